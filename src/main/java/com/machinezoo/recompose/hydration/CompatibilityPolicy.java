// Part of Recompose: https://recompose.machinezoo.com
package com.machinezoo.recompose.hydration;

/**
 * How thoroughly server tree is compared with client tree before it is adopted.
 */
public enum CompatibilityPolicy {
	/**
	 * Compares only root node type. This is fast and permissive, but it can adopt structurally different descendants.
	 */
	SHALLOW,
	/**
	 * Compares type, key, props, and child key sequence of every node.
	 * Mismatching subtrees are rendered fresh while matching siblings are still adopted.
	 */
	DEEP
}
