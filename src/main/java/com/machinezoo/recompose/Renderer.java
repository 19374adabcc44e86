// Part of Recompose: https://recompose.machinezoo.com
package com.machinezoo.recompose;

import java.util.*;
import com.machinezoo.recompose.tree.*;

/**
 * Presentation layer collaborator bound to one mount point.
 * The runtime never creates presentation primitives itself. It only describes what to create or update
 * and which existing server-rendered elements to make interactive.
 */
public interface Renderer {
	/**
	 * Creates or updates presentation nodes at {@code path} to match {@code node} including its descendants.
	 *
	 * @param path
	 *            path of the node in the composition tree
	 * @param node
	 *            desired state of the subtree
	 */
	void createOrUpdate(NodePath path, ComponentNode node);
	/**
	 * Attaches live handlers to an existing element identified by hydration marker id.
	 *
	 * @param markerId
	 *            id of the hydration marker
	 * @param handlers
	 *            event handlers keyed by event name
	 */
	void bindMarker(String markerId, Map<String, EventHandler> handlers);
}
