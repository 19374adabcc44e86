// Part of Recompose: https://recompose.machinezoo.com
package com.machinezoo.recompose.hydration;

import com.machinezoo.recompose.tree.*;

/**
 * Order in which markers are bound. Nodes choose their priority via the {@code hydrationPriority} property.
 */
public enum HydrationPriority {
	/*
	 * Explicitly marked by the developer as must-bind-first.
	 */
	CRITICAL,
	VISIBLE,
	NEAR,
	DEFERRED;
	public static HydrationPriority of(ComponentNode node) {
		PropValue value = node.prop(ComponentNode.HYDRATION_PRIORITY);
		if (value.kind() != PropValue.Kind.STRING)
			return VISIBLE;
		return parse(value.asString());
	}
	/*
	 * Unknown names fall back to the default. Priority is a hint and must not fail hydration.
	 */
	public static HydrationPriority parse(String name) {
		if (name == null)
			return VISIBLE;
		for (HydrationPriority priority : values())
			if (priority.name().equalsIgnoreCase(name))
				return priority;
		return VISIBLE;
	}
}
