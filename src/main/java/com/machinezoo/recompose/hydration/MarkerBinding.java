// Part of Recompose: https://recompose.machinezoo.com
package com.machinezoo.recompose.hydration;

import java.util.*;
import com.google.common.collect.*;
import com.machinezoo.recompose.*;
import com.machinezoo.recompose.tree.*;

/**
 * Instruction to attach live event handlers of a client node to the element carrying the marker.
 */
public final class MarkerBinding {
	private final String markerId;
	public String markerId() {
		return markerId;
	}
	private final NodePath path;
	public NodePath path() {
		return path;
	}
	private final String type;
	public String type() {
		return type;
	}
	private final HydrationPriority priority;
	public HydrationPriority priority() {
		return priority;
	}
	private final ImmutableMap<String, EventHandler> handlers;
	public Map<String, EventHandler> handlers() {
		return handlers;
	}
	/*
	 * Fresh bindings target elements the renderer has just created for a fallback subtree rather than adopted server markup.
	 */
	private final boolean fresh;
	public boolean fresh() {
		return fresh;
	}
	public MarkerBinding(String markerId, NodePath path, String type, HydrationPriority priority, Map<String, EventHandler> handlers, boolean fresh) {
		Objects.requireNonNull(markerId);
		Objects.requireNonNull(path);
		Objects.requireNonNull(type);
		Objects.requireNonNull(priority);
		Objects.requireNonNull(handlers);
		this.markerId = markerId;
		this.path = path;
		this.type = type;
		this.priority = priority;
		this.handlers = ImmutableMap.copyOf(handlers);
		this.fresh = fresh;
	}
	@Override
	public String toString() {
		return "bind " + markerId + " at " + path + " " + handlers.keySet() + (fresh ? " (fresh)" : "");
	}
}
