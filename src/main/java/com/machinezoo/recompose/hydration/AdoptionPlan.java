// Part of Recompose: https://recompose.machinezoo.com
package com.machinezoo.recompose.hydration;

import java.util.*;
import com.google.common.collect.*;
import com.machinezoo.recompose.tree.*;
import com.machinezoo.stagean.*;

/**
 * Result of matching server tree against client tree.
 * Fallback subtrees are rendered fresh, everything else is adopted, and markers are bound in priority order.
 * Plan is a pure description. Neither tree is modified while it is computed or applied.
 */
@StubDocs
public final class AdoptionPlan {
	/**
	 * Client subtree that replaces incompatible server markup.
	 */
	public static final class Fallback {
		private final NodePath path;
		public NodePath path() {
			return path;
		}
		private final ComponentNode node;
		public ComponentNode node() {
			return node;
		}
		public Fallback(NodePath path, ComponentNode node) {
			Objects.requireNonNull(path);
			Objects.requireNonNull(node);
			this.path = path;
			this.node = node;
		}
		@Override
		public String toString() {
			return "render " + path + " fresh";
		}
	}
	private final NodePath rootPath;
	public NodePath rootPath() {
		return rootPath;
	}
	private final ComponentNode clientTree;
	public ComponentNode clientTree() {
		return clientTree;
	}
	private final boolean fullRender;
	public boolean fullRender() {
		return fullRender;
	}
	private final ImmutableList<Fallback> fallbacks;
	public List<Fallback> fallbacks() {
		return fallbacks;
	}
	private final ImmutableList<MarkerBinding> bindings;
	public List<MarkerBinding> bindings() {
		return bindings;
	}
	private final ImmutableList<DomMarker> unbound;
	public List<DomMarker> unbound() {
		return unbound;
	}
	private final ImmutableList<TreeIncompatibleException> mismatches;
	public List<TreeIncompatibleException> mismatches() {
		return mismatches;
	}
	AdoptionPlan(NodePath rootPath, ComponentNode clientTree, boolean fullRender, List<Fallback> fallbacks, List<MarkerBinding> bindings, List<DomMarker> unbound, List<TreeIncompatibleException> mismatches) {
		this.rootPath = rootPath;
		this.clientTree = clientTree;
		this.fullRender = fullRender;
		this.fallbacks = ImmutableList.copyOf(fallbacks);
		this.bindings = ImmutableList.copyOf(bindings);
		this.unbound = ImmutableList.copyOf(unbound);
		this.mismatches = ImmutableList.copyOf(mismatches);
	}
	/*
	 * Unbound markers do not prevent adoption. They point to server elements the client does not want to make interactive.
	 */
	public boolean adopted() {
		return !fullRender && fallbacks.isEmpty();
	}
	@Override
	public String toString() {
		if (fullRender)
			return "full client render of " + rootPath;
		return "adopt " + rootPath + " with " + fallbacks.size() + " fallbacks and " + bindings.size() + " bindings";
	}
}
