// Part of Recompose: https://recompose.machinezoo.com
package com.machinezoo.recompose;

import java.util.*;
import com.machinezoo.recompose.tree.*;

/*
 * Output of one scope execution. Unlike ComponentNode, it is mutable while the render function runs,
 * it holds live event handlers, and child scopes are referenced rather than inlined.
 * Referencing child scopes lets a child re-execute alone without touching the parent's output.
 */
class LiveNode {
	final String type;
	String key;
	final Map<String, PropValue> props = new LinkedHashMap<>();
	final Map<String, EventHandler> handlers = new LinkedHashMap<>();
	/*
	 * Either LiveNode or RenderScope.
	 */
	final List<Object> children = new ArrayList<>();
	LiveNode(String type, String key) {
		this.type = type;
		this.key = key;
	}
	static String keyOf(Object child) {
		return child instanceof LiveNode ? ((LiveNode)child).key : ((RenderScope)child).key();
	}
	boolean hasChildKey(String key) {
		for (Object child : children)
			if (keyOf(child).equals(key))
				return true;
		return false;
	}
	ComponentNode snapshot(String key) {
		Map<String, PropValue> snapshotProps = props;
		if (!handlers.isEmpty()) {
			snapshotProps = new LinkedHashMap<>(props);
			List<PropValue> events = new ArrayList<>();
			for (String event : handlers.keySet())
				events.add(PropValue.of(event));
			snapshotProps.put(ComponentNode.EVENTS, PropValue.list(events));
		}
		List<ComponentNode> nodes = new ArrayList<>();
		for (Object child : children) {
			if (child instanceof LiveNode) {
				LiveNode element = (LiveNode)child;
				nodes.add(element.snapshot(element.key));
			} else
				nodes.add(((RenderScope)child).snapshot());
		}
		return new ComponentNode(type, key, snapshotProps, nodes);
	}
	void collectHandlers(NodePath path, Map<NodePath, Map<String, EventHandler>> collected) {
		if (!handlers.isEmpty())
			collected.put(path, Collections.unmodifiableMap(new LinkedHashMap<>(handlers)));
		for (Object child : children) {
			if (child instanceof LiveNode) {
				LiveNode element = (LiveNode)child;
				element.collectHandlers(path.child(element.key), collected);
			} else
				((RenderScope)child).collectHandlers(collected);
		}
	}
	void collectScopes(Set<RenderScope> collected) {
		for (Object child : children) {
			if (child instanceof LiveNode)
				((LiveNode)child).collectScopes(collected);
			else
				collected.add((RenderScope)child);
		}
	}
	static LiveNode placeholder(String type) {
		return new LiveNode(type, "placeholder");
	}
}
