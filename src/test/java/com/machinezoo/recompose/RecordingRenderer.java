// Part of Recompose: https://recompose.machinezoo.com
package com.machinezoo.recompose;

import java.util.*;
import com.machinezoo.recompose.tree.*;

public class RecordingRenderer implements Renderer {
	public final List<NodePath> updated = Collections.synchronizedList(new ArrayList<>());
	public final Map<NodePath, ComponentNode> nodes = Collections.synchronizedMap(new LinkedHashMap<>());
	public final List<String> bound = Collections.synchronizedList(new ArrayList<>());
	public final Map<String, Map<String, EventHandler>> handlers = Collections.synchronizedMap(new LinkedHashMap<>());
	@Override
	public void createOrUpdate(NodePath path, ComponentNode node) {
		updated.add(path);
		nodes.put(path, node);
	}
	@Override
	public void bindMarker(String markerId, Map<String, EventHandler> handlers) {
		bound.add(markerId);
		this.handlers.put(markerId, handlers);
	}
	public void clear() {
		updated.clear();
		nodes.clear();
		bound.clear();
		handlers.clear();
	}
}
