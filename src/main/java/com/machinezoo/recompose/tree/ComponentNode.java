// Part of Recompose: https://recompose.machinezoo.com
package com.machinezoo.recompose.tree;

import java.util.*;
import java.util.function.*;
import com.google.common.collect.*;

/*
 * Snapshot nodes are pure values. They carry no reference to the scope that produced them,
 * so they can be compared, serialized, and shared freely after the composition that produced them is gone.
 * Event handlers are deliberately absent. Only names of handled events are recorded in the reserved "events" property.
 */
/**
 * Immutable structural description of one node of rendered UI.
 * Equality is structural over {@link #type()}, {@link #key()}, {@link #props()}, and ordered {@link #children()}.
 */
public final class ComponentNode {
	/**
	 * Reserved property listing names of events handled by the node. Nodes with this property are interactive.
	 */
	public static final String EVENTS = "events";
	/**
	 * Property whose string value is used as explicit hydration marker id.
	 */
	public static final String ID = "id";
	/**
	 * Property requesting particular hydration priority for the node.
	 */
	public static final String HYDRATION_PRIORITY = "hydrationPriority";
	private final String type;
	public String type() {
		return type;
	}
	private final String key;
	public String key() {
		return key;
	}
	private final ImmutableMap<String, PropValue> props;
	public Map<String, PropValue> props() {
		return props;
	}
	private final ImmutableList<ComponentNode> children;
	public List<ComponentNode> children() {
		return children;
	}
	public ComponentNode(String type, String key, Map<String, PropValue> props, List<ComponentNode> children) {
		Objects.requireNonNull(type);
		Objects.requireNonNull(props);
		Objects.requireNonNull(children);
		if (type.isEmpty())
			throw new IllegalArgumentException("Node type must not be empty.");
		this.type = type;
		this.key = NodePath.checkKey(key);
		this.props = ImmutableMap.copyOf(props);
		this.children = ImmutableList.copyOf(children);
		Set<String> keys = new HashSet<>();
		for (ComponentNode child : this.children)
			if (!keys.add(child.key))
				throw new IllegalArgumentException("Duplicate child key '" + child.key + "' under node " + type + ".");
	}
	public static ComponentNode leaf(String type, String key) {
		return new ComponentNode(type, key, Collections.emptyMap(), Collections.emptyList());
	}
	public static ComponentNode of(String type, String key, ComponentNode... children) {
		return new ComponentNode(type, key, Collections.emptyMap(), Arrays.asList(children));
	}
	public ComponentNode withKey(String key) {
		return key.equals(this.key) ? this : new ComponentNode(type, key, props, children);
	}
	public ComponentNode withProp(String name, Object value) {
		Map<String, PropValue> updated = new LinkedHashMap<>(props);
		updated.put(name, PropValue.from(value));
		return new ComponentNode(type, key, updated, children);
	}
	public ComponentNode withChildren(List<ComponentNode> children) {
		return new ComponentNode(type, key, props, children);
	}
	public PropValue prop(String name) {
		return props.getOrDefault(name, PropValue.NULL);
	}
	public Optional<ComponentNode> child(String key) {
		for (ComponentNode child : children)
			if (child.key.equals(key))
				return Optional.of(child);
		return Optional.empty();
	}
	/**
	 * Finds descendant at the given path. The first key of the path must be this node's key.
	 *
	 * @param path
	 *            path of the descendant starting with this node's key
	 * @return the descendant or empty {@link Optional} if there is no node at the path
	 */
	public Optional<ComponentNode> find(NodePath path) {
		List<String> keys = path.keys();
		if (!keys.get(0).equals(key))
			return Optional.empty();
		ComponentNode node = this;
		for (String step : keys.subList(1, keys.size())) {
			Optional<ComponentNode> next = node.child(step);
			if (!next.isPresent())
				return Optional.empty();
			node = next.get();
		}
		return Optional.of(node);
	}
	public boolean interactive() {
		PropValue events = prop(EVENTS);
		return events.kind() == PropValue.Kind.LIST && !events.asList().isEmpty();
	}
	public List<String> events() {
		if (!interactive())
			return Collections.emptyList();
		List<String> names = new ArrayList<>();
		for (PropValue event : prop(EVENTS).asList())
			names.add(event.asString());
		return names;
	}
	/**
	 * Visits this node and all its descendants in document order together with their paths.
	 *
	 * @param root
	 *            path of this node
	 * @param visitor
	 *            callback receiving every node and its path
	 */
	public void walk(NodePath root, BiConsumer<NodePath, ComponentNode> visitor) {
		visitor.accept(root, this);
		for (ComponentNode child : children)
			child.walk(root.child(child.key), visitor);
	}
	public void walk(BiConsumer<NodePath, ComponentNode> visitor) {
		walk(NodePath.root(key), visitor);
	}
	public int size() {
		int size = 1;
		for (ComponentNode child : children)
			size += child.size();
		return size;
	}
	@Override
	public boolean equals(Object obj) {
		if (this == obj)
			return true;
		if (!(obj instanceof ComponentNode))
			return false;
		ComponentNode other = (ComponentNode)obj;
		return type.equals(other.type) && key.equals(other.key) && props.equals(other.props) && children.equals(other.children);
	}
	@Override
	public int hashCode() {
		return Objects.hash(type, key, props, children);
	}
	@Override
	public String toString() {
		StringBuilder text = new StringBuilder();
		text.append('<').append(type).append(" key=").append(key);
		for (Map.Entry<String, PropValue> prop : props.entrySet())
			text.append(' ').append(prop.getKey()).append('=').append(prop.getValue());
		if (children.isEmpty())
			return text.append("/>").toString();
		text.append('>');
		for (ComponentNode child : children)
			text.append(child);
		return text.append("</").append(type).append('>').toString();
	}
}
