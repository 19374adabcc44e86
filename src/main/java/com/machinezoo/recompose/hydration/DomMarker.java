// Part of Recompose: https://recompose.machinezoo.com
package com.machinezoo.recompose.hydration;

import java.util.*;
import com.google.common.base.*;
import com.google.common.collect.*;
import java.util.Objects;
import java.util.Optional;
import com.machinezoo.recompose.tree.*;

/**
 * Serializable pointer from server-rendered element to the client binding that makes it interactive.
 */
public final class DomMarker {
	public static final String ID_ATTRIBUTE = "data-hydration-id";
	public static final String PATH_ATTRIBUTE = "data-hydration-path";
	public static final String EVENTS_ATTRIBUTE = "data-hydration-events";
	public static final String PRIORITY_ATTRIBUTE = "data-hydration-priority";
	private static final Joiner joiner = Joiner.on(',');
	private final String id;
	public String id() {
		return id;
	}
	private final String type;
	public String type() {
		return type;
	}
	private final ImmutableMap<String, String> attributes;
	public Map<String, String> attributes() {
		return attributes;
	}
	public DomMarker(String id, String type, Map<String, String> attributes) {
		Objects.requireNonNull(id);
		Objects.requireNonNull(type);
		Objects.requireNonNull(attributes);
		if (id.isEmpty())
			throw new IllegalArgumentException("Marker id must not be empty.");
		this.id = id;
		this.type = type;
		this.attributes = ImmutableMap.copyOf(attributes);
	}
	public DomMarker(String id, String type) {
		this(id, type, Collections.emptyMap());
	}
	/*
	 * Explicit string id wins, because developers use it to address the element from outside.
	 * Generated ids are derived from the path, which is unique within the tree.
	 */
	public static String idOf(NodePath path, ComponentNode node) {
		PropValue explicit = node.prop(ComponentNode.ID);
		if (explicit.kind() == PropValue.Kind.STRING && !explicit.asString().isEmpty())
			return explicit.asString();
		return "h:" + path;
	}
	public static DomMarker of(NodePath path, ComponentNode node) {
		String id = idOf(path, node);
		Map<String, String> attributes = new LinkedHashMap<>();
		attributes.put(ID_ATTRIBUTE, id);
		attributes.put(PATH_ATTRIBUTE, path.toString());
		attributes.put(EVENTS_ATTRIBUTE, joiner.join(node.events()));
		if (node.prop(ComponentNode.HYDRATION_PRIORITY).kind() == PropValue.Kind.STRING)
			attributes.put(PRIORITY_ATTRIBUTE, HydrationPriority.of(node).name());
		return new DomMarker(id, node.type(), attributes);
	}
	public Optional<NodePath> path() {
		String path = attributes.get(PATH_ATTRIBUTE);
		if (path == null)
			return Optional.empty();
		try {
			return Optional.of(NodePath.parse(path));
		} catch (IllegalArgumentException ex) {
			return Optional.empty();
		}
	}
	@Override
	public boolean equals(Object obj) {
		if (!(obj instanceof DomMarker))
			return false;
		DomMarker other = (DomMarker)obj;
		return id.equals(other.id) && type.equals(other.type) && attributes.equals(other.attributes);
	}
	@Override
	public int hashCode() {
		return Objects.hash(id, type, attributes);
	}
	@Override
	public String toString() {
		return "marker " + id + " <" + type + ">";
	}
}
