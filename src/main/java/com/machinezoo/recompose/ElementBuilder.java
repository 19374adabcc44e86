// Part of Recompose: https://recompose.machinezoo.com
package com.machinezoo.recompose;

import java.util.*;
import com.machinezoo.recompose.tree.*;
import com.machinezoo.stagean.*;

/**
 * Builder of one element. Props and event handlers are configured here and children are added through inherited {@link UiBuilder} methods.
 */
@StubDocs
public class ElementBuilder extends UiBuilder {
	/*
	 * Builder of the parent element. It is null for the root element of the scope.
	 */
	private final UiBuilder parent;
	ElementBuilder(RenderScope scope, LiveNode node, UiBuilder parent) {
		super(scope, node);
		this.parent = parent;
	}
	@Override
	NodePath path() {
		return parent != null ? parent.path().child(container.key) : scope.path();
	}
	public String type() {
		return container.type;
	}
	public String key() {
		return container.key;
	}
	/**
	 * Replaces positional key of this element with an explicit one.
	 * Explicit keys keep element identity stable when siblings are inserted, removed, or reordered.
	 *
	 * @param key
	 *            new key, unique among siblings
	 * @return {@code this} (fluent method)
	 * @throws IllegalStateException
	 *             if this is the root element, children were already added, or a sibling has the same key
	 */
	public ElementBuilder key(String key) {
		NodePath.checkKey(key);
		checkExecuting();
		if (parent == null)
			throw new IllegalStateException("Root element takes the key of its render scope.");
		if (!container.children.isEmpty())
			throw new IllegalStateException("Key must be set before children are added.");
		if (!key.equals(container.key) && parent.container.hasChildKey(key))
			throw new IllegalStateException("Duplicate child key '" + key + "' under " + parent.path() + ".");
		container.key = key;
		return this;
	}
	public ElementBuilder prop(String name, Object value) {
		Objects.requireNonNull(name);
		checkExecuting();
		if (ComponentNode.EVENTS.equals(name))
			throw new IllegalArgumentException("Property '" + name + "' is reserved for event names.");
		container.props.put(name, PropValue.from(value));
		return this;
	}
	public ElementBuilder id(String id) {
		return prop(ComponentNode.ID, id);
	}
	public ElementBuilder on(String event, EventHandler handler) {
		Objects.requireNonNull(event);
		Objects.requireNonNull(handler);
		checkExecuting();
		container.handlers.put(event, handler);
		return this;
	}
}
