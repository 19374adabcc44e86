// Part of Recompose: https://recompose.machinezoo.com
package com.machinezoo.recompose.tree;

import java.util.*;
import com.google.common.base.*;
import com.google.common.collect.*;
import java.util.Objects;

/**
 * Position of a {@link ComponentNode} in the tree expressed as a sequence of node keys starting with the root key.
 * String form joins the keys with {@code /}, which is why keys must not contain the separator.
 * Paths are stable across independent composition passes as long as the keys are stable,
 * which makes them usable for pairing server-rendered nodes with client-rendered ones.
 */
public final class NodePath {
	public static final char SEPARATOR = '/';
	private static final Splitter splitter = Splitter.on(SEPARATOR);
	private static final Joiner joiner = Joiner.on(SEPARATOR);
	private final ImmutableList<String> keys;
	public List<String> keys() {
		return keys;
	}
	private NodePath(ImmutableList<String> keys) {
		this.keys = keys;
	}
	public static NodePath root(String key) {
		return new NodePath(ImmutableList.of(checkKey(key)));
	}
	public static NodePath parse(String path) {
		Objects.requireNonNull(path);
		List<String> keys = splitter.splitToList(path);
		for (String key : keys)
			checkKey(key);
		return new NodePath(ImmutableList.copyOf(keys));
	}
	public static String checkKey(String key) {
		Objects.requireNonNull(key);
		if (key.isEmpty())
			throw new IllegalArgumentException("Node key must not be empty.");
		if (key.indexOf(SEPARATOR) >= 0)
			throw new IllegalArgumentException("Node key must not contain '" + SEPARATOR + "': " + key);
		return key;
	}
	public NodePath child(String key) {
		return new NodePath(ImmutableList.<String>builder().addAll(keys).add(checkKey(key)).build());
	}
	public NodePath parent() {
		if (keys.size() <= 1)
			return null;
		return new NodePath(keys.subList(0, keys.size() - 1));
	}
	public String last() {
		return keys.get(keys.size() - 1);
	}
	public int depth() {
		return keys.size();
	}
	/**
	 * Returns {@code true} if this path equals {@code other} or lies underneath it.
	 *
	 * @param other
	 *            potential ancestor path
	 * @return {@code true} if {@code other} is this path or its ancestor
	 */
	public boolean within(NodePath other) {
		return keys.size() >= other.keys.size() && keys.subList(0, other.keys.size()).equals(other.keys);
	}
	@Override
	public boolean equals(Object obj) {
		return obj instanceof NodePath && keys.equals(((NodePath)obj).keys);
	}
	@Override
	public int hashCode() {
		return keys.hashCode();
	}
	@Override
	public String toString() {
		return joiner.join(keys);
	}
}
