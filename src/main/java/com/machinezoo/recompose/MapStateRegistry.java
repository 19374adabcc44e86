// Part of Recompose: https://recompose.machinezoo.com
package com.machinezoo.recompose;

import java.util.*;

/**
 * In-memory {@link StateRegistry}. This is the default registry of every {@link Composition}.
 */
public class MapStateRegistry implements StateRegistry {
	private final Map<String, Object> entries = new LinkedHashMap<>();
	@Override
	public synchronized Optional<Object> get(String key) {
		Objects.requireNonNull(key);
		return Optional.ofNullable(entries.get(key));
	}
	@Override
	public synchronized void set(String key, Object value) {
		Objects.requireNonNull(key);
		if (value == null)
			entries.remove(key);
		else
			entries.put(key, value);
	}
	@Override
	public synchronized void remove(String key) {
		entries.remove(key);
	}
	@Override
	public synchronized Set<String> keys() {
		return new LinkedHashSet<>(entries.keySet());
	}
	@Override
	public synchronized String toString() {
		return entries.toString();
	}
}
