// Part of Recompose: https://recompose.machinezoo.com
package com.machinezoo.recompose.util;

import java.util.*;
import java.util.concurrent.atomic.*;
import com.google.common.cache.*;
import com.machinezoo.stagean.*;
import io.opentracing.*;

/*
 * Composition objects form a tree (composition, scopes, cells), but the interesting objects
 * are often reached from the bottom, for example a cell write that invalidates some scope deep in the tree.
 * Log messages and tracing spans are only useful if they describe where in the tree the object lives.
 *
 * Owner trace keeps a short alias, optional tags, and a parent link for any object
 * without forcing every class to carry the information as a field.
 * Data is kept in a weak identity map, so tracing never keeps objects alive.
 * That also means the data must not reference the target object.
 */
/**
 * Ownership trace of runtime objects for diagnostic output and tracing.
 */
@NoTests
@StubDocs
@DraftApi("should be in a separate library")
public class OwnerTrace<T> {
	/*
	 * Guava's weak keys use identity comparison, which is what we want here.
	 * Scopes and cells have overridden hashCode() and nodes have structural equality.
	 */
	private static final LoadingCache<Object, TraceData> all = CacheBuilder.newBuilder()
		.weakKeys()
		.build(CacheLoader.from(TraceData::new));
	public static <T> OwnerTrace<T> of(T target) {
		return new OwnerTrace<T>(target, all.getUnchecked(target));
	}
	private final T target;
	public T target() {
		return target;
	}
	private final TraceData data;
	private OwnerTrace(T target, TraceData data) {
		Objects.requireNonNull(target);
		this.target = target;
		this.data = data;
	}
	private static class TraceData {
		volatile String alias;
		volatile Map<String, Object> tags = Collections.emptyMap();
		volatile TraceData parent;
		TraceData(Object target) {
			alias = target.getClass().getSimpleName();
		}
	}
	public OwnerTrace<T> alias(String alias) {
		Objects.requireNonNull(alias);
		data.alias = alias;
		return this;
	}
	/*
	 * Tags are copied on write. There are only a few of them and they are read far more often than written.
	 */
	public OwnerTrace<T> tag(String key, Object value) {
		Objects.requireNonNull(key);
		if (value != null) {
			synchronized (data) {
				Map<String, Object> tags = new LinkedHashMap<>(data.tags);
				tags.put(key, value);
				data.tags = Collections.unmodifiableMap(tags);
			}
		}
		return this;
	}
	private static final AtomicLong counter = new AtomicLong();
	public OwnerTrace<T> generateId() {
		return tag("id", counter.incrementAndGet());
	}
	public OwnerTrace<T> parent(Object parent) {
		data.parent = parent != null ? all.getUnchecked(parent) : null;
		return this;
	}
	/*
	 * Fill the span with tags of the whole ancestor chain, each prefixed with the alias of its owner.
	 * Chains are short, usually composition -> scope -> cell.
	 */
	public void fill(Span span) {
		Objects.requireNonNull(span);
		List<TraceData> chain = chain();
		for (int i = chain.size() - 1; i >= 0; --i) {
			TraceData level = chain.get(i);
			for (Map.Entry<String, Object> tag : level.tags.entrySet()) {
				String key = level.alias + "." + tag.getKey();
				Object value = tag.getValue();
				if (value instanceof Number)
					span.setTag(key, (Number)value);
				else if (value instanceof Boolean)
					span.setTag(key, (Boolean)value);
				else
					span.setTag(key, value.toString());
			}
		}
	}
	private List<TraceData> chain() {
		List<TraceData> chain = new ArrayList<>();
		for (TraceData level = data; level != null && chain.size() < 16; level = level.parent)
			chain.add(level);
		return chain;
	}
	private static String format(TraceData level) {
		StringBuilder text = new StringBuilder(level.alias);
		Map<String, Object> tags = level.tags;
		if (!tags.isEmpty()) {
			text.append('[');
			boolean first = true;
			for (Map.Entry<String, Object> tag : tags.entrySet()) {
				if (!first)
					text.append(", ");
				first = false;
				text.append(tag.getKey()).append('=').append(tag.getValue());
			}
			text.append(']');
		}
		return text.toString();
	}
	@Override
	public String toString() {
		List<TraceData> chain = chain();
		StringBuilder text = new StringBuilder();
		for (int i = chain.size() - 1; i >= 0; --i) {
			if (text.length() > 0)
				text.append(" / ");
			text.append(format(chain.get(i)));
		}
		return text.toString();
	}
}
