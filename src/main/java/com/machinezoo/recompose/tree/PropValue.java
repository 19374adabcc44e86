// Part of Recompose: https://recompose.machinezoo.com
package com.machinezoo.recompose.tree;

import java.math.*;
import java.util.*;
import com.google.common.collect.*;

/*
 * Properties are transferred from server to client, so they have to survive JSON round-trip intact.
 * Arbitrary Java objects wouldn't. We therefore restrict property values to a closed set of JSON-compatible kinds.
 *
 * Numbers are held as BigDecimal and compared numerically, because JSON doesn't distinguish integers from decimals.
 * Property 42 written on the server as an integer must equal 42.0 decoded on the client.
 */
/**
 * Immutable tagged union of values that can be stored in {@link ComponentNode} properties.
 * Every {@code PropValue} maps losslessly onto JSON.
 *
 * @see ComponentNode#props()
 */
public final class PropValue {
	/**
	 * Kind of the value held by {@link PropValue}.
	 */
	public enum Kind {
		NULL,
		BOOLEAN,
		NUMBER,
		STRING,
		LIST,
		MAP
	}
	private final Kind kind;
	public Kind kind() {
		return kind;
	}
	private final Object value;
	private PropValue(Kind kind, Object value) {
		this.kind = kind;
		this.value = value;
	}
	public static final PropValue NULL = new PropValue(Kind.NULL, null);
	public static final PropValue TRUE = new PropValue(Kind.BOOLEAN, true);
	public static final PropValue FALSE = new PropValue(Kind.BOOLEAN, false);
	public static PropValue of(boolean value) {
		return value ? TRUE : FALSE;
	}
	public static PropValue of(String value) {
		return value != null ? new PropValue(Kind.STRING, value) : NULL;
	}
	public static PropValue of(long value) {
		return new PropValue(Kind.NUMBER, BigDecimal.valueOf(value));
	}
	public static PropValue of(double value) {
		if (Double.isNaN(value) || Double.isInfinite(value))
			throw new IllegalArgumentException("Property value must be a finite number.");
		return new PropValue(Kind.NUMBER, BigDecimal.valueOf(value));
	}
	public static PropValue of(BigDecimal value) {
		return value != null ? new PropValue(Kind.NUMBER, value) : NULL;
	}
	public static PropValue list(List<PropValue> items) {
		Objects.requireNonNull(items);
		return new PropValue(Kind.LIST, ImmutableList.copyOf(items));
	}
	public static PropValue map(Map<String, PropValue> entries) {
		Objects.requireNonNull(entries);
		return new PropValue(Kind.MAP, ImmutableMap.copyOf(entries));
	}
	/**
	 * Converts plain Java value into {@link PropValue}.
	 * Supported inputs are {@code null}, {@link PropValue}, {@link Boolean}, {@link Number}, {@link CharSequence}, {@link Enum}
	 * (stored as its name), {@link Collection} of supported values, and {@link Map} with {@link String} keys and supported values.
	 *
	 * @param value
	 *            value to convert
	 * @return equivalent {@link PropValue}
	 * @throws IllegalArgumentException
	 *             if the value or any nested value is of unsupported type
	 */
	public static PropValue from(Object value) {
		if (value == null)
			return NULL;
		if (value instanceof PropValue)
			return (PropValue)value;
		if (value instanceof Boolean)
			return of((Boolean)value);
		if (value instanceof BigDecimal)
			return of((BigDecimal)value);
		if (value instanceof BigInteger)
			return of(new BigDecimal((BigInteger)value));
		if (value instanceof Float || value instanceof Double)
			return of(((Number)value).doubleValue());
		if (value instanceof Number)
			return of(((Number)value).longValue());
		if (value instanceof CharSequence)
			return of(value.toString());
		if (value instanceof Enum)
			return of(((Enum<?>)value).name());
		if (value instanceof Collection) {
			List<PropValue> items = new ArrayList<>();
			for (Object item : (Collection<?>)value)
				items.add(from(item));
			return list(items);
		}
		if (value instanceof Map) {
			Map<String, PropValue> entries = new LinkedHashMap<>();
			for (Map.Entry<?, ?> entry : ((Map<?, ?>)value).entrySet()) {
				if (!(entry.getKey() instanceof String))
					throw new IllegalArgumentException("Property map keys must be strings.");
				entries.put((String)entry.getKey(), from(entry.getValue()));
			}
			return map(entries);
		}
		throw new IllegalArgumentException("Unsupported property value type: " + value.getClass().getName());
	}
	public boolean isNull() {
		return kind == Kind.NULL;
	}
	private void expect(Kind expected) {
		if (kind != expected)
			throw new IllegalStateException("Expected " + expected + " property value, found " + kind + ".");
	}
	public boolean asBoolean() {
		expect(Kind.BOOLEAN);
		return (Boolean)value;
	}
	public BigDecimal asNumber() {
		expect(Kind.NUMBER);
		return (BigDecimal)value;
	}
	public String asString() {
		expect(Kind.STRING);
		return (String)value;
	}
	@SuppressWarnings("unchecked")
	public List<PropValue> asList() {
		expect(Kind.LIST);
		return (List<PropValue>)value;
	}
	@SuppressWarnings("unchecked")
	public Map<String, PropValue> asMap() {
		expect(Kind.MAP);
		return (Map<String, PropValue>)value;
	}
	@Override
	public boolean equals(Object obj) {
		if (this == obj)
			return true;
		if (!(obj instanceof PropValue))
			return false;
		PropValue other = (PropValue)obj;
		if (kind != other.kind)
			return false;
		if (kind == Kind.NUMBER)
			return ((BigDecimal)value).compareTo((BigDecimal)other.value) == 0;
		return Objects.equals(value, other.value);
	}
	@Override
	public int hashCode() {
		if (kind == Kind.NUMBER) {
			BigDecimal number = (BigDecimal)value;
			return number.signum() == 0 ? 0 : number.stripTrailingZeros().hashCode();
		}
		return Objects.hash(kind, value);
	}
	@Override
	public String toString() {
		switch (kind) {
		case NULL:
			return "null";
		case STRING:
			return "\"" + value + "\"";
		case NUMBER:
			return ((BigDecimal)value).toPlainString();
		default:
			return String.valueOf(value);
		}
	}
}
