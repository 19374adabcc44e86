// Part of Recompose: https://recompose.machinezoo.com
package com.machinezoo.recompose.tree;

import static org.junit.jupiter.api.Assertions.*;
import java.math.*;
import java.util.*;
import org.junit.jupiter.api.*;

public class PropValueTest {
	enum Color {
		RED
	}
	@Test
	public void kinds() {
		assertEquals(PropValue.Kind.NULL, PropValue.from(null).kind());
		assertEquals(PropValue.Kind.BOOLEAN, PropValue.from(true).kind());
		assertEquals(PropValue.Kind.NUMBER, PropValue.from(1).kind());
		assertEquals(PropValue.Kind.NUMBER, PropValue.from(1.5).kind());
		assertEquals(PropValue.Kind.STRING, PropValue.from("x").kind());
		assertEquals(PropValue.Kind.LIST, PropValue.from(Arrays.asList(1, "a")).kind());
		assertEquals(PropValue.Kind.MAP, PropValue.from(Collections.singletonMap("k", 1)).kind());
		// Enums are stored by name.
		assertEquals(PropValue.of("RED"), PropValue.from(Color.RED));
		// Existing values pass through.
		assertSame(PropValue.TRUE, PropValue.from(PropValue.TRUE));
	}
	@Test
	public void unsupported() {
		assertThrows(IllegalArgumentException.class, () -> PropValue.from(new Object()));
		assertThrows(IllegalArgumentException.class, () -> PropValue.from(Collections.singletonMap(1, "x")));
		assertThrows(IllegalArgumentException.class, () -> PropValue.of(Double.NaN));
	}
	@Test
	public void numbers() {
		// Integers and decimals with the same value are equal.
		assertEquals(PropValue.of(42), PropValue.of(42.0));
		assertEquals(PropValue.of(42).hashCode(), PropValue.of(new BigDecimal("42.000")).hashCode());
		assertEquals(PropValue.of(0).hashCode(), PropValue.of(new BigDecimal("0.00")).hashCode());
		assertNotEquals(PropValue.of(1), PropValue.of("1"));
		assertEquals(new BigDecimal("2.5"), PropValue.from(2.5f).asNumber().stripTrailingZeros());
		assertEquals(BigInteger.TEN, PropValue.from(BigInteger.TEN).asNumber().toBigIntegerExact());
	}
	@Test
	public void accessors() {
		assertTrue(PropValue.of(true).asBoolean());
		assertEquals("x", PropValue.of("x").asString());
		assertEquals(Arrays.asList(PropValue.of(1)), PropValue.from(Arrays.asList(1)).asList());
		assertEquals(PropValue.of(2), PropValue.from(Collections.singletonMap("k", 2)).asMap().get("k"));
		assertTrue(PropValue.of((String)null).isNull());
		// Kind mismatch is an error.
		assertThrows(IllegalStateException.class, () -> PropValue.of("x").asNumber());
		assertThrows(IllegalStateException.class, () -> PropValue.NULL.asBoolean());
	}
	@Test
	public void nested() {
		Map<String, Object> map = new LinkedHashMap<>();
		map.put("items", Arrays.asList(1, 2));
		map.put("label", "x");
		PropValue value = PropValue.from(map);
		assertEquals(PropValue.from(map), value);
		assertEquals(2, value.asMap().get("items").asList().size());
		// Collections are copied.
		List<PropValue> items = value.asMap().get("items").asList();
		assertThrows(UnsupportedOperationException.class, () -> items.add(PropValue.NULL));
	}
}
