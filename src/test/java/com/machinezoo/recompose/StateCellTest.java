// Part of Recompose: https://recompose.machinezoo.com
package com.machinezoo.recompose;

import static org.junit.jupiter.api.Assertions.*;
import java.util.*;
import java.util.concurrent.*;
import org.junit.jupiter.api.*;
import com.machinezoo.closeablescope.*;
import com.machinezoo.recompose.tree.*;

public class StateCellTest {
	private static RenderScope scope() {
		return new RenderScope(new Composition(ui -> {}), null, "root", NodePath.root("root"), ui -> {});
	}
	@Test
	public void crud() {
		// Construct default.
		StateCell<String> v = new StateCell<>();
		assertNull(v.get());
		// Write and read.
		v.set("hello");
		assertEquals("hello", v.get());
		v.set("world");
		assertEquals("world", v.get());
		// Construct non-default.
		v = new StateCell<>("hi");
		assertEquals("hi", v.get());
		// Allow nulls.
		v.set(null);
		assertNull(v.get());
		// Update from current value.
		StateCell<Integer> n = new StateCell<>(1);
		n.update(x -> x + 1);
		assertEquals(2, (int)n.get());
	}
	@Test
	public void versions() {
		// Versions start at 1 and every effective write increments them.
		StateCell<String> v = new StateCell<>();
		assertEquals(1, v.version());
		v.set("hello");
		assertEquals(2, v.version());
		v.set("world");
		assertEquals(3, v.version());
	}
	@Test
	public void noopWrite() {
		StateCell<List<String>> v = new StateCell<>(Arrays.asList("a", "b"));
		List<String> original = v.get();
		// Equal value is ignored, including the instance.
		v.set(new ArrayList<>(Arrays.asList("a", "b")));
		assertEquals(1, v.version());
		assertSame(original, v.get());
		// Reference equality treats every new instance as a change.
		v.equality(false);
		v.set(new ArrayList<>(Arrays.asList("a", "b")));
		assertEquals(2, v.version());
	}
	@Test
	public void trackAccess() {
		StateCell<String> v = new StateCell<>("hello");
		RenderScope s = scope();
		try (CloseableScope c = s.enter()) {
			assertEquals("hello", v.get());
		}
		// Access has been observed and the scope became a reader.
		assertTrue(s.dependencies().contains(v));
		assertEquals(1, v.readerCount());
		// Peeking does not register anything.
		StateCell<String> p = new StateCell<>("quiet");
		try (CloseableScope c = s.enter()) {
			assertEquals("quiet", p.peek());
		}
		assertFalse(s.dependencies().contains(p));
		// Neither does reading with tracking suspended.
		try (CloseableScope c = s.enter(); CloseableScope u = CurrentRenderScope.untracked()) {
			assertEquals("quiet", p.get());
		}
		assertFalse(s.dependencies().contains(p));
	}
	@Test
	public void readersForgottenOnWrite() {
		StateCell<String> v = new StateCell<>("hello");
		RenderScope s = scope();
		try (CloseableScope c = s.enter()) {
			v.get();
		}
		assertEquals(1, v.readerCount());
		// Readers must read the cell again to be notified again.
		v.set("hi");
		assertEquals(0, v.readerCount());
		assertTrue(s.dirty());
	}
	@Test
	public void recursiveEnter() {
		RenderScope s = scope();
		try (CloseableScope c = s.enter()) {
			assertSame(s, RenderScope.current());
			assertThrows(IllegalStateException.class, s::enter);
		}
		assertNull(RenderScope.current());
	}
	@Test
	public void storeCellValue() {
		// Store ordinary value.
		assertEquals("value", new StateCell<>(new CellValue<>("value")).get());
		// Store exception.
		RuntimeException ex = new RuntimeException();
		CompletionException ce = assertThrows(CompletionException.class, () -> new StateCell<String>(CellValue.failed(ex)).get());
		assertSame(ex, ce.getCause());
		// Pending flag propagates into current scope.
		RenderScope s = scope();
		StateCell<String> v = new StateCell<>(new CellValue<>("partial", null, true));
		try (CloseableScope c = s.enter()) {
			assertEquals("partial", v.get());
			assertTrue(CurrentRenderScope.pending());
		}
		assertTrue(s.pending());
		// Both result and exception cannot be set.
		assertThrows(IllegalArgumentException.class, () -> new CellValue<>("x", ex, false));
	}
	@Test
	public void exceptionIdentity() {
		// Two exceptions that look the same are still two different values.
		StateCell<String> v = new StateCell<>(CellValue.failed(new RuntimeException("x")));
		v.value(CellValue.failed(new RuntimeException("x")));
		assertEquals(2, v.version());
	}
}
