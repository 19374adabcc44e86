// Part of Recompose: https://recompose.machinezoo.com
package com.machinezoo.recompose.tree;

import static org.junit.jupiter.api.Assertions.*;
import java.util.*;
import org.junit.jupiter.api.*;

public class NodePathTest {
	@Test
	public void navigation() {
		NodePath path = NodePath.root("root").child("list").child("3");
		assertEquals("root/list/3", path.toString());
		assertEquals(Arrays.asList("root", "list", "3"), path.keys());
		assertEquals(3, path.depth());
		assertEquals("3", path.last());
		assertEquals(NodePath.parse("root/list"), path.parent());
		assertNull(NodePath.root("root").parent());
		assertEquals(path, NodePath.parse(path.toString()));
	}
	@Test
	public void within() {
		NodePath path = NodePath.parse("root/a/b");
		assertTrue(path.within(NodePath.parse("root/a")));
		assertTrue(path.within(path));
		assertFalse(path.within(NodePath.parse("root/b")));
		assertFalse(NodePath.parse("root/a").within(path));
		// Key prefix is not a path prefix.
		assertFalse(NodePath.parse("root/ab").within(NodePath.parse("root/a")));
	}
	@Test
	public void invalidKeys() {
		assertThrows(IllegalArgumentException.class, () -> NodePath.root(""));
		assertThrows(IllegalArgumentException.class, () -> NodePath.root("a").child("b/c"));
		assertThrows(IllegalArgumentException.class, () -> NodePath.parse("root//x"));
		assertThrows(NullPointerException.class, () -> NodePath.root(null));
	}
}
