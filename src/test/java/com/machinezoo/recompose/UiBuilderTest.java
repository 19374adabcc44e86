// Part of Recompose: https://recompose.machinezoo.com
package com.machinezoo.recompose;

import static org.hamcrest.MatcherAssert.*;
import static org.hamcrest.Matchers.*;
import static org.junit.jupiter.api.Assertions.*;
import java.util.*;
import java.util.concurrent.*;
import java.util.concurrent.atomic.*;
import org.junit.jupiter.api.*;
import com.machinezoo.recompose.tree.*;

public class UiBuilderTest extends TestBase {
	final List<Throwable> errors = new CopyOnWriteArrayList<>();
	private Composition start(RenderFunction content) {
		return new Composition(content).handler((s, ex) -> errors.add(ex)).start();
	}
	@Test
	public void structure() {
		Composition composition = start(ui -> ui.element("ul", list -> {
			list.element("li", item -> item.text("first"));
			list.element("li", item -> item.text("second"));
			list.element("li").key("last").prop("selected", true);
		}));
		ComponentNode tree = composition.snapshot();
		// Positional keys unless explicit key is given.
		assertEquals(Arrays.asList("0", "1", "last"), Arrays.asList(tree.children().get(0).key(), tree.children().get(1).key(), tree.children().get(2).key()));
		ComponentNode text = node(composition, "root/1/0");
		assertEquals("#text", text.type());
		assertEquals("second", text.prop("value").asString());
		assertTrue(node(composition, "root/last").prop("selected").asBoolean());
	}
	@Test
	public void rootKey() {
		// Root element always takes the scope key.
		Composition composition = new Composition(ui -> ui.element("main")).rootKey("app").start();
		assertEquals("app", composition.snapshot().key());
		assertEquals(NodePath.root("app"), composition.root().path());
	}
	@Test
	public void emptyOutput() {
		Composition composition = start(ui -> {});
		assertEquals("#empty", composition.snapshot().type());
		assertEquals("root", composition.snapshot().key());
	}
	@Test
	public void events() {
		AtomicInteger clicks = new AtomicInteger();
		Composition composition = start(ui -> ui.element("div", div -> {
			div.on("click", e -> clicks.incrementAndGet());
			div.element("button").on("click", e -> clicks.addAndGet(10)).on("focus", e -> {});
		}));
		ComponentNode tree = composition.snapshot();
		// Snapshot carries event names only.
		assertEquals(Arrays.asList("click"), tree.events());
		assertEquals(Arrays.asList("click", "focus"), node(composition, "root/0").events());
		// Live handlers are available by path.
		Map<NodePath, Map<String, EventHandler>> handlers = composition.handlers();
		assertThat(handlers.keySet(), containsInAnyOrder(NodePath.root("root"), NodePath.parse("root/0")));
		handlers.get(NodePath.root("root")).get("click").handle("event");
		handlers.get(NodePath.parse("root/0")).get("click").handle("event");
		assertEquals(11, clicks.get());
	}
	@Test
	public void handlersOfChildScopes() {
		Composition composition = start(ui -> ui.element("div", div -> div.scope("child", s -> s.element("button").on("click", e -> {}))));
		assertThat(composition.handlers().keySet(), contains(NodePath.parse("root/child")));
	}
	@Test
	public void eventHandlerWritesState() {
		StateCell<Integer> count = new StateCell<>(0);
		Composition composition = start(ui -> ui.element("button").prop("value", count.get()).on("click", e -> count.update(n -> n + 1)));
		composition.handlers().get(NodePath.root("root")).get("click").handle(null);
		assertEquals(1, number(composition, "root"));
	}
	@Test
	public void multipleRoots() {
		Composition composition = start(ui -> {
			ui.element("a");
			ui.element("b");
		});
		assertInstanceOf(IllegalStateException.class, errors.get(0));
		assertEquals("#error", composition.snapshot().type());
	}
	@Test
	public void scopeAtRootLevel() {
		start(ui -> ui.scope(s -> s.element("div")));
		assertInstanceOf(IllegalStateException.class, errors.get(0));
	}
	@Test
	public void duplicateKeys() {
		start(ui -> ui.element("div", div -> {
			div.element("span").key("k");
			div.element("span").key("k");
		}));
		assertInstanceOf(IllegalStateException.class, errors.get(0));
	}
	@Test
	public void numericExplicitKeys() {
		Composition composition = start(ui -> ui.element("ul", list -> {
			list.element("li").key("1");
			list.element("li");
			list.element("li").key("3");
			list.element("li");
			list.scope(s -> s.element("li"));
		}));
		assertTrue(errors.isEmpty());
		List<String> keys = new ArrayList<>();
		for (ComponentNode item : composition.snapshot().children())
			keys.add(item.key());
		// Positional siblings skip indexes taken by explicit keys.
		assertEquals(Arrays.asList("1", "2", "3", "4", "5"), keys);
	}
	@Test
	public void duplicateScopeKeys() {
		start(ui -> ui.element("div", div -> {
			div.scope("k", s -> s.element("span"));
			div.scope("k", s -> s.element("span"));
		}));
		assertInstanceOf(IllegalStateException.class, errors.get(0));
	}
	@Test
	public void keyAfterChildren() {
		start(ui -> ui.element("div", div -> div.element("ul", list -> {
			list.element("li");
			list.key("late");
		})));
		assertInstanceOf(IllegalStateException.class, errors.get(0));
	}
	@Test
	public void invalidKey() {
		start(ui -> ui.element("div", div -> div.element("span").key("a/b")));
		assertInstanceOf(IllegalArgumentException.class, errors.get(0));
	}
	@Test
	public void reservedProp() {
		start(ui -> ui.element("div").prop(ComponentNode.EVENTS, "click"));
		assertInstanceOf(IllegalArgumentException.class, errors.get(0));
	}
	@Test
	public void staleBuilder() {
		AtomicReference<UiBuilder> kept = new AtomicReference<>();
		start(ui -> {
			kept.set(ui);
			ui.element("div");
		});
		assertThrows(IllegalStateException.class, () -> kept.get().element("span"));
		assertThrows(IllegalStateException.class, () -> kept.get().state(1));
	}
	@Test
	public void nestedScopes() {
		StateCell<Integer> inner = new StateCell<>(1);
		AtomicInteger outerRuns = new AtomicInteger();
		Composition composition = start(ui -> ui.element("div", div -> div.scope("outer", outer -> {
			outerRuns.incrementAndGet();
			outer.element("section", section -> section.element("header", header -> header.scope("inner", s -> s.element("span").prop("value", inner.get()))));
		})));
		RecordingRenderer renderer = new RecordingRenderer();
		composition.renderer(renderer);
		inner.set(2);
		assertEquals(1, outerRuns.get());
		assertEquals(2, number(composition, "root/outer/0/inner"));
		assertEquals(Arrays.asList(NodePath.parse("root/outer/0/inner")), renderer.updated);
	}
}
