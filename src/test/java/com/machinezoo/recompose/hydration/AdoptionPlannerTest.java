// Part of Recompose: https://recompose.machinezoo.com
package com.machinezoo.recompose.hydration;

import static java.util.stream.Collectors.*;
import static org.hamcrest.MatcherAssert.*;
import static org.hamcrest.Matchers.*;
import static org.junit.jupiter.api.Assertions.*;
import java.time.*;
import java.util.*;
import org.junit.jupiter.api.*;
import com.machinezoo.recompose.*;
import com.machinezoo.recompose.tree.*;

public class AdoptionPlannerTest {
	final AdoptionPlanner deep = new AdoptionPlanner(CompatibilityPolicy.DEEP);
	final AdoptionPlanner shallow = new AdoptionPlanner(CompatibilityPolicy.SHALLOW);
	private static HydrationContext context(ComponentNode tree, DomMarker... markers) {
		return new HydrationContext(tree, Collections.emptyMap(), Arrays.asList(markers), Instant.EPOCH);
	}
	private static ComponentNode page(String heading, String... items) {
		List<ComponentNode> children = new ArrayList<>();
		for (String item : items)
			children.add(ComponentNode.leaf("li", item));
		return ComponentNode.of("div", "root",
			ComponentNode.leaf("h1", "title").withProp("value", heading),
			new ComponentNode("ul", "list", Collections.emptyMap(), children));
	}
	@Test
	public void identicalTrees() {
		ComponentNode tree = ComponentNode.of("div", "root", ComponentNode.leaf("button", "0"));
		assertTrue(deep.compatible(tree, tree));
		AdoptionPlan plan = deep.plan(context(tree, new DomMarker("root", "div")), tree.withProp(ComponentNode.ID, "root"), Collections.emptyMap());
		// Props differ now, so the root falls back.
		assertTrue(plan.fullRender());
		plan = deep.plan(context(tree), tree, Collections.emptyMap());
		assertTrue(plan.adopted());
		assertTrue(plan.fallbacks().isEmpty());
		assertTrue(plan.bindings().isEmpty());
	}
	@Test
	public void rootTypeMismatch() {
		ComponentNode server = ComponentNode.leaf("div", "root");
		ComponentNode client = ComponentNode.leaf("span", "root");
		assertFalse(deep.compatible(server, client));
		assertFalse(shallow.compatible(server, client));
		AdoptionPlan plan = deep.plan(context(server), client, Collections.emptyMap());
		assertTrue(plan.fullRender());
		assertFalse(plan.adopted());
		assertEquals(1, plan.fallbacks().size());
		assertEquals(NodePath.root("root"), plan.fallbacks().get(0).path());
		TreeIncompatibleException mismatch = plan.mismatches().get(0);
		assertEquals("div", mismatch.serverType());
		assertEquals("span", mismatch.clientType());
	}
	@Test
	public void rootKeyMismatch() {
		assertFalse(deep.compatible(ComponentNode.leaf("div", "root"), ComponentNode.leaf("div", "app")));
	}
	@Test
	public void partialFallback() {
		AdoptionPlan plan = deep.plan(context(page("Hello", "a", "b")), page("Goodbye", "a", "b"), Collections.emptyMap());
		// Only the changed heading is rendered fresh.
		assertFalse(plan.fullRender());
		assertFalse(plan.adopted());
		assertEquals(Arrays.asList(NodePath.parse("root/title")), plan.fallbacks().stream().map(AdoptionPlan.Fallback::path).collect(toList()));
		assertEquals("Goodbye", plan.fallbacks().get(0).node().prop("value").asString());
	}
	@Test
	public void childSequenceMismatch() {
		AdoptionPlan plan = deep.plan(context(page("Hello", "a", "b")), page("Hello", "a", "b", "c"), Collections.emptyMap());
		// Whole list falls back, siblings stay adopted.
		assertEquals(Arrays.asList(NodePath.parse("root/list")), plan.fallbacks().stream().map(AdoptionPlan.Fallback::path).collect(toList()));
		assertThat(plan.mismatches().get(0).getMessage(), containsString("children differ"));
		plan = deep.plan(context(page("Hello", "a", "b")), page("Hello", "b", "a"), Collections.emptyMap());
		assertEquals(NodePath.parse("root/list"), plan.fallbacks().get(0).path());
	}
	@Test
	public void shallowPolicy() {
		// Shallow policy looks at the root type only.
		assertTrue(shallow.compatible(page("Hello", "a"), page("Goodbye", "x", "y")));
		assertTrue(shallow.plan(context(page("Hello", "a")), page("Goodbye", "x", "y"), Collections.emptyMap()).adopted());
	}
	@Test
	public void bindings() {
		EventHandler click = e -> {};
		ComponentNode tree = ComponentNode.of("div", "root",
			ComponentNode.leaf("button", "later").withProp(ComponentNode.EVENTS, Arrays.asList("click")).withProp(ComponentNode.HYDRATION_PRIORITY, "deferred"),
			ComponentNode.leaf("button", "plain").withProp(ComponentNode.EVENTS, Arrays.asList("click")),
			ComponentNode.leaf("button", "first").withProp(ComponentNode.EVENTS, Arrays.asList("click")).withProp(ComponentNode.HYDRATION_PRIORITY, "CRITICAL").withProp(ComponentNode.ID, "buy"));
		Map<NodePath, Map<String, EventHandler>> handlers = new HashMap<>();
		handlers.put(NodePath.parse("root/first"), Collections.singletonMap("click", click));
		AdoptionPlan plan = deep.plan(context(tree, new DomMarker("buy", "button"), new DomMarker("ghost", "div")), tree, handlers);
		assertTrue(plan.adopted());
		// Critical first, then default priority, deferred last.
		assertEquals(Arrays.asList("buy", "h:root/plain", "h:root/later"), plan.bindings().stream().map(MarkerBinding::markerId).collect(toList()));
		assertEquals(HydrationPriority.CRITICAL, plan.bindings().get(0).priority());
		assertSame(click, plan.bindings().get(0).handlers().get("click"));
		assertTrue(plan.bindings().get(1).handlers().isEmpty());
		assertFalse(plan.bindings().get(0).fresh());
		// Server marker with no client counterpart.
		assertEquals(Arrays.asList("ghost"), plan.unbound().stream().map(DomMarker::id).collect(toList()));
	}
	@Test
	public void markerOnPlainNode() {
		// Server marker can point to a node without events, for example one with explicit id.
		ComponentNode tree = ComponentNode.of("div", "root", ComponentNode.leaf("button", "0")).withProp(ComponentNode.ID, "root");
		AdoptionPlan plan = deep.plan(context(tree, new DomMarker("root", "div")), tree, Collections.emptyMap());
		assertEquals(Arrays.asList("root"), plan.bindings().stream().map(MarkerBinding::markerId).collect(toList()));
		assertTrue(plan.unbound().isEmpty());
	}
	@Test
	public void freshBindings() {
		ComponentNode server = ComponentNode.of("div", "root", ComponentNode.leaf("a", "link"));
		ComponentNode client = ComponentNode.of("div", "root", ComponentNode.leaf("button", "link").withProp(ComponentNode.EVENTS, Arrays.asList("click")));
		AdoptionPlan plan = deep.plan(context(server), client, Collections.emptyMap());
		// Interactive node inside fallback is bound after it is created.
		assertEquals(1, plan.bindings().size());
		assertTrue(plan.bindings().get(0).fresh());
	}
	@Test
	public void fullRenderPlan() {
		ComponentNode client = ComponentNode.leaf("div", "root").withProp(ComponentNode.EVENTS, Arrays.asList("click"));
		AdoptionPlan plan = deep.fullRender(null, client, Collections.emptyMap());
		assertTrue(plan.fullRender());
		assertEquals(client, plan.fallbacks().get(0).node());
		assertTrue(plan.bindings().get(0).fresh());
	}
}
