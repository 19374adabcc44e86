// Part of Recompose: https://recompose.machinezoo.com
package com.machinezoo.recompose.hydration;

import static java.util.stream.Collectors.*;
import static org.junit.jupiter.api.Assertions.*;
import java.time.*;
import java.util.*;
import java.util.concurrent.atomic.*;
import org.junit.jupiter.api.*;
import com.google.gson.*;
import com.machinezoo.recompose.*;
import com.machinezoo.recompose.tree.*;

public class HydrationManagerTest extends TestBase {
	final HydrationManager manager = new HydrationManager().clock(Clock.fixed(Instant.parse("2024-01-01T10:00:00.123456Z"), ZoneOffset.UTC));
	final AtomicInteger clicks = new AtomicInteger();
	private RenderFunction app(String buttonType) {
		return ui -> ui.element("div", div -> {
			div.id("root").on("click", e -> clicks.incrementAndGet());
			div.element(buttonType);
		});
	}
	private String serverRender(RenderFunction content) {
		try (Composition server = new Composition(content).start()) {
			return manager.encode(manager.serializeHydrationContext(server));
		}
	}
	@Test
	public void adoptIdenticalTree() {
		String data = serverRender(app("button"));
		Composition client = new Composition(app("button"));
		RecordingRenderer renderer = new RecordingRenderer();
		HydrationResult result = manager.hydrate(data, MountPoint.of("app"), client, renderer);
		assertEquals(HydrationState.ADOPTED, result.state());
		assertFalse(result.failure().isPresent());
		// Server markup is kept, only handlers are attached.
		assertTrue(renderer.updated.isEmpty());
		assertEquals(Arrays.asList("root"), renderer.bound);
		renderer.handlers.get("root").get("click").handle(null);
		assertEquals(1, clicks.get());
	}
	@Test
	public void compatibleTrees() {
		ComponentNode tree = ComponentNode.of("div", "root", ComponentNode.leaf("button", "0"));
		HydrationContext context = new HydrationContext(tree, Collections.emptyMap(), Arrays.asList(new DomMarker("root", "div")), Instant.EPOCH);
		assertTrue(manager.validateTreeCompatibility(context, tree));
	}
	@Test
	public void incompatibleRoot() {
		ComponentNode server = ComponentNode.of("div", "root", ComponentNode.leaf("button", "0"));
		ComponentNode client = ComponentNode.of("span", "root", ComponentNode.leaf("button", "0"));
		HydrationContext context = new HydrationContext(server, Collections.emptyMap(), Arrays.asList(new DomMarker("root", "div")), Instant.EPOCH);
		assertFalse(manager.validateTreeCompatibility(context, client));
		// Shallow policy compares root type too.
		assertFalse(new HydrationManager().policy(CompatibilityPolicy.SHALLOW).validateTreeCompatibility(context, client));
	}
	@Test
	public void fullClientRender() {
		String data = serverRender(ui -> ui.element("div", div -> div.element("button")));
		Composition client = new Composition(ui -> ui.element("span", span -> span.element("button")));
		RecordingRenderer renderer = new RecordingRenderer();
		HydrationResult result = manager.hydrate(data, MountPoint.of("app"), client, renderer);
		assertEquals(HydrationState.FULL_CLIENT_RENDER, result.state());
		assertInstanceOf(TreeIncompatibleException.class, result.failure().get());
		assertEquals(Arrays.asList(NodePath.root("root")), renderer.updated);
		assertEquals("span", renderer.nodes.get(NodePath.root("root")).type());
	}
	@Test
	public void serializeComposition() {
		Composition server = new Composition(ui -> ui.element("div", div -> {
			div.element("button").on("click", e -> {});
			div.element("a").id("home").on("click", e -> {}).prop(ComponentNode.HYDRATION_PRIORITY, "critical");
			div.element("p").text("static");
			div.state("draft", String.class, "hello");
		})).start();
		HydrationContext context = manager.serializeHydrationContext(server);
		assertEquals(server.snapshot(), context.componentTree());
		// Only interactive nodes get markers.
		assertEquals(Arrays.asList("h:root/0", "home"), context.hydrationMarkers().stream().map(DomMarker::id).collect(toList()));
		DomMarker home = context.marker("home").get();
		assertEquals("a", home.type());
		assertEquals(Optional.of(NodePath.parse("root/1")), home.path());
		assertEquals("CRITICAL", home.attributes().get(DomMarker.PRIORITY_ATTRIBUTE));
		assertEquals(new JsonPrimitive("hello"), context.stateData().get("root#draft"));
		assertEquals(Instant.parse("2024-01-01T10:00:00.123Z"), context.timestamp());
		// Serialized context survives the wire.
		assertEquals(context, manager.decode(manager.encode(context)));
	}
	@Test
	public void duplicateMarkers() {
		Composition server = new Composition(ui -> ui.element("div", div -> {
			div.element("button").id("same").on("click", e -> {});
			div.element("button").id("same").on("click", e -> {});
		})).start();
		DuplicateMarkerException ex = assertThrows(DuplicateMarkerException.class, () -> manager.serializeHydrationContext(server));
		assertEquals("same", ex.markerId());
	}
	@Test
	public void mountPointMismatch() {
		String data = serverRender(app("button"));
		assertEquals("div", manager.deserializeAndMatch(data, MountPoint.of("app", "div")).componentTree().type());
		TreeIncompatibleException ex = assertThrows(TreeIncompatibleException.class, () -> manager.deserializeAndMatch(data, MountPoint.of("app", "span")));
		assertEquals("div", ex.serverType());
		assertEquals("span", ex.clientType());
		assertThrows(DeserializationException.class, () -> manager.deserializeAndMatch("{", MountPoint.of("app")));
	}
	@Test
	public void planAgainstComposition() {
		String data = serverRender(app("button"));
		Composition client = new Composition(app("a")).start();
		AdoptionPlan plan = manager.plan(manager.decode(data), client);
		assertFalse(plan.fullRender());
		assertEquals(NodePath.parse("root/0"), plan.fallbacks().get(0).path());
		assertEquals("a", plan.fallbacks().get(0).node().type());
	}
}
