// Part of Recompose: https://recompose.machinezoo.com
package com.machinezoo.recompose.hydration;

import java.time.*;
import java.time.temporal.*;
import java.util.*;
import org.slf4j.*;
import com.google.gson.*;
import com.machinezoo.recompose.*;
import com.machinezoo.recompose.tree.*;
import com.machinezoo.stagean.*;

/*
 * Server side serializes a finished composition into a context.
 * Client side runs its own composition and matches it against the context.
 * The manager holds only configuration. All per-hydration state lives in HydrationSession.
 */
/**
 * Serializes composition output for transfer to the client and adopts it there.
 *
 * @see HydrationSession
 */
@DraftDocs("wire format and client bootstrap")
public class HydrationManager {
	private static final Logger logger = LoggerFactory.getLogger(HydrationManager.class);
	private CompatibilityPolicy policy = CompatibilityPolicy.DEEP;
	public synchronized HydrationManager policy(CompatibilityPolicy policy) {
		Objects.requireNonNull(policy);
		this.policy = policy;
		return this;
	}
	public synchronized CompatibilityPolicy policy() {
		return policy;
	}
	private Clock clock = Clock.systemUTC();
	public synchronized HydrationManager clock(Clock clock) {
		Objects.requireNonNull(clock);
		this.clock = clock;
		return this;
	}
	public synchronized Clock clock() {
		return clock;
	}
	private HydrationCodec codec = new HydrationCodec();
	public synchronized HydrationManager gson(Gson gson) {
		codec = new HydrationCodec(gson);
		return this;
	}
	public synchronized HydrationCodec codec() {
		return codec;
	}
	private HydrationListener listener = new HydrationListener() {
	};
	public synchronized HydrationManager listener(HydrationListener listener) {
		Objects.requireNonNull(listener);
		this.listener = listener;
		return this;
	}
	public synchronized HydrationListener listener() {
		return listener;
	}
	/**
	 * Builds hydration context from the current output of a started composition.
	 *
	 * @param composition
	 *            server-side composition
	 * @return hydration context with component tree, saveable state, and markers
	 * @throws DuplicateMarkerException
	 *             if two interactive nodes resolve to the same marker id
	 */
	public HydrationContext serializeHydrationContext(Composition composition) {
		Objects.requireNonNull(composition);
		return serializeHydrationContext(composition.snapshot(), composition.stateData());
	}
	public HydrationContext serializeHydrationContext(ComponentNode tree, Map<String, ?> stateData) {
		Objects.requireNonNull(tree);
		Objects.requireNonNull(stateData);
		List<DomMarker> markers = new ArrayList<>();
		tree.walk((path, node) -> {
			if (node.interactive())
				markers.add(DomMarker.of(path, node));
		});
		HydrationCodec codec = codec();
		Map<String, JsonElement> state = new LinkedHashMap<>();
		for (Map.Entry<String, ?> entry : stateData.entrySet())
			state.put(entry.getKey(), codec.stateJson(entry.getValue()));
		/*
		 * Wire format carries milliseconds. Truncate here, so that the context survives encoding unchanged.
		 */
		Instant timestamp = clock().instant().truncatedTo(ChronoUnit.MILLIS);
		HydrationContext context = new HydrationContext(tree, state, markers, timestamp);
		logger.debug("Serialized {}.", context);
		return context;
	}
	public String encode(HydrationContext context) {
		return codec().encode(context);
	}
	public HydrationContext decode(String data) {
		return codec().decode(data);
	}
	/**
	 * Parses hydration context and checks it against what the presentation layer actually shows at the mount point.
	 *
	 * @param contextData
	 *            serialized context
	 * @param mount
	 *            mount point holding server-rendered markup
	 * @return parsed context
	 * @throws DeserializationException
	 *             if the context cannot be parsed
	 * @throws TreeIncompatibleException
	 *             if the mount point shows different root element than the context describes
	 */
	public HydrationContext deserializeAndMatch(String contextData, MountPoint mount) {
		Objects.requireNonNull(mount);
		HydrationContext context = decode(contextData);
		Optional<String> rendered = mount.renderedRootType();
		String expected = context.componentTree().type();
		if (rendered.isPresent() && !rendered.get().equals(expected))
			throw new TreeIncompatibleException(context.rootPath(), expected, rendered.get(), "mount point " + mount.id() + " shows <" + rendered.get() + ">.");
		return context;
	}
	public boolean validateTreeCompatibility(HydrationContext context, ComponentNode clientTree) {
		Objects.requireNonNull(context);
		Objects.requireNonNull(clientTree);
		return new AdoptionPlanner(policy()).compatible(context.componentTree(), clientTree);
	}
	public AdoptionPlan plan(HydrationContext context, Composition composition) {
		Objects.requireNonNull(composition);
		return new AdoptionPlanner(policy()).plan(context, composition.snapshot(), composition.handlers());
	}
	/**
	 * Runs complete client-side hydration.
	 * The composition must not be started yet. It is started by this method after its state registry is seeded.
	 *
	 * @return outcome of the hydration, never {@code null}
	 * @see HydrationSession#run()
	 */
	public HydrationResult hydrate(String contextData, MountPoint mount, Composition composition, Renderer renderer) {
		return new HydrationSession(this, contextData, mount, composition, renderer).run();
	}
}
