// Part of Recompose: https://recompose.machinezoo.com
package com.machinezoo.recompose.hydration;

import java.util.*;
import org.slf4j.*;
import com.machinezoo.noexception.slf4j.*;
import com.machinezoo.recompose.*;
import com.machinezoo.recompose.util.*;
import com.machinezoo.stagean.*;
import io.micrometer.core.instrument.*;
import io.micrometer.core.instrument.Timer;
import io.opentracing.*;
import io.opentracing.util.*;

/*
 * Session runs to completion. There is no cancellation, because partially adopted UI is not a valid intermediate state.
 *
 * Renderer is attached to the composition only after the plan is applied.
 * Until then, the composition may flush, but nothing is pushed to the presentation layer,
 * because the plan is computed from the latest snapshot and covers all such changes.
 */
/**
 * One-shot client-side hydration of a single mount point.
 * Classified failures never escape. They end in partial or full client rendering and they are reported to {@link HydrationListener}.
 */
@StubDocs
public class HydrationSession {
	private static final Logger logger = LoggerFactory.getLogger(HydrationSession.class);
	private static final Timer timer = Metrics.timer("recompose.hydration");
	private static final Counter failureCount = Metrics.counter("recompose.hydration.failures");
	private static final Counter mismatchCount = Metrics.counter("recompose.hydration.mismatches");
	private static final Counter unboundCount = Metrics.counter("recompose.hydration.unbound");
	private final HydrationManager manager;
	private final String contextData;
	private final MountPoint mount;
	private final Composition composition;
	private final Renderer renderer;
	private final HydrationListener listener;
	public HydrationSession(HydrationManager manager, String contextData, MountPoint mount, Composition composition, Renderer renderer) {
		Objects.requireNonNull(manager);
		Objects.requireNonNull(mount);
		Objects.requireNonNull(composition);
		Objects.requireNonNull(renderer);
		this.manager = manager;
		this.contextData = contextData;
		this.mount = mount;
		this.composition = composition;
		this.renderer = renderer;
		listener = manager.listener();
		OwnerTrace.of(this).alias("hydration").parent(composition).tag("mount", mount.id());
	}
	private volatile HydrationState state = HydrationState.IDLE;
	public HydrationState state() {
		return state;
	}
	private void transition(HydrationState next) {
		logger.trace("Hydration of {} moves from {} to {}.", mount.id(), state, next);
		state = next;
		ExceptionLogging.log(logger).run(() -> listener.stateChanged(next));
	}
	/**
	 * Deserializes the context, starts the composition, matches the trees, and applies the resulting plan.
	 *
	 * @return outcome of the hydration
	 * @throws IllegalStateException
	 *             if the session was already run or the composition was already started
	 */
	public HydrationResult run() {
		synchronized (this) {
			if (state != HydrationState.IDLE)
				throw new IllegalStateException("Hydration session can be run only once.");
			if (composition.started())
				throw new IllegalStateException("Hydrated composition must not be started yet.");
			state = HydrationState.DESERIALIZING;
		}
		Timer.Sample sample = Timer.start(Clock.SYSTEM);
		Span span = GlobalTracer.get().buildSpan("recompose.hydration")
			.withTag("component", "recompose")
			.start();
		OwnerTrace.of(this).fill(span);
		try (Scope trace = GlobalTracer.get().activateSpan(span)) {
			ExceptionLogging.log(logger).run(() -> listener.stateChanged(HydrationState.DESERIALIZING));
			HydrationContext context;
			try {
				context = manager.deserializeAndMatch(contextData, mount);
			} catch (HydrationException ex) {
				logger.warn("Cannot hydrate {}, rendering it on the client from scratch.", mount.id(), ex);
				failureCount.increment();
				ExceptionLogging.log(logger).run(() -> listener.deserializationFailed(ex));
				composition.start();
				AdoptionPlan plan = new AdoptionPlanner(manager.policy()).fullRender(null, composition.snapshot(), composition.handlers());
				return finish(HydrationState.FULL_CLIENT_RENDER, null, plan, ex, span);
			}
			transition(HydrationState.MATCHING);
			/*
			 * Seed saveable state before the first client pass, so that client output matches server output.
			 */
			StateRegistry registry = composition.registry();
			context.stateData().forEach(registry::set);
			composition.start();
			AdoptionPlan plan = manager.plan(context, composition);
			for (DomMarker marker : plan.unbound()) {
				logger.debug("Server marker {} has no client counterpart.", marker.id());
				unboundCount.increment();
				ExceptionLogging.log(logger).run(() -> listener.markerUnbound(marker));
			}
			if (plan.adopted())
				return finish(HydrationState.ADOPTED, context, plan, null, span);
			transition(HydrationState.MISMATCHED);
			for (TreeIncompatibleException mismatch : plan.mismatches()) {
				logger.info("Hydration mismatch: {}", mismatch.getMessage());
				mismatchCount.increment();
				ExceptionLogging.log(logger).run(() -> listener.subtreeMismatched(mismatch));
			}
			HydrationException failure = plan.mismatches().isEmpty() ? null : plan.mismatches().get(0);
			return finish(plan.fullRender() ? HydrationState.FULL_CLIENT_RENDER : HydrationState.ADOPTED_WITH_FALLBACK, context, plan, failure, span);
		} finally {
			span.finish();
			sample.stop(timer);
		}
	}
	private HydrationResult finish(HydrationState outcome, HydrationContext context, AdoptionPlan plan, HydrationException failure, Span span) {
		apply(plan);
		composition.renderer(renderer);
		transition(outcome);
		span.setTag("outcome", outcome.name());
		span.setTag("fallbacks", plan.fallbacks().size());
		span.setTag("bindings", plan.bindings().size());
		Metrics.counter("recompose.hydration.outcomes", "state", outcome.name()).increment();
		HydrationResult result = new HydrationResult(outcome, context, plan, failure);
		logger.debug("Hydration of {} finished: {}", mount.id(), result);
		ExceptionLogging.log(logger).run(() -> listener.completed(result));
		return result;
	}
	/*
	 * Fresh subtrees are created first, so that markers inside them exist by the time they are bound.
	 * Renderer failures are logged and skipped. Remaining work still proceeds, so that as much of the UI as possible becomes interactive.
	 */
	private void apply(AdoptionPlan plan) {
		for (AdoptionPlan.Fallback fallback : plan.fallbacks())
			ExceptionLogging.log(logger).run(() -> renderer.createOrUpdate(fallback.path(), fallback.node()));
		for (MarkerBinding binding : plan.bindings())
			ExceptionLogging.log(logger).run(() -> renderer.bindMarker(binding.markerId(), binding.handlers()));
	}
	@Override
	public String toString() {
		return OwnerTrace.of(this).toString();
	}
}
