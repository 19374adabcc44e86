// Part of Recompose: https://recompose.machinezoo.com
package com.machinezoo.recompose;

import java.lang.ref.*;
import java.util.*;
import org.slf4j.*;
import com.machinezoo.noexception.slf4j.*;
import com.machinezoo.recompose.util.*;
import com.machinezoo.stagean.*;
import io.micrometer.core.instrument.*;
import io.micrometer.core.instrument.Timer;
import io.opentracing.*;
import io.opentracing.util.*;
import it.unimi.dsi.fastutil.objects.*;

/*
 * Writes only enqueue scopes. Execution happens in flushes, which process the queue in rounds.
 * Every round is sorted by depth, so that parents execute before their children.
 * Parent execution re-executes invalidated children inline, which clears their dirty flag,
 * and the queued entries of these children are then skipped.
 *
 * Writes made during a flush (by render functions or effects) land in the next round of the same flush.
 * Scopes that keep invalidating themselves are stopped after a configurable number of executions per flush.
 */
/**
 * Per-composition queue of invalidated {@link RenderScope}s.
 */
@StubDocs
public class RecomposeScheduler {
	private static final Logger logger = LoggerFactory.getLogger(RecomposeScheduler.class);
	private static final Timer timer = Metrics.timer("recompose.flush");
	private final Composition composition;
	RecomposeScheduler(Composition composition) {
		this.composition = composition;
		OwnerTrace.of(this).alias("scheduler").parent(composition);
	}
	private final Set<RenderScope> queue = new LinkedHashSet<>();
	synchronized void enqueue(RenderScope scope) {
		scope.markDirty();
		queue.add(scope);
	}
	public synchronized boolean pending() {
		return !queue.isEmpty();
	}
	private int batchDepth;
	private boolean flushing;
	private boolean scheduled;
	/*
	 * Called once after all readers of a write have been enqueued.
	 */
	void written() {
		if (!composition.started() || composition.closed())
			return;
		switch (composition.batching()) {
		case IMMEDIATE:
			synchronized (this) {
				if (batchDepth > 0 || flushing)
					return;
			}
			flush();
			break;
		case EXECUTOR:
			synchronized (this) {
				if (scheduled)
					return;
				scheduled = true;
			}
			composition.executor().execute(ExceptionLogging.log(logger).runnable(new FlushTask(this)));
			break;
		case MANUAL:
			break;
		}
	}
	/*
	 * Queued flush must not keep an abandoned composition alive.
	 */
	private static class FlushTask implements Runnable {
		final WeakReference<RecomposeScheduler> scheduler;
		FlushTask(RecomposeScheduler scheduler) {
			this.scheduler = new WeakReference<>(scheduler);
		}
		@Override
		public void run() {
			RecomposeScheduler target = scheduler.get();
			if (target != null)
				target.flush();
		}
	}
	/**
	 * Runs the action with immediate flushing suspended.
	 * All writes performed by the action are processed in one flush after the outermost batch completes.
	 *
	 * @param action
	 *            action to run
	 */
	public void batch(Runnable action) {
		Objects.requireNonNull(action);
		synchronized (this) {
			++batchDepth;
		}
		boolean flush;
		try {
			action.run();
		} finally {
			synchronized (this) {
				--batchDepth;
				flush = batchDepth == 0 && !flushing && !queue.isEmpty();
			}
		}
		if (flush && composition.batching() == BatchingMode.IMMEDIATE && composition.started())
			flush();
	}
	/**
	 * Executes all invalidated scopes until the queue is drained.
	 * Nested calls made from within a running flush return immediately.
	 */
	public synchronized void flush() {
		scheduled = false;
		if (flushing || queue.isEmpty() || composition.closed())
			return;
		flushing = true;
		Timer.Sample sample = Timer.start(Clock.SYSTEM);
		Span span = GlobalTracer.get().buildSpan("recompose.flush")
			.withTag("component", "recompose")
			.start();
		OwnerTrace.of(this).fill(span);
		Object2IntMap<RenderScope> counts = new Object2IntOpenHashMap<>();
		Set<RenderScope> updated = new LinkedHashSet<>();
		try (Scope trace = GlobalTracer.get().activateSpan(span)) {
			int rounds = 0;
			int executions = 0;
			while (!queue.isEmpty()) {
				List<RenderScope> round = new ArrayList<>(queue);
				queue.clear();
				++rounds;
				/*
				 * List.sort() is stable, so scopes of equal depth keep invalidation order.
				 */
				round.sort(Comparator.comparingInt(RenderScope::depth));
				for (RenderScope scope : round) {
					if (!scope.dirty() || scope.disposed() || scope.stopped())
						continue;
					int count = counts.getInt(scope) + 1;
					counts.put(scope, count);
					if (count > composition.maxReexecutions()) {
						logger.warn("Stopping scope {} after {} executions in one flush.", scope.path(), count - 1);
						scope.stop(new SchedulingOverflowException(scope, count - 1));
					} else
						scope.execute();
					++executions;
					updated.add(scope);
				}
				composition.runEffects();
			}
			span.setTag("rounds", rounds);
			span.setTag("executions", executions);
			push(updated);
		} finally {
			flushing = false;
			span.finish();
			sample.stop(timer);
		}
	}
	/*
	 * Renderer receives one update per updated subtree. Scopes updated together with an ancestor are covered by the ancestor's update.
	 * Pending scopes still show their previous output, so there is nothing to push for them.
	 */
	private void push(Set<RenderScope> updated) {
		Renderer renderer = composition.renderer();
		if (renderer == null)
			return;
		for (RenderScope scope : updated) {
			if (scope.disposed() || scope.pending() || coveredByAncestor(scope, updated))
				continue;
			ExceptionLogging.log(logger).run(() -> renderer.createOrUpdate(scope.path(), scope.snapshot()));
		}
	}
	private static boolean coveredByAncestor(RenderScope scope, Set<RenderScope> updated) {
		for (RenderScope ancestor = scope.parent(); ancestor != null; ancestor = ancestor.parent())
			if (updated.contains(ancestor))
				return true;
		return false;
	}
	@Override
	public String toString() {
		return OwnerTrace.of(this).toString();
	}
}
