// Part of Recompose: https://recompose.machinezoo.com
package com.machinezoo.recompose;

import java.util.*;
import java.util.concurrent.*;
import java.util.function.*;
import org.slf4j.*;
import com.google.gson.*;
import com.machinezoo.noexception.slf4j.*;
import com.machinezoo.recompose.tree.*;
import com.machinezoo.recompose.util.*;
import com.machinezoo.stagean.*;
import io.micrometer.core.instrument.*;

/*
 * Composition is configured first and then started. Configuration is frozen after start
 * except for the renderer, which hydration attaches only after the server-rendered tree has been adopted.
 *
 * Everything mutable in the composition is guarded by the scheduler's monitor,
 * which is also held for the whole duration of every flush.
 */
/**
 * Root of one live tree of {@link RenderScope}s.
 * Every composition has its own {@link RecomposeScheduler}, {@link StateRegistry}, and {@link Renderer} binding.
 * Independent compositions can run concurrently without sharing anything but explicitly shared {@link StateCell}s.
 */
@DraftDocs("usage example")
public class Composition implements AutoCloseable {
	private static final Logger logger = LoggerFactory.getLogger(Composition.class);
	/*
	 * Compositions are not tracked globally, but we want to know how many of them are running.
	 */
	private static final Set<Composition> active =
		Metrics.gaugeCollectionSize("recompose.compositions.active", Collections.emptyList(), ConcurrentHashMap.newKeySet());
	private final RenderFunction content;
	private final RecomposeScheduler scheduler;
	public RecomposeScheduler scheduler() {
		return scheduler;
	}
	public Composition(RenderFunction content) {
		Objects.requireNonNull(content);
		this.content = content;
		OwnerTrace.of(this).alias("composition").generateId();
		scheduler = new RecomposeScheduler(this);
	}
	private volatile boolean started;
	public boolean started() {
		return started;
	}
	private volatile boolean closed;
	public boolean closed() {
		return closed;
	}
	private void ensureNotStarted() {
		if (started)
			throw new IllegalStateException("Composition is already started.");
	}
	private String rootKey = "root";
	public synchronized Composition rootKey(String rootKey) {
		NodePath.checkKey(rootKey);
		ensureNotStarted();
		this.rootKey = rootKey;
		return this;
	}
	public synchronized String rootKey() {
		return rootKey;
	}
	private StateRegistry registry = new MapStateRegistry();
	public synchronized Composition registry(StateRegistry registry) {
		Objects.requireNonNull(registry);
		ensureNotStarted();
		this.registry = registry;
		return this;
	}
	public synchronized StateRegistry registry() {
		return registry;
	}
	/*
	 * Renderer can be attached at any time. Hydration attaches it only after adoption is complete.
	 */
	private volatile Renderer renderer;
	public Composition renderer(Renderer renderer) {
		this.renderer = renderer;
		return this;
	}
	public Renderer renderer() {
		return renderer;
	}
	/*
	 * Exception handlers mirror the ones of the reactive thread:
	 * global default that can be replaced and per-composition handler that defaults to the global one.
	 */
	private static volatile BiConsumer<RenderScope, Throwable> handlerDefault = (s, ex) -> logger.error("Render function of scope {} failed.", s.path(), ex);
	public static void handlerDefault(BiConsumer<RenderScope, Throwable> handler) {
		Objects.requireNonNull(handler);
		handlerDefault = handler;
	}
	public static BiConsumer<RenderScope, Throwable> handlerDefault() {
		return handlerDefault;
	}
	private BiConsumer<RenderScope, Throwable> handler = (s, ex) -> handlerDefault.accept(s, ex);
	public synchronized Composition handler(BiConsumer<RenderScope, Throwable> handler) {
		Objects.requireNonNull(handler);
		ensureNotStarted();
		this.handler = handler;
		return this;
	}
	public synchronized BiConsumer<RenderScope, Throwable> handler() {
		return handler;
	}
	void report(RenderScope scope, Throwable exception) {
		ExceptionLogging.log(logger).fromBiConsumer(handler()).accept(scope, exception);
	}
	/*
	 * Completions of asynchronous values arrive on arbitrary threads. Dispatcher decides where the resulting write runs.
	 * The default runs it on the completing thread, which is fine as long as the scheduler's monitor serializes flushes.
	 */
	private Executor dispatcher = Runnable::run;
	public synchronized Composition dispatcher(Executor dispatcher) {
		Objects.requireNonNull(dispatcher);
		ensureNotStarted();
		this.dispatcher = dispatcher;
		return this;
	}
	public synchronized Executor dispatcher() {
		return dispatcher;
	}
	private Executor executor = ForkJoinPool.commonPool();
	public synchronized Composition executor(Executor executor) {
		Objects.requireNonNull(executor);
		ensureNotStarted();
		this.executor = executor;
		return this;
	}
	public synchronized Executor executor() {
		return executor;
	}
	private BatchingMode batching = BatchingMode.IMMEDIATE;
	public synchronized Composition batching(BatchingMode batching) {
		Objects.requireNonNull(batching);
		ensureNotStarted();
		this.batching = batching;
		return this;
	}
	public synchronized BatchingMode batching() {
		return batching;
	}
	private int maxReexecutions = 10;
	/**
	 * Configures how many times a single scope may execute within one flush before it is stopped.
	 *
	 * @param maxReexecutions
	 *            positive execution ceiling, 10 by default
	 * @return {@code this} (fluent method)
	 * @see SchedulingOverflowException
	 */
	public synchronized Composition maxReexecutions(int maxReexecutions) {
		if (maxReexecutions <= 0)
			throw new IllegalArgumentException("Execution ceiling must be positive.");
		ensureNotStarted();
		this.maxReexecutions = maxReexecutions;
		return this;
	}
	public synchronized int maxReexecutions() {
		return maxReexecutions;
	}
	private Gson gson = new Gson();
	public synchronized Composition gson(Gson gson) {
		Objects.requireNonNull(gson);
		ensureNotStarted();
		this.gson = gson;
		return this;
	}
	public synchronized Gson gson() {
		return gson;
	}
	private RenderScope root;
	public RenderScope root() {
		synchronized (scheduler) {
			return root;
		}
	}
	/**
	 * Executes the root render function and everything it places.
	 * Effects scheduled by the initial pass run before this method returns.
	 * If a renderer is attached, it receives the whole tree.
	 *
	 * @return {@code this} (fluent method)
	 * @throws IllegalStateException
	 *             if the composition was already started
	 */
	public Composition start() {
		synchronized (this) {
			ensureNotStarted();
			started = true;
		}
		active.add(this);
		synchronized (scheduler) {
			root = new RenderScope(this, null, rootKey, NodePath.root(rootKey), content);
			scheduler.batch(() -> {
				root.execute();
				runEffects();
				Renderer attached = renderer;
				if (attached != null && !root.pending())
					ExceptionLogging.log(logger).run(() -> attached.createOrUpdate(root.path(), root.snapshot()));
			});
		}
		logger.debug("Started composition {}.", this);
		return this;
	}
	private final List<Runnable> effects = new ArrayList<>();
	void scheduleEffects(List<Runnable> scheduled) {
		synchronized (scheduler) {
			effects.addAll(scheduled);
		}
	}
	void runEffects() {
		synchronized (scheduler) {
			while (!effects.isEmpty()) {
				List<Runnable> batch = new ArrayList<>(effects);
				effects.clear();
				for (Runnable effect : batch)
					ExceptionLogging.log(logger).run(effect);
			}
		}
	}
	public void flush() {
		scheduler.flush();
	}
	public void batch(Runnable action) {
		scheduler.batch(action);
	}
	private void ensureStarted() {
		if (!started)
			throw new IllegalStateException("Composition has not been started yet.");
	}
	/**
	 * Returns immutable snapshot of the current tree. Pending scopes contribute their previous output.
	 *
	 * @return root of the component tree
	 */
	public ComponentNode snapshot() {
		ensureStarted();
		synchronized (scheduler) {
			return root.snapshot();
		}
	}
	/**
	 * Returns live event handlers of all interactive nodes keyed by node path.
	 *
	 * @return map from node path to handlers keyed by event name
	 */
	public Map<NodePath, Map<String, EventHandler>> handlers() {
		ensureStarted();
		Map<NodePath, Map<String, EventHandler>> collected = new LinkedHashMap<>();
		synchronized (scheduler) {
			root.collectHandlers(collected);
		}
		return Collections.unmodifiableMap(collected);
	}
	/**
	 * Returns values of saveable state keyed by registry key.
	 * Values of live saveable cells take precedence over values stored in the registry.
	 *
	 * @return serializable state of this composition
	 */
	public Map<String, Object> stateData() {
		Map<String, Object> collected = new LinkedHashMap<>();
		StateRegistry registry = registry();
		for (String key : registry.keys())
			registry.get(key).ifPresent(v -> collected.put(key, v));
		synchronized (scheduler) {
			if (root != null)
				root.collectState(collected);
		}
		return Collections.unmodifiableMap(collected);
	}
	/**
	 * Disposes all scopes. Effect cleanups run and saveable state is written back to the registry.
	 */
	@Override
	public void close() {
		synchronized (scheduler) {
			if (closed)
				return;
			closed = true;
			if (root != null)
				root.dispose();
		}
		active.remove(this);
		logger.debug("Closed composition {}.", this);
	}
	@Override
	public String toString() {
		return OwnerTrace.of(this).toString();
	}
}
