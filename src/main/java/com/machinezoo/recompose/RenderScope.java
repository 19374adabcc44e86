// Part of Recompose: https://recompose.machinezoo.com
package com.machinezoo.recompose;

import java.lang.ref.*;
import java.util.*;
import java.util.concurrent.*;
import java.util.function.*;
import org.slf4j.*;
import com.google.gson.*;
import com.machinezoo.closeablescope.*;
import com.machinezoo.noexception.slf4j.*;
import com.machinezoo.recompose.tree.*;
import com.machinezoo.recompose.util.*;
import com.machinezoo.stagean.*;
import io.micrometer.core.instrument.*;
import it.unimi.dsi.fastutil.objects.*;

/*
 * There is at most one current scope per thread. Cells consult it on every read to record dependencies.
 * Scopes nest when a parent's render function places a child scope. The child becomes current
 * for the duration of its execution and the parent is restored afterwards,
 * so reads inside the child are attributed to the child only.
 *
 * Scopes are deliberately not thread-safe. A composition runs on one logical thread.
 */
/**
 * One live invocation site of a {@link RenderFunction} and the unit of re-execution.
 * Scope identity is preserved across re-executions. It is determined by the scope's path relative to its parent,
 * which is derived from node keys. Scope is discarded when its parent's re-execution no longer places a scope there.
 */
@StubDocs
public class RenderScope {
	private static final Logger logger = LoggerFactory.getLogger(RenderScope.class);
	private static final Counter executionCount = Metrics.counter("recompose.scope.executions");
	private static final Counter failureCount = Metrics.counter("recompose.scope.failures");
	private static final ThreadLocal<RenderScope> current = new ThreadLocal<>();
	public static RenderScope current() {
		return current.get();
	}
	/*
	 * Previously current scope, restored when this one exits. Non-null only while the scope executes.
	 */
	private RenderScope previous;
	private boolean executing;
	boolean executing() {
		return executing;
	}
	CloseableScope enter() {
		if (executing)
			throw new IllegalStateException("Cannot execute the same render scope recursively.");
		executing = true;
		previous = current.get();
		current.set(this);
		return () -> {
			current.set(previous);
			previous = null;
			executing = false;
		};
	}
	static CloseableScope ignore() {
		RenderScope outer = current.get();
		current.set(null);
		return () -> current.set(outer);
	}
	private final Composition composition;
	public Composition composition() {
		return composition;
	}
	/*
	 * Scopes are owned top-down. The parent link is weak and only used for navigation and diagnostics.
	 */
	private final WeakReference<RenderScope> parent;
	public RenderScope parent() {
		return parent != null ? parent.get() : null;
	}
	private final String key;
	public String key() {
		return key;
	}
	private final NodePath path;
	public NodePath path() {
		return path;
	}
	private final int depth;
	public int depth() {
		return depth;
	}
	private RenderFunction function;
	private Object inputs;
	RenderScope(Composition composition, RenderScope parent, String key, NodePath path, RenderFunction function) {
		Objects.requireNonNull(composition);
		Objects.requireNonNull(function);
		this.composition = composition;
		this.parent = parent != null ? new WeakReference<>(parent) : null;
		this.key = NodePath.checkKey(key);
		this.path = path;
		this.depth = parent != null ? parent.depth + 1 : 0;
		this.function = function;
		OwnerTrace.of(this)
			.alias("scope")
			.parent(parent != null ? parent : composition)
			.tag("path", path);
	}
	/*
	 * Each cell is recorded with the version seen at the first read.
	 */
	private final Object2LongMap<StateCell<?>> dependencies = new Object2LongOpenHashMap<>();
	public Collection<StateCell<?>> dependencies() {
		return Collections.unmodifiableCollection(new ArrayList<>(dependencies.keySet()));
	}
	void watch(StateCell<?> cell) {
		Objects.requireNonNull(cell);
		if (!dependencies.containsKey(cell)) {
			dependencies.put(cell, cell.version());
			cell.subscribe(this);
		}
	}
	private void unsubscribe() {
		for (StateCell<?> cell : dependencies.keySet())
			cell.unsubscribe(this);
		dependencies.clear();
	}
	private boolean dirty;
	public boolean dirty() {
		return dirty;
	}
	void markDirty() {
		dirty = true;
	}
	private boolean pending;
	public boolean pending() {
		return pending;
	}
	void markPending() {
		pending = true;
	}
	private Throwable failure;
	public Throwable failure() {
		return failure;
	}
	private boolean stopped;
	public boolean stopped() {
		return stopped;
	}
	private boolean disposed;
	public boolean disposed() {
		return disposed;
	}
	private long executions;
	public long executions() {
		return executions;
	}
	private LiveNode output;
	/*
	 * Child scopes keyed by their path relative to this scope.
	 */
	private final Map<String, RenderScope> children = new LinkedHashMap<>();
	public Collection<RenderScope> children() {
		return Collections.unmodifiableCollection(new ArrayList<>(children.values()));
	}
	private Set<String> placed;
	private Set<String> saveableKeys;
	private List<Runnable> scheduledEffects;
	/**
	 * Executes the render function and replaces this scope's output.
	 * Previous dependencies are dropped first and the dependencies of this execution are recorded.
	 * Exceptions thrown by the render function are reported to the composition and do not propagate.
	 */
	void execute() {
		if (disposed || stopped)
			return;
		dirty = false;
		pending = false;
		unsubscribe();
		slotIndex = 0;
		placed = new HashSet<>();
		saveableKeys = new HashSet<>();
		scheduledEffects = new ArrayList<>();
		UiBuilder builder = new UiBuilder(this, null);
		Throwable exception = null;
		try (CloseableScope computation = enter()) {
			try {
				function.render(builder);
			} catch (PendingValueException ex) {
				pending = true;
			} catch (Throwable ex) {
				exception = ex;
			}
		}
		++executions;
		executionCount.increment();
		Set<String> produced = placed;
		List<Runnable> effects = scheduledEffects;
		placed = null;
		saveableKeys = null;
		scheduledEffects = null;
		if (pending) {
			/*
			 * Pending execution is incomplete. Keep showing the previous output
			 * and keep children it references, so that their state survives the wait.
			 */
			if (output == null)
				output = LiveNode.placeholder("#pending");
			Set<RenderScope> referenced = new HashSet<>();
			output.collectScopes(referenced);
			retainChildren(id -> produced.contains(id) || referenced.contains(children.get(id)));
			logger.debug("Scope {} is waiting for pending value.", path);
			return;
		}
		if (exception != null) {
			failure = exception;
			failureCount.increment();
			output = errorNode(exception);
			retainChildren(id -> false);
			composition.report(this, exception);
			return;
		}
		failure = null;
		output = builder.root() != null ? builder.root() : LiveNode.placeholder("#empty");
		retainChildren(produced::contains);
		if (!effects.isEmpty())
			composition.scheduleEffects(effects);
	}
	private static LiveNode errorNode(Throwable exception) {
		LiveNode node = LiveNode.placeholder("#error");
		node.props.put("message", PropValue.of(String.valueOf(exception.getMessage())));
		node.props.put("exception", PropValue.of(exception.getClass().getName()));
		return node;
	}
	private void retainChildren(Predicate<String> kept) {
		for (Iterator<Map.Entry<String, RenderScope>> iterator = children.entrySet().iterator(); iterator.hasNext();) {
			Map.Entry<String, RenderScope> entry = iterator.next();
			if (!kept.test(entry.getKey())) {
				entry.getValue().dispose();
				iterator.remove();
			}
		}
	}
	/*
	 * Called by UiBuilder when the render function places a child scope.
	 * Reuses the existing child at the same relative path or creates a new one.
	 */
	RenderScope place(NodePath childPath, Object inputs, boolean skippable, RenderFunction function) {
		return place(childPath, inputs, skippable, function, Collections.emptyMap());
	}
	/*
	 * Provided values are written before the skip check, so that readers among descendants are already invalidated
	 * by the time the provider decides what to re-execute.
	 */
	RenderScope place(NodePath childPath, Object inputs, boolean skippable, RenderFunction function, Map<CompositionLocal<?>, Object> provisions) {
		String id = relativeId(childPath);
		if (!placed.add(id))
			throw new IllegalStateException("Duplicate scope key at " + childPath + ".");
		RenderScope child = children.get(id);
		if (child != null && !child.provided.keySet().equals(provisions.keySet())) {
			/*
			 * Readers of a local that is no longer provided here would never learn about it. Start over.
			 */
			child.dispose();
			children.remove(id);
			child = null;
		}
		if (child == null) {
			child = new RenderScope(composition, this, childPath.last(), childPath, function);
			children.put(id, child);
			for (Map.Entry<CompositionLocal<?>, Object> provision : provisions.entrySet())
				child.provided.put(provision.getKey(), OwnerTrace.of(new StateCell<Object>(provision.getValue())).parent(child).tag("local", provision.getKey()).target());
		} else {
			for (Map.Entry<CompositionLocal<?>, Object> provision : provisions.entrySet())
				child.provided.get(provision.getKey()).set(provision.getValue());
		}
		if (skippable && !child.dirty && child.output != null && child.failure == null && !child.pending && Objects.equals(child.inputs, inputs)) {
			return child;
		}
		child.function = function;
		child.inputs = inputs;
		child.execute();
		return child;
	}
	/*
	 * Values this scope provides to itself and its descendants.
	 */
	private final Map<CompositionLocal<?>, StateCell<Object>> provided = new HashMap<>();
	/*
	 * Nearest provider wins. The provided cell is read with tracking, so this scope re-executes when the value changes.
	 */
	@SuppressWarnings("unchecked")
	<T> T local(CompositionLocal<T> local) {
		Objects.requireNonNull(local);
		for (RenderScope scope = this; scope != null; scope = scope.parent()) {
			StateCell<Object> cell = scope.provided.get(local);
			if (cell != null)
				return (T)cell.get();
		}
		return local.fallback();
	}
	private String relativeId(NodePath childPath) {
		return String.join("/", childPath.keys().subList(path.depth(), childPath.depth()));
	}
	/*
	 * Hooks are stored in positional slots. Slot order must be the same in every execution.
	 */
	private final List<Slot> slots = new ArrayList<>();
	private int slotIndex;
	private static abstract class Slot {
	}
	private static class StateSlot extends Slot {
		StateCell<?> cell;
	}
	private static class SaveableSlot extends Slot {
		String registryKey;
		StateCell<?> cell;
	}
	private static class RememberSlot extends Slot {
		boolean initialized;
		Object key;
		Object value;
	}
	private static class EffectSlot extends Slot {
		boolean initialized;
		Object key;
		Runnable cleanup;
	}
	private <S extends Slot> S slot(Class<S> kind, Supplier<S> factory) {
		if (!executing)
			throw new IllegalStateException("Hooks can be only used while the render function executes.");
		if (slotIndex < slots.size()) {
			Slot slot = slots.get(slotIndex++);
			if (!kind.isInstance(slot))
				throw new IllegalStateException("Hook order changed in scope " + path + " at slot " + (slotIndex - 1) + ".");
			return kind.cast(slot);
		}
		S slot = factory.get();
		slots.add(slot);
		++slotIndex;
		return slot;
	}
	@SuppressWarnings("unchecked")
	<T> StateCell<T> state(T initial) {
		StateSlot slot = slot(StateSlot.class, StateSlot::new);
		if (slot.cell == null)
			slot.cell = OwnerTrace.of(new StateCell<>(initial)).parent(this).tag("slot", slotIndex - 1).target();
		return (StateCell<T>)slot.cell;
	}
	@SuppressWarnings("unchecked")
	<T> StateCell<T> saveable(String key, Class<T> type, T initial) {
		Objects.requireNonNull(key);
		Objects.requireNonNull(type);
		if (!saveableKeys.add(key))
			throw new IllegalStateException("Duplicate saveable state key '" + key + "' in scope " + path + ".");
		SaveableSlot slot = slot(SaveableSlot.class, SaveableSlot::new);
		String registryKey = path + "#" + key;
		if (slot.cell == null || !registryKey.equals(slot.registryKey)) {
			slot.registryKey = registryKey;
			slot.cell = OwnerTrace.of(new StateCell<>(restore(registryKey, type, initial))).parent(this).tag("key", key).target();
		}
		return (StateCell<T>)slot.cell;
	}
	/*
	 * Values that arrived with hydration are still JSON trees. They are converted on first use, when the type is finally known.
	 */
	private <T> T restore(String registryKey, Class<T> type, T initial) {
		Optional<Object> stored = composition.registry().get(registryKey);
		if (!stored.isPresent())
			return initial;
		Object value = stored.get();
		try {
			if (value instanceof JsonElement)
				return composition.gson().fromJson((JsonElement)value, type);
			if (type.isInstance(value))
				return type.cast(value);
		} catch (JsonParseException ex) {
			logger.warn("Cannot restore state {} as {}.", registryKey, type.getName(), ex);
			return initial;
		}
		logger.warn("Stored state {} is of type {}, expected {}.", registryKey, value.getClass().getName(), type.getName());
		return initial;
	}
	@SuppressWarnings("unchecked")
	<T> T remember(Object key, Supplier<T> supplier) {
		Objects.requireNonNull(supplier);
		RememberSlot slot = slot(RememberSlot.class, RememberSlot::new);
		if (!slot.initialized || !Objects.equals(slot.key, key)) {
			slot.value = supplier.get();
			slot.key = key;
			slot.initialized = true;
		}
		return (T)slot.value;
	}
	void effect(Object key, Supplier<Runnable> effect) {
		Objects.requireNonNull(effect);
		EffectSlot slot = slot(EffectSlot.class, EffectSlot::new);
		if (slot.initialized && Objects.equals(slot.key, key))
			return;
		/*
		 * The key is committed only when the effect actually runs. If this execution turns out pending or failed,
		 * the effect is dropped and the next execution schedules it again.
		 */
		scheduledEffects.add(() -> {
			if (disposed || (slot.initialized && Objects.equals(slot.key, key)))
				return;
			cleanup(slot);
			slot.initialized = true;
			slot.key = key;
			slot.cleanup = effect.get();
		});
	}
	private void cleanup(EffectSlot slot) {
		Runnable cleanup = slot.cleanup;
		slot.cleanup = null;
		if (cleanup != null)
			ExceptionLogging.log(logger).run(cleanup);
	}
	<T> AsyncValue<T> async(Object key, Supplier<CompletableFuture<T>> supplier) {
		Objects.requireNonNull(supplier);
		return remember(key, () -> {
			try (CloseableScope untracked = ignore()) {
				return new AsyncValue<>(composition, supplier.get());
			}
		});
	}
	void stop(Throwable exception) {
		if (stopped)
			return;
		stopped = true;
		failure = exception;
		failureCount.increment();
		unsubscribe();
		retainChildren(id -> false);
		output = errorNode(exception);
		composition.report(this, exception);
	}
	/**
	 * Permanently tears down this scope and its descendants.
	 * Effect cleanups run, saveable cells are written back to the state registry, and dependencies are dropped.
	 */
	void dispose() {
		if (disposed)
			return;
		disposed = true;
		for (RenderScope child : children.values())
			child.dispose();
		children.clear();
		for (Slot slot : slots) {
			if (slot instanceof EffectSlot)
				cleanup((EffectSlot)slot);
			else if (slot instanceof SaveableSlot) {
				SaveableSlot saveable = (SaveableSlot)slot;
				composition.registry().set(saveable.registryKey, saveable.cell.peek());
			}
		}
		slots.clear();
		unsubscribe();
		logger.trace("Disposed scope {}.", path);
	}
	/**
	 * Returns snapshot of this scope's latest output including output of descendant scopes.
	 *
	 * @return snapshot of the subtree rendered by this scope
	 */
	public ComponentNode snapshot() {
		LiveNode root = output != null ? output : LiveNode.placeholder("#pending");
		return root.snapshot(key);
	}
	void collectHandlers(Map<NodePath, Map<String, EventHandler>> collected) {
		if (output != null)
			output.collectHandlers(path, collected);
	}
	void collectState(Map<String, Object> collected) {
		for (Slot slot : slots) {
			if (slot instanceof SaveableSlot) {
				SaveableSlot saveable = (SaveableSlot)slot;
				collected.put(saveable.registryKey, saveable.cell.peek());
			}
		}
		for (RenderScope child : children.values())
			child.collectState(collected);
	}
	private final int hashCode = ThreadLocalRandom.current().nextInt();
	@Override
	public int hashCode() {
		return hashCode;
	}
	@Override
	public String toString() {
		return OwnerTrace.of(this).toString();
	}
}
