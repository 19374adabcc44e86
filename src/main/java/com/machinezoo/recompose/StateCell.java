// Part of Recompose: https://recompose.machinezoo.com
package com.machinezoo.recompose;

import java.util.*;
import java.util.concurrent.*;
import java.util.function.*;
import com.machinezoo.recompose.util.*;
import com.machinezoo.stagean.*;
import io.opentracing.*;
import io.opentracing.util.*;

/**
 * Observable mutable value and the unit of dependency tracking.
 * Reading the cell from within an executing {@link RenderScope} registers the scope as a reader.
 * Writing a value that differs from the current one increments {@link #version()}
 * and invalidates all registered readers through their {@link Composition}'s scheduler.
 * Readers are then forgotten. They subscribe again when they execute next time,
 * so a scope that stops reading the cell is no longer invalidated by it.
 * <p>
 * Cells are usually declared inside render functions via {@link UiBuilder#state(Object)},
 * which keeps the cell alive across re-executions of the declaring scope.
 * They can be also created directly and shared between scopes of one composition.
 *
 * @param <T>
 *            type of the stored value
 *
 * @see UiBuilder#state(Object)
 * @see RenderScope
 */
@DraftDocs("link to composition docs")
public class StateCell<T> {
	/*
	 * Full equality is the default, because render functions commonly write the same value again,
	 * for example when an event handler sets a flag that is already set.
	 * Every such write would otherwise re-execute all readers.
	 */
	private volatile boolean equality = true;
	public boolean equality() {
		return equality;
	}
	/**
	 * Configures full ({@link Object#equals(Object)}) or reference equality for change detection on write.
	 *
	 * @param equality
	 *            {@code true} for full equality, {@code false} for reference equality
	 * @return {@code this} (fluent method)
	 */
	public StateCell<T> equality(boolean equality) {
		this.equality = equality;
		return this;
	}
	/*
	 * Versions start at 1, so that 0 can mean "no version" in dependency maps.
	 */
	private volatile long version = 1;
	/**
	 * Returns current version of this cell. Initial version is 1 and every effective write increments it.
	 * Reading the version does not register any dependency.
	 *
	 * @return current version
	 */
	public long version() {
		return version;
	}
	/*
	 * Readers are held weakly. Strong references only go from scopes to cells.
	 * A cell shared by several compositions must not keep disposed compositions alive.
	 */
	private Set<RenderScope> readers = newReaderSet();
	private static Set<RenderScope> newReaderSet() {
		return Collections.newSetFromMap(new WeakHashMap<RenderScope, Boolean>());
	}
	synchronized void subscribe(RenderScope scope) {
		Objects.requireNonNull(scope);
		readers.add(scope);
	}
	synchronized void unsubscribe(RenderScope scope) {
		readers.remove(scope);
	}
	synchronized int readerCount() {
		return readers.size();
	}
	private volatile CellValue<T> value;
	/**
	 * Reads current {@link CellValue} and registers current {@link RenderScope} (if any) as a reader.
	 * Pending flag and exception are not propagated. Use {@link #get()} for that.
	 *
	 * @return current {@link CellValue}, never {@code null}
	 */
	public CellValue<T> value() {
		/*
		 * Register before reading the value. If a write sneaks in between, the scope sees the stale version and reschedules itself.
		 */
		RenderScope current = RenderScope.current();
		if (current != null)
			current.watch(this);
		return value;
	}
	/**
	 * Stores new {@link CellValue} and invalidates readers if the value actually changed.
	 * Writing a value equal to the current one (per {@link #equality()}) is a no-op:
	 * version stays the same, the old value instance is kept, and no scope is invalidated.
	 *
	 * @param value
	 *            new value
	 * @throws NullPointerException
	 *             if {@code value} is {@code null}
	 */
	public void value(CellValue<T> value) {
		Objects.requireNonNull(value);
		CellValue<T> previous = this.value;
		if (equality ? previous.equals(value) : previous.same(value))
			return;
		Set<RenderScope> notified = null;
		synchronized (this) {
			this.value = value;
			++version;
			if (!readers.isEmpty()) {
				notified = readers;
				readers = newReaderSet();
			}
		}
		if (notified != null) {
			Span span = GlobalTracer.get().buildSpan("recompose.change")
				.withTag("component", "recompose")
				.start();
			OwnerTrace.of(this).fill(span);
			try (Scope trace = GlobalTracer.get().activateSpan(span)) {
				/*
				 * Enqueue everything first and only then let schedulers flush,
				 * so that all readers of this write land in the same flush.
				 */
				Set<RecomposeScheduler> schedulers = new LinkedHashSet<>();
				for (RenderScope reader : new ArrayList<>(notified)) {
					RecomposeScheduler scheduler = reader.composition().scheduler();
					scheduler.enqueue(reader);
					schedulers.add(scheduler);
				}
				for (RecomposeScheduler scheduler : schedulers)
					scheduler.written();
			} finally {
				span.finish();
			}
		}
	}
	/**
	 * Returns the stored value and registers current {@link RenderScope} as a reader.
	 *
	 * @return current value
	 * @throws CompletionException
	 *             if the cell holds an exception
	 */
	public T get() {
		return value().get();
	}
	/**
	 * Returns the stored result without registering any dependency.
	 *
	 * @return current result, {@code null} if the cell holds an exception
	 */
	public T peek() {
		return value.result();
	}
	public void set(T value) {
		value(new CellValue<>(value));
	}
	/**
	 * Replaces the value with the result of applying {@code update} to the current value.
	 * The current value is read without registering a dependency.
	 *
	 * @param update
	 *            function computing new value from the old one
	 */
	public void update(UnaryOperator<T> update) {
		Objects.requireNonNull(update);
		set(update.apply(peek()));
	}
	private final int hashCode = ThreadLocalRandom.current().nextInt();
	@Override
	public int hashCode() {
		return hashCode;
	}
	public StateCell(CellValue<T> value) {
		Objects.requireNonNull(value);
		this.value = value;
		OwnerTrace.of(this).alias("cell");
	}
	public StateCell(T value) {
		this(new CellValue<>(value));
	}
	public StateCell() {
		this(new CellValue<>());
	}
	@Override
	public String toString() {
		return OwnerTrace.of(this) + " = " + value;
	}
}
