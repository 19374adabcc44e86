// Part of Recompose: https://recompose.machinezoo.com
package com.machinezoo.recompose;

import java.util.*;
import java.util.concurrent.*;
import com.machinezoo.stagean.*;

/*
 * Cells hold this triple rather than a bare value, so that asynchronous sources can park
 * "not yet available" and "failed" states in a cell and let render functions observe them like any other value.
 */
/**
 * Immutable content of {@link StateCell} consisting of result, exception, and pending flag.
 * Pending value signals that the real value is not available yet, typically because an asynchronous operation is in flight.
 *
 * @param <T>
 *            type of the result
 *
 * @see StateCell#value()
 * @see AsyncValue
 */
@DraftDocs("explain pending scopes")
public class CellValue<T> {
	private final T result;
	public T result() {
		return result;
	}
	private final Throwable exception;
	public Throwable exception() {
		return exception;
	}
	private final boolean pending;
	public boolean pending() {
		return pending;
	}
	/**
	 * Creates new {@link CellValue} from its components.
	 *
	 * @param result
	 *            result value, possibly {@code null}
	 * @param exception
	 *            exception or {@code null}
	 * @param pending
	 *            {@code true} if the value is not available yet
	 * @throws IllegalArgumentException
	 *             if both {@code result} and {@code exception} are non-{@code null}
	 */
	public CellValue(T result, Throwable exception, boolean pending) {
		if (result != null && exception != null)
			throw new IllegalArgumentException("Cannot set both the result and the exception.");
		this.result = result;
		this.exception = exception;
		this.pending = pending;
	}
	public CellValue(T result) {
		this(result, null, false);
	}
	public CellValue() {
		this(null, null, false);
	}
	public static <T> CellValue<T> failed(Throwable exception) {
		Objects.requireNonNull(exception);
		return new CellValue<>(null, exception, false);
	}
	public static <T> CellValue<T> waiting() {
		return new CellValue<>(null, new PendingValueException(), true);
	}
	/**
	 * Unpacks this value into current render scope.
	 * If the value is pending, current {@link RenderScope} (if any) is marked as pending.
	 * Stored exception is rethrown wrapped in {@link CompletionException}.
	 *
	 * @return the result
	 * @throws CompletionException
	 *             if this value holds an exception
	 */
	public T get() {
		if (pending)
			CurrentRenderScope.markPending();
		if (exception != null)
			throw new CompletionException(exception);
		return result;
	}
	/*
	 * Exceptions are compared by identity. Two distinct failures are two distinct changes even if they look alike.
	 */
	@Override
	public boolean equals(Object obj) {
		if (this == obj)
			return true;
		if (!(obj instanceof CellValue))
			return false;
		CellValue<?> other = (CellValue<?>)obj;
		return pending == other.pending && exception == other.exception && Objects.equals(result, other.result);
	}
	@Override
	public int hashCode() {
		return Objects.hash(result, System.identityHashCode(exception), pending);
	}
	public boolean same(CellValue<?> other) {
		return other != null && result == other.result && exception == other.exception && pending == other.pending;
	}
	@Override
	public String toString() {
		return (exception == null ? Objects.toString(result) : exception.toString()) + (pending ? " [pending]" : "");
	}
}
