// Part of Recompose: https://recompose.machinezoo.com
package com.machinezoo.recompose;

import java.util.*;
import java.util.concurrent.*;
import org.slf4j.*;
import com.machinezoo.noexception.slf4j.*;
import com.machinezoo.recompose.util.*;
import com.machinezoo.stagean.*;

/*
 * Future state is transferred into a cell, so that render functions can read it like any other state
 * and get invalidated when the future completes.
 *
 * Completion can happen on any thread. It is handed to the composition's dispatcher,
 * which decides on which thread the cell write and the resulting flush happen.
 */
/**
 * Result of asynchronous operation observable from render functions.
 *
 * @param <T>
 *            type of the result
 * @see UiBuilder#async(Object, java.util.function.Supplier)
 */
@StubDocs
public class AsyncValue<T> {
	private static final Logger logger = LoggerFactory.getLogger(AsyncValue.class);
	private final CompletableFuture<T> future;
	public CompletableFuture<T> future() {
		return future;
	}
	private final StateCell<T> cell = OwnerTrace
		.of(new StateCell<T>(CellValue.waiting()))
		.parent(this)
		.target();
	public StateCell<T> cell() {
		return cell;
	}
	public AsyncValue(Composition composition, CompletableFuture<T> future) {
		Objects.requireNonNull(composition);
		Objects.requireNonNull(future);
		OwnerTrace.of(this).alias("async").parent(composition);
		this.future = future;
		future.whenComplete((result, exception) -> composition.dispatcher().execute(ExceptionLogging.log(logger).runnable(() -> complete(result, exception))));
	}
	private void complete(T result, Throwable exception) {
		if (exception instanceof CompletionException && exception.getCause() != null)
			exception = exception.getCause();
		if (exception != null)
			logger.debug("Asynchronous value failed.", exception);
		cell.value(new CellValue<>(exception == null ? result : null, exception, false));
	}
	/**
	 * Returns the result or marks current {@link RenderScope} as pending if the result is not available yet.
	 *
	 * @return result of the asynchronous operation
	 * @throws PendingValueException
	 *             if the operation is still running
	 * @throws CompletionException
	 *             if the operation failed
	 */
	public T get() {
		CellValue<T> value = cell.value();
		if (value.pending())
			throw PendingValueException.pending("Asynchronous value is not available yet.");
		return value.get();
	}
	/*
	 * Does not mark the scope pending. The scope still depends on the cell and re-executes when the value arrives.
	 */
	public T getNow(T fallback) {
		CellValue<T> value = cell.value();
		return value.pending() ? fallback : value.get();
	}
	public boolean done() {
		return !cell.value().pending();
	}
	@Override
	public String toString() {
		return OwnerTrace.of(this).toString();
	}
}
