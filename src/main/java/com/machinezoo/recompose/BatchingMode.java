// Part of Recompose: https://recompose.machinezoo.com
package com.machinezoo.recompose;

/**
 * Determines when invalidated scopes are flushed.
 * Batching never drops invalidations. It only changes how many writes end up in one flush.
 *
 * @see Composition#batching(BatchingMode)
 */
public enum BatchingMode {
	/**
	 * Flush at the end of every write, or at the end of the outermost {@link Composition#batch(Runnable)}.
	 */
	IMMEDIATE,
	/**
	 * Flush only when {@link Composition#flush()} is called.
	 */
	MANUAL,
	/**
	 * Schedule one flush task on {@link Composition#executor()} for every burst of writes.
	 */
	EXECUTOR
}
