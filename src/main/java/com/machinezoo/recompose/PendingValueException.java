// Part of Recompose: https://recompose.machinezoo.com
package com.machinezoo.recompose;

/**
 * Thrown when a render function reads a value that is not available yet.
 * Throwing it through {@link #pending()} marks current {@link RenderScope} as pending.
 * Pending scopes are not treated as failed. They keep their previous output
 * and execute again once the awaited value issues an invalidation.
 */
public class PendingValueException extends RuntimeException {
	private static final long serialVersionUID = 1L;
	public PendingValueException(String message, Throwable cause) {
		super(message, cause);
	}
	public PendingValueException(String message) {
		this(message, null);
	}
	public PendingValueException() {
		this(null, null);
	}
	public static PendingValueException pending(String message) {
		CurrentRenderScope.markPending();
		throw new PendingValueException(message);
	}
	public static PendingValueException pending() {
		throw pending(null);
	}
}
