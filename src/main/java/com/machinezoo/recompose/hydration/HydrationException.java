// Part of Recompose: https://recompose.machinezoo.com
package com.machinezoo.recompose.hydration;

/**
 * Classified failure of hydration. Subclasses identify the failure class.
 * {@link HydrationSession} never lets these escape. It degrades to partial or full client rendering instead.
 */
public class HydrationException extends RuntimeException {
	private static final long serialVersionUID = 1L;
	public HydrationException(String message, Throwable cause) {
		super(message, cause);
	}
	public HydrationException(String message) {
		super(message);
	}
}
