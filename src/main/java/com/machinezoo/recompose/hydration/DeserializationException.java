// Part of Recompose: https://recompose.machinezoo.com
package com.machinezoo.recompose.hydration;

import java.util.*;

/**
 * Hydration context data could not be turned into {@link HydrationContext}.
 * This always results in full client rendering of the whole root.
 */
public class DeserializationException extends HydrationException {
	private static final long serialVersionUID = 1L;
	public enum Reason {
		/*
		 * Input is not well-formed JSON.
		 */
		MALFORMED_JSON,
		/*
		 * JSON is well-formed, but the top-level value or some nested value is not an object where one is required.
		 */
		NOT_AN_OBJECT,
		MISSING_FIELD,
		INVALID_FIELD,
		DUPLICATE_MARKER
	}
	private final Reason reason;
	public Reason reason() {
		return reason;
	}
	public DeserializationException(Reason reason, String message, Throwable cause) {
		super(message, cause);
		Objects.requireNonNull(reason);
		this.reason = reason;
	}
	public DeserializationException(Reason reason, String message) {
		this(reason, message, null);
	}
}
