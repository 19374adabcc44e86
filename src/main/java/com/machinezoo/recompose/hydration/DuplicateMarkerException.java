// Part of Recompose: https://recompose.machinezoo.com
package com.machinezoo.recompose.hydration;

/**
 * Two hydration markers in one context share an id. Markers must be unambiguous, so the context is rejected.
 */
public class DuplicateMarkerException extends HydrationException {
	private static final long serialVersionUID = 1L;
	private final String markerId;
	public String markerId() {
		return markerId;
	}
	public DuplicateMarkerException(String markerId) {
		super("Duplicate hydration marker id: " + markerId);
		this.markerId = markerId;
	}
}
