// Part of Recompose: https://recompose.machinezoo.com
package com.machinezoo.recompose.hydration;

/**
 * Observer of hydration progress and of degraded outcomes.
 * Hydration never throws for classified failures, so this is the place to report them.
 * All methods have empty default implementations.
 */
public interface HydrationListener {
	default void stateChanged(HydrationState state) {
	}
	default void deserializationFailed(HydrationException exception) {
	}
	default void subtreeMismatched(TreeIncompatibleException exception) {
	}
	default void markerUnbound(DomMarker marker) {
	}
	default void completed(HydrationResult result) {
	}
}
