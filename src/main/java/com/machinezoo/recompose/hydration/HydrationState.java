// Part of Recompose: https://recompose.machinezoo.com
package com.machinezoo.recompose.hydration;

/*
 * IDLE -> DESERIALIZING -> MATCHING -> ADOPTED
 *                                   \-> MISMATCHED -> ADOPTED_WITH_FALLBACK | FULL_CLIENT_RENDER
 * Deserialization failure goes straight to FULL_CLIENT_RENDER.
 */
public enum HydrationState {
	IDLE,
	DESERIALIZING,
	MATCHING,
	ADOPTED,
	MISMATCHED,
	ADOPTED_WITH_FALLBACK,
	FULL_CLIENT_RENDER;
	public boolean terminal() {
		return this == ADOPTED || this == ADOPTED_WITH_FALLBACK || this == FULL_CLIENT_RENDER;
	}
}
