// Part of Recompose: https://recompose.machinezoo.com
package com.machinezoo.recompose.hydration;

import java.util.*;

/**
 * Outcome of {@link HydrationSession}.
 */
public final class HydrationResult {
	private final HydrationState state;
	public HydrationState state() {
		return state;
	}
	private final HydrationContext context;
	public Optional<HydrationContext> context() {
		return Optional.ofNullable(context);
	}
	private final AdoptionPlan plan;
	public AdoptionPlan plan() {
		return plan;
	}
	private final HydrationException failure;
	public Optional<HydrationException> failure() {
		return Optional.ofNullable(failure);
	}
	HydrationResult(HydrationState state, HydrationContext context, AdoptionPlan plan, HydrationException failure) {
		Objects.requireNonNull(state);
		Objects.requireNonNull(plan);
		this.state = state;
		this.context = context;
		this.plan = plan;
		this.failure = failure;
	}
	@Override
	public String toString() {
		return state + ": " + plan;
	}
}
