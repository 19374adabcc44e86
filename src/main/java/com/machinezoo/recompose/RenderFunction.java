// Part of Recompose: https://recompose.machinezoo.com
package com.machinezoo.recompose;

/**
 * Render function describing UI from current state.
 * Every invocation site of a render function gets its own {@link RenderScope},
 * which re-executes the function whenever any {@link StateCell} it read changes.
 * The function must emit at most one root element through the supplied {@link UiBuilder}.
 */
@FunctionalInterface
public interface RenderFunction {
	void render(UiBuilder ui);
}
