// Part of Recompose: https://recompose.machinezoo.com
package com.machinezoo.recompose;

/**
 * Live event handler attached to an interactive node.
 * Handlers never leave the process. Snapshots only record event names.
 * Renderers receive handlers through {@link Renderer#bindMarker(String, java.util.Map)}.
 */
@FunctionalInterface
public interface EventHandler {
	/**
	 * Handles event raised by the presentation layer.
	 *
	 * @param event
	 *            renderer-specific event payload, possibly {@code null}
	 */
	void handle(Object event);
}
