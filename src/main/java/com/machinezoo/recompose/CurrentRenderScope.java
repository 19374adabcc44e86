// Part of Recompose: https://recompose.machinezoo.com
package com.machinezoo.recompose;

import com.machinezoo.closeablescope.*;
import com.machinezoo.stagean.*;

/*
 * Code reading cells is frequently called both from render functions and from event handlers or tests.
 * These helpers do the right thing whether there is current scope or not.
 */
@DraftDocs("link to pending scope docs")
public class CurrentRenderScope {
	public static void markPending() {
		RenderScope current = RenderScope.current();
		if (current != null)
			current.markPending();
	}
	public static boolean pending() {
		RenderScope current = RenderScope.current();
		return current != null && current.pending();
	}
	public static Composition composition() {
		RenderScope current = RenderScope.current();
		return current != null ? current.composition() : null;
	}
	/**
	 * Suspends dependency tracking until the returned scope is closed.
	 * Cells read in the meantime do not become dependencies of current {@link RenderScope}.
	 *
	 * @return scope restoring dependency tracking when closed
	 */
	public static CloseableScope untracked() {
		return RenderScope.ignore();
	}
}
