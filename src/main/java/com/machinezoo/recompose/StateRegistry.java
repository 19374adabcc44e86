// Part of Recompose: https://recompose.machinezoo.com
package com.machinezoo.recompose;

import java.util.*;
import com.machinezoo.stagean.*;

/**
 * Key-value store consulted to seed saveable {@link StateCell}s across teardown and recreation of their scope.
 * Every {@link Composition} has its own registry, so that concurrently running compositions,
 * for example ones serving different requests, never see each other's state.
 * The registry is not part of the reactive graph. Reads and writes do not invalidate anything.
 *
 * @see UiBuilder#state(String, Class, Object)
 */
@StubDocs
public interface StateRegistry {
	Optional<Object> get(String key);
	void set(String key, Object value);
	void remove(String key);
	Set<String> keys();
}
