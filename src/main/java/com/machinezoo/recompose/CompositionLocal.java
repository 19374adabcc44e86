// Part of Recompose: https://recompose.machinezoo.com
package com.machinezoo.recompose;

import java.util.*;
import com.machinezoo.recompose.util.*;
import com.machinezoo.stagean.*;

/*
 * Locals carry no value of their own. Provided values are held by the providing scope in a state cell,
 * so reading a local is an ordinary tracked read and providing a different value invalidates every reader below.
 */
/**
 * Value passed implicitly down the scope tree.
 * Render scopes provide a value via {@link UiBuilder#provide(CompositionLocal, Object, RenderFunction)}
 * and descendant scopes read the nearest provided value via {@link UiBuilder#local(CompositionLocal)}.
 *
 * @param <T>
 *            type of the value
 */
@DraftDocs("theming and dependency injection examples")
public final class CompositionLocal<T> {
	private final boolean required;
	public boolean required() {
		return required;
	}
	private final T fallback;
	private CompositionLocal(boolean required, T fallback) {
		this.required = required;
		this.fallback = fallback;
		OwnerTrace.of(this).alias("local");
	}
	/**
	 * Creates local that resolves to the given value where nothing is provided.
	 *
	 * @param <T>
	 *            type of the value
	 * @param fallback
	 *            default value, may be {@code null}
	 * @return new local
	 */
	public static <T> CompositionLocal<T> of(T fallback) {
		return new CompositionLocal<>(false, fallback);
	}
	/**
	 * Creates local that must be provided by some ancestor scope.
	 * Reading it where nothing is provided throws {@link IllegalStateException}.
	 *
	 * @param <T>
	 *            type of the value
	 * @return new local
	 */
	public static <T> CompositionLocal<T> required() {
		return new CompositionLocal<>(true, null);
	}
	public CompositionLocal<T> name(String name) {
		Objects.requireNonNull(name);
		OwnerTrace.of(this).tag("name", name);
		return this;
	}
	T fallback() {
		if (required)
			throw new IllegalStateException("No value of " + this + " is provided.");
		return fallback;
	}
	/**
	 * Reads the value provided to current {@link RenderScope}.
	 * Outside of render scopes, the default value is returned.
	 *
	 * @return nearest provided value or the default value
	 * @throws IllegalStateException
	 *             if the local is required and no value is provided
	 */
	public T current() {
		RenderScope scope = RenderScope.current();
		return scope != null ? scope.local(this) : fallback();
	}
	@Override
	public String toString() {
		return OwnerTrace.of(this).toString();
	}
}
