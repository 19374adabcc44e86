// Part of Recompose: https://recompose.machinezoo.com
package com.machinezoo.recompose;

import java.util.*;
import java.util.concurrent.*;
import java.util.function.*;
import com.machinezoo.recompose.tree.*;
import com.machinezoo.stagean.*;

/*
 * Builders are thin views over the live output of the executing scope.
 * They are only valid while the render function that received them runs.
 */
/**
 * Receiver of render function output and entry point to hooks.
 * Every render function emits exactly one root element. The root element takes the key of the render scope.
 * Nested elements get their position among siblings as their key unless an explicit key is configured
 * via {@link ElementBuilder#key(String)}.
 * <p>
 * Hook methods ({@link #state(Object)}, {@link #remember(Supplier)}, {@link #effect(Object, Supplier)}, {@link #async(Object, Supplier)})
 * store their data in positional slots of the current scope. They must be called in the same order on every execution.
 */
@DraftDocs("examples")
public class UiBuilder {
	final RenderScope scope;
	/*
	 * Element receiving children. It is null for the root-level builder passed to the render function.
	 */
	final LiveNode container;
	private LiveNode root;
	LiveNode root() {
		return root;
	}
	UiBuilder(RenderScope scope, LiveNode container) {
		this.scope = scope;
		this.container = container;
	}
	NodePath path() {
		return scope.path();
	}
	void checkExecuting() {
		if (!scope.executing() || RenderScope.current() != scope)
			throw new IllegalStateException("Builder can be only used while its render function executes.");
	}
	/*
	 * Positional key is the child's index unless an explicitly keyed sibling already took it.
	 * Then the next free index is used.
	 */
	private String nextKey(String explicit) {
		if (explicit == null) {
			int index = container.children.size();
			while (container.hasChildKey(Integer.toString(index)))
				++index;
			return Integer.toString(index);
		}
		String key = NodePath.checkKey(explicit);
		if (container.hasChildKey(key))
			throw new IllegalStateException("Duplicate child key '" + key + "' under " + path() + ".");
		return key;
	}
	public ElementBuilder element(String type) {
		Objects.requireNonNull(type);
		checkExecuting();
		if (container == null) {
			if (root != null)
				throw new IllegalStateException("Render function of scope " + scope.path() + " emitted more than one root element.");
			root = new LiveNode(type, scope.key());
			return new ElementBuilder(scope, root, null);
		}
		LiveNode node = new LiveNode(type, nextKey(null));
		container.children.add(node);
		return new ElementBuilder(scope, node, this);
	}
	public ElementBuilder element(String type, Consumer<ElementBuilder> body) {
		Objects.requireNonNull(body);
		ElementBuilder element = element(type);
		body.accept(element);
		return element;
	}
	public UiBuilder text(Object value) {
		element("#text").prop("value", Objects.toString(value));
		return this;
	}
	/**
	 * Places child render scope with positional key.
	 *
	 * @param function
	 *            render function of the child scope
	 * @return {@code this} (fluent method)
	 * @see #scope(String, Object, RenderFunction)
	 */
	public UiBuilder scope(RenderFunction function) {
		return place(null, null, false, function);
	}
	public UiBuilder scope(String key, RenderFunction function) {
		return place(key, null, false, function);
	}
	/**
	 * Places child render scope with explicit key and inputs.
	 * If the child scope already exists, it is not invalidated, and its inputs are equal to the previous ones,
	 * its execution is skipped and its previous output is reused.
	 *
	 * @param key
	 *            key of the child scope or {@code null} for positional key
	 * @param inputs
	 *            data the render function depends on, compared with {@link Object#equals(Object)}
	 * @param function
	 *            render function of the child scope
	 * @return {@code this} (fluent method)
	 * @throws IllegalStateException
	 *             if called at root level or if the key is already used by a sibling
	 */
	public UiBuilder scope(String key, Object inputs, RenderFunction function) {
		return place(key, inputs, true, function);
	}
	/**
	 * Places child render scope that provides value of a {@link CompositionLocal} to itself and all its descendants.
	 * When the provided value changes, scopes that read the local are re-executed.
	 *
	 * @param <T>
	 *            type of the value
	 * @param local
	 *            local to provide
	 * @param value
	 *            provided value, may be {@code null}
	 * @param function
	 *            render function of the child scope
	 * @return {@code this} (fluent method)
	 * @throws IllegalStateException
	 *             if called at root level
	 */
	public <T> UiBuilder provide(CompositionLocal<T> local, T value, RenderFunction function) {
		return provide(null, local, value, function);
	}
	public <T> UiBuilder provide(String key, CompositionLocal<T> local, T value, RenderFunction function) {
		Objects.requireNonNull(local);
		return place(key, null, false, function, Collections.<CompositionLocal<?>, Object>singletonMap(local, value));
	}
	/**
	 * Reads value of a {@link CompositionLocal} provided by the nearest ancestor scope (or this scope).
	 * The read is tracked like any cell read.
	 *
	 * @param <T>
	 *            type of the value
	 * @param local
	 *            local to read
	 * @return provided value or the local's default value
	 * @throws IllegalStateException
	 *             if the local is required and no scope provides it
	 */
	public <T> T local(CompositionLocal<T> local) {
		checkExecuting();
		return scope.local(local);
	}
	private UiBuilder place(String key, Object inputs, boolean skippable, RenderFunction function) {
		return place(key, inputs, skippable, function, Collections.emptyMap());
	}
	private UiBuilder place(String key, Object inputs, boolean skippable, RenderFunction function, Map<CompositionLocal<?>, Object> provisions) {
		Objects.requireNonNull(function);
		checkExecuting();
		if (container == null)
			throw new IllegalStateException("Child scope must be placed inside the root element of scope " + scope.path() + ".");
		String childKey = nextKey(key);
		RenderScope child = scope.place(path().child(childKey), inputs, skippable, function, provisions);
		container.children.add(child);
		return this;
	}
	public <T> StateCell<T> state(T initial) {
		return scope.state(initial);
	}
	/**
	 * Declares saveable state. Its value is restored from and written back to the composition's {@link StateRegistry}
	 * under registry key composed of scope path and the given key.
	 *
	 * @param <T>
	 *            type of the value
	 * @param key
	 *            key unique within this scope
	 * @param type
	 *            class of the value, used to convert serialized data
	 * @param initial
	 *            value used when the registry has no entry
	 * @return state cell persisting across scope disposal
	 */
	public <T> StateCell<T> state(String key, Class<T> type, T initial) {
		return scope.saveable(key, type, initial);
	}
	public <T> T remember(Supplier<T> supplier) {
		return scope.remember(null, supplier);
	}
	public <T> T remember(Object key, Supplier<T> supplier) {
		return scope.remember(key, supplier);
	}
	/**
	 * Schedules side effect to run after the current flush completes.
	 * The effect runs again whenever the key changes. Cleanup returned by the previous run is called first.
	 * Last cleanup runs when the scope is disposed.
	 *
	 * @param key
	 *            key of the effect
	 * @param effect
	 *            effect returning cleanup action or {@code null}
	 */
	public void effect(Object key, Supplier<Runnable> effect) {
		scope.effect(key, effect);
	}
	public <T> AsyncValue<T> async(Object key, Supplier<CompletableFuture<T>> supplier) {
		return scope.async(key, supplier);
	}
	public Composition composition() {
		return scope.composition();
	}
}
