// Part of Recompose: https://recompose.machinezoo.com
package com.machinezoo.recompose;

/**
 * Raised when a {@link RenderScope} keeps invalidating itself within one flush beyond the configured ceiling.
 * This is typically caused by a render function that reads a cell and then unconditionally writes a new value into it.
 * The offending scope is stopped. The rest of the composition continues to work.
 *
 * @see Composition#maxReexecutions(int)
 */
public class SchedulingOverflowException extends RuntimeException {
	private static final long serialVersionUID = 1L;
	private final transient RenderScope scope;
	public RenderScope scope() {
		return scope;
	}
	private final int executions;
	public int executions() {
		return executions;
	}
	public SchedulingOverflowException(RenderScope scope, int executions) {
		super("Scope " + scope.path() + " was invalidated " + executions + " times in one flush.");
		this.scope = scope;
		this.executions = executions;
	}
}
