// Part of Recompose: https://recompose.machinezoo.com
/*
 * Diagnostic functions supported by runtime objects:
 * - Null check is performed on method parameters where appropriate.
 * - Exceptions from application code (render functions, effects, handlers, renderer) are always handled. Those with nowhere to go are logged.
 * - Metrics are exposed by scopes, the scheduler, and compositions.
 * - Opentracing spans are created around flushes and effective state changes.
 * - Object's OwnerTrace has at least an alias. Identifying parameters of the object are added as tags.
 * - Method toString() is defined and it never creates reactive dependencies.
 */
/**
 * State cells, render scopes, scheduler, and the composition that ties them together.
 */
package com.machinezoo.recompose;
