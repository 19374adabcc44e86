// Part of Recompose: https://recompose.machinezoo.com
/**
 * Immutable snapshot of composition output.
 */
package com.machinezoo.recompose.tree;
