// Part of Recompose: https://recompose.machinezoo.com
package com.machinezoo.recompose;

import static org.awaitility.Awaitility.*;
import org.awaitility.pollinterval.*;
import org.junit.jupiter.api.*;
import com.machinezoo.noexception.*;
import com.machinezoo.recompose.tree.*;

public abstract class TestBase {
	@BeforeAll
	public static void awaitility() {
		setDefaultPollInterval(new FibonacciPollInterval());
	}
	public static void sleep(int millis) {
		Exceptions.sneak().run(() -> Thread.sleep(millis));
	}
	public static void settle() {
		sleep(100);
	}
	public static ComponentNode node(Composition composition, String path) {
		return composition.snapshot().find(NodePath.parse(path)).orElseThrow(() -> new AssertionError("No node at " + path));
	}
	public static int number(Composition composition, String path) {
		return node(composition, path).prop("value").asNumber().intValue();
	}
}
