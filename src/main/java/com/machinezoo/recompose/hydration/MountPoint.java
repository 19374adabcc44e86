// Part of Recompose: https://recompose.machinezoo.com
package com.machinezoo.recompose.hydration;

import java.util.*;

/**
 * Presentation-side container the server markup was rendered into.
 */
public interface MountPoint {
	String id();
	/*
	 * Type of the element the server actually rendered, if the presentation layer can tell.
	 */
	default Optional<String> renderedRootType() {
		return Optional.empty();
	}
	static MountPoint of(String id) {
		Objects.requireNonNull(id);
		return () -> id;
	}
	static MountPoint of(String id, String renderedRootType) {
		Objects.requireNonNull(id);
		Objects.requireNonNull(renderedRootType);
		return new MountPoint() {
			@Override
			public String id() {
				return id;
			}
			@Override
			public Optional<String> renderedRootType() {
				return Optional.of(renderedRootType);
			}
		};
	}
}
