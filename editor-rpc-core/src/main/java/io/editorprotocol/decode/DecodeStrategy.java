/*
 * Copyright 2026-2026 the original author or authors.
 */

package io.editorprotocol.decode;

import java.util.Arrays;
import java.util.Locale;

/**
 * How a line of input is turned into a typed message. All strategies accept and reject
 * the same inputs and produce equal results; they differ only in what they allocate
 * on the way.
 */
public enum DecodeStrategy {

	/**
	 * Parse the line to a tree and read id, method and params by reference from it. No
	 * part of the tree is copied, so the decoded params share nodes with the parsed
	 * line.
	 */
	BORROWED,

	/**
	 * Parse the line to a tree, take an owned copy, remove the id and bind the rest to
	 * an intermediate {@code (method, params)} value before dispatching. One extra
	 * materialization pass, no sharing with the parsed line.
	 */
	OWNED,

	/**
	 * Stream over the envelope once and dispatch on the method tag. Only the params
	 * value is materialized; the envelope itself never becomes a tree.
	 */
	TAGGED;

	/**
	 * Parses a strategy name, ignoring case and surrounding whitespace.
	 * @param name the strategy name
	 * @return the strategy
	 * @throws IllegalArgumentException if the name does not match a strategy
	 */
	public static DecodeStrategy from(String name) {
		if (name != null) {
			String normalized = name.trim().toUpperCase(Locale.ROOT);
			for (DecodeStrategy strategy : values()) {
				if (strategy.name().equals(normalized)) {
					return strategy;
				}
			}
		}
		throw new IllegalArgumentException(
				"Unknown decode strategy '" + name + "', expected one of " + Arrays.toString(values()));
	}

}
