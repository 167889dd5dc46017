/*
 * Copyright 2026-2026 the original author or authors.
 */

package io.editorprotocol.util;

/**
 * Assertion utility class that assists in validating arguments.
 */
public final class Assert {

	private Assert() {
	}

	/**
	 * Assert that an object is not {@code null}.
	 * @param object the object to check
	 * @param message the exception message to use if the assertion fails
	 * @throws IllegalArgumentException if the object is {@code null}
	 */
	public static void notNull(Object object, String message) {
		if (object == null) {
			throw new IllegalArgumentException(message);
		}
	}

	/**
	 * Assert a boolean expression.
	 * @param expression a boolean expression
	 * @param message the exception message to use if the assertion fails
	 * @throws IllegalArgumentException if {@code expression} is {@code false}
	 */
	public static void isTrue(boolean expression, String message) {
		if (!expression) {
			throw new IllegalArgumentException(message);
		}
	}

	/**
	 * Assert that a value is zero or positive.
	 * @param value the value to check
	 * @param message the exception message to use if the assertion fails
	 * @throws IllegalArgumentException if the value is negative
	 */
	public static void notNegative(long value, String message) {
		if (value < 0) {
			throw new IllegalArgumentException(message);
		}
	}

}
