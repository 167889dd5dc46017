/*
 * Copyright 2026-2026 the original author or authors.
 */

package io.editorprotocol.spec;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import io.editorprotocol.util.Assert;

/**
 * Opaque, client assigned name of a document view. View identifiers are the primary
 * means of routing edit commands between the backend and a client view.
 * <p>
 * Ordering is provided for deterministic iteration only.
 */
public final class ViewIdentifier implements Comparable<ViewIdentifier> {

	private final String value;

	private ViewIdentifier(String value) {
		this.value = value;
	}

	@JsonCreator(mode = JsonCreator.Mode.DELEGATING)
	public static ViewIdentifier of(String value) {
		Assert.notNull(value, "view_id must not be null");
		return new ViewIdentifier(value);
	}

	@JsonValue
	public String value() {
		return value;
	}

	@Override
	public int compareTo(ViewIdentifier other) {
		return value.compareTo(other.value);
	}

	@Override
	public boolean equals(Object o) {
		if (o == null || getClass() != o.getClass())
			return false;
		ViewIdentifier that = (ViewIdentifier) o;
		return value.equals(that.value);
	}

	@Override
	public int hashCode() {
		return value.hashCode();
	}

	@Override
	public String toString() {
		return value;
	}

}
