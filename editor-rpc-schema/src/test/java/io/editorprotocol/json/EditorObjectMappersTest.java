/*
 * Copyright 2026-2026 the original author or authors.
 */

package io.editorprotocol.json;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.exc.MismatchedInputException;
import org.junit.jupiter.api.Test;

import io.editorprotocol.spec.EditorSchema.EditNotification;
import io.editorprotocol.spec.LineRange;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class EditorObjectMappersTest {

	ObjectMapper mapper = EditorObjectMappers.create();

	@Test
	void registersPositionalCodecs() throws Exception {
		assertThat(mapper.readValue("[12,13]", LineRange.class)).isEqualTo(new LineRange(12, 13));
	}

	@Test
	void doesNotCoerceStringsToNumbers() {
		assertThatThrownBy(() -> mapper.readValue("""
				{"line":"5"}""", EditNotification.GotoLine.class)).isInstanceOf(MismatchedInputException.class);
	}

	@Test
	void doesNotTruncateFloats() {
		assertThatThrownBy(() -> mapper.readValue("""
				{"line":1.5}""", EditNotification.GotoLine.class)).isInstanceOf(MismatchedInputException.class);
	}

	@Test
	void rejectsNullForPrimitives() {
		assertThatThrownBy(() -> mapper.readValue("""
				{"wrap_around":null}""", EditNotification.FindPrevious.class))
			.isInstanceOf(MismatchedInputException.class);
	}

	@Test
	void ignoresUnknownFieldsOfKnownPayloads() throws Exception {
		assertThat(mapper.readValue("""
				{"line":7,"column":3}""", EditNotification.GotoLine.class))
			.isEqualTo(new EditNotification.GotoLine(7));
	}

}
