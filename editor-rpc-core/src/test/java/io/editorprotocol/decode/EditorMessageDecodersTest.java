/*
 * Copyright 2026-2026 the original author or authors.
 */

package io.editorprotocol.decode;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.EnumSource;

import io.editorprotocol.json.EditorObjectMappers;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class EditorMessageDecodersTest {

	@AfterEach
	void clearProperty() {
		System.clearProperty(EditorMessageDecoders.STRATEGY_PROPERTY);
	}

	@ParameterizedTest
	@EnumSource(DecodeStrategy.class)
	void createsDecoderForEachStrategy(DecodeStrategy strategy) {
		assertThat(EditorMessageDecoders.create(strategy).strategy()).isEqualTo(strategy);
		assertThat(EditorMessageDecoders.create(strategy, EditorObjectMappers.create()).strategy())
			.isEqualTo(strategy);
	}

	@Test
	void defaultsToTaggedStrategy() {
		assertThat(EditorMessageDecoders.createDefault()).isInstanceOf(TaggedMessageDecoder.class);
	}

	@Test
	void systemPropertySelectsStrategy() {
		System.setProperty(EditorMessageDecoders.STRATEGY_PROPERTY, "Owned");

		assertThat(EditorMessageDecoders.createDefault()).isInstanceOf(OwnedMessageDecoder.class);
	}

	@Test
	void blankSystemPropertyFallsBackToDefault() {
		System.setProperty(EditorMessageDecoders.STRATEGY_PROPERTY, " ");

		assertThat(EditorMessageDecoders.createDefault().strategy()).isEqualTo(EditorMessageDecoders.DEFAULT_STRATEGY);
	}

	@Test
	void invalidSystemPropertyFails() {
		System.setProperty(EditorMessageDecoders.STRATEGY_PROPERTY, "lazy");

		assertThatThrownBy(EditorMessageDecoders::createDefault).isInstanceOf(IllegalArgumentException.class)
			.hasMessageContaining("'lazy'");
	}

	@Test
	void nullArgumentsAreRejected() {
		assertThatThrownBy(() -> EditorMessageDecoders.create(null)).isInstanceOf(IllegalArgumentException.class);
		assertThatThrownBy(() -> EditorMessageDecoders.create(DecodeStrategy.TAGGED, null))
			.isInstanceOf(IllegalArgumentException.class);
	}

}
