/*
 * Copyright 2026-2026 the original author or authors.
 */

package io.editorprotocol.decode;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import io.editorprotocol.json.EditorObjectMappers;
import io.editorprotocol.spec.CommandGrammar;
import io.editorprotocol.util.Assert;

/**
 * Creates {@link EditorMessageDecoder} instances.
 * <p>
 * The default strategy is {@link DecodeStrategy#TAGGED}. It can be changed for the
 * whole process with the {@value #STRATEGY_PROPERTY} system property, for example
 * {@code -Dio.editorprotocol.decodeStrategy=owned}.
 */
public final class EditorMessageDecoders {

	private static final Logger logger = LoggerFactory.getLogger(EditorMessageDecoders.class);

	/**
	 * System property selecting the strategy used by {@link #createDefault()}.
	 */
	public static final String STRATEGY_PROPERTY = "io.editorprotocol.decodeStrategy";

	public static final DecodeStrategy DEFAULT_STRATEGY = DecodeStrategy.TAGGED;

	private EditorMessageDecoders() {
	}

	/**
	 * @return a decoder using the strategy named by {@value #STRATEGY_PROPERTY}, or
	 * {@link #DEFAULT_STRATEGY} when the property is unset
	 * @throws IllegalArgumentException if the property names no strategy
	 */
	public static EditorMessageDecoder createDefault() {
		String configured = System.getProperty(STRATEGY_PROPERTY);
		if (configured == null || configured.isBlank()) {
			return create(DEFAULT_STRATEGY);
		}
		DecodeStrategy strategy = DecodeStrategy.from(configured);
		logger.debug("Using decode strategy {} from system property {}", strategy, STRATEGY_PROPERTY);
		return create(strategy);
	}

	public static EditorMessageDecoder create(DecodeStrategy strategy) {
		return create(strategy, EditorObjectMappers.create());
	}

	/**
	 * Creates a decoder over the given mapper. The mapper must have the
	 * {@link io.editorprotocol.spec.EditorRpcModule} registered.
	 * @param strategy the decode strategy
	 * @param mapper the mapper used for parsing and binding
	 * @return a new decoder
	 */
	public static EditorMessageDecoder create(DecodeStrategy strategy, ObjectMapper mapper) {
		Assert.notNull(strategy, "strategy must not be null");
		Assert.notNull(mapper, "mapper must not be null");
		CommandGrammar grammar = new CommandGrammar(mapper);
		return switch (strategy) {
			case BORROWED -> new BorrowedMessageDecoder(grammar);
			case OWNED -> new OwnedMessageDecoder(grammar);
			case TAGGED -> new TaggedMessageDecoder(grammar);
		};
	}

}
