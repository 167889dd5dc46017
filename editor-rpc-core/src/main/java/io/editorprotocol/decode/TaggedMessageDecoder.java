/*
 * Copyright 2026-2026 the original author or authors.
 */

package io.editorprotocol.decode;

import java.io.IOException;

import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.core.JsonToken;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.NullNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import io.editorprotocol.spec.CommandGrammar;
import io.editorprotocol.spec.EditorSchema;
import io.editorprotocol.spec.RpcDecodeException;
import io.editorprotocol.spec.RpcError.UnknownCoreMethod;

/**
 * Decodes in a single streaming pass over the envelope. The method is read as text,
 * the id and params values are read as trees, and every other field is skipped; the
 * envelope object itself is never materialized.
 *
 * @see DecodeStrategy#TAGGED
 */
public class TaggedMessageDecoder extends AbstractEditorMessageDecoder {

	private static final Logger logger = LoggerFactory.getLogger(TaggedMessageDecoder.class);

	public TaggedMessageDecoder(CommandGrammar grammar) {
		super(grammar);
	}

	@Override
	public DecodedMessage decode(String line) throws RpcDecodeException {
		logger.debug("Received JSON message: {}", line);

		JsonNode id = null;
		String method = null;
		JsonNode params = null;

		try (JsonParser parser = this.mapper.createParser(line)) {
			if (parser.nextToken() != JsonToken.START_OBJECT) {
				throw new RpcDecodeException(UnknownCoreMethod.missing());
			}
			while (parser.nextToken() == JsonToken.FIELD_NAME) {
				String field = parser.currentName();
				JsonToken token = parser.nextToken();
				switch (field) {
					case EditorSchema.FIELD_ID -> id = readValue(parser, token);
					case EditorSchema.FIELD_METHOD -> {
						if (token == JsonToken.VALUE_STRING) {
							method = parser.getText();
						}
						else {
							parser.skipChildren();
							method = null;
						}
					}
					case EditorSchema.FIELD_PARAMS -> params = readValue(parser, token);
					default -> parser.skipChildren();
				}
			}
		}
		catch (IOException e) {
			throw new RpcDecodeException(UnknownCoreMethod.missing(), e);
		}

		if (method == null) {
			throw new RpcDecodeException(UnknownCoreMethod.missing());
		}
		return dispatch(id, method, params);
	}

	private JsonNode readValue(JsonParser parser, JsonToken token) throws IOException {
		if (token == JsonToken.VALUE_NULL) {
			return NullNode.getInstance();
		}
		return this.mapper.readTree(parser);
	}

	@Override
	public DecodeStrategy strategy() {
		return DecodeStrategy.TAGGED;
	}

}
