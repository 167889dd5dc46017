/*
 * Copyright 2026-2026 the original author or authors.
 */

package io.editorprotocol.decode;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import io.editorprotocol.spec.CommandGrammar;
import io.editorprotocol.spec.EditorSchema;
import io.editorprotocol.spec.RpcDecodeException;
import io.editorprotocol.spec.RpcError.UnknownCoreMethod;

/**
 * Decodes through an owned intermediate value: the parsed tree is copied, the id is
 * removed from the copy, and the remainder is bound to an {@link RpcCall} before
 * dispatching.
 *
 * @see DecodeStrategy#OWNED
 */
public class OwnedMessageDecoder extends AbstractEditorMessageDecoder {

	private static final Logger logger = LoggerFactory.getLogger(OwnedMessageDecoder.class);

	/**
	 * An envelope without its id.
	 *
	 * @param method the method name
	 * @param params the params, {@code null} when absent
	 */
	@JsonIgnoreProperties(ignoreUnknown = true)
	public record RpcCall( // @formatter:off
		@JsonProperty(value = "method", required = true) String method,
		@JsonProperty("params") JsonNode params) { // @formatter:on
	}

	public OwnedMessageDecoder(CommandGrammar grammar) {
		super(grammar);
	}

	@Override
	public DecodedMessage decode(String line) throws RpcDecodeException {
		logger.debug("Received JSON message: {}", line);

		JsonNode tree = readTree(line);
		if (tree == null || !tree.isObject()) {
			throw new RpcDecodeException(UnknownCoreMethod.missing());
		}
		ObjectNode owned = ((ObjectNode) tree).deepCopy();
		JsonNode id = owned.remove(EditorSchema.FIELD_ID);
		RpcMessageClassifier.requireMethod(owned);

		RpcCall call;
		try {
			call = this.mapper.treeToValue(owned, RpcCall.class);
		}
		catch (JsonProcessingException | IllegalArgumentException e) {
			throw new RpcDecodeException(UnknownCoreMethod.missing(), e);
		}
		return dispatch(id, call.method(), call.params());
	}

	@Override
	public DecodeStrategy strategy() {
		return DecodeStrategy.OWNED;
	}

}
