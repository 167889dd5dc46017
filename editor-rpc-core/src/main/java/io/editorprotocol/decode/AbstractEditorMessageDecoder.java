/*
 * Copyright 2026-2026 the original author or authors.
 */

package io.editorprotocol.decode;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import io.editorprotocol.spec.CommandGrammar;
import io.editorprotocol.spec.RpcDecodeException;
import io.editorprotocol.spec.RpcError.UnknownCoreMethod;
import io.editorprotocol.util.Assert;

/**
 * Base class for decoders: hands a classified envelope to the request or notification
 * grammar.
 */
public abstract class AbstractEditorMessageDecoder implements EditorMessageDecoder {

	protected final CommandGrammar grammar;

	protected final ObjectMapper mapper;

	protected AbstractEditorMessageDecoder(CommandGrammar grammar) {
		Assert.notNull(grammar, "The CommandGrammar can not be null");
		this.grammar = grammar;
		this.mapper = grammar.getMapper();
	}

	protected DecodedMessage dispatch(JsonNode id, String method, JsonNode params) throws RpcDecodeException {
		if (id != null) {
			return new DecodedMessage.Request(id, this.grammar.requestFromJson(method, params));
		}
		return new DecodedMessage.Notification(this.grammar.notificationFromJson(method, params));
	}

	protected JsonNode readTree(String line) throws RpcDecodeException {
		try {
			return this.mapper.readTree(line);
		}
		catch (JsonProcessingException e) {
			throw new RpcDecodeException(UnknownCoreMethod.missing(), e);
		}
	}

}
