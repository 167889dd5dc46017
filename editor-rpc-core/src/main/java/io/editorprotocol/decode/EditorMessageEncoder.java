/*
 * Copyright 2026-2026 the original author or authors.
 */

package io.editorprotocol.decode;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;

import io.editorprotocol.spec.CommandGrammar;
import io.editorprotocol.spec.EditorSchema;
import io.editorprotocol.spec.EditorSchema.CoreNotification;
import io.editorprotocol.spec.EditorSchema.CoreRequest;
import io.editorprotocol.util.Assert;

/**
 * Writes typed messages back to single-line JSON in the form the decoders accept.
 */
public class EditorMessageEncoder {

	private final CommandGrammar grammar;

	public EditorMessageEncoder() {
		this(new CommandGrammar());
	}

	public EditorMessageEncoder(CommandGrammar grammar) {
		Assert.notNull(grammar, "The CommandGrammar can not be null");
		this.grammar = grammar;
	}

	public String encode(CoreNotification notification) {
		return write(this.grammar.toJson(notification));
	}

	public String encode(long id, CoreRequest request) {
		return encode(this.grammar.getMapper().getNodeFactory().numberNode(id), request);
	}

	/**
	 * Encodes a request with its id as the first member.
	 * @param id the correlation id, may be a JSON null node but not {@code null}
	 * @param request the request
	 * @return the encoded line, without terminator
	 */
	public String encode(JsonNode id, CoreRequest request) {
		Assert.notNull(id, "id must not be null");
		ObjectNode message = this.grammar.getMapper().createObjectNode();
		message.set(EditorSchema.FIELD_ID, id);
		message.setAll(this.grammar.toJson(request));
		return write(message);
	}

	public String encode(DecodedMessage message) {
		Assert.notNull(message, "message must not be null");
		if (message instanceof DecodedMessage.Request request) {
			return encode(request.id(), request.request());
		}
		return encode(((DecodedMessage.Notification) message).notification());
	}

	private String write(JsonNode node) {
		try {
			return this.grammar.getMapper().writeValueAsString(node);
		}
		catch (JsonProcessingException e) {
			throw new RuntimeException("Failed to serialize editor message", e);
		}
	}

}
