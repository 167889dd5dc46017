/*
 * Copyright 2026-2026 the original author or authors.
 */

package io.editorprotocol.decode;

import com.fasterxml.jackson.databind.JsonNode;

import io.editorprotocol.spec.EditorSchema;
import io.editorprotocol.spec.RpcDecodeException;
import io.editorprotocol.spec.RpcError.UnknownCoreMethod;

/**
 * Splits a message envelope into correlation id, method name and params.
 * <p>
 * A message is a request when it has an {@code id} field, whatever its value
 * (including {@code null}), and a notification otherwise. The id takes no part in
 * method dispatch.
 */
public final class RpcMessageClassifier {

	private RpcMessageClassifier() {
	}

	/**
	 * The parts of an envelope, referencing the nodes of the parsed message.
	 *
	 * @param id the id node, {@code null} when the message has no id field
	 * @param method the method name
	 * @param params the params node, {@code null} when the message has no params field
	 */
	public record ClassifiedMessage(JsonNode id, String method, JsonNode params) {

		public boolean isRequest() {
			return id != null;
		}

	}

	/**
	 * Classifies a parsed message.
	 * @param message the parsed message
	 * @return the envelope parts
	 * @throws RpcDecodeException with a missing {@link UnknownCoreMethod} if the message
	 * is not an object or has no string {@code method}
	 */
	public static ClassifiedMessage classify(JsonNode message) throws RpcDecodeException {
		if (message == null || !message.isObject()) {
			throw new RpcDecodeException(UnknownCoreMethod.missing());
		}
		return new ClassifiedMessage(message.get(EditorSchema.FIELD_ID), requireMethod(message),
				message.get(EditorSchema.FIELD_PARAMS));
	}

	/**
	 * @param message an object node
	 * @return the text of the {@code method} field
	 * @throws RpcDecodeException with a missing {@link UnknownCoreMethod} if the field is
	 * absent or not a string
	 */
	static String requireMethod(JsonNode message) throws RpcDecodeException {
		JsonNode method = message.get(EditorSchema.FIELD_METHOD);
		if (method == null || !method.isTextual()) {
			throw new RpcDecodeException(UnknownCoreMethod.missing());
		}
		return method.textValue();
	}

}
