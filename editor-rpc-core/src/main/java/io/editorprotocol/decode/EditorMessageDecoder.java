/*
 * Copyright 2026-2026 the original author or authors.
 */

package io.editorprotocol.decode;

import io.editorprotocol.spec.RpcDecodeException;

/**
 * Decodes one line of client input into a typed message.
 * <p>
 * Decoding is a pure function of the line: implementations hold no mutable state, never
 * block, and can be used from several threads at once.
 */
public interface EditorMessageDecoder {

	/**
	 * Decodes a line holding one JSON object.
	 * @param line the line, without its terminator
	 * @return a request if the message has an {@code id}, a notification otherwise
	 * @throws RpcDecodeException if the line does not hold a valid message; text that is
	 * not JSON, or JSON that is not an object with a string {@code method}, is reported
	 * as a missing core method
	 */
	DecodedMessage decode(String line) throws RpcDecodeException;

	DecodeStrategy strategy();

}
