/*
 * Copyright 2026-2026 the original author or authors.
 */

package io.editorprotocol.decode;

import io.editorprotocol.spec.RpcDecodeException;

/**
 * Receives the outcome of each line read by an {@link EditorLineReader}.
 */
public interface DecodedMessageHandler {

	void onMessage(DecodedMessage message);

	/**
	 * Called for a line that could not be decoded. Reading continues with the next line.
	 * @param line the offending line
	 * @param error the decode failure
	 */
	void onError(String line, RpcDecodeException error);

}
