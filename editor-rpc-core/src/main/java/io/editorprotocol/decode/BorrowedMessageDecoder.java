/*
 * Copyright 2026-2026 the original author or authors.
 */

package io.editorprotocol.decode;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import io.editorprotocol.decode.RpcMessageClassifier.ClassifiedMessage;
import io.editorprotocol.spec.CommandGrammar;
import io.editorprotocol.spec.RpcDecodeException;

/**
 * Decodes by parsing the line to a tree and reading id, method and params straight
 * out of it.
 *
 * @see DecodeStrategy#BORROWED
 */
public class BorrowedMessageDecoder extends AbstractEditorMessageDecoder {

	private static final Logger logger = LoggerFactory.getLogger(BorrowedMessageDecoder.class);

	public BorrowedMessageDecoder(CommandGrammar grammar) {
		super(grammar);
	}

	@Override
	public DecodedMessage decode(String line) throws RpcDecodeException {
		logger.debug("Received JSON message: {}", line);

		ClassifiedMessage message = RpcMessageClassifier.classify(readTree(line));
		return dispatch(message.id(), message.method(), message.params());
	}

	@Override
	public DecodeStrategy strategy() {
		return DecodeStrategy.BORROWED;
	}

}
