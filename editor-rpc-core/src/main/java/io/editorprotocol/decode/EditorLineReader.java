/*
 * Copyright 2026-2026 the original author or authors.
 */

package io.editorprotocol.decode;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.Reader;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import io.editorprotocol.spec.RpcDecodeException;
import io.editorprotocol.util.Assert;

/**
 * Reads newline-delimited messages from a character stream and decodes each one.
 * Blank lines are skipped. A line that fails to decode is reported to the handler and
 * does not stop the stream.
 */
public class EditorLineReader {

	private static final Logger logger = LoggerFactory.getLogger(EditorLineReader.class);

	private final EditorMessageDecoder decoder;

	/**
	 * Counts of the lines handled by one {@link EditorLineReader#read} call.
	 *
	 * @param decoded lines decoded to a message
	 * @param failed lines that failed to decode
	 */
	public record ReadSummary(long decoded, long failed) {

		public long total() {
			return decoded + failed;
		}

	}

	public EditorLineReader(EditorMessageDecoder decoder) {
		Assert.notNull(decoder, "The EditorMessageDecoder can not be null");
		this.decoder = decoder;
	}

	/**
	 * Reads until end of stream. The reader is not closed.
	 * @param reader the input
	 * @param handler receives each decoded message or failure, in input order
	 * @return the counts of decoded and failed lines
	 * @throws IOException if reading from the input fails
	 */
	public ReadSummary read(Reader reader, DecodedMessageHandler handler) throws IOException {
		Assert.notNull(reader, "reader must not be null");
		Assert.notNull(handler, "handler must not be null");

		logger.debug("Reading messages using {} strategy", this.decoder.strategy());
		BufferedReader lines = reader instanceof BufferedReader buffered ? buffered : new BufferedReader(reader);
		long decoded = 0;
		long failed = 0;
		String line;
		while ((line = lines.readLine()) != null) {
			if (line.isBlank()) {
				continue;
			}
			DecodedMessage message;
			try {
				message = this.decoder.decode(line);
			}
			catch (RpcDecodeException e) {
				failed++;
				logger.debug("Failed to decode line: {}", e.getMessage());
				handler.onError(line, e);
				continue;
			}
			decoded++;
			handler.onMessage(message);
		}

		logger.debug("Read {} messages, {} failed", decoded + failed, failed);
		return new ReadSummary(decoded, failed);
	}

}
