/*
 * Copyright 2026-2026 the original author or authors.
 */

package io.editorprotocol.decode;

import com.fasterxml.jackson.databind.JsonNode;

import io.editorprotocol.spec.EditorSchema.CoreNotification;
import io.editorprotocol.spec.EditorSchema.CoreRequest;
import io.editorprotocol.util.Assert;

/**
 * The typed result of decoding one line of client input.
 */
public sealed interface DecodedMessage permits DecodedMessage.Request, DecodedMessage.Notification {

	boolean isRequest();

	/**
	 * A message that carried an {@code id}. The id is kept as sent, so that the reply
	 * can be correlated by the caller; a literal {@code null} id is kept as a JSON null
	 * node.
	 *
	 * @param id the correlation id
	 * @param request the decoded request
	 */
	record Request(JsonNode id, CoreRequest request) implements DecodedMessage {

		public Request {
			Assert.notNull(id, "id must not be null");
			Assert.notNull(request, "request must not be null");
		}

		@Override
		public boolean isRequest() {
			return true;
		}

	}

	record Notification(CoreNotification notification) implements DecodedMessage {

		public Notification {
			Assert.notNull(notification, "notification must not be null");
		}

		@Override
		public boolean isRequest() {
			return false;
		}

	}

}
