/*
 * Copyright 2026-2026 the original author or authors.
 */

package io.editorprotocol.spec;

import com.fasterxml.jackson.databind.module.SimpleModule;

/**
 * Registers the positional array encodings of {@link LineRange} and
 * {@link MouseAction} with Jackson.
 */
public class EditorRpcModule extends SimpleModule {

	public EditorRpcModule() {
		super("EditorRpcModule");

		addSerializer(LineRange.class, new PositionalCodecs.LineRangeSerializer());
		addDeserializer(LineRange.class, new PositionalCodecs.LineRangeDeserializer());

		addSerializer(MouseAction.class, new PositionalCodecs.MouseActionSerializer());
		addDeserializer(MouseAction.class, new PositionalCodecs.MouseActionDeserializer());
	}

}
