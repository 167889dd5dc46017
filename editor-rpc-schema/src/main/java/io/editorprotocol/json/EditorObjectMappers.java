/*
 * Copyright 2026-2026 the original author or authors.
 */

package io.editorprotocol.json;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.MapperFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.cfg.CoercionAction;
import com.fasterxml.jackson.databind.cfg.CoercionInputShape;
import com.fasterxml.jackson.databind.json.JsonMapper;
import com.fasterxml.jackson.databind.type.LogicalType;
import com.fasterxml.jackson.module.paramnames.ParameterNamesModule;

import io.editorprotocol.spec.EditorRpcModule;

/**
 * Factory for the Jackson {@link ObjectMapper} used to bind editor protocol payloads.
 * <p>
 * The mapper is configured to:
 * <ul>
 * <li>Not call {@code setAccessible()} on constructors/fields, avoiding the need for
 * {@code --add-opens} flags</li>
 * <li>Use the {@link ParameterNamesModule} to discover creator parameter names from
 * bytecode (requires the {@code -parameters} compiler flag, configured in the parent
 * pom.xml)</li>
 * <li>Reject scalar coercions, so {@code "1"} never binds to a number and {@code 1.5}
 * never binds to an integer field; numbers and booleans never bind to strings</li>
 * <li>Reject {@code null} for primitive fields</li>
 * <li>Encode {@code LineRange} and {@code MouseAction} in their positional array
 * form</li>
 * </ul>
 */
public final class EditorObjectMappers {

	private EditorObjectMappers() {
	}

	/**
	 * Creates a new, fully configured mapper. Mappers are thread-safe once built, so a
	 * single instance can be shared by all decoders of a process.
	 * @return a new {@link ObjectMapper}
	 */
	public static ObjectMapper create() {
		return JsonMapper.builder()
			.disable(MapperFeature.CAN_OVERRIDE_ACCESS_MODIFIERS)
			.disable(MapperFeature.ALLOW_COERCION_OF_SCALARS)
			.disable(DeserializationFeature.ACCEPT_FLOAT_AS_INT)
			.enable(DeserializationFeature.FAIL_ON_NULL_FOR_PRIMITIVES)
			.withCoercionConfig(LogicalType.Textual,
					config -> config.setCoercion(CoercionInputShape.Integer, CoercionAction.Fail)
						.setCoercion(CoercionInputShape.Float, CoercionAction.Fail)
						.setCoercion(CoercionInputShape.Boolean, CoercionAction.Fail))
			.addModule(new ParameterNamesModule())
			.addModule(new EditorRpcModule())
			.build();
	}

}
