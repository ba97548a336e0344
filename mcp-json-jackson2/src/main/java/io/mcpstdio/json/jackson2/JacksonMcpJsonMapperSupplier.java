/*
 * Copyright 2025-2026 the original author or authors.
 */

package io.mcpstdio.json.jackson2;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.MapperFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.json.JsonMapper;
import com.fasterxml.jackson.module.paramnames.ParameterNamesModule;

import io.mcpstdio.json.McpJsonMapper;
import io.mcpstdio.json.McpJsonMapperSupplier;

/**
 * A supplier of {@link McpJsonMapper} instances that uses the Jackson library for JSON
 * serialization and deserialization.
 * <p>
 * The mapper never pretty-prints, so every serialized message fits on one line, which is
 * what the newline-delimited framing of the stdio transport relies on.
 */
public class JacksonMcpJsonMapperSupplier implements McpJsonMapperSupplier {

	/**
	 * Returns a new instance of {@link McpJsonMapper} that uses the Jackson library for
	 * JSON serialization and deserialization.
	 * @return a new {@link McpJsonMapper} instance
	 */
	@Override
	public McpJsonMapper get() {
		return new JacksonMcpJsonMapper(createMapper());
	}

	/**
	 * Creates an ObjectMapper that does not call {@code setAccessible()} and discovers
	 * record constructor parameter names from bytecode (requires the {@code -parameters}
	 * compiler flag, configured in the parent pom.xml). Content after the first JSON
	 * value is rejected.
	 * @return a configured ObjectMapper
	 */
	static ObjectMapper createMapper() {
		return JsonMapper.builder()
			.disable(MapperFeature.CAN_OVERRIDE_ACCESS_MODIFIERS)
			.disable(SerializationFeature.INDENT_OUTPUT)
			.disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES)
			.enable(DeserializationFeature.FAIL_ON_TRAILING_TOKENS)
			.addModule(new ParameterNamesModule())
			.build();
	}

}
