/*
 * Copyright 2025-2026 the original author or authors.
 */

package io.mcpstdio.json;

/**
 * Lazily resolved, process-wide default {@link McpJsonMapper}.
 */
public final class McpJsonDefaults {

	private McpJsonDefaults() {
	}

	public static McpJsonMapper getMapper() {
		return Holder.MAPPER;
	}

	private static final class Holder {

		private static final McpJsonMapper MAPPER = McpJsonMapper.createDefault();

	}

}
