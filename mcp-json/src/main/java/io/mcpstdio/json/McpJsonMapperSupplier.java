/*
 * Copyright 2025-2026 the original author or authors.
 */

package io.mcpstdio.json;

import java.util.function.Supplier;

/**
 * Service provider interface for {@link McpJsonMapper} implementations. Implementations
 * are registered under {@code META-INF/services/io.mcpstdio.json.McpJsonMapperSupplier}.
 */
public interface McpJsonMapperSupplier extends Supplier<McpJsonMapper> {

}
