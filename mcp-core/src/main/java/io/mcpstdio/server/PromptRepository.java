/*
 * Copyright 2025-2026 the original author or authors.
 */

package io.mcpstdio.server;

import io.mcpstdio.spec.McpSchema;
import reactor.core.publisher.Mono;

/**
 * Repository interface for the prompts a server lists.
 */
public interface PromptRepository {

	Mono<McpSchema.ListPromptsResult> listPrompts(String cursor);

	void addPrompt(McpSchema.Prompt prompt);

	void removePrompt(String name);

}
