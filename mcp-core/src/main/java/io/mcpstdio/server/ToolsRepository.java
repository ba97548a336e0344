/*
 * Copyright 2025-2026 the original author or authors.
 */

package io.mcpstdio.server;

import io.mcpstdio.spec.McpSchema;
import reactor.core.publisher.Mono;

/**
 * Repository interface for the tools a server offers.
 */
public interface ToolsRepository {

	/**
	 * List one page of tools.
	 * @param cursor An opaque pagination token. If null, the first page of results is
	 * returned.
	 * @return A {@link Mono} emitting the page and the optional next cursor, or an
	 * invalid-cursor {@link io.mcpstdio.spec.McpError}
	 */
	Mono<McpSchema.ListToolsResult> listTools(String cursor);

	/**
	 * Resolve a tool specification for execution by name.
	 * @param name The name of the tool to execute
	 * @return A {@link Mono} emitting the specification if found, otherwise empty
	 */
	Mono<McpServerFeatures.SyncToolSpecification> resolveToolForCall(String name);

	/**
	 * Add a tool to the repository at runtime. A tool with the same name is replaced.
	 * @param tool The tool specification to add
	 */
	void addTool(McpServerFeatures.SyncToolSpecification tool);

	/**
	 * Remove a tool from the repository at runtime by name.
	 * @param name The name of the tool to remove
	 */
	void removeTool(String name);

}
