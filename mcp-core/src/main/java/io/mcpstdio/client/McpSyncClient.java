/*
 * Copyright 2025-2026 the original author or authors.
 */

package io.mcpstdio.client;

import java.util.List;

import io.mcpstdio.spec.McpSchema;
import io.mcpstdio.spec.McpSessionState;

/**
 * Blocking MCP client. Each call waits for its response, or for the request timeout, and
 * rethrows failures as the {@link io.mcpstdio.spec.McpError} subclass that describes
 * them.
 *
 * @see McpClient
 * @see McpAsyncClient
 */
public interface McpSyncClient extends AutoCloseable {

	McpSchema.InitializeResult getCurrentInitializationResult();

	McpSchema.ServerCapabilities getServerCapabilities();

	String getServerInstructions();

	McpSchema.Implementation getServerInfo();

	boolean isInitialized();

	McpSessionState getState();

	McpSchema.ClientCapabilities getClientCapabilities();

	McpSchema.Implementation getClientInfo();

	/**
	 * Terminates the server process immediately.
	 */
	@Override
	void close();

	/**
	 * Shuts the session down if it is initialized, otherwise closes it.
	 * @return {@code true} if closing completed in time
	 */
	boolean closeGracefully();

	McpSchema.InitializeResult initialize();

	/**
	 * Sends {@code shutdown} and terminates the server process.
	 */
	void shutdown();

	Object ping();

	McpSchema.ListResourcesResult listResources();

	McpSchema.ListResourcesResult listResources(String cursor);

	List<McpSchema.Resource> listAllResources();

	McpSchema.ReadResourceResult readResource(McpSchema.Resource resource);

	McpSchema.ReadResourceResult readResource(McpSchema.ReadResourceRequest readResourceRequest);

	McpSchema.ListToolsResult listTools();

	McpSchema.ListToolsResult listTools(String cursor);

	List<McpSchema.Tool> listAllTools();

	McpSchema.CallToolResult callTool(McpSchema.CallToolRequest callToolRequest);

	McpSchema.ListPromptsResult listPrompts();

	McpSchema.ListPromptsResult listPrompts(String cursor);

	List<McpSchema.Prompt> listAllPrompts();

}
