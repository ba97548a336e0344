/*
 * Copyright 2025-2026 the original author or authors.
 */

package io.mcpstdio.client;

import java.util.List;

import io.mcpstdio.spec.McpClientSession;
import io.mcpstdio.spec.McpSchema;
import io.mcpstdio.spec.McpSessionState;
import reactor.core.publisher.Mono;

/**
 * Asynchronous MCP client. Every operation returns a {@link Mono}; several requests may
 * be in flight at once and are matched to their responses by id.
 *
 * <p>
 * The client follows a lifecycle:
 * <ol>
 * <li>Initialization - {@link #initialize()} must complete before any other request
 * <li>Normal Operation - listing, reading and calling
 * <li>Shutdown - {@link #shutdown()} asks the server to stop and then terminates it
 * </ol>
 * Requests issued out of order fail with
 * {@link io.mcpstdio.spec.McpProtocolViolationException} before anything is sent.
 *
 * @see McpClient
 * @see McpClientSession
 */
public interface McpAsyncClient {

	/**
	 * Get the current initialization result.
	 * @return the initialization result, or {@code null} before initialization
	 */
	McpSchema.InitializeResult getCurrentInitializationResult();

	McpSchema.ServerCapabilities getServerCapabilities();

	String getServerInstructions();

	McpSchema.Implementation getServerInfo();

	boolean isInitialized();

	McpSessionState getState();

	McpSchema.ClientCapabilities getClientCapabilities();

	McpSchema.Implementation getClientInfo();

	/**
	 * Closes the client connection immediately, terminating the server process.
	 */
	void close();

	/**
	 * Shuts the session down if it is initialized, otherwise closes it.
	 * @return A Mono that completes when the connection is closed
	 */
	Mono<Void> closeGracefully();

	// --------------------------
	// Lifecycle
	// --------------------------

	/**
	 * Performs the initialization handshake and then sends the
	 * {@code notifications/initialized} notification.
	 * @return the initialize result.
	 */
	Mono<McpSchema.InitializeResult> initialize();

	/**
	 * Sends {@code shutdown}, then terminates the server process whether or not it
	 * answered in time.
	 * @return A Mono that completes once the server process has exited
	 */
	Mono<Void> shutdown();

	/**
	 * Sends a ping request to the server.
	 * @return A Mono that completes with the server's ping response
	 */
	Mono<Object> ping();

	// --------------------------
	// Resources
	// --------------------------

	/**
	 * Retrieves the first page of resources.
	 * @return A Mono that completes with the first page
	 */
	Mono<McpSchema.ListResourcesResult> listResources();

	/**
	 * Retrieves a page of resources.
	 * @param cursor Optional pagination cursor from a previous list request
	 * @return A Mono that completes with the page
	 */
	Mono<McpSchema.ListResourcesResult> listResources(String cursor);

	/**
	 * Follows {@code nextCursor} from the first page until the server reports the last
	 * one.
	 * @return A Mono that completes with every resource, in listing order
	 */
	Mono<List<McpSchema.Resource>> listAllResources();

	Mono<McpSchema.ReadResourceResult> readResource(McpSchema.Resource resource);

	Mono<McpSchema.ReadResourceResult> readResource(McpSchema.ReadResourceRequest readResourceRequest);

	// --------------------------
	// Tools
	// --------------------------

	Mono<McpSchema.ListToolsResult> listTools();

	Mono<McpSchema.ListToolsResult> listTools(String cursor);

	Mono<List<McpSchema.Tool>> listAllTools();

	/**
	 * Calls a tool provided by the server.
	 * @param callToolRequest The request containing the tool name and input parameters.
	 * @return A Mono that emits the result of the tool call
	 */
	Mono<McpSchema.CallToolResult> callTool(McpSchema.CallToolRequest callToolRequest);

	// --------------------------
	// Prompts
	// --------------------------

	Mono<McpSchema.ListPromptsResult> listPrompts();

	Mono<McpSchema.ListPromptsResult> listPrompts(String cursor);

	Mono<List<McpSchema.Prompt>> listAllPrompts();

}
