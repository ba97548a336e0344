/*
 * Copyright 2025-2026 the original author or authors.
 */

package io.mcpstdio.client;

import java.time.Duration;
import java.util.List;

import io.mcpstdio.logger.McpLogger;
import io.mcpstdio.spec.McpSchema;
import io.mcpstdio.spec.McpSessionState;
import io.mcpstdio.util.Assert;

/**
 * A synchronous client that wraps an {@link McpAsyncClient} and blocks on its results.
 * Timeouts are enforced by the underlying session, so blocking calls carry no deadline
 * of their own.
 */
class DefaultMcpSyncClient implements McpSyncClient {

	private final McpAsyncClient delegate;

	private final Duration closeTimeout;

	private final McpLogger logger;

	DefaultMcpSyncClient(McpAsyncClient delegate, Duration closeTimeout, McpLogger logger) {
		Assert.notNull(delegate, "The delegate can not be null");
		Assert.notNull(closeTimeout, "The closeTimeout can not be null");
		Assert.notNull(logger, "The logger can not be null");
		this.delegate = delegate;
		this.closeTimeout = closeTimeout;
		this.logger = logger;
	}

	@Override
	public McpSchema.InitializeResult getCurrentInitializationResult() {
		return this.delegate.getCurrentInitializationResult();
	}

	@Override
	public McpSchema.ServerCapabilities getServerCapabilities() {
		return this.delegate.getServerCapabilities();
	}

	@Override
	public String getServerInstructions() {
		return this.delegate.getServerInstructions();
	}

	@Override
	public McpSchema.Implementation getServerInfo() {
		return this.delegate.getServerInfo();
	}

	@Override
	public boolean isInitialized() {
		return this.delegate.isInitialized();
	}

	@Override
	public McpSessionState getState() {
		return this.delegate.getState();
	}

	@Override
	public McpSchema.ClientCapabilities getClientCapabilities() {
		return this.delegate.getClientCapabilities();
	}

	@Override
	public McpSchema.Implementation getClientInfo() {
		return this.delegate.getClientInfo();
	}

	@Override
	public void close() {
		this.delegate.close();
	}

	@Override
	public boolean closeGracefully() {
		try {
			this.delegate.closeGracefully().block(this.closeTimeout);
		}
		catch (RuntimeException e) {
			this.logger.warn("Client didn't close within timeout of " + this.closeTimeout.toMillis() + " ms.", e);
			this.delegate.close();
			return false;
		}
		return true;
	}

	@Override
	public McpSchema.InitializeResult initialize() {
		return this.delegate.initialize().block();
	}

	@Override
	public void shutdown() {
		this.delegate.shutdown().block();
	}

	@Override
	public Object ping() {
		return this.delegate.ping().block();
	}

	@Override
	public McpSchema.ListResourcesResult listResources() {
		return this.delegate.listResources().block();
	}

	@Override
	public McpSchema.ListResourcesResult listResources(String cursor) {
		return this.delegate.listResources(cursor).block();
	}

	@Override
	public List<McpSchema.Resource> listAllResources() {
		return this.delegate.listAllResources().block();
	}

	@Override
	public McpSchema.ReadResourceResult readResource(McpSchema.Resource resource) {
		return this.delegate.readResource(resource).block();
	}

	@Override
	public McpSchema.ReadResourceResult readResource(McpSchema.ReadResourceRequest readResourceRequest) {
		return this.delegate.readResource(readResourceRequest).block();
	}

	@Override
	public McpSchema.ListToolsResult listTools() {
		return this.delegate.listTools().block();
	}

	@Override
	public McpSchema.ListToolsResult listTools(String cursor) {
		return this.delegate.listTools(cursor).block();
	}

	@Override
	public List<McpSchema.Tool> listAllTools() {
		return this.delegate.listAllTools().block();
	}

	@Override
	public McpSchema.CallToolResult callTool(McpSchema.CallToolRequest callToolRequest) {
		return this.delegate.callTool(callToolRequest).block();
	}

	@Override
	public McpSchema.ListPromptsResult listPrompts() {
		return this.delegate.listPrompts().block();
	}

	@Override
	public McpSchema.ListPromptsResult listPrompts(String cursor) {
		return this.delegate.listPrompts(cursor).block();
	}

	@Override
	public List<McpSchema.Prompt> listAllPrompts() {
		return this.delegate.listAllPrompts().block();
	}

}
