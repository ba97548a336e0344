/*
 * Copyright 2025-2026 the original author or authors.
 */

package io.mcpstdio.server;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import io.mcpstdio.json.McpJsonDefaults;
import io.mcpstdio.json.McpJsonMapper;
import io.mcpstdio.logger.McpLogger;
import io.mcpstdio.logger.Slf4jMcpLogger;
import io.mcpstdio.pagination.McpPaginator;
import io.mcpstdio.spec.McpLineTransport;
import io.mcpstdio.spec.McpSchema;
import io.mcpstdio.spec.McpServerSession;
import io.mcpstdio.util.Assert;

/**
 * Factory class for creating Model Context Protocol (MCP) servers over a line
 * transport.
 *
 * <pre>{@code
 * McpSyncServer server = McpServer.sync(new StdioServerTransport())
 *     .serverInfo("my-server", "1.0.0")
 *     .defaultPageSize(25)
 *     .resources(McpServerFeatures.fileResource(Path.of("data.csv"), "Sample data", "text/csv"))
 *     .tools(new McpServerFeatures.SyncToolSpecification(echoTool, request -> CallToolResult.text("ok")))
 *     .build();
 *
 * server.run();
 * }</pre>
 *
 * @see McpSyncServer
 */
public interface McpServer {

	McpSchema.Implementation DEFAULT_SERVER_INFO = new McpSchema.Implementation("mcp-server", "1.0.0");

	/**
	 * Starts building a server that serves requests on the calling thread.
	 * @param transport the transport the server reads requests from
	 * @return a new builder
	 */
	static SyncSpecification sync(McpLineTransport transport) {
		return new SyncSpecification(transport);
	}

	/**
	 * Synchronous server specification.
	 */
	class SyncSpecification {

		final McpLineTransport transport;

		McpJsonMapper jsonMapper;

		McpLogger logger;

		McpSchema.Implementation serverInfo = DEFAULT_SERVER_INFO;

		String instructions;

		int defaultPageSize = McpPaginator.DEFAULT_PAGE_SIZE;

		int maxRequests;

		final List<McpServerFeatures.SyncResourceSpecification> resources = new ArrayList<>();

		final List<McpServerFeatures.SyncToolSpecification> tools = new ArrayList<>();

		final List<McpSchema.Prompt> prompts = new ArrayList<>();

		final Map<String, McpServerSession.NotificationHandler> notificationHandlers = new HashMap<>();

		private SyncSpecification(McpLineTransport transport) {
			Assert.notNull(transport, "Transport must not be null");
			this.transport = transport;
		}

		public SyncSpecification serverInfo(McpSchema.Implementation serverInfo) {
			Assert.notNull(serverInfo, "Server info must not be null");
			this.serverInfo = serverInfo;
			return this;
		}

		public SyncSpecification serverInfo(String name, String version) {
			Assert.hasText(name, "Name must not be null or empty");
			Assert.hasText(version, "Version must not be null or empty");
			this.serverInfo = new McpSchema.Implementation(name, version);
			return this;
		}

		public SyncSpecification instructions(String instructions) {
			this.instructions = instructions;
			return this;
		}

		/**
		 * Page size of listings started without a cursor.
		 * @param defaultPageSize between 1 and {@link McpPaginator#MAX_PAGE_SIZE}
		 * @return this builder
		 */
		public SyncSpecification defaultPageSize(int defaultPageSize) {
			Assert.isTrue(defaultPageSize >= 1 && defaultPageSize <= McpPaginator.MAX_PAGE_SIZE,
					"defaultPageSize must be between 1 and " + McpPaginator.MAX_PAGE_SIZE);
			this.defaultPageSize = defaultPageSize;
			return this;
		}

		/**
		 * Stops serving after this many requests; {@code 0}, the default, means no limit.
		 */
		public SyncSpecification maxRequests(int maxRequests) {
			Assert.isTrue(maxRequests >= 0, "maxRequests must not be negative");
			this.maxRequests = maxRequests;
			return this;
		}

		public SyncSpecification resources(McpServerFeatures.SyncResourceSpecification... resources) {
			Assert.notNull(resources, "Resources must not be null");
			this.resources.addAll(Arrays.asList(resources));
			return this;
		}

		public SyncSpecification resources(List<McpServerFeatures.SyncResourceSpecification> resources) {
			Assert.notNull(resources, "Resources must not be null");
			this.resources.addAll(resources);
			return this;
		}

		public SyncSpecification tools(McpServerFeatures.SyncToolSpecification... tools) {
			Assert.notNull(tools, "Tools must not be null");
			this.tools.addAll(Arrays.asList(tools));
			return this;
		}

		public SyncSpecification tools(List<McpServerFeatures.SyncToolSpecification> tools) {
			Assert.notNull(tools, "Tools must not be null");
			this.tools.addAll(tools);
			return this;
		}

		public SyncSpecification prompts(McpSchema.Prompt... prompts) {
			Assert.notNull(prompts, "Prompts must not be null");
			this.prompts.addAll(Arrays.asList(prompts));
			return this;
		}

		public SyncSpecification prompts(List<McpSchema.Prompt> prompts) {
			Assert.notNull(prompts, "Prompts must not be null");
			this.prompts.addAll(prompts);
			return this;
		}

		public SyncSpecification notificationHandler(String method, McpServerSession.NotificationHandler handler) {
			Assert.hasText(method, "Method must not be empty");
			Assert.notNull(handler, "Handler must not be null");
			this.notificationHandlers.put(method, handler);
			return this;
		}

		public SyncSpecification jsonMapper(McpJsonMapper jsonMapper) {
			Assert.notNull(jsonMapper, "JsonMapper must not be null");
			this.jsonMapper = jsonMapper;
			return this;
		}

		public SyncSpecification logger(McpLogger logger) {
			Assert.notNull(logger, "Logger must not be null");
			this.logger = logger;
			return this;
		}

		public McpSyncServer build() {
			if (this.jsonMapper == null) {
				this.jsonMapper = McpJsonDefaults.getMapper();
			}
			if (this.logger == null) {
				this.logger = new Slf4jMcpLogger(McpSyncServer.class);
			}
			return new McpSyncServer(this);
		}

	}

}
