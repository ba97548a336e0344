/*
 * Copyright 2025-2026 the original author or authors.
 */

package io.mcpstdio.server;

import java.util.Map;

import io.mcpstdio.logger.McpLogger;
import io.mcpstdio.pagination.CursorCodec;
import io.mcpstdio.pagination.McpPaginator;
import io.mcpstdio.spec.JsonRpcLineCodec;
import io.mcpstdio.spec.McpError;
import io.mcpstdio.spec.McpLineTransport;
import io.mcpstdio.spec.McpSchema;
import io.mcpstdio.spec.McpServerSession;
import io.mcpstdio.spec.McpSessionState;
import io.mcpstdio.util.Utils;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

/**
 * An MCP server serving one client over a line transport. Requests are handled one at a
 * time on the thread that calls {@link #run()}.
 *
 * <p>
 * Resources, tools and prompts live in in-memory repositories and may be added or
 * removed while the server runs; listings are paged with cursors, so a client paging
 * through a changing collection may see items shift between pages.
 *
 * @see McpServer
 */
public class McpSyncServer {

	public static final String SHUTDOWN_STATUS = "shutting down";

	private final McpSchema.Implementation serverInfo;

	private final String instructions;

	private final McpSchema.ServerCapabilities serverCapabilities;

	private final InMemoryResourceRepository resourceRepository;

	private final InMemoryToolsRepository toolsRepository;

	private final InMemoryPromptRepository promptRepository;

	private final McpServerDispatcher dispatcher;

	private final McpServerSession session;

	private final McpLogger logger;

	McpSyncServer(McpServer.SyncSpecification specification) {
		this.serverInfo = specification.serverInfo;
		this.instructions = specification.instructions;
		this.logger = specification.logger;
		this.serverCapabilities = new McpSchema.ServerCapabilities(
				new McpSchema.ServerCapabilities.ResourceCapabilities(false, false),
				new McpSchema.ServerCapabilities.ToolCapabilities(false),
				new McpSchema.ServerCapabilities.PromptCapabilities(false));

		McpPaginator paginator = new McpPaginator(new CursorCodec(specification.jsonMapper));
		int pageSize = specification.defaultPageSize;
		this.resourceRepository = new InMemoryResourceRepository(paginator, pageSize, specification.resources);
		this.toolsRepository = new InMemoryToolsRepository(paginator, pageSize, specification.tools);
		this.promptRepository = new InMemoryPromptRepository(paginator, pageSize, specification.prompts);

		this.dispatcher = new McpServerDispatcher(specification.jsonMapper, this.logger);
		registerRoutes();

		this.session = new McpServerSession(specification.transport, new JsonRpcLineCodec(specification.jsonMapper),
				this.dispatcher, Map.copyOf(specification.notificationHandlers), specification.maxRequests,
				this.logger);
	}

	private void registerRoutes() {
		this.dispatcher
			.route(McpSchema.METHOD_INITIALIZE, McpSchema.InitializeRequest.class, this::initialize)
			.route(McpSchema.METHOD_PING, Object.class, params -> Mono.just(Map.of()))
			.route(McpSchema.METHOD_RESOURCES_LIST, McpSchema.PaginatedRequest.class,
					request -> this.resourceRepository.listResources(request.cursor()))
			.route(McpSchema.METHOD_RESOURCES_READ, McpSchema.ReadResourceRequest.class, this::readResource)
			.route(McpSchema.METHOD_TOOLS_LIST, McpSchema.PaginatedRequest.class,
					request -> this.toolsRepository.listTools(request.cursor()))
			.route(McpSchema.METHOD_TOOLS_CALL, McpSchema.CallToolRequest.class, this::callTool)
			.route(McpSchema.METHOD_PROMPT_LIST, McpSchema.PaginatedRequest.class,
					request -> this.promptRepository.listPrompts(request.cursor()))
			.route(McpSchema.METHOD_SHUTDOWN, Object.class, params -> Mono
				.just(new McpSchema.ShutdownResult(SHUTDOWN_STATUS, "Server shutdown initiated")));
	}

	private Mono<McpSchema.InitializeResult> initialize(McpSchema.InitializeRequest request) {
		this.logger.info("Client initialize request - Protocol: " + request.protocolVersion() + ", Info: "
				+ request.clientInfo());
		if (request.protocolVersion() != null
				&& !McpSchema.LATEST_PROTOCOL_VERSION.equals(request.protocolVersion())) {
			this.logger.warn("Client requested unsupported protocol version: " + request.protocolVersion()
					+ ", answering with " + McpSchema.LATEST_PROTOCOL_VERSION);
		}
		return Mono.just(new McpSchema.InitializeResult(McpSchema.LATEST_PROTOCOL_VERSION, this.serverCapabilities,
				this.serverInfo, this.instructions));
	}

	private Mono<McpSchema.ReadResourceResult> readResource(McpSchema.ReadResourceRequest request) {
		String uri = request.uri();
		if (!Utils.hasText(uri)) {
			return Mono.error(McpError.RESOURCE_NOT_FOUND.apply(""));
		}
		return this.resourceRepository.resolveResource(uri)
			.switchIfEmpty(Mono.error(() -> McpError.RESOURCE_NOT_FOUND.apply(uri)))
			.map(specification -> specification.readHandler().apply(request))
			.subscribeOn(Schedulers.boundedElastic());
	}

	private Mono<McpSchema.CallToolResult> callTool(McpSchema.CallToolRequest request) {
		String name = request.name();
		if (!Utils.hasText(name)) {
			return Mono.error(McpError.TOOL_NOT_FOUND.apply(""));
		}
		return this.toolsRepository.resolveToolForCall(name)
			.switchIfEmpty(Mono.error(() -> McpError.TOOL_NOT_FOUND.apply(name)))
			.map(specification -> specification.callHandler().apply(request))
			.subscribeOn(Schedulers.boundedElastic());
	}

	/**
	 * Serves requests on the calling thread until the client sends {@code shutdown},
	 * closes its end of the stream, or the request limit is reached. The transport is
	 * released before this method returns.
	 */
	public void run() {
		try {
			this.session.run();
		}
		finally {
			close();
		}
	}

	public McpSessionState getState() {
		return this.session.getState();
	}

	public McpSchema.Implementation getServerInfo() {
		return this.serverInfo;
	}

	public McpSchema.ServerCapabilities getServerCapabilities() {
		return this.serverCapabilities;
	}

	// ---------------------------------------
	// Runtime feature management
	// ---------------------------------------

	public void addResource(McpServerFeatures.SyncResourceSpecification resource) {
		this.resourceRepository.addResource(resource);
	}

	public void removeResource(String uri) {
		this.resourceRepository.removeResource(uri);
	}

	public void addTool(McpServerFeatures.SyncToolSpecification tool) {
		this.toolsRepository.addTool(tool);
	}

	public void removeTool(String name) {
		this.toolsRepository.removeTool(name);
	}

	public void addPrompt(McpSchema.Prompt prompt) {
		this.promptRepository.addPrompt(prompt);
	}

	public void removePrompt(String name) {
		this.promptRepository.removePrompt(name);
	}

	McpServerDispatcher getDispatcher() {
		return this.dispatcher;
	}

	/**
	 * Stops serving and releases the transport.
	 */
	public void close() {
		this.session.close();
	}

}
