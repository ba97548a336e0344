/*
 * Copyright 2025-2026 the original author or authors.
 */

package io.mcpstdio.client;

import java.time.Duration;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.function.Function;

import io.mcpstdio.json.TypeRef;
import io.mcpstdio.logger.McpLogger;
import io.mcpstdio.spec.McpClientSession;
import io.mcpstdio.spec.McpReadTimeoutException;
import io.mcpstdio.spec.McpSchema;
import io.mcpstdio.spec.McpSessionState;
import io.mcpstdio.util.Assert;
import io.mcpstdio.util.Utils;
import reactor.core.publisher.Mono;

/**
 * {@link McpAsyncClient} on top of a {@link McpClientSession}.
 */
class DefaultMcpAsyncClient implements McpAsyncClient {

	private static final TypeRef<Object> OBJECT_TYPE_REF = new TypeRef<>() {
	};

	private static final TypeRef<McpSchema.ListResourcesResult> LIST_RESOURCES_RESULT_TYPE_REF = new TypeRef<>() {
	};

	private static final TypeRef<McpSchema.ReadResourceResult> READ_RESOURCE_RESULT_TYPE_REF = new TypeRef<>() {
	};

	private static final TypeRef<McpSchema.ListToolsResult> LIST_TOOLS_RESULT_TYPE_REF = new TypeRef<>() {
	};

	private static final TypeRef<McpSchema.CallToolResult> CALL_TOOL_RESULT_TYPE_REF = new TypeRef<>() {
	};

	private static final TypeRef<McpSchema.ListPromptsResult> LIST_PROMPTS_RESULT_TYPE_REF = new TypeRef<>() {
	};

	private final McpClientSession session;

	private final McpSchema.Implementation clientInfo;

	private final McpSchema.ClientCapabilities clientCapabilities;

	private final Duration initializationTimeout;

	private final McpLogger logger;

	private volatile McpSchema.InitializeResult initializeResult;

	DefaultMcpAsyncClient(McpClientSession session, McpSchema.Implementation clientInfo,
			McpSchema.ClientCapabilities clientCapabilities, Duration initializationTimeout, McpLogger logger) {
		Assert.notNull(session, "Session must not be null");
		Assert.notNull(clientInfo, "Client info must not be null");
		Assert.notNull(clientCapabilities, "Client capabilities must not be null");
		Assert.notNull(initializationTimeout, "Initialization timeout must not be null");
		Assert.notNull(logger, "Logger must not be null");
		this.session = session;
		this.clientInfo = clientInfo;
		this.clientCapabilities = clientCapabilities;
		this.initializationTimeout = initializationTimeout;
		this.logger = logger;
	}

	@Override
	public McpSchema.InitializeResult getCurrentInitializationResult() {
		return this.initializeResult;
	}

	@Override
	public McpSchema.ServerCapabilities getServerCapabilities() {
		McpSchema.InitializeResult result = this.initializeResult;
		return result != null ? result.capabilities() : null;
	}

	@Override
	public String getServerInstructions() {
		McpSchema.InitializeResult result = this.initializeResult;
		return result != null ? result.instructions() : null;
	}

	@Override
	public McpSchema.Implementation getServerInfo() {
		McpSchema.InitializeResult result = this.initializeResult;
		return result != null ? result.serverInfo() : null;
	}

	@Override
	public boolean isInitialized() {
		return this.session.getState() == McpSessionState.INITIALIZED;
	}

	@Override
	public McpSessionState getState() {
		return this.session.getState();
	}

	@Override
	public McpSchema.ClientCapabilities getClientCapabilities() {
		return this.clientCapabilities;
	}

	@Override
	public McpSchema.Implementation getClientInfo() {
		return this.clientInfo;
	}

	@Override
	public void close() {
		this.session.close();
	}

	@Override
	public Mono<Void> closeGracefully() {
		return Mono.defer(() -> {
			if (this.session.getState() == McpSessionState.INITIALIZED) {
				return shutdown();
			}
			return Mono.fromRunnable(this::close);
		});
	}

	// --------------------------
	// Lifecycle
	// --------------------------

	@Override
	public Mono<McpSchema.InitializeResult> initialize() {
		McpSchema.InitializeRequest initializeRequest = new McpSchema.InitializeRequest(
				McpSchema.LATEST_PROTOCOL_VERSION, this.clientCapabilities, this.clientInfo);
		return this.session.initialize(initializeRequest)
			.timeout(this.initializationTimeout,
					Mono.error(() -> new McpReadTimeoutException(
							"Server did not complete initialization within " + this.initializationTimeout.toMillis()
									+ " ms")))
			.doOnNext(result -> {
				if (!McpSchema.LATEST_PROTOCOL_VERSION.equals(result.protocolVersion())) {
					this.logger.warn("Server answered with protocol version " + result.protocolVersion()
							+ ", expected " + McpSchema.LATEST_PROTOCOL_VERSION);
				}
				this.initializeResult = result;
			});
	}

	@Override
	public Mono<Void> shutdown() {
		return this.session.shutdown();
	}

	@Override
	public Mono<Object> ping() {
		return this.session.sendRequest(McpSchema.METHOD_PING, null, OBJECT_TYPE_REF);
	}

	// --------------------------
	// Resources
	// --------------------------

	@Override
	public Mono<McpSchema.ListResourcesResult> listResources() {
		return listResources(McpSchema.FIRST_PAGE);
	}

	@Override
	public Mono<McpSchema.ListResourcesResult> listResources(String cursor) {
		return this.session.sendRequest(McpSchema.METHOD_RESOURCES_LIST, new McpSchema.PaginatedRequest(cursor),
				LIST_RESOURCES_RESULT_TYPE_REF);
	}

	@Override
	public Mono<List<McpSchema.Resource>> listAllResources() {
		return collectAllPages(this::listResources, McpSchema.ListResourcesResult::resources,
				McpSchema.ListResourcesResult::nextCursor);
	}

	@Override
	public Mono<McpSchema.ReadResourceResult> readResource(McpSchema.Resource resource) {
		Assert.notNull(resource, "Resource must not be null");
		return readResource(new McpSchema.ReadResourceRequest(resource.uri()));
	}

	@Override
	public Mono<McpSchema.ReadResourceResult> readResource(McpSchema.ReadResourceRequest readResourceRequest) {
		return this.session.sendRequest(McpSchema.METHOD_RESOURCES_READ, readResourceRequest,
				READ_RESOURCE_RESULT_TYPE_REF);
	}

	// --------------------------
	// Tools
	// --------------------------

	@Override
	public Mono<McpSchema.ListToolsResult> listTools() {
		return listTools(McpSchema.FIRST_PAGE);
	}

	@Override
	public Mono<McpSchema.ListToolsResult> listTools(String cursor) {
		return this.session.sendRequest(McpSchema.METHOD_TOOLS_LIST, new McpSchema.PaginatedRequest(cursor),
				LIST_TOOLS_RESULT_TYPE_REF);
	}

	@Override
	public Mono<List<McpSchema.Tool>> listAllTools() {
		return collectAllPages(this::listTools, McpSchema.ListToolsResult::tools,
				McpSchema.ListToolsResult::nextCursor);
	}

	@Override
	public Mono<McpSchema.CallToolResult> callTool(McpSchema.CallToolRequest callToolRequest) {
		return this.session.sendRequest(McpSchema.METHOD_TOOLS_CALL, callToolRequest, CALL_TOOL_RESULT_TYPE_REF);
	}

	// --------------------------
	// Prompts
	// --------------------------

	@Override
	public Mono<McpSchema.ListPromptsResult> listPrompts() {
		return listPrompts(McpSchema.FIRST_PAGE);
	}

	@Override
	public Mono<McpSchema.ListPromptsResult> listPrompts(String cursor) {
		return this.session.sendRequest(McpSchema.METHOD_PROMPT_LIST, new McpSchema.PaginatedRequest(cursor),
				LIST_PROMPTS_RESULT_TYPE_REF);
	}

	@Override
	public Mono<List<McpSchema.Prompt>> listAllPrompts() {
		return collectAllPages(this::listPrompts, McpSchema.ListPromptsResult::prompts,
				McpSchema.ListPromptsResult::nextCursor);
	}

	/**
	 * Follows {@code nextCursor} until it is absent or repeats.
	 */
	private <R, T> Mono<List<T>> collectAllPages(Function<String, Mono<R>> pageFetcher,
			Function<R, List<T>> items, Function<R, String> nextCursor) {
		return Mono.defer(() -> {
			Set<String> seenCursors = new HashSet<>();
			return pageFetcher.apply(McpSchema.FIRST_PAGE).expand(page -> {
				String cursor = nextCursor.apply(page);
				if (!Utils.hasText(cursor)) {
					return Mono.empty();
				}
				if (!seenCursors.add(cursor)) {
					this.logger.warn("Server repeated cursor " + cursor + ", stopping pagination");
					return Mono.empty();
				}
				return pageFetcher.apply(cursor);
			}).concatMapIterable(page -> {
				List<T> pageItems = items.apply(page);
				return pageItems != null ? pageItems : List.of();
			}).collectList();
		});
	}

}
