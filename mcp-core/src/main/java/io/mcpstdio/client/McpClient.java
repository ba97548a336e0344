/*
 * Copyright 2025-2026 the original author or authors.
 */

package io.mcpstdio.client;

import java.time.Duration;
import java.util.HashMap;
import java.util.Map;

import io.mcpstdio.json.McpJsonDefaults;
import io.mcpstdio.json.McpJsonMapper;
import io.mcpstdio.logger.McpLogger;
import io.mcpstdio.logger.Slf4jMcpLogger;
import io.mcpstdio.spec.JsonRpcLineCodec;
import io.mcpstdio.spec.McpClientSession;
import io.mcpstdio.spec.McpLineTransport;
import io.mcpstdio.spec.McpSchema;
import io.mcpstdio.spec.RequestIdGenerator;
import io.mcpstdio.util.Assert;

/**
 * Factory class for creating Model Context Protocol (MCP) clients.
 *
 * <p>
 * Example of creating a basic synchronous client: <pre>{@code
 * StdioClientTransport transport = StdioClientTransport.launch(
 *     ServerParameters.builder("python3").args("server.py").build());
 *
 * McpSyncClient client = McpClient.sync(transport)
 *     .requestTimeout(Duration.ofSeconds(10))
 *     .clientInfo(new McpSchema.Implementation("my-client", "1.0.0"))
 *     .build();
 *
 * client.initialize();
 * List<McpSchema.Resource> resources = client.listAllResources();
 * client.shutdown();
 * }</pre>
 *
 * @see McpAsyncClient
 * @see McpSyncClient
 */
public interface McpClient {

	Duration DEFAULT_REQUEST_TIMEOUT = Duration.ofSeconds(20);

	Duration DEFAULT_INITIALIZATION_TIMEOUT = Duration.ofSeconds(20);

	McpSchema.Implementation DEFAULT_CLIENT_INFO = new McpSchema.Implementation("mcp-stdio-client", "1.0.0");

	/**
	 * Start building a synchronous MCP client over the given transport. The client owns
	 * the transport from now on and terminates it on shutdown or close.
	 * @param transport the line transport to the server
	 * @return a new builder instance
	 */
	static SyncSpec sync(McpLineTransport transport) {
		return new SyncSpec(transport);
	}

	/**
	 * Start building an asynchronous MCP client over the given transport.
	 * @param transport the line transport to the server
	 * @return a new builder instance
	 */
	static AsyncSpec async(McpLineTransport transport) {
		return new AsyncSpec(transport);
	}

	/**
	 * Settings shared by the synchronous and asynchronous builders.
	 */
	abstract class Spec<S extends Spec<S>> {

		final McpLineTransport transport;

		Duration requestTimeout = DEFAULT_REQUEST_TIMEOUT;

		Duration initializationTimeout = DEFAULT_INITIALIZATION_TIMEOUT;

		McpSchema.Implementation clientInfo = DEFAULT_CLIENT_INFO;

		McpSchema.ClientCapabilities capabilities = McpSchema.ClientCapabilities.empty();

		RequestIdGenerator requestIdGenerator = RequestIdGenerator.ofDefault();

		McpJsonMapper jsonMapper;

		McpLogger logger;

		final Map<String, McpClientSession.NotificationHandler> notificationHandlers = new HashMap<>();

		Spec(McpLineTransport transport) {
			Assert.notNull(transport, "Transport must not be null");
			this.transport = transport;
		}

		@SuppressWarnings("unchecked")
		private S self() {
			return (S) this;
		}

		/**
		 * How long each request waits for its response. Defaults to 20 seconds.
		 */
		public S requestTimeout(Duration requestTimeout) {
			Assert.notNull(requestTimeout, "Request timeout must not be null");
			this.requestTimeout = requestTimeout;
			return self();
		}

		/**
		 * How long {@code initialize} waits for the server. Defaults to 20 seconds.
		 */
		public S initializationTimeout(Duration initializationTimeout) {
			Assert.notNull(initializationTimeout, "Initialization timeout must not be null");
			this.initializationTimeout = initializationTimeout;
			return self();
		}

		public S clientInfo(McpSchema.Implementation clientInfo) {
			Assert.notNull(clientInfo, "Client info must not be null");
			this.clientInfo = clientInfo;
			return self();
		}

		public S capabilities(McpSchema.ClientCapabilities capabilities) {
			Assert.notNull(capabilities, "Capabilities must not be null");
			this.capabilities = capabilities;
			return self();
		}

		public S requestIdGenerator(RequestIdGenerator requestIdGenerator) {
			Assert.notNull(requestIdGenerator, "Request id generator must not be null");
			this.requestIdGenerator = requestIdGenerator;
			return self();
		}

		public S notificationHandler(String method, McpClientSession.NotificationHandler handler) {
			Assert.hasText(method, "Method must not be empty");
			Assert.notNull(handler, "Handler must not be null");
			this.notificationHandlers.put(method, handler);
			return self();
		}

		public S jsonMapper(McpJsonMapper jsonMapper) {
			Assert.notNull(jsonMapper, "JsonMapper must not be null");
			this.jsonMapper = jsonMapper;
			return self();
		}

		public S logger(McpLogger logger) {
			Assert.notNull(logger, "Logger must not be null");
			this.logger = logger;
			return self();
		}

		DefaultMcpAsyncClient buildAsyncClient() {
			McpJsonMapper mapper = this.jsonMapper != null ? this.jsonMapper : McpJsonDefaults.getMapper();
			McpLogger sink = this.logger != null ? this.logger : new Slf4jMcpLogger(McpClientSession.class);
			McpClientSession session = new McpClientSession(this.requestTimeout, this.transport,
					new JsonRpcLineCodec(mapper), this.requestIdGenerator, Map.of(), this.notificationHandlers, sink);
			return new DefaultMcpAsyncClient(session, this.clientInfo, this.capabilities, this.initializationTimeout,
					sink);
		}

	}

	/**
	 * Builder of {@link McpSyncClient}.
	 */
	class SyncSpec extends Spec<SyncSpec> {

		SyncSpec(McpLineTransport transport) {
			super(transport);
		}

		public McpSyncClient build() {
			DefaultMcpAsyncClient asyncClient = buildAsyncClient();
			// shutdown waits up to one request timeout plus the process grace period
			Duration closeTimeout = this.requestTimeout.plusSeconds(10);
			return new DefaultMcpSyncClient(asyncClient, closeTimeout,
					this.logger != null ? this.logger : new Slf4jMcpLogger(McpSyncClient.class));
		}

	}

	/**
	 * Builder of {@link McpAsyncClient}.
	 */
	class AsyncSpec extends Spec<AsyncSpec> {

		AsyncSpec(McpLineTransport transport) {
			super(transport);
		}

		public McpAsyncClient build() {
			return buildAsyncClient();
		}

	}

}
