/*
 * Copyright 2025-2026 the original author or authors.
 */

package io.mcpstdio.client;

import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.Map;

import io.mcpstdio.client.transport.ServerParameters;
import io.mcpstdio.client.transport.StdioClientTransport;
import io.mcpstdio.json.McpJsonDefaults;
import io.mcpstdio.logger.Slf4jMcpLogger;
import io.mcpstdio.pagination.CursorCodec;
import io.mcpstdio.pagination.PaginationCursor;
import io.mcpstdio.security.CommandAllowlist;
import io.mcpstdio.spec.McpConnectionLostException;
import io.mcpstdio.spec.McpError;
import io.mcpstdio.spec.McpProtocolViolationException;
import io.mcpstdio.spec.McpSchema;
import io.mcpstdio.spec.McpSessionState;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.Timeout;
import org.junit.jupiter.api.condition.EnabledOnOs;
import org.junit.jupiter.api.condition.OS;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * End-to-end tests of {@link McpSyncClient} against {@link PaginationTestServer} running
 * in a separate JVM.
 */
@Timeout(60)
@EnabledOnOs({ OS.LINUX, OS.MAC })
class StdioMcpSyncClientTests {

	private static final Duration REQUEST_TIMEOUT = Duration.ofSeconds(10);

	private StdioClientTransport transport;

	private McpSyncClient client;

	@BeforeEach
	void setUp() {
		String java = Path.of(System.getProperty("java.home"), "bin", "java").toString();
		ServerParameters params = ServerParameters.builder(java)
			.args("-cp", System.getProperty("java.class.path"), PaginationTestServer.class.getName())
			.build();
		this.transport = StdioClientTransport.launch(params, new CommandAllowlist(),
				StdioClientTransport.DEFAULT_TERMINATE_GRACE_PERIOD, new Slf4jMcpLogger(StdioMcpSyncClientTests.class));
		this.client = McpClient.sync(this.transport)
			.requestTimeout(REQUEST_TIMEOUT)
			.initializationTimeout(Duration.ofSeconds(30))
			.clientInfo(new McpSchema.Implementation("stdio-test-client", "1.0.0"))
			.build();
	}

	@AfterEach
	void tearDown() {
		this.client.close();
		assertThat(this.transport.isAlive()).isFalse();
	}

	@Test
	void initializeAndPing() {
		McpSchema.InitializeResult result = this.client.initialize();

		assertThat(result.serverInfo().name()).isEqualTo(PaginationTestServer.SERVER_NAME);
		assertThat(result.protocolVersion()).isEqualTo(McpSchema.LATEST_PROTOCOL_VERSION);
		assertThat(this.client.isInitialized()).isTrue();
		assertThat(this.client.getServerInfo()).isEqualTo(result.serverInfo());
		assertThat(this.client.ping()).isNotNull();
	}

	@Test
	void readBeforeInitializeIsRefusedImmediately() {
		long start = System.nanoTime();

		assertThatThrownBy(() -> this.client.readResource(new McpSchema.ReadResourceRequest(PaginationTestServer.resourceUri(0))))
			.isInstanceOf(McpProtocolViolationException.class);

		assertThat(Duration.ofNanos(System.nanoTime() - start)).isLessThan(REQUEST_TIMEOUT);
	}

	@Test
	void firstPageCarriesCursorToTheSecond() {
		this.client.initialize();

		McpSchema.ListResourcesResult first = this.client.listResources();

		assertThat(first.resources()).hasSize(PaginationTestServer.PAGE_SIZE);
		assertThat(new CursorCodec(McpJsonDefaults.getMapper()).decode(first.nextCursor()))
			.isEqualTo(new PaginationCursor(25, 25, PaginationTestServer.RESOURCE_COUNT));

		McpSchema.ListResourcesResult second = this.client.listResources(first.nextCursor());
		assertThat(second.resources()).hasSize(PaginationTestServer.PAGE_SIZE);
		assertThat(second.resources()).doesNotContainAnyElementsOf(first.resources());
	}

	@Test
	void listAllFollowsCursorsToTheEnd() {
		this.client.initialize();

		List<McpSchema.Resource> resources = this.client.listAllResources();
		List<McpSchema.Tool> tools = this.client.listAllTools();
		List<McpSchema.Prompt> prompts = this.client.listAllPrompts();

		assertThat(resources).hasSize(PaginationTestServer.RESOURCE_COUNT)
			.extracting(McpSchema.Resource::uri)
			.doesNotHaveDuplicates()
			.contains(PaginationTestServer.resourceUri(0), PaginationTestServer.resourceUri(499));
		assertThat(tools).hasSize(PaginationTestServer.TOOL_COUNT + 2)
			.extracting(McpSchema.Tool::name)
			.doesNotHaveDuplicates();
		assertThat(prompts).hasSize(PaginationTestServer.PROMPT_COUNT);
	}

	@Test
	void readsResourcesAndReportsMissingOnes() {
		this.client.initialize();

		McpSchema.ReadResourceResult result = this.client
			.readResource(new McpSchema.ReadResourceRequest(PaginationTestServer.resourceUri(42)));
		assertThat(result.contents()).singleElement().satisfies(contents -> {
			assertThat(contents.uri()).isEqualTo(PaginationTestServer.resourceUri(42));
			assertThat(contents.mimeType()).isEqualTo("application/json");
			assertThat(contents.text()).contains("resource_000042");
		});

		assertThatThrownBy(() -> this.client.readResource(new McpSchema.ReadResourceRequest("test://data/missing.json")))
			.isInstanceOfSatisfying(McpError.class, error -> {
				assertThat(error.getCode()).isEqualTo(McpSchema.ErrorCodes.RESOURCE_NOT_FOUND);
				assertThat(error.getJsonRpcError().data()).isEqualTo(Map.of("uri", "test://data/missing.json"));
			});
	}

	@Test
	void invalidCursorIsReportedByTheServer() {
		this.client.initialize();

		assertThatThrownBy(() -> this.client.listTools("not-base64!!")).isInstanceOfSatisfying(McpError.class,
				error -> assertThat(error.getCode()).isEqualTo(McpSchema.ErrorCodes.INVALID_PARAMS));
		assertThat(this.client.isInitialized()).isTrue();
	}

	@Test
	void callsTools() {
		this.client.initialize();

		McpSchema.CallToolResult result = this.client
			.callTool(new McpSchema.CallToolRequest("echo", Map.of("text", "hello ✓")));

		assertThat(result.content()).singleElement()
			.satisfies(content -> assertThat(content.text()).isEqualTo("hello ✓"));
	}

	@Test
	void serverExitDuringRequestIsConnectionLost() {
		this.client.initialize();
		long start = System.nanoTime();

		assertThatThrownBy(() -> this.client.callTool(new McpSchema.CallToolRequest("crash", Map.of())))
			.isInstanceOf(McpConnectionLostException.class);

		assertThat(Duration.ofNanos(System.nanoTime() - start)).isLessThan(REQUEST_TIMEOUT);
		assertThat(this.client.getState()).isEqualTo(McpSessionState.TERMINATED);
	}

	@Test
	void shutdownStopsTheServerProcess() {
		this.client.initialize();

		this.client.shutdown();

		assertThat(this.client.getState()).isEqualTo(McpSessionState.TERMINATED);
		assertThat(this.transport.isAlive()).isFalse();
	}

	@Test
	void closeGracefullyShutsDownAnInitializedClient() {
		this.client.initialize();

		assertThat(this.client.closeGracefully()).isTrue();
		assertThat(this.transport.isAlive()).isFalse();
	}

}
