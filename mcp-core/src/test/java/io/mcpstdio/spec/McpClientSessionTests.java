/*
 * Copyright 2025-2026 the original author or authors.
 */

package io.mcpstdio.spec;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;

import io.mcpstdio.MockLineTransport;
import io.mcpstdio.json.TypeRef;
import io.mcpstdio.logger.Slf4jMcpLogger;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import reactor.core.publisher.Mono;
import reactor.test.StepVerifier;

import static org.assertj.core.api.Assertions.assertThat;
import static org.awaitility.Awaitility.await;

/**
 * Test suite for {@link McpClientSession} covering request-response correlation, the
 * initialization gate and failure propagation.
 */
class McpClientSessionTests {

	private static final Duration TIMEOUT = Duration.ofSeconds(5);

	private static final TypeRef<Map<String, Object>> MAP_TYPE = new TypeRef<>() {
	};

	private static final Map<String, Object> INITIALIZE_RESULT = Map.of("protocolVersion",
			McpSchema.LATEST_PROTOCOL_VERSION, "capabilities", Map.of("resources", Map.of()), "serverInfo",
			Map.of("name", "test-server", "version", "1.0.0"));

	private final List<Object> notifications = new CopyOnWriteArrayList<>();

	private MockLineTransport transport;

	private McpClientSession session;

	@BeforeEach
	void setUp() {
		this.transport = new MockLineTransport();
		this.session = newSession(TIMEOUT);
	}

	private McpClientSession newSession(Duration timeout) {
		return new McpClientSession(timeout, this.transport, this.transport.getCodec(),
				RequestIdGenerator.ofIncremental(), Map.of(),
				Map.of("notifications/message", params -> Mono.fromRunnable(() -> this.notifications.add(params))),
				new Slf4jMcpLogger(McpClientSessionTests.class));
	}

	@AfterEach
	void tearDown() {
		this.session.close();
	}

	private void initializeSession() {
		StepVerifier.create(this.session.initialize(initializeRequest())).then(() -> {
			McpSchema.JSONRPCRequest request = this.transport.awaitSentRequest();
			assertThat(request.method()).isEqualTo(McpSchema.METHOD_INITIALIZE);
			this.transport.respond(request, INITIALIZE_RESULT);
		}).assertNext(result -> assertThat(result.serverInfo().name()).isEqualTo("test-server")).verifyComplete();

		McpSchema.JSONRPCMessage initialized = this.transport.awaitSentMessage();
		assertThat(initialized).isInstanceOfSatisfying(McpSchema.JSONRPCNotification.class,
				notification -> assertThat(notification.method())
					.isEqualTo(McpSchema.METHOD_NOTIFICATION_INITIALIZED));
	}

	private static McpSchema.InitializeRequest initializeRequest() {
		return new McpSchema.InitializeRequest(McpSchema.LATEST_PROTOCOL_VERSION,
				McpSchema.ClientCapabilities.empty(), new McpSchema.Implementation("test-client", "1.0.0"));
	}

	@Test
	void initializeMovesSessionToInitialized() {
		assertThat(this.session.getState()).isEqualTo(McpSessionState.UNINITIALIZED);

		initializeSession();

		assertThat(this.session.getState()).isEqualTo(McpSessionState.INITIALIZED);
	}

	@Test
	void requestBeforeInitializeIsProtocolViolationAndNothingIsSent() {
		StepVerifier
			.create(this.session.sendRequest(McpSchema.METHOD_RESOURCES_READ,
					new McpSchema.ReadResourceRequest("test://a"), MAP_TYPE))
			.expectErrorSatisfies(error -> {
				assertThat(error).isInstanceOf(McpProtocolViolationException.class);
				assertThat(((McpProtocolViolationException) error).getState())
					.isEqualTo(McpSessionState.UNINITIALIZED);
			})
			.verify(Duration.ofSeconds(1));

		assertThat(this.transport.getSentLines()).isEmpty();
	}

	@Test
	void secondInitializeIsProtocolViolation() {
		initializeSession();

		StepVerifier.create(this.session.initialize(initializeRequest()))
			.expectError(McpProtocolViolationException.class)
			.verify(Duration.ofSeconds(1));
	}

	@Test
	void lifecycleMethodsCannotBeSentAsPlainRequests() {
		initializeSession();

		StepVerifier.create(this.session.sendRequest(McpSchema.METHOD_SHUTDOWN, null, MAP_TYPE))
			.expectError(IllegalArgumentException.class)
			.verify(Duration.ofSeconds(1));
	}

	@Test
	void failedInitializeCanBeRetried() {
		StepVerifier.create(this.session.initialize(initializeRequest())).then(() -> {
			McpSchema.JSONRPCRequest request = this.transport.awaitSentRequest();
			this.transport.respondWithError(request, McpSchema.ErrorCodes.INTERNAL_ERROR, "not ready");
		}).expectErrorSatisfies(error -> assertThat(error).isInstanceOf(McpError.class).hasMessage("not ready"))
			.verify(TIMEOUT);

		assertThat(this.session.getState()).isEqualTo(McpSessionState.UNINITIALIZED);
		initializeSession();
	}

	@Test
	void responsesAreMatchedByIdWhateverTheirOrder() {
		initializeSession();

		Mono<Map<String, Object>> first = this.session.sendRequest("tools/list", Map.of(), MAP_TYPE);
		Mono<Map<String, Object>> second = this.session.sendRequest("prompts/list", Map.of(), MAP_TYPE);

		StepVerifier.create(Mono.zip(first, second)).then(() -> {
			McpSchema.JSONRPCRequest firstRequest = this.transport.awaitSentRequest();
			McpSchema.JSONRPCRequest secondRequest = this.transport.awaitSentRequest();
			assertThat(firstRequest.id()).isNotEqualTo(secondRequest.id());
			this.transport.respond(secondRequest, Map.of("answer", secondRequest.method()));
			this.transport.respond(firstRequest, Map.of("answer", firstRequest.method()));
		}).assertNext(results -> {
			assertThat(results.getT1()).containsEntry("answer", "tools/list");
			assertThat(results.getT2()).containsEntry("answer", "prompts/list");
		}).verifyComplete();

		assertThat(this.session.pendingRequestCount()).isZero();
	}

	@Test
	void errorResponseSurfacesAsMcpError() {
		initializeSession();

		StepVerifier.create(this.session.sendRequest(McpSchema.METHOD_RESOURCES_READ,
				new McpSchema.ReadResourceRequest("test://missing"), MAP_TYPE)).then(() -> {
					McpSchema.JSONRPCRequest request = this.transport.awaitSentRequest();
					this.transport.simulateIncomingMessage(new McpSchema.JSONRPCResponse(McpSchema.JSONRPC_VERSION,
							request.id(), null, McpError.RESOURCE_NOT_FOUND.apply("test://missing").getJsonRpcError()));
				}).expectErrorSatisfies(error -> {
					assertThat(error).isInstanceOf(McpError.class);
					McpError mcpError = (McpError) error;
					assertThat(mcpError.getCode()).isEqualTo(McpSchema.ErrorCodes.RESOURCE_NOT_FOUND);
					assertThat(mcpError.getJsonRpcError().data()).isEqualTo(Map.of("uri", "test://missing"));
				}).verify(TIMEOUT);
	}

	@Test
	void unansweredRequestTimesOutAndIsForgotten() {
		this.session.close();
		this.transport = new MockLineTransport();
		this.session = newSession(Duration.ofMillis(300));
		initializeSession();

		StepVerifier.create(this.session.sendRequest("tools/list", Map.of(), MAP_TYPE))
			.expectErrorSatisfies(error -> {
				assertThat(error).isInstanceOf(McpReadTimeoutException.class);
				assertThat(((McpError) error).getCode()).isEqualTo(McpSchema.ErrorCodes.REQUEST_TIMEOUT);
			})
			.verify(TIMEOUT);

		assertThat(this.session.pendingRequestCount()).isZero();

		// the late answer is dropped and the session keeps working
		McpSchema.JSONRPCRequest stale = this.transport.awaitSentRequest();
		this.transport.respond(stale, Map.of("late", true));

		StepVerifier.create(this.session.sendRequest("prompts/list", Map.of(), MAP_TYPE)).then(() -> {
			McpSchema.JSONRPCRequest request = this.transport.awaitSentRequest();
			this.transport.respond(request, Map.of("fresh", true));
		}).assertNext(result -> assertThat(result).containsEntry("fresh", true)).verifyComplete();
	}

	@Test
	void endOfStreamFailsOutstandingRequestsWithConnectionLost() {
		initializeSession();

		StepVerifier.create(this.session.sendRequest("tools/list", Map.of(), MAP_TYPE)).then(() -> {
			this.transport.awaitSentRequest();
			this.transport.simulateEndOfStream();
		}).expectError(McpConnectionLostException.class).verify(TIMEOUT);

		assertThat(this.session.getState()).isEqualTo(McpSessionState.TERMINATED);
		assertThat(this.session.pendingRequestCount()).isZero();

		StepVerifier.create(this.session.sendRequest("tools/list", Map.of(), MAP_TYPE))
			.expectError(McpProtocolViolationException.class)
			.verify(Duration.ofSeconds(1));
	}

	@Test
	void shutdownWaitsForResponseThenTerminatesTransport() {
		initializeSession();

		StepVerifier.create(this.session.shutdown()).then(() -> {
			McpSchema.JSONRPCRequest request = this.transport.awaitSentRequest();
			assertThat(request.method()).isEqualTo(McpSchema.METHOD_SHUTDOWN);
			this.transport.respond(request, Map.of("status", "shutting down"));
		}).verifyComplete();

		assertThat(this.session.getState()).isEqualTo(McpSessionState.TERMINATED);
		assertThat(this.transport.isTerminated()).isTrue();
	}

	@Test
	void shutdownTerminatesEvenWhenThePeerNeverAnswers() {
		this.session.close();
		this.transport = new MockLineTransport();
		this.session = newSession(Duration.ofMillis(300));
		initializeSession();

		StepVerifier.create(this.session.shutdown()).verifyComplete();

		assertThat(this.session.getState()).isEqualTo(McpSessionState.TERMINATED);
		assertThat(this.transport.isTerminated()).isTrue();
	}

	@Test
	void shutdownTerminatesWhenTheRequestCannotBeWritten() {
		initializeSession();
		this.transport.failSends(line -> line.contains("\"" + McpSchema.METHOD_SHUTDOWN + "\""),
				new McpTransportException("broken pipe while process alive"));

		StepVerifier.create(this.session.shutdown()).verifyComplete();

		assertThat(this.session.getState()).isEqualTo(McpSessionState.TERMINATED);
		assertThat(this.transport.isTerminated()).isTrue();
	}

	@Test
	void endOfStreamReleasesTheTransport() {
		initializeSession();

		this.transport.simulateEndOfStream();

		await().atMost(TIMEOUT).untilAsserted(() -> {
			assertThat(this.session.getState()).isEqualTo(McpSessionState.TERMINATED);
			assertThat(this.transport.isTerminated()).isTrue();
		});
	}

	@Test
	void shutdownBeforeInitializeIsProtocolViolation() {
		StepVerifier.create(this.session.shutdown())
			.expectError(McpProtocolViolationException.class)
			.verify(Duration.ofSeconds(1));
	}

	@Test
	void answersPingFromThePeer() {
		this.transport.simulateIncomingMessage(
				new McpSchema.JSONRPCRequest(McpSchema.JSONRPC_VERSION, McpSchema.METHOD_PING, "srv-1", null));

		McpSchema.JSONRPCResponse response = this.transport.awaitSentResponse();
		assertThat(response.id()).isEqualTo("srv-1");
		assertThat(response.result()).isEqualTo(Map.of());
		assertThat(response.error()).isNull();
	}

	@Test
	void unknownPeerRequestIsMethodNotFound() {
		this.transport.simulateIncomingMessage(
				new McpSchema.JSONRPCRequest(McpSchema.JSONRPC_VERSION, "sampling/createMessage", 42, Map.of()));

		McpSchema.JSONRPCResponse response = this.transport.awaitSentResponse();
		assertThat(response.id()).isEqualTo(42);
		assertThat(response.error().code()).isEqualTo(McpSchema.ErrorCodes.METHOD_NOT_FOUND);
	}

	@Test
	void notificationsReachTheirHandlerAndGarbageIsSkipped() {
		this.transport.simulateIncomingLine("this is not json");
		this.transport.simulateIncomingLine("");
		this.transport.simulateIncomingMessage(new McpSchema.JSONRPCNotification(McpSchema.JSONRPC_VERSION,
				"notifications/message", Map.of("level", "info")));

		await().atMost(TIMEOUT).untilAsserted(() -> assertThat(this.notifications).hasSize(1));
		assertThat(this.notifications.get(0)).isEqualTo(Map.of("level", "info"));
		assertThat(this.session.getState()).isEqualTo(McpSessionState.UNINITIALIZED);
	}

	@Test
	void closeIsIdempotent() {
		this.session.close();
		this.session.close();

		assertThat(this.session.getState()).isEqualTo(McpSessionState.TERMINATED);
		assertThat(this.transport.isTerminated()).isTrue();
	}

}
