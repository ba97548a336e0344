/*
 * Copyright 2025-2026 the original author or authors.
 */

package io.mcpstdio.server;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

import io.mcpstdio.json.McpJsonMapper;
import io.mcpstdio.logger.McpLogger;
import io.mcpstdio.spec.McpError;
import io.mcpstdio.spec.McpSchema;
import io.mcpstdio.spec.McpSchema.JSONRPCRequest;
import io.mcpstdio.spec.McpSchema.JSONRPCResponse;
import io.mcpstdio.spec.McpSchema.JSONRPCResponse.JSONRPCError;
import io.mcpstdio.spec.McpServerSession;
import io.mcpstdio.util.Assert;
import reactor.core.publisher.Mono;

/**
 * Routing table from method names to typed handlers.
 *
 * <p>
 * Every request is answered: an unknown method with {@code -32601}, params that cannot
 * be converted to the handler's request type with {@code -32602}, a handler failing
 * with {@link McpError} with that error, and any other handler failure with
 * {@code -32603}.
 */
public class McpServerDispatcher implements McpServerSession.RequestDispatcher {

	private record Route<P>(Class<P> paramsType, McpRequestHandler<P, ?> handler) {

		Mono<?> invoke(McpJsonMapper jsonMapper, Object params) {
			P request;
			try {
				request = jsonMapper.convertValue(params != null ? params : Map.of(), this.paramsType);
			}
			catch (IllegalArgumentException e) {
				return Mono.error(McpError.invalidParams("Invalid params: " + e.getMessage()));
			}
			return this.handler.handle(request);
		}

	}

	private final Map<String, Route<?>> routes = new LinkedHashMap<>();

	private final McpJsonMapper jsonMapper;

	private final McpLogger logger;

	public McpServerDispatcher(McpJsonMapper jsonMapper, McpLogger logger) {
		Assert.notNull(jsonMapper, "The jsonMapper can not be null");
		Assert.notNull(logger, "The logger can not be null");
		this.jsonMapper = jsonMapper;
		this.logger = logger;
	}

	/**
	 * Registers the handler of a method, replacing any previous one.
	 * @param <P> the typed params
	 * @param <R> the result type
	 * @param method the method name
	 * @param paramsType the type the params are converted into
	 * @param handler the handler
	 * @return this dispatcher
	 */
	public <P, R> McpServerDispatcher route(String method, Class<P> paramsType, McpRequestHandler<P, R> handler) {
		Assert.hasText(method, "method must not be empty");
		Assert.notNull(paramsType, "paramsType must not be null");
		Assert.notNull(handler, "handler must not be null");
		this.routes.put(method, new Route<>(paramsType, handler));
		return this;
	}

	public Set<String> methods() {
		return Collections.unmodifiableSet(this.routes.keySet());
	}

	@Override
	public Mono<JSONRPCResponse> dispatch(JSONRPCRequest request) {
		Route<?> route = this.routes.get(request.method());
		if (route == null) {
			this.logger.debug("No route for method " + request.method());
			return Mono.just(errorResponse(request, McpError.methodNotFound(request.method()).getJsonRpcError()));
		}
		return Mono.defer(() -> route.invoke(this.jsonMapper, request.params()))
			.<JSONRPCResponse>map(result -> new JSONRPCResponse(McpSchema.JSONRPC_VERSION, request.id(), result, null))
			.switchIfEmpty(Mono.fromSupplier(
					() -> new JSONRPCResponse(McpSchema.JSONRPC_VERSION, request.id(), Map.of(), null)))
			.onErrorResume(t -> {
				JSONRPCError error;
				if (t instanceof McpError mcpError && mcpError.getJsonRpcError() != null) {
					error = mcpError.getJsonRpcError();
				}
				else {
					this.logger.error("Handler of " + request.method() + " failed", t);
					error = new JSONRPCError(McpSchema.ErrorCodes.INTERNAL_ERROR, String.valueOf(t.getMessage()), null);
				}
				return Mono.just(errorResponse(request, error));
			});
	}

	private static JSONRPCResponse errorResponse(JSONRPCRequest request, JSONRPCError error) {
		return new JSONRPCResponse(McpSchema.JSONRPC_VERSION, request.id(), null, error);
	}

}
