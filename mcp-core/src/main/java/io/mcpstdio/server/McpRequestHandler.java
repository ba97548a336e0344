/*
 * Copyright 2025-2026 the original author or authors.
 */

package io.mcpstdio.server;

import reactor.core.publisher.Mono;

/**
 * Handles one request method. The dispatcher converts the request params into
 * {@code P} before calling the handler, so handlers work with typed requests only.
 *
 * @param <P> the typed params of the method
 * @param <R> the result type, serialized as the response {@code result}
 */
@FunctionalInterface
public interface McpRequestHandler<P, R> {

	/**
	 * @param request the converted request params
	 * @return a Mono emitting the result, or an {@link io.mcpstdio.spec.McpError} to
	 * answer with that error
	 */
	Mono<R> handle(P request);

}
