/*
 * Copyright 2025-2026 the original author or authors.
 */

package io.mcpstdio.server;

import io.mcpstdio.spec.McpSchema;
import reactor.core.publisher.Mono;

/**
 * Repository interface for the resources a server offers.
 */
public interface ResourceRepository {

	/**
	 * List one page of resources.
	 * @param cursor An opaque pagination token, or null for the first page
	 * @return A {@link Mono} emitting the page and the optional next cursor
	 */
	Mono<McpSchema.ListResourcesResult> listResources(String cursor);

	/**
	 * Resolve the specification of a resource by URI.
	 * @param uri the resource URI
	 * @return A {@link Mono} emitting the specification if found, otherwise empty
	 */
	Mono<McpServerFeatures.SyncResourceSpecification> resolveResource(String uri);

	void addResource(McpServerFeatures.SyncResourceSpecification resource);

	void removeResource(String uri);

}
