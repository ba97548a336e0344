/*
 * Copyright 2025-2026 the original author or authors.
 */

package io.mcpstdio.server;

import java.util.Comparator;
import java.util.List;
import java.util.concurrent.ConcurrentHashMap;

import io.mcpstdio.pagination.McpPaginator;
import io.mcpstdio.pagination.Page;
import io.mcpstdio.spec.McpSchema;
import io.mcpstdio.util.Assert;
import reactor.core.publisher.Mono;

/**
 * In-memory {@link ResourceRepository}, listing resources in URI order.
 */
public class InMemoryResourceRepository implements ResourceRepository {

	private final ConcurrentHashMap<String, McpServerFeatures.SyncResourceSpecification> resources = new ConcurrentHashMap<>();

	private final McpPaginator paginator;

	private final int pageSize;

	public InMemoryResourceRepository(McpPaginator paginator, int pageSize,
			List<McpServerFeatures.SyncResourceSpecification> initialResources) {
		Assert.notNull(paginator, "paginator must not be null");
		this.paginator = paginator;
		this.pageSize = pageSize;
		if (initialResources != null) {
			initialResources.forEach(this::addResource);
		}
	}

	@Override
	public Mono<McpSchema.ListResourcesResult> listResources(String cursor) {
		return Mono.fromSupplier(() -> {
			List<McpSchema.Resource> resourceList = this.resources.values()
				.stream()
				.map(McpServerFeatures.SyncResourceSpecification::resource)
				.sorted(Comparator.comparing(McpSchema.Resource::uri))
				.toList();
			Page<McpSchema.Resource> page = this.paginator.paginate(resourceList, cursor, this.pageSize);
			return new McpSchema.ListResourcesResult(page.items(), page.nextCursor());
		});
	}

	@Override
	public Mono<McpServerFeatures.SyncResourceSpecification> resolveResource(String uri) {
		return Mono.justOrEmpty(uri).mapNotNull(this.resources::get);
	}

	@Override
	public void addResource(McpServerFeatures.SyncResourceSpecification resource) {
		Assert.notNull(resource, "resource must not be null");
		this.resources.put(resource.resource().uri(), resource);
	}

	@Override
	public void removeResource(String uri) {
		this.resources.remove(uri);
	}

}
