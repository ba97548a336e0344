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
 * Default in-memory implementation of {@link ToolsRepository}. Tools are listed in name
 * order and paged through the {@link McpPaginator}.
 */
public class InMemoryToolsRepository implements ToolsRepository {

	private final ConcurrentHashMap<String, McpServerFeatures.SyncToolSpecification> tools = new ConcurrentHashMap<>();

	private final McpPaginator paginator;

	private final int pageSize;

	public InMemoryToolsRepository(McpPaginator paginator, int pageSize) {
		this(paginator, pageSize, List.of());
	}

	/**
	 * Create a new InMemoryToolsRepository initialized with the given tools.
	 * @param paginator slices the listing into pages
	 * @param pageSize page size of a listing started without a cursor
	 * @param initialTools Collection of tools to register initially
	 */
	public InMemoryToolsRepository(McpPaginator paginator, int pageSize,
			List<McpServerFeatures.SyncToolSpecification> initialTools) {
		Assert.notNull(paginator, "paginator must not be null");
		this.paginator = paginator;
		this.pageSize = pageSize;
		if (initialTools != null) {
			for (McpServerFeatures.SyncToolSpecification tool : initialTools) {
				this.tools.put(tool.tool().name(), tool);
			}
		}
	}

	@Override
	public Mono<McpSchema.ListToolsResult> listTools(String cursor) {
		return Mono.fromSupplier(() -> {
			// ConcurrentHashMap has no iteration order; cursors need a stable one
			List<McpSchema.Tool> toolList = this.tools.values()
				.stream()
				.map(McpServerFeatures.SyncToolSpecification::tool)
				.sorted(Comparator.comparing(McpSchema.Tool::name))
				.toList();
			Page<McpSchema.Tool> page = this.paginator.paginate(toolList, cursor, this.pageSize);
			return new McpSchema.ListToolsResult(page.items(), page.nextCursor());
		});
	}

	@Override
	public Mono<McpServerFeatures.SyncToolSpecification> resolveToolForCall(String name) {
		return Mono.justOrEmpty(name).mapNotNull(this.tools::get);
	}

	@Override
	public void addTool(McpServerFeatures.SyncToolSpecification tool) {
		Assert.notNull(tool, "tool must not be null");
		// Last-write-wins policy
		this.tools.put(tool.tool().name(), tool);
	}

	@Override
	public void removeTool(String name) {
		this.tools.remove(name);
	}

	public int size() {
		return this.tools.size();
	}

}
