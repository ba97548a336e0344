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
 * In-memory {@link PromptRepository}, listing prompts in name order.
 */
public class InMemoryPromptRepository implements PromptRepository {

	private final ConcurrentHashMap<String, McpSchema.Prompt> prompts = new ConcurrentHashMap<>();

	private final McpPaginator paginator;

	private final int pageSize;

	public InMemoryPromptRepository(McpPaginator paginator, int pageSize, List<McpSchema.Prompt> initialPrompts) {
		Assert.notNull(paginator, "paginator must not be null");
		this.paginator = paginator;
		this.pageSize = pageSize;
		if (initialPrompts != null) {
			initialPrompts.forEach(this::addPrompt);
		}
	}

	@Override
	public Mono<McpSchema.ListPromptsResult> listPrompts(String cursor) {
		return Mono.fromSupplier(() -> {
			List<McpSchema.Prompt> promptList = this.prompts.values()
				.stream()
				.sorted(Comparator.comparing(McpSchema.Prompt::name))
				.toList();
			Page<McpSchema.Prompt> page = this.paginator.paginate(promptList, cursor, this.pageSize);
			return new McpSchema.ListPromptsResult(page.items(), page.nextCursor());
		});
	}

	@Override
	public void addPrompt(McpSchema.Prompt prompt) {
		Assert.notNull(prompt, "prompt must not be null");
		this.prompts.put(prompt.name(), prompt);
	}

	@Override
	public void removePrompt(String name) {
		this.prompts.remove(name);
	}

}
