/*
 * Copyright 2025-2026 the original author or authors.
 */

package io.mcpstdio.pagination;

import java.util.List;

import io.mcpstdio.util.Assert;
import io.mcpstdio.util.Utils;

/**
 * Slices a collection into pages addressed by {@link CursorCodec} tokens. The server
 * keeps no cursor state; a token carries everything needed to produce the next page, so
 * the same token always yields the same page of an unchanged collection.
 */
public class McpPaginator {

	public static final int MAX_PAGE_SIZE = 100;

	public static final int DEFAULT_PAGE_SIZE = 50;

	private final CursorCodec cursorCodec;

	public McpPaginator(CursorCodec cursorCodec) {
		Assert.notNull(cursorCodec, "The cursorCodec can not be null");
		this.cursorCodec = cursorCodec;
	}

	/**
	 * Returns the page addressed by {@code cursor}, or the first page when the cursor is
	 * {@code null} or blank. The offset is clamped into {@code [0, items.size()]} and the
	 * page size into {@code [1, MAX_PAGE_SIZE]}, so paging past the end yields an empty
	 * last page.
	 * @param <T> item type
	 * @param items the full collection, in listing order
	 * @param cursor token from a previous page, may be {@code null}
	 * @param defaultLimit page size used when starting a new listing
	 * @return the page
	 * @throws io.mcpstdio.spec.McpError with code {@code -32602} for an invalid cursor
	 */
	public <T> Page<T> paginate(List<T> items, String cursor, int defaultLimit) {
		Assert.notNull(items, "items must not be null");
		int size = items.size();

		int offset;
		int limit;
		if (!Utils.hasText(cursor)) {
			offset = 0;
			limit = defaultLimit;
		}
		else {
			PaginationCursor position = this.cursorCodec.decode(cursor);
			offset = position.offset();
			limit = position.limit();
		}

		offset = Math.max(0, Math.min(offset, size));
		limit = Math.max(1, Math.min(limit, MAX_PAGE_SIZE));

		int end = (int) Math.min((long) offset + limit, size);
		List<T> pageItems = items.subList(offset, end);

		long nextOffset = (long) offset + limit;
		boolean hasMore = nextOffset < size;
		String nextCursor = hasMore ? this.cursorCodec.encode((int) nextOffset, limit, size) : null;

		return new Page<>(pageItems, nextCursor, hasMore, pageItems.size(), offset, limit, size);
	}

	public <T> Page<T> paginate(List<T> items, String cursor) {
		return paginate(items, cursor, DEFAULT_PAGE_SIZE);
	}

}
