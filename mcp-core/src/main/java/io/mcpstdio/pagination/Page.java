/*
 * Copyright 2025-2026 the original author or authors.
 */

package io.mcpstdio.pagination;

import java.util.List;

/**
 * One page of a listing.
 *
 * @param <T> item type
 * @param items the items of this page, in source order
 * @param nextCursor token for the following page, {@code null} on the last page
 * @param hasMore whether items remain after this page
 * @param returnedCount number of items on this page
 * @param offset index of the first item of this page
 * @param limit page size in effect
 * @param totalAvailable size of the whole collection
 */
public record Page<T>(List<T> items, String nextCursor, boolean hasMore, int returnedCount, int offset, int limit,
		int totalAvailable) {

	public Page {
		items = List.copyOf(items);
	}

}
