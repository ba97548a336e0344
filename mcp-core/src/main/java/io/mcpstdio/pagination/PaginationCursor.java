/*
 * Copyright 2025-2026 the original author or authors.
 */

package io.mcpstdio.pagination;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Position within a listing, as carried inside an opaque cursor token.
 *
 * @param offset index of the first item of the page the cursor points at
 * @param limit page size the listing was started with
 * @param total size of the collection when the cursor was issued
 * @param version cursor format version, always {@link #CURRENT_VERSION} for cursors
 * issued by this engine
 */
@JsonInclude(JsonInclude.Include.NON_ABSENT)
@JsonIgnoreProperties(ignoreUnknown = true)
public record PaginationCursor( // @formatter:off
	@JsonProperty("offset") int offset,
	@JsonProperty("limit") int limit,
	@JsonProperty("total") int total,
	@JsonProperty("version") String version) { // @formatter:on

	public static final String CURRENT_VERSION = "1.0";

	public PaginationCursor(int offset, int limit, int total) {
		this(offset, limit, total, CURRENT_VERSION);
	}

}
