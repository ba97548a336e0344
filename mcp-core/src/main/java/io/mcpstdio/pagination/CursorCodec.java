/*
 * Copyright 2025-2026 the original author or authors.
 */

package io.mcpstdio.pagination;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.Base64;
import java.util.Map;

import io.mcpstdio.json.McpJsonMapper;
import io.mcpstdio.json.TypeRef;
import io.mcpstdio.spec.McpError;
import io.mcpstdio.util.Assert;

/**
 * Encodes listing positions as opaque tokens: the JSON form of a
 * {@link PaginationCursor}, Base64 encoded with the standard alphabet. Decoding accepts
 * only tokens this codec could have produced; anything else is an invalid-cursor
 * {@link McpError} with code {@code -32602}.
 */
public class CursorCodec {

	private static final TypeRef<Map<String, Object>> MAP_TYPE_REF = new TypeRef<>() {
	};

	private final McpJsonMapper jsonMapper;

	public CursorCodec(McpJsonMapper jsonMapper) {
		Assert.notNull(jsonMapper, "The JsonMapper can not be null");
		this.jsonMapper = jsonMapper;
	}

	public String encode(int offset, int limit, int total) {
		return encode(new PaginationCursor(offset, limit, total));
	}

	public String encode(PaginationCursor cursor) {
		Assert.notNull(cursor, "cursor must not be null");
		try {
			return Base64.getEncoder().encodeToString(this.jsonMapper.writeValueAsBytes(cursor));
		}
		catch (IOException e) {
			throw new IllegalStateException("Failed to serialize cursor " + cursor, e);
		}
	}

	/**
	 * @param cursor a token previously returned as {@code nextCursor}
	 * @return the decoded position
	 * @throws McpError with code {@code -32602} and {@code data.cursor} set to the
	 * offending token if the token is corrupt, incomplete or of a foreign version
	 */
	public PaginationCursor decode(String cursor) {
		if (cursor == null) {
			throw McpError.invalidCursor(null);
		}

		Map<String, Object> fields;
		try {
			byte[] json = Base64.getDecoder().decode(cursor.strip());
			fields = this.jsonMapper.readValue(json, MAP_TYPE_REF);
		}
		catch (IllegalArgumentException | IOException e) {
			throw McpError.invalidCursor(cursor);
		}
		if (fields == null) {
			throw McpError.invalidCursor(cursor);
		}

		Object offset = fields.get("offset");
		Object limit = fields.get("limit");
		Object total = fields.get("total");
		Object version = fields.get("version");
		if (!isInt(offset) || !isInt(limit) || !isInt(total) || !(version instanceof String)) {
			throw McpError.invalidCursor(cursor);
		}
		if (!PaginationCursor.CURRENT_VERSION.equals(version)) {
			throw McpError.invalidCursor(cursor);
		}
		return new PaginationCursor(((Number) offset).intValue(), ((Number) limit).intValue(),
				((Number) total).intValue(), (String) version);
	}

	private static boolean isInt(Object value) {
		return value instanceof Integer || (value instanceof Long l && l >= Integer.MIN_VALUE && l <= Integer.MAX_VALUE);
	}

}
