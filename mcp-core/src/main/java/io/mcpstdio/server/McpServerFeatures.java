/*
 * Copyright 2025-2026 the original author or authors.
 */

package io.mcpstdio.server;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.List;
import java.util.function.Function;

import io.mcpstdio.spec.McpError;
import io.mcpstdio.spec.McpSchema;
import io.mcpstdio.util.Assert;

/**
 * Specifications of the resources and tools a server offers, each pairing the listed
 * descriptor with the function that serves it.
 */
public final class McpServerFeatures {

	private McpServerFeatures() {
	}

	/**
	 * A resource and the function that reads it.
	 *
	 * @param resource the listed resource
	 * @param readHandler produces the contents for a {@code resources/read} request
	 */
	public record SyncResourceSpecification(McpSchema.Resource resource,
			Function<McpSchema.ReadResourceRequest, McpSchema.ReadResourceResult> readHandler) {

		public SyncResourceSpecification {
			Assert.notNull(resource, "resource must not be null");
			Assert.notNull(readHandler, "readHandler must not be null");
		}

	}

	/**
	 * A tool and the function that runs it.
	 *
	 * @param tool the listed tool
	 * @param callHandler produces the result of a {@code tools/call} request
	 */
	public record SyncToolSpecification(McpSchema.Tool tool,
			Function<McpSchema.CallToolRequest, McpSchema.CallToolResult> callHandler) {

		public SyncToolSpecification {
			Assert.notNull(tool, "tool must not be null");
			Assert.notNull(callHandler, "callHandler must not be null");
		}

	}

	/**
	 * A resource whose contents are fixed text.
	 */
	public static SyncResourceSpecification textResource(McpSchema.Resource resource, String text) {
		Assert.notNull(text, "text must not be null");
		return new SyncResourceSpecification(resource, request -> new McpSchema.ReadResourceResult(
				List.of(new McpSchema.TextResourceContents(resource.uri(), resource.mimeType(), text))));
	}

	/**
	 * Publishes an on-disk file as a text resource under its {@code file://} URI. The
	 * file is read, as UTF-8, on every {@code resources/read}.
	 * @param path the file
	 * @param description the resource description, may be {@code null}
	 * @param mimeType the MIME type, may be {@code null}
	 * @return the resource specification
	 */
	public static SyncResourceSpecification fileResource(Path path, String description, String mimeType) {
		Assert.notNull(path, "path must not be null");
		Path absolutePath = path.toAbsolutePath().normalize();
		String uri = absolutePath.toUri().toString();
		McpSchema.Resource resource = new McpSchema.Resource(uri, String.valueOf(absolutePath.getFileName()),
				description, mimeType);
		return new SyncResourceSpecification(resource, request -> {
			try {
				String text = Files.readString(absolutePath, StandardCharsets.UTF_8);
				return new McpSchema.ReadResourceResult(List.of(new McpSchema.TextResourceContents(uri, mimeType, text)));
			}
			catch (NoSuchFileException e) {
				throw McpError.RESOURCE_NOT_FOUND.apply(uri);
			}
			catch (IOException e) {
				throw McpError.internalError("Failed to read " + absolutePath + ": " + e.getMessage());
			}
		});
	}

}
