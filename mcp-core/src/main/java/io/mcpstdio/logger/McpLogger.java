/*
 * Copyright 2025-2026 the original author or authors.
 */

package io.mcpstdio.logger;

/**
 * Logging sink injected into transports, sessions and servers. Components receive one
 * through their constructor or builder instead of reaching for a static logger, so each
 * session can be given its own scoped sink.
 */
public interface McpLogger {

	void debug(String message);

	void info(String message);

	void warn(String message);

	void warn(String message, Throwable t);

	void error(String message);

	void error(String message, Throwable t);

	static McpLogger noop() {
		return new McpLogger() {
			public void debug(String msg) {
			}

			public void info(String msg) {
			}

			public void warn(String msg) {
			}

			public void warn(String msg, Throwable t) {
			}

			public void error(String msg) {
			}

			public void error(String msg, Throwable t) {
			}
		};
	}

}
