/*
 * Copyright 2025-2026 the original author or authors.
 */

package io.mcpstdio.logger;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * {@link McpLogger} backed by SLF4J. The logger name is taken from the component class,
 * optionally suffixed with a scope (for example the server command a session talks to).
 */
public class Slf4jMcpLogger implements McpLogger {

	private final Logger delegate;

	public Slf4jMcpLogger(Class<?> clazz) {
		this.delegate = LoggerFactory.getLogger(clazz);
	}

	public Slf4jMcpLogger(Class<?> clazz, String scope) {
		this.delegate = LoggerFactory.getLogger(clazz.getName() + "." + scope);
	}

	@Override
	public void debug(final String message) {
		delegate.debug(message);
	}

	@Override
	public void info(final String message) {
		delegate.info(message);
	}

	@Override
	public void warn(final String message) {
		delegate.warn(message);
	}

	@Override
	public void warn(final String message, final Throwable t) {
		delegate.warn(message, t);
	}

	@Override
	public void error(final String message) {
		delegate.error(message);
	}

	@Override
	public void error(final String message, final Throwable t) {
		delegate.error(message, t);
	}

}
