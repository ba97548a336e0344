/*
 * Copyright 2025-2026 the original author or authors.
 */

package io.mcpstdio.server.transport;

import java.io.InputStream;
import java.io.OutputStream;

import io.mcpstdio.logger.McpLogger;
import io.mcpstdio.logger.Slf4jMcpLogger;
import io.mcpstdio.spec.AbstractLineTransport;

/**
 * Line transport over the current process's standard streams, used by a server that is
 * itself launched as a subprocess. Anything else the process prints must go to standard
 * error so that standard output carries protocol lines only.
 */
public class StdioServerTransport extends AbstractLineTransport {

	private final OutputStream outputStream;

	private volatile boolean outputClosed;

	/**
	 * Creates a transport over {@code System.in} and {@code System.out}.
	 */
	public StdioServerTransport() {
		this(System.in, System.out, new Slf4jMcpLogger(StdioServerTransport.class));
	}

	public StdioServerTransport(InputStream inputStream, OutputStream outputStream, McpLogger logger) {
		super("stdio-server", logger);
		this.outputStream = outputStream;
		connect(inputStream, outputStream);
	}

	@Override
	public boolean isAlive() {
		return !isTerminated() && !isEndOfStream() && !this.outputClosed;
	}

	@Override
	protected void doTerminate() {
		this.outputClosed = true;
		if (this.outputStream == System.out) {
			// never close the process's own stdout
			System.out.flush();
			return;
		}
		closeOutbound();
	}

}
