/*
 * Copyright 2025-2026 the original author or authors.
 */

package io.mcpstdio.client.transport;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.time.Duration;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.function.Consumer;

import io.mcpstdio.logger.McpLogger;
import io.mcpstdio.logger.Slf4jMcpLogger;
import io.mcpstdio.security.CommandAllowlist;
import io.mcpstdio.spec.AbstractLineTransport;
import io.mcpstdio.spec.McpTransportException;
import io.mcpstdio.util.Assert;
import reactor.core.publisher.Sinks;
import reactor.core.scheduler.Scheduler;
import reactor.core.scheduler.Schedulers;

/**
 * Line transport to an MCP server running as a subprocess. Lines are exchanged over the
 * process's standard input and output; its standard error is drained on a separate
 * thread and forwarded to the logging sink.
 *
 * <p>
 * {@link #terminate()} closes the process's standard input, asks it to stop, waits for
 * the grace period and then kills it. When it returns the process has exited.
 */
public class StdioClientTransport extends AbstractLineTransport {

	public static final Duration DEFAULT_TERMINATE_GRACE_PERIOD = Duration.ofSeconds(2);

	private final ServerParameters params;

	private final Process process;

	private final Duration terminateGracePeriod;

	private final Scheduler errorScheduler;

	private final Sinks.Many<String> errorSink;

	private volatile Consumer<String> stdErrorHandler;

	StdioClientTransport(ServerParameters params, Process process, Duration terminateGracePeriod,
			McpLogger logger) {
		super(transportName(params.getCommand()), logger);
		this.params = params;
		this.process = process;
		this.terminateGracePeriod = terminateGracePeriod;
		this.stdErrorHandler = error -> logger.info("STDERR Message received: " + error);

		this.errorSink = Sinks.many().unicast().onBackpressureBuffer();
		this.errorSink.asFlux().subscribe(line -> this.stdErrorHandler.accept(line));
		this.errorScheduler = Schedulers.fromExecutorService(Executors.newSingleThreadExecutor(runnable -> {
			Thread thread = new Thread(runnable, "mcp-" + getName() + "-stderr");
			thread.setDaemon(true);
			return thread;
		}), "error");

		connect(process.getInputStream(), process.getOutputStream());
		startErrorProcessing();
	}

	/**
	 * Starts the server process after checking the command against the process-wide
	 * {@link CommandAllowlist}.
	 * @param params the server command line
	 * @return a connected transport
	 * @throws SecurityException if the allowlist rejects the command line
	 * @throws McpTransportException if the process cannot be started
	 */
	public static StdioClientTransport launch(ServerParameters params) {
		return launch(params, CommandAllowlist.getInstance(), DEFAULT_TERMINATE_GRACE_PERIOD,
				new Slf4jMcpLogger(StdioClientTransport.class));
	}

	/**
	 * Starts the server process.
	 * @param params the server command line
	 * @param allowlist the gate the command line must pass
	 * @param terminateGracePeriod how long {@link #terminate()} waits after the graceful
	 * stop signal before killing the process
	 * @param logger the logging sink
	 * @return a connected transport
	 * @throws SecurityException if the allowlist rejects the command line
	 * @throws McpTransportException if the process cannot be started
	 */
	public static StdioClientTransport launch(ServerParameters params, CommandAllowlist allowlist,
			Duration terminateGracePeriod, McpLogger logger) {
		Assert.notNull(params, "The params can not be null");
		Assert.notNull(allowlist, "The allowlist can not be null");
		Assert.notNull(terminateGracePeriod, "The terminateGracePeriod can not be null");
		Assert.notNull(logger, "The logger can not be null");

		allowlist.validate(params.getCommand(), params.getArgs());

		ProcessBuilder processBuilder = new ProcessBuilder(params.getCommandLine());
		processBuilder.environment().putAll(params.getEnv());
		if (params.getWorkingDirectory() != null) {
			processBuilder.directory(params.getWorkingDirectory().toFile());
		}
		processBuilder.redirectErrorStream(false);

		Process process;
		try {
			process = processBuilder.start();
		}
		catch (IOException e) {
			throw new McpTransportException("Failed to start process with command: " + params.getCommandLine(), e);
		}
		logger.info("Started " + params + " with pid " + process.pid());
		return new StdioClientTransport(params, process, terminateGracePeriod, logger);
	}

	private static String transportName(String command) {
		Path fileName = Path.of(command).getFileName();
		return fileName != null ? fileName.toString() : command;
	}

	/**
	 * Replaces the consumer of the server's standard error lines. The default logs each
	 * line at info level.
	 */
	public void setStdErrorHandler(Consumer<String> errorHandler) {
		Assert.notNull(errorHandler, "The errorHandler can not be null");
		this.stdErrorHandler = errorHandler;
	}

	public ServerParameters getServerParameters() {
		return this.params;
	}

	public long pid() {
		return this.process.pid();
	}

	@Override
	public boolean isAlive() {
		return this.process.isAlive();
	}

	private void startErrorProcessing() {
		this.errorScheduler.schedule(() -> {
			try (BufferedReader processErrorReader = new BufferedReader(
					new InputStreamReader(this.process.getErrorStream(), StandardCharsets.UTF_8))) {
				String line;
				while (!isTerminated() && (line = processErrorReader.readLine()) != null) {
					if (!this.errorSink.tryEmitNext(line).isSuccess()) {
						this.logger.warn("Failed to forward error output line: " + line);
					}
				}
			}
			catch (IOException e) {
				if (!isTerminated()) {
					this.logger.error("Error reading from error stream", e);
				}
			}
			finally {
				this.errorSink.tryEmitComplete();
			}
		});
	}

	@Override
	protected void doTerminate() {
		closeOutbound();
		try {
			if (this.process.isAlive()) {
				this.logger.debug("Sending TERM to process " + this.process.pid());
				this.process.destroy();
				if (!this.process.waitFor(this.terminateGracePeriod.toMillis(), TimeUnit.MILLISECONDS)) {
					this.logger.warn("Process " + this.process.pid() + " did not exit within "
							+ this.terminateGracePeriod.toMillis() + " ms, killing it");
					this.process.destroyForcibly();
					this.process.waitFor();
				}
			}
			this.logger.debug("Process " + this.process.pid() + " exited with code " + this.process.exitValue());
		}
		catch (InterruptedException e) {
			this.process.destroyForcibly();
			awaitExitUninterruptibly();
			Thread.currentThread().interrupt();
			throw new McpTransportException("Interrupted while waiting for process " + this.process.pid(), e);
		}
		finally {
			this.errorScheduler.dispose();
		}
	}

	private void awaitExitUninterruptibly() {
		long deadline = System.nanoTime() + this.terminateGracePeriod.toNanos();
		boolean interrupted = false;
		while (this.process.isAlive() && System.nanoTime() < deadline) {
			try {
				this.process.waitFor(deadline - System.nanoTime(), TimeUnit.NANOSECONDS);
			}
			catch (InterruptedException e) {
				interrupted = true;
			}
		}
		if (this.process.isAlive()) {
			this.logger.warn("Process " + this.process.pid() + " still running after forced kill");
		}
		if (interrupted) {
			Thread.currentThread().interrupt();
		}
	}

}
