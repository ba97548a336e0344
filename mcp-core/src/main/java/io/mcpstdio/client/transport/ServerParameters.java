/*
 * Copyright 2025-2026 the original author or authors.
 */

package io.mcpstdio.client.transport;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import io.mcpstdio.util.Assert;

/**
 * Command line, environment and working directory of an MCP server subprocess.
 */
public final class ServerParameters {

	private final String command;

	private final List<String> args;

	private final Map<String, String> env;

	private final Path workingDirectory;

	private ServerParameters(String command, List<String> args, Map<String, String> env, Path workingDirectory) {
		Assert.hasText(command, "The command can not be empty");
		this.command = command;
		this.args = List.copyOf(args);
		this.env = Map.copyOf(env);
		this.workingDirectory = workingDirectory;
	}

	public String getCommand() {
		return this.command;
	}

	public List<String> getArgs() {
		return this.args;
	}

	public Map<String, String> getEnv() {
		return this.env;
	}

	/**
	 * @return the directory the process starts in, or {@code null} to inherit the
	 * current one
	 */
	public Path getWorkingDirectory() {
		return this.workingDirectory;
	}

	/**
	 * The full command line, executable first.
	 */
	public List<String> getCommandLine() {
		List<String> commandLine = new ArrayList<>();
		commandLine.add(this.command);
		commandLine.addAll(this.args);
		return commandLine;
	}

	@Override
	public String toString() {
		return "ServerParameters" + getCommandLine();
	}

	public static Builder builder(String command) {
		return new Builder(command);
	}

	public static class Builder {

		private final String command;

		private final List<String> args = new ArrayList<>();

		private final Map<String, String> env = new HashMap<>();

		private Path workingDirectory;

		public Builder(String command) {
			Assert.notNull(command, "The command can not be null");
			this.command = command;
		}

		public Builder args(String... args) {
			Assert.notNull(args, "The args can not be null");
			this.args.addAll(Arrays.asList(args));
			return this;
		}

		public Builder args(List<String> args) {
			Assert.notNull(args, "The args can not be null");
			this.args.addAll(args);
			return this;
		}

		public Builder arg(String arg) {
			Assert.notNull(arg, "The arg can not be null");
			this.args.add(arg);
			return this;
		}

		public Builder env(Map<String, String> env) {
			if (env != null && !env.isEmpty()) {
				this.env.putAll(env);
			}
			return this;
		}

		public Builder addEnvVar(String key, String value) {
			Assert.notNull(key, "The key can not be null");
			Assert.notNull(value, "The value can not be null");
			this.env.put(key, value);
			return this;
		}

		public Builder workingDirectory(Path workingDirectory) {
			this.workingDirectory = workingDirectory;
			return this;
		}

		public ServerParameters build() {
			return new ServerParameters(this.command, this.args, this.env, this.workingDirectory);
		}

	}

}
