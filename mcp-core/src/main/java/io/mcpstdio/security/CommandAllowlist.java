/*
 * Copyright 2025-2026 the original author or authors.
 */

package io.mcpstdio.security;

import java.util.Arrays;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

import io.mcpstdio.util.Assert;
import io.mcpstdio.util.Utils;

/**
 * Gate consulted before a server subprocess is started.
 *
 * <p>
 * Until an allowlist is set the gate is permissive and admits any command. Once set, and
 * it can be set only once, a command is admitted only if it equals one of the entries
 * exactly and contains no whitespace; an empty allowlist admits nothing. Arguments are
 * always checked for path traversal and shell metacharacters.
 *
 * <p>
 * The process-wide instance returned by {@link #getInstance()} is initialized from the
 * {@value #SYSTEM_PROPERTY} system property, or failing that the
 * {@value #ENVIRONMENT_VARIABLE} environment variable, when either is present.
 */
public final class CommandAllowlist {

	public static final String SYSTEM_PROPERTY = "mcp.allowed.commands";

	public static final String ENVIRONMENT_VARIABLE = "MCP_ALLOWED_COMMANDS";

	public static final String SEPARATOR = ":";

	private static final List<String> UNSAFE_ARGUMENT_SEQUENCES = List.of("..", "|", ";", "&", "`", "$");

	private volatile Set<String> allowedCommands;

	public CommandAllowlist() {
	}

	/**
	 * Creates an allowlist that is already set to the given commands.
	 */
	public static CommandAllowlist of(String... commands) {
		CommandAllowlist allowlist = new CommandAllowlist();
		allowlist.setAllowedCommands(Arrays.asList(commands));
		return allowlist;
	}

	/**
	 * Sets the allowed commands from a colon-separated list. Blank segments are ignored.
	 * @param commands for example {@code "/usr/bin/python3:node"}
	 * @throws IllegalStateException if the allowlist has already been set
	 */
	public void setAllowedCommands(String commands) {
		Assert.notNull(commands, "commands must not be null");
		setAllowedCommands(Arrays.stream(commands.split(SEPARATOR))
			.map(String::strip)
			.filter(Utils::hasText)
			.collect(Collectors.toList()));
	}

	/**
	 * Sets the allowed commands.
	 * @param commands the commands to admit; empty to admit none
	 * @throws IllegalStateException if the allowlist has already been set
	 */
	public synchronized void setAllowedCommands(Collection<String> commands) {
		Assert.notNull(commands, "commands must not be null");
		if (this.allowedCommands != null) {
			throw new IllegalStateException(
					"Cannot modify allowed MCP commands: commands are immutable once set");
		}
		this.allowedCommands = Collections.unmodifiableSet(new LinkedHashSet<>(commands));
	}

	public boolean isPermissive() {
		return this.allowedCommands == null;
	}

	public Set<String> getAllowedCommands() {
		Set<String> commands = this.allowedCommands;
		return commands == null ? Set.of() : commands;
	}

	public boolean isCommandAllowed(String command) {
		Set<String> commands = this.allowedCommands;
		if (commands == null) {
			return true;
		}
		if (!Utils.hasText(command) || command.chars().anyMatch(Character::isWhitespace)) {
			return false;
		}
		return commands.contains(command);
	}

	/**
	 * Checks a command line before it is launched.
	 * @param command the executable
	 * @param args its arguments
	 * @throws SecurityException if the command is not allowed or an argument contains
	 * an unsafe sequence
	 */
	public void validate(String command, List<String> args) {
		if (!isCommandAllowed(command)) {
			String allowed = getAllowedCommands().stream()
				.map(entry -> "'" + entry + "'")
				.collect(Collectors.joining(", "));
			throw new SecurityException("MCP command '" + command + "' not allowed. Allowed commands: " + allowed);
		}
		if (args == null) {
			return;
		}
		for (String arg : args) {
			for (String sequence : UNSAFE_ARGUMENT_SEQUENCES) {
				if (arg != null && arg.contains(sequence)) {
					throw new SecurityException("MCP argument contains potentially unsafe characters: " + arg);
				}
			}
		}
	}

	/**
	 * The process-wide allowlist.
	 */
	public static CommandAllowlist getInstance() {
		return Holder.INSTANCE;
	}

	static CommandAllowlist fromConfiguration(String systemPropertyValue, String environmentValue) {
		CommandAllowlist allowlist = new CommandAllowlist();
		if (systemPropertyValue != null) {
			allowlist.setAllowedCommands(systemPropertyValue);
		}
		else if (environmentValue != null) {
			allowlist.setAllowedCommands(environmentValue);
		}
		return allowlist;
	}

	private static final class Holder {

		private static final CommandAllowlist INSTANCE = fromConfiguration(System.getProperty(SYSTEM_PROPERTY),
				System.getenv(ENVIRONMENT_VARIABLE));

	}

}
