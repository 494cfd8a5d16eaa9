/*
 * Copyright (c) 2025 Helios Policy Miner
 * Licensed under the Apache License, Version 2.0
 */
package com.helios.policyminer.cli;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Parsed {@code --name value} / {@code --name=value} options of one command.
 */
final class CommandOptions {

    static final String HELP = "--help";

    private final Map<String, String> values;
    private final boolean helpRequested;

    private CommandOptions(Map<String, String> values, boolean helpRequested) {
        this.values = values;
        this.helpRequested = helpRequested;
    }

    /**
     * Parses the arguments that follow the command name.
     *
     * @param allowed option names accepted by the command, including the leading dashes
     */
    static CommandOptions parse(String[] args, int from, Set<String> allowed) throws UsageException {
        Map<String, String> values = new LinkedHashMap<>();
        boolean help = false;
        for (int i = from; i < args.length; i++) {
            String arg = args[i];
            if (HELP.equals(arg)) {
                help = true;
                continue;
            }
            if (!arg.startsWith("--")) {
                throw new UsageException("Unexpected argument: " + arg);
            }
            String name = arg;
            String value;
            int eq = arg.indexOf('=');
            if (eq > 0) {
                name = arg.substring(0, eq);
                value = arg.substring(eq + 1);
            } else if (i + 1 < args.length) {
                value = args[++i];
            } else {
                throw new UsageException("Option " + arg + " requires a value");
            }
            if (!allowed.contains(name)) {
                throw new UsageException("No such option: " + name);
            }
            values.put(name, value);
        }
        return new CommandOptions(values, help);
    }

    boolean helpRequested() {
        return helpRequested;
    }

    boolean has(String name) {
        return values.containsKey(name);
    }

    String get(String name, String defaultValue) {
        return values.getOrDefault(name, defaultValue);
    }

    Path requireExistingPath(String name) throws UsageException {
        String value = values.get(name);
        if (value == null) {
            throw new UsageException("Missing option " + name);
        }
        Path path = Path.of(value);
        if (!Files.exists(path)) {
            throw new UsageException("Invalid value for " + name + ": path '" + value + "' does not exist");
        }
        return path;
    }

    double getDouble(String name, double defaultValue) throws UsageException {
        String value = values.get(name);
        if (value == null) {
            return defaultValue;
        }
        try {
            return Double.parseDouble(value.trim());
        } catch (NumberFormatException e) {
            throw new UsageException("Invalid value for " + name + ": '" + value + "' is not a valid float");
        }
    }

    int getInt(String name, int defaultValue) throws UsageException {
        String value = values.get(name);
        if (value == null) {
            return defaultValue;
        }
        try {
            return Integer.parseInt(value.trim());
        } catch (NumberFormatException e) {
            throw new UsageException("Invalid value for " + name + ": '" + value + "' is not a valid integer");
        }
    }

    /**
     * Returns the lower-cased value, which must be one of {@code choices}.
     */
    String getChoice(String name, String defaultValue, Set<String> choices) throws UsageException {
        String value = values.getOrDefault(name, defaultValue).toLowerCase(Locale.ROOT);
        if (!choices.contains(value)) {
            throw new UsageException("Invalid value for " + name + ": '" + value + "' is not one of " + choices);
        }
        return value;
    }
}
