/*
 * Copyright (c) 2025 Helios Policy Miner
 * Licensed under the Apache License, Version 2.0
 */
package com.helios.policyminer.cli;

import com.helios.policyminer.api.exceptions.PolicyValidationException;
import com.helios.policyminer.api.model.BehaviorLog;
import com.helios.policyminer.api.model.PolicySet;
import com.helios.policyminer.core.extraction.ExtractionConfig;
import com.helios.policyminer.core.extraction.PolicyExtractor;
import com.helios.policyminer.infra.metrics.MetricsRegistry;
import com.helios.policyminer.infra.metrics.impl.inmemory.InMemoryMetricsRegistry;
import com.helios.policyminer.infra.telemetry.TracingService;
import com.helios.policyminer.io.BehaviorLogParser;
import com.helios.policyminer.io.PolicyFormatter;
import com.helios.policyminer.io.PolicySetCodec;
import io.opentelemetry.api.trace.Tracer;

import java.io.IOException;
import java.io.InputStream;
import java.io.PrintStream;
import java.nio.file.Path;
import java.util.List;
import java.util.Properties;
import java.util.Set;
import java.util.logging.Level;
import java.util.logging.LogManager;
import java.util.logging.Logger;

/**
 * Command line entry point.
 *
 * <pre>
 *   policyminer extract --logs behavior.jsonl [--output policies.json] [--min-support F] ...
 *   policyminer format --policies policies.json [--output-format text|markdown|json] [--max-policies N]
 * </pre>
 *
 * Exit codes: 0 on success, 1 on runtime or I/O failure, 2 on usage errors.
 */
public class PolicyMinerApplication {
    private static final Logger logger = Logger.getLogger(PolicyMinerApplication.class.getName());

    static final int EXIT_OK = 0;
    static final int EXIT_FAILURE = 1;
    static final int EXIT_USAGE = 2;

    static final String VERBOSE_PROPERTY = "policyminer.verbose";
    static final int EXTRACT_REPORT_POLICIES = 10;
    static final String DEFAULT_OUTPUT_FILE = "policies.json";

    private static final Set<String> EXTRACT_OPTIONS = Set.of(
            "--logs", "--output", "--min-support", "--min-confidence", "--min-lift", "--name", "--parallelism");
    private static final Set<String> FORMAT_OPTIONS = Set.of("--policies", "--output-format", "--max-policies");
    private static final Set<String> OUTPUT_FORMATS = Set.of("text", "markdown", "json");

    private final Properties systemProperties;
    private final Tracer tracer;
    private final MetricsRegistry metrics;
    private final BehaviorLogParser parser = new BehaviorLogParser();
    private final PolicySetCodec codec = new PolicySetCodec();
    private final PolicyFormatter formatter = new PolicyFormatter();

    public PolicyMinerApplication(Properties systemProperties, Tracer tracer, MetricsRegistry metrics) {
        this.systemProperties = systemProperties;
        this.tracer = tracer;
        this.metrics = metrics;
    }

    public static void main(String[] args) {
        configureLogging();
        TracingService tracingService = TracingService.getInstance();
        int exitCode;
        try {
            PolicyMinerApplication app = new PolicyMinerApplication(
                    System.getProperties(), tracingService.getTracer(), MetricsRegistry.getInstance());
            exitCode = app.run(args, System.out, System.err);
        } finally {
            tracingService.shutdown();
        }
        System.exit(exitCode);
    }

    /**
     * Runs one command and returns its exit code.
     */
    public int run(String[] args, PrintStream out, PrintStream err) {
        if (args.length == 0) {
            Usage.printUsage(err);
            return EXIT_USAGE;
        }
        String command = args[0];
        try {
            switch (command) {
                case CommandOptions.HELP:
                    Usage.printUsage(out);
                    return EXIT_OK;
                case "--version":
                    out.println("policyminer, version " + version());
                    return EXIT_OK;
                case "extract":
                    return extract(CommandOptions.parse(args, 1, EXTRACT_OPTIONS), out, err);
                case "format":
                    return format(CommandOptions.parse(args, 1, FORMAT_OPTIONS), out, err);
                default:
                    throw new UsageException("No such command '" + command + "'");
            }
        } catch (UsageException e) {
            err.println("Error: " + e.getMessage());
            err.println();
            if ("extract".equals(command)) {
                Usage.printExtractUsage(err);
            } else if ("format".equals(command)) {
                Usage.printFormatUsage(err);
            } else {
                Usage.printUsage(err);
            }
            return EXIT_USAGE;
        }
    }

    private int extract(CommandOptions options, PrintStream out, PrintStream err) throws UsageException {
        if (options.helpRequested()) {
            Usage.printExtractUsage(out);
            return EXIT_OK;
        }
        Path logsPath = options.requireExistingPath("--logs");
        ExtractionConfig config = extractionConfig(options);
        String name = options.get("--name", PolicySet.DEFAULT_NAME);
        Path output = options.has("--output")
                ? Path.of(options.get("--output", DEFAULT_OUTPUT_FILE))
                : logsPath.resolveSibling(DEFAULT_OUTPUT_FILE);

        try {
            BehaviorLogParser.ParseResult parsed = parser.parseFile(logsPath);
            List<BehaviorLog> logs = parsed.logs();
            out.println("Parsed " + logs.size() + " valid log entries.");

            PolicySet policySet = new PolicyExtractor(config, tracer, metrics).extract(logs, name);
            out.println("Mined " + policySet.policies().size() + " policies.");

            codec.write(policySet, output);
            out.println("Saved policy set to " + output);
            out.println(formatter.toText(policySet, EXTRACT_REPORT_POLICIES));

            logMetrics();
            return EXIT_OK;
        } catch (IOException e) {
            logger.log(Level.FINE, "Extraction failed", e);
            err.println("ERROR: " + e.getMessage());
            return EXIT_FAILURE;
        }
    }

    private int format(CommandOptions options, PrintStream out, PrintStream err) throws UsageException {
        if (options.helpRequested()) {
            Usage.printFormatUsage(out);
            return EXIT_OK;
        }
        Path policiesPath = options.requireExistingPath("--policies");
        String outputFormat = options.getChoice("--output-format", "text", OUTPUT_FORMATS);
        int maxPolicies = options.getInt("--max-policies", PolicyFormatter.DEFAULT_MAX_POLICIES);

        PolicySet policySet;
        try {
            policySet = codec.read(policiesPath);
        } catch (IOException | PolicyValidationException e) {
            logger.log(Level.FINE, "Failed to load " + policiesPath, e);
            err.println("ERROR loading policy set: " + e.getMessage());
            return EXIT_FAILURE;
        }

        switch (outputFormat) {
            case "markdown" -> out.println(formatter.toMarkdown(policySet, maxPolicies));
            case "json" -> out.println(codec.toJson(policySet));
            default -> out.println(formatter.toText(policySet, maxPolicies));
        }
        return EXIT_OK;
    }

    /**
     * System properties supply defaults; explicit options win.
     */
    private ExtractionConfig extractionConfig(CommandOptions options) throws UsageException {
        ExtractionConfig defaults;
        try {
            defaults = ExtractionConfig.fromProperties(systemProperties);
        } catch (IllegalArgumentException e) {
            throw new UsageException(e.getMessage());
        }
        try {
            return defaults.toBuilder()
                    .minSupport(options.getDouble("--min-support", defaults.minSupport()))
                    .minConfidence(options.getDouble("--min-confidence", defaults.minConfidence()))
                    .minLift(options.getDouble("--min-lift", defaults.minLift()))
                    .parallelism(options.getInt("--parallelism", defaults.parallelism()))
                    .build();
        } catch (IllegalArgumentException e) {
            throw new UsageException(e.getMessage());
        }
    }

    private void logMetrics() {
        if (metrics instanceof InMemoryMetricsRegistry inMemory && logger.isLoggable(Level.INFO)) {
            logger.info("Run metrics: " + inMemory.counterSnapshot() + ", timers: " + inMemory.timerTotals());
        }
    }

    static String version() {
        String version = PolicyMinerApplication.class.getPackage().getImplementationVersion();
        return version != null ? version : "1.0.0-SNAPSHOT";
    }

    private static void configureLogging() {
        try (InputStream config = PolicyMinerApplication.class.getResourceAsStream("/logging.properties")) {
            if (config != null) {
                LogManager.getLogManager().readConfiguration(config);
            }
        } catch (IOException e) {
            System.err.println("Could not load logging configuration: " + e.getMessage());
        }
        if (Boolean.getBoolean(VERBOSE_PROPERTY)) {
            Logger root = Logger.getLogger("");
            root.setLevel(Level.INFO);
            for (var handler : root.getHandlers()) {
                handler.setLevel(Level.INFO);
            }
        }
    }
}
