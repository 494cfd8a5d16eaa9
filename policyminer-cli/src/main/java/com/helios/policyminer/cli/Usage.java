/*
 * Copyright (c) 2025 Helios Policy Miner
 * Licensed under the Apache License, Version 2.0
 */
package com.helios.policyminer.cli;

import java.io.PrintStream;

/**
 * Help text for the command line.
 */
final class Usage {

    private Usage() {
    }

    static void printUsage(PrintStream out) {
        out.println("Usage: policyminer [--help] [--version] <command> [options]");
        out.println();
        out.println("Governance policy extraction from agent behavior logs.");
        out.println();
        out.println("Commands:");
        out.println("  extract  Mine policies from a JSONL behavior log file");
        out.println("  format   Render a JSON policy set as text, Markdown or JSON");
        out.println();
        out.println("Run 'policyminer <command> --help' for command options.");
    }

    static void printExtractUsage(PrintStream out) {
        out.println("Usage: policyminer extract --logs <file.jsonl> [options]");
        out.println();
        out.println("Options:");
        out.println("  --logs PATH             JSONL behavior log file (required)");
        out.println("  --output PATH           Output JSON path (default: policies.json next to the logs)");
        out.println("  --min-support FLOAT     Minimum support threshold (default: 0.05)");
        out.println("  --min-confidence FLOAT  Minimum confidence threshold (default: 0.6)");
        out.println("  --min-lift FLOAT        Minimum lift threshold (default: 1.0)");
        out.println("  --name TEXT             Policy set name (default: Mined Policy Set)");
        out.println("  --parallelism N         Counting workers for large inputs (default: 1)");
        out.println();
        out.println("Example:");
        out.println("  policyminer extract --logs behavior.jsonl --min-confidence 0.7");
    }

    static void printFormatUsage(PrintStream out) {
        out.println("Usage: policyminer format --policies <file.json> [options]");
        out.println();
        out.println("Options:");
        out.println("  --policies PATH                  JSON policy set file (required)");
        out.println("  --output-format text|markdown|json  Output format (default: text)");
        out.println("  --max-policies N                 Maximum policies to render (default: 50)");
        out.println();
        out.println("Example:");
        out.println("  policyminer format --policies policies.json --output-format markdown");
    }
}
