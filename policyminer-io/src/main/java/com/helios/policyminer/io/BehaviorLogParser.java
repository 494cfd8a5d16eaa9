/*
 * Copyright (c) 2025 Helios Policy Miner
 * Licensed under the Apache License, Version 2.0
 */
package com.helios.policyminer.io;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.helios.policyminer.api.model.BehaviorLog;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedReader;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Reads behavior logs from JSON Lines files (one JSON object per line).
 *
 * <p>Blank lines are ignored. Lines that are not valid JSON, that are not
 * objects, or that fail {@link BehaviorLog} validation are skipped and
 * counted rather than failing the whole file. Unknown fields are ignored.
 *
 * <pre>{@code
 * BehaviorLogParser parser = new BehaviorLogParser();
 * ParseResult result = parser.parseFile(Path.of("behavior.jsonl"));
 * List<BehaviorLog> logs = result.logs();
 * }</pre>
 */
public class BehaviorLogParser {
    private static final Logger logger = LoggerFactory.getLogger(BehaviorLogParser.class);

    private final ObjectMapper objectMapper;

    public BehaviorLogParser() {
        this(JsonMappers.create());
    }

    public BehaviorLogParser(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    /**
     * Outcome of parsing a file.
     *
     * @param logs         valid logs in file order
     * @param skippedLines number of non-blank lines that were rejected
     */
    public record ParseResult(List<BehaviorLog> logs, int skippedLines) {
        public ParseResult {
            logs = List.copyOf(logs);
        }
    }

    /**
     * Parses a UTF-8 JSONL file.
     *
     * @throws IOException if the file cannot be read
     */
    public ParseResult parseFile(Path path) throws IOException {
        List<BehaviorLog> logs = new ArrayList<>();
        int skipped = 0;
        int lineNumber = 0;

        try (BufferedReader reader = Files.newBufferedReader(path, StandardCharsets.UTF_8)) {
            String line;
            while ((line = reader.readLine()) != null) {
                lineNumber++;
                String trimmed = line.strip();
                if (trimmed.isEmpty()) {
                    continue;
                }
                BehaviorLog log = parseLine(trimmed, lineNumber);
                if (log == null) {
                    skipped++;
                } else {
                    logs.add(log);
                }
            }
        }

        logger.info("Parsed {} behavior logs from {} ({} lines skipped)", logs.size(), path, skipped);
        return new ParseResult(logs, skipped);
    }

    /**
     * Parses a JSONL file and returns only the valid logs.
     */
    public List<BehaviorLog> parseFileLogs(Path path) throws IOException {
        return parseFile(path).logs();
    }

    /**
     * Validates already-decoded records, skipping those that are invalid.
     */
    public List<BehaviorLog> parseRecords(List<Map<String, Object>> records) {
        List<BehaviorLog> logs = new ArrayList<>(records.size());
        for (int i = 0; i < records.size(); i++) {
            Map<String, Object> record = records.get(i);
            if (record == null) {
                logger.debug("Skipping record {}: null", i);
                continue;
            }
            try {
                logs.add(objectMapper.convertValue(record, BehaviorLog.class));
            } catch (IllegalArgumentException e) {
                logger.debug("Skipping record {}: {}", i, describe(e));
            }
        }
        return logs;
    }

    private BehaviorLog parseLine(String line, int lineNumber) {
        try {
            BehaviorLog log = objectMapper.readValue(line, BehaviorLog.class);
            if (log == null) {
                logger.debug("Skipping line {}: null document", lineNumber);
            }
            return log;
        } catch (JsonProcessingException | IllegalArgumentException e) {
            logger.debug("Skipping line {}: {}", lineNumber, describe(e));
            return null;
        }
    }

    private static String describe(Exception e) {
        var validation = JsonMappers.validationCause(e);
        if (validation != null) {
            return validation.getMessage();
        }
        if (e instanceof JsonProcessingException jpe) {
            return jpe.getOriginalMessage();
        }
        return e.getMessage();
    }
}
