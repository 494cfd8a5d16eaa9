/*
 * Copyright (c) 2025 Helios Policy Miner
 * Licensed under the Apache License, Version 2.0
 */
package com.helios.policyminer.api.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.helios.policyminer.api.exceptions.PolicyValidationException;

import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * A single recorded agent action together with the situation it happened in.
 *
 * <p>
 * A behavior log consists of:
 * <ul>
 * <li><b>logId</b>: identifier of the entry. Duplicates inside a batch are
 * tolerated and counted independently.</li>
 * <li><b>agentId</b>: identifier of the acting agent.</li>
 * <li><b>timestamp</b>: ISO-8601 text; informational only.</li>
 * <li><b>action</b>: name of the action taken (e.g. "read_file").</li>
 * <li><b>context</b>: flat attribute map describing the situation. Insertion
 * order is preserved and drives rule discovery order.</li>
 * <li><b>outcome</b>: outcome label, not used for mining.</li>
 * </ul>
 *
 * @param logId     non-blank entry identifier (trimmed)
 * @param agentId   non-blank agent identifier (trimmed)
 * @param timestamp event time, defaults to the current UTC time
 * @param action    non-blank action name (trimmed)
 * @param context   situational attributes, defaults to an empty map
 * @param outcome   outcome label, defaults to {@value #DEFAULT_OUTCOME}
 */
public record BehaviorLog(
        @JsonProperty("log_id") String logId,
        @JsonProperty("agent_id") String agentId,
        @JsonProperty("timestamp") String timestamp,
        @JsonProperty("action") String action,
        @JsonProperty("context") Map<String, Object> context,
        @JsonProperty("outcome") String outcome) {

    public static final String DEFAULT_OUTCOME = "success";

    public BehaviorLog {
        logId = requireNonBlank("log_id", logId);
        agentId = requireNonBlank("agent_id", agentId);
        action = requireNonBlank("action", action);
        if (timestamp == null || timestamp.isBlank()) {
            timestamp = LocalDateTime.now(ZoneOffset.UTC).toString();
        }
        if (context != null && context.keySet().stream().anyMatch(Objects::isNull)) {
            throw new PolicyValidationException("context", "attribute names must not be null");
        }
        // LinkedHashMap keeps key order and tolerates null attribute values
        context = context == null
                ? Map.of()
                : Collections.unmodifiableMap(new LinkedHashMap<>(context));
        if (outcome == null) {
            outcome = DEFAULT_OUTCOME;
        }
    }

    /**
     * Creates a log stamped with the current time and the default outcome.
     */
    public static BehaviorLog of(String logId, String agentId, String action, Map<String, Object> context) {
        return new BehaviorLog(logId, agentId, null, action, context, null);
    }

    private static String requireNonBlank(String field, String value) {
        if (value == null || value.isBlank()) {
            throw new PolicyValidationException(field, "must not be blank");
        }
        return value.strip();
    }
}
