/*
 * Copyright (c) 2025 Helios Policy Miner
 * Licensed under the Apache License, Version 2.0
 */
package com.helios.policyminer.api.model;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.helios.policyminer.api.exceptions.PolicyValidationException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.util.AbstractMap;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class BehaviorLogTest {

    @Test
    @DisplayName("Should apply defaults for timestamp, context and outcome")
    void shouldApplyDefaults() {
        BehaviorLog log = new BehaviorLog("log001", "agent_alpha", null, "read_file", null, null);

        assertThat(log.timestamp()).isNotBlank();
        assertThat(log.context()).isEmpty();
        assertThat(log.outcome()).isEqualTo("success");
    }

    @Test
    @DisplayName("Should trim identifiers and action")
    void shouldTrimIdentifiersAndAction() {
        BehaviorLog log = BehaviorLog.of("  log001 ", " agent ", "  read_file  ", Map.of());

        assertThat(log.logId()).isEqualTo("log001");
        assertThat(log.agentId()).isEqualTo("agent");
        assertThat(log.action()).isEqualTo("read_file");
    }

    @ParameterizedTest
    @ValueSource(strings = {"", "   ", "\t"})
    @DisplayName("Should reject blank action")
    void shouldRejectBlankAction(String action) {
        assertThatThrownBy(() -> BehaviorLog.of("log001", "agent", action, Map.of()))
                .isInstanceOf(PolicyValidationException.class)
                .extracting(e -> ((PolicyValidationException) e).field())
                .isEqualTo("action");
    }

    @Test
    @DisplayName("Should reject blank agent id and log id")
    void shouldRejectBlankIdentifiers() {
        assertThatThrownBy(() -> BehaviorLog.of("log001", " ", "read", Map.of()))
                .isInstanceOf(PolicyValidationException.class)
                .hasMessageContaining("agent_id");
        assertThatThrownBy(() -> BehaviorLog.of(null, "agent", "read", Map.of()))
                .isInstanceOf(PolicyValidationException.class)
                .hasMessageContaining("log_id");
    }

    @Test
    @DisplayName("Should keep context insertion order and null values")
    void shouldKeepContextOrderAndNulls() {
        Map<String, Object> context = new LinkedHashMap<>();
        context.put("zone", "eu");
        context.put("attempts", 3);
        context.put("flags", List.of("a", "b"));
        context.put("missing", null);

        BehaviorLog log = BehaviorLog.of("log001", "agent", "read", context);

        assertThat(log.context()).containsExactly(
                Map.entry("zone", "eu"),
                Map.entry("attempts", 3),
                Map.entry("flags", List.of("a", "b")),
                new AbstractMap.SimpleEntry<>("missing", null));
    }

    @Test
    @DisplayName("Should not be affected by later changes to the caller's context map")
    void shouldCopyContext() {
        Map<String, Object> context = new HashMap<>();
        context.put("role", "admin");
        BehaviorLog log = BehaviorLog.of("log001", "agent", "read", context);

        context.put("role", "guest");

        assertThat(log.context()).containsEntry("role", "admin");
        assertThatThrownBy(() -> log.context().put("x", 1))
                .isInstanceOf(UnsupportedOperationException.class);
    }

    @Test
    @DisplayName("Should decode from a snake_case JSON document")
    void shouldDecodeFromJson() throws Exception {
        String json = """
                {"log_id": "l1", "agent_id": "a1", "action": " approve ",
                 "context": {"role": "manager", "level": 2}, "timestamp": "2025-01-01T00:00:00"}
                """;

        BehaviorLog log = new ObjectMapper().readValue(json, BehaviorLog.class);

        assertThat(log.logId()).isEqualTo("l1");
        assertThat(log.action()).isEqualTo("approve");
        assertThat(log.timestamp()).isEqualTo("2025-01-01T00:00:00");
        assertThat(log.context()).containsEntry("role", "manager").containsEntry("level", 2);
        assertThat(log.outcome()).isEqualTo("success");
    }
}
