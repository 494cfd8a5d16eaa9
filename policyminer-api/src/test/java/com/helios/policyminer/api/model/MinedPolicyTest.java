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

import java.util.LinkedHashMap;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class MinedPolicyTest {

    private static MinedPolicy policy(double support, double confidence, double lift) {
        return new MinedPolicy("policy_0001", Map.of("role", "admin"), "read_file",
                support, confidence, lift, "When role='admin', agents perform 'read_file'");
    }

    @Test
    @DisplayName("Should expose antecedent key and value")
    void shouldExposeAntecedent() {
        MinedPolicy policy = policy(0.3, 0.9, 1.5);

        assertThat(policy.antecedentKey()).isEqualTo("role");
        assertThat(policy.antecedentValue()).isEqualTo("admin");
    }

    @ParameterizedTest
    @ValueSource(doubles = {-0.01, 1.01, Double.NaN})
    @DisplayName("Should reject support outside [0, 1]")
    void shouldRejectSupportOutOfRange(double support) {
        assertThatThrownBy(() -> policy(support, 0.5, 1.0))
                .isInstanceOf(PolicyValidationException.class)
                .extracting(e -> ((PolicyValidationException) e).field())
                .isEqualTo("support");
    }

    @ParameterizedTest
    @ValueSource(doubles = {-0.5, 1.5})
    @DisplayName("Should reject confidence outside [0, 1]")
    void shouldRejectConfidenceOutOfRange(double confidence) {
        assertThatThrownBy(() -> policy(0.5, confidence, 1.0))
                .isInstanceOf(PolicyValidationException.class)
                .hasMessageContaining("confidence");
    }

    @Test
    @DisplayName("Should reject negative lift but accept boundaries")
    void shouldValidateLift() {
        assertThatThrownBy(() -> policy(0.5, 0.5, -0.1))
                .isInstanceOf(PolicyValidationException.class)
                .hasMessageContaining("lift");

        assertThat(policy(0.0, 1.0, 0.0).lift()).isZero();
        assertThat(policy(1.0, 0.0, 250.0).lift()).isEqualTo(250.0);
    }

    @Test
    @DisplayName("Should require exactly one antecedent attribute")
    void shouldRequireSingleAntecedent() {
        Map<String, String> twoKeys = new LinkedHashMap<>();
        twoKeys.put("role", "admin");
        twoKeys.put("env", "prod");

        assertThatThrownBy(() -> new MinedPolicy("p", twoKeys, "read", 0.1, 0.1, 1.0, ""))
                .isInstanceOf(PolicyValidationException.class)
                .hasMessageContaining("antecedent");
        assertThatThrownBy(() -> new MinedPolicy("p", Map.of(), "read", 0.1, 0.1, 1.0, ""))
                .isInstanceOf(PolicyValidationException.class);
    }

    @Test
    @DisplayName("Should default description to empty")
    void shouldDefaultDescription() {
        MinedPolicy policy = new MinedPolicy("p", Map.of("k", "v"), "read", 0.1, 0.1, 1.0, null);

        assertThat(policy.description()).isEmpty();
    }

    @Test
    @DisplayName("Should default lift when absent from a document")
    void shouldDefaultLiftWhenAbsent() throws Exception {
        String json = """
                {"policy_id": "policy_0001", "antecedent": {"role": "admin"},
                 "consequent": "read", "support": 0.4, "confidence": 0.8}
                """;

        MinedPolicy policy = new ObjectMapper().readValue(json, MinedPolicy.class);

        assertThat(policy.lift()).isEqualTo(MinedPolicy.DEFAULT_LIFT);
        assertThat(policy.description()).isEmpty();
    }
}
