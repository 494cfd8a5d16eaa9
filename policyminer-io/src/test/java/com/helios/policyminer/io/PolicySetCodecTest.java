/*
 * Copyright (c) 2025 Helios Policy Miner
 * Licensed under the Apache License, Version 2.0
 */
package com.helios.policyminer.io;

import com.helios.policyminer.api.exceptions.PolicyValidationException;
import com.helios.policyminer.api.model.MinedPolicy;
import com.helios.policyminer.api.model.PolicySet;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class PolicySetCodecTest {

    @TempDir
    Path tempDir;

    private final PolicySetCodec codec = new PolicySetCodec();

    private static PolicySet sampleSet() {
        MinedPolicy policy = new MinedPolicy("policy_0001", Map.of("role", "admin"), "read_file",
                0.7, 1.0, 1.428571,
                "When role='admin', agents perform 'read_file' with 100.0% confidence (support=70.0%, lift=1.43)");
        return new PolicySet("Audit", 10, List.of(policy), "2025-03-01T12:00:00");
    }

    @Test
    @DisplayName("Should produce a document with fields in model order")
    void shouldProduceDocument() {
        Map<String, Object> document = codec.toDocument(sampleSet());

        assertThat(document).containsOnlyKeys("name", "source_logs", "policies", "generated_at");
        assertThat(document.keySet()).containsExactly("name", "source_logs", "policies", "generated_at");
        assertThat(document.get("policies")).asList().singleElement()
                .isInstanceOfSatisfying(Map.class, policy -> assertThat(policy.keySet()).containsExactly(
                        "policy_id", "antecedent", "consequent", "support", "confidence", "lift", "description"));
    }

    @Test
    @DisplayName("Should decode an encoded document to an equal set")
    void shouldDecodeDocument() {
        PolicySet original = sampleSet();

        assertThat(codec.fromDocument(codec.toDocument(original))).isEqualTo(original);
        assertThat(codec.fromJson(codec.toJson(original))).isEqualTo(original);
    }

    @Test
    @DisplayName("Should pretty print with two-space indentation")
    void shouldPrettyPrint() {
        String json = codec.toJson(sampleSet());

        assertThat(json).startsWith("{\n  \"name\": \"Audit\",\n  \"source_logs\": 10,\n  \"policies\": [\n    {\n");
        assertThat(json).contains("      \"policy_id\": \"policy_0001\"");
        assertThat(json).endsWith("\"generated_at\": \"2025-03-01T12:00:00\"\n}");
    }

    @Test
    @DisplayName("Should default lift, description, name and ignore unknown fields")
    void shouldApplyDefaults() {
        String json = """
                {
                  "source_logs": 4,
                  "producer": "legacy",
                  "policies": [
                    {"policy_id": "p1", "antecedent": {"env": "prod"}, "consequent": "deploy",
                     "support": 0.5, "confidence": 0.75, "extra": 1}
                  ]
                }
                """;

        PolicySet set = codec.fromJson(json);

        assertThat(set.name()).isEqualTo("Mined Policy Set");
        assertThat(set.generatedAt()).isNotBlank();
        assertThat(set.policies()).singleElement().satisfies(policy -> {
            assertThat(policy.lift()).isEqualTo(1.0);
            assertThat(policy.description()).isEmpty();
        });
    }

    @Test
    @DisplayName("Should report the offending field of an invalid policy")
    void shouldRejectInvalidPolicies() {
        String outOfRange = """
                {"policies": [{"policy_id": "p1", "antecedent": {"k": "v"}, "consequent": "a",
                               "support": 1.5, "confidence": 0.5}]}
                """;
        String missingConfidence = """
                {"policies": [{"policy_id": "p1", "antecedent": {"k": "v"}, "consequent": "a", "support": 0.5}]}
                """;

        assertThatThrownBy(() -> codec.fromJson(outOfRange))
                .isInstanceOfSatisfying(PolicyValidationException.class,
                        e -> assertThat(e.field()).isEqualTo("support"));
        assertThatThrownBy(() -> codec.fromJson(missingConfidence))
                .isInstanceOfSatisfying(PolicyValidationException.class,
                        e -> assertThat(e.field()).isEqualTo("confidence"));
    }

    @Test
    @DisplayName("Should reject malformed JSON and wrong types")
    void shouldRejectMalformedJson() {
        assertThatThrownBy(() -> codec.fromJson("{\"policies\": ["))
                .isInstanceOf(PolicyValidationException.class);
        assertThatThrownBy(() -> codec.fromJson("{\"source_logs\": \"many\"}"))
                .isInstanceOf(PolicyValidationException.class);
        assertThatThrownBy(() -> codec.fromJson("null"))
                .isInstanceOf(PolicyValidationException.class);
        assertThatThrownBy(() -> codec.fromDocument(Map.of("source_logs", -1)))
                .isInstanceOfSatisfying(PolicyValidationException.class,
                        e -> assertThat(e.field()).isEqualTo("source_logs"));
    }

    @Test
    @DisplayName("Should write and read files")
    void shouldWriteAndReadFiles() throws IOException {
        Path file = tempDir.resolve("policies.json");

        codec.write(sampleSet(), file);

        assertThat(Files.readString(file)).isEqualTo(codec.toJson(sampleSet()));
        assertThat(codec.read(file)).isEqualTo(sampleSet());
    }
}
