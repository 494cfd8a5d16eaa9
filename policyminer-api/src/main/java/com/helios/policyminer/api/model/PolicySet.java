/*
 * Copyright (c) 2025 Helios Policy Miner
 * Licensed under the Apache License, Version 2.0
 */
package com.helios.policyminer.api.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import com.helios.policyminer.api.exceptions.PolicyValidationException;

import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.util.Comparator;
import java.util.List;

/**
 * The ranked output of one extraction run plus its run metadata.
 *
 * <p>The order of {@link #policies()} is significant and is preserved through
 * serialization. Instances are never mutated; derived views such as
 * {@link #topPolicies(int)} return new lists.
 *
 * @param name        free-text label for the run
 * @param sourceLogs  number of logs analyzed, never negative
 * @param policies    policies in ranked order
 * @param generatedAt ISO-8601 creation time
 */
@JsonPropertyOrder({"name", "source_logs", "policies", "generated_at"})
public record PolicySet(
        @JsonProperty("name") String name,
        @JsonProperty("source_logs") int sourceLogs,
        @JsonProperty("policies") List<MinedPolicy> policies,
        @JsonProperty("generated_at") String generatedAt) {

    public static final String DEFAULT_NAME = "Mined Policy Set";
    public static final int DEFAULT_TOP_N = 10;

    private static final Comparator<MinedPolicy> BY_CONFIDENCE_DESC =
            Comparator.comparingDouble(MinedPolicy::confidence).reversed();

    public PolicySet {
        if (name == null) {
            name = DEFAULT_NAME;
        }
        if (sourceLogs < 0) {
            throw new PolicyValidationException("source_logs", "must be >= 0, got " + sourceLogs);
        }
        policies = policies == null ? List.of() : List.copyOf(policies);
        if (generatedAt == null || generatedAt.isBlank()) {
            generatedAt = LocalDateTime.now(ZoneOffset.UTC).toString();
        }
    }

    @JsonCreator
    public static PolicySet fromDocument(
            @JsonProperty("name") String name,
            @JsonProperty("source_logs") Integer sourceLogs,
            @JsonProperty("policies") List<MinedPolicy> policies,
            @JsonProperty("generated_at") String generatedAt) {
        return new PolicySet(name, sourceLogs == null ? 0 : sourceLogs, policies, generatedAt);
    }

    /**
     * Creates an empty set for a run that analyzed no logs.
     */
    public static PolicySet empty(String name) {
        return new PolicySet(name, 0, List.of(), null);
    }

    /**
     * Returns the {@code n} policies with the highest confidence.
     *
     * <p>The stored order is not trusted (the set may have been decoded from an
     * external document), so the ranking is recomputed with a stable sort:
     * equal confidences keep their relative order.
     *
     * @param n maximum number of policies to return
     * @return a new list of at most {@code n} policies
     */
    public List<MinedPolicy> topPolicies(int n) {
        if (n <= 0) {
            return List.of();
        }
        return policies.stream()
                .sorted(BY_CONFIDENCE_DESC)
                .limit(n)
                .toList();
    }

    public List<MinedPolicy> topPolicies() {
        return topPolicies(DEFAULT_TOP_N);
    }
}
