/*
 * Copyright (c) 2025 Helios Policy Miner
 * Licensed under the Apache License, Version 2.0
 */
package com.helios.policyminer.api.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import com.helios.policyminer.api.exceptions.PolicyValidationException;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * A governance policy derived from behavioral patterns: "when the context
 * attribute in {@code antecedent} holds, agents perform {@code consequent}".
 *
 * <h2>Scores</h2>
 * <ul>
 *   <li><b>support</b>: share of all logs carrying both antecedent and consequent</li>
 *   <li><b>confidence</b>: share of antecedent-matching logs that show the consequent</li>
 *   <li><b>lift</b>: confidence divided by the consequent's baseline frequency</li>
 * </ul>
 *
 * @param policyId    identifier, {@code policy_NNNN} when produced by an extraction run
 * @param antecedent  exactly one context attribute and its text value
 * @param consequent  the predicted action
 * @param support     value in [0, 1]
 * @param confidence  value in [0, 1]
 * @param lift        non-negative value
 * @param description human-readable summary, may be empty
 */
@JsonPropertyOrder({"policy_id", "antecedent", "consequent", "support", "confidence", "lift", "description"})
public record MinedPolicy(
        @JsonProperty("policy_id") String policyId,
        @JsonProperty("antecedent") Map<String, String> antecedent,
        @JsonProperty("consequent") String consequent,
        @JsonProperty("support") double support,
        @JsonProperty("confidence") double confidence,
        @JsonProperty("lift") double lift,
        @JsonProperty("description") String description) {

    public static final double DEFAULT_LIFT = 1.0;

    public MinedPolicy {
        if (policyId == null) {
            throw new PolicyValidationException("policy_id", "is required");
        }
        if (consequent == null) {
            throw new PolicyValidationException("consequent", "is required");
        }
        if (antecedent == null || antecedent.size() != 1) {
            throw new PolicyValidationException("antecedent",
                    "must contain exactly one attribute, got " + (antecedent == null ? 0 : antecedent.size()));
        }
        antecedent = Collections.unmodifiableMap(new LinkedHashMap<>(antecedent));
        requireFraction("support", support);
        requireFraction("confidence", confidence);
        if (!(lift >= 0.0)) {
            throw new PolicyValidationException("lift", "must be >= 0, got " + lift);
        }
        if (description == null) {
            description = "";
        }
    }

    /**
     * Builds a policy from a decoded document where {@code lift} and
     * {@code description} are optional.
     */
    @JsonCreator
    public static MinedPolicy fromDocument(
            @JsonProperty("policy_id") String policyId,
            @JsonProperty("antecedent") Map<String, String> antecedent,
            @JsonProperty("consequent") String consequent,
            @JsonProperty("support") Double support,
            @JsonProperty("confidence") Double confidence,
            @JsonProperty("lift") Double lift,
            @JsonProperty("description") String description) {
        if (support == null) {
            throw new PolicyValidationException("support", "is required");
        }
        if (confidence == null) {
            throw new PolicyValidationException("confidence", "is required");
        }
        return new MinedPolicy(policyId, antecedent, consequent, support, confidence,
                lift == null ? DEFAULT_LIFT : lift, description);
    }

    /**
     * Creates a copy carrying a different policy id.
     */
    public MinedPolicy withPolicyId(String newPolicyId) {
        return new MinedPolicy(newPolicyId, antecedent, consequent, support, confidence, lift, description);
    }

    /**
     * Returns the context attribute name of the antecedent.
     */
    @JsonIgnore
    public String antecedentKey() {
        return antecedent.keySet().iterator().next();
    }

    /**
     * Returns the text value of the antecedent.
     */
    @JsonIgnore
    public String antecedentValue() {
        return antecedent.values().iterator().next();
    }

    private static void requireFraction(String field, double value) {
        if (!(value >= 0.0 && value <= 1.0)) {
            throw new PolicyValidationException(field, "must be between 0.0 and 1.0, got " + value);
        }
    }
}
