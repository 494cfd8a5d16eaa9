/*
 * Copyright (c) 2025 Helios Policy Miner
 * Licensed under the Apache License, Version 2.0
 */
package com.helios.policyminer.io;

import com.helios.policyminer.api.model.MinedPolicy;
import com.helios.policyminer.api.model.PolicySet;
import com.helios.policyminer.core.text.PolicyDescriptions;

import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Renders a policy set as a plain-text report or a Markdown table.
 *
 * <p>Policies are rendered in stored order, limited to the first
 * {@code maxPolicies}. The header always reports the total count.
 */
public class PolicyFormatter {

    public static final int DEFAULT_MAX_POLICIES = 50;

    private static final int SCORE_DIGITS = 4;
    private static final String RULE = "-".repeat(60);

    public String toText(PolicySet policySet) {
        return toText(policySet, DEFAULT_MAX_POLICIES);
    }

    public String toText(PolicySet policySet, int maxPolicies) {
        List<String> lines = new ArrayList<>();
        lines.add("Policy Set: " + policySet.name());
        lines.add("Source logs: " + policySet.sourceLogs());
        lines.add("Generated at: " + policySet.generatedAt());
        lines.add("Total policies: " + policySet.policies().size());
        lines.add(RULE);
        for (MinedPolicy policy : head(policySet, maxPolicies)) {
            lines.add("[" + policy.policyId() + "] " + policy.description());
            lines.add("  support=" + score(policy.support())
                    + " confidence=" + score(policy.confidence())
                    + " lift=" + score(policy.lift()));
        }
        return String.join("\n", lines);
    }

    public String toMarkdown(PolicySet policySet) {
        return toMarkdown(policySet, DEFAULT_MAX_POLICIES);
    }

    public String toMarkdown(PolicySet policySet, int maxPolicies) {
        List<String> lines = new ArrayList<>();
        lines.add("# " + policySet.name());
        lines.add("");
        lines.add("- **Source logs:** " + policySet.sourceLogs());
        lines.add("- **Generated at:** " + policySet.generatedAt());
        lines.add("- **Total policies:** " + policySet.policies().size());
        lines.add("");
        lines.add("| ID | Antecedent | Consequent | Support | Confidence | Lift |");
        lines.add("|----|-----------|-----------|---------|------------|------|");
        for (MinedPolicy policy : head(policySet, maxPolicies)) {
            String antecedent = policy.antecedent().entrySet().stream()
                    .map(e -> e.getKey() + "=" + e.getValue())
                    .collect(Collectors.joining(", "));
            lines.add("| " + policy.policyId() + " | " + antecedent + " | " + policy.consequent()
                    + " | " + score(policy.support())
                    + " | " + score(policy.confidence())
                    + " | " + score(policy.lift()) + " |");
        }
        return String.join("\n", lines);
    }

    private static List<MinedPolicy> head(PolicySet policySet, int maxPolicies) {
        List<MinedPolicy> policies = policySet.policies();
        return policies.subList(0, Math.max(0, Math.min(maxPolicies, policies.size())));
    }

    private static String score(double value) {
        return PolicyDescriptions.fixed(value, SCORE_DIGITS);
    }
}
