/*
 * Copyright (c) 2025 Helios Policy Miner
 * Licensed under the Apache License, Version 2.0
 */
package com.helios.policyminer.core.extraction;

import com.helios.policyminer.api.ExtractionListener;
import com.helios.policyminer.api.IPolicyExtractor;
import com.helios.policyminer.api.model.BehaviorLog;
import com.helios.policyminer.api.model.MinedPolicy;
import com.helios.policyminer.api.model.PolicySet;
import com.helios.policyminer.core.coercion.AntecedentValueCoercer;
import com.helios.policyminer.core.coercion.StringValueCoercer;
import com.helios.policyminer.core.extraction.FrequencyTables.RuleKey;
import com.helios.policyminer.core.text.PolicyDescriptions;
import com.helios.policyminer.infra.metrics.MetricsRegistry;
import com.helios.policyminer.infra.telemetry.TracingService;
import io.opentelemetry.api.OpenTelemetry;
import io.opentelemetry.api.trace.Span;
import io.opentelemetry.api.trace.Tracer;
import io.opentelemetry.context.Scope;
import it.unimi.dsi.fastutil.objects.Object2IntMap;
import it.unimi.dsi.fastutil.objects.Object2IntMaps;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.Executor;
import java.util.concurrent.ForkJoinPool;

/**
 * Mines single-attribute association rules from behavior logs.
 *
 * <p>For each context attribute value observed in the logs and each action
 * that co-occurs with it, the extractor computes:
 * <pre>
 *   support    = count(antecedent AND consequent) / total_logs
 *   confidence = count(antecedent AND consequent) / count(antecedent)
 *   lift       = confidence / (count(consequent) / total_logs)
 * </pre>
 * Rules are kept when support, confidence and lift each reach their
 * configured minimum (checked in that order).
 *
 * <h2>Pipeline</h2>
 * <ol>
 *   <li>COUNTING: one scan fills the {@link FrequencyTables}; large inputs may
 *   be split across workers and merged in chunk order</li>
 *   <li>SCORING: every observed (key, value, action) triple is scored and
 *   filtered; scores are rounded to 6 decimals for storage</li>
 *   <li>RANKING: stable sort by confidence descending, then ids
 *   {@code policy_0001, policy_0002, ...} are assigned in final order</li>
 * </ol>
 *
 * <h2>Thread Safety</h2>
 * <p>All working state is local to one {@link #extract(List, String)} call,
 * so concurrent extractions on the same instance are independent. The
 * listener is shared by all calls on the instance.
 */
public class PolicyExtractor implements IPolicyExtractor {
    private static final Logger logger = LoggerFactory.getLogger(PolicyExtractor.class);

    static final int SCORE_SCALE = 6;
    static final String POLICY_ID_FORMAT = "policy_%04d";
    private static final String UNASSIGNED_ID = "";

    private static final Comparator<MinedPolicy> BY_CONFIDENCE_DESC =
            Comparator.comparingDouble(MinedPolicy::confidence).reversed();

    private final ExtractionConfig config;
    private final Tracer tracer;
    private final AntecedentValueCoercer coercer;
    private final MetricsRegistry metrics;
    private final Executor executor;

    private volatile ExtractionListener listener;

    public PolicyExtractor() {
        this(ExtractionConfig.defaults());
    }

    public PolicyExtractor(ExtractionConfig config) {
        this(config, OpenTelemetry.noop().getTracer(TracingService.INSTRUMENTATION_NAME));
    }

    public PolicyExtractor(ExtractionConfig config, Tracer tracer) {
        this(config, tracer, MetricsRegistry.getInstance());
    }

    public PolicyExtractor(ExtractionConfig config, Tracer tracer, MetricsRegistry metrics) {
        this(config, tracer, metrics, StringValueCoercer.INSTANCE, ForkJoinPool.commonPool());
    }

    public PolicyExtractor(ExtractionConfig config, Tracer tracer, MetricsRegistry metrics,
                           AntecedentValueCoercer coercer, Executor executor) {
        this.config = Objects.requireNonNull(config, "ExtractionConfig cannot be null");
        this.tracer = Objects.requireNonNull(tracer, "Tracer cannot be null");
        this.metrics = Objects.requireNonNull(metrics, "MetricsRegistry cannot be null");
        this.coercer = Objects.requireNonNull(coercer, "AntecedentValueCoercer cannot be null");
        this.executor = Objects.requireNonNull(executor, "Executor cannot be null");
    }

    public ExtractionConfig getConfig() {
        return config;
    }

    @Override
    public void setExtractionListener(ExtractionListener listener) {
        this.listener = listener;
    }

    @Override
    public PolicySet extract(List<BehaviorLog> logs, String name) {
        Objects.requireNonNull(logs, "logs cannot be null");
        Span span = tracer.spanBuilder("extract-policies").startSpan();
        try (Scope scope = span.makeCurrent()) {
            long startTime = System.nanoTime();
            int total = logs.size();
            span.setAttribute("sourceLogs", total);
            metrics.counter("policyminer_extractions_total").increment();

            if (total == 0) {
                logger.debug("No behavior logs supplied, returning empty policy set '{}'", name);
                return PolicySet.empty(name);
            }
            metrics.counter("policyminer_logs_processed_total").increment(total);

            ExtractionListener currentListener = this.listener;
            FrequencyTables tables = countFrequencies(logs, currentListener);
            List<ScoredRule> accepted = scoreRules(tables, currentListener);
            List<MinedPolicy> policies = rankPolicies(accepted, currentListener);

            long elapsed = System.nanoTime() - startTime;
            metrics.counter("policyminer_policies_emitted_total").increment(policies.size());
            metrics.timer("policyminer_extraction_latency").record(Duration.ofNanos(elapsed));
            span.setAttribute("policyCount", policies.size());

            logger.info("Mined {} policies from {} behavior logs in {} ms",
                    policies.size(), total, elapsed / 1_000_000);
            return new PolicySet(name, total, policies, null);
        } catch (RuntimeException e) {
            span.recordException(e);
            throw e;
        } finally {
            span.end();
        }
    }

    private FrequencyTables countFrequencies(List<BehaviorLog> logs, ExtractionListener listener) {
        Span span = tracer.spanBuilder("count-frequencies").startSpan();
        try (Scope scope = span.makeCurrent()) {
            long stageStart = startStage(listener, ExtractionListener.STAGE_COUNTING, 1);

            int workers = Math.min(config.parallelism(), logs.size());
            FrequencyTables tables;
            if (workers > 1 && logs.size() >= config.parallelThreshold()) {
                tables = countInParallel(logs, workers, listener);
            } else {
                workers = 1;
                tables = FrequencyTables.count(logs, coercer);
            }

            span.setAttribute("workers", workers);
            span.setAttribute("distinctActions", tables.distinctActions());
            span.setAttribute("distinctAntecedents", tables.distinctAntecedents());
            logger.debug("Counted {} actions, {} antecedents, {} co-occurrences using {} worker(s)",
                    tables.distinctActions(), tables.distinctAntecedents(), tables.coOccurrences().size(), workers);

            Map<String, Object> stageMetrics = new LinkedHashMap<>();
            stageMetrics.put("workers", workers);
            stageMetrics.put("distinctActions", tables.distinctActions());
            stageMetrics.put("distinctAntecedents", tables.distinctAntecedents());
            stageMetrics.put("candidateRules", tables.coOccurrences().size());
            completeStage(listener, ExtractionListener.STAGE_COUNTING, stageStart, stageMetrics);
            return tables;
        } finally {
            span.end();
        }
    }

    /**
     * Counts contiguous chunks concurrently. Merging in chunk order reproduces
     * the first-seen order of a sequential scan.
     */
    private FrequencyTables countInParallel(List<BehaviorLog> logs, int workers, ExtractionListener listener) {
        int chunkSize = (logs.size() + workers - 1) / workers;
        List<CompletableFuture<FrequencyTables>> futures = new ArrayList<>(workers);
        for (int from = 0; from < logs.size(); from += chunkSize) {
            List<BehaviorLog> chunk = logs.subList(from, Math.min(from + chunkSize, logs.size()));
            futures.add(CompletableFuture.supplyAsync(() -> FrequencyTables.count(chunk, coercer), executor));
        }

        FrequencyTables merged = new FrequencyTables();
        try {
            for (CompletableFuture<FrequencyTables> future : futures) {
                merged.mergeFrom(future.join());
            }
        } catch (CompletionException e) {
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            IllegalStateException failure = new IllegalStateException(
                    "Parallel frequency counting failed: " + cause.getMessage(), cause);
            if (listener != null) {
                listener.onError(ExtractionListener.STAGE_COUNTING, failure);
            }
            throw failure;
        }
        return merged;
    }

    private List<ScoredRule> scoreRules(FrequencyTables tables, ExtractionListener listener) {
        Span span = tracer.spanBuilder("score-rules").startSpan();
        try (Scope scope = span.makeCurrent()) {
            long stageStart = startStage(listener, ExtractionListener.STAGE_SCORING, 2);
            double total = tables.totalRecords();
            int belowSupport = 0;
            int belowConfidence = 0;
            int belowLift = 0;

            List<ScoredRule> accepted = new ArrayList<>();
            for (Object2IntMap.Entry<RuleKey> entry : Object2IntMaps.fastIterable(tables.coOccurrences())) {
                RuleKey rule = entry.getKey();
                int coCount = entry.getIntValue();

                double support = coCount / total;
                if (support < config.minSupport()) {
                    belowSupport++;
                    continue;
                }

                int antecedentCount = tables.antecedentCount(rule.antecedent());
                double confidence = antecedentCount > 0 ? (double) coCount / antecedentCount : 0.0;
                if (confidence < config.minConfidence()) {
                    belowConfidence++;
                    continue;
                }

                double baseline = tables.actionCount(rule.action()) / total;
                double lift = baseline > 0 ? confidence / baseline : 0.0;
                if (lift < config.minLift()) {
                    belowLift++;
                    continue;
                }

                accepted.add(new ScoredRule(rule, support, confidence, lift));
            }

            span.setAttribute("acceptedRules", accepted.size());
            logger.debug("Scored {} candidate rules: {} accepted, {} below support, {} below confidence, {} below lift",
                    tables.coOccurrences().size(), accepted.size(), belowSupport, belowConfidence, belowLift);

            Map<String, Object> stageMetrics = new LinkedHashMap<>();
            stageMetrics.put("acceptedRules", accepted.size());
            stageMetrics.put("rejectedBySupport", belowSupport);
            stageMetrics.put("rejectedByConfidence", belowConfidence);
            stageMetrics.put("rejectedByLift", belowLift);
            completeStage(listener, ExtractionListener.STAGE_SCORING, stageStart, stageMetrics);
            return accepted;
        } finally {
            span.end();
        }
    }

    private List<MinedPolicy> rankPolicies(List<ScoredRule> accepted, ExtractionListener listener) {
        Span span = tracer.spanBuilder("rank-policies").startSpan();
        try (Scope scope = span.makeCurrent()) {
            long stageStart = startStage(listener, ExtractionListener.STAGE_RANKING, 3);

            List<MinedPolicy> sorted = new ArrayList<>(accepted.size());
            for (ScoredRule rule : accepted) {
                sorted.add(rule.toPolicy(UNASSIGNED_ID));
            }
            // List.sort is stable: equal confidences keep discovery order
            sorted.sort(BY_CONFIDENCE_DESC);

            List<MinedPolicy> ranked = new ArrayList<>(sorted.size());
            for (int rank = 0; rank < sorted.size(); rank++) {
                ranked.add(sorted.get(rank).withPolicyId(String.format(POLICY_ID_FORMAT, rank + 1)));
            }

            completeStage(listener, ExtractionListener.STAGE_RANKING, stageStart,
                    Map.of("policies", ranked.size()));
            return ranked;
        } finally {
            span.end();
        }
    }

    private static long startStage(ExtractionListener listener, String stage, int number) {
        if (listener != null) {
            listener.onStageStart(stage, number, ExtractionListener.TOTAL_STAGES);
        }
        return System.nanoTime();
    }

    private static void completeStage(ExtractionListener listener, String stage, long stageStart,
                                      Map<String, Object> stageMetrics) {
        if (listener != null) {
            listener.onStageComplete(stage, new ExtractionListener.StageResult(
                    stage, System.nanoTime() - stageStart, Map.copyOf(stageMetrics)));
        }
    }

    /**
     * A rule that passed every threshold, with its un-rounded scores.
     */
    private record ScoredRule(RuleKey rule, double support, double confidence, double lift) {

        MinedPolicy toPolicy(String policyId) {
            String key = rule.antecedent().key();
            String value = rule.antecedent().value();
            return new MinedPolicy(
                    policyId,
                    Map.of(key, value),
                    rule.action(),
                    PolicyDescriptions.round(support, SCORE_SCALE),
                    PolicyDescriptions.round(confidence, SCORE_SCALE),
                    PolicyDescriptions.round(lift, SCORE_SCALE),
                    PolicyDescriptions.describe(key, value, rule.action(), support, confidence, lift));
        }
    }
}
