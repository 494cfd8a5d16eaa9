/*
 * Copyright (c) 2025 Helios Policy Miner
 * Licensed under the Apache License, Version 2.0
 */
package com.helios.policyminer.infra.metrics.impl.inmemory;


import com.helios.policyminer.infra.metrics.Counter;
import com.helios.policyminer.infra.metrics.MetricsRegistry;
import com.helios.policyminer.infra.metrics.Timer;

import java.time.Duration;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.concurrent.ConcurrentHashMap;

/**
 * In-memory metrics registry.
 *
 * <p>Provides access to recorded values for run summaries and assertions:
 * <pre>{@code
 * InMemoryMetricsRegistry metrics = new InMemoryMetricsRegistry();
 * PolicyExtractor extractor = new PolicyExtractor(config, tracer, metrics);
 *
 * extractor.extract(logs);
 *
 * assertThat(metrics.getCounterValue("policyminer_extractions_total")).isEqualTo(1L);
 * }</pre>
 */
public final class InMemoryMetricsRegistry implements MetricsRegistry {

    private final Map<String, InMemoryCounter> counters = new ConcurrentHashMap<>();
    private final Map<String, InMemoryTimer> timers = new ConcurrentHashMap<>();

    @Override
    public Counter counter(String name) {
        return counters.computeIfAbsent(name, InMemoryCounter::new);
    }

    @Override
    public Timer timer(String name) {
        return timers.computeIfAbsent(name, InMemoryTimer::new);
    }

    public long getCounterValue(String name) {
        Counter counter = counters.get(name);
        return counter != null ? counter.count() : 0L;
    }

    /**
     * Returns the recorded durations of a timer in recording order.
     */
    public List<Duration> getTimerRecordings(String name) {
        InMemoryTimer timer = timers.get(name);
        return timer != null ? timer.getRecordings() : Collections.emptyList();
    }

    /**
     * Returns a name-sorted snapshot of every counter value.
     */
    public Map<String, Long> counterSnapshot() {
        Map<String, Long> snapshot = new TreeMap<>();
        counters.forEach((name, counter) -> snapshot.put(name, counter.count()));
        return snapshot;
    }

    /**
     * Returns a name-sorted snapshot of timer totals.
     */
    public Map<String, Duration> timerTotals() {
        Map<String, Duration> snapshot = new TreeMap<>();
        timers.forEach((name, timer) -> snapshot.put(name, timer.total()));
        return snapshot;
    }

    public void reset() {
        counters.clear();
        timers.clear();
    }
}
