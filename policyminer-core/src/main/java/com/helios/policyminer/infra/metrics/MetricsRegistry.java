/*
 * Copyright (c) 2025 Helios Policy Miner
 * Licensed under the Apache License, Version 2.0
 */
package com.helios.policyminer.infra.metrics;

import com.helios.policyminer.infra.metrics.internal.MetricsRegistryHolder;

/**
 * Named counters and timers for extraction runs.
 *
 * <p>Metric names are lowercase with underscores and carry the
 * {@code policyminer_} prefix. Looking up the same name twice returns the
 * same instrument.
 *
 * <pre>{@code
 * MetricsRegistry metrics = MetricsRegistry.getInstance();
 * metrics.counter("policyminer_extractions_total").increment();
 * }</pre>
 */
public interface MetricsRegistry {

    Counter counter(String name);

    Timer timer(String name);

    /**
     * Returns the process-wide registry chosen through
     * {@link java.util.ServiceLoader}, or a no-op registry when no
     * {@link com.helios.policyminer.infra.metrics.api.MetricsRegistryProvider}
     * is on the class path.
     */
    static MetricsRegistry getInstance() {
        return MetricsRegistryHolder.INSTANCE;
    }
}
