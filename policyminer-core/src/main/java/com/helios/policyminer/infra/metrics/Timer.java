/*
 * Copyright (c) 2025 Helios Policy Miner
 * Licensed under the Apache License, Version 2.0
 */
package com.helios.policyminer.infra.metrics;

import java.time.Duration;

/**
 * Distribution of measured durations, e.g. extraction latency per run.
 * Implementations must be safe for concurrent extractions.
 */
public interface Timer {

    void record(Duration duration);

    /**
     * Number of recorded durations.
     */
    long count();

    /**
     * Sum of all recorded durations.
     */
    Duration total();

    /**
     * @param percentile value between 0.0 and 1.0
     * @return duration at percentile, {@link Duration#ZERO} when nothing was recorded
     */
    Duration percentile(double percentile);
}
