/*
 * Copyright (c) 2025 Helios Policy Miner
 * Licensed under the Apache License, Version 2.0
 */
package com.helios.policyminer.infra.metrics.internal;

import com.helios.policyminer.infra.metrics.Counter;
import com.helios.policyminer.infra.metrics.MetricsRegistry;
import com.helios.policyminer.infra.metrics.Timer;

import java.time.Duration;

/**
 * Used when no provider is registered; every instrument discards its input.
 */
final class NoOpMetricsRegistry implements MetricsRegistry {

    static final Counter DISCARDING_COUNTER = new Counter() {
        @Override
        public void increment() {
        }

        @Override
        public void increment(long amount) {
        }

        @Override
        public long count() {
            return 0L;
        }
    };

    static final Timer DISCARDING_TIMER = new Timer() {
        @Override
        public void record(Duration duration) {
        }

        @Override
        public long count() {
            return 0L;
        }

        @Override
        public Duration total() {
            return Duration.ZERO;
        }

        @Override
        public Duration percentile(double percentile) {
            return Duration.ZERO;
        }
    };

    @Override
    public Counter counter(String name) {
        return DISCARDING_COUNTER;
    }

    @Override
    public Timer timer(String name) {
        return DISCARDING_TIMER;
    }
}
