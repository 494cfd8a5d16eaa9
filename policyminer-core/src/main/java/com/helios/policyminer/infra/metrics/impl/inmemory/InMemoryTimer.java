/*
 * Copyright (c) 2025 Helios Policy Miner
 * Licensed under the Apache License, Version 2.0
 */
package com.helios.policyminer.infra.metrics.impl.inmemory;

import com.helios.policyminer.infra.metrics.Timer;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Keeps every recorded duration. Extraction runs are few per process, so the
 * list stays small.
 */
final class InMemoryTimer implements Timer {

    private final String name;
    private final List<Duration> recordings = new CopyOnWriteArrayList<>();

    InMemoryTimer(String name) {
        this.name = name;
    }

    @Override
    public void record(Duration duration) {
        if (duration.isNegative()) {
            throw new IllegalArgumentException("Cannot record negative duration: " + duration);
        }
        recordings.add(duration);
    }

    @Override
    public long count() {
        return recordings.size();
    }

    @Override
    public Duration total() {
        Duration total = Duration.ZERO;
        for (Duration recording : recordings) {
            total = total.plus(recording);
        }
        return total;
    }

    @Override
    public Duration percentile(double percentile) {
        if (recordings.isEmpty()) {
            return Duration.ZERO;
        }

        double p = Math.max(0.0, Math.min(1.0, percentile));

        List<Duration> sorted = new ArrayList<>(recordings);
        Collections.sort(sorted);

        double index = (sorted.size() - 1) * p;
        int lowerIndex = (int) Math.floor(index);
        int upperIndex = (int) Math.ceil(index);

        if (lowerIndex == upperIndex) {
            return sorted.get(lowerIndex);
        }

        Duration lower = sorted.get(lowerIndex);
        Duration upper = sorted.get(upperIndex);
        double fraction = index - lowerIndex;

        long interpolatedNanos = lower.toNanos() +
                (long) ((upper.toNanos() - lower.toNanos()) * fraction);

        return Duration.ofNanos(interpolatedNanos);
    }

    List<Duration> getRecordings() {
        return Collections.unmodifiableList(new ArrayList<>(recordings));
    }

    @Override
    public String toString() {
        return name + "{count=" + count() + ", total=" + total().toMillis() + "ms}";
    }
}
