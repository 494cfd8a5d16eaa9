/*
 * Copyright (c) 2025 Helios Policy Miner
 * Licensed under the Apache License, Version 2.0
 */
package com.helios.policyminer.infra.metrics.impl.inmemory;

import com.helios.policyminer.infra.metrics.Counter;

import java.util.concurrent.atomic.LongAdder;

final class InMemoryCounter implements Counter {

    private final String name;
    private final LongAdder total = new LongAdder();

    InMemoryCounter(String name) {
        this.name = name;
    }

    @Override
    public void increment() {
        total.increment();
    }

    @Override
    public void increment(long amount) {
        if (amount < 0) {
            throw new IllegalArgumentException(name + " only counts up, got " + amount);
        }
        total.add(amount);
    }

    @Override
    public long count() {
        return total.sum();
    }

    @Override
    public String toString() {
        return name + "=" + count();
    }
}
