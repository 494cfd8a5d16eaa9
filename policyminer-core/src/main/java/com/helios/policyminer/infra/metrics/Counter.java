/*
 * Copyright (c) 2025 Helios Policy Miner
 * Licensed under the Apache License, Version 2.0
 */
package com.helios.policyminer.infra.metrics;

/**
 * Running total of events, such as extraction runs or processed logs.
 * Implementations must be safe for concurrent extractions.
 */
public interface Counter {

    /**
     * Adds one.
     */
    void increment();

    /**
     * Adds {@code amount}, which must not be negative.
     */
    void increment(long amount);

    long count();
}
