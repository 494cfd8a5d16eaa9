/*
 * Copyright (c) 2025 Helios Policy Miner
 * Licensed under the Apache License, Version 2.0
 */
package com.helios.policyminer.infra.metrics.impl.inmemory;

import com.helios.policyminer.infra.metrics.MetricsRegistry;
import com.helios.policyminer.infra.metrics.api.MetricsRegistryProvider;

/**
 * Provides {@link InMemoryMetricsRegistry}; the command line registers it so a
 * run can log its own counters.
 */
public final class InMemoryMetricsRegistryProvider implements MetricsRegistryProvider {

    @Override
    public MetricsRegistry create() {
        return new InMemoryMetricsRegistry();
    }

    @Override
    public int priority() {
        return 100;
    }

    @Override
    public String name() {
        return "in-memory";
    }
}
