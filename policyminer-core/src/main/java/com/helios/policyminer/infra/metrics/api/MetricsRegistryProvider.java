/*
 * Copyright (c) 2025 Helios Policy Miner
 * Licensed under the Apache License, Version 2.0
 */
package com.helios.policyminer.infra.metrics.api;

import com.helios.policyminer.infra.metrics.MetricsRegistry;

/**
 * Service provider for {@link MetricsRegistry}. Register implementations in
 * {@code META-INF/services/com.helios.policyminer.infra.metrics.api.MetricsRegistryProvider}.
 */
public interface MetricsRegistryProvider {

    /**
     * Builds the registry. Called once per process.
     */
    MetricsRegistry create();

    /**
     * When several providers are registered the highest priority wins.
     */
    default int priority() {
        return 0;
    }

    default String name() {
        return getClass().getSimpleName();
    }
}
