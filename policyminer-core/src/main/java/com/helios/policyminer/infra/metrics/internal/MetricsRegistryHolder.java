/*
 * Copyright (c) 2025 Helios Policy Miner
 * Licensed under the Apache License, Version 2.0
 */
package com.helios.policyminer.infra.metrics.internal;


import com.helios.policyminer.infra.metrics.MetricsRegistry;
import com.helios.policyminer.infra.metrics.api.MetricsRegistryProvider;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Comparator;
import java.util.ServiceLoader;
import java.util.stream.StreamSupport;

/**
 * Lazy holder for singleton MetricsRegistry.
 * Uses ServiceLoader for discovery.
 *
 * <p><b>INTERNAL USE ONLY</b> - API may change without notice.
 */
public final class MetricsRegistryHolder {

    private static final Logger logger = LoggerFactory.getLogger(MetricsRegistryHolder.class);

    public static final MetricsRegistry INSTANCE = select(ServiceLoader.load(MetricsRegistryProvider.class));

    private MetricsRegistryHolder() {
        throw new AssertionError("No instances");
    }

    /**
     * Picks the highest-priority provider, or the no-op registry when none is registered.
     */
    static MetricsRegistry select(Iterable<MetricsRegistryProvider> providers) {
        MetricsRegistryProvider provider = StreamSupport.stream(providers.spliterator(), false)
                .max(Comparator.comparingInt(MetricsRegistryProvider::priority))
                .orElse(null);

        if (provider == null) {
            logger.debug("No metrics provider found, using no-op implementation");
            return new NoOpMetricsRegistry();
        }
        logger.debug("Using metrics provider: {} (priority: {})", provider.name(), provider.priority());
        return provider.create();
    }
}
