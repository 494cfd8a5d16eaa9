/*
 * Copyright (c) 2025 Helios Policy Miner
 * Licensed under the Apache License, Version 2.0
 */
package com.helios.policyminer.infra.metrics.internal;

import com.helios.policyminer.infra.metrics.MetricsRegistry;
import com.helios.policyminer.infra.metrics.api.MetricsRegistryProvider;
import com.helios.policyminer.infra.metrics.impl.inmemory.InMemoryMetricsRegistry;
import com.helios.policyminer.infra.metrics.impl.inmemory.InMemoryMetricsRegistryProvider;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class MetricsRegistryHolderTest {

    @Test
    void shouldFallBackToNoOpWithoutProviders() {
        MetricsRegistry registry = MetricsRegistryHolder.select(List.of());

        assertThat(registry).isInstanceOf(NoOpMetricsRegistry.class);
        registry.counter("anything").increment(3);
        assertThat(registry.counter("anything").count()).isZero();
    }

    @Test
    void shouldPickHighestPriorityProvider() {
        MetricsRegistry fromLowPriority = new InMemoryMetricsRegistry();
        MetricsRegistryProvider lowPriority = new MetricsRegistryProvider() {
            @Override
            public MetricsRegistry create() {
                return fromLowPriority;
            }

            @Override
            public int priority() {
                return 1;
            }

            @Override
            public String name() {
                return "Low";
            }
        };

        MetricsRegistry selected = MetricsRegistryHolder.select(
                List.of(lowPriority, new InMemoryMetricsRegistryProvider()));

        assertThat(selected).isInstanceOf(InMemoryMetricsRegistry.class).isNotSameAs(fromLowPriority);
    }
}
