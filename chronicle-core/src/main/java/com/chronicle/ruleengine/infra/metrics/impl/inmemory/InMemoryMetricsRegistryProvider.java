/*
 * Copyright (c) 2025 Chronicle Rule Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.chronicle.ruleengine.infra.metrics.impl.inmemory;

import com.chronicle.ruleengine.infra.metrics.MetricsRegistry;
import com.chronicle.ruleengine.infra.metrics.api.MetricsRegistryProvider;

/**
 * Registered from test resources so tests see recorded values through
 * {@link MetricsRegistry#getInstance()}.
 */
public final class InMemoryMetricsRegistryProvider implements MetricsRegistryProvider {

    @Override
    public MetricsRegistry create() {
        return new InMemoryMetricsRegistry();
    }

    @Override
    public int priority() {
        return 1000;
    }

    @Override
    public String name() {
        return "InMemory";
    }
}
