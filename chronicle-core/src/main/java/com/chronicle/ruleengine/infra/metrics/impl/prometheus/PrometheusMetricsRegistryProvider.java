/*
 * Copyright (c) 2025 Chronicle Rule Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.chronicle.ruleengine.infra.metrics.impl.prometheus;

import com.chronicle.ruleengine.infra.metrics.MetricsRegistry;
import com.chronicle.ruleengine.infra.metrics.api.MetricsRegistryProvider;

/**
 * Production provider, registered in {@code META-INF/services}.
 */
public final class PrometheusMetricsRegistryProvider implements MetricsRegistryProvider {

    @Override
    public MetricsRegistry create() {
        return new PrometheusMetricsRegistry();
    }

    @Override
    public int priority() {
        return 100;
    }

    @Override
    public String name() {
        return "Prometheus";
    }
}
