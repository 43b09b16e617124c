/*
 * Copyright (c) 2025 Chronicle Rule Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.chronicle.ruleengine.infra.metrics.api;

import com.chronicle.ruleengine.infra.metrics.MetricsRegistry;

/**
 * Service provider for a {@link MetricsRegistry} backend.
 * Register implementations in {@code META-INF/services}.
 */
public interface MetricsRegistryProvider {

    MetricsRegistry create();

    /** Higher wins when several providers are on the classpath. */
    default int priority() {
        return 0;
    }

    default String name() {
        return getClass().getSimpleName();
    }
}
