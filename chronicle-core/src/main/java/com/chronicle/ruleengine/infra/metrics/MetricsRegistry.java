/*
 * Copyright (c) 2025 Chronicle Rule Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.chronicle.ruleengine.infra.metrics;

import com.chronicle.ruleengine.infra.metrics.internal.MetricsRegistryHolder;

/**
 * Framework-agnostic metrics facade.
 *
 * <p>Tags are given as alternating key/value pairs:
 * <pre>{@code
 * registry.counter("effects_failed", "entity_type", "settlement").increment();
 * }</pre>
 *
 * <p>The process-wide instance is discovered with {@link java.util.ServiceLoader}; the provider
 * with the highest {@link com.chronicle.ruleengine.infra.metrics.api.MetricsRegistryProvider#priority()}
 * wins, and a no-op registry is used when none is registered.
 */
public interface MetricsRegistry {

    Counter counter(String name, String... tags);

    Gauge gauge(String name, String... tags);

    Timer timer(String name, String... tags);

    static MetricsRegistry getInstance() {
        return MetricsRegistryHolder.INSTANCE;
    }
}
