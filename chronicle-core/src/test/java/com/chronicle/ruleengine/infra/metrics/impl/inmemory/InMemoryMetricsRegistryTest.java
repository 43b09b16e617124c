/*
 * Copyright (c) 2025 Chronicle Rule Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.chronicle.ruleengine.infra.metrics.impl.inmemory;

import com.chronicle.ruleengine.infra.metrics.MetricsRegistry;
import com.chronicle.ruleengine.infra.metrics.RuleEngineMetrics;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;

class InMemoryMetricsRegistryTest {

    @Test
    @DisplayName("Test classpath registers the in-memory provider with the highest priority")
    void discoveredThroughServiceLoader() {
        assertThat(MetricsRegistry.getInstance()).isInstanceOf(InMemoryMetricsRegistry.class);
    }

    @Test
    @DisplayName("Engine metrics aggregate per name, ignoring tags")
    void engineMetrics() {
        InMemoryMetricsRegistry registry = new InMemoryMetricsRegistry();
        RuleEngineMetrics metrics = new RuleEngineMetrics(registry);

        metrics.cacheHit();
        metrics.cacheMiss();
        metrics.cacheMiss();
        metrics.exactDeletes(3);
        metrics.effectSucceeded("settlement");
        metrics.effectSucceeded("structure");
        metrics.graphNodes("c1", "main", 42);
        metrics.evaluationTime(Duration.ofMillis(5));

        assertThat(registry.getCounterValue(RuleEngineMetrics.CACHE_HITS)).isEqualTo(1);
        assertThat(registry.getCounterValue(RuleEngineMetrics.CACHE_MISSES)).isEqualTo(2);
        assertThat(registry.getCounterValue(RuleEngineMetrics.EXACT_DELETES)).isEqualTo(3);
        assertThat(registry.getCounterValue(RuleEngineMetrics.EFFECTS_SUCCEEDED)).isEqualTo(2);
        assertThat(registry.getGaugeValue(RuleEngineMetrics.GRAPH_NODES)).isEqualTo(42.0);
        assertThat(registry.getTimerRecordings(RuleEngineMetrics.EVALUATION_TIMER)).containsExactly(Duration.ofMillis(5));

        registry.reset();
        assertThat(registry.getCounterValue(RuleEngineMetrics.CACHE_HITS)).isZero();
    }
}
