/*
 * Copyright (c) 2025 Chronicle Rule Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.chronicle.ruleengine.infra.metrics;

import java.time.Duration;

/**
 * Named engine metrics on top of a {@link MetricsRegistry}.
 */
public final class RuleEngineMetrics {

    public static final String CACHE_HITS = "computed_fields_cache_hits";
    public static final String CACHE_MISSES = "computed_fields_cache_misses";
    public static final String EXACT_DELETES = "invalidation_exact_deletes";
    public static final String PATTERN_DELETES = "invalidation_pattern_deletes";
    public static final String EFFECTS_SUCCEEDED = "effects_succeeded";
    public static final String EFFECTS_FAILED = "effects_failed";
    public static final String EVALUATION_TIMER = "computed_fields_evaluation";
    public static final String GRAPH_NODES = "dependency_graph_nodes";

    private final MetricsRegistry registry;

    public RuleEngineMetrics(MetricsRegistry registry) {
        this.registry = registry;
    }

    public RuleEngineMetrics() {
        this(MetricsRegistry.getInstance());
    }

    public MetricsRegistry getRegistry() {
        return registry;
    }

    public void cacheHit() {
        registry.counter(CACHE_HITS).increment();
    }

    public void cacheMiss() {
        registry.counter(CACHE_MISSES).increment();
    }

    public void exactDeletes(int keys) {
        if (keys > 0) {
            registry.counter(EXACT_DELETES).increment(keys);
        }
    }

    public void patternDeletes(int patterns) {
        if (patterns > 0) {
            registry.counter(PATTERN_DELETES).increment(patterns);
        }
    }

    public void effectSucceeded(String entityType) {
        registry.counter(EFFECTS_SUCCEEDED, "entity_type", entityType).increment();
    }

    public void effectFailed(String entityType) {
        registry.counter(EFFECTS_FAILED, "entity_type", entityType).increment();
    }

    public void evaluationTime(Duration elapsed) {
        registry.timer(EVALUATION_TIMER).record(elapsed);
    }

    public void graphNodes(String campaignId, String branchId, int nodes) {
        registry.gauge(GRAPH_NODES, "campaign", campaignId, "branch", branchId).set(nodes);
    }
}
