/*
 * Copyright (c) 2025 Chronicle Rule Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.chronicle.ruleengine.infra.metrics.impl.inmemory;

import com.chronicle.ruleengine.infra.metrics.Counter;
import com.chronicle.ruleengine.infra.metrics.Gauge;
import com.chronicle.ruleengine.infra.metrics.MetricsRegistry;
import com.chronicle.ruleengine.infra.metrics.Timer;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Registry that keeps values in memory for assertions:
 * <pre>{@code
 * InMemoryMetricsRegistry metrics = new InMemoryMetricsRegistry();
 * CampaignRuleEngine engine = CampaignRuleEngine.builder()
 *         // stores and cache ...
 *         .metrics(new RuleEngineMetrics(metrics))
 *         .build();
 * engine.evaluateComputedFields("settlement", "s1", "main");
 * assertThat(metrics.getCounterValue(RuleEngineMetrics.CACHE_MISSES)).isEqualTo(1);
 * }</pre>
 *
 * <p>Tags are ignored: values are aggregated per metric name.
 */
public final class InMemoryMetricsRegistry implements MetricsRegistry {

    private final Map<String, InMemoryCounter> counters = new ConcurrentHashMap<>();
    private final Map<String, InMemoryGauge> gauges = new ConcurrentHashMap<>();
    private final Map<String, InMemoryTimer> timers = new ConcurrentHashMap<>();

    @Override
    public Counter counter(String name, String... tags) {
        return counters.computeIfAbsent(name, InMemoryCounter::new);
    }

    @Override
    public Gauge gauge(String name, String... tags) {
        return gauges.computeIfAbsent(name, InMemoryGauge::new);
    }

    @Override
    public Timer timer(String name, String... tags) {
        return timers.computeIfAbsent(name, InMemoryTimer::new);
    }

    public long getCounterValue(String name) {
        InMemoryCounter counter = counters.get(name);
        return counter != null ? counter.count() : 0L;
    }

    public double getGaugeValue(String name) {
        InMemoryGauge gauge = gauges.get(name);
        return gauge != null ? gauge.value() : 0.0;
    }

    public List<Duration> getTimerRecordings(String name) {
        InMemoryTimer timer = timers.get(name);
        return timer != null ? timer.getRecordings() : List.of();
    }

    public void reset() {
        counters.clear();
        gauges.clear();
        timers.clear();
    }
}
