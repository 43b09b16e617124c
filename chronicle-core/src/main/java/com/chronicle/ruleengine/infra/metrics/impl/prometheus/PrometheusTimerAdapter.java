/*
 * Copyright (c) 2025 Chronicle Rule Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.chronicle.ruleengine.infra.metrics.impl.prometheus;

import com.chronicle.ruleengine.infra.metrics.Timer;

import java.time.Duration;
import java.util.concurrent.Callable;

/**
 * {@link Timer} backed by a Prometheus histogram, observed in seconds.
 *
 * <p>Percentiles are computed server-side with {@code histogram_quantile()}, so
 * {@link #percentile(double)} is unsupported.
 */
final class PrometheusTimerAdapter implements Timer {

    private final io.prometheus.client.Histogram.Child histogram;

    PrometheusTimerAdapter(io.prometheus.client.Histogram histogram, String[] labelValues) {
        if (labelValues == null) {
            throw new IllegalArgumentException("Label values cannot be null");
        }
        this.histogram = histogram.labels(labelValues);
    }

    @Override
    public <T> T record(Callable<T> callable) throws Exception {
        if (callable == null) {
            throw new IllegalArgumentException("Callable cannot be null");
        }
        io.prometheus.client.Histogram.Timer timer = histogram.startTimer();
        try {
            return callable.call();
        } finally {
            timer.observeDuration();
        }
    }

    @Override
    public void record(Duration duration) {
        if (duration == null) {
            throw new IllegalArgumentException("Duration cannot be null");
        }
        if (duration.isNegative()) {
            throw new IllegalArgumentException("Duration cannot be negative: " + duration);
        }
        histogram.observe(duration.toNanos() / 1_000_000_000.0);
    }

    @Override
    public Duration percentile(double percentile) {
        throw new UnsupportedOperationException(String.format(
                "Percentiles are computed by the Prometheus server: histogram_quantile(%.2f, rate(<metric>_bucket[5m]))",
                percentile));
    }

    /** Number of observations, the {@code _count} series. */
    long count() {
        return (long) histogram.get().buckets[histogram.get().buckets.length - 1];
    }

    /** Sum of observed seconds, the {@code _sum} series. */
    double sumSeconds() {
        return histogram.get().sum;
    }
}
