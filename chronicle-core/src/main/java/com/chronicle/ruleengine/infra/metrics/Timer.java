/*
 * Copyright (c) 2025 Chronicle Rule Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.chronicle.ruleengine.infra.metrics;

import java.time.Duration;
import java.util.concurrent.Callable;

/**
 * Latency recorder.
 */
public interface Timer {

    /**
     * Runs {@code callable} and records its duration, also when it throws.
     */
    <T> T record(Callable<T> callable) throws Exception;

    void record(Duration duration);

    /**
     * Client-side percentile in {@code [0, 1]}. Not every backend supports it.
     *
     * @throws UnsupportedOperationException when the backend aggregates server-side
     */
    Duration percentile(double percentile);
}
