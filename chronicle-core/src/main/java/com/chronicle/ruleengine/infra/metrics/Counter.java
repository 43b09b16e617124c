/*
 * Copyright (c) 2025 Chronicle Rule Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.chronicle.ruleengine.infra.metrics;

/**
 * Monotonically increasing count.
 */
public interface Counter {

    void increment();

    /**
     * @param amount non-negative increment
     */
    void increment(long amount);

    long count();
}
