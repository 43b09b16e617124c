/*
 * Copyright (c) 2025 Chronicle Rule Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.chronicle.ruleengine.infra.metrics.impl.inmemory;

import com.chronicle.ruleengine.infra.metrics.Counter;

import java.util.concurrent.atomic.AtomicLong;

final class InMemoryCounter implements Counter {

    private final String name;
    private final AtomicLong value = new AtomicLong();

    InMemoryCounter(String name) {
        this.name = name;
    }

    @Override
    public void increment() {
        value.incrementAndGet();
    }

    @Override
    public void increment(long amount) {
        if (amount < 0) {
            throw new IllegalArgumentException("Counter increment cannot be negative: " + amount);
        }
        value.addAndGet(amount);
    }

    @Override
    public long count() {
        return value.get();
    }

    void reset() {
        value.set(0);
    }

    @Override
    public String toString() {
        return String.format("InMemoryCounter{name='%s', count=%d}", name, value.get());
    }
}
