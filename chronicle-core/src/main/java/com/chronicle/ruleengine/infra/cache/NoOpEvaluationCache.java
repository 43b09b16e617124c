/*
 * Copyright (c) 2025 Chronicle Rule Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.chronicle.ruleengine.infra.cache;

import com.chronicle.ruleengine.api.spi.EvaluationCache;

import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;
import java.util.logging.Logger;

/**
 * Stores nothing. Every read is a miss, so every evaluation recomputes.
 */
public class NoOpEvaluationCache implements EvaluationCache {

    private static final Logger logger = Logger.getLogger(NoOpEvaluationCache.class.getName());

    private static final CompletableFuture<Optional<byte[]>> EMPTY = CompletableFuture.completedFuture(Optional.empty());
    private static final CompletableFuture<Void> DONE = CompletableFuture.completedFuture(null);
    private static final CompletableFuture<Long> NOTHING_REMOVED = CompletableFuture.completedFuture(0L);

    private final AtomicLong misses = new AtomicLong();
    private final AtomicLong sets = new AtomicLong();

    public NoOpEvaluationCache() {
        logger.info("NoOpEvaluationCache initialized, caching is disabled");
    }

    @Override
    public CompletableFuture<Optional<byte[]>> get(String key) {
        misses.incrementAndGet();
        return EMPTY;
    }

    @Override
    public CompletableFuture<Void> set(String key, byte[] value, long ttl, TimeUnit timeUnit) {
        sets.incrementAndGet();
        return DONE;
    }

    @Override
    public CompletableFuture<Long> delete(String key) {
        return NOTHING_REMOVED;
    }

    @Override
    public CompletableFuture<Long> deletePattern(String pattern) {
        return NOTHING_REMOVED;
    }

    @Override
    public CacheMetrics getMetrics() {
        return new CacheMetrics(0L, misses.get(), sets.get(), 0L, 0L, 0L, 0L);
    }
}
