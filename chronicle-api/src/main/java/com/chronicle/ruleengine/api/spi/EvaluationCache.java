/*
 * Copyright (c) 2025 Chronicle Rule Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.chronicle.ruleengine.api.spi;

import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;

/**
 * Key-value cache with glob-pattern deletion, holding serialized evaluation results.
 *
 * <p>The API is async-first so distributed implementations never block the caller's thread.
 * Implementations report I/O failures by completing the future exceptionally; callers decide
 * whether a failure is a miss or a no-op.
 *
 * <p>Patterns use Redis glob syntax: {@code *} matches any run of characters, {@code ?} one character.
 */
public interface EvaluationCache {

    CompletableFuture<Optional<byte[]>> get(String key);

    CompletableFuture<Void> set(String key, byte[] value, long ttl, TimeUnit timeUnit);

    /**
     * @return number of entries removed (0 or 1)
     */
    CompletableFuture<Long> delete(String key);

    /**
     * @return number of entries removed
     */
    CompletableFuture<Long> deletePattern(String pattern);

    CacheMetrics getMetrics();

    /**
     * Counters for monitoring; all values are since construction.
     */
    record CacheMetrics(
            long hits,
            long misses,
            long sets,
            long deletes,
            long patternDeletes,
            long errors,
            long currentSize
    ) {
        public double hitRate() {
            long total = hits + misses;
            return total == 0 ? 0.0 : (double) hits / total;
        }

        public String format() {
            return String.format(
                    "Cache Metrics: hits=%d (%.1f%%), misses=%d, sets=%d, deletes=%d, patternDeletes=%d, errors=%d, size=%d",
                    hits, hitRate() * 100, misses, sets, deletes, patternDeletes, errors, currentSize
            );
        }
    }
}
