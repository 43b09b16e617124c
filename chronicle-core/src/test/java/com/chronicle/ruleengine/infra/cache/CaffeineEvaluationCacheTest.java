/*
 * Copyright (c) 2025 Chronicle Rule Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.chronicle.ruleengine.infra.cache;

import com.chronicle.ruleengine.api.spi.EvaluationCache;
import com.github.benmanes.caffeine.cache.Ticker;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.util.Optional;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;

import static org.assertj.core.api.Assertions.assertThat;

class CaffeineEvaluationCacheTest {

    private final AtomicLong nanos = new AtomicLong();
    private CaffeineEvaluationCache cache;

    @BeforeEach
    void setUp() {
        Ticker ticker = nanos::get;
        cache = new CaffeineEvaluationCache(CacheConfig.builder().maxSize(100).build(), ticker);
    }

    @Test
    @DisplayName("Should store and return values")
    void shouldStoreAndGet() {
        cache.set("computed-fields:settlement:s1:main", bytes("{}"), 5, TimeUnit.MINUTES).join();

        Optional<byte[]> value = cache.get("computed-fields:settlement:s1:main").join();

        assertThat(value).isPresent();
        assertThat(new String(value.get(), StandardCharsets.UTF_8)).isEqualTo("{}");
        assertThat(cache.get("missing").join()).isEmpty();

        EvaluationCache.CacheMetrics metrics = cache.getMetrics();
        assertThat(metrics.hits()).isEqualTo(1);
        assertThat(metrics.misses()).isEqualTo(1);
        assertThat(metrics.sets()).isEqualTo(1);
        assertThat(metrics.hitRate()).isEqualTo(0.5);
    }

    @Test
    @DisplayName("Entries expire after their own TTL")
    void shouldExpirePerEntry() {
        cache.set("short", bytes("1"), 1, TimeUnit.SECONDS).join();
        cache.set("long", bytes("2"), 1, TimeUnit.MINUTES).join();

        nanos.addAndGet(TimeUnit.SECONDS.toNanos(2));

        assertThat(cache.get("short").join()).isEmpty();
        assertThat(cache.get("long").join()).isPresent();
    }

    @Test
    @DisplayName("Delete reports whether the key existed")
    void shouldDelete() {
        cache.set("k", bytes("1"), 1, TimeUnit.MINUTES).join();

        assertThat(cache.delete("k").join()).isEqualTo(1L);
        assertThat(cache.delete("k").join()).isZero();
        assertThat(cache.get("k").join()).isEmpty();
    }

    @Test
    @DisplayName("Pattern delete removes only matching keys")
    void shouldDeleteByPattern() {
        cache.set("computed-fields:settlement:s1:main", bytes("1"), 1, TimeUnit.MINUTES).join();
        cache.set("computed-fields:settlement:s2:main", bytes("2"), 1, TimeUnit.MINUTES).join();
        cache.set("computed-fields:settlement:s1:feature", bytes("3"), 1, TimeUnit.MINUTES).join();
        cache.set("computed-fields:structure:t1:main", bytes("4"), 1, TimeUnit.MINUTES).join();

        long removed = cache.deletePattern(CacheKeys.computedFieldsPattern("settlement", "main")).join();

        assertThat(removed).isEqualTo(2);
        assertThat(cache.get("computed-fields:settlement:s1:feature").join()).isPresent();
        assertThat(cache.get("computed-fields:structure:t1:main").join()).isPresent();
        assertThat(cache.getMetrics().patternDeletes()).isEqualTo(1);
    }

    private static byte[] bytes(String text) {
        return text.getBytes(StandardCharsets.UTF_8);
    }
}
