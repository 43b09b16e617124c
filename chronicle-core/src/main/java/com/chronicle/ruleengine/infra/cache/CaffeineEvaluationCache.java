/*
 * Copyright (c) 2025 Chronicle Rule Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.chronicle.ruleengine.infra.cache;

import com.chronicle.ruleengine.api.spi.EvaluationCache;
import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.benmanes.caffeine.cache.Expiry;
import com.github.benmanes.caffeine.cache.Ticker;

import java.util.Iterator;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;
import java.util.logging.Level;
import java.util.logging.Logger;
import java.util.regex.Pattern;

/**
 * Process-local {@link EvaluationCache} on Caffeine. Every entry carries its own TTL.
 * All operations complete synchronously.
 */
public class CaffeineEvaluationCache implements EvaluationCache {

    private static final Logger logger = Logger.getLogger(CaffeineEvaluationCache.class.getName());

    private record Entry(byte[] value, long ttlNanos) {
    }

    private final Cache<String, Entry> cache;

    private final AtomicLong hits = new AtomicLong();
    private final AtomicLong misses = new AtomicLong();
    private final AtomicLong sets = new AtomicLong();
    private final AtomicLong deletes = new AtomicLong();
    private final AtomicLong patternDeletes = new AtomicLong();

    public CaffeineEvaluationCache(CacheConfig config) {
        this(config, Ticker.systemTicker());
    }

    /**
     * @param ticker time source, replaceable in tests to move expiry forward
     */
    public CaffeineEvaluationCache(CacheConfig config, Ticker ticker) {
        this.cache = Caffeine.newBuilder()
                .maximumSize(config.getMaxSize())
                .expireAfter(new Expiry<String, Entry>() {
                    @Override
                    public long expireAfterCreate(String key, Entry entry, long currentTime) {
                        return entry.ttlNanos();
                    }

                    @Override
                    public long expireAfterUpdate(String key, Entry entry, long currentTime, long currentDuration) {
                        return entry.ttlNanos();
                    }

                    @Override
                    public long expireAfterRead(String key, Entry entry, long currentTime, long currentDuration) {
                        return currentDuration;
                    }
                })
                .ticker(ticker)
                .build();

        logger.info(String.format("CaffeineEvaluationCache initialized: maxSize=%d", config.getMaxSize()));
    }

    @Override
    public CompletableFuture<Optional<byte[]>> get(String key) {
        Entry entry = cache.getIfPresent(key);
        if (entry == null) {
            misses.incrementAndGet();
            return CompletableFuture.completedFuture(Optional.empty());
        }
        hits.incrementAndGet();
        return CompletableFuture.completedFuture(Optional.of(entry.value()));
    }

    @Override
    public CompletableFuture<Void> set(String key, byte[] value, long ttl, TimeUnit timeUnit) {
        cache.put(key, new Entry(value, timeUnit.toNanos(ttl)));
        sets.incrementAndGet();
        return CompletableFuture.completedFuture(null);
    }

    @Override
    public CompletableFuture<Long> delete(String key) {
        long removed = cache.asMap().remove(key) != null ? 1 : 0;
        deletes.addAndGet(removed);
        return CompletableFuture.completedFuture(removed);
    }

    @Override
    public CompletableFuture<Long> deletePattern(String pattern) {
        Pattern regex = Pattern.compile(CacheKeys.globToRegex(pattern));
        long removed = 0;
        Iterator<String> keys = cache.asMap().keySet().iterator();
        while (keys.hasNext()) {
            if (regex.matcher(keys.next()).matches()) {
                keys.remove();
                removed++;
            }
        }
        patternDeletes.incrementAndGet();
        if (logger.isLoggable(Level.FINE)) {
            logger.fine(String.format("Pattern delete '%s' removed %d entries", pattern, removed));
        }
        return CompletableFuture.completedFuture(removed);
    }

    @Override
    public CacheMetrics getMetrics() {
        return new CacheMetrics(hits.get(), misses.get(), sets.get(), deletes.get(), patternDeletes.get(),
                0L, cache.estimatedSize());
    }

    /** Runs pending expiry and eviction work. */
    public void cleanup() {
        cache.cleanUp();
    }
}
