/*
 * Copyright (c) 2025 Chronicle Rule Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.chronicle.ruleengine.infra.cache;

import com.chronicle.ruleengine.api.exceptions.StoreUnavailableException;
import com.chronicle.ruleengine.api.spi.EvaluationCache;
import org.redisson.Redisson;
import org.redisson.api.RBucket;
import org.redisson.api.RedissonClient;
import org.redisson.client.codec.ByteArrayCodec;

import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.Executor;
import java.util.concurrent.ForkJoinPool;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.Supplier;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Shared {@link EvaluationCache} on Redis through Redisson.
 *
 * <p>Each engine key is its own Redis string with a native TTL ({@code SET key value PX ttl}), so
 * glob deletion maps directly onto {@code SCAN MATCH} + {@code DEL} via
 * {@link org.redisson.api.RKeys#deleteByPattern(String)}. Redis calls run on {@code executor};
 * failures complete the future with {@link StoreUnavailableException}.
 */
public class RedisEvaluationCache implements EvaluationCache, AutoCloseable {

    private static final Logger logger = Logger.getLogger(RedisEvaluationCache.class.getName());

    private final RedissonClient redisson;
    private final Executor executor;
    private final boolean ownsClient;

    private final AtomicLong hits = new AtomicLong();
    private final AtomicLong misses = new AtomicLong();
    private final AtomicLong sets = new AtomicLong();
    private final AtomicLong deletes = new AtomicLong();
    private final AtomicLong patternDeletes = new AtomicLong();
    private final AtomicLong errors = new AtomicLong();

    /**
     * Connects a new client from {@code config}; {@link #close()} shuts it down.
     */
    public RedisEvaluationCache(CacheConfig config) {
        this(Redisson.create(config.toRedissonConfig()), ForkJoinPool.commonPool(), true);
        logger.info(String.format("RedisEvaluationCache connected: address=%s, poolSize=%d, cluster=%s",
                config.getRedisAddress(), config.getRedisConnectionPoolSize(), config.isRedisUseCluster()));
    }

    /**
     * Uses a client managed by the caller.
     */
    public RedisEvaluationCache(RedissonClient redisson, Executor executor) {
        this(redisson, executor, false);
    }

    private RedisEvaluationCache(RedissonClient redisson, Executor executor, boolean ownsClient) {
        this.redisson = redisson;
        this.executor = executor;
        this.ownsClient = ownsClient;
    }

    @Override
    public CompletableFuture<Optional<byte[]>> get(String key) {
        return call("get " + key, () -> {
            byte[] value = bucket(key).get();
            if (value == null) {
                misses.incrementAndGet();
                return Optional.<byte[]>empty();
            }
            hits.incrementAndGet();
            return Optional.of(value);
        });
    }

    @Override
    public CompletableFuture<Void> set(String key, byte[] value, long ttl, TimeUnit timeUnit) {
        return call("set " + key, () -> {
            bucket(key).set(value, ttl, timeUnit);
            sets.incrementAndGet();
            if (logger.isLoggable(Level.FINE)) {
                logger.fine(String.format("Cached %s: %d bytes, ttl=%d %s", key, value.length, ttl, timeUnit));
            }
            return null;
        });
    }

    @Override
    public CompletableFuture<Long> delete(String key) {
        return call("delete " + key, () -> {
            long removed = redisson.getKeys().delete(key);
            deletes.addAndGet(removed);
            return removed;
        });
    }

    @Override
    public CompletableFuture<Long> deletePattern(String pattern) {
        return call("deletePattern " + pattern, () -> {
            long removed = redisson.getKeys().deleteByPattern(pattern);
            patternDeletes.incrementAndGet();
            return removed;
        });
    }

    @Override
    public CacheMetrics getMetrics() {
        return new CacheMetrics(hits.get(), misses.get(), sets.get(), deletes.get(), patternDeletes.get(),
                errors.get(), -1L);
    }

    @Override
    public void close() {
        if (ownsClient) {
            redisson.shutdown();
        }
    }

    private RBucket<byte[]> bucket(String key) {
        return redisson.getBucket(key, ByteArrayCodec.INSTANCE);
    }

    private <T> CompletableFuture<T> call(String operation, Supplier<T> body) {
        return CompletableFuture.supplyAsync(() -> {
            try {
                return body.get();
            } catch (RuntimeException e) {
                errors.incrementAndGet();
                throw new CompletionException(new StoreUnavailableException("Redis " + operation + " failed", e));
            }
        }, executor);
    }
}
