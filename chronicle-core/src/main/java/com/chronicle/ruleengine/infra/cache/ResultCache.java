/*
 * Copyright (c) 2025 Chronicle Rule Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.chronicle.ruleengine.infra.cache;

import com.chronicle.ruleengine.api.spi.EvaluationCache;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.io.IOException;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Typed, blocking view over an {@link EvaluationCache}.
 *
 * <p>Values are JSON encoded with Jackson. Every call waits at most {@code timeout}; a failed,
 * timed out or undecodable read is reported as a miss and a failed write or delete as a no-op.
 * Nothing thrown by the cache reaches the caller.
 */
public class ResultCache {

    private static final Logger logger = Logger.getLogger(ResultCache.class.getName());

    private static final TypeReference<Map<String, JsonNode>> FIELDS_TYPE = new TypeReference<>() {
    };

    private final EvaluationCache cache;
    private final ObjectMapper mapper;
    private final Duration timeout;
    private final Duration defaultTtl;

    public ResultCache(EvaluationCache cache, ObjectMapper mapper, Duration timeout, Duration defaultTtl) {
        this.cache = cache;
        this.mapper = mapper;
        this.timeout = timeout;
        this.defaultTtl = defaultTtl;
    }

    public Optional<Map<String, JsonNode>> getComputedFields(String key) {
        return read(key).flatMap(bytes -> decode(key, bytes, FIELDS_TYPE));
    }

    public void putComputedFields(String key, Map<String, JsonNode> fields) {
        write(key, fields);
    }

    public Optional<JsonNode> getValue(String key) {
        return read(key).flatMap(bytes -> decodeTree(key, bytes));
    }

    public void putValue(String key, JsonNode value) {
        write(key, value);
    }

    /**
     * @return number of removed entries, 0 when the cache failed
     */
    public long delete(String key) {
        return await("delete " + key, cache.delete(key)).orElse(0L);
    }

    public long deletePattern(String pattern) {
        return await("deletePattern " + pattern, cache.deletePattern(pattern)).orElse(0L);
    }

    /** Deletes each key; returns how many were present. */
    public long deleteAll(List<String> keys) {
        long removed = 0;
        for (String key : keys) {
            removed += delete(key);
        }
        return removed;
    }

    public Duration getDefaultTtl() {
        return defaultTtl;
    }

    public EvaluationCache.CacheMetrics getMetrics() {
        return cache.getMetrics();
    }

    // ========================================================================
    // INTERNALS
    // ========================================================================

    private Optional<byte[]> read(String key) {
        return await("get " + key, cache.get(key)).flatMap(v -> v);
    }

    private void write(String key, Object value) {
        byte[] bytes;
        try {
            bytes = mapper.writeValueAsBytes(value);
        } catch (IOException e) {
            logger.log(Level.WARNING, "Could not encode cache value for " + key, e);
            return;
        }
        await("set " + key, cache.set(key, bytes, defaultTtl.toMillis(), TimeUnit.MILLISECONDS));
    }

    private <T> Optional<T> decode(String key, byte[] bytes, TypeReference<T> type) {
        try {
            return Optional.of(mapper.readValue(bytes, type));
        } catch (IOException e) {
            logger.log(Level.WARNING, "Discarding undecodable cache entry " + key, e);
            return Optional.empty();
        }
    }

    private Optional<JsonNode> decodeTree(String key, byte[] bytes) {
        try {
            return Optional.of(mapper.readTree(bytes));
        } catch (IOException e) {
            logger.log(Level.WARNING, "Discarding undecodable cache entry " + key, e);
            return Optional.empty();
        }
    }

    private <T> Optional<T> await(String operation, CompletableFuture<T> future) {
        try {
            return Optional.ofNullable(future.get(timeout.toMillis(), TimeUnit.MILLISECONDS));
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            logger.warning(String.format("Cache %s interrupted", operation));
        } catch (TimeoutException e) {
            future.cancel(true);
            logger.warning(String.format("Cache %s timed out after %d ms", operation, timeout.toMillis()));
        } catch (ExecutionException e) {
            logger.log(Level.WARNING, String.format("Cache %s failed", operation), e.getCause());
        }
        return Optional.empty();
    }
}
