/*
 * Copyright (c) 2025 Chronicle Rule Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.chronicle.ruleengine.infra.cache;

import com.chronicle.ruleengine.api.exceptions.StoreUnavailableException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.redisson.api.RBucket;
import org.redisson.api.RKeys;
import org.redisson.api.RedissonClient;
import org.redisson.client.codec.ByteArrayCodec;

import java.util.Optional;
import java.util.concurrent.CompletionException;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class RedisEvaluationCacheTest {

    @Mock
    private RedissonClient redissonClient;

    @Mock
    private RBucket<byte[]> bucket;

    @Mock
    private RKeys keys;

    private RedisEvaluationCache cache;

    @BeforeEach
    void setUp() {
        cache = new RedisEvaluationCache(redissonClient, Runnable::run);
    }

    @Test
    @DisplayName("Should write bytes with the entry TTL")
    void shouldSetWithTtl() {
        when(redissonClient.<byte[]>getBucket(anyString(), eq(ByteArrayCodec.INSTANCE))).thenReturn(bucket);
        byte[] value = {1, 2, 3};

        cache.set("derived-variable:v1:main", value, 30, TimeUnit.SECONDS).join();

        verify(bucket).set(value, 30, TimeUnit.SECONDS);
        assertThat(cache.getMetrics().sets()).isEqualTo(1);
    }

    @Test
    @DisplayName("Should return stored bytes and count misses")
    void shouldGet() {
        when(redissonClient.<byte[]>getBucket(anyString(), eq(ByteArrayCodec.INSTANCE))).thenReturn(bucket);
        when(bucket.get()).thenReturn(new byte[]{42}, (byte[]) null);

        Optional<byte[]> first = cache.get("k").join();
        Optional<byte[]> second = cache.get("k").join();

        assertThat(first).hasValueSatisfying(bytes -> assertThat(bytes).containsExactly(42));
        assertThat(second).isEmpty();
        assertThat(cache.getMetrics().hits()).isEqualTo(1);
        assertThat(cache.getMetrics().misses()).isEqualTo(1);
    }

    @Test
    @DisplayName("Delete and pattern delete go through RKeys")
    void shouldDeleteThroughKeys() {
        when(redissonClient.getKeys()).thenReturn(keys);
        when(keys.delete("computed-fields:settlement:s1:main")).thenReturn(1L);
        when(keys.deleteByPattern("computed-fields:settlement:*:main")).thenReturn(7L);

        assertThat(cache.delete("computed-fields:settlement:s1:main").join()).isEqualTo(1L);
        assertThat(cache.deletePattern("computed-fields:settlement:*:main").join()).isEqualTo(7L);
        assertThat(cache.getMetrics().patternDeletes()).isEqualTo(1);
    }

    @Test
    @DisplayName("Redis failures complete the future with StoreUnavailableException")
    void shouldWrapFailures() {
        when(redissonClient.getKeys()).thenThrow(new IllegalStateException("connection refused"));

        assertThatThrownBy(() -> cache.delete("k").join())
                .isInstanceOf(CompletionException.class)
                .hasCauseInstanceOf(StoreUnavailableException.class);
        assertThat(cache.getMetrics().errors()).isEqualTo(1);
    }

    @Test
    @DisplayName("A caller-managed client is not shut down on close")
    void shouldNotShutdownForeignClient() {
        cache.close();

        verifyNoInteractions(redissonClient);
    }
}
