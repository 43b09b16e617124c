/*
 * Copyright (c) 2025 Chronicle Rule Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.chronicle.ruleengine.infra.cache;

import com.chronicle.ruleengine.api.exceptions.StoreUnavailableException;
import com.chronicle.ruleengine.api.spi.EvaluationCache;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.BooleanNode;
import com.fasterxml.jackson.databind.node.IntNode;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class ResultCacheTest {

    private static final ObjectMapper MAPPER = new ObjectMapper();

    @Nested
    @DisplayName("Against a working cache")
    class Working {

        private final ResultCache cache = new ResultCache(
                new CaffeineEvaluationCache(CacheConfig.builder().build()), MAPPER,
                Duration.ofSeconds(1), Duration.ofMinutes(5));

        @Test
        @DisplayName("Computed fields survive serialization")
        void computedFieldsRoundTrip() {
            cache.putComputedFields("computed-fields:settlement:s1:main",
                    Map.of("prosperity", BooleanNode.TRUE, "tier", IntNode.valueOf(3)));

            Map<String, JsonNode> fields = cache.getComputedFields("computed-fields:settlement:s1:main").orElseThrow();

            assertThat(fields.get("prosperity").asBoolean()).isTrue();
            assertThat(fields.get("tier").asInt()).isEqualTo(3);
        }

        @Test
        @DisplayName("Deletes report how many entries were removed")
        void deletes() {
            cache.putValue("derived-variable:v1:main", IntNode.valueOf(1));
            cache.putValue("derived-variable:v2:main", IntNode.valueOf(2));
            cache.putValue("computed-fields:settlement:s1:main", IntNode.valueOf(3));

            assertThat(cache.deleteAll(List.of("derived-variable:v1:main", "derived-variable:missing:main"))).isEqualTo(1);
            assertThat(cache.deletePattern("computed-fields:*:main")).isEqualTo(1);
            assertThat(cache.getValue("derived-variable:v2:main")).hasValue(IntNode.valueOf(2));
        }

        @Test
        @DisplayName("Undecodable bytes read as a miss")
        void corruptEntry() {
            cache.putValue("computed-fields:settlement:s1:main", IntNode.valueOf(7));

            assertThat(cache.getComputedFields("computed-fields:settlement:s1:main")).isEmpty();
        }
    }

    @Nested
    @DisplayName("Against a failing cache")
    class Failing {

        @Test
        @DisplayName("Failures become misses and no-ops")
        void failuresDegrade() {
            EvaluationCache broken = mock(EvaluationCache.class);
            when(broken.get(anyString())).thenReturn(
                    CompletableFuture.failedFuture(new StoreUnavailableException("down")));
            when(broken.delete(anyString())).thenReturn(
                    CompletableFuture.failedFuture(new StoreUnavailableException("down")));
            ResultCache cache = new ResultCache(broken, MAPPER, Duration.ofSeconds(1), Duration.ofMinutes(5));

            assertThat(cache.getComputedFields("computed-fields:settlement:s1:main")).isEmpty();
            assertThat(cache.delete("computed-fields:settlement:s1:main")).isZero();
        }

        @Test
        @DisplayName("A cache that never answers times out as a miss")
        void timeoutDegrades() {
            EvaluationCache hanging = mock(EvaluationCache.class);
            when(hanging.get(anyString())).thenReturn(new CompletableFuture<>());
            ResultCache cache = new ResultCache(hanging, MAPPER, Duration.ofMillis(50), Duration.ofMinutes(5));

            assertThat(cache.getValue("derived-variable:v1:main")).isEmpty();
        }
    }
}
