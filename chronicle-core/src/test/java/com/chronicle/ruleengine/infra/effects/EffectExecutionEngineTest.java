/*
 * Copyright (c) 2025 Chronicle Rule Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.chronicle.ruleengine.infra.effects;

import com.chronicle.ruleengine.api.exceptions.CircularDependencyException;
import com.chronicle.ruleengine.api.exceptions.EntityNotFoundException;
import com.chronicle.ruleengine.api.exceptions.StoreUnavailableException;
import com.chronicle.ruleengine.api.model.Effect;
import com.chronicle.ruleengine.api.model.EffectExecution;
import com.chronicle.ruleengine.api.model.EffectExecutionStatus;
import com.chronicle.ruleengine.api.model.EffectExecutionSummary;
import com.chronicle.ruleengine.api.model.EffectTiming;
import com.chronicle.ruleengine.api.model.EntitySnapshot;
import com.chronicle.ruleengine.api.model.PatchOperation;
import com.chronicle.ruleengine.api.model.PatchPreview;
import com.chronicle.ruleengine.api.spi.EffectExecutionLog;
import com.chronicle.ruleengine.compiler.DependencyGraphCompiler;
import com.chronicle.ruleengine.infra.cache.CacheConfig;
import com.chronicle.ruleengine.infra.cache.CacheKeys;
import com.chronicle.ruleengine.infra.cache.CaffeineEvaluationCache;
import com.chronicle.ruleengine.infra.cache.ResultCache;
import com.chronicle.ruleengine.infra.invalidation.EntityHierarchy;
import com.chronicle.ruleengine.infra.invalidation.InvalidationCoordinator;
import com.chronicle.ruleengine.infra.management.DependencyGraphManager;
import com.chronicle.ruleengine.infra.metrics.RuleEngineMetrics;
import com.chronicle.ruleengine.infra.metrics.impl.inmemory.InMemoryMetricsRegistry;
import com.chronicle.ruleengine.testkit.InMemoryConditionStore;
import com.chronicle.ruleengine.testkit.InMemoryEffectExecutionLog;
import com.chronicle.ruleengine.testkit.InMemoryEffectStore;
import com.chronicle.ruleengine.testkit.InMemoryEntityStore;
import com.chronicle.ruleengine.testkit.InMemoryVariableStore;
import com.fasterxml.jackson.databind.node.IntNode;
import com.fasterxml.jackson.databind.node.TextNode;
import io.opentelemetry.api.OpenTelemetry;
import io.opentelemetry.api.trace.Tracer;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;

import static com.chronicle.ruleengine.testkit.Fixtures.BRANCH;
import static com.chronicle.ruleengine.testkit.Fixtures.CAMPAIGN;
import static com.chronicle.ruleengine.testkit.Fixtures.MAPPER;
import static com.chronicle.ruleengine.testkit.Fixtures.effect;
import static com.chronicle.ruleengine.testkit.Fixtures.nextInstant;
import static com.chronicle.ruleengine.testkit.Fixtures.object;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class EffectExecutionEngineTest {

    private static final Instant NOW = Instant.parse("2025-03-01T12:00:00Z");
    private static final String ACTOR = "gm-1";

    private InMemoryEntityStore entities;
    private InMemoryEffectStore effects;
    private InMemoryEffectExecutionLog log;
    private InMemoryMetricsRegistry registry;
    private ResultCache cache;
    private Tracer tracer;
    private DependencyGraphManager graphs;
    private EffectExecutionEngine engine;

    @BeforeEach
    void setUp() {
        tracer = OpenTelemetry.noop().getTracer("test");
        entities = new InMemoryEntityStore().withPatcher(new JsonPatchApplier()::apply);
        effects = new InMemoryEffectStore();
        log = new InMemoryEffectExecutionLog();
        registry = new InMemoryMetricsRegistry();
        RuleEngineMetrics metrics = new RuleEngineMetrics(registry);

        graphs = new DependencyGraphManager(new DependencyGraphCompiler(
                new InMemoryConditionStore(), new InMemoryVariableStore(), effects, tracer), metrics);
        cache = new ResultCache(new CaffeineEvaluationCache(CacheConfig.builder().build()), MAPPER,
                Duration.ofSeconds(1), Duration.ofMinutes(5));
        InvalidationCoordinator coordinator = new InvalidationCoordinator(graphs, cache, metrics, tracer);

        engine = new EffectExecutionEngine(entities, effects, log, PatchPathPolicy.defaults(), new JsonPatchApplier(),
                graphs, coordinator, EntityHierarchy.defaults(), metrics, tracer, Clock.fixed(NOW, ZoneOffset.UTC));

        entities.put("settlement", "s1", CAMPAIGN, object(
                "{\"id\": \"s1\", \"name\": \"Oakvale\", \"level\": 2, \"kingdomId\": \"k1\", \"variables\": {}}"));
        entities.put("structure", "st1", CAMPAIGN, object(
                "{\"id\": \"st1\", \"name\": \"Temple\", \"level\": 1, \"type\": \"temple\", \"settlementId\": \"s1\"}"));
    }

    @Nested
    @DisplayName("Execution for one entity")
    class ForEntity {

        @Test
        @DisplayName("A forbidden effect fails alone and the next one still runs")
        void failureDoesNotStopBatch() {
            effects.save(effect("e1", "settlement", "s1", EffectTiming.ON_RESOLVE, 1,
                    List.of(PatchOperation.replace("/id", TextNode.valueOf("hijacked")))));
            effects.save(effect("e2", "settlement", "s1", EffectTiming.ON_RESOLVE, 2,
                    List.of(PatchOperation.replace("/level", IntNode.valueOf(3)))));

            EffectExecutionSummary summary = engine.executeForEntity("settlement", "s1",
                    EffectTiming.ON_RESOLVE, ACTOR, BRANCH);

            assertThat(summary.total()).isEqualTo(2);
            assertThat(summary.succeeded()).isEqualTo(1);
            assertThat(summary.failed()).isEqualTo(1);
            assertThat(summary.executionOrder()).containsExactly("e1", "e2");

            assertThat(log.findByEffect("e1")).singleElement().satisfies(record -> {
                assertThat(record.status()).isEqualTo(EffectExecutionStatus.FAILED);
                assertThat(record.error()).contains("/id");
                assertThat(record.appliedPatch()).isEmpty();
            });
            EffectExecution succeeded = log.findByEffect("e2").get(0);
            assertThat(succeeded.status()).isEqualTo(EffectExecutionStatus.SUCCEEDED);
            assertThat(succeeded.executedBy()).isEqualTo(ACTOR);
            assertThat(succeeded.executedAt()).isEqualTo(NOW);
            assertThat(succeeded.affectedFields()).containsExactly("level");
            assertThat(succeeded.contextSnapshot().get("level").asInt()).isEqualTo(2);

            EntitySnapshot settlement = entities.load("settlement", "s1").orElseThrow();
            assertThat(settlement.data().get("level").asInt()).isEqualTo(3);
            assertThat(settlement.data().get("id").asText()).isEqualTo("s1");
            assertThat(settlement.version()).isEqualTo(2);

            assertThat(registry.getCounterValue(RuleEngineMetrics.EFFECTS_FAILED)).isEqualTo(1);
            assertThat(registry.getCounterValue(RuleEngineMetrics.EFFECTS_SUCCEEDED)).isEqualTo(1);
        }

        @Test
        @DisplayName("One forbidden operation rejects the whole patch")
        void partialPatchRejected() {
            effects.save(effect("mixed", "settlement", "s1", EffectTiming.ON_RESOLVE, 0, List.of(
                    PatchOperation.replace("/level", IntNode.valueOf(4)),
                    PatchOperation.replace("/kingdomId", TextNode.valueOf("k2")))));

            EffectExecutionSummary summary = engine.executeForEntity("settlement", "s1",
                    EffectTiming.ON_RESOLVE, ACTOR, BRANCH);

            assertThat(summary.failed()).isEqualTo(1);
            EntitySnapshot settlement = entities.load("settlement", "s1").orElseThrow();
            assertThat(settlement.data().get("level").asInt()).isEqualTo(2);
            assertThat(settlement.version()).isEqualTo(1);
        }

        @Test
        @DisplayName("A failing test operation leaves the entity untouched")
        void failingTestOperation() {
            effects.save(effect("guarded", "settlement", "s1", EffectTiming.PRE, 0, List.of(
                    PatchOperation.test("/level", IntNode.valueOf(7)),
                    PatchOperation.replace("/level", IntNode.valueOf(8)))));

            EffectExecutionSummary summary = engine.executeForEntity("settlement", "s1",
                    EffectTiming.PRE, ACTOR, BRANCH);

            assertThat(summary.details()).singleElement().satisfies(record ->
                    assertThat(record.error()).contains("Test failed"));
            assertThat(entities.load("settlement", "s1").orElseThrow().data().get("level").asInt()).isEqualTo(2);
        }

        @Test
        @DisplayName("Equal priorities run writers before readers")
        void writersBeforeReaders() {
            effects.save(effect("reader", "settlement", "s1", EffectTiming.ON_RESOLVE, 0,
                    List.of(PatchOperation.copy("/level", "/description"))));
            effects.save(effect("writer", "settlement", "s1", EffectTiming.ON_RESOLVE, 0,
                    List.of(PatchOperation.replace("/level", IntNode.valueOf(5)))));

            EffectExecutionSummary summary = engine.executeForEntity("settlement", "s1",
                    EffectTiming.ON_RESOLVE, ACTOR, BRANCH);

            assertThat(summary.executionOrder()).containsExactly("writer", "reader");
            assertThat(entities.load("settlement", "s1").orElseThrow().data().get("description").asInt())
                    .isEqualTo(5);
        }

        @Test
        @DisplayName("Inactive and deleted effects are skipped")
        void inactiveSkipped() {
            effects.save(new Effect("off", CAMPAIGN, "off", "settlement", "s1",
                    List.of(PatchOperation.replace("/level", IntNode.valueOf(9))), EffectTiming.POST, 0,
                    false, null, nextInstant()));
            effects.save(new Effect("gone", CAMPAIGN, "gone", "settlement", "s1",
                    List.of(PatchOperation.replace("/level", IntNode.valueOf(9))), EffectTiming.POST, 0,
                    true, NOW, nextInstant()));

            EffectExecutionSummary summary = engine.executeForEntity("settlement", "s1",
                    EffectTiming.POST, ACTOR, BRANCH);

            assertThat(summary.total()).isZero();
            assertThat(log.all()).isEmpty();
        }

        @Test
        @DisplayName("A successful effect evicts the entity and its parent from the cache")
        void invalidatesAfterSuccess() {
            String structure = CacheKeys.computedFields("structure", "st1", BRANCH);
            String parent = CacheKeys.computedFields("settlement", "s1", BRANCH);
            String siblings = CacheKeys.childList("structure", "settlement", "s1", BRANCH);
            String unrelated = CacheKeys.computedFields("settlement", "s2", BRANCH);
            for (String key : List.of(structure, parent, siblings, unrelated)) {
                cache.putValue(key, IntNode.valueOf(1));
            }
            effects.save(effect("upgrade", "structure", "st1", EffectTiming.ON_RESOLVE, 0,
                    List.of(PatchOperation.replace("/level", IntNode.valueOf(2)))));

            engine.executeForEntity("structure", "st1", EffectTiming.ON_RESOLVE, ACTOR, BRANCH);

            assertThat(cache.getValue(structure)).isEmpty();
            assertThat(cache.getValue(parent)).isEmpty();
            assertThat(cache.getValue(siblings)).isEmpty();
            assertThat(cache.getValue(unrelated)).isPresent();
        }

        @Test
        @DisplayName("A missing entity is recorded as a failure")
        void missingEntity() {
            effects.save(effect("lost", "settlement", "s9", EffectTiming.ON_RESOLVE, 0,
                    List.of(PatchOperation.replace("/level", IntNode.valueOf(2)))));

            EffectExecutionSummary summary = engine.executeForEntity("settlement", "s9",
                    EffectTiming.ON_RESOLVE, ACTOR, BRANCH);

            assertThat(summary.failed()).isEqualTo(1);
            assertThat(log.findByEffect("lost")).singleElement()
                    .extracting(EffectExecution::status).isEqualTo(EffectExecutionStatus.FAILED);
        }
    }

    @Nested
    @DisplayName("Execution with dependencies")
    class WithDependencies {

        @Test
        @DisplayName("Effects run in dependency order regardless of request order")
        void dependencyOrder() {
            effects.save(effect("reader", "settlement", "s1", EffectTiming.ON_RESOLVE, 0,
                    List.of(PatchOperation.copy("/level", "/description"))));
            effects.save(effect("writer", "settlement", "s1", EffectTiming.ON_RESOLVE, 0,
                    List.of(PatchOperation.replace("/level", IntNode.valueOf(6)))));

            EffectExecutionSummary summary = engine.executeWithDependencies(List.of("reader", "writer"), ACTOR, BRANCH);

            assertThat(summary.executionOrder()).containsExactly("writer", "reader");
            assertThat(summary.succeeded()).isEqualTo(2);
        }

        @Test
        @DisplayName("A cyclic set is refused before anything is applied")
        void cycleRefused() {
            effects.save(effect("a", "settlement", "s1", EffectTiming.ON_RESOLVE, 0, List.of(
                    PatchOperation.test("/name", TextNode.valueOf("Oakvale")),
                    PatchOperation.replace("/level", IntNode.valueOf(3)))));
            effects.save(effect("b", "settlement", "s1", EffectTiming.ON_RESOLVE, 0, List.of(
                    PatchOperation.test("/level", IntNode.valueOf(3)),
                    PatchOperation.replace("/name", TextNode.valueOf("Oakhold")))));

            assertThatThrownBy(() -> engine.executeWithDependencies(List.of("a", "b"), ACTOR, BRANCH))
                    .isInstanceOf(CircularDependencyException.class)
                    .satisfies(e -> assertThat(((CircularDependencyException) e).getCyclePath())
                            .contains("effect:a", "effect:b"));
            assertThat(log.all()).isEmpty();
            assertThat(entities.load("settlement", "s1").orElseThrow().version()).isEqualTo(1);
        }

        @Test
        @DisplayName("Unknown ids yield an empty summary")
        void unknownIds() {
            assertThat(engine.executeWithDependencies(List.of("nope"), ACTOR, BRANCH).total()).isZero();
        }
    }

    @Nested
    @DisplayName("Preview")
    class Preview {

        @Test
        @DisplayName("Shows the patched document without persisting it")
        void validPreview() {
            effects.save(effect("grow", "settlement", "s1", EffectTiming.ON_RESOLVE, 0, List.of(
                    PatchOperation.replace("/level", IntNode.valueOf(3)),
                    PatchOperation.add("/variables/gold", IntNode.valueOf(50)))));

            PatchPreview preview = engine.preview("grow");

            assertThat(preview.isValid()).isTrue();
            assertThat(preview.after().get("level").asInt()).isEqualTo(3);
            assertThat(preview.before().get("level").asInt()).isEqualTo(2);
            assertThat(preview.changedFields()).containsExactly("level", "variables");
            assertThat(entities.load("settlement", "s1").orElseThrow().version()).isEqualTo(1);
            assertThat(log.all()).isEmpty();
        }

        @Test
        @DisplayName("Reports policy violations and patch failures as errors")
        void invalidPreview() {
            effects.save(effect("bad", "settlement", "s1", EffectTiming.ON_RESOLVE, 0, List.of(
                    PatchOperation.replace("/id", TextNode.valueOf("x")),
                    PatchOperation.remove("/createdAt"))));
            effects.save(effect("broken", "settlement", "s1", EffectTiming.ON_RESOLVE, 0,
                    List.of(PatchOperation.remove("/description"))));

            PatchPreview forbidden = engine.preview("bad");
            assertThat(forbidden.errors()).hasSize(2);
            assertThat(forbidden.after()).isEqualTo(forbidden.before());

            PatchPreview failing = engine.preview("broken");
            assertThat(failing.isValid()).isFalse();
            assertThat(failing.errors().get(0)).contains("No value at /description");
        }

        @Test
        @DisplayName("Missing effects throw, missing entities are reported")
        void missing() {
            assertThatThrownBy(() -> engine.preview("nope")).isInstanceOf(EntityNotFoundException.class);

            effects.save(effect("orphan", "settlement", "s9", EffectTiming.ON_RESOLVE, 0,
                    List.of(PatchOperation.replace("/level", IntNode.valueOf(2)))));
            assertThat(engine.preview("orphan").errors()).singleElement()
                    .satisfies(error -> assertThat(error).contains("s9"));
        }
    }

    @Nested
    @DisplayName("Failures after the patch is persisted")
    class AfterPersist {

        private EffectExecutionLog failingLog;
        private InvalidationCoordinator failingCoordinator;
        private InMemoryMetricsRegistry afterRegistry;
        private EffectExecutionEngine fragile;

        @BeforeEach
        void setUp() {
            failingLog = mock(EffectExecutionLog.class);
            failingCoordinator = mock(InvalidationCoordinator.class);
            doThrow(new StoreUnavailableException("audit table offline")).when(failingLog).append(any());
            when(failingCoordinator.invalidate(any())).thenThrow(new StoreUnavailableException("graph offline"));
            afterRegistry = new InMemoryMetricsRegistry();
            fragile = new EffectExecutionEngine(entities, effects, failingLog, PatchPathPolicy.defaults(),
                    new JsonPatchApplier(), graphs, failingCoordinator, EntityHierarchy.defaults(),
                    new RuleEngineMetrics(afterRegistry), tracer, Clock.fixed(NOW, ZoneOffset.UTC));
            effects.save(effect("raise", "settlement", "s1", EffectTiming.ON_RESOLVE, 0,
                    List.of(PatchOperation.replace("/level", IntNode.valueOf(5)))));
        }

        @Test
        @DisplayName("Audit and invalidation failures keep a persisted effect SUCCEEDED")
        void persistedStaysSucceeded() {
            EffectExecutionSummary summary = fragile.executeForEntity("settlement", "s1",
                    EffectTiming.ON_RESOLVE, ACTOR, BRANCH);

            assertThat(summary.succeeded()).isEqualTo(1);
            assertThat(summary.failed()).isZero();
            assertThat(summary.details()).singleElement()
                    .satisfies(record -> assertThat(record.status()).isEqualTo(EffectExecutionStatus.SUCCEEDED));
            assertThat(entities.load("settlement", "s1").orElseThrow().data().get("level").asInt()).isEqualTo(5);

            verify(failingLog, times(1)).append(any());
            verify(failingCoordinator).invalidate(any());
            assertThat(afterRegistry.getCounterValue(RuleEngineMetrics.EFFECTS_SUCCEEDED)).isEqualTo(1);
            assertThat(afterRegistry.getCounterValue(RuleEngineMetrics.EFFECTS_FAILED)).isZero();
        }
    }
}
