/*
 * Copyright (c) 2025 Chronicle Rule Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.chronicle.ruleengine.service;

import com.chronicle.ruleengine.api.exceptions.CircularDependencyException;
import com.chronicle.ruleengine.api.exceptions.EntityNotFoundException;
import com.chronicle.ruleengine.api.exceptions.ForbiddenPathException;
import com.chronicle.ruleengine.api.model.Effect;
import com.chronicle.ruleengine.api.model.EffectTiming;
import com.chronicle.ruleengine.api.model.PatchOperation;
import com.chronicle.ruleengine.engine.CampaignRuleEngine;
import com.chronicle.ruleengine.infra.cache.CacheConfig;
import com.chronicle.ruleengine.infra.cache.CaffeineEvaluationCache;
import com.chronicle.ruleengine.testkit.InMemoryConditionStore;
import com.chronicle.ruleengine.testkit.InMemoryEffectExecutionLog;
import com.chronicle.ruleengine.testkit.InMemoryEffectStore;
import com.chronicle.ruleengine.testkit.InMemoryEntityStore;
import com.chronicle.ruleengine.testkit.InMemoryVariableStore;
import com.fasterxml.jackson.databind.node.IntNode;
import com.fasterxml.jackson.databind.node.TextNode;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;

import static com.chronicle.ruleengine.testkit.Fixtures.BRANCH;
import static com.chronicle.ruleengine.testkit.Fixtures.CAMPAIGN;
import static com.chronicle.ruleengine.testkit.Fixtures.effect;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class EffectServiceTest {

    private static final Instant NOW = Instant.parse("2025-03-01T12:00:00Z");

    private InMemoryEffectStore effects;
    private CampaignRuleEngine engine;
    private EffectService service;

    @BeforeEach
    void setUp() {
        effects = new InMemoryEffectStore();
        engine = CampaignRuleEngine.builder()
                .entityStore(new InMemoryEntityStore())
                .variableStore(new InMemoryVariableStore())
                .conditionStore(new InMemoryConditionStore())
                .effectStore(effects)
                .executionLog(new InMemoryEffectExecutionLog())
                .cache(new CaffeineEvaluationCache(CacheConfig.builder().build()))
                .build();
        service = new EffectService(effects, engine, Clock.fixed(NOW, ZoneOffset.UTC));
    }

    @Test
    @DisplayName("Valid effects are stored and drop the compiled graph")
    void create() {
        engine.getGraphManager().getGraph(CAMPAIGN, BRANCH);

        service.create(effect("grow", "settlement", "s1", EffectTiming.ON_RESOLVE, 0,
                List.of(PatchOperation.replace("/level", IntNode.valueOf(3)))), BRANCH);

        assertThat(effects.findById("grow")).isPresent();
        assertThat(engine.getGraphManager().peek(CAMPAIGN, BRANCH)).isEmpty();
        assertThat(engine.getDependents(CAMPAIGN, BRANCH, "effect:grow")).contains("variable:level");
    }

    @Test
    @DisplayName("Protected paths are refused with the offending path")
    void forbiddenPath() {
        assertThatThrownBy(() -> service.create(effect("steal", "settlement", "s1", EffectTiming.POST, 0,
                List.of(PatchOperation.replace("/kingdomId", TextNode.valueOf("k2")))), BRANCH))
                .isInstanceOf(ForbiddenPathException.class)
                .satisfies(e -> assertThat(((ForbiddenPathException) e).getPath()).isEqualTo("/kingdomId"));
        assertThat(effects.findById("steal")).isEmpty();
    }

    @Test
    @DisplayName("Effects that would feed each other are refused")
    void cycle() {
        service.create(effect("a", "settlement", "s1", EffectTiming.ON_RESOLVE, 0, List.of(
                PatchOperation.test("/name", TextNode.valueOf("Oakvale")),
                PatchOperation.replace("/level", IntNode.valueOf(3)))), BRANCH);

        assertThatThrownBy(() -> service.create(effect("b", "settlement", "s1", EffectTiming.ON_RESOLVE, 0, List.of(
                PatchOperation.test("/level", IntNode.valueOf(3)),
                PatchOperation.replace("/name", TextNode.valueOf("Oakhold")))), BRANCH))
                .isInstanceOf(CircularDependencyException.class);
    }

    @Test
    @DisplayName("Deleting is soft and hides the effect from execution")
    void delete() {
        service.create(effect("grow", "settlement", "s1", EffectTiming.ON_RESOLVE, 0,
                List.of(PatchOperation.replace("/level", IntNode.valueOf(3)))), BRANCH);

        Effect deleted = service.delete("grow", BRANCH);

        assertThat(deleted.deletedAt()).isEqualTo(NOW);
        assertThat(effects.findActive("settlement", "s1", EffectTiming.ON_RESOLVE)).isEmpty();
        assertThatThrownBy(() -> service.delete("grow", BRANCH)).isInstanceOf(EntityNotFoundException.class);
        assertThatThrownBy(() -> service.update(deleted, BRANCH)).isInstanceOf(EntityNotFoundException.class);
    }
}
