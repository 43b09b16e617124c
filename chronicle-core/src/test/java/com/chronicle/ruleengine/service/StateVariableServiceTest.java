/*
 * Copyright (c) 2025 Chronicle Rule Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.chronicle.ruleengine.service;

import com.chronicle.ruleengine.api.exceptions.CircularDependencyException;
import com.chronicle.ruleengine.api.exceptions.EntityNotFoundException;
import com.chronicle.ruleengine.api.exceptions.OptimisticLockConflictException;
import com.chronicle.ruleengine.api.model.StateVariable;
import com.chronicle.ruleengine.api.model.VariableScope;
import com.chronicle.ruleengine.engine.CampaignRuleEngine;
import com.chronicle.ruleengine.infra.cache.CacheConfig;
import com.chronicle.ruleengine.infra.cache.CaffeineEvaluationCache;
import com.chronicle.ruleengine.testkit.InMemoryConditionStore;
import com.chronicle.ruleengine.testkit.InMemoryEffectExecutionLog;
import com.chronicle.ruleengine.testkit.InMemoryEffectStore;
import com.chronicle.ruleengine.testkit.InMemoryEntityStore;
import com.chronicle.ruleengine.testkit.InMemoryVariableStore;
import com.fasterxml.jackson.databind.node.IntNode;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static com.chronicle.ruleengine.testkit.Fixtures.BRANCH;
import static com.chronicle.ruleengine.testkit.Fixtures.CAMPAIGN;
import static com.chronicle.ruleengine.testkit.Fixtures.condition;
import static com.chronicle.ruleengine.testkit.Fixtures.derived;
import static com.chronicle.ruleengine.testkit.Fixtures.expr;
import static com.chronicle.ruleengine.testkit.Fixtures.object;
import static com.chronicle.ruleengine.testkit.Fixtures.stored;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class StateVariableServiceTest {

    private InMemoryVariableStore variables;
    private CampaignRuleEngine engine;
    private StateVariableService service;

    @BeforeEach
    void setUp() {
        InMemoryEntityStore entities = new InMemoryEntityStore();
        InMemoryConditionStore conditions = new InMemoryConditionStore();
        variables = new InMemoryVariableStore();
        engine = CampaignRuleEngine.builder()
                .entityStore(entities)
                .variableStore(variables)
                .conditionStore(conditions)
                .effectStore(new InMemoryEffectStore())
                .executionLog(new InMemoryEffectExecutionLog())
                .cache(new CaffeineEvaluationCache(CacheConfig.builder().build()))
                .build();
        service = new StateVariableService(variables, engine);

        entities.put("settlement", "s1", CAMPAIGN, object("{\"id\": \"s1\", \"level\": 2}"));
        conditions.save(condition("prosperous", "settlement", null, "isProsperous",
                "{\">\": [{\"var\": \"population\"}, 10000]}", 0));
    }

    @Test
    @DisplayName("A value update is reflected in computed fields")
    void valueUpdate() {
        StateVariable population = service.create(
                stored("v-pop", VariableScope.SETTLEMENT, "s1", "population", "12000"), BRANCH);
        assertThat(engine.evaluateComputedFields("settlement", "s1", BRANCH).get("isProsperous").asBoolean()).isTrue();

        StateVariable updated = service.updateValue("v-pop", IntNode.valueOf(5000), population.version(), BRANCH);

        assertThat(updated.version()).isEqualTo(population.version() + 1);
        assertThat(engine.evaluateComputedFields("settlement", "s1", BRANCH).get("isProsperous").asBoolean()).isFalse();
    }

    @Test
    @DisplayName("A formula update refreshes the cached derived value")
    void formulaUpdate() {
        service.create(stored("v-pop", VariableScope.SETTLEMENT, "s1", "population", "12000"), BRANCH);
        StateVariable tax = service.create(derived("v-tax", VariableScope.SETTLEMENT, "s1", "tax",
                "{\"/\": [{\"var\": \"population\"}, 1000]}"), BRANCH);
        assertThat(engine.evaluateVariable("v-tax", BRANCH, Map.of(), false).value().asDouble()).isEqualTo(12.0);

        service.updateFormula("v-tax", expr("{\"/\": [{\"var\": \"population\"}, 100]}"), tax.version(), BRANCH);

        assertThat(engine.evaluateVariable("v-tax", BRANCH, Map.of(), false).value().asDouble()).isEqualTo(120.0);
    }

    @Test
    @DisplayName("Self-referencing formulas are refused")
    void circularFormula() {
        service.create(derived("v-a", VariableScope.SETTLEMENT, "s1", "a", "{\"+\": [{\"var\": \"b\"}, 1]}"), BRANCH);

        assertThatThrownBy(() -> service.create(
                derived("v-b", VariableScope.SETTLEMENT, "s1", "b", "{\"+\": [{\"var\": \"a\"}, 1]}"), BRANCH))
                .isInstanceOf(CircularDependencyException.class);
        assertThat(variables.findById("v-b")).isEmpty();
    }

    @Test
    @DisplayName("Version conflicts and deleted variables are reported")
    void conflictsAndDeletes() {
        StateVariable population = service.create(
                stored("v-pop", VariableScope.SETTLEMENT, "s1", "population", "12000"), BRANCH);

        assertThatThrownBy(() -> service.updateValue("v-pop", IntNode.valueOf(1), population.version() + 5, BRANCH))
                .isInstanceOf(OptimisticLockConflictException.class);

        service.delete("v-pop", population.version(), BRANCH);

        assertThat(engine.evaluateComputedFields("settlement", "s1", BRANCH).get("isProsperous").asBoolean()).isFalse();
        assertThatThrownBy(() -> service.updateValue("v-pop", IntNode.valueOf(1), population.version() + 1, BRANCH))
                .isInstanceOf(EntityNotFoundException.class);
    }
}
