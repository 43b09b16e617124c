/*
 * Copyright (c) 2025 Chronicle Rule Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.chronicle.ruleengine.runtime.context;

import com.chronicle.ruleengine.api.exceptions.EntityNotFoundException;
import com.chronicle.ruleengine.api.exceptions.StoreUnavailableException;
import com.chronicle.ruleengine.api.model.VariableScope;
import com.chronicle.ruleengine.api.spi.VariableStore;
import com.chronicle.ruleengine.runtime.evaluation.ExpressionEvaluator;
import com.chronicle.ruleengine.runtime.operators.DomainOperatorResolver;
import com.chronicle.ruleengine.testkit.InMemoryEntityStore;
import com.chronicle.ruleengine.testkit.InMemoryVariableStore;
import com.fasterxml.jackson.databind.JsonNode;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;
import java.util.Map;

import static com.chronicle.ruleengine.testkit.Fixtures.CAMPAIGN;
import static com.chronicle.ruleengine.testkit.Fixtures.derived;
import static com.chronicle.ruleengine.testkit.Fixtures.json;
import static com.chronicle.ruleengine.testkit.Fixtures.object;
import static com.chronicle.ruleengine.testkit.Fixtures.stored;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class ContextBuilderTest {

    private InMemoryEntityStore entities;
    private InMemoryVariableStore variables;
    private ContextBuilder builder;

    @BeforeEach
    void setUp() {
        entities = new InMemoryEntityStore();
        variables = new InMemoryVariableStore();
        ExpressionEvaluator evaluator = new ExpressionEvaluator(new DomainOperatorResolver(entities, variables));
        builder = new ContextBuilder(entities, variables, evaluator);

        entities.put("settlement", "s1", CAMPAIGN, object("{\"name\": \"Riverbend\", \"population\": 12000}"));
    }

    @Test
    @DisplayName("Entity fields resolve at the root and under the entity type")
    void dualPlacement() {
        EvaluationContext ctx = builder.build("settlement", "s1", null);

        assertThat(ctx.resolve("population").asInt()).isEqualTo(12000);
        assertThat(ctx.resolve("settlement.population").asInt()).isEqualTo(12000);
        assertThat(ctx.entityType()).isEqualTo("settlement");
        assertThat(ctx.snapshot()).isPresent();
    }

    @Test
    @DisplayName("Stored and derived variables are merged by key")
    void variablesAreMerged() {
        variables.save(stored("v1", VariableScope.SETTLEMENT, "s1", "gold", "100"));
        // declared before its dependency on purpose
        variables.save(derived("v2", VariableScope.SETTLEMENT, "s1", "wealth",
                "{\"*\": [{\"var\": \"income\"}, 2]}"));
        variables.save(derived("v3", VariableScope.SETTLEMENT, "s1", "income",
                "{\"+\": [{\"var\": \"gold\"}, 5]}"));

        EvaluationContext ctx = builder.build("settlement", "s1", null);

        assertThat(ctx.resolve("gold").asInt()).isEqualTo(100);
        assertThat(ctx.resolve("income").asInt()).isEqualTo(105);
        assertThat(ctx.resolve("wealth").asInt()).isEqualTo(210);
    }

    @Test
    @DisplayName("Tombstoned rows returned by the store are left out")
    void tombstonesFiltered() {
        VariableStore store = mock(VariableStore.class);
        when(store.findByScope(VariableScope.SETTLEMENT, "s1")).thenReturn(List.of(
                stored("v1", VariableScope.SETTLEMENT, "s1", "gold", "100"),
                stored("v2", VariableScope.SETTLEMENT, "s1", "tribute", "7").softDeleted(Instant.now()),
                derived("v3", VariableScope.SETTLEMENT, "s1", "wealth", "{\"*\": [{\"var\": \"gold\"}, 2]}")
                        .softDeleted(Instant.now())));
        ContextBuilder tombstoneAware = new ContextBuilder(entities, store,
                new ExpressionEvaluator(new DomainOperatorResolver(entities, store)));

        EvaluationContext ctx = tombstoneAware.build("settlement", "s1", null);

        assertThat(ctx.resolve("gold").asInt()).isEqualTo(100);
        assertThat(ctx.contains("tribute")).isFalse();
        assertThat(ctx.contains("wealth")).isFalse();
    }

    @Test
    @DisplayName("Variables of other entities are not visible")
    void scopedToEntity() {
        variables.save(stored("v1", VariableScope.SETTLEMENT, "s2", "gold", "100"));

        assertThat(builder.build("settlement", "s1", null).contains("gold")).isFalse();
    }

    @Test
    @DisplayName("Mutually dependent derived variables degrade to null instead of looping")
    void derivedCycleYieldsNull() {
        variables.save(derived("a", VariableScope.SETTLEMENT, "s1", "alpha", "{\"+\": [{\"var\": \"beta\"}, 1]}"));
        variables.save(derived("b", VariableScope.SETTLEMENT, "s1", "beta", "{\"+\": [{\"var\": \"alpha\"}, 1]}"));

        EvaluationContext ctx = builder.build("settlement", "s1", null);

        assertThat(ctx.resolve("alpha").isNull()).isTrue();
        assertThat(ctx.resolve("beta").isNull()).isTrue();
        assertThat(ctx.resolve("population").asInt()).isEqualTo(12000);
    }

    @Test
    @DisplayName("A failing derived variable becomes null without affecting the others")
    void failingDerivedIsNull() {
        variables.save(derived("a", VariableScope.SETTLEMENT, "s1", "broken", "{\"+\": [{\"var\": \"name\"}, 1]}"));
        variables.save(derived("b", VariableScope.SETTLEMENT, "s1", "fine", "{\"-\": [{\"var\": \"population\"}, 2000]}"));

        EvaluationContext ctx = builder.build("settlement", "s1", null);

        assertThat(ctx.resolve("broken").isNull()).isTrue();
        assertThat(ctx.resolve("fine").asInt()).isEqualTo(10000);
    }

    @Test
    @DisplayName("Extra context overrides entity data and variables")
    void extraContextWins() {
        variables.save(stored("v1", VariableScope.SETTLEMENT, "s1", "gold", "100"));
        Map<String, JsonNode> extra = Map.of("gold", json("1"), "population", json("3"));

        EvaluationContext ctx = builder.build("settlement", "s1", extra);

        assertThat(ctx.resolve("gold").asInt()).isEqualTo(1);
        assertThat(ctx.resolve("population").asInt()).isEqualTo(3);
        assertThat(ctx.resolve("settlement.population").asInt()).isEqualTo(12000);
    }

    @Test
    @DisplayName("Missing entity degrades to a context with variables and extras only")
    void missingEntityDegrades() {
        variables.save(stored("v1", VariableScope.SETTLEMENT, "ghost", "gold", "7"));

        EvaluationContext ctx = builder.build("settlement", "ghost", Map.of("turn", json("3")));

        assertThat(ctx.resolve("gold").asInt()).isEqualTo(7);
        assertThat(ctx.resolve("turn").asInt()).isEqualTo(3);
        assertThat(ctx.snapshot()).isEmpty();
    }

    @Test
    @DisplayName("Unavailable entity store degrades in lenient mode and throws in strict mode")
    void storeUnavailable() {
        entities.setUnavailable(true);

        assertThat(builder.build("settlement", "s1", null).contains("population")).isFalse();
        assertThatThrownBy(() -> builder.buildStrict("settlement", "s1", null))
                .isInstanceOf(StoreUnavailableException.class);
    }

    @Test
    void strictBuildRejectsMissingEntity() {
        assertThatThrownBy(() -> builder.buildStrict("settlement", "ghost", null))
                .isInstanceOf(EntityNotFoundException.class);
    }

    @Test
    @DisplayName("Entity types without a variable scope still build")
    void unknownScope() {
        entities.put("caravan", "x1", CAMPAIGN, object("{\"speed\": 3}"));

        assertThat(builder.build("caravan", "x1", null).resolve("caravan.speed").asInt()).isEqualTo(3);
    }
}
