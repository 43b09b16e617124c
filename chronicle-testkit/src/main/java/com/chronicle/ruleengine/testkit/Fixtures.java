/*
 * Copyright (c) 2025 Chronicle Rule Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.chronicle.ruleengine.testkit;

import com.chronicle.ruleengine.api.model.Condition;
import com.chronicle.ruleengine.api.model.Effect;
import com.chronicle.ruleengine.api.model.EffectTiming;
import com.chronicle.ruleengine.api.model.ExpressionNode;
import com.chronicle.ruleengine.api.model.ExpressionNodes;
import com.chronicle.ruleengine.api.model.PatchOperation;
import com.chronicle.ruleengine.api.model.StateVariable;
import com.chronicle.ruleengine.api.model.VariableScope;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.io.UncheckedIOException;
import java.time.Instant;
import java.util.List;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Builders for test definitions. Every created definition gets a strictly increasing
 * {@code createdAt}, so creation order in tests follows call order.
 */
public final class Fixtures {

    public static final ObjectMapper MAPPER = new ObjectMapper();
    public static final String CAMPAIGN = "c1";
    public static final String BRANCH = "main";

    private static final AtomicLong CLOCK = new AtomicLong(1_700_000_000L);

    private Fixtures() {
    }

    public static JsonNode json(String text) {
        try {
            return MAPPER.readTree(text);
        } catch (JsonProcessingException e) {
            throw new UncheckedIOException(e);
        }
    }

    public static ObjectNode object(String text) {
        return (ObjectNode) json(text);
    }

    public static ExpressionNode expr(String text) {
        return ExpressionNodes.fromJson(json(text));
    }

    public static Instant nextInstant() {
        return Instant.ofEpochSecond(CLOCK.incrementAndGet());
    }

    public static Condition condition(String id, String entityType, String entityId, String field,
                                      String expression, int priority) {
        return new Condition(id, CAMPAIGN, entityType, entityId, field, expr(expression), priority,
                true, null, nextInstant(), 1);
    }

    public static StateVariable stored(String id, VariableScope scope, String scopeId, String key, String value) {
        return new StateVariable(id, CAMPAIGN, scope, scopeId, key, json(value), null,
                true, null, nextInstant(), 1);
    }

    public static StateVariable derived(String id, VariableScope scope, String scopeId, String key, String formula) {
        return new StateVariable(id, CAMPAIGN, scope, scopeId, key, null, expr(formula),
                true, null, nextInstant(), 1);
    }

    public static Effect effect(String id, String entityType, String entityId, EffectTiming timing,
                                int priority, List<PatchOperation> payload) {
        return new Effect(id, CAMPAIGN, id, entityType, entityId, payload, timing, priority,
                true, null, nextInstant());
    }
}
