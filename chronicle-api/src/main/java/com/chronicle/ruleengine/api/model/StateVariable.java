/*
 * Copyright (c) 2025 Chronicle Rule Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.chronicle.ruleengine.api.model;

import com.fasterxml.jackson.databind.JsonNode;

import java.time.Instant;
import java.util.Objects;

/**
 * Named value attached to an entity. Stored variables carry a {@code value}; derived variables
 * carry a {@code formula}. Exactly one of the two is present.
 */
public record StateVariable(
        String id,
        String campaignId,
        VariableScope scope,
        String scopeId,
        String key,
        JsonNode value,
        ExpressionNode formula,
        boolean active,
        Instant deletedAt,
        Instant createdAt,
        long version
) {
    public StateVariable {
        Objects.requireNonNull(id, "id");
        Objects.requireNonNull(scope, "scope");
        Objects.requireNonNull(key, "key");
        if ((value == null) == (formula == null)) {
            throw new IllegalArgumentException(
                    "Variable '" + key + "' must have exactly one of value or formula");
        }
        createdAt = createdAt == null ? Instant.EPOCH : createdAt;
    }

    public boolean isDerived() {
        return formula != null;
    }

    public boolean isLive() {
        return active && deletedAt == null;
    }

    public String scopeEntityType() {
        return scope.entityType();
    }

    public StateVariable withValue(JsonNode newValue) {
        return new StateVariable(id, campaignId, scope, scopeId, key, newValue, null,
                active, deletedAt, createdAt, version + 1);
    }

    public StateVariable withFormula(ExpressionNode newFormula) {
        return new StateVariable(id, campaignId, scope, scopeId, key, null, newFormula,
                active, deletedAt, createdAt, version + 1);
    }

    public StateVariable softDeleted(Instant at) {
        return new StateVariable(id, campaignId, scope, scopeId, key, value, formula,
                active, at, createdAt, version + 1);
    }
}
