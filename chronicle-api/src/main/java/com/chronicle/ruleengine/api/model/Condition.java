/*
 * Copyright (c) 2025 Chronicle Rule Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.chronicle.ruleengine.api.model;

import java.time.Instant;
import java.util.Objects;

/**
 * Computed-field definition. A condition with a {@code null} entityId applies to every entity
 * of its type.
 *
 * @param field name of the computed field the expression produces
 */
public record Condition(
        String id,
        String campaignId,
        String entityType,
        String entityId,
        String field,
        ExpressionNode expression,
        int priority,
        boolean active,
        Instant deletedAt,
        Instant createdAt,
        long version
) {
    public Condition {
        Objects.requireNonNull(id, "id");
        Objects.requireNonNull(campaignId, "campaignId");
        Objects.requireNonNull(entityType, "entityType");
        Objects.requireNonNull(field, "field");
        Objects.requireNonNull(expression, "expression");
        createdAt = createdAt == null ? Instant.EPOCH : createdAt;
    }

    /** Active and not tombstoned. */
    public boolean isLive() {
        return active && deletedAt == null;
    }

    public boolean isTypeWide() {
        return entityId == null;
    }

    public boolean appliesTo(String type, String id) {
        return entityType.equals(type) && (entityId == null || entityId.equals(id));
    }

    public Condition withExpression(ExpressionNode newExpression) {
        return new Condition(id, campaignId, entityType, entityId, field, newExpression, priority,
                active, deletedAt, createdAt, version + 1);
    }

    public Condition softDeleted(Instant at) {
        return new Condition(id, campaignId, entityType, entityId, field, expression, priority,
                active, at, createdAt, version + 1);
    }
}
