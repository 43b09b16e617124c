/*
 * Copyright (c) 2025 Chronicle Rule Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.chronicle.ruleengine.api.model;

import com.fasterxml.jackson.databind.node.ObjectNode;

import java.util.Objects;

/**
 * Point-in-time copy of an entity's core fields as returned by the entity store.
 * Callers must treat {@code data} as read-only; patching works on a deep copy.
 */
public record EntitySnapshot(
        String entityType,
        String entityId,
        String campaignId,
        ObjectNode data,
        long version
) {
    public EntitySnapshot {
        Objects.requireNonNull(entityType, "entityType");
        Objects.requireNonNull(entityId, "entityId");
        Objects.requireNonNull(data, "data");
    }

    /** Text value of a top-level field, or {@code null}. */
    public String text(String field) {
        return data.hasNonNull(field) ? data.get(field).asText() : null;
    }
}
