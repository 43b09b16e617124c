/*
 * Copyright (c) 2025 Chronicle Rule Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.chronicle.ruleengine.api.model;

import java.time.Instant;
import java.util.List;
import java.util.Objects;

/**
 * Timed patch applied to the entity it is attached to.
 */
public record Effect(
        String id,
        String campaignId,
        String name,
        String entityType,
        String entityId,
        List<PatchOperation> payload,
        EffectTiming timing,
        int priority,
        boolean active,
        Instant deletedAt,
        Instant createdAt
) {
    public Effect {
        Objects.requireNonNull(id, "id");
        Objects.requireNonNull(entityType, "entityType");
        Objects.requireNonNull(timing, "timing");
        payload = payload == null ? List.of() : List.copyOf(payload);
        createdAt = createdAt == null ? Instant.EPOCH : createdAt;
    }

    public boolean isLive() {
        return active && deletedAt == null;
    }
}
