/*
 * Copyright (c) 2025 Chronicle Rule Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.chronicle.ruleengine.api.model;

import java.util.Objects;
import java.util.Set;

/**
 * What changed. The surrounding application reports every relevant mutation as one of these.
 */
public sealed interface InvalidationScope
        permits InvalidationScope.EntityChanged, InvalidationScope.VariableChanged,
                InvalidationScope.ConditionDefinitionChanged, InvalidationScope.EffectDefinitionChanged {

    String campaignId();

    String branchId();

    /**
     * Core fields of an entity changed. {@code parentType}/{@code parentId} name the owning entity
     * whose child lists and computed fields must follow; {@code changedFields} are the top-level
     * fields touched, empty when unknown.
     */
    record EntityChanged(String campaignId, String branchId, String entityType, String entityId,
                         String parentType, String parentId, Set<String> changedFields)
            implements InvalidationScope {
        public EntityChanged {
            Objects.requireNonNull(entityType, "entityType");
            Objects.requireNonNull(entityId, "entityId");
            changedFields = changedFields == null ? Set.of() : Set.copyOf(changedFields);
        }

        public EntityChanged(String campaignId, String branchId, String entityType, String entityId) {
            this(campaignId, branchId, entityType, entityId, null, null, Set.of());
        }
    }

    /**
     * A stored value (or derived formula) of the variable {@code key} on entity
     * {@code scopeType}/{@code scopeId} changed.
     */
    record VariableChanged(String campaignId, String branchId, String scopeType, String scopeId, String key)
            implements InvalidationScope {
        public VariableChanged {
            Objects.requireNonNull(scopeType, "scopeType");
            Objects.requireNonNull(scopeId, "scopeId");
            Objects.requireNonNull(key, "key");
        }
    }

    /**
     * A condition was created, edited or deleted. {@code entityId} is {@code null} for type-wide conditions.
     */
    record ConditionDefinitionChanged(String campaignId, String branchId, String conditionId,
                                      String entityType, String entityId) implements InvalidationScope {
        public ConditionDefinitionChanged {
            Objects.requireNonNull(entityType, "entityType");
        }
    }

    record EffectDefinitionChanged(String campaignId, String branchId, String effectId)
            implements InvalidationScope {
    }
}
