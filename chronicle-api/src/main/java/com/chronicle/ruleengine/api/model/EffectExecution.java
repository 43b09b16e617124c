/*
 * Copyright (c) 2025 Chronicle Rule Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.chronicle.ruleengine.api.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.JsonNode;

import java.io.Serializable;
import java.time.Instant;
import java.util.List;

/**
 * Append-only audit record of one effect execution attempt.
 */
public record EffectExecution(
        @JsonProperty("id") String id,
        @JsonProperty("effect_id") String effectId,
        @JsonProperty("entity_type") String entityType,
        @JsonProperty("entity_id") String entityId,
        @JsonProperty("executed_by") String executedBy,
        @JsonProperty("executed_at") Instant executedAt,
        @JsonProperty("context_snapshot") JsonNode contextSnapshot,
        @JsonProperty("status") EffectExecutionStatus status,
        @JsonProperty("applied_patch") List<PatchOperation> appliedPatch,
        @JsonProperty("affected_fields") List<String> affectedFields,
        @JsonProperty("error") String error
) implements Serializable {

    public EffectExecution {
        appliedPatch = appliedPatch == null ? List.of() : List.copyOf(appliedPatch);
        affectedFields = affectedFields == null ? List.of() : List.copyOf(affectedFields);
    }

    public boolean succeeded() {
        return status == EffectExecutionStatus.SUCCEEDED;
    }
}
