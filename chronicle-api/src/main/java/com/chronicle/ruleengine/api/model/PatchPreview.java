/*
 * Copyright (c) 2025 Chronicle Rule Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.chronicle.ruleengine.api.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.JsonNode;

import java.io.Serializable;
import java.util.List;

/**
 * Dry-run result of applying an effect: entity before and after, without persisting anything.
 */
public record PatchPreview(
        @JsonProperty("effect_id") String effectId,
        @JsonProperty("before") JsonNode before,
        @JsonProperty("after") JsonNode after,
        @JsonProperty("changed_fields") List<String> changedFields,
        @JsonProperty("errors") List<String> errors
) implements Serializable {

    public boolean isValid() {
        return errors.isEmpty();
    }
}
