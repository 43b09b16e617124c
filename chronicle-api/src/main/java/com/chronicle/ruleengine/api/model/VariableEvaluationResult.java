/*
 * Copyright (c) 2025 Chronicle Rule Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.chronicle.ruleengine.api.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.JsonNode;

import java.io.Serializable;

/**
 * Result of evaluating a single state variable. {@code trace} is {@code null} unless requested.
 */
public record VariableEvaluationResult(
        @JsonProperty("success") boolean success,
        @JsonProperty("value") JsonNode value,
        @JsonProperty("error") String error,
        @JsonProperty("trace") EvaluationTrace trace
) implements Serializable {

    public static VariableEvaluationResult success(JsonNode value, EvaluationTrace trace) {
        return new VariableEvaluationResult(true, value, null, trace);
    }

    public static VariableEvaluationResult failure(String error, EvaluationTrace trace) {
        return new VariableEvaluationResult(false, null, error, trace);
    }
}
