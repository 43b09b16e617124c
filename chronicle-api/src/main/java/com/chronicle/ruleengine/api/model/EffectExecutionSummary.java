/*
 * Copyright (c) 2025 Chronicle Rule Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.chronicle.ruleengine.api.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.io.Serializable;
import java.util.List;

/**
 * Outcome of a batch of effect executions, in execution order.
 */
public record EffectExecutionSummary(
        @JsonProperty("total") int total,
        @JsonProperty("succeeded") int succeeded,
        @JsonProperty("failed") int failed,
        @JsonProperty("details") List<EffectExecution> details,
        @JsonProperty("execution_order") List<String> executionOrder
) implements Serializable {

    public static EffectExecutionSummary of(List<EffectExecution> details, List<String> executionOrder) {
        int ok = (int) details.stream().filter(EffectExecution::succeeded).count();
        return new EffectExecutionSummary(details.size(), ok, details.size() - ok,
                List.copyOf(details), List.copyOf(executionOrder));
    }

    public static EffectExecutionSummary empty() {
        return new EffectExecutionSummary(0, 0, 0, List.of(), List.of());
    }
}
