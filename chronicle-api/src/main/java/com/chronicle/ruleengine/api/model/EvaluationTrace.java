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
 * Step-by-step explanation of a variable evaluation, for debugging formulas.
 *
 * <h2>Usage</h2>
 * <pre>
 * VariableEvaluationResult result = engine.evaluateVariable("var-1", "main", null, true);
 * for (EvaluationTrace.Step step : result.trace().steps()) {
 *     System.out.println(step.step() + ". " + step.description() + " passed=" + step.passed());
 * }
 * </pre>
 */
public record EvaluationTrace(
        @JsonProperty("variable_id") String variableId,
        @JsonProperty("formula") JsonNode formula,
        @JsonProperty("steps") List<Step> steps,
        @JsonProperty("total_duration_nanos") long totalDurationNanos
) implements Serializable {

    public record Step(
            @JsonProperty("step") int step,
            @JsonProperty("description") String description,
            @JsonProperty("input") JsonNode input,
            @JsonProperty("output") JsonNode output,
            @JsonProperty("passed") boolean passed
    ) implements Serializable {
    }

    public boolean allPassed() {
        return steps.stream().allMatch(Step::passed);
    }
}
