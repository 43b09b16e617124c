/*
 * Copyright (c) 2025 Chronicle Rule Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.chronicle.ruleengine.api.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.io.Serializable;
import java.util.List;

/**
 * Authoring-time verdict on an expression or definition.
 */
public record ValidationResult(
        @JsonProperty("status") Status status,
        @JsonProperty("message") String message,
        @JsonProperty("cycle_path") List<String> cyclePath,
        @JsonProperty("depth") int depth
) implements Serializable {

    public enum Status {
        OK,
        CIRCULAR_DEPENDENCY,
        FORMULA_TOO_COMPLEX,
        INVALID
    }

    public static ValidationResult ok(int depth) {
        return new ValidationResult(Status.OK, null, List.of(), depth);
    }

    public static ValidationResult circularDependency(List<String> cyclePath) {
        return new ValidationResult(Status.CIRCULAR_DEPENDENCY,
                "Circular dependency: " + String.join(" -> ", cyclePath), List.copyOf(cyclePath), 0);
    }

    public static ValidationResult formulaTooComplex(int depth, int maxDepth) {
        return new ValidationResult(Status.FORMULA_TOO_COMPLEX,
                String.format("Expression depth %d exceeds maximum of %d", depth, maxDepth), List.of(), depth);
    }

    public static ValidationResult invalid(String message) {
        return new ValidationResult(Status.INVALID, message, List.of(), 0);
    }

    public boolean isOk() {
        return status == Status.OK;
    }
}
