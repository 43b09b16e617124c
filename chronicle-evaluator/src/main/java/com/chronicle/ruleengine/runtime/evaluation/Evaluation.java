/*
 * Copyright (c) 2025 Chronicle Rule Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.chronicle.ruleengine.runtime.evaluation;

import com.chronicle.ruleengine.api.exceptions.RuleEngineException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.NullNode;

/**
 * Outcome of one expression evaluation: either a value or the error that prevented it.
 */
public record Evaluation(JsonNode value, RuleEngineException error) {

    public static Evaluation success(JsonNode value) {
        return new Evaluation(value == null || value.isMissingNode() ? NullNode.getInstance() : value, null);
    }

    public static Evaluation failure(RuleEngineException error) {
        return new Evaluation(null, error);
    }

    public boolean isSuccess() {
        return error == null;
    }

    /** The value, or JSON null on failure. */
    public JsonNode valueOrNull() {
        return isSuccess() ? value : NullNode.getInstance();
    }

    public String errorMessage() {
        return error == null ? null : error.getMessage();
    }
}
