/*
 * Copyright (c) 2025 Chronicle Rule Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.chronicle.ruleengine.service;

import com.chronicle.ruleengine.api.exceptions.CircularDependencyException;
import com.chronicle.ruleengine.api.exceptions.EvaluationException;
import com.chronicle.ruleengine.api.exceptions.FormulaTooComplexException;
import com.chronicle.ruleengine.api.model.ValidationResult;

/**
 * Turns a failed {@link ValidationResult} into the matching exception.
 */
final class ValidationFailures {

    private ValidationFailures() {
    }

    static void raiseIfInvalid(ValidationResult result, int maxDepth) {
        switch (result.status()) {
            case OK -> {
            }
            case CIRCULAR_DEPENDENCY -> throw new CircularDependencyException(result.cyclePath());
            case FORMULA_TOO_COMPLEX -> throw new FormulaTooComplexException(result.depth(), maxDepth);
            default -> throw new EvaluationException(result.message());
        }
    }
}
