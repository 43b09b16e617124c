/*
 * Copyright (c) 2025 Chronicle Rule Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.chronicle.ruleengine.api.exceptions;

/**
 * Operator applied to incompatible operands, unknown operator, or malformed expression JSON.
 */
public class EvaluationException extends RuleEngineException {

    public EvaluationException(String message) {
        super(ErrorCode.EVALUATION_ERROR, message);
    }

    public EvaluationException(String message, Throwable cause) {
        super(ErrorCode.EVALUATION_ERROR, message, cause);
    }
}
