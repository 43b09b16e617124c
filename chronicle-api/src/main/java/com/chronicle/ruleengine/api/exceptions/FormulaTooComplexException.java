/*
 * Copyright (c) 2025 Chronicle Rule Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.chronicle.ruleengine.api.exceptions;

/**
 * Raised when an expression tree is deeper than the configured limit.
 */
public class FormulaTooComplexException extends RuleEngineException {

    private final int depth;
    private final int maxDepth;

    public FormulaTooComplexException(int depth, int maxDepth) {
        super(ErrorCode.FORMULA_TOO_COMPLEX,
                String.format("Expression depth %d exceeds maximum of %d", depth, maxDepth));
        this.depth = depth;
        this.maxDepth = maxDepth;
    }

    public int getDepth() {
        return depth;
    }

    public int getMaxDepth() {
        return maxDepth;
    }
}
