/*
 * Copyright (c) 2025 Chronicle Rule Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.chronicle.ruleengine.api.exceptions;

/**
 * Base class of every failure raised by the rule engine.
 *
 * <p>All engine exceptions are unchecked; each carries an {@link ErrorCode} so callers can
 * map failures without {@code instanceof} chains.
 */
public class RuleEngineException extends RuntimeException {

    private final ErrorCode errorCode;

    public RuleEngineException(ErrorCode errorCode, String message) {
        super(message);
        this.errorCode = errorCode;
    }

    public RuleEngineException(ErrorCode errorCode, String message, Throwable cause) {
        super(message, cause);
        this.errorCode = errorCode;
    }

    public ErrorCode getErrorCode() {
        return errorCode;
    }
}
