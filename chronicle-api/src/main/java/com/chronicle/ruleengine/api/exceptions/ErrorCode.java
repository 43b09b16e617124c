/*
 * Copyright (c) 2025 Chronicle Rule Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.chronicle.ruleengine.api.exceptions;

/**
 * Stable identifiers for the failure kinds the engine reports.
 */
public enum ErrorCode {
    ENTITY_NOT_FOUND,
    FORMULA_TOO_COMPLEX,
    CIRCULAR_DEPENDENCY,
    FORBIDDEN_PATH,
    OPTIMISTIC_LOCK_CONFLICT,
    EVALUATION_ERROR,
    STORE_UNAVAILABLE
}
