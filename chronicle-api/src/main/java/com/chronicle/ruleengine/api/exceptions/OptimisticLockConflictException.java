/*
 * Copyright (c) 2025 Chronicle Rule Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.chronicle.ruleengine.api.exceptions;

/**
 * Version mismatch on a versioned write. Never retried by the engine.
 */
public class OptimisticLockConflictException extends RuleEngineException {

    private final String id;
    private final long expectedVersion;
    private final long actualVersion;

    public OptimisticLockConflictException(String id, long expectedVersion, long actualVersion) {
        super(ErrorCode.OPTIMISTIC_LOCK_CONFLICT, String.format(
                "Version conflict on '%s': expected %d but found %d", id, expectedVersion, actualVersion));
        this.id = id;
        this.expectedVersion = expectedVersion;
        this.actualVersion = actualVersion;
    }

    public String getId() {
        return id;
    }

    public long getExpectedVersion() {
        return expectedVersion;
    }

    public long getActualVersion() {
        return actualVersion;
    }
}
