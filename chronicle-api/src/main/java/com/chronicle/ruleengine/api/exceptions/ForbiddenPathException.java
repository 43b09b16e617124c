/*
 * Copyright (c) 2025 Chronicle Rule Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.chronicle.ruleengine.api.exceptions;

public class ForbiddenPathException extends RuleEngineException {

    private final String path;
    private final String entityType;

    public ForbiddenPathException(String entityType, String path, String reason) {
        super(ErrorCode.FORBIDDEN_PATH, String.format("Path '%s' on %s is not patchable: %s", path, entityType, reason));
        this.path = path;
        this.entityType = entityType;
    }

    public String getPath() {
        return path;
    }

    public String getEntityType() {
        return entityType;
    }
}
