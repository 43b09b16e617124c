/*
 * Copyright (c) 2025 Chronicle Rule Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.chronicle.ruleengine.api.exceptions;

public class EntityNotFoundException extends RuleEngineException {

    private final String entityType;
    private final String entityId;

    public EntityNotFoundException(String entityType, String entityId) {
        super(ErrorCode.ENTITY_NOT_FOUND, String.format("%s '%s' not found", entityType, entityId));
        this.entityType = entityType;
        this.entityId = entityId;
    }

    public String getEntityType() {
        return entityType;
    }

    public String getEntityId() {
        return entityId;
    }
}
