/*
 * Copyright (c) 2025 Chronicle Rule Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.chronicle.ruleengine.api.model;

import java.util.Locale;

/**
 * Entity kinds a {@link StateVariable} can be attached to.
 */
public enum VariableScope {
    WORLD,
    CAMPAIGN,
    KINGDOM,
    SETTLEMENT,
    STRUCTURE,
    PARTY,
    CHARACTER,
    LOCATION,
    EVENT,
    ENCOUNTER;

    /** Lower-case entity type used in contexts and cache keys. */
    public String entityType() {
        return name().toLowerCase(Locale.ROOT);
    }

    public static VariableScope fromEntityType(String entityType) {
        return valueOf(entityType.toUpperCase(Locale.ROOT));
    }
}
