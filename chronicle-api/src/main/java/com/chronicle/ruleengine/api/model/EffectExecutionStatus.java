/*
 * Copyright (c) 2025 Chronicle Rule Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.chronicle.ruleengine.api.model;

public enum EffectExecutionStatus {
    PENDING,
    APPLYING,
    SUCCEEDED,
    FAILED
}
