/*
 * Copyright (c) 2025 Chronicle Rule Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.chronicle.ruleengine.api.model;

/**
 * Phase of encounter or event resolution in which an effect runs.
 */
public enum EffectTiming {
    PRE,
    ON_RESOLVE,
    POST
}
