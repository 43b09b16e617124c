/*
 * Copyright (c) 2025 Chronicle Rule Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.chronicle.ruleengine.api.exceptions;

import java.util.List;

/**
 * Raised at authoring time when a definition would close a cycle in the dependency graph.
 * The cycle path starts and ends with the same node key.
 */
public class CircularDependencyException extends RuleEngineException {

    private final List<String> cyclePath;

    public CircularDependencyException(List<String> cyclePath) {
        super(ErrorCode.CIRCULAR_DEPENDENCY, "Circular dependency detected: " + String.join(" -> ", cyclePath));
        this.cyclePath = List.copyOf(cyclePath);
    }

    public List<String> getCyclePath() {
        return cyclePath;
    }
}
