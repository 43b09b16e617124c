/*
 * Copyright (c) 2025 Chronicle Rule Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.chronicle.ruleengine.api.model;

import java.util.List;

/**
 * Cycles found in a dependency graph. Each cycle lists node keys and repeats its first key at the end.
 */
public record CycleReport(List<List<String>> cycles) {

    public CycleReport {
        cycles = cycles == null ? List.of() : cycles.stream().map(List::copyOf).toList();
    }

    public static CycleReport none() {
        return new CycleReport(List.of());
    }

    public boolean hasCycles() {
        return !cycles.isEmpty();
    }
}
