/*
 * Copyright (c) 2025 Chronicle Rule Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.chronicle.ruleengine.api.model;

import java.util.List;
import java.util.Set;

/**
 * Proposed definitions layered over the stored ones when compiling a candidate graph for validation.
 * An entry replaces the stored definition with the same id; {@code removedIds} hides stored definitions.
 */
public record GraphOverlay(
        List<Condition> conditions,
        List<StateVariable> variables,
        List<Effect> effects,
        Set<String> removedIds
) {
    public GraphOverlay {
        conditions = conditions == null ? List.of() : List.copyOf(conditions);
        variables = variables == null ? List.of() : List.copyOf(variables);
        effects = effects == null ? List.of() : List.copyOf(effects);
        removedIds = removedIds == null ? Set.of() : Set.copyOf(removedIds);
    }

    public static GraphOverlay none() {
        return new GraphOverlay(List.of(), List.of(), List.of(), Set.of());
    }

    public static GraphOverlay withCondition(Condition condition) {
        return new GraphOverlay(List.of(condition), List.of(), List.of(), Set.of());
    }

    public static GraphOverlay withVariable(StateVariable variable) {
        return new GraphOverlay(List.of(), List.of(variable), List.of(), Set.of());
    }

    public static GraphOverlay withEffect(Effect effect) {
        return new GraphOverlay(List.of(), List.of(), List.of(effect), Set.of());
    }

    public boolean isEmpty() {
        return conditions.isEmpty() && variables.isEmpty() && effects.isEmpty() && removedIds.isEmpty();
    }
}
