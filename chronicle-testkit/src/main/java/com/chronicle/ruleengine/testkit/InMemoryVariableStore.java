/*
 * Copyright (c) 2025 Chronicle Rule Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.chronicle.ruleengine.testkit;

import com.chronicle.ruleengine.api.exceptions.EntityNotFoundException;
import com.chronicle.ruleengine.api.exceptions.OptimisticLockConflictException;
import com.chronicle.ruleengine.api.model.ExpressionNode;
import com.chronicle.ruleengine.api.model.StateVariable;
import com.chronicle.ruleengine.api.model.VariableScope;
import com.chronicle.ruleengine.api.spi.VariableStore;
import com.fasterxml.jackson.databind.JsonNode;

import java.time.Instant;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.stream.Collectors;

public class InMemoryVariableStore implements VariableStore {

    private final Map<String, StateVariable> variables = new ConcurrentHashMap<>();

    @Override
    public List<StateVariable> findByScope(VariableScope scope, String scopeId) {
        return variables.values().stream()
                .filter(StateVariable::isLive)
                .filter(v -> v.scope() == scope && v.scopeId().equals(scopeId))
                .sorted(Comparator.comparing(StateVariable::createdAt).thenComparing(StateVariable::id))
                .collect(Collectors.toList());
    }

    @Override
    public Optional<StateVariable> findById(String id) {
        return Optional.ofNullable(variables.get(id));
    }

    @Override
    public List<StateVariable> findActiveByCampaign(String campaignId) {
        return variables.values().stream()
                .filter(StateVariable::isLive)
                .filter(v -> campaignId.equals(v.campaignId()))
                .sorted(Comparator.comparing(StateVariable::createdAt).thenComparing(StateVariable::id))
                .collect(Collectors.toList());
    }

    @Override
    public synchronized StateVariable save(StateVariable variable) {
        boolean duplicate = variables.values().stream()
                .filter(StateVariable::isLive)
                .filter(v -> !v.id().equals(variable.id()))
                .anyMatch(v -> v.scope() == variable.scope()
                        && v.scopeId().equals(variable.scopeId())
                        && v.key().equals(variable.key()));
        if (duplicate) {
            throw new IllegalStateException("Variable '" + variable.key() + "' already exists on "
                    + variable.scope() + " " + variable.scopeId());
        }
        variables.put(variable.id(), variable);
        return variable;
    }

    @Override
    public synchronized StateVariable update(String id, JsonNode value, ExpressionNode formula, long expectedVersion) {
        StateVariable current = current(id, expectedVersion);
        StateVariable updated = formula != null ? current.withFormula(formula) : current.withValue(value);
        variables.put(id, updated);
        return updated;
    }

    @Override
    public synchronized StateVariable softDelete(String id, long expectedVersion) {
        StateVariable deleted = current(id, expectedVersion).softDeleted(Instant.now());
        variables.put(id, deleted);
        return deleted;
    }

    private StateVariable current(String id, long expectedVersion) {
        StateVariable current = variables.get(id);
        if (current == null || !current.isLive()) {
            throw new EntityNotFoundException("variable", id);
        }
        if (current.version() != expectedVersion) {
            throw new OptimisticLockConflictException(id, expectedVersion, current.version());
        }
        return current;
    }
}
