/*
 * Copyright (c) 2025 Chronicle Rule Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.chronicle.ruleengine.service;

import com.chronicle.ruleengine.api.exceptions.EntityNotFoundException;
import com.chronicle.ruleengine.api.model.ExpressionNode;
import com.chronicle.ruleengine.api.model.InvalidationScope;
import com.chronicle.ruleengine.api.model.StateVariable;
import com.chronicle.ruleengine.api.spi.VariableStore;
import com.chronicle.ruleengine.engine.CampaignRuleEngine;
import com.fasterxml.jackson.databind.JsonNode;

import java.util.Objects;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Authoring of state variables.
 *
 * <p>Updates are versioned: a stale {@code expectedVersion} surfaces as
 * {@link com.chronicle.ruleengine.api.exceptions.OptimisticLockConflictException} and is never retried.
 * A value change invalidates the readers of the variable; a change in the set of derived formulas
 * also drops the campaign graph.
 */
public class StateVariableService {

    private static final Logger logger = Logger.getLogger(StateVariableService.class.getName());

    private final VariableStore store;
    private final CampaignRuleEngine engine;

    public StateVariableService(VariableStore store, CampaignRuleEngine engine) {
        this.store = store;
        this.engine = engine;
    }

    public StateVariable create(StateVariable variable, String branchId) {
        validate(variable, branchId);
        StateVariable saved = store.save(variable);
        changed(saved, branchId, true);
        logger.info(String.format("Created %s variable %s (%s) on %s '%s'",
                saved.isDerived() ? "derived" : "stored", saved.id(), saved.key(), saved.scope(), saved.scopeId()));
        return saved;
    }

    public StateVariable updateValue(String variableId, JsonNode value, long expectedVersion, String branchId) {
        Objects.requireNonNull(value, "value");
        StateVariable current = require(variableId);
        StateVariable saved = store.update(variableId, value, null, expectedVersion);
        if (current.isDerived()) {
            engine.evictDerivedValue(variableId, branchId);
        }
        changed(saved, branchId, current.isDerived());
        return saved;
    }

    public StateVariable updateFormula(String variableId, ExpressionNode formula, long expectedVersion,
                                       String branchId) {
        Objects.requireNonNull(formula, "formula");
        StateVariable current = require(variableId);
        validate(current.withFormula(formula), branchId);
        StateVariable saved = store.update(variableId, null, formula, expectedVersion);
        changed(saved, branchId, true);
        return saved;
    }

    public StateVariable delete(String variableId, long expectedVersion, String branchId) {
        StateVariable current = require(variableId);
        StateVariable saved = store.softDelete(variableId, expectedVersion);
        if (current.isDerived()) {
            engine.evictDerivedValue(variableId, branchId);
        }
        changed(saved, branchId, true);
        logger.info(String.format("Deleted variable %s", variableId));
        return saved;
    }

    private void validate(StateVariable candidate, String branchId) {
        ValidationFailures.raiseIfInvalid(engine.validateVariable(candidate, branchId),
                engine.getValidator().getMaxDepth());
    }

    private StateVariable require(String variableId) {
        return store.findById(variableId)
                .filter(StateVariable::isLive)
                .orElseThrow(() -> new EntityNotFoundException("variable", variableId));
    }

    private void changed(StateVariable variable, String branchId, boolean structural) {
        if (structural && engine.getGraphManager().invalidateGraph(variable.campaignId(), branchId)
                && logger.isLoggable(Level.FINE)) {
            logger.fine(String.format("Variable %s changed the graph of %s/%s", variable.id(),
                    variable.campaignId(), branchId));
        }
        engine.invalidate(new InvalidationScope.VariableChanged(variable.campaignId(), branchId,
                variable.scopeEntityType(), variable.scopeId(), variable.key()));
    }
}
