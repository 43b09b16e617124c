/*
 * Copyright (c) 2025 Chronicle Rule Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.chronicle.ruleengine.api.spi;

import com.chronicle.ruleengine.api.model.ExpressionNode;
import com.chronicle.ruleengine.api.model.StateVariable;
import com.chronicle.ruleengine.api.model.VariableScope;
import com.fasterxml.jackson.databind.JsonNode;

import java.util.List;
import java.util.Optional;

public interface VariableStore {

    /** Live variables attached to one entity. */
    List<StateVariable> findByScope(VariableScope scope, String scopeId);

    Optional<StateVariable> findById(String id);

    /** Live variables of a campaign, across all scopes. */
    List<StateVariable> findActiveByCampaign(String campaignId);

    /**
     * Inserts a new variable.
     *
     * @throws IllegalStateException if a live variable with the same scope, scopeId and key exists
     */
    StateVariable save(StateVariable variable);

    /**
     * Versioned update. Exactly one of {@code value} and {@code formula} must be non-null.
     *
     * @throws com.chronicle.ruleengine.api.exceptions.OptimisticLockConflictException on version mismatch
     * @throws com.chronicle.ruleengine.api.exceptions.EntityNotFoundException if the variable does not exist
     */
    StateVariable update(String id, JsonNode value, ExpressionNode formula, long expectedVersion);

    /**
     * Tombstones the variable.
     *
     * @throws com.chronicle.ruleengine.api.exceptions.OptimisticLockConflictException on version mismatch
     */
    StateVariable softDelete(String id, long expectedVersion);
}
