/*
 * Copyright (c) 2025 Chronicle Rule Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.chronicle.ruleengine.service;

import com.chronicle.ruleengine.api.exceptions.EntityNotFoundException;
import com.chronicle.ruleengine.api.exceptions.OptimisticLockConflictException;
import com.chronicle.ruleengine.api.model.Condition;
import com.chronicle.ruleengine.api.model.ExpressionNode;
import com.chronicle.ruleengine.api.model.InvalidationScope;
import com.chronicle.ruleengine.api.spi.ConditionStore;
import com.chronicle.ruleengine.engine.CampaignRuleEngine;

import java.time.Clock;
import java.util.logging.Logger;

/**
 * Authoring of conditions. Every write is validated against the campaign graph before it is
 * persisted, and the cached fields it may change are invalidated afterwards.
 */
public class ConditionService {

    private static final Logger logger = Logger.getLogger(ConditionService.class.getName());

    private final ConditionStore store;
    private final CampaignRuleEngine engine;
    private final Clock clock;

    public ConditionService(ConditionStore store, CampaignRuleEngine engine, Clock clock) {
        this.store = store;
        this.engine = engine;
        this.clock = clock;
    }

    /**
     * @throws com.chronicle.ruleengine.api.exceptions.CircularDependencyException if the condition closes a cycle
     * @throws com.chronicle.ruleengine.api.exceptions.FormulaTooComplexException  if the expression is too deep
     */
    public Condition create(Condition condition, String branchId) {
        validate(condition, branchId);
        Condition saved = store.save(condition);
        changed(saved, branchId);
        logger.info(String.format("Created condition %s (%s) for %s", saved.id(), saved.field(), target(saved)));
        return saved;
    }

    public Condition update(String conditionId, ExpressionNode expression, long expectedVersion, String branchId) {
        Condition current = require(conditionId, expectedVersion);
        Condition candidate = current.withExpression(expression);
        validate(candidate, branchId);
        Condition saved = store.save(candidate);
        changed(saved, branchId);
        return saved;
    }

    public Condition delete(String conditionId, long expectedVersion, String branchId) {
        Condition current = require(conditionId, expectedVersion);
        Condition saved = store.save(current.softDeleted(clock.instant()));
        changed(saved, branchId);
        logger.info(String.format("Deleted condition %s", conditionId));
        return saved;
    }

    private void validate(Condition candidate, String branchId) {
        ValidationFailures.raiseIfInvalid(engine.validateCondition(candidate, branchId),
                engine.getValidator().getMaxDepth());
    }

    private Condition require(String conditionId, long expectedVersion) {
        Condition current = store.findById(conditionId)
                .filter(Condition::isLive)
                .orElseThrow(() -> new EntityNotFoundException("condition", conditionId));
        if (current.version() != expectedVersion) {
            throw new OptimisticLockConflictException(conditionId, expectedVersion, current.version());
        }
        return current;
    }

    private void changed(Condition condition, String branchId) {
        engine.invalidate(new InvalidationScope.ConditionDefinitionChanged(condition.campaignId(), branchId,
                condition.id(), condition.entityType(), condition.entityId()));
    }

    private static String target(Condition condition) {
        return condition.isTypeWide() ? "every " + condition.entityType()
                : condition.entityType() + " '" + condition.entityId() + "'";
    }
}
