/*
 * Copyright (c) 2025 Chronicle Rule Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.chronicle.ruleengine.service;

import com.chronicle.ruleengine.api.exceptions.EntityNotFoundException;
import com.chronicle.ruleengine.api.model.Effect;
import com.chronicle.ruleengine.api.model.InvalidationScope;
import com.chronicle.ruleengine.api.spi.EffectStore;
import com.chronicle.ruleengine.engine.CampaignRuleEngine;

import java.time.Clock;
import java.util.logging.Logger;

/**
 * Authoring of effects. Patch paths are checked against the whitelist at write time, so a
 * persisted effect only fails at execution when the entity itself rejects the patch.
 */
public class EffectService {

    private static final Logger logger = Logger.getLogger(EffectService.class.getName());

    private final EffectStore store;
    private final CampaignRuleEngine engine;
    private final Clock clock;

    public EffectService(EffectStore store, CampaignRuleEngine engine, Clock clock) {
        this.store = store;
        this.engine = engine;
        this.clock = clock;
    }

    /**
     * @throws com.chronicle.ruleengine.api.exceptions.ForbiddenPathException      if a path is not patchable
     * @throws com.chronicle.ruleengine.api.exceptions.CircularDependencyException if the effect closes a cycle
     */
    public Effect create(Effect effect, String branchId) {
        validate(effect, branchId);
        Effect saved = store.save(effect);
        changed(saved, branchId);
        logger.info(String.format("Created effect %s (%s) on %s, timing %s, priority %d",
                saved.id(), saved.name(), saved.entityType(), saved.timing(), saved.priority()));
        return saved;
    }

    public Effect update(Effect effect, String branchId) {
        require(effect.id());
        validate(effect, branchId);
        Effect saved = store.save(effect);
        changed(saved, branchId);
        return saved;
    }

    public Effect delete(String effectId, String branchId) {
        Effect current = require(effectId);
        Effect saved = store.save(new Effect(current.id(), current.campaignId(), current.name(),
                current.entityType(), current.entityId(), current.payload(), current.timing(),
                current.priority(), current.active(), clock.instant(), current.createdAt()));
        changed(saved, branchId);
        logger.info(String.format("Deleted effect %s", effectId));
        return saved;
    }

    private void validate(Effect candidate, String branchId) {
        engine.getPathPolicy().validate(candidate.entityType(), candidate.payload());
        ValidationFailures.raiseIfInvalid(engine.validateEffect(candidate, branchId),
                engine.getValidator().getMaxDepth());
    }

    private Effect require(String effectId) {
        return store.findById(effectId)
                .filter(Effect::isLive)
                .orElseThrow(() -> new EntityNotFoundException("effect", effectId));
    }

    private void changed(Effect effect, String branchId) {
        engine.invalidate(new InvalidationScope.EffectDefinitionChanged(effect.campaignId(), branchId, effect.id()));
    }
}
