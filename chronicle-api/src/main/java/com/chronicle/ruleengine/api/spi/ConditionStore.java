/*
 * Copyright (c) 2025 Chronicle Rule Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.chronicle.ruleengine.api.spi;

import com.chronicle.ruleengine.api.model.Condition;

import java.util.List;
import java.util.Optional;

public interface ConditionStore {

    /** Live conditions bound to the entity plus live type-wide conditions for its type. */
    List<Condition> findActiveForEntity(String entityType, String entityId);

    List<Condition> findActiveByCampaign(String campaignId);

    Optional<Condition> findById(String id);

    Condition save(Condition condition);
}
