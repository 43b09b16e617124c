/*
 * Copyright (c) 2025 Chronicle Rule Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.chronicle.ruleengine.testkit;

import com.chronicle.ruleengine.api.model.Condition;
import com.chronicle.ruleengine.api.spi.ConditionStore;

import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.stream.Collectors;

public class InMemoryConditionStore implements ConditionStore {

    private final Map<String, Condition> conditions = new ConcurrentHashMap<>();

    @Override
    public List<Condition> findActiveForEntity(String entityType, String entityId) {
        return conditions.values().stream()
                .filter(Condition::isLive)
                .filter(c -> c.appliesTo(entityType, entityId))
                .sorted(Comparator.comparing(Condition::createdAt).thenComparing(Condition::id))
                .collect(Collectors.toList());
    }

    @Override
    public List<Condition> findActiveByCampaign(String campaignId) {
        return conditions.values().stream()
                .filter(Condition::isLive)
                .filter(c -> c.campaignId().equals(campaignId))
                .sorted(Comparator.comparing(Condition::createdAt).thenComparing(Condition::id))
                .collect(Collectors.toList());
    }

    @Override
    public Optional<Condition> findById(String id) {
        return Optional.ofNullable(conditions.get(id));
    }

    @Override
    public Condition save(Condition condition) {
        conditions.put(condition.id(), condition);
        return condition;
    }
}
