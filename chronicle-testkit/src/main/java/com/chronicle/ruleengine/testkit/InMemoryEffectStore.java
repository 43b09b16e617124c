/*
 * Copyright (c) 2025 Chronicle Rule Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.chronicle.ruleengine.testkit;

import com.chronicle.ruleengine.api.model.Effect;
import com.chronicle.ruleengine.api.model.EffectTiming;
import com.chronicle.ruleengine.api.spi.EffectStore;

import java.util.Collection;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.stream.Collectors;

public class InMemoryEffectStore implements EffectStore {

    private final Map<String, Effect> effects = new ConcurrentHashMap<>();

    @Override
    public List<Effect> findActive(String entityType, String entityId, EffectTiming timing) {
        return effects.values().stream()
                .filter(Effect::isLive)
                .filter(e -> e.entityType().equals(entityType) && Objects.equals(e.entityId(), entityId))
                .filter(e -> e.timing() == timing)
                .sorted(Comparator.comparing(Effect::createdAt).thenComparing(Effect::id))
                .collect(Collectors.toList());
    }

    @Override
    public List<Effect> findByIds(Collection<String> ids) {
        return ids.stream()
                .map(effects::get)
                .filter(Objects::nonNull)
                .filter(Effect::isLive)
                .collect(Collectors.toList());
    }

    @Override
    public List<Effect> findActiveByCampaign(String campaignId) {
        return effects.values().stream()
                .filter(Effect::isLive)
                .filter(e -> campaignId.equals(e.campaignId()))
                .sorted(Comparator.comparing(Effect::createdAt).thenComparing(Effect::id))
                .collect(Collectors.toList());
    }

    @Override
    public Optional<Effect> findById(String id) {
        return Optional.ofNullable(effects.get(id));
    }

    @Override
    public Effect save(Effect effect) {
        effects.put(effect.id(), effect);
        return effect;
    }
}
