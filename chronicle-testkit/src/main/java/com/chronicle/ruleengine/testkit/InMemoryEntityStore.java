/*
 * Copyright (c) 2025 Chronicle Rule Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.chronicle.ruleengine.testkit;

import com.chronicle.ruleengine.api.exceptions.EntityNotFoundException;
import com.chronicle.ruleengine.api.exceptions.OptimisticLockConflictException;
import com.chronicle.ruleengine.api.exceptions.StoreUnavailableException;
import com.chronicle.ruleengine.api.model.EntitySnapshot;
import com.chronicle.ruleengine.api.model.PatchOperation;
import com.chronicle.ruleengine.api.spi.EntityStore;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.BiFunction;

/**
 * Map-backed {@link EntityStore}. Patches are applied by a pluggable function so this module stays
 * independent of the engine's patch implementation.
 */
public class InMemoryEntityStore implements EntityStore {

    private final Map<String, EntitySnapshot> entities = new ConcurrentHashMap<>();
    private final AtomicInteger loadCount = new AtomicInteger();
    private volatile BiFunction<ObjectNode, List<PatchOperation>, ObjectNode> patcher = (doc, patch) -> {
        throw new UnsupportedOperationException("No patcher configured");
    };
    private volatile boolean unavailable;

    public InMemoryEntityStore withPatcher(BiFunction<ObjectNode, List<PatchOperation>, ObjectNode> patcher) {
        this.patcher = patcher;
        return this;
    }

    public EntitySnapshot put(String entityType, String entityId, String campaignId, ObjectNode data) {
        EntitySnapshot snapshot = new EntitySnapshot(entityType, entityId, campaignId, data.deepCopy(), 1);
        entities.put(key(entityType, entityId), snapshot);
        return snapshot;
    }

    public void remove(String entityType, String entityId) {
        entities.remove(key(entityType, entityId));
    }

    /** Makes every subsequent call fail with {@link StoreUnavailableException}. */
    public void setUnavailable(boolean unavailable) {
        this.unavailable = unavailable;
    }

    public int getLoadCount() {
        return loadCount.get();
    }

    @Override
    public Optional<EntitySnapshot> load(String entityType, String entityId) {
        checkAvailable();
        loadCount.incrementAndGet();
        EntitySnapshot snapshot = entities.get(key(entityType, entityId));
        return Optional.ofNullable(snapshot).map(InMemoryEntityStore::copy);
    }

    @Override
    public synchronized EntitySnapshot applyPatch(String entityType, String entityId,
                                                  List<PatchOperation> patch, long expectedVersion) {
        checkAvailable();
        EntitySnapshot current = entities.get(key(entityType, entityId));
        if (current == null) {
            throw new EntityNotFoundException(entityType, entityId);
        }
        if (current.version() != expectedVersion) {
            throw new OptimisticLockConflictException(entityId, expectedVersion, current.version());
        }
        ObjectNode patched = patcher.apply(current.data().deepCopy(), patch);
        EntitySnapshot updated = new EntitySnapshot(entityType, entityId, current.campaignId(),
                patched, current.version() + 1);
        entities.put(key(entityType, entityId), updated);
        return copy(updated);
    }

    private void checkAvailable() {
        if (unavailable) {
            throw new StoreUnavailableException("entity store offline");
        }
    }

    private static EntitySnapshot copy(EntitySnapshot snapshot) {
        return new EntitySnapshot(snapshot.entityType(), snapshot.entityId(), snapshot.campaignId(),
                snapshot.data().deepCopy(), snapshot.version());
    }

    private static String key(String entityType, String entityId) {
        return entityType + ":" + entityId;
    }
}
