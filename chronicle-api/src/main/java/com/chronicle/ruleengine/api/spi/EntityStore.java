/*
 * Copyright (c) 2025 Chronicle Rule Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.chronicle.ruleengine.api.spi;

import com.chronicle.ruleengine.api.model.EntitySnapshot;
import com.chronicle.ruleengine.api.model.PatchOperation;

import java.util.List;
import java.util.Optional;

/**
 * Read and patch access to campaign entities (settlements, structures, kingdoms, encounters, events).
 * Entity types are lower-case. Soft-deleted entities are never returned.
 */
public interface EntityStore {

    /**
     * @throws com.chronicle.ruleengine.api.exceptions.StoreUnavailableException on I/O failure
     */
    Optional<EntitySnapshot> load(String entityType, String entityId);

    /**
     * Persists a patch computed against {@code expectedVersion}.
     *
     * @return the updated snapshot
     * @throws com.chronicle.ruleengine.api.exceptions.EntityNotFoundException if the entity is gone
     * @throws com.chronicle.ruleengine.api.exceptions.OptimisticLockConflictException if the version moved
     * @throws com.chronicle.ruleengine.api.exceptions.StoreUnavailableException on I/O failure
     */
    EntitySnapshot applyPatch(String entityType, String entityId, List<PatchOperation> patch, long expectedVersion);
}
