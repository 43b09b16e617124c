/*
 * Copyright (c) 2025 Chronicle Rule Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.chronicle.ruleengine.runtime.context;

import com.chronicle.ruleengine.api.exceptions.EntityNotFoundException;
import com.chronicle.ruleengine.api.exceptions.StoreUnavailableException;
import com.chronicle.ruleengine.api.model.EntitySnapshot;
import com.chronicle.ruleengine.api.model.ExpressionNodes;
import com.chronicle.ruleengine.api.model.StateVariable;
import com.chronicle.ruleengine.api.model.VariableScope;
import com.chronicle.ruleengine.api.spi.EntityStore;
import com.chronicle.ruleengine.api.spi.VariableStore;
import com.chronicle.ruleengine.runtime.evaluation.Evaluation;
import com.chronicle.ruleengine.runtime.evaluation.ExpressionEvaluator;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.NullNode;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Assembles the {@link EvaluationContext} for one entity.
 *
 * <p>Layering, later entries overriding earlier ones:
 * <ol>
 *   <li>entity fields, at the root and under the lower-case entity type</li>
 *   <li>stored state variables of the entity, by key</li>
 *   <li>derived state variables, evaluated on demand against the context built so far</li>
 *   <li>caller-supplied extra context</li>
 * </ol>
 *
 * <p>{@link #build} degrades gracefully: a missing entity or an unavailable store leaves the
 * corresponding layer empty and logs a warning. {@link #buildStrict} throws instead.
 */
public final class ContextBuilder {

    private static final Logger logger = Logger.getLogger(ContextBuilder.class.getName());

    private final EntityStore entityStore;
    private final VariableStore variableStore;
    private final ExpressionEvaluator evaluator;

    public ContextBuilder(EntityStore entityStore, VariableStore variableStore, ExpressionEvaluator evaluator) {
        this.entityStore = Objects.requireNonNull(entityStore, "entityStore");
        this.variableStore = Objects.requireNonNull(variableStore, "variableStore");
        this.evaluator = Objects.requireNonNull(evaluator, "evaluator");
    }

    public EvaluationContext build(String entityType, String entityId, Map<String, JsonNode> extraContext) {
        return build(entityType, entityId, extraContext, null, false);
    }

    /**
     * Builds a context in which the derived variable {@code excludedKey} is left unresolved.
     * Used when evaluating that variable itself.
     */
    public EvaluationContext build(String entityType, String entityId, Map<String, JsonNode> extraContext,
                                   String excludedKey) {
        return build(entityType, entityId, extraContext, excludedKey, false);
    }

    /**
     * @throws EntityNotFoundException   if the entity does not exist
     * @throws StoreUnavailableException if a store cannot be reached
     */
    public EvaluationContext buildStrict(String entityType, String entityId, Map<String, JsonNode> extraContext) {
        return build(entityType, entityId, extraContext, null, true);
    }

    private EvaluationContext build(String entityType, String entityId, Map<String, JsonNode> extraContext,
                                    String excludedKey, boolean strict) {
        ObjectNode root = JsonNodeFactory.instance.objectNode();
        EntitySnapshot snapshot = loadEntity(entityType, entityId, strict);
        if (snapshot != null) {
            root.setAll(snapshot.data().deepCopy());
            root.set(entityType, snapshot.data().deepCopy());
        }

        List<StateVariable> variables = loadVariables(entityType, entityId, strict);
        Map<String, StateVariable> derived = new LinkedHashMap<>();
        for (StateVariable variable : variables) {
            if (variable.isDerived()) {
                if (!variable.key().equals(excludedKey)) {
                    derived.put(variable.key(), variable);
                }
            } else {
                root.set(variable.key(), variable.value());
            }
        }

        if (!derived.isEmpty()) {
            DerivedResolution resolution = new DerivedResolution(root, derived, entityType, entityId, snapshot);
            for (StateVariable variable : derived.values()) {
                resolution.resolve(variable);
            }
        }

        if (extraContext != null) {
            extraContext.forEach((key, value) -> root.set(key, value == null ? NullNode.getInstance() : value));
        }
        return EvaluationContext.forEntity(root, entityType, entityId, snapshot);
    }

    private EntitySnapshot loadEntity(String entityType, String entityId, boolean strict) {
        Optional<EntitySnapshot> snapshot;
        try {
            snapshot = entityStore.load(entityType, entityId);
        } catch (StoreUnavailableException e) {
            if (strict) {
                throw e;
            }
            logger.log(Level.WARNING, String.format(
                    "Entity store unavailable for %s:%s; building context without entity data", entityType, entityId), e);
            return null;
        }
        if (snapshot.isEmpty()) {
            if (strict) {
                throw new EntityNotFoundException(entityType, entityId);
            }
            logger.warning(String.format("Entity %s:%s not found; building context without entity data",
                    entityType, entityId));
            return null;
        }
        return snapshot.get();
    }

    private List<StateVariable> loadVariables(String entityType, String entityId, boolean strict) {
        VariableScope scope;
        try {
            scope = VariableScope.fromEntityType(entityType);
        } catch (IllegalArgumentException e) {
            logger.fine("No variable scope for entity type " + entityType);
            return List.of();
        }
        try {
            return variableStore.findByScope(scope, entityId).stream()
                    .filter(StateVariable::isLive)
                    .toList();
        } catch (StoreUnavailableException e) {
            if (strict) {
                throw e;
            }
            logger.log(Level.WARNING, String.format(
                    "Variable store unavailable for %s:%s; building context without variables", entityType, entityId), e);
            return List.of();
        }
    }

    /**
     * Per-build state for derived variables. A variable that is re-entered while still on the
     * resolving stack reads as null.
     */
    private final class DerivedResolution {
        private final ObjectNode root;
        private final Map<String, StateVariable> pending;
        private final String entityType;
        private final String entityId;
        private final EntitySnapshot snapshot;
        private final Deque<String> resolving = new ArrayDeque<>();

        DerivedResolution(ObjectNode root, Map<String, StateVariable> derived, String entityType,
                          String entityId, EntitySnapshot snapshot) {
            this.root = root;
            this.pending = new LinkedHashMap<>(derived);
            this.entityType = entityType;
            this.entityId = entityId;
            this.snapshot = snapshot;
        }

        void resolve(StateVariable variable) {
            String key = variable.key();
            if (!pending.containsKey(key)) {
                return;
            }
            if (resolving.contains(key)) {
                logger.warning(String.format("Derived variable '%s' on %s:%s depends on itself via %s; using null",
                        key, entityType, entityId, resolving));
                return;
            }
            resolving.push(key);
            try {
                for (String path : ExpressionNodes.variablePaths(variable.formula())) {
                    StateVariable dependency = pending.get(baseSegment(path));
                    if (dependency != null && dependency != variable) {
                        resolve(dependency);
                    }
                }
                EvaluationContext partial = EvaluationContext.forEntity(root, entityType, entityId, snapshot);
                Evaluation result = evaluator.evaluate(variable.formula(), partial);
                if (result.isSuccess()) {
                    root.set(key, result.value());
                } else {
                    logger.warning(String.format("Derived variable '%s' (%s) failed: %s; using null",
                            key, variable.id(), result.errorMessage()));
                    root.set(key, NullNode.getInstance());
                }
            } finally {
                resolving.pop();
                pending.remove(key);
            }
        }

        private String baseSegment(String path) {
            int dot = path.indexOf('.');
            return dot < 0 ? path : path.substring(0, dot);
        }
    }
}
