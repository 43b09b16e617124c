/*
 * Copyright (c) 2025 Chronicle Rule Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.chronicle.ruleengine.runtime.context;

import com.chronicle.ruleengine.api.model.EntitySnapshot;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.MissingNode;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.util.Map;
import java.util.Optional;

/**
 * Immutable variable bag an expression is evaluated against, together with the entity the
 * evaluation is bound to.
 *
 * <p>Lookups use dotted paths. A key containing dots that exists verbatim at the root wins over
 * path traversal, so extra context entries such as {@code "settlement.population"} stay addressable.
 * Numeric segments index into arrays.
 *
 * THREAD SAFETY: immutable; {@link #with} and {@link #withAll} return copies.
 */
public final class EvaluationContext {

    private static final EvaluationContext EMPTY =
            new EvaluationContext(JsonNodeFactory.instance.objectNode(), null, null, null);

    private final ObjectNode root;
    private final String entityType;
    private final String entityId;
    private final EntitySnapshot snapshot;

    private EvaluationContext(ObjectNode root, String entityType, String entityId, EntitySnapshot snapshot) {
        this.root = root;
        this.entityType = entityType;
        this.entityId = entityId;
        this.snapshot = snapshot;
    }

    public static EvaluationContext empty() {
        return EMPTY;
    }

    /** Unbound context over a copy of {@code data}. */
    public static EvaluationContext of(ObjectNode data) {
        return new EvaluationContext(data.deepCopy(), null, null, null);
    }

    /**
     * Context bound to an entity. {@code snapshot} may be {@code null} when the entity could not be loaded.
     */
    public static EvaluationContext forEntity(ObjectNode data, String entityType, String entityId,
                                              EntitySnapshot snapshot) {
        return new EvaluationContext(data.deepCopy(), entityType, entityId, snapshot);
    }

    /**
     * Resolves a dotted path.
     *
     * @return the value, or {@link MissingNode} when any segment is absent
     */
    public JsonNode resolve(String path) {
        if (path == null || path.isEmpty()) {
            return root;
        }
        JsonNode direct = root.get(path);
        if (direct != null) {
            return direct;
        }
        JsonNode current = root;
        int start = 0;
        while (start <= path.length()) {
            int dot = path.indexOf('.', start);
            String segment = dot < 0 ? path.substring(start) : path.substring(start, dot);
            current = step(current, segment);
            if (current.isMissingNode() || dot < 0) {
                return current;
            }
            start = dot + 1;
        }
        return current;
    }

    private static JsonNode step(JsonNode current, String segment) {
        if (current.isObject()) {
            return current.path(segment);
        }
        if (current.isArray()) {
            try {
                return current.path(Integer.parseInt(segment));
            } catch (NumberFormatException e) {
                return MissingNode.getInstance();
            }
        }
        return MissingNode.getInstance();
    }

    public boolean contains(String path) {
        return !resolve(path).isMissingNode();
    }

    public EvaluationContext with(String key, JsonNode value) {
        ObjectNode copy = root.deepCopy();
        copy.set(key, value);
        return new EvaluationContext(copy, entityType, entityId, snapshot);
    }

    public EvaluationContext withAll(Map<String, JsonNode> values) {
        if (values == null || values.isEmpty()) {
            return this;
        }
        ObjectNode copy = root.deepCopy();
        values.forEach(copy::set);
        return new EvaluationContext(copy, entityType, entityId, snapshot);
    }

    public String entityType() {
        return entityType;
    }

    public String entityId() {
        return entityId;
    }

    public Optional<EntitySnapshot> snapshot() {
        return Optional.ofNullable(snapshot);
    }

    /** Copy of the full context document. */
    public ObjectNode toJson() {
        return root.deepCopy();
    }

    @Override
    public String toString() {
        return String.format("EvaluationContext{entity=%s:%s, keys=%d}", entityType, entityId, root.size());
    }
}
