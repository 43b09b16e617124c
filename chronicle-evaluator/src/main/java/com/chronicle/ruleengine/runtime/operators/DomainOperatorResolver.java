/*
 * Copyright (c) 2025 Chronicle Rule Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.chronicle.ruleengine.runtime.operators;

import com.chronicle.ruleengine.api.exceptions.EvaluationException;
import com.chronicle.ruleengine.api.exceptions.StoreUnavailableException;
import com.chronicle.ruleengine.api.model.DomainOperatorType;
import com.chronicle.ruleengine.api.model.EntitySnapshot;
import com.chronicle.ruleengine.api.model.ExpressionNode;
import com.chronicle.ruleengine.api.model.StateVariable;
import com.chronicle.ruleengine.api.model.VariableScope;
import com.chronicle.ruleengine.api.spi.EntityStore;
import com.chronicle.ruleengine.api.spi.VariableStore;
import com.chronicle.ruleengine.runtime.context.EvaluationContext;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.BooleanNode;
import com.fasterxml.jackson.databind.node.IntNode;
import com.fasterxml.jackson.databind.node.NullNode;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.function.BiFunction;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Replaces every {@link ExpressionNode.DomainOperator} in a tree with the literal it evaluates to.
 *
 * <p>Resolution runs depth-first: arguments are resolved and evaluated before their operator.
 * The target entity is the explicit id when one is given, otherwise the context entity when the
 * namespace matches, otherwise the nearest ancestor reachable through {@code settlementId} /
 * {@code kingdomId}. When the target cannot be loaded the operator degrades to its neutral value
 * and a warning is logged.
 *
 * THREAD SAFETY: stateless apart from the injected stores.
 */
public final class DomainOperatorResolver {

    private static final Logger logger = Logger.getLogger(DomainOperatorResolver.class.getName());

    private final EntityStore entityStore;
    private final VariableStore variableStore;

    /**
     * @param variableStore optional; used by {@code *.var(name)} when the entity document has no
     *                      {@code variables} entry for the name
     */
    public DomainOperatorResolver(EntityStore entityStore, VariableStore variableStore) {
        this.entityStore = Objects.requireNonNull(entityStore, "entityStore");
        this.variableStore = variableStore;
    }

    public DomainOperatorResolver(EntityStore entityStore) {
        this(entityStore, null);
    }

    /**
     * Returns a copy of {@code node} without domain operators.
     *
     * @param argumentEvaluator evaluates an already-resolved argument subtree
     * @throws EvaluationException for domain operators outside the supported set
     */
    public ExpressionNode resolve(ExpressionNode node, EvaluationContext context,
                                  BiFunction<ExpressionNode, EvaluationContext, JsonNode> argumentEvaluator) {
        switch (node.kind()) {
            case OPERATOR: {
                ExpressionNode.Operator op = (ExpressionNode.Operator) node;
                List<ExpressionNode> children = new ArrayList<>(op.children().size());
                boolean changed = false;
                for (ExpressionNode child : op.children()) {
                    ExpressionNode resolved = resolve(child, context, argumentEvaluator);
                    changed |= resolved != child;
                    children.add(resolved);
                }
                return changed ? new ExpressionNode.Operator(op.name(), children) : op;
            }
            case DOMAIN_OPERATOR: {
                ExpressionNode.DomainOperator op = (ExpressionNode.DomainOperator) node;
                DomainOperatorType type = DomainOperatorType.lookup(op)
                        .orElseThrow(() -> new EvaluationException("Unknown domain operator: " + op.qualifiedName()));
                List<JsonNode> args = new ArrayList<>(op.arguments().size());
                for (ExpressionNode arg : op.arguments()) {
                    args.add(argumentEvaluator.apply(resolve(arg, context, argumentEvaluator), context));
                }
                return new ExpressionNode.Literal(evaluate(type, args, op.explicitId(), context));
            }
            default:
                return node;
        }
    }

    /**
     * Computes one domain operator against its target entity.
     */
    public JsonNode evaluate(DomainOperatorType type, List<JsonNode> args, String explicitId,
                             EvaluationContext context) {
        Optional<EntitySnapshot> target;
        try {
            target = findTarget(type.namespace(), explicitId, context);
        } catch (StoreUnavailableException e) {
            logger.log(Level.WARNING, String.format(
                    "Entity store unavailable while resolving %s; using neutral value", type.qualifiedName()), e);
            return type.neutralValue();
        }
        if (target.isEmpty()) {
            logger.warning(String.format("No %s entity for %s (explicitId=%s, context=%s:%s); using neutral value",
                    type.namespace(), type.qualifiedName(), explicitId, context.entityType(), context.entityId()));
            return type.neutralValue();
        }
        return compute(type, args, target.get());
    }

    // ========================================================================
    // TARGET RESOLUTION
    // ========================================================================

    private Optional<EntitySnapshot> findTarget(String namespace, String explicitId, EvaluationContext context) {
        if (explicitId != null) {
            return entityStore.load(namespace, explicitId);
        }
        String contextType = context.entityType();
        if (contextType == null || context.entityId() == null) {
            return Optional.empty();
        }
        Optional<EntitySnapshot> current = context.snapshot();
        if (current.isEmpty()) {
            current = entityStore.load(contextType, context.entityId());
        }
        // walk up structure -> settlement -> kingdom
        while (current.isPresent() && !namespace.equals(current.get().entityType())) {
            String parentField = parentField(current.get().entityType());
            String parentType = parentType(current.get().entityType());
            if (parentField == null || current.get().text(parentField) == null) {
                return Optional.empty();
            }
            current = entityStore.load(parentType, current.get().text(parentField));
        }
        return current;
    }

    private static String parentField(String entityType) {
        switch (entityType) {
            case "structure":
                return "settlementId";
            case "settlement":
                return "kingdomId";
            default:
                return null;
        }
    }

    private static String parentType(String entityType) {
        switch (entityType) {
            case "structure":
                return "settlement";
            case "settlement":
                return "kingdom";
            default:
                return null;
        }
    }

    // ========================================================================
    // OPERATORS
    // ========================================================================

    private JsonNode compute(DomainOperatorType type, List<JsonNode> args, EntitySnapshot entity) {
        JsonNode data = entity.data();
        switch (type) {
            case SETTLEMENT_LEVEL:
            case STRUCTURE_LEVEL:
            case KINGDOM_LEVEL:
                return data.path("level").isNumber() ? data.get("level") : type.neutralValue();
            case SETTLEMENT_VAR:
            case STRUCTURE_VAR:
                return variable(entity, argText(args, 0));
            case SETTLEMENT_HAS_STRUCTURE_TYPE:
                return BooleanNode.valueOf(countStructures(data, argText(args, 0)) > 0);
            case SETTLEMENT_STRUCTURE_COUNT:
                return IntNode.valueOf(countStructures(data, argText(args, 0)));
            case SETTLEMENT_IN_KINGDOM:
                return BooleanNode.valueOf(fieldEquals(entity, "kingdomId", argText(args, 0)));
            case SETTLEMENT_AT_LOCATION:
                return BooleanNode.valueOf(fieldEquals(entity, "locationId", argText(args, 0)));
            case STRUCTURE_TYPE:
                return data.hasNonNull("type") ? data.get("type") : NullNode.getInstance();
            case STRUCTURE_IS_OPERATIONAL:
                return data.path("operational").isBoolean() ? data.get("operational") : BooleanNode.TRUE;
            case STRUCTURE_IN_SETTLEMENT:
                return BooleanNode.valueOf(fieldEquals(entity, "settlementId", argText(args, 0)));
            default:
                throw new EvaluationException("Unhandled domain operator: " + type.qualifiedName());
        }
    }

    private JsonNode variable(EntitySnapshot entity, String name) {
        if (name == null) {
            return NullNode.getInstance();
        }
        JsonNode inline = entity.data().path("variables").path(name);
        if (!inline.isMissingNode()) {
            return inline;
        }
        if (variableStore == null) {
            return NullNode.getInstance();
        }
        try {
            for (StateVariable variable : variableStore.findByScope(
                    VariableScope.fromEntityType(entity.entityType()), entity.entityId())) {
                if (variable.isLive() && name.equals(variable.key()) && !variable.isDerived()) {
                    return variable.value();
                }
            }
        } catch (StoreUnavailableException e) {
            logger.log(Level.WARNING, String.format("Variable store unavailable reading %s of %s:%s",
                    name, entity.entityType(), entity.entityId()), e);
        }
        return NullNode.getInstance();
    }

    private static int countStructures(JsonNode data, String structureType) {
        JsonNode structures = data.path("structures");
        if (!structures.isArray()) {
            return 0;
        }
        int count = 0;
        for (JsonNode structure : structures) {
            if (structureType == null || structureType.equals(structure.path("type").asText(null))) {
                count++;
            }
        }
        return count;
    }

    private static boolean fieldEquals(EntitySnapshot entity, String field, String expected) {
        return expected != null && expected.equals(entity.text(field));
    }

    private static String argText(List<JsonNode> args, int index) {
        if (index >= args.size() || JsonValues.isNull(args.get(index))) {
            return null;
        }
        return JsonValues.text(args.get(index));
    }
}
