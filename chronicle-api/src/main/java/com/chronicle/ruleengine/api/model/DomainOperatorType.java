/*
 * Copyright (c) 2025 Chronicle Rule Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.chronicle.ruleengine.api.model;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.BooleanNode;
import com.fasterxml.jackson.databind.node.IntNode;
import com.fasterxml.jackson.databind.node.NullNode;

import java.util.Arrays;
import java.util.Map;
import java.util.Optional;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Closed set of domain operators understood by the engine.
 *
 * <p>Each operator declares how many value arguments it takes (an explicit target id may
 * follow them), the canonical dependency name it reads, and the neutral value returned when
 * the target entity cannot be resolved.
 */
public enum DomainOperatorType {

    SETTLEMENT_LEVEL("settlement", "level", 0, "settlement.level", IntNode.valueOf(0)),
    SETTLEMENT_VAR("settlement", "var", 1, "settlement.variables", NullNode.getInstance()),
    SETTLEMENT_HAS_STRUCTURE_TYPE("settlement", "hasStructureType", 1, "settlement.structures", BooleanNode.FALSE),
    SETTLEMENT_STRUCTURE_COUNT("settlement", "structureCount", 1, "settlement.structures", IntNode.valueOf(0)),
    SETTLEMENT_IN_KINGDOM("settlement", "inKingdom", 1, "settlement.kingdomId", BooleanNode.FALSE),
    SETTLEMENT_AT_LOCATION("settlement", "atLocation", 1, "settlement.locationId", BooleanNode.FALSE),
    STRUCTURE_LEVEL("structure", "level", 0, "structure.level", IntNode.valueOf(0)),
    STRUCTURE_TYPE("structure", "type", 0, "structure.type", NullNode.getInstance()),
    STRUCTURE_VAR("structure", "var", 1, "structure.variables", NullNode.getInstance()),
    STRUCTURE_IS_OPERATIONAL("structure", "isOperational", 0, "structure.operational", BooleanNode.FALSE),
    STRUCTURE_IN_SETTLEMENT("structure", "inSettlement", 1, "structure.settlementId", BooleanNode.FALSE),
    KINGDOM_LEVEL("kingdom", "level", 0, "kingdom.level", IntNode.valueOf(0));

    private static final Map<String, DomainOperatorType> BY_NAME = Arrays.stream(values())
            .collect(Collectors.toUnmodifiableMap(DomainOperatorType::qualifiedName, Function.identity()));

    private final String namespace;
    private final String property;
    private final int valueArity;
    private final String canonicalDependency;
    private final JsonNode neutralValue;

    DomainOperatorType(String namespace, String property, int valueArity,
                       String canonicalDependency, JsonNode neutralValue) {
        this.namespace = namespace;
        this.property = property;
        this.valueArity = valueArity;
        this.canonicalDependency = canonicalDependency;
        this.neutralValue = neutralValue;
    }

    public static Optional<DomainOperatorType> lookup(String qualifiedName) {
        return Optional.ofNullable(BY_NAME.get(qualifiedName));
    }

    public static Optional<DomainOperatorType> lookup(ExpressionNode.DomainOperator node) {
        return lookup(node.qualifiedName());
    }

    public static boolean isDomainNamespace(String namespace) {
        return "settlement".equals(namespace) || "structure".equals(namespace) || "kingdom".equals(namespace);
    }

    public String namespace() {
        return namespace;
    }

    public String property() {
        return property;
    }

    public String qualifiedName() {
        return namespace + "." + property;
    }

    /** Number of leading value arguments; an argument at this index is the explicit target id. */
    public int valueArity() {
        return valueArity;
    }

    public String canonicalDependency() {
        return canonicalDependency;
    }

    public JsonNode neutralValue() {
        return neutralValue;
    }
}
