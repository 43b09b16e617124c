/*
 * Copyright (c) 2025 Chronicle Rule Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.chronicle.ruleengine.compiler.analysis;

import com.chronicle.ruleengine.api.exceptions.RuleEngineException;
import com.chronicle.ruleengine.api.model.DomainOperatorType;
import com.chronicle.ruleengine.api.model.ExpressionNode;
import com.chronicle.ruleengine.api.model.ExpressionNodes;
import com.chronicle.ruleengine.api.model.ValidationResult;
import com.chronicle.ruleengine.runtime.operators.CollectionOperatorEvaluator;
import com.chronicle.ruleengine.runtime.operators.LogicalOperatorEvaluator;
import com.chronicle.ruleengine.runtime.operators.NumericOperatorEvaluator;
import com.fasterxml.jackson.databind.JsonNode;

import java.util.HashSet;
import java.util.Optional;
import java.util.Set;

/**
 * Authoring-time checks on a single expression: structure, known operators and depth.
 * Graph-level checks (cycles) are done by the caller against a candidate graph.
 */
public class ExpressionValidator {

    private static final Set<String> KNOWN_OPERATORS;

    static {
        Set<String> known = new HashSet<>();
        known.addAll(LogicalOperatorEvaluator.OPERATORS);
        known.addAll(NumericOperatorEvaluator.ARITHMETIC);
        known.addAll(NumericOperatorEvaluator.COMPARISON);
        known.addAll(CollectionOperatorEvaluator.OPERATORS);
        KNOWN_OPERATORS = Set.copyOf(known);
    }

    private final int maxDepth;

    public ExpressionValidator(int maxDepth) {
        this.maxDepth = maxDepth;
    }

    public int getMaxDepth() {
        return maxDepth;
    }

    public ValidationResult validate(JsonNode expression) {
        if (expression == null || expression.isNull() || expression.isMissingNode()) {
            return ValidationResult.invalid("Expression is empty");
        }
        ExpressionNode node;
        try {
            node = ExpressionNodes.fromJson(expression);
        } catch (RuleEngineException e) {
            return ValidationResult.invalid(e.getMessage());
        }
        return validate(node);
    }

    public ValidationResult validate(ExpressionNode node) {
        if (node == null) {
            return ValidationResult.invalid("Expression is empty");
        }
        Optional<String> unknown = findUnknownOperator(node);
        if (unknown.isPresent()) {
            return ValidationResult.invalid("Unknown operator: " + unknown.get());
        }
        int depth = ExpressionNodes.depth(node);
        if (depth > maxDepth) {
            return ValidationResult.formulaTooComplex(depth, maxDepth);
        }
        return ValidationResult.ok(depth);
    }

    private static Optional<String> findUnknownOperator(ExpressionNode node) {
        switch (node.kind()) {
            case OPERATOR: {
                ExpressionNode.Operator op = (ExpressionNode.Operator) node;
                if (!KNOWN_OPERATORS.contains(op.name())) {
                    return Optional.of(op.name());
                }
                for (ExpressionNode child : op.children()) {
                    Optional<String> unknown = findUnknownOperator(child);
                    if (unknown.isPresent()) {
                        return unknown;
                    }
                }
                return Optional.empty();
            }
            case DOMAIN_OPERATOR: {
                ExpressionNode.DomainOperator op = (ExpressionNode.DomainOperator) node;
                if (DomainOperatorType.lookup(op).isEmpty()) {
                    return Optional.of(op.qualifiedName());
                }
                for (ExpressionNode arg : op.arguments()) {
                    Optional<String> unknown = findUnknownOperator(arg);
                    if (unknown.isPresent()) {
                        return unknown;
                    }
                }
                return Optional.empty();
            }
            default:
                return Optional.empty();
        }
    }
}
