/*
 * Copyright (c) 2025 Chronicle Rule Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.chronicle.ruleengine.runtime.operators;

import com.chronicle.ruleengine.api.exceptions.EvaluationException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.BooleanNode;
import com.fasterxml.jackson.databind.node.NullNode;

import java.util.List;
import java.util.Set;

/**
 * Arithmetic and ordering operators over already-evaluated operands.
 *
 * <p>Null handling:
 * <ul>
 *   <li>any arithmetic with a {@code null} operand yields {@code null}</li>
 *   <li>division or modulo by zero yields {@code null}</li>
 *   <li>ordering treats {@code null} as lower than every defined value</li>
 * </ul>
 */
public final class NumericOperatorEvaluator {

    public static final Set<String> ARITHMETIC = Set.of("+", "-", "*", "/", "%", "min", "max");
    public static final Set<String> COMPARISON = Set.of("<", "<=", ">", ">=");

    public boolean handles(String operator) {
        return ARITHMETIC.contains(operator) || COMPARISON.contains(operator);
    }

    public JsonNode apply(String operator, List<JsonNode> operands) {
        if (COMPARISON.contains(operator)) {
            return BooleanNode.valueOf(compare(operator, operands));
        }
        return arithmetic(operator, operands);
    }

    // ========================================================================
    // ORDERING
    // ========================================================================

    private boolean compare(String operator, List<JsonNode> operands) {
        if (operands.size() < 2) {
            throw new EvaluationException("Operator '" + operator + "' needs at least two operands");
        }
        // "between" form: a < b < c
        if (operands.size() == 3 && ("<".equals(operator) || "<=".equals(operator))) {
            return holds(operator, JsonValues.compare(operands.get(0), operands.get(1), operator))
                    && holds(operator, JsonValues.compare(operands.get(1), operands.get(2), operator));
        }
        return holds(operator, JsonValues.compare(operands.get(0), operands.get(1), operator));
    }

    private static boolean holds(String operator, int cmp) {
        switch (operator) {
            case "<":
                return cmp < 0;
            case "<=":
                return cmp <= 0;
            case ">":
                return cmp > 0;
            case ">=":
                return cmp >= 0;
            default:
                throw new EvaluationException("Unknown comparison operator: " + operator);
        }
    }

    // ========================================================================
    // ARITHMETIC
    // ========================================================================

    private JsonNode arithmetic(String operator, List<JsonNode> operands) {
        for (JsonNode operand : operands) {
            if (JsonValues.isNull(operand)) {
                return NullNode.getInstance();
            }
        }

        switch (operator) {
            case "+": {
                double sum = 0;
                for (JsonNode operand : operands) {
                    sum += JsonValues.toNumber(operand, operator);
                }
                return JsonValues.numberNode(sum);
            }
            case "*": {
                if (operands.isEmpty()) {
                    throw new EvaluationException("Operator '*' needs at least one operand");
                }
                double product = 1;
                for (JsonNode operand : operands) {
                    product *= JsonValues.toNumber(operand, operator);
                }
                return JsonValues.numberNode(product);
            }
            case "-": {
                if (operands.size() == 1) {
                    return JsonValues.numberNode(-JsonValues.toNumber(operands.get(0), operator));
                }
                requireTwo(operator, operands);
                return JsonValues.numberNode(JsonValues.toNumber(operands.get(0), operator)
                        - JsonValues.toNumber(operands.get(1), operator));
            }
            case "/": {
                requireTwo(operator, operands);
                double divisor = JsonValues.toNumber(operands.get(1), operator);
                if (divisor == 0) {
                    return NullNode.getInstance();
                }
                return JsonValues.numberNode(JsonValues.toNumber(operands.get(0), operator) / divisor);
            }
            case "%": {
                requireTwo(operator, operands);
                double divisor = JsonValues.toNumber(operands.get(1), operator);
                if (divisor == 0) {
                    return NullNode.getInstance();
                }
                return JsonValues.numberNode(JsonValues.toNumber(operands.get(0), operator) % divisor);
            }
            case "min":
            case "max": {
                if (operands.isEmpty()) {
                    return NullNode.getInstance();
                }
                double best = JsonValues.toNumber(operands.get(0), operator);
                for (int i = 1; i < operands.size(); i++) {
                    double candidate = JsonValues.toNumber(operands.get(i), operator);
                    best = "min".equals(operator) ? Math.min(best, candidate) : Math.max(best, candidate);
                }
                return JsonValues.numberNode(best);
            }
            default:
                throw new EvaluationException("Unknown arithmetic operator: " + operator);
        }
    }

    private static void requireTwo(String operator, List<JsonNode> operands) {
        if (operands.size() != 2) {
            throw new EvaluationException(String.format(
                    "Operator '%s' expects 2 operands, got %d", operator, operands.size()));
        }
    }
}
