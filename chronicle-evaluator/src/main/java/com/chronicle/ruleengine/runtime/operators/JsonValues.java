/*
 * Copyright (c) 2025 Chronicle Rule Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.chronicle.ruleengine.runtime.operators;

import com.chronicle.ruleengine.api.exceptions.EvaluationException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.DoubleNode;
import com.fasterxml.jackson.databind.node.IntNode;
import com.fasterxml.jackson.databind.node.LongNode;

/**
 * Value semantics shared by the operator evaluators.
 *
 * <p>Ordering is total over null, booleans, numbers and strings: {@code null} sorts below every
 * defined value, booleans compare as 0/1, numeric strings compare as numbers against numbers.
 * Objects and arrays are not orderable.
 */
public final class JsonValues {

    private static final double MAX_EXACT_INTEGER = 9_007_199_254_740_992d;

    private JsonValues() {
        throw new AssertionError("No instances");
    }

    public static boolean isNull(JsonNode value) {
        return value == null || value.isNull() || value.isMissingNode();
    }

    /** JSONLogic truthiness: null, false, 0, NaN, "" and [] are falsy. */
    public static boolean truthy(JsonNode value) {
        if (isNull(value)) {
            return false;
        }
        if (value.isBoolean()) {
            return value.booleanValue();
        }
        if (value.isNumber()) {
            double d = value.doubleValue();
            return d != 0 && !Double.isNaN(d);
        }
        if (value.isTextual()) {
            return !value.textValue().isEmpty();
        }
        if (value.isArray()) {
            return !value.isEmpty();
        }
        return true;
    }

    /**
     * Numeric view of an operand.
     *
     * @throws EvaluationException if the value is an object, array, or non-numeric string
     */
    public static double toNumber(JsonNode value, String operator) {
        if (value.isNumber()) {
            return value.doubleValue();
        }
        if (value.isBoolean()) {
            return value.booleanValue() ? 1 : 0;
        }
        if (value.isTextual()) {
            String text = value.textValue().trim();
            if (text.isEmpty()) {
                return 0;
            }
            try {
                return Double.parseDouble(text);
            } catch (NumberFormatException e) {
                throw new EvaluationException(String.format(
                        "Operator '%s' cannot use non-numeric string \"%s\"", operator, value.textValue()));
            }
        }
        throw new EvaluationException(String.format(
                "Operator '%s' cannot use %s operand", operator, value.getNodeType()));
    }

    /** Integral doubles become int or long nodes so results compare equal to parsed JSON. */
    public static JsonNode numberNode(double value) {
        if (value == Math.rint(value) && Math.abs(value) < MAX_EXACT_INTEGER) {
            long asLong = (long) value;
            if (asLong >= Integer.MIN_VALUE && asLong <= Integer.MAX_VALUE) {
                return IntNode.valueOf((int) asLong);
            }
            return LongNode.valueOf(asLong);
        }
        return DoubleNode.valueOf(value);
    }

    /**
     * Compares two operands under the engine's total order.
     *
     * @throws EvaluationException if either operand is an object or array, or a string and a
     *         number cannot be reconciled
     */
    public static int compare(JsonNode left, JsonNode right, String operator) {
        boolean leftNull = isNull(left);
        boolean rightNull = isNull(right);
        if (leftNull || rightNull) {
            return leftNull && rightNull ? 0 : (leftNull ? -1 : 1);
        }
        if (left.isContainerNode() || right.isContainerNode()) {
            throw new EvaluationException(String.format(
                    "Operator '%s' cannot order %s and %s", operator, left.getNodeType(), right.getNodeType()));
        }
        if (left.isTextual() && right.isTextual()) {
            return Integer.signum(left.textValue().compareTo(right.textValue()));
        }
        return Double.compare(toNumber(left, operator), toNumber(right, operator));
    }

    /** Loose equality in the JSONLogic sense ({@code ==}). */
    public static boolean looseEquals(JsonNode left, JsonNode right) {
        boolean leftNull = isNull(left);
        boolean rightNull = isNull(right);
        if (leftNull || rightNull) {
            return leftNull && rightNull;
        }
        if (left.isContainerNode() || right.isContainerNode()) {
            return left.equals(right);
        }
        if (left.isTextual() && right.isTextual()) {
            return left.textValue().equals(right.textValue());
        }
        try {
            return toNumber(left, "==") == toNumber(right, "==");
        } catch (EvaluationException e) {
            return false;
        }
    }

    /** Strict equality ({@code ===}): same JSON type and value, numbers compared by value. */
    public static boolean strictEquals(JsonNode left, JsonNode right) {
        boolean leftNull = isNull(left);
        boolean rightNull = isNull(right);
        if (leftNull || rightNull) {
            return leftNull && rightNull;
        }
        if (left.isNumber() && right.isNumber()) {
            return left.doubleValue() == right.doubleValue();
        }
        return left.getNodeType() == right.getNodeType() && left.equals(right);
    }

    /** String form used by {@code cat}; null renders as empty. */
    public static String text(JsonNode value) {
        if (isNull(value)) {
            return "";
        }
        if (value.isNumber()) {
            return numberNode(value.doubleValue()).asText();
        }
        return value.isValueNode() ? value.asText() : value.toString();
    }
}
