/*
 * Copyright (c) 2025 Chronicle Rule Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.chronicle.ruleengine.runtime.operators;

import com.chronicle.ruleengine.api.exceptions.EvaluationException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.BooleanNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.TextNode;

import java.util.List;
import java.util.Set;

/**
 * Membership, string concatenation and array operators over evaluated operands.
 */
public final class CollectionOperatorEvaluator {

    public static final Set<String> OPERATORS = Set.of("in", "cat", "merge", "array");

    public boolean handles(String operator) {
        return OPERATORS.contains(operator);
    }

    public JsonNode apply(String operator, List<JsonNode> operands) {
        switch (operator) {
            case "in":
                return BooleanNode.valueOf(in(operands));
            case "cat": {
                StringBuilder sb = new StringBuilder();
                for (JsonNode operand : operands) {
                    sb.append(JsonValues.text(operand));
                }
                return TextNode.valueOf(sb.toString());
            }
            case "merge": {
                ArrayNode merged = JsonNodeFactory.instance.arrayNode();
                for (JsonNode operand : operands) {
                    if (operand.isArray()) {
                        merged.addAll((ArrayNode) operand);
                    } else {
                        merged.add(operand);
                    }
                }
                return merged;
            }
            case "array": {
                ArrayNode array = JsonNodeFactory.instance.arrayNode();
                operands.forEach(array::add);
                return array;
            }
            default:
                throw new EvaluationException("Unknown collection operator: " + operator);
        }
    }

    private static boolean in(List<JsonNode> operands) {
        if (operands.size() != 2) {
            throw new EvaluationException("Operator 'in' expects 2 operands, got " + operands.size());
        }
        JsonNode needle = operands.get(0);
        JsonNode haystack = operands.get(1);
        if (JsonValues.isNull(haystack)) {
            return false;
        }
        if (haystack.isTextual()) {
            return !JsonValues.isNull(needle) && haystack.textValue().contains(JsonValues.text(needle));
        }
        if (haystack.isArray()) {
            for (JsonNode element : haystack) {
                if (JsonValues.strictEquals(needle, element)) {
                    return true;
                }
            }
            return false;
        }
        throw new EvaluationException("Operator 'in' cannot search a " + haystack.getNodeType());
    }
}
