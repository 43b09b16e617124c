/*
 * Copyright (c) 2025 Chronicle Rule Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.chronicle.ruleengine.runtime.operators;

import com.chronicle.ruleengine.api.exceptions.EvaluationException;
import com.chronicle.ruleengine.api.model.ExpressionNode;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.BooleanNode;
import com.fasterxml.jackson.databind.node.NullNode;

import java.util.List;
import java.util.Set;
import java.util.function.Function;

/**
 * Boolean, branching and equality operators.
 *
 * <p>{@code and}, {@code or} and {@code if} receive unevaluated children and evaluate them lazily,
 * so short-circuited branches are never computed. {@code and}/{@code or} return the deciding
 * operand itself rather than a coerced boolean.
 */
public final class LogicalOperatorEvaluator {

    public static final Set<String> OPERATORS =
            Set.of("and", "or", "!", "!!", "if", "?:", "==", "!=", "===", "!==");

    public boolean handles(String operator) {
        return OPERATORS.contains(operator);
    }

    public JsonNode apply(String operator, List<ExpressionNode> children, Function<ExpressionNode, JsonNode> eval) {
        switch (operator) {
            case "and":
                return and(children, eval);
            case "or":
                return or(children, eval);
            case "!":
                return BooleanNode.valueOf(!JsonValues.truthy(first(children, eval)));
            case "!!":
                return BooleanNode.valueOf(JsonValues.truthy(first(children, eval)));
            case "if":
            case "?:":
                return branch(children, eval);
            case "==":
                return BooleanNode.valueOf(JsonValues.looseEquals(operand(children, 0, eval), operand(children, 1, eval)));
            case "!=":
                return BooleanNode.valueOf(!JsonValues.looseEquals(operand(children, 0, eval), operand(children, 1, eval)));
            case "===":
                return BooleanNode.valueOf(JsonValues.strictEquals(operand(children, 0, eval), operand(children, 1, eval)));
            case "!==":
                return BooleanNode.valueOf(!JsonValues.strictEquals(operand(children, 0, eval), operand(children, 1, eval)));
            default:
                throw new EvaluationException("Unknown logical operator: " + operator);
        }
    }

    private static JsonNode and(List<ExpressionNode> children, Function<ExpressionNode, JsonNode> eval) {
        JsonNode last = NullNode.getInstance();
        for (ExpressionNode child : children) {
            last = eval.apply(child);
            if (!JsonValues.truthy(last)) {
                return last;
            }
        }
        return last;
    }

    private static JsonNode or(List<ExpressionNode> children, Function<ExpressionNode, JsonNode> eval) {
        JsonNode last = NullNode.getInstance();
        for (ExpressionNode child : children) {
            last = eval.apply(child);
            if (JsonValues.truthy(last)) {
                return last;
            }
        }
        return last;
    }

    /** [cond1, then1, cond2, then2, ..., else] */
    private static JsonNode branch(List<ExpressionNode> children, Function<ExpressionNode, JsonNode> eval) {
        int i = 0;
        for (; i + 1 < children.size(); i += 2) {
            if (JsonValues.truthy(eval.apply(children.get(i)))) {
                return eval.apply(children.get(i + 1));
            }
        }
        return i < children.size() ? eval.apply(children.get(i)) : NullNode.getInstance();
    }

    private static JsonNode first(List<ExpressionNode> children, Function<ExpressionNode, JsonNode> eval) {
        return children.isEmpty() ? NullNode.getInstance() : eval.apply(children.get(0));
    }

    private static JsonNode operand(List<ExpressionNode> children, int index,
                                    Function<ExpressionNode, JsonNode> eval) {
        return index < children.size() ? eval.apply(children.get(index)) : NullNode.getInstance();
    }
}
