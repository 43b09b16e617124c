/*
 * Copyright (c) 2025 Chronicle Rule Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.chronicle.ruleengine.api.model;

import com.chronicle.ruleengine.api.exceptions.EvaluationException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.NullNode;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Conversion between the JSONLogic-shaped wire form of an expression and {@link ExpressionNode} trees,
 * plus a few structural helpers shared by the evaluator and the compiler.
 *
 * <pre>{@code
 * {"and": [{">": [{"var": "population"}, 10000]}, {"settlement.hasStructureType": ["temple"]}]}
 * }</pre>
 */
public final class ExpressionNodes {

    /** Synthetic operator for arrays that contain non-constant elements. */
    public static final String ARRAY_OPERATOR = "array";

    private static final JsonNodeFactory NODES = JsonNodeFactory.instance;

    private ExpressionNodes() {
        throw new AssertionError("No instances");
    }

    // ========================================================================
    // JSON -> TREE
    // ========================================================================

    /**
     * Converts a JSON expression into a tree.
     *
     * @throws EvaluationException if an object node has more than one key or a {@code var} operand is malformed
     */
    public static ExpressionNode fromJson(JsonNode json) {
        if (json == null || json.isMissingNode() || json.isNull()) {
            return new ExpressionNode.Literal(NullNode.getInstance());
        }
        if (json.isArray()) {
            return fromArray((ArrayNode) json);
        }
        if (!json.isObject() || json.isEmpty()) {
            return new ExpressionNode.Literal(json);
        }
        if (json.size() > 1) {
            throw new EvaluationException("Expression object must have exactly one operator key, found " + json.size());
        }

        Map.Entry<String, JsonNode> entry = json.fields().next();
        String name = entry.getKey();
        JsonNode operand = entry.getValue();

        if ("var".equals(name)) {
            return toVarRef(operand);
        }

        int dot = name.indexOf('.');
        if (dot > 0 && DomainOperatorType.isDomainNamespace(name.substring(0, dot))) {
            return toDomainOperator(name.substring(0, dot), name.substring(dot + 1), operand);
        }

        return new ExpressionNode.Operator(name, operands(operand));
    }

    private static ExpressionNode fromArray(ArrayNode array) {
        List<ExpressionNode> elements = new ArrayList<>(array.size());
        boolean allLiteral = true;
        for (JsonNode element : array) {
            ExpressionNode node = fromJson(element);
            allLiteral &= node.kind() == ExpressionNode.Kind.LITERAL;
            elements.add(node);
        }
        return allLiteral ? new ExpressionNode.Literal(array) : new ExpressionNode.Operator(ARRAY_OPERATOR, elements);
    }

    private static ExpressionNode toVarRef(JsonNode operand) {
        if (operand.isArray()) {
            if (operand.isEmpty()) {
                return new ExpressionNode.VarRef("");
            }
            JsonNode path = operand.get(0);
            JsonNode defaultValue = operand.size() > 1 ? operand.get(1) : NullNode.getInstance();
            return new ExpressionNode.VarRef(pathText(path), defaultValue);
        }
        return new ExpressionNode.VarRef(pathText(operand));
    }

    private static String pathText(JsonNode path) {
        if (path.isNull()) {
            return "";
        }
        if (!path.isValueNode()) {
            throw new EvaluationException("var path must be a string or number, got " + path.getNodeType());
        }
        return path.asText();
    }

    private static ExpressionNode toDomainOperator(String namespace, String property, JsonNode operand) {
        List<ExpressionNode> args = operands(operand);
        String explicitId = null;

        int arity = DomainOperatorType.lookup(namespace + "." + property)
                .map(DomainOperatorType::valueArity)
                .orElse(args.size());
        if (args.size() > arity) {
            ExpressionNode idArg = args.get(arity);
            if (idArg instanceof ExpressionNode.Literal literal && literal.value().isTextual()) {
                explicitId = literal.value().asText();
            }
            args = args.subList(0, arity);
        }
        return new ExpressionNode.DomainOperator(namespace, property, args, explicitId);
    }

    private static List<ExpressionNode> operands(JsonNode operand) {
        if (operand == null || operand.isNull()) {
            return List.of();
        }
        if (!operand.isArray()) {
            return List.of(fromJson(operand));
        }
        List<ExpressionNode> children = new ArrayList<>(operand.size());
        for (JsonNode child : operand) {
            children.add(fromJson(child));
        }
        return children;
    }

    // ========================================================================
    // TREE -> JSON
    // ========================================================================

    public static JsonNode toJson(ExpressionNode node) {
        switch (node.kind()) {
            case LITERAL:
                return ((ExpressionNode.Literal) node).value();
            case VAR_REF: {
                ExpressionNode.VarRef ref = (ExpressionNode.VarRef) node;
                ObjectNode object = NODES.objectNode();
                if (ref.defaultValue().isNull()) {
                    object.put("var", ref.path());
                } else {
                    object.putArray("var").add(ref.path()).add(ref.defaultValue());
                }
                return object;
            }
            case OPERATOR: {
                ExpressionNode.Operator op = (ExpressionNode.Operator) node;
                ArrayNode children = NODES.arrayNode();
                op.children().forEach(child -> children.add(toJson(child)));
                if (ARRAY_OPERATOR.equals(op.name())) {
                    return children;
                }
                ObjectNode object = NODES.objectNode();
                object.set(op.name(), children);
                return object;
            }
            case DOMAIN_OPERATOR: {
                ExpressionNode.DomainOperator op = (ExpressionNode.DomainOperator) node;
                ArrayNode args = NODES.arrayNode();
                op.arguments().forEach(arg -> args.add(toJson(arg)));
                if (op.explicitId() != null) {
                    args.add(op.explicitId());
                }
                ObjectNode object = NODES.objectNode();
                object.set(op.qualifiedName(), args);
                return object;
            }
            default:
                throw new IllegalStateException("Unhandled node kind: " + node.kind());
        }
    }

    // ========================================================================
    // STRUCTURE
    // ========================================================================

    /**
     * Depth of the tree, counting the root as 1. Literal arrays do not add depth.
     */
    public static int depth(ExpressionNode node) {
        switch (node.kind()) {
            case LITERAL:
            case VAR_REF:
                return 1;
            case OPERATOR:
                return 1 + maxDepth(((ExpressionNode.Operator) node).children());
            case DOMAIN_OPERATOR:
                return 1 + maxDepth(((ExpressionNode.DomainOperator) node).arguments());
            default:
                throw new IllegalStateException("Unhandled node kind: " + node.kind());
        }
    }

    private static int maxDepth(List<ExpressionNode> children) {
        int max = 0;
        for (ExpressionNode child : children) {
            max = Math.max(max, depth(child));
        }
        return max;
    }

    /**
     * Variable paths referenced by {@code var} nodes, in first-seen order.
     */
    public static Set<String> variablePaths(ExpressionNode node) {
        Set<String> paths = new LinkedHashSet<>();
        collectPaths(node, paths);
        return paths;
    }

    private static void collectPaths(ExpressionNode node, Set<String> paths) {
        switch (node.kind()) {
            case VAR_REF:
                paths.add(((ExpressionNode.VarRef) node).path());
                break;
            case OPERATOR:
                ((ExpressionNode.Operator) node).children().forEach(child -> collectPaths(child, paths));
                break;
            case DOMAIN_OPERATOR:
                ((ExpressionNode.DomainOperator) node).arguments().forEach(arg -> collectPaths(arg, paths));
                break;
            default:
                break;
        }
    }
}
