/*
 * Copyright (c) 2025 Chronicle Rule Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.chronicle.ruleengine.api.model;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.NullNode;

import java.util.List;
import java.util.Objects;

/**
 * Immutable expression tree evaluated against an entity context.
 *
 * <p>The node vocabulary is closed: every node is one of {@link Literal}, {@link VarRef},
 * {@link Operator} or {@link DomainOperator}. Consumers dispatch on {@link #kind()} with a
 * {@code switch}; adding a node type means adding a case everywhere the switch appears.
 *
 * <p>Trees are normally produced from their JSON form by {@link ExpressionNodes#fromJson}.
 */
public sealed interface ExpressionNode
        permits ExpressionNode.Literal, ExpressionNode.VarRef, ExpressionNode.Operator, ExpressionNode.DomainOperator {

    enum Kind {
        LITERAL,
        VAR_REF,
        OPERATOR,
        DOMAIN_OPERATOR
    }

    Kind kind();

    /**
     * Constant value. Arrays whose elements are all constants are kept as one literal.
     */
    record Literal(JsonNode value) implements ExpressionNode {
        public Literal {
            value = value == null ? NullNode.getInstance() : value;
        }

        @Override
        public Kind kind() {
            return Kind.LITERAL;
        }
    }

    /**
     * Dotted-path lookup into the evaluation context. A missing path resolves to
     * {@code defaultValue}, which is JSON null unless the expression supplied one.
     */
    record VarRef(String path, JsonNode defaultValue) implements ExpressionNode {
        public VarRef {
            Objects.requireNonNull(path, "path");
            defaultValue = defaultValue == null ? NullNode.getInstance() : defaultValue;
        }

        public VarRef(String path) {
            this(path, NullNode.getInstance());
        }

        @Override
        public Kind kind() {
            return Kind.VAR_REF;
        }
    }

    record Operator(String name, List<ExpressionNode> children) implements ExpressionNode {
        public Operator {
            Objects.requireNonNull(name, "name");
            children = children == null ? List.of() : List.copyOf(children);
        }

        @Override
        public Kind kind() {
            return Kind.OPERATOR;
        }
    }

    /**
     * Engine-specific accessor such as {@code settlement.hasStructureType("temple")}.
     *
     * @param namespace  entity namespace ({@code settlement}, {@code structure}, {@code kingdom})
     * @param property   accessor name within the namespace
     * @param arguments  value arguments, not including the explicit id
     * @param explicitId target entity id, or {@code null} for the entity under evaluation
     */
    record DomainOperator(String namespace, String property, List<ExpressionNode> arguments, String explicitId)
            implements ExpressionNode {
        public DomainOperator {
            Objects.requireNonNull(namespace, "namespace");
            Objects.requireNonNull(property, "property");
            arguments = arguments == null ? List.of() : List.copyOf(arguments);
        }

        public String qualifiedName() {
            return namespace + "." + property;
        }

        @Override
        public Kind kind() {
            return Kind.DOMAIN_OPERATOR;
        }
    }
}
