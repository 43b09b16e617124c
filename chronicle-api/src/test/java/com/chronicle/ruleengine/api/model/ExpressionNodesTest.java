/*
 * Copyright (c) 2025 Chronicle Rule Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.chronicle.ruleengine.api.model;

import com.chronicle.ruleengine.api.exceptions.EvaluationException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ExpressionNodesTest {

    private final ObjectMapper mapper = new ObjectMapper();

    private JsonNode json(String text) throws Exception {
        return mapper.readTree(text);
    }

    @Test
    @DisplayName("Comparison with var converts to operator over var ref and literal")
    void convertsComparison() throws Exception {
        ExpressionNode node = ExpressionNodes.fromJson(json("{\">\": [{\"var\": \"population\"}, 10000]}"));

        assertThat(node).isInstanceOf(ExpressionNode.Operator.class);
        ExpressionNode.Operator op = (ExpressionNode.Operator) node;
        assertThat(op.name()).isEqualTo(">");
        assertThat(op.children()).hasSize(2);
        assertThat(op.children().get(0)).isEqualTo(new ExpressionNode.VarRef("population"));
        assertThat(((ExpressionNode.Literal) op.children().get(1)).value().asInt()).isEqualTo(10000);
    }

    @Test
    @DisplayName("var with default keeps the default value")
    void varWithDefault() throws Exception {
        ExpressionNode node = ExpressionNodes.fromJson(json("{\"var\": [\"gold\", 5]}"));

        ExpressionNode.VarRef ref = (ExpressionNode.VarRef) node;
        assertThat(ref.path()).isEqualTo("gold");
        assertThat(ref.defaultValue().asInt()).isEqualTo(5);
    }

    @Test
    @DisplayName("Domain operator splits value arguments from the explicit id")
    void domainOperatorExplicitId() throws Exception {
        ExpressionNode node = ExpressionNodes.fromJson(json("{\"settlement.hasStructureType\": [\"temple\", \"s-9\"]}"));

        ExpressionNode.DomainOperator op = (ExpressionNode.DomainOperator) node;
        assertThat(op.namespace()).isEqualTo("settlement");
        assertThat(op.property()).isEqualTo("hasStructureType");
        assertThat(op.arguments()).hasSize(1);
        assertThat(op.explicitId()).isEqualTo("s-9");
    }

    @Test
    @DisplayName("Zero-arity domain operator with one argument treats it as the explicit id")
    void zeroArityDomainOperator() throws Exception {
        ExpressionNode.DomainOperator op =
                (ExpressionNode.DomainOperator) ExpressionNodes.fromJson(json("{\"settlement.level\": [\"s-2\"]}"));

        assertThat(op.arguments()).isEmpty();
        assertThat(op.explicitId()).isEqualTo("s-2");
    }

    @Test
    @DisplayName("Dotted operator outside the domain namespaces stays a plain operator")
    void unknownNamespaceIsOperator() throws Exception {
        ExpressionNode node = ExpressionNodes.fromJson(json("{\"party.size\": []}"));

        assertThat(node.kind()).isEqualTo(ExpressionNode.Kind.OPERATOR);
    }

    @Test
    void constantArrayIsLiteralAndMixedArrayIsOperator() throws Exception {
        assertThat(ExpressionNodes.fromJson(json("[1, 2, 3]")).kind()).isEqualTo(ExpressionNode.Kind.LITERAL);

        ExpressionNode mixed = ExpressionNodes.fromJson(json("[1, {\"var\": \"x\"}]"));
        assertThat(mixed.kind()).isEqualTo(ExpressionNode.Kind.OPERATOR);
        assertThat(((ExpressionNode.Operator) mixed).name()).isEqualTo(ExpressionNodes.ARRAY_OPERATOR);
    }

    @Test
    @DisplayName("Object with several keys is rejected")
    void rejectsMultiKeyObject() throws Exception {
        JsonNode malformed = json("{\"and\": [true], \"or\": [false]}");

        assertThatThrownBy(() -> ExpressionNodes.fromJson(malformed))
                .isInstanceOf(EvaluationException.class)
                .hasMessageContaining("exactly one operator key");
    }

    @Test
    void toJsonRestoresWireForm() throws Exception {
        JsonNode original = json("{\"and\":[{\">\":[{\"var\":\"population\"},10000]},"
                + "{\"settlement.hasStructureType\":[\"temple\",\"s-9\"]},{\"var\":[\"gold\",0]}]}");

        assertThat(ExpressionNodes.toJson(ExpressionNodes.fromJson(original))).isEqualTo(original);
    }

    @Test
    @DisplayName("Depth counts operators and ignores literal arrays")
    void depth() throws Exception {
        assertThat(ExpressionNodes.depth(ExpressionNodes.fromJson(json("5")))).isEqualTo(1);
        assertThat(ExpressionNodes.depth(ExpressionNodes.fromJson(json("{\"in\": [{\"var\": \"x\"}, [1, 2]]}"))))
                .isEqualTo(2);
        assertThat(ExpressionNodes.depth(ExpressionNodes.fromJson(
                json("{\"!\": [{\"!\": [{\"!\": [true]}]}]}")))).isEqualTo(4);
    }

    @Test
    void collectsVariablePaths() throws Exception {
        ExpressionNode node = ExpressionNodes.fromJson(json(
                "{\"+\": [{\"var\": \"a\"}, {\"*\": [{\"var\": \"b.c\"}, {\"var\": \"a\"}]}]}"));

        assertThat(ExpressionNodes.variablePaths(node)).containsExactly("a", "b.c");
    }
}
