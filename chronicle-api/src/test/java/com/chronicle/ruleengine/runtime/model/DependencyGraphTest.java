/*
 * Copyright (c) 2025 Chronicle Rule Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.chronicle.ruleengine.runtime.model;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class DependencyGraphTest {

    @Test
    @DisplayName("READS edges point dependents at their dependencies")
    void readsEdges() {
        DependencyGraph.Builder builder = DependencyGraph.builder("c1", "main");
        int population = builder.concreteVariable("population");
        int condition = builder.definition(DependencyGraph.conditionKey("prosperity"),
                DependencyGraph.NodeType.CONDITION, 0, 1, "settlement", "s1", "prosperity");
        builder.edge(condition, population, DependencyGraph.EdgeType.READS);

        DependencyGraph graph = builder.build();

        assertThat((List<Integer>) graph.dependenciesOf(condition)).containsExactly(population);
        assertThat((List<Integer>) graph.dependentsOf(population)).containsExactly(condition);
        assertThat(graph.node(population).virtual()).isFalse();
    }

    @Test
    @DisplayName("WRITES edges make the written variable depend on the effect")
    void writesEdges() {
        DependencyGraph.Builder builder = DependencyGraph.builder("c1", "main");
        int level = builder.variable("settlement.level");
        int effect = builder.definition(DependencyGraph.effectKey("e1"),
                DependencyGraph.NodeType.EFFECT, 1, 1, "settlement", "s1", "e1");
        builder.edge(effect, level, DependencyGraph.EdgeType.WRITES);

        DependencyGraph graph = builder.build();

        assertThat((List<Integer>) graph.dependenciesOf(level)).containsExactly(effect);
        assertThat((List<Integer>) graph.dependentsOf(effect)).containsExactly(level);
        assertThat(graph.node(level).virtual()).isTrue();
    }

    @Test
    void duplicateEdgesAndNodesAreCollapsed() {
        DependencyGraph.Builder builder = DependencyGraph.builder("c1", "main");
        int a = builder.variable("a");
        int again = builder.variable("a");
        int b = builder.variable("b");
        builder.edge(a, b, DependencyGraph.EdgeType.READS);
        builder.edge(a, b, DependencyGraph.EdgeType.READS);

        DependencyGraph graph = builder.build();

        assertThat(again).isEqualTo(a);
        assertThat(graph.nodeCount()).isEqualTo(2);
        assertThat(graph.edgeCount()).isEqualTo(1);
        assertThat(graph.indexOf("variable:a")).isEqualTo(a);
        assertThat(graph.indexOf("variable:missing")).isEqualTo(-1);
        assertThat(graph.findNode("variable:b")).isPresent();
    }
}
