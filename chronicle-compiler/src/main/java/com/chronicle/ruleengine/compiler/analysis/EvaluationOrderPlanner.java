/*
 * Copyright (c) 2025 Chronicle Rule Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.chronicle.ruleengine.compiler.analysis;

import com.chronicle.ruleengine.api.exceptions.CircularDependencyException;
import com.chronicle.ruleengine.runtime.model.DependencyGraph;
import it.unimi.dsi.fastutil.ints.IntArrayList;
import it.unimi.dsi.fastutil.ints.IntList;

import java.util.Comparator;
import java.util.List;
import java.util.PriorityQueue;

/**
 * Topological order over a {@link DependencyGraph}, dependencies first (Kahn's algorithm).
 *
 * <p>Among nodes that are ready at the same time the order is priority ascending, then creation
 * order, then key, so the result is deterministic.
 */
public class EvaluationOrderPlanner {

    private final CycleDetector cycleDetector;

    public EvaluationOrderPlanner(CycleDetector cycleDetector) {
        this.cycleDetector = cycleDetector;
    }

    public EvaluationOrderPlanner() {
        this(new CycleDetector());
    }

    /**
     * @throws CircularDependencyException if some nodes can never become ready
     */
    public IntList plan(DependencyGraph graph) {
        int n = graph.nodeCount();
        int[] pending = new int[n];
        PriorityQueue<DependencyGraph.Node> ready = new PriorityQueue<>(tieBreak());
        for (int i = 0; i < n; i++) {
            pending[i] = graph.dependenciesOf(i).size();
            if (pending[i] == 0) {
                ready.add(graph.node(i));
            }
        }

        IntList order = new IntArrayList(n);
        while (!ready.isEmpty()) {
            int node = ready.poll().index();
            order.add(node);
            IntList dependents = graph.dependentsOf(node);
            for (int i = 0; i < dependents.size(); i++) {
                int dependent = dependents.getInt(i);
                if (--pending[dependent] == 0) {
                    ready.add(graph.node(dependent));
                }
            }
        }

        if (order.size() < n) {
            List<List<String>> cycles = cycleDetector.detect(graph).cycles();
            throw new CircularDependencyException(cycles.isEmpty() ? List.of() : cycles.get(0));
        }
        return order;
    }

    /** Ordering among simultaneously ready nodes. */
    public static Comparator<DependencyGraph.Node> tieBreak() {
        return Comparator.comparingInt(DependencyGraph.Node::priority)
                .thenComparingLong(DependencyGraph.Node::creationOrder)
                .thenComparing(DependencyGraph.Node::key);
    }
}
