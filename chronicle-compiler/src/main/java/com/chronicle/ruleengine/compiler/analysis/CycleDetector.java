/*
 * Copyright (c) 2025 Chronicle Rule Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.chronicle.ruleengine.compiler.analysis;

import com.chronicle.ruleengine.api.model.CycleReport;
import com.chronicle.ruleengine.runtime.model.DependencyGraph;
import it.unimi.dsi.fastutil.ints.Int2IntOpenHashMap;
import it.unimi.dsi.fastutil.ints.IntArrayFIFOQueue;
import it.unimi.dsi.fastutil.ints.IntArrayList;
import it.unimi.dsi.fastutil.ints.IntList;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Comparator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Finds cycles in the "depends on" relation of a {@link DependencyGraph}.
 *
 * <p>Depth-first search with white/grey/black colouring, driven by an explicit stack so deep
 * chains cannot overflow the call stack. Every back edge yields one cycle; cycles are rotated to
 * start at their smallest key and de-duplicated, so the report does not depend on the order in
 * which definitions were inserted.
 */
public class CycleDetector {

    private static final byte WHITE = 0;
    private static final byte GREY = 1;
    private static final byte BLACK = 2;

    public CycleReport detect(DependencyGraph graph) {
        int n = graph.nodeCount();
        byte[] colour = new byte[n];
        Set<List<String>> cycles = new LinkedHashSet<>();

        Integer[] roots = new Integer[n];
        for (int i = 0; i < n; i++) {
            roots[i] = i;
        }
        Arrays.sort(roots, Comparator.comparing((Integer i) -> graph.node(i).key()));

        IntList path = new IntArrayList();
        IntList cursor = new IntArrayList();
        for (int root : roots) {
            if (colour[root] != WHITE) {
                continue;
            }
            colour[root] = GREY;
            path.add(root);
            cursor.add(0);
            while (!path.isEmpty()) {
                int top = path.size() - 1;
                int node = path.getInt(top);
                IntList deps = graph.dependenciesOf(node);
                int next = cursor.getInt(top);
                if (next < deps.size()) {
                    cursor.set(top, next + 1);
                    int dep = deps.getInt(next);
                    if (colour[dep] == WHITE) {
                        colour[dep] = GREY;
                        path.add(dep);
                        cursor.add(0);
                    } else if (colour[dep] == GREY) {
                        cycles.add(normalise(cycleFromPath(graph, path, dep)));
                    }
                } else {
                    colour[node] = BLACK;
                    path.removeInt(top);
                    cursor.removeInt(top);
                }
            }
        }
        return new CycleReport(new ArrayList<>(cycles));
    }

    /**
     * Shortest cycle passing through {@code nodeKey}, if any.
     */
    public Optional<List<String>> findCycleThrough(DependencyGraph graph, String nodeKey) {
        int start = graph.indexOf(nodeKey);
        if (start < 0) {
            return Optional.empty();
        }
        Int2IntOpenHashMap parent = new Int2IntOpenHashMap();
        parent.defaultReturnValue(-1);
        IntArrayFIFOQueue queue = new IntArrayFIFOQueue();
        queue.enqueue(start);
        while (!queue.isEmpty()) {
            int node = queue.dequeueInt();
            IntList deps = graph.dependenciesOf(node);
            for (int i = 0; i < deps.size(); i++) {
                int dep = deps.getInt(i);
                if (dep == start) {
                    List<String> cycle = new ArrayList<>();
                    for (int at = node; at != start; at = parent.get(at)) {
                        cycle.add(0, graph.node(at).key());
                    }
                    cycle.add(0, nodeKey);
                    cycle.add(nodeKey);
                    return Optional.of(cycle);
                }
                if (!parent.containsKey(dep)) {
                    parent.put(dep, node);
                    queue.enqueue(dep);
                }
            }
        }
        return Optional.empty();
    }

    private static List<String> cycleFromPath(DependencyGraph graph, IntList path, int repeated) {
        List<String> cycle = new ArrayList<>();
        int from = path.lastIndexOf(repeated);
        for (int i = from; i < path.size(); i++) {
            cycle.add(graph.node(path.getInt(i)).key());
        }
        return cycle;
    }

    /** Rotates to the smallest key and closes the cycle. */
    private static List<String> normalise(List<String> open) {
        int min = 0;
        for (int i = 1; i < open.size(); i++) {
            if (open.get(i).compareTo(open.get(min)) < 0) {
                min = i;
            }
        }
        List<String> cycle = new ArrayList<>(open.size() + 1);
        for (int i = 0; i < open.size(); i++) {
            cycle.add(open.get((min + i) % open.size()));
        }
        cycle.add(cycle.get(0));
        return cycle;
    }
}
