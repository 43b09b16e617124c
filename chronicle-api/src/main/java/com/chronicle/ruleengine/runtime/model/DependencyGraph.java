/*
 * Copyright (c) 2025 Chronicle Rule Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.chronicle.ruleengine.runtime.model;

import com.chronicle.ruleengine.api.model.CycleReport;
import it.unimi.dsi.fastutil.ints.IntArrayList;
import it.unimi.dsi.fastutil.ints.IntList;
import it.unimi.dsi.fastutil.ints.IntLists;
import it.unimi.dsi.fastutil.longs.LongOpenHashSet;
import it.unimi.dsi.fastutil.longs.LongSet;
import it.unimi.dsi.fastutil.objects.Object2IntMap;
import it.unimi.dsi.fastutil.objects.Object2IntOpenHashMap;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Read/write dependency graph of one campaign branch.
 *
 * <p>Nodes live in an arena addressed by {@code int} index; edges are stored as parallel arrays
 * and indexed both ways with {@link IntList} adjacency. Nothing holds a reference to another
 * node object, so cyclic definitions never produce cyclic object graphs.
 *
 * <p>Edges are directed {@code READS} (a condition or formula reads a variable) and
 * {@code WRITES} (an effect writes a variable). Both are folded into a single
 * "depends on" relation:
 * <ul>
 *   <li>{@code X READS Y} means X depends on Y</li>
 *   <li>{@code E WRITES V} means V depends on E</li>
 * </ul>
 * Cycle detection and evaluation ordering run over that relation; invalidation walks it backwards.
 *
 * <p>Instances are immutable once built and are replaced as a whole when definitions change.
 */
public final class DependencyGraph {

    public static final String VARIABLE_PREFIX = "variable:";
    public static final String DERIVED_PREFIX = "derived:";
    public static final String CONDITION_PREFIX = "condition:";
    public static final String EFFECT_PREFIX = "effect:";

    public enum NodeType {
        VARIABLE,
        CONDITION,
        EFFECT
    }

    public enum EdgeType {
        READS,
        WRITES
    }

    /**
     * Graph vertex.
     *
     * @param virtual      true when no stored row backs the node (entity properties, unknown names)
     * @param entityType   entity the definition is bound to, or {@code null}
     * @param entityId     bound entity id, {@code null} for type-wide or unbound nodes
     * @param sourceId     id of the condition, variable or effect row, {@code null} for virtual nodes
     */
    public record Node(
            int index,
            String key,
            NodeType type,
            boolean virtual,
            int priority,
            long creationOrder,
            String entityType,
            String entityId,
            String sourceId
    ) {
        public String name() {
            int colon = key.indexOf(':');
            return colon < 0 ? key : key.substring(colon + 1);
        }

        public boolean isDerivedVariable() {
            return key.startsWith(DERIVED_PREFIX);
        }
    }

    public record Edge(int from, int to, EdgeType type) {
    }

    private final String campaignId;
    private final String branchId;
    private final List<Node> nodes;
    private final Object2IntMap<String> keyIndex;
    private final int[] edgeFrom;
    private final int[] edgeTo;
    private final EdgeType[] edgeTypes;
    private final IntList[] dependencies;
    private final IntList[] dependents;

    private final CycleReport cycles;
    private final IntList evaluationOrder;

    private DependencyGraph(Builder builder) {
        this.campaignId = builder.campaignId;
        this.branchId = builder.branchId;
        this.nodes = Collections.unmodifiableList(new ArrayList<>(builder.nodes));
        this.keyIndex = new Object2IntOpenHashMap<>(builder.keyIndex);
        this.keyIndex.defaultReturnValue(-1);
        this.edgeFrom = builder.edgeFrom.toIntArray();
        this.edgeTo = builder.edgeTo.toIntArray();
        this.edgeTypes = builder.edgeTypes.toArray(new EdgeType[0]);

        int n = nodes.size();
        this.dependencies = new IntList[n];
        this.dependents = new IntList[n];
        for (int i = 0; i < n; i++) {
            dependencies[i] = new IntArrayList();
            dependents[i] = new IntArrayList();
        }
        for (int e = 0; e < edgeFrom.length; e++) {
            int dependent = edgeTypes[e] == EdgeType.READS ? edgeFrom[e] : edgeTo[e];
            int dependency = edgeTypes[e] == EdgeType.READS ? edgeTo[e] : edgeFrom[e];
            dependencies[dependent].add(dependency);
            dependents[dependency].add(dependent);
        }
        for (int i = 0; i < n; i++) {
            dependencies[i] = IntLists.unmodifiable(dependencies[i]);
            dependents[i] = IntLists.unmodifiable(dependents[i]);
        }
        this.cycles = CycleReport.none();
        this.evaluationOrder = IntLists.EMPTY_LIST;
    }

    private DependencyGraph(DependencyGraph source, CycleReport cycles, IntList evaluationOrder) {
        this.campaignId = source.campaignId;
        this.branchId = source.branchId;
        this.nodes = source.nodes;
        this.keyIndex = source.keyIndex;
        this.edgeFrom = source.edgeFrom;
        this.edgeTo = source.edgeTo;
        this.edgeTypes = source.edgeTypes;
        this.dependencies = source.dependencies;
        this.dependents = source.dependents;
        this.cycles = cycles;
        this.evaluationOrder = IntLists.unmodifiable(new IntArrayList(evaluationOrder));
    }

    /**
     * Returns a copy sharing this graph's structure with analysis results attached.
     * The evaluation order should be empty when the graph has cycles.
     */
    public DependencyGraph withAnalysis(CycleReport cycleReport, IntList order) {
        return new DependencyGraph(this, Objects.requireNonNull(cycleReport), Objects.requireNonNull(order));
    }

    public static Builder builder(String campaignId, String branchId) {
        return new Builder(campaignId, branchId);
    }

    public static String variableKey(String name) {
        return VARIABLE_PREFIX + name;
    }

    public static String derivedKey(String variableId) {
        return DERIVED_PREFIX + variableId;
    }

    public static String conditionKey(String conditionId) {
        return CONDITION_PREFIX + conditionId;
    }

    public static String effectKey(String effectId) {
        return EFFECT_PREFIX + effectId;
    }

    // ========================================================================
    // ACCESSORS
    // ========================================================================

    public String getCampaignId() {
        return campaignId;
    }

    public String getBranchId() {
        return branchId;
    }

    public int nodeCount() {
        return nodes.size();
    }

    public int edgeCount() {
        return edgeFrom.length;
    }

    public Node node(int index) {
        return nodes.get(index);
    }

    public List<Node> nodes() {
        return nodes;
    }

    /** Index of the node with this key, or -1. */
    public int indexOf(String key) {
        return keyIndex.getInt(key);
    }

    public Optional<Node> findNode(String key) {
        int index = indexOf(key);
        return index < 0 ? Optional.empty() : Optional.of(nodes.get(index));
    }

    public Edge edge(int edgeIndex) {
        return new Edge(edgeFrom[edgeIndex], edgeTo[edgeIndex], edgeTypes[edgeIndex]);
    }

    /** Nodes that {@code index} depends on. */
    public IntList dependenciesOf(int index) {
        return dependencies[index];
    }

    /** Nodes that depend on {@code index}. */
    public IntList dependentsOf(int index) {
        return dependents[index];
    }

    public CycleReport getCycles() {
        return cycles;
    }

    public boolean isAcyclic() {
        return !cycles.hasCycles();
    }

    /** Dependencies-first order over all nodes; empty if the graph has cycles. */
    public IntList getEvaluationOrder() {
        return evaluationOrder;
    }

    public List<String> getEvaluationOrderKeys() {
        List<String> keys = new ArrayList<>(evaluationOrder.size());
        for (int i = 0; i < evaluationOrder.size(); i++) {
            keys.add(nodes.get(evaluationOrder.getInt(i)).key());
        }
        return keys;
    }

    public List<Node> nodesOfType(NodeType type) {
        List<Node> result = new ArrayList<>();
        for (Node node : nodes) {
            if (node.type() == type) {
                result.add(node);
            }
        }
        return result;
    }

    @Override
    public String toString() {
        return String.format("DependencyGraph{campaign=%s, branch=%s, nodes=%d, edges=%d, cycles=%d}",
                campaignId, branchId, nodes.size(), edgeFrom.length, cycles.cycles().size());
    }

    // ========================================================================
    // BUILDER
    // ========================================================================

    public static final class Builder {
        private final String campaignId;
        private final String branchId;
        private final List<Node> nodes = new ArrayList<>();
        private final Object2IntOpenHashMap<String> keyIndex = new Object2IntOpenHashMap<>();
        private final IntArrayList edgeFrom = new IntArrayList();
        private final IntArrayList edgeTo = new IntArrayList();
        private final List<EdgeType> edgeTypes = new ArrayList<>();
        private final LongSet edgeSet = new LongOpenHashSet();

        private Builder(String campaignId, String branchId) {
            this.campaignId = campaignId;
            this.branchId = branchId;
            keyIndex.defaultReturnValue(-1);
        }

        /**
         * Returns the index of the virtual VARIABLE node for {@code name}, creating it on demand.
         */
        public int variable(String name) {
            String key = variableKey(name);
            int existing = keyIndex.getInt(key);
            if (existing >= 0) {
                return existing;
            }
            return append(key, NodeType.VARIABLE, true, 0, Long.MAX_VALUE, null, null, null);
        }

        /**
         * Marks the VARIABLE node for {@code name} as backed by a stored row.
         */
        public int concreteVariable(String name) {
            int index = variable(name);
            Node node = nodes.get(index);
            if (node.virtual()) {
                nodes.set(index, new Node(index, node.key(), node.type(), false, node.priority(),
                        node.creationOrder(), node.entityType(), node.entityId(), node.sourceId()));
            }
            return index;
        }

        /**
         * Adds (or replaces) a concrete definition node.
         */
        public int definition(String key, NodeType type, int priority, long creationOrder,
                              String entityType, String entityId, String sourceId) {
            int existing = keyIndex.getInt(key);
            if (existing >= 0) {
                nodes.set(existing, new Node(existing, key, type, false, priority, creationOrder,
                        entityType, entityId, sourceId));
                return existing;
            }
            return append(key, type, false, priority, creationOrder, entityType, entityId, sourceId);
        }

        private int append(String key, NodeType type, boolean virtual, int priority, long creationOrder,
                           String entityType, String entityId, String sourceId) {
            int index = nodes.size();
            nodes.add(new Node(index, key, type, virtual, priority, creationOrder, entityType, entityId, sourceId));
            keyIndex.put(key, index);
            return index;
        }

        /**
         * Adds a directed edge; duplicates are ignored.
         */
        public Builder edge(int from, int to, EdgeType type) {
            long id = (((long) from << 31) ^ to) << 1 | type.ordinal();
            if (edgeSet.add(id)) {
                edgeFrom.add(from);
                edgeTo.add(to);
                edgeTypes.add(type);
            }
            return this;
        }

        public int nodeCount() {
            return nodes.size();
        }

        public DependencyGraph build() {
            return new DependencyGraph(this);
        }
    }
}
