/*
 * Copyright (c) 2025 Chronicle Rule Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.chronicle.ruleengine.infra.management;

import com.chronicle.ruleengine.api.IGraphCompiler;
import com.chronicle.ruleengine.api.model.Effect;
import com.chronicle.ruleengine.api.model.GraphOverlay;
import com.chronicle.ruleengine.infra.metrics.RuleEngineMetrics;
import com.chronicle.ruleengine.runtime.model.DependencyGraph;

import java.util.Collection;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicReference;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Holds the compiled dependency graph of every campaign branch.
 *
 * <p>Graphs are compiled lazily and swapped as whole objects, so readers always see a complete
 * graph without locking. Rebuilds are idempotent and may race; the last completed rebuild wins.
 * A graph compiled while {@link #invalidateGraph} ran is returned to its caller but not installed:
 * each slot holds a {@code (generation, graph)} pair that is only ever replaced by compare-and-set
 * against the pair the compile started from.
 */
public class DependencyGraphManager {

    private static final Logger logger = Logger.getLogger(DependencyGraphManager.class.getName());

    private record Installed(long generation, DependencyGraph graph) {
        static final Installed EMPTY = new Installed(0, null);

        Installed next(DependencyGraph replacement) {
            return new Installed(generation + 1, replacement);
        }
    }

    private static final class Slot {
        final AtomicReference<Installed> state = new AtomicReference<>(Installed.EMPTY);
    }

    private final IGraphCompiler compiler;
    private final RuleEngineMetrics metrics;
    private final ConcurrentHashMap<String, Slot> graphs = new ConcurrentHashMap<>();

    public DependencyGraphManager(IGraphCompiler compiler, RuleEngineMetrics metrics) {
        this.compiler = compiler;
        this.metrics = metrics;
    }

    /**
     * Current graph, compiled on first use.
     */
    public DependencyGraph getGraph(String campaignId, String branchId) {
        Slot slot = slot(campaignId, branchId);
        Installed observed = slot.state.get();
        if (observed.graph() != null) {
            return observed.graph();
        }
        DependencyGraph built = compiler.compile(campaignId, branchId);
        if (slot.state.compareAndSet(observed, new Installed(observed.generation(), built))) {
            installed(campaignId, branchId, built);
            return built;
        }
        DependencyGraph winner = slot.state.get().graph();
        return winner != null ? winner : built;
    }

    /**
     * Compiles and installs a fresh graph regardless of the current one.
     */
    public DependencyGraph rebuild(String campaignId, String branchId) {
        Slot slot = slot(campaignId, branchId);
        DependencyGraph built = compiler.compile(campaignId, branchId);
        slot.state.getAndUpdate(current -> current.next(built));
        installed(campaignId, branchId, built);
        return built;
    }

    /**
     * Compiles a graph with proposed definitions layered over the stored ones. Never installed.
     */
    public DependencyGraph compileCandidate(String campaignId, String branchId, GraphOverlay overlay) {
        return compiler.compile(campaignId, branchId, overlay);
    }

    /** Ordering graph for an ad-hoc batch of effects. Never installed. */
    public DependencyGraph compileEffects(String campaignId, String branchId, Collection<Effect> effects) {
        return compiler.compileEffects(campaignId, branchId, effects);
    }

    /**
     * Drops the installed graph; the next {@link #getGraph} recompiles.
     *
     * @return true if a graph was installed
     */
    public boolean invalidateGraph(String campaignId, String branchId) {
        Slot slot = graphs.get(key(campaignId, branchId));
        if (slot == null) {
            return false;
        }
        DependencyGraph dropped = slot.state.getAndUpdate(current -> current.next(null)).graph();
        if (dropped != null && logger.isLoggable(Level.FINE)) {
            logger.fine(String.format("Dropped dependency graph for %s/%s", campaignId, branchId));
        }
        return dropped != null;
    }

    public Optional<DependencyGraph> peek(String campaignId, String branchId) {
        Slot slot = graphs.get(key(campaignId, branchId));
        return slot == null ? Optional.empty() : Optional.ofNullable(slot.state.get().graph());
    }

    private void installed(String campaignId, String branchId, DependencyGraph graph) {
        metrics.graphNodes(campaignId, branchId, graph.nodeCount());
    }

    private Slot slot(String campaignId, String branchId) {
        return graphs.computeIfAbsent(key(campaignId, branchId), k -> new Slot());
    }

    private static String key(String campaignId, String branchId) {
        return campaignId + ":" + branchId;
    }
}
