/*
 * Copyright (c) 2025 Chronicle Rule Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.chronicle.ruleengine.compiler;

import com.chronicle.ruleengine.api.IGraphCompiler;
import com.chronicle.ruleengine.api.exceptions.CircularDependencyException;
import com.chronicle.ruleengine.api.model.Condition;
import com.chronicle.ruleengine.api.model.CycleReport;
import com.chronicle.ruleengine.api.model.Effect;
import com.chronicle.ruleengine.api.model.GraphOverlay;
import com.chronicle.ruleengine.api.model.StateVariable;
import com.chronicle.ruleengine.api.spi.ConditionStore;
import com.chronicle.ruleengine.api.spi.EffectStore;
import com.chronicle.ruleengine.api.spi.VariableStore;
import com.chronicle.ruleengine.compiler.analysis.CycleDetector;
import com.chronicle.ruleengine.compiler.analysis.EvaluationOrderPlanner;
import com.chronicle.ruleengine.compiler.extraction.DependencyExtractor;
import com.chronicle.ruleengine.runtime.model.DependencyGraph;
import com.chronicle.ruleengine.runtime.model.DependencyGraph.EdgeType;
import com.chronicle.ruleengine.runtime.model.DependencyGraph.NodeType;
import io.opentelemetry.api.trace.Span;
import io.opentelemetry.api.trace.Tracer;
import io.opentelemetry.context.Scope;
import it.unimi.dsi.fastutil.ints.IntLists;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.TimeUnit;
import java.util.function.Function;
import java.util.function.Predicate;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Compiles the live conditions, state variables and effects of a campaign into a
 * {@link DependencyGraph}.
 *
 * <h2>Nodes</h2>
 * <ul>
 *   <li>{@code variable:<name>} for every name something reads or writes; concrete when a
 *       stored or derived variable with that key exists</li>
 *   <li>{@code derived:<id>} for derived variables, provider of {@code variable:<key>}</li>
 *   <li>{@code condition:<id>}, provider of {@code variable:<field>}</li>
 *   <li>{@code effect:<id>}, writing the names its patch touches</li>
 * </ul>
 *
 * <p>Read paths are normalised with {@link DependencyExtractor#readName}; patch pointers with
 * {@link DependencyExtractor#writeNames}. An effect never gets a read edge to a name it writes
 * itself, so test-then-replace patches do not form self cycles.
 */
public class DependencyGraphCompiler implements IGraphCompiler {

    private static final Logger logger = Logger.getLogger(DependencyGraphCompiler.class.getName());

    private final ConditionStore conditionStore;
    private final VariableStore variableStore;
    private final EffectStore effectStore;
    private final Tracer tracer;
    private final CycleDetector cycleDetector;
    private final EvaluationOrderPlanner orderPlanner;

    public DependencyGraphCompiler(ConditionStore conditionStore, VariableStore variableStore,
                                   EffectStore effectStore, Tracer tracer) {
        this.conditionStore = conditionStore;
        this.variableStore = variableStore;
        this.effectStore = effectStore;
        this.tracer = tracer;
        this.cycleDetector = new CycleDetector();
        this.orderPlanner = new EvaluationOrderPlanner(cycleDetector);
    }

    @Override
    public DependencyGraph compile(String campaignId, String branchId) {
        return compile(campaignId, branchId, GraphOverlay.none());
    }

    @Override
    public DependencyGraph compile(String campaignId, String branchId, GraphOverlay overlay) {
        Span span = tracer.spanBuilder("compile-dependency-graph").startSpan();
        try (Scope scope = span.makeCurrent()) {
            long start = System.nanoTime();
            span.setAttribute("campaignId", campaignId);
            span.setAttribute("branchId", branchId);
            span.setAttribute("candidate", !overlay.isEmpty());

            List<StateVariable> variables = merge(variableStore.findActiveByCampaign(campaignId),
                    overlay.variables(), overlay.removedIds(), StateVariable::id, StateVariable::isLive,
                    Comparator.comparing(StateVariable::createdAt).thenComparing(StateVariable::id));
            List<Condition> conditions = merge(conditionStore.findActiveByCampaign(campaignId),
                    overlay.conditions(), overlay.removedIds(), Condition::id, Condition::isLive,
                    Comparator.comparing(Condition::createdAt).thenComparing(Condition::id));
            List<Effect> effects = merge(effectStore.findActiveByCampaign(campaignId),
                    overlay.effects(), overlay.removedIds(), Effect::id, Effect::isLive,
                    Comparator.comparing(Effect::createdAt).thenComparing(Effect::id));

            DependencyGraph.Builder builder = DependencyGraph.builder(campaignId, branchId);
            addVariables(builder, variables);
            addConditions(builder, conditions);
            addEffects(builder, effects);

            DependencyGraph graph = analyse(builder.build());

            span.setAttribute("nodeCount", graph.nodeCount());
            span.setAttribute("edgeCount", graph.edgeCount());
            span.setAttribute("cycleCount", graph.getCycles().cycles().size());
            span.setAttribute("compilationTimeMs", TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - start));

            if (!overlay.isEmpty()) {
                if (logger.isLoggable(Level.FINE)) {
                    logger.fine(String.format("Compiled candidate graph for %s/%s: %s", campaignId, branchId, graph));
                }
            } else if (!graph.isAcyclic()) {
                logger.warning(String.format("Dependency graph for %s/%s has %d cycle(s): %s",
                        campaignId, branchId, graph.getCycles().cycles().size(), graph.getCycles().cycles()));
            } else {
                logger.info(String.format("Compiled dependency graph for %s/%s: %d nodes, %d edges",
                        campaignId, branchId, graph.nodeCount(), graph.edgeCount()));
            }
            return graph;
        } catch (RuntimeException e) {
            span.recordException(e);
            throw e;
        } finally {
            span.end();
        }
    }

    /**
     * Graph restricted to the given effects and the names they read and write.
     * Used to order an ad-hoc batch of effects.
     */
    @Override
    public DependencyGraph compileEffects(String campaignId, String branchId, Collection<Effect> effects) {
        DependencyGraph.Builder builder = DependencyGraph.builder(campaignId, branchId);
        addEffects(builder, effects);
        return analyse(builder.build());
    }

    private DependencyGraph analyse(DependencyGraph graph) {
        CycleReport cycles = cycleDetector.detect(graph);
        if (cycles.hasCycles()) {
            return graph.withAnalysis(cycles, IntLists.EMPTY_LIST);
        }
        try {
            return graph.withAnalysis(cycles, orderPlanner.plan(graph));
        } catch (CircularDependencyException e) {
            // unreachable when the detector found no cycle
            return graph.withAnalysis(new CycleReport(List.of(e.getCyclePath())), IntLists.EMPTY_LIST);
        }
    }

    // ========================================================================
    // NODES & EDGES
    // ========================================================================

    private static void addVariables(DependencyGraph.Builder builder, List<StateVariable> variables) {
        for (StateVariable variable : variables) {
            int name = builder.concreteVariable(variable.key());
            if (!variable.isDerived()) {
                continue;
            }
            int derived = builder.definition(DependencyGraph.derivedKey(variable.id()), NodeType.VARIABLE,
                    0, variable.createdAt().toEpochMilli(), variable.scopeEntityType(), variable.scopeId(),
                    variable.id());
            builder.edge(name, derived, EdgeType.READS);
            for (String read : DependencyExtractor.extractReads(variable.formula())) {
                builder.edge(derived, builder.variable(DependencyExtractor.readName(read)), EdgeType.READS);
            }
        }
    }

    private static void addConditions(DependencyGraph.Builder builder, List<Condition> conditions) {
        for (Condition condition : conditions) {
            int node = builder.definition(DependencyGraph.conditionKey(condition.id()), NodeType.CONDITION,
                    condition.priority(), condition.createdAt().toEpochMilli(), condition.entityType(),
                    condition.entityId(), condition.id());
            builder.edge(builder.variable(condition.field()), node, EdgeType.READS);
            for (String read : DependencyExtractor.extractReads(condition.expression())) {
                builder.edge(node, builder.variable(DependencyExtractor.readName(read)), EdgeType.READS);
            }
        }
    }

    private static void addEffects(DependencyGraph.Builder builder, Collection<Effect> effects) {
        for (Effect effect : effects) {
            int node = builder.definition(DependencyGraph.effectKey(effect.id()), NodeType.EFFECT,
                    effect.priority(), effect.createdAt().toEpochMilli(), effect.entityType(),
                    effect.entityId(), effect.id());
            Set<String> written = new HashSet<>();
            for (String pointer : DependencyExtractor.extractWrites(effect.payload())) {
                for (String name : DependencyExtractor.writeNames(effect.entityType(), pointer)) {
                    written.add(name);
                    builder.edge(node, builder.variable(name), EdgeType.WRITES);
                }
            }
            for (String pointer : DependencyExtractor.extractPatchReads(effect.payload())) {
                for (String name : DependencyExtractor.writeNames(effect.entityType(), pointer)) {
                    if (!written.contains(name)) {
                        builder.edge(node, builder.variable(name), EdgeType.READS);
                    }
                }
            }
        }
    }

    /** Stored definitions with overlay entries replacing same-id rows and removed ids hidden. */
    private static <T> List<T> merge(List<T> stored, List<T> proposed, Set<String> removed,
                                     Function<T, String> id, Predicate<T> live,
                                     Comparator<T> order) {
        Map<String, T> byId = new LinkedHashMap<>();
        for (T item : stored) {
            byId.put(id.apply(item), item);
        }
        for (T item : proposed) {
            byId.put(id.apply(item), item);
        }
        List<T> result = new ArrayList<>();
        for (T item : byId.values()) {
            if (!removed.contains(id.apply(item)) && live.test(item)) {
                result.add(item);
            }
        }
        result.sort(order);
        return result;
    }
}
