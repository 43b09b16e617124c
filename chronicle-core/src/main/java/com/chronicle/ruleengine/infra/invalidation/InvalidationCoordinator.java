/*
 * Copyright (c) 2025 Chronicle Rule Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.chronicle.ruleengine.infra.invalidation;

import com.chronicle.ruleengine.api.model.InvalidationReport;
import com.chronicle.ruleengine.api.model.InvalidationScope;
import com.chronicle.ruleengine.api.model.InvalidationScope.ConditionDefinitionChanged;
import com.chronicle.ruleengine.api.model.InvalidationScope.EffectDefinitionChanged;
import com.chronicle.ruleengine.api.model.InvalidationScope.EntityChanged;
import com.chronicle.ruleengine.api.model.InvalidationScope.VariableChanged;
import com.chronicle.ruleengine.infra.cache.CacheKeys;
import com.chronicle.ruleengine.infra.cache.ResultCache;
import com.chronicle.ruleengine.infra.management.DependencyGraphManager;
import com.chronicle.ruleengine.infra.metrics.RuleEngineMetrics;
import com.chronicle.ruleengine.runtime.model.DependencyGraph;
import com.chronicle.ruleengine.runtime.model.DependencyGraph.Node;
import com.chronicle.ruleengine.runtime.model.DependencyGraph.NodeType;
import io.opentelemetry.api.trace.Span;
import io.opentelemetry.api.trace.Tracer;
import io.opentelemetry.context.Scope;
import it.unimi.dsi.fastutil.ints.IntArrayList;
import it.unimi.dsi.fastutil.ints.IntList;
import org.roaringbitmap.IntIterator;
import org.roaringbitmap.RoaringBitmap;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.Objects;
import java.util.Set;
import java.util.TreeSet;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Translates mutations into cache deletes by walking the dependency graph against its edges.
 *
 * <p>Reads are reached through two kinds of names:
 * <ul>
 *   <li><b>local</b> names ({@code population}) resolve inside the context of the entity being
 *       evaluated, so only definitions evaluated for the changed entity are affected;</li>
 *   <li><b>qualified</b> names ({@code settlement.level}, {@code settlement.variables}) may be read
 *       from other entities through domain operators. A reached condition bound to one entity loses
 *       that entity's entry; a type-wide condition loses every entry of its type in the branch.</li>
 * </ul>
 * Structural changes (condition or effect definitions) drop the compiled graph.
 *
 * <p>Cache failures are logged by {@link ResultCache} and never reach the caller.
 */
public class InvalidationCoordinator {

    private static final Logger logger = Logger.getLogger(InvalidationCoordinator.class.getName());

    private static final String VARIABLES_FIELD = "variables";

    private final DependencyGraphManager graphManager;
    private final ResultCache cache;
    private final RuleEngineMetrics metrics;
    private final Tracer tracer;

    public InvalidationCoordinator(DependencyGraphManager graphManager, ResultCache cache,
                                   RuleEngineMetrics metrics, Tracer tracer) {
        this.graphManager = graphManager;
        this.cache = cache;
        this.metrics = metrics;
        this.tracer = tracer;
    }

    /** Keys and patterns collected for one invalidation. */
    private static final class Plan {
        final Set<String> exactKeys = new LinkedHashSet<>();
        final Set<String> patterns = new LinkedHashSet<>();
        final Set<String> affectedNodes = new TreeSet<>();
        boolean graphDropped;
    }

    public InvalidationReport invalidate(InvalidationScope scope) {
        Objects.requireNonNull(scope, "scope");
        Span span = tracer.spanBuilder("invalidate").startSpan();
        try (Scope ignored = span.makeCurrent()) {
            span.setAttribute("scope", scope.getClass().getSimpleName());
            span.setAttribute("campaignId", String.valueOf(scope.campaignId()));
            span.setAttribute("branchId", String.valueOf(scope.branchId()));

            Plan plan = new Plan();
            if (scope instanceof VariableChanged changed) {
                planVariableChanged(changed, plan);
            } else if (scope instanceof EntityChanged changed) {
                planEntityChanged(changed, plan);
            } else if (scope instanceof ConditionDefinitionChanged changed) {
                planConditionChanged(changed, plan);
            } else if (scope instanceof EffectDefinitionChanged changed) {
                plan.graphDropped = true;
                graphManager.invalidateGraph(changed.campaignId(), changed.branchId());
            }

            long removed = cache.deleteAll(new ArrayList<>(plan.exactKeys));
            for (String pattern : plan.patterns) {
                removed += cache.deletePattern(pattern);
            }
            metrics.exactDeletes(plan.exactKeys.size());
            metrics.patternDeletes(plan.patterns.size());

            InvalidationReport report = new InvalidationReport(new ArrayList<>(plan.exactKeys),
                    new ArrayList<>(plan.patterns), new ArrayList<>(plan.affectedNodes), plan.graphDropped);
            span.setAttribute("exactKeys", plan.exactKeys.size());
            span.setAttribute("patterns", plan.patterns.size());
            span.setAttribute("affectedNodes", plan.affectedNodes.size());
            span.setAttribute("entriesRemoved", removed);

            if (logger.isLoggable(Level.FINE)) {
                logger.fine(String.format("Invalidated %s: %d keys, %d patterns, %d entries removed",
                        scope, plan.exactKeys.size(), plan.patterns.size(), removed));
            }
            return report;
        } catch (RuntimeException e) {
            span.recordException(e);
            throw e;
        } finally {
            span.end();
        }
    }

    // ========================================================================
    // SCOPES
    // ========================================================================

    private void planVariableChanged(VariableChanged changed, Plan plan) {
        String branch = changed.branchId();
        DependencyGraph graph = graphOrNull(changed.campaignId(), branch);
        if (graph == null) {
            fallback(changed.scopeType(), branch, plan);
            return;
        }

        int variable = graph.indexOf(DependencyGraph.variableKey(changed.key()));
        if (variable >= 0) {
            // the variable's own cached value when it is derived
            for (int dependency : graph.dependenciesOf(variable)) {
                Node node = graph.node(dependency);
                if (node.isDerivedVariable() && boundTo(node, changed.scopeType(), changed.scopeId())) {
                    plan.exactKeys.add(CacheKeys.derivedVariable(node.sourceId(), branch));
                }
            }
            RoaringBitmap reached = reach(graph, IntArrayList.of(variable));
            forEachReached(graph, reached, variable, plan, node ->
                    invalidateLocal(node, changed.scopeType(), changed.scopeId(), branch, plan));
        }

        IntList qualified = new IntArrayList();
        addIfPresent(graph, qualified, changed.scopeType() + "." + VARIABLES_FIELD);
        if (!qualified.isEmpty()) {
            RoaringBitmap reached = reach(graph, qualified);
            forEachReached(graph, reached, -1, plan, node -> invalidateQualified(node, branch, plan));
        }
    }

    private void planEntityChanged(EntityChanged changed, Plan plan) {
        String branch = changed.branchId();
        plan.exactKeys.add(CacheKeys.computedFields(changed.entityType(), changed.entityId(), branch));
        if (changed.parentType() != null && changed.parentId() != null) {
            plan.exactKeys.add(CacheKeys.computedFields(changed.parentType(), changed.parentId(), branch));
            plan.exactKeys.add(CacheKeys.childList(changed.entityType(), changed.parentType(),
                    changed.parentId(), branch));
        }

        DependencyGraph graph = graphOrNull(changed.campaignId(), branch);
        if (graph == null) {
            fallback(changed.entityType(), branch, plan);
            return;
        }

        for (Node node : graph.nodesOfType(NodeType.VARIABLE)) {
            if (node.isDerivedVariable() && boundTo(node, changed.entityType(), changed.entityId())) {
                plan.exactKeys.add(CacheKeys.derivedVariable(node.sourceId(), branch));
            }
        }

        IntList starts = new IntArrayList();
        String prefix = changed.entityType() + ".";
        if (changed.changedFields().isEmpty()) {
            for (Node node : graph.nodesOfType(NodeType.VARIABLE)) {
                if (!node.isDerivedVariable() && node.name().startsWith(prefix)) {
                    starts.add(node.index());
                }
            }
        } else {
            for (String field : changed.changedFields()) {
                addIfPresent(graph, starts, prefix + field);
            }
        }
        if (changed.parentType() != null) {
            addIfPresent(graph, starts, changed.parentType() + "." + changed.entityType() + "s");
        }
        if (!starts.isEmpty()) {
            RoaringBitmap reached = reach(graph, starts);
            forEachReached(graph, reached, -1, plan, node -> invalidateQualified(node, branch, plan));
        }
    }

    private void planConditionChanged(ConditionDefinitionChanged changed, Plan plan) {
        plan.graphDropped = true;
        graphManager.invalidateGraph(changed.campaignId(), changed.branchId());
        if (changed.entityId() != null) {
            plan.exactKeys.add(CacheKeys.computedFields(changed.entityType(), changed.entityId(), changed.branchId()));
        } else {
            plan.patterns.add(CacheKeys.computedFieldsPattern(changed.entityType(), changed.branchId()));
        }
        if (changed.conditionId() != null) {
            plan.affectedNodes.add(DependencyGraph.conditionKey(changed.conditionId()));
        }
    }

    // ========================================================================
    // NODE TO KEY TRANSLATION
    // ========================================================================

    private static void invalidateLocal(Node node, String entityType, String entityId, String branch, Plan plan) {
        if (node.type() == NodeType.CONDITION) {
            boolean sameEntity = node.entityId() == null
                    ? entityType.equals(node.entityType())
                    : boundTo(node, entityType, entityId);
            if (sameEntity) {
                plan.exactKeys.add(CacheKeys.computedFields(entityType, entityId, branch));
            }
        } else if (node.isDerivedVariable() && boundTo(node, entityType, entityId)) {
            plan.exactKeys.add(CacheKeys.derivedVariable(node.sourceId(), branch));
        }
    }

    private static void invalidateQualified(Node node, String branch, Plan plan) {
        if (node.type() == NodeType.CONDITION) {
            if (node.entityId() != null) {
                plan.exactKeys.add(CacheKeys.computedFields(node.entityType(), node.entityId(), branch));
            } else {
                plan.patterns.add(CacheKeys.computedFieldsPattern(node.entityType(), branch));
            }
        } else if (node.isDerivedVariable()) {
            plan.exactKeys.add(CacheKeys.derivedVariable(node.sourceId(), branch));
        }
    }

    // ========================================================================
    // GRAPH WALK
    // ========================================================================

    /**
     * Reverse-edge BFS: every node that transitively depends on one of {@code starts}, starts included.
     */
    static RoaringBitmap reach(DependencyGraph graph, IntList starts) {
        RoaringBitmap visited = new RoaringBitmap();
        IntArrayList queue = new IntArrayList();
        for (int start : starts) {
            if (visited.checkedAdd(start)) {
                queue.add(start);
            }
        }
        for (int head = 0; head < queue.size(); head++) {
            for (int dependent : graph.dependentsOf(queue.getInt(head))) {
                if (visited.checkedAdd(dependent)) {
                    queue.add(dependent);
                }
            }
        }
        return visited;
    }

    private interface NodeAction {
        void apply(Node node);
    }

    private static void forEachReached(DependencyGraph graph, RoaringBitmap reached, int start, Plan plan,
                                       NodeAction action) {
        IntIterator it = reached.getIntIterator();
        while (it.hasNext()) {
            int index = it.next();
            Node node = graph.node(index);
            if (index != start && !node.virtual()) {
                plan.affectedNodes.add(node.key());
            }
            action.apply(node);
        }
    }

    private static void addIfPresent(DependencyGraph graph, IntList target, String name) {
        int index = graph.indexOf(DependencyGraph.variableKey(name));
        if (index >= 0) {
            target.add(index);
        }
    }

    private static boolean boundTo(Node node, String entityType, String entityId) {
        return entityType.equals(node.entityType()) && entityId.equals(node.entityId());
    }

    private DependencyGraph graphOrNull(String campaignId, String branchId) {
        try {
            return graphManager.getGraph(campaignId, branchId);
        } catch (RuntimeException e) {
            logger.log(Level.WARNING, String.format(
                    "Dependency graph for %s/%s unavailable, falling back to pattern invalidation", campaignId, branchId), e);
            return null;
        }
    }

    /** Without a graph nothing can be narrowed: drop every derived value and every computed field of the type. */
    private static void fallback(String entityType, String branch, Plan plan) {
        plan.patterns.add(CacheKeys.computedFieldsPattern(entityType, branch));
        plan.patterns.add(CacheKeys.build(CacheKeys.DERIVED_VARIABLE, branch, "*"));
    }
}
