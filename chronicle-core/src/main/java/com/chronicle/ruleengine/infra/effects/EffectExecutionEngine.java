/*
 * Copyright (c) 2025 Chronicle Rule Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.chronicle.ruleengine.infra.effects;

import com.chronicle.ruleengine.api.exceptions.CircularDependencyException;
import com.chronicle.ruleengine.api.exceptions.EntityNotFoundException;
import com.chronicle.ruleengine.api.exceptions.EvaluationException;
import com.chronicle.ruleengine.api.model.Effect;
import com.chronicle.ruleengine.api.model.EffectExecution;
import com.chronicle.ruleengine.api.model.EffectExecutionStatus;
import com.chronicle.ruleengine.api.model.EffectExecutionSummary;
import com.chronicle.ruleengine.api.model.EffectTiming;
import com.chronicle.ruleengine.api.model.EntitySnapshot;
import com.chronicle.ruleengine.api.model.InvalidationScope;
import com.chronicle.ruleengine.api.model.PatchPreview;
import com.chronicle.ruleengine.api.spi.EffectExecutionLog;
import com.chronicle.ruleengine.api.spi.EffectStore;
import com.chronicle.ruleengine.api.spi.EntityStore;
import com.chronicle.ruleengine.infra.invalidation.EntityHierarchy;
import com.chronicle.ruleengine.infra.invalidation.InvalidationCoordinator;
import com.chronicle.ruleengine.infra.management.DependencyGraphManager;
import com.chronicle.ruleengine.infra.metrics.RuleEngineMetrics;
import com.chronicle.ruleengine.runtime.model.DependencyGraph;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.NullNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.opentelemetry.api.trace.Span;
import io.opentelemetry.api.trace.Tracer;
import io.opentelemetry.context.Scope;

import java.time.Clock;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Applies effects to entities one at a time and keeps the audit trail.
 *
 * <p>Every effect goes {@code PENDING -> APPLYING -> SUCCEEDED | FAILED}; only the terminal state is
 * written to the {@link EffectExecutionLog}. Each effect loads a fresh snapshot, so it observes the
 * patches of the effects before it. A failing effect is recorded and the batch continues.
 */
public class EffectExecutionEngine {

    private static final Logger logger = Logger.getLogger(EffectExecutionEngine.class.getName());

    private final EntityStore entityStore;
    private final EffectStore effectStore;
    private final EffectExecutionLog executionLog;
    private final PatchPathPolicy pathPolicy;
    private final JsonPatchApplier patchApplier;
    private final DependencyGraphManager graphManager;
    private final InvalidationCoordinator coordinator;
    private final EntityHierarchy hierarchy;
    private final RuleEngineMetrics metrics;
    private final Tracer tracer;
    private final Clock clock;

    public EffectExecutionEngine(EntityStore entityStore, EffectStore effectStore, EffectExecutionLog executionLog,
                                 PatchPathPolicy pathPolicy, JsonPatchApplier patchApplier,
                                 DependencyGraphManager graphManager, InvalidationCoordinator coordinator,
                                 EntityHierarchy hierarchy, RuleEngineMetrics metrics, Tracer tracer, Clock clock) {
        this.entityStore = entityStore;
        this.effectStore = effectStore;
        this.executionLog = executionLog;
        this.pathPolicy = pathPolicy;
        this.patchApplier = patchApplier;
        this.graphManager = graphManager;
        this.coordinator = coordinator;
        this.hierarchy = hierarchy;
        this.metrics = metrics;
        this.tracer = tracer;
        this.clock = clock;
    }

    /**
     * Runs the live effects of one entity for one timing phase: priority ascending, then the
     * write-before-read order of the effects, then creation order.
     */
    public EffectExecutionSummary executeForEntity(String entityType, String entityId, EffectTiming timing,
                                                   String actor, String branchId) {
        Span span = tracer.spanBuilder("execute-effects").startSpan();
        try (Scope ignored = span.makeCurrent()) {
            span.setAttribute("entityType", entityType);
            span.setAttribute("entityId", entityId);
            span.setAttribute("timing", timing.name());

            List<Effect> effects = live(effectStore.findActive(entityType, entityId, timing));
            if (effects.isEmpty()) {
                return EffectExecutionSummary.empty();
            }
            Map<String, Integer> graphRank = graphRank(effects, branchId);
            effects.sort(Comparator.comparingInt(Effect::priority)
                    .thenComparingInt((Effect e) -> graphRank.getOrDefault(e.id(), Integer.MAX_VALUE))
                    .thenComparing(Effect::createdAt)
                    .thenComparing(Effect::id));

            EffectExecutionSummary summary = run(effects, actor, branchId, entityType, entityId);
            span.setAttribute("succeeded", summary.succeeded());
            span.setAttribute("failed", summary.failed());
            return summary;
        } catch (RuntimeException e) {
            span.recordException(e);
            throw e;
        } finally {
            span.end();
        }
    }

    /**
     * Runs a chosen set of effects in dependency order.
     *
     * @throws CircularDependencyException before anything is applied if the set is cyclic
     */
    public EffectExecutionSummary executeWithDependencies(List<String> effectIds, String actor, String branchId) {
        Span span = tracer.spanBuilder("execute-effects").startSpan();
        try (Scope ignored = span.makeCurrent()) {
            span.setAttribute("requested", effectIds.size());

            List<Effect> effects = live(effectStore.findByIds(effectIds));
            if (effects.isEmpty()) {
                return EffectExecutionSummary.empty();
            }
            DependencyGraph graph = graphManager.compileEffects(effects.get(0).campaignId(), branchId, effects);
            if (!graph.isAcyclic()) {
                List<String> cycle = graph.getCycles().cycles().get(0);
                logger.warning(String.format("Refusing to execute %d effects: cycle %s", effects.size(), cycle));
                throw new CircularDependencyException(cycle);
            }

            Map<String, Effect> byKey = new LinkedHashMap<>();
            for (Effect effect : effects) {
                byKey.put(DependencyGraph.effectKey(effect.id()), effect);
            }
            List<Effect> ordered = new ArrayList<>();
            for (String key : graph.getEvaluationOrderKeys()) {
                Effect effect = byKey.get(key);
                if (effect != null) {
                    ordered.add(effect);
                }
            }

            EffectExecutionSummary summary = run(ordered, actor, branchId, null, null);
            span.setAttribute("succeeded", summary.succeeded());
            span.setAttribute("failed", summary.failed());
            return summary;
        } catch (RuntimeException e) {
            span.recordException(e);
            throw e;
        } finally {
            span.end();
        }
    }

    /**
     * Applies the effect to a copy of its entity. Nothing is persisted, audited or invalidated.
     *
     * @throws EntityNotFoundException if the effect does not exist
     */
    public PatchPreview preview(String effectId) {
        Effect effect = effectStore.findById(effectId)
                .orElseThrow(() -> new EntityNotFoundException("effect", effectId));
        if (effect.entityId() == null) {
            return new PatchPreview(effectId, NullNode.getInstance(), NullNode.getInstance(), List.of(),
                    List.of("Effect is not bound to an entity"));
        }
        Optional<EntitySnapshot> snapshot = entityStore.load(effect.entityType(), effect.entityId());
        if (snapshot.isEmpty()) {
            return new PatchPreview(effectId, NullNode.getInstance(), NullNode.getInstance(), List.of(),
                    List.of(String.format("%s '%s' not found", effect.entityType(), effect.entityId())));
        }
        ObjectNode before = snapshot.get().data();
        List<String> errors = new ArrayList<>(pathPolicy.violations(effect.entityType(), effect.payload()));
        if (!errors.isEmpty()) {
            return new PatchPreview(effectId, before, before, List.of(), errors);
        }
        try {
            ObjectNode after = patchApplier.apply(before, effect.payload());
            return new PatchPreview(effectId, before, after, JsonPatchApplier.changedFields(before, after), List.of());
        } catch (EvaluationException e) {
            return new PatchPreview(effectId, before, before, List.of(), List.of(e.getMessage()));
        }
    }

    // ========================================================================
    // EXECUTION
    // ========================================================================

    private EffectExecutionSummary run(List<Effect> effects, String actor, String branchId,
                                       String entityType, String entityId) {
        List<EffectExecution> details = new ArrayList<>(effects.size());
        List<String> order = new ArrayList<>(effects.size());
        for (Effect effect : effects) {
            order.add(effect.id());
            String type = entityType != null ? entityType : effect.entityType();
            String id = entityId != null ? entityId : effect.entityId();
            details.add(execute(effect, type, id, actor, branchId));
        }
        EffectExecutionSummary summary = EffectExecutionSummary.of(details, order);
        logger.info(String.format("Executed %d effects: %d succeeded, %d failed",
                summary.total(), summary.succeeded(), summary.failed()));
        return summary;
    }

    private EffectExecution execute(Effect effect, String entityType, String entityId, String actor,
                                    String branchId) {
        EffectExecutionStatus status = EffectExecutionStatus.PENDING;
        JsonNode before = NullNode.getInstance();
        EntitySnapshot snapshot;
        EntitySnapshot updated;
        try {
            if (entityId == null) {
                throw new EntityNotFoundException(entityType, "<unbound>");
            }
            snapshot = entityStore.load(entityType, entityId)
                    .orElseThrow(() -> new EntityNotFoundException(entityType, entityId));
            before = snapshot.data().deepCopy();
            pathPolicy.validate(entityType, effect.payload());

            status = EffectExecutionStatus.APPLYING;
            patchApplier.apply(snapshot.data(), effect.payload());
            updated = entityStore.applyPatch(entityType, entityId, effect.payload(), snapshot.version());
        } catch (RuntimeException e) {
            logger.log(Level.WARNING, String.format("Effect %s failed on %s '%s' while %s: %s",
                    effect.id(), entityType, entityId, status, e.getMessage()), e);
            EffectExecution failed = new EffectExecution(UUID.randomUUID().toString(), effect.id(), entityType,
                    entityId, actor, clock.instant(), before, EffectExecutionStatus.FAILED, List.of(), List.of(),
                    e.getMessage());
            metrics.effectFailed(entityType);
            audit(failed);
            return failed;
        }

        // persisted from here on: later failures must not turn the execution into FAILED
        EffectExecution record = new EffectExecution(UUID.randomUUID().toString(), effect.id(), entityType, entityId,
                actor, clock.instant(), before, EffectExecutionStatus.SUCCEEDED, effect.payload(),
                JsonPatchApplier.affectedFields(effect.payload()), null);
        metrics.effectSucceeded(entityType);
        audit(record);
        try {
            notifyChanged(effect, updated, branchId, JsonPatchApplier.changedFields(snapshot.data(), updated.data()));
        } catch (RuntimeException e) {
            logger.log(Level.WARNING, String.format(
                    "Effect %s was applied to %s '%s' but cache invalidation failed", effect.id(), entityType,
                    entityId), e);
        }
        return record;
    }

    private void audit(EffectExecution record) {
        try {
            executionLog.append(record);
        } catch (RuntimeException e) {
            logger.log(Level.WARNING, String.format("Could not write %s audit record for effect %s on %s '%s'",
                    record.status(), record.effectId(), record.entityType(), record.entityId()), e);
        }
    }

    private void notifyChanged(Effect effect, EntitySnapshot updated, String branchId, List<String> changed) {
        Optional<EntityHierarchy.ParentRef> parent = hierarchy.parentOf(updated);
        coordinator.invalidate(new InvalidationScope.EntityChanged(effect.campaignId(), branchId,
                updated.entityType(), updated.entityId(),
                parent.map(EntityHierarchy.ParentRef::type).orElse(null),
                parent.map(EntityHierarchy.ParentRef::id).orElse(null),
                new HashSet<>(changed)));
    }

    // ========================================================================
    // ORDERING
    // ========================================================================

    private static List<Effect> live(List<Effect> effects) {
        List<Effect> result = new ArrayList<>();
        for (Effect effect : effects) {
            if (effect.isLive()) {
                result.add(effect);
            }
        }
        return result;
    }

    /** Position of each effect in the write-before-read order; empty when the effects are cyclic. */
    private Map<String, Integer> graphRank(List<Effect> effects, String branchId) {
        Map<String, Integer> rank = new HashMap<>();
        if (effects.size() < 2) {
            return rank;
        }
        DependencyGraph graph = graphManager.compileEffects(effects.get(0).campaignId(), branchId, effects);
        int position = 0;
        for (String key : graph.getEvaluationOrderKeys()) {
            if (key.startsWith(DependencyGraph.EFFECT_PREFIX)) {
                rank.put(key.substring(DependencyGraph.EFFECT_PREFIX.length()), position++);
            }
        }
        return rank;
    }
}
