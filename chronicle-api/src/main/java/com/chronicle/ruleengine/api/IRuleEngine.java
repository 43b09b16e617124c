/*
 * Copyright (c) 2025 Chronicle Rule Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.chronicle.ruleengine.api;

import com.chronicle.ruleengine.api.model.Condition;
import com.chronicle.ruleengine.api.model.CycleReport;
import com.chronicle.ruleengine.api.model.EffectExecutionSummary;
import com.chronicle.ruleengine.api.model.EffectTiming;
import com.chronicle.ruleengine.api.model.InvalidationReport;
import com.chronicle.ruleengine.api.model.InvalidationScope;
import com.chronicle.ruleengine.api.model.PatchPreview;
import com.chronicle.ruleengine.api.model.ValidationResult;
import com.chronicle.ruleengine.api.model.VariableEvaluationResult;
import com.fasterxml.jackson.databind.JsonNode;

import java.util.List;
import java.util.Map;

/**
 * Entry point used by the rest of the application.
 *
 * <h2>Usage</h2>
 * <pre>{@code
 * Map<String, JsonNode> fields = engine.evaluateComputedFields("settlement", "s1", "main");
 * // ... a variable changes ...
 * engine.invalidate(new InvalidationScope.VariableChanged("c1", "main", "settlement", "s1", "population"));
 * fields = engine.evaluateComputedFields("settlement", "s1", "main");  // recomputed
 * }</pre>
 */
public interface IRuleEngine {

    /**
     * Computed fields of an entity, served from cache when possible.
     */
    Map<String, JsonNode> evaluateComputedFields(String entityType, String entityId, String branchId);

    /**
     * Dry run: computes fields with {@code extraContext} layered over the entity context.
     * Never reads or writes the cache.
     */
    Map<String, JsonNode> evaluateComputedFields(String entityType, String entityId, String branchId,
                                                 Map<String, JsonNode> extraContext);

    VariableEvaluationResult evaluateVariable(String variableId, String branchId,
                                              Map<String, JsonNode> extraContext, boolean includeTrace);

    /**
     * Checks depth and parseability of a raw expression.
     */
    ValidationResult validateExpression(JsonNode expression);

    /**
     * Checks a condition as if it were persisted, including the cycle check against the campaign graph.
     */
    ValidationResult validateCondition(Condition candidate, String branchId);

    EffectExecutionSummary executeEffectsForEntity(String entityType, String entityId, EffectTiming timing,
                                                   String actor, String branchId);

    /**
     * Executes the given effects in dependency order.
     *
     * @throws com.chronicle.ruleengine.api.exceptions.CircularDependencyException before anything is
     *         applied if the effects depend on each other cyclically
     */
    EffectExecutionSummary executeEffectsWithDependencies(List<String> effectIds, String actor, String branchId);

    PatchPreview previewEffect(String effectId);

    InvalidationReport invalidate(InvalidationScope scope);

    List<String> getEvaluationOrder(String campaignId, String branchId);

    List<String> getDependencies(String campaignId, String branchId, String nodeKey);

    List<String> getDependents(String campaignId, String branchId, String nodeKey);

    CycleReport detectCycles(String campaignId, String branchId);
}
