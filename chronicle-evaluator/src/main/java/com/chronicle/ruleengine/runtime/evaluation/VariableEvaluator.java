/*
 * Copyright (c) 2025 Chronicle Rule Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.chronicle.ruleengine.runtime.evaluation;

import com.chronicle.ruleengine.api.exceptions.RuleEngineException;
import com.chronicle.ruleengine.api.exceptions.StoreUnavailableException;
import com.chronicle.ruleengine.api.model.EvaluationTrace;
import com.chronicle.ruleengine.api.model.ExpressionNodes;
import com.chronicle.ruleengine.api.model.StateVariable;
import com.chronicle.ruleengine.api.model.VariableEvaluationResult;
import com.chronicle.ruleengine.api.spi.VariableStore;
import com.chronicle.ruleengine.runtime.context.ContextBuilder;
import com.chronicle.ruleengine.runtime.context.EvaluationContext;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.IntNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.NullNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.fasterxml.jackson.databind.node.TextNode;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Evaluates a single state variable, optionally recording a step-by-step trace.
 *
 * <p>Stored variables return their value directly. Derived variables go through:
 * validate formula, build context, evaluate formula, resolve referenced variables.
 */
public final class VariableEvaluator {

    private static final Logger logger = Logger.getLogger(VariableEvaluator.class.getName());

    private final VariableStore variableStore;
    private final ContextBuilder contextBuilder;
    private final ExpressionEvaluator evaluator;

    public VariableEvaluator(VariableStore variableStore, ContextBuilder contextBuilder,
                             ExpressionEvaluator evaluator) {
        this.variableStore = Objects.requireNonNull(variableStore, "variableStore");
        this.contextBuilder = Objects.requireNonNull(contextBuilder, "contextBuilder");
        this.evaluator = Objects.requireNonNull(evaluator, "evaluator");
    }

    public VariableEvaluationResult evaluate(String variableId, Map<String, JsonNode> extraContext,
                                             boolean includeTrace) {
        Optional<StateVariable> variable;
        try {
            variable = variableStore.findById(variableId);
        } catch (StoreUnavailableException e) {
            logger.log(Level.WARNING, "Variable store unavailable loading " + variableId, e);
            return VariableEvaluationResult.failure(e.getMessage(), null);
        }
        if (variable.isEmpty() || !variable.get().isLive()) {
            return VariableEvaluationResult.failure("Variable not found: " + variableId, null);
        }
        return evaluate(variable.get(), extraContext, includeTrace);
    }

    public VariableEvaluationResult evaluate(StateVariable variable, Map<String, JsonNode> extraContext,
                                             boolean includeTrace) {
        long start = System.nanoTime();
        TraceRecorder trace = new TraceRecorder(includeTrace);
        JsonNode formulaJson = variable.isDerived() ? ExpressionNodes.toJson(variable.formula()) : NullNode.getInstance();

        trace.step("Start evaluation of '" + variable.key() + "'", TextNode.valueOf(variable.id()), null, true);

        if (!variable.isDerived()) {
            trace.step("Return stored value", null, variable.value(), true);
            return VariableEvaluationResult.success(variable.value(), trace.finish(variable, formulaJson, start));
        }

        int depth;
        try {
            depth = evaluator.checkDepth(variable.formula());
        } catch (RuleEngineException e) {
            trace.step("Validate formula", formulaJson, TextNode.valueOf(e.getMessage()), false);
            return VariableEvaluationResult.failure(e.getMessage(), trace.finish(variable, formulaJson, start));
        }
        trace.step("Validate formula", formulaJson, IntNode.valueOf(depth), true);

        EvaluationContext context = contextBuilder.build(
                variable.scopeEntityType(), variable.scopeId(), extraContext, variable.key());
        trace.step("Build context", null, includeTrace ? context.toJson() : null, true);

        Evaluation result = evaluator.evaluate(variable.formula(), context);
        if (!result.isSuccess()) {
            trace.step("Evaluate formula", formulaJson, TextNode.valueOf(result.errorMessage()), false);
            return VariableEvaluationResult.failure(result.errorMessage(), trace.finish(variable, formulaJson, start));
        }
        trace.step("Evaluate formula", formulaJson, result.value(), true);

        if (includeTrace) {
            ObjectNode resolved = JsonNodeFactory.instance.objectNode();
            for (String path : ExpressionNodes.variablePaths(variable.formula())) {
                JsonNode value = context.resolve(path);
                resolved.set(path, value.isMissingNode() ? NullNode.getInstance() : value);
            }
            trace.step("Resolve variables", null, resolved, true);
        }

        if (logger.isLoggable(Level.FINE)) {
            logger.fine(String.format("Variable %s (%s) evaluated to %s", variable.key(), variable.id(), result.value()));
        }
        return VariableEvaluationResult.success(result.value(), trace.finish(variable, formulaJson, start));
    }

    private static final class TraceRecorder {
        private final boolean enabled;
        private final List<EvaluationTrace.Step> steps = new ArrayList<>();

        TraceRecorder(boolean enabled) {
            this.enabled = enabled;
        }

        void step(String description, JsonNode input, JsonNode output, boolean passed) {
            if (enabled) {
                steps.add(new EvaluationTrace.Step(steps.size() + 1, description, input, output, passed));
            }
        }

        EvaluationTrace finish(StateVariable variable, JsonNode formula, long startNanos) {
            if (!enabled) {
                return null;
            }
            return new EvaluationTrace(variable.id(), formula, List.copyOf(steps), System.nanoTime() - startNanos);
        }
    }
}
