/*
 * Copyright (c) 2025 Chronicle Rule Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.chronicle.ruleengine.runtime.evaluation;

import com.chronicle.ruleengine.api.exceptions.EvaluationException;
import com.chronicle.ruleengine.api.exceptions.FormulaTooComplexException;
import com.chronicle.ruleengine.api.exceptions.RuleEngineException;
import com.chronicle.ruleengine.api.model.ExpressionNode;
import com.chronicle.ruleengine.api.model.ExpressionNodes;
import com.chronicle.ruleengine.runtime.context.EvaluationContext;
import com.chronicle.ruleengine.runtime.operators.CollectionOperatorEvaluator;
import com.chronicle.ruleengine.runtime.operators.DomainOperatorResolver;
import com.chronicle.ruleengine.runtime.operators.JsonValues;
import com.chronicle.ruleengine.runtime.operators.LogicalOperatorEvaluator;
import com.chronicle.ruleengine.runtime.operators.NumericOperatorEvaluator;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.NullNode;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Evaluates JSONLogic-style expression trees against an {@link EvaluationContext}.
 *
 * <p>Evaluation runs in two passes:
 * <ol>
 *   <li>domain operators are resolved to literals by {@link DomainOperatorResolver} (may do I/O)</li>
 *   <li>the remaining tree is evaluated synchronously</li>
 * </ol>
 * The depth limit is enforced before either pass. {@link #evaluate} never throws: every failure
 * is reported through {@link Evaluation#error()}.
 *
 * THREAD SAFETY: stateless, safe for concurrent use.
 */
public final class ExpressionEvaluator {

    private static final Logger logger = Logger.getLogger(ExpressionEvaluator.class.getName());

    public static final int DEFAULT_MAX_DEPTH = 10;

    private final DomainOperatorResolver domainResolver;
    private final int maxDepth;
    private final LogicalOperatorEvaluator logical = new LogicalOperatorEvaluator();
    private final NumericOperatorEvaluator numeric = new NumericOperatorEvaluator();
    private final CollectionOperatorEvaluator collections = new CollectionOperatorEvaluator();

    public ExpressionEvaluator(DomainOperatorResolver domainResolver, int maxDepth) {
        if (maxDepth < 1) {
            throw new IllegalArgumentException("maxDepth must be positive, got " + maxDepth);
        }
        this.domainResolver = Objects.requireNonNull(domainResolver, "domainResolver");
        this.maxDepth = maxDepth;
    }

    public ExpressionEvaluator(DomainOperatorResolver domainResolver) {
        this(domainResolver, DEFAULT_MAX_DEPTH);
    }

    public int getMaxDepth() {
        return maxDepth;
    }

    /**
     * Evaluates a JSON expression document.
     */
    public Evaluation evaluate(JsonNode expression, EvaluationContext context) {
        ExpressionNode node;
        try {
            node = ExpressionNodes.fromJson(expression);
        } catch (RuleEngineException e) {
            return Evaluation.failure(e);
        } catch (RuntimeException e) {
            return Evaluation.failure(new EvaluationException("Malformed expression: " + e.getMessage(), e));
        }
        return evaluate(node, context);
    }

    public Evaluation evaluate(ExpressionNode node, EvaluationContext context) {
        if (node == null) {
            return Evaluation.success(NullNode.getInstance());
        }
        EvaluationContext ctx = context == null ? EvaluationContext.empty() : context;
        try {
            checkDepth(node);
            ExpressionNode resolved = domainResolver.resolve(node, ctx, this::evaluateCore);
            return Evaluation.success(evaluateCore(resolved, ctx));
        } catch (RuleEngineException e) {
            if (logger.isLoggable(Level.FINE)) {
                logger.fine(String.format("Evaluation failed for %s: %s", ctx, e.getMessage()));
            }
            return Evaluation.failure(e);
        } catch (RuntimeException e) {
            logger.log(Level.WARNING, "Unexpected evaluation failure for " + ctx, e);
            return Evaluation.failure(new EvaluationException("Evaluation failed: " + e.getMessage(), e));
        }
    }

    /**
     * @return the tree depth
     * @throws FormulaTooComplexException when the depth exceeds the limit
     */
    public int checkDepth(ExpressionNode node) {
        int depth = ExpressionNodes.depth(node);
        if (depth > maxDepth) {
            throw new FormulaTooComplexException(depth, maxDepth);
        }
        return depth;
    }

    // ========================================================================
    // SYNCHRONOUS CORE
    // ========================================================================

    private JsonNode evaluateCore(ExpressionNode node, EvaluationContext context) {
        switch (node.kind()) {
            case LITERAL:
                return ((ExpressionNode.Literal) node).value();
            case VAR_REF: {
                ExpressionNode.VarRef ref = (ExpressionNode.VarRef) node;
                JsonNode value = context.resolve(ref.path());
                return JsonValues.isNull(value) ? ref.defaultValue() : value;
            }
            case OPERATOR:
                return applyOperator((ExpressionNode.Operator) node, context);
            case DOMAIN_OPERATOR:
                throw new EvaluationException(
                        "Unresolved domain operator: " + ((ExpressionNode.DomainOperator) node).qualifiedName());
            default:
                throw new EvaluationException("Unhandled node kind: " + node.kind());
        }
    }

    private JsonNode applyOperator(ExpressionNode.Operator op, EvaluationContext context) {
        String name = op.name();
        if (logical.handles(name)) {
            return logical.apply(name, op.children(), child -> evaluateCore(child, context));
        }
        boolean isNumeric = numeric.handles(name);
        if (!isNumeric && !collections.handles(name)) {
            throw new EvaluationException("Unknown operator: " + name);
        }
        List<JsonNode> operands = new ArrayList<>(op.children().size());
        for (ExpressionNode child : op.children()) {
            operands.add(evaluateCore(child, context));
        }
        return isNumeric ? numeric.apply(name, operands) : collections.apply(name, operands);
    }
}
