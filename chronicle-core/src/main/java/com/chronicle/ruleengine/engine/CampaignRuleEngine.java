/*
 * Copyright (c) 2025 Chronicle Rule Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.chronicle.ruleengine.engine;

import com.chronicle.ruleengine.api.IRuleEngine;
import com.chronicle.ruleengine.api.exceptions.CircularDependencyException;
import com.chronicle.ruleengine.api.exceptions.StoreUnavailableException;
import com.chronicle.ruleengine.api.model.Condition;
import com.chronicle.ruleengine.api.model.CycleReport;
import com.chronicle.ruleengine.api.model.Effect;
import com.chronicle.ruleengine.api.model.EffectExecutionSummary;
import com.chronicle.ruleengine.api.model.EffectTiming;
import com.chronicle.ruleengine.api.model.GraphOverlay;
import com.chronicle.ruleengine.api.model.InvalidationReport;
import com.chronicle.ruleengine.api.model.InvalidationScope;
import com.chronicle.ruleengine.api.model.PatchPreview;
import com.chronicle.ruleengine.api.model.StateVariable;
import com.chronicle.ruleengine.api.model.ValidationResult;
import com.chronicle.ruleengine.api.model.VariableEvaluationResult;
import com.chronicle.ruleengine.api.spi.ConditionStore;
import com.chronicle.ruleengine.api.spi.EffectExecutionLog;
import com.chronicle.ruleengine.api.spi.EffectStore;
import com.chronicle.ruleengine.api.spi.EntityStore;
import com.chronicle.ruleengine.api.spi.EvaluationCache;
import com.chronicle.ruleengine.api.spi.VariableStore;
import com.chronicle.ruleengine.compiler.DependencyGraphCompiler;
import com.chronicle.ruleengine.compiler.analysis.CycleDetector;
import com.chronicle.ruleengine.compiler.analysis.ExpressionValidator;
import com.chronicle.ruleengine.config.EngineConfig;
import com.chronicle.ruleengine.infra.cache.CacheKeys;
import com.chronicle.ruleengine.infra.cache.ResultCache;
import com.chronicle.ruleengine.infra.effects.EffectExecutionEngine;
import com.chronicle.ruleengine.infra.effects.JsonPatchApplier;
import com.chronicle.ruleengine.infra.effects.PatchPathPolicy;
import com.chronicle.ruleengine.infra.invalidation.EntityHierarchy;
import com.chronicle.ruleengine.infra.invalidation.InvalidationCoordinator;
import com.chronicle.ruleengine.infra.management.DependencyGraphManager;
import com.chronicle.ruleengine.infra.metrics.RuleEngineMetrics;
import com.chronicle.ruleengine.runtime.context.ContextBuilder;
import com.chronicle.ruleengine.runtime.context.EvaluationContext;
import com.chronicle.ruleengine.runtime.evaluation.Evaluation;
import com.chronicle.ruleengine.runtime.evaluation.ExpressionEvaluator;
import com.chronicle.ruleengine.runtime.evaluation.VariableEvaluator;
import com.chronicle.ruleengine.runtime.model.DependencyGraph;
import com.chronicle.ruleengine.runtime.operators.DomainOperatorResolver;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.NullNode;
import io.opentelemetry.api.OpenTelemetry;
import io.opentelemetry.api.trace.Span;
import io.opentelemetry.api.trace.Tracer;
import io.opentelemetry.context.Scope;
import it.unimi.dsi.fastutil.ints.IntList;

import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Default {@link IRuleEngine}: computed fields and derived variables with result caching,
 * dependency-tracked invalidation and effect execution for one deployment.
 *
 * <h2>Computed fields</h2>
 * The live conditions of an entity are evaluated in the campaign's dependency order, so a
 * condition reading another condition's field sees its value. When several conditions produce the
 * same field the one with the highest priority wins; equal priorities go to the later definition.
 *
 * <p>Instances are thread-safe. Build them with {@link #builder()}.
 */
public class CampaignRuleEngine implements IRuleEngine {

    private static final Logger logger = Logger.getLogger(CampaignRuleEngine.class.getName());

    private final ConditionStore conditionStore;
    private final VariableStore variableStore;
    private final ContextBuilder contextBuilder;
    private final ExpressionEvaluator evaluator;
    private final VariableEvaluator variableEvaluator;
    private final ExpressionValidator validator;
    private final CycleDetector cycleDetector;
    private final DependencyGraphManager graphManager;
    private final ResultCache cache;
    private final InvalidationCoordinator coordinator;
    private final PatchPathPolicy pathPolicy;
    private final EffectExecutionEngine effectEngine;
    private final RuleEngineMetrics metrics;
    private final Tracer tracer;

    private CampaignRuleEngine(Builder builder) {
        EngineConfig config = builder.config;
        this.conditionStore = builder.conditionStore;
        this.variableStore = builder.variableStore;
        this.metrics = builder.metrics;
        this.tracer = builder.tracer;

        this.evaluator = new ExpressionEvaluator(
                new DomainOperatorResolver(builder.entityStore, builder.variableStore), config.getMaxExpressionDepth());
        this.contextBuilder = new ContextBuilder(builder.entityStore, builder.variableStore, evaluator);
        this.variableEvaluator = new VariableEvaluator(builder.variableStore, contextBuilder, evaluator);
        this.validator = new ExpressionValidator(config.getMaxExpressionDepth());
        this.cycleDetector = new CycleDetector();

        this.graphManager = new DependencyGraphManager(new DependencyGraphCompiler(
                builder.conditionStore, builder.variableStore, builder.effectStore, tracer), metrics);
        this.cache = new ResultCache(builder.cache, builder.mapper, config.getCacheTimeout(),
                config.getComputedFieldsTtl());
        this.coordinator = new InvalidationCoordinator(graphManager, cache, metrics, tracer);
        this.pathPolicy = builder.pathPolicy;
        this.effectEngine = new EffectExecutionEngine(builder.entityStore, builder.effectStore, builder.executionLog,
                pathPolicy, new JsonPatchApplier(), graphManager, coordinator, builder.hierarchy,
                metrics, tracer, builder.clock);

        logger.info("Rule engine initialised: " + config);
    }

    public static Builder builder() {
        return new Builder();
    }

    // ========================================================================
    // COMPUTED FIELDS
    // ========================================================================

    @Override
    public Map<String, JsonNode> evaluateComputedFields(String entityType, String entityId, String branchId) {
        Span span = tracer.spanBuilder("evaluate-computed-fields").startSpan();
        try (Scope ignored = span.makeCurrent()) {
            span.setAttribute("entityType", entityType);
            span.setAttribute("entityId", entityId);
            span.setAttribute("branchId", branchId);

            String key = CacheKeys.computedFields(entityType, entityId, branchId);
            Optional<Map<String, JsonNode>> cached = cache.getComputedFields(key);
            if (cached.isPresent()) {
                metrics.cacheHit();
                span.setAttribute("cacheHit", true);
                return Collections.unmodifiableMap(cached.get());
            }
            metrics.cacheMiss();
            span.setAttribute("cacheHit", false);

            long start = System.nanoTime();
            Map<String, JsonNode> fields = computeFields(entityType, entityId, branchId, Map.of());
            metrics.evaluationTime(Duration.ofNanos(System.nanoTime() - start));
            cache.putComputedFields(key, fields);
            span.setAttribute("fields", fields.size());
            return Collections.unmodifiableMap(fields);
        } catch (RuntimeException e) {
            span.recordException(e);
            throw e;
        } finally {
            span.end();
        }
    }

    @Override
    public Map<String, JsonNode> evaluateComputedFields(String entityType, String entityId, String branchId,
                                                        Map<String, JsonNode> extraContext) {
        if (extraContext == null || extraContext.isEmpty()) {
            return evaluateComputedFields(entityType, entityId, branchId);
        }
        Span span = tracer.spanBuilder("evaluate-computed-fields").startSpan();
        try (Scope ignored = span.makeCurrent()) {
            span.setAttribute("entityType", entityType);
            span.setAttribute("entityId", entityId);
            span.setAttribute("dryRun", true);
            return Collections.unmodifiableMap(computeFields(entityType, entityId, branchId, extraContext));
        } catch (RuntimeException e) {
            span.recordException(e);
            throw e;
        } finally {
            span.end();
        }
    }

    private Map<String, JsonNode> computeFields(String entityType, String entityId, String branchId,
                                                Map<String, JsonNode> extraContext) {
        List<Condition> conditions = new ArrayList<>();
        for (Condition condition : conditionStore.findActiveForEntity(entityType, entityId)) {
            if (condition.isLive() && condition.appliesTo(entityType, entityId)) {
                conditions.add(condition);
            }
        }
        Map<String, JsonNode> fields = new LinkedHashMap<>();
        if (conditions.isEmpty()) {
            return fields;
        }
        conditions.sort(evaluationOrder(conditions.get(0).campaignId(), branchId));

        EvaluationContext context = contextBuilder.build(entityType, entityId, extraContext);
        Map<String, Condition> winners = new HashMap<>();
        for (Condition condition : conditions) {
            Evaluation result = evaluator.evaluate(condition.expression(), context);
            JsonNode value;
            if (result.isSuccess()) {
                value = result.value();
            } else {
                logger.warning(String.format("Condition %s (%s) on %s '%s' failed: %s",
                        condition.id(), condition.field(), entityType, entityId, result.errorMessage()));
                value = NullNode.getInstance();
            }
            Condition current = winners.get(condition.field());
            if (current == null || outranks(condition, current)) {
                winners.put(condition.field(), condition);
                fields.put(condition.field(), value);
                context = context.with(condition.field(), value);
            }
        }
        if (logger.isLoggable(Level.FINE)) {
            logger.fine(String.format("Computed %d fields for %s '%s' on %s", fields.size(), entityType, entityId, branchId));
        }
        return fields;
    }

    private static boolean outranks(Condition candidate, Condition current) {
        if (candidate.priority() != current.priority()) {
            return candidate.priority() > current.priority();
        }
        return candidate.createdAt().compareTo(current.createdAt()) >= 0;
    }

    /** Graph order when the graph is usable, otherwise priority then creation order. */
    private Comparator<Condition> evaluationOrder(String campaignId, String branchId) {
        Comparator<Condition> fallback = Comparator.comparingInt(Condition::priority)
                .thenComparing(Condition::createdAt)
                .thenComparing(Condition::id);
        List<String> order;
        try {
            order = graphManager.getGraph(campaignId, branchId).getEvaluationOrderKeys();
        } catch (StoreUnavailableException e) {
            logger.log(Level.WARNING, String.format(
                    "Dependency graph for %s/%s unavailable, using priority order", campaignId, branchId), e);
            return fallback;
        }
        if (order.isEmpty()) {
            return fallback;
        }
        Map<String, Integer> rank = new HashMap<>();
        for (int i = 0; i < order.size(); i++) {
            rank.put(order.get(i), i);
        }
        return Comparator.comparingInt((Condition c) ->
                        rank.getOrDefault(DependencyGraph.conditionKey(c.id()), Integer.MAX_VALUE))
                .thenComparing(fallback);
    }

    // ========================================================================
    // VARIABLES & VALIDATION
    // ========================================================================

    @Override
    public VariableEvaluationResult evaluateVariable(String variableId, String branchId,
                                                     Map<String, JsonNode> extraContext, boolean includeTrace) {
        Optional<StateVariable> variable = variableStore.findById(variableId).filter(StateVariable::isLive);
        if (variable.isEmpty()) {
            return VariableEvaluationResult.failure("Variable not found: " + variableId, null);
        }
        if (!variable.get().isDerived()) {
            return variableEvaluator.evaluate(variable.get(), extraContext, includeTrace);
        }

        boolean cacheable = (extraContext == null || extraContext.isEmpty()) && !includeTrace;
        String key = CacheKeys.derivedVariable(variableId, branchId);
        if (cacheable) {
            Optional<JsonNode> cached = cache.getValue(key);
            if (cached.isPresent()) {
                metrics.cacheHit();
                return VariableEvaluationResult.success(cached.get(), null);
            }
            metrics.cacheMiss();
        }

        VariableEvaluationResult result = variableEvaluator.evaluate(variable.get(), extraContext, includeTrace);
        if (cacheable && result.success()) {
            cache.putValue(key, result.value() == null ? NullNode.getInstance() : result.value());
        }
        return result;
    }

    /**
     * Drops the cached value of a derived variable. Needed when the variable leaves the graph
     * (deleted, or turned into a stored value), since graph-driven invalidation no longer reaches it.
     */
    public long evictDerivedValue(String variableId, String branchId) {
        return cache.delete(CacheKeys.derivedVariable(variableId, branchId));
    }

    @Override
    public ValidationResult validateExpression(JsonNode expression) {
        return validator.validate(expression);
    }

    @Override
    public ValidationResult validateCondition(Condition candidate, String branchId) {
        ValidationResult shape = validator.validate(candidate.expression());
        if (!shape.isOk()) {
            return shape;
        }
        DependencyGraph graph = graphManager.compileCandidate(candidate.campaignId(), branchId,
                GraphOverlay.withCondition(candidate));
        Optional<List<String>> cycle = cycleDetector.findCycleThrough(graph, DependencyGraph.conditionKey(candidate.id()));
        if (cycle.isPresent()) {
            return ValidationResult.circularDependency(cycle.get());
        }
        return shape;
    }

    /**
     * Checks a derived formula as if it were persisted: shape, depth and cycles through the variable.
     * Stored variables are always valid.
     */
    public ValidationResult validateVariable(StateVariable candidate, String branchId) {
        if (!candidate.isDerived()) {
            return ValidationResult.ok(0);
        }
        ValidationResult shape = validator.validate(candidate.formula());
        if (!shape.isOk()) {
            return shape;
        }
        DependencyGraph graph = graphManager.compileCandidate(candidate.campaignId(), branchId,
                GraphOverlay.withVariable(candidate));
        Optional<List<String>> cycle = cycleDetector.findCycleThrough(graph, DependencyGraph.derivedKey(candidate.id()));
        return cycle.map(ValidationResult::circularDependency).orElse(shape);
    }

    /**
     * Checks an effect as if it were persisted: every patch path against the whitelist, then cycles
     * through the effect.
     */
    public ValidationResult validateEffect(Effect candidate, String branchId) {
        List<String> violations = pathPolicy.violations(candidate.entityType(), candidate.payload());
        if (!violations.isEmpty()) {
            return ValidationResult.invalid(String.join("; ", violations));
        }
        DependencyGraph graph = graphManager.compileCandidate(candidate.campaignId(), branchId,
                GraphOverlay.withEffect(candidate));
        Optional<List<String>> cycle = cycleDetector.findCycleThrough(graph, DependencyGraph.effectKey(candidate.id()));
        return cycle.map(ValidationResult::circularDependency).orElse(ValidationResult.ok(0));
    }

    // ========================================================================
    // EFFECTS & INVALIDATION
    // ========================================================================

    @Override
    public EffectExecutionSummary executeEffectsForEntity(String entityType, String entityId, EffectTiming timing,
                                                          String actor, String branchId) {
        return effectEngine.executeForEntity(entityType, entityId, timing, actor, branchId);
    }

    @Override
    public EffectExecutionSummary executeEffectsWithDependencies(List<String> effectIds, String actor,
                                                                 String branchId) {
        return effectEngine.executeWithDependencies(effectIds, actor, branchId);
    }

    @Override
    public PatchPreview previewEffect(String effectId) {
        return effectEngine.preview(effectId);
    }

    @Override
    public InvalidationReport invalidate(InvalidationScope scope) {
        return coordinator.invalidate(scope);
    }

    // ========================================================================
    // GRAPH QUERIES
    // ========================================================================

    /**
     * @throws CircularDependencyException if the campaign graph has a cycle
     */
    @Override
    public List<String> getEvaluationOrder(String campaignId, String branchId) {
        DependencyGraph graph = graphManager.getGraph(campaignId, branchId);
        if (!graph.isAcyclic()) {
            throw new CircularDependencyException(graph.getCycles().cycles().get(0));
        }
        return graph.getEvaluationOrderKeys();
    }

    @Override
    public List<String> getDependencies(String campaignId, String branchId, String nodeKey) {
        DependencyGraph graph = graphManager.getGraph(campaignId, branchId);
        int index = graph.indexOf(nodeKey);
        return index < 0 ? List.of() : keys(graph, graph.dependenciesOf(index));
    }

    @Override
    public List<String> getDependents(String campaignId, String branchId, String nodeKey) {
        DependencyGraph graph = graphManager.getGraph(campaignId, branchId);
        int index = graph.indexOf(nodeKey);
        return index < 0 ? List.of() : keys(graph, graph.dependentsOf(index));
    }

    @Override
    public CycleReport detectCycles(String campaignId, String branchId) {
        return graphManager.getGraph(campaignId, branchId).getCycles();
    }

    private static List<String> keys(DependencyGraph graph, IntList indices) {
        List<String> keys = new ArrayList<>(indices.size());
        for (int i = 0; i < indices.size(); i++) {
            keys.add(graph.node(indices.getInt(i)).key());
        }
        return keys;
    }

    // ========================================================================
    // ACCESSORS
    // ========================================================================

    public DependencyGraphManager getGraphManager() {
        return graphManager;
    }

    public ExpressionValidator getValidator() {
        return validator;
    }

    public PatchPathPolicy getPathPolicy() {
        return pathPolicy;
    }

    public RuleEngineMetrics getMetrics() {
        return metrics;
    }

    public EvaluationCache.CacheMetrics getCacheMetrics() {
        return cache.getMetrics();
    }

    // ========================================================================
    // BUILDER
    // ========================================================================

    public static final class Builder {
        private EntityStore entityStore;
        private VariableStore variableStore;
        private ConditionStore conditionStore;
        private EffectStore effectStore;
        private EffectExecutionLog executionLog;
        private EvaluationCache cache;
        private EngineConfig config = EngineConfig.defaults();
        private PatchPathPolicy pathPolicy = PatchPathPolicy.defaults();
        private EntityHierarchy hierarchy = EntityHierarchy.defaults();
        private RuleEngineMetrics metrics;
        private Tracer tracer = OpenTelemetry.noop().getTracer("chronicle-rule-engine");
        private ObjectMapper mapper = new ObjectMapper();
        private Clock clock = Clock.systemUTC();

        private Builder() {
        }

        public Builder entityStore(EntityStore entityStore) {
            this.entityStore = entityStore;
            return this;
        }

        public Builder variableStore(VariableStore variableStore) {
            this.variableStore = variableStore;
            return this;
        }

        public Builder conditionStore(ConditionStore conditionStore) {
            this.conditionStore = conditionStore;
            return this;
        }

        public Builder effectStore(EffectStore effectStore) {
            this.effectStore = effectStore;
            return this;
        }

        public Builder executionLog(EffectExecutionLog executionLog) {
            this.executionLog = executionLog;
            return this;
        }

        public Builder cache(EvaluationCache cache) {
            this.cache = cache;
            return this;
        }

        public Builder config(EngineConfig config) {
            this.config = config;
            return this;
        }

        public Builder pathPolicy(PatchPathPolicy pathPolicy) {
            this.pathPolicy = pathPolicy;
            return this;
        }

        public Builder hierarchy(EntityHierarchy hierarchy) {
            this.hierarchy = hierarchy;
            return this;
        }

        public Builder metrics(RuleEngineMetrics metrics) {
            this.metrics = metrics;
            return this;
        }

        public Builder tracer(Tracer tracer) {
            this.tracer = tracer;
            return this;
        }

        public Builder objectMapper(ObjectMapper mapper) {
            this.mapper = mapper;
            return this;
        }

        public Builder clock(Clock clock) {
            this.clock = clock;
            return this;
        }

        public CampaignRuleEngine build() {
            Objects.requireNonNull(entityStore, "entityStore");
            Objects.requireNonNull(variableStore, "variableStore");
            Objects.requireNonNull(conditionStore, "conditionStore");
            Objects.requireNonNull(effectStore, "effectStore");
            Objects.requireNonNull(executionLog, "executionLog");
            Objects.requireNonNull(cache, "cache");
            if (metrics == null) {
                metrics = new RuleEngineMetrics();
            }
            return new CampaignRuleEngine(this);
        }
    }
}
