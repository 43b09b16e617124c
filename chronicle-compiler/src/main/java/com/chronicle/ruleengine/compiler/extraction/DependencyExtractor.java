/*
 * Copyright (c) 2025 Chronicle Rule Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.chronicle.ruleengine.compiler.extraction;

import com.chronicle.ruleengine.api.model.DomainOperatorType;
import com.chronicle.ruleengine.api.model.ExpressionNode;
import com.chronicle.ruleengine.api.model.ExpressionNodes;
import com.chronicle.ruleengine.api.model.PatchOperation;
import com.chronicle.ruleengine.api.model.VariableScope;
import com.fasterxml.jackson.databind.JsonNode;

import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.logging.Level;
import java.util.logging.Logger;
import java.util.stream.Collectors;

/**
 * Static analysis of what expressions read and what patches write.
 *
 * <p>Two naming layers are exposed:
 * <ul>
 *   <li>raw extraction ({@link #extractReads}, {@link #extractWrites}) reports paths as written</li>
 *   <li>graph names ({@link #readName}, {@link #writeNames}) normalise those paths to the
 *       variable names the dependency graph is keyed by</li>
 * </ul>
 * None of the methods throw on malformed input.
 */
public final class DependencyExtractor {

    private static final Logger logger = Logger.getLogger(DependencyExtractor.class.getName());

    private static final Set<String> ENTITY_TYPES = Collections.unmodifiableSet(Arrays.stream(VariableScope.values())
            .map(VariableScope::entityType)
            .collect(Collectors.toSet()));

    private static final String VARIABLES_FIELD = "variables";

    private DependencyExtractor() {
        throw new AssertionError("No instances");
    }

    // ========================================================================
    // READS
    // ========================================================================

    /**
     * Variable paths and canonical domain dependencies an expression reads, in first-seen order.
     * Unknown domain operators are ignored.
     */
    public static Set<String> extractReads(ExpressionNode node) {
        Set<String> reads = new LinkedHashSet<>();
        if (node != null) {
            collectReads(node, reads);
        }
        return reads;
    }

    /**
     * Converts and analyses a JSON expression; malformed documents yield an empty set.
     */
    public static Set<String> extractReads(JsonNode expression) {
        if (expression == null) {
            return new LinkedHashSet<>();
        }
        try {
            return extractReads(ExpressionNodes.fromJson(expression));
        } catch (RuntimeException e) {
            if (logger.isLoggable(Level.FINE)) {
                logger.fine("Ignoring malformed expression during read extraction: " + e.getMessage());
            }
            return new LinkedHashSet<>();
        }
    }

    private static void collectReads(ExpressionNode node, Set<String> reads) {
        switch (node.kind()) {
            case VAR_REF: {
                String path = ((ExpressionNode.VarRef) node).path();
                if (!path.isEmpty()) {
                    reads.add(path);
                }
                break;
            }
            case OPERATOR:
                ((ExpressionNode.Operator) node).children().forEach(child -> collectReads(child, reads));
                break;
            case DOMAIN_OPERATOR: {
                ExpressionNode.DomainOperator op = (ExpressionNode.DomainOperator) node;
                DomainOperatorType.lookup(op).ifPresent(type -> reads.add(type.canonicalDependency()));
                op.arguments().forEach(arg -> collectReads(arg, reads));
                break;
            }
            default:
                break;
        }
    }

    // ========================================================================
    // WRITES
    // ========================================================================

    /**
     * Paths of every non-{@code test} operation.
     */
    public static Set<String> extractWrites(List<PatchOperation> patch) {
        Set<String> writes = new LinkedHashSet<>();
        if (patch == null) {
            return writes;
        }
        for (PatchOperation op : patch) {
            if (op != null && op.path() != null && !op.isTest()) {
                writes.add(op.path());
            }
        }
        return writes;
    }

    /**
     * Tolerant variant over a raw JSON Patch document. Entries without a string {@code op} and
     * {@code path} are skipped.
     */
    public static Set<String> extractWrites(JsonNode patch) {
        Set<String> writes = new LinkedHashSet<>();
        if (patch == null || !patch.isArray()) {
            return writes;
        }
        for (JsonNode entry : patch) {
            JsonNode op = entry.get("op");
            JsonNode path = entry.get("path");
            if (op != null && op.isTextual() && path != null && path.isTextual() && !"test".equals(op.textValue())) {
                writes.add(path.textValue());
            }
        }
        return writes;
    }

    /**
     * Paths a patch reads: {@code test} targets and {@code copy}/{@code move} sources.
     */
    public static Set<String> extractPatchReads(List<PatchOperation> patch) {
        Set<String> reads = new LinkedHashSet<>();
        if (patch == null) {
            return reads;
        }
        for (PatchOperation op : patch) {
            if (op == null) {
                continue;
            }
            if (op.isTest() && op.path() != null) {
                reads.add(op.path());
            } else if (op.readsFrom() && op.from() != null) {
                reads.add(op.from());
            }
        }
        return reads;
    }

    // ========================================================================
    // NAMES
    // ========================================================================

    /** {@code "foo.bar"} -> {@code "foo"}. */
    public static String baseVariable(String path) {
        if (path == null) {
            return "";
        }
        int dot = path.indexOf('.');
        return dot < 0 ? path : path.substring(0, dot);
    }

    /** {@code "/resources/gold"} -> {@code "resources"}. */
    public static String baseVariableFromPointer(String pointer) {
        if (pointer == null || pointer.isEmpty()) {
            return "";
        }
        String trimmed = pointer.startsWith("/") ? pointer.substring(1) : pointer;
        int slash = trimmed.indexOf('/');
        return unescape(slash < 0 ? trimmed : trimmed.substring(0, slash));
    }

    /**
     * Graph variable name for a read path. Paths qualified by an entity type keep two segments
     * ({@code settlement.level.x} -> {@code settlement.level}); others keep their base segment.
     */
    public static String readName(String path) {
        String base = baseVariable(path);
        if (ENTITY_TYPES.contains(base.toLowerCase(Locale.ROOT)) && path.length() > base.length() + 1) {
            String rest = path.substring(base.length() + 1);
            return base + "." + baseVariable(rest);
        }
        return base;
    }

    /**
     * Graph variable names a patch pointer on an entity of {@code entityType} writes (or reads,
     * for {@code test}). {@code /level} on a settlement is both {@code level} and
     * {@code settlement.level}; {@code /variables/morale} additionally names {@code morale}.
     */
    public static Set<String> writeNames(String entityType, String pointer) {
        Set<String> names = new LinkedHashSet<>();
        String field = baseVariableFromPointer(pointer);
        if (field.isEmpty()) {
            return names;
        }
        if (VARIABLES_FIELD.equals(field)) {
            String rest = pointer.substring(pointer.indexOf(VARIABLES_FIELD) + VARIABLES_FIELD.length());
            String variable = baseVariableFromPointer(rest);
            if (!variable.isEmpty()) {
                names.add(variable);
            }
        }
        names.add(field);
        names.add(entityType + "." + field);
        return names;
    }

    private static String unescape(String segment) {
        return segment.replace("~1", "/").replace("~0", "~");
    }
}
