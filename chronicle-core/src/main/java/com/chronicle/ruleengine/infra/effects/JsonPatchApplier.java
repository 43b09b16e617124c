/*
 * Copyright (c) 2025 Chronicle Rule Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.chronicle.ruleengine.infra.effects;

import com.chronicle.ruleengine.api.exceptions.EvaluationException;
import com.chronicle.ruleengine.api.model.PatchOperation;
import com.fasterxml.jackson.core.JsonPointer;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.util.Iterator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.TreeSet;

/**
 * RFC 6902 JSON Patch over Jackson trees.
 *
 * <p>The input document is never modified; operations run against a deep copy that is only
 * returned when every operation succeeded. A failing operation, including a failed {@code test},
 * raises {@link EvaluationException}.
 */
public class JsonPatchApplier {

    private static final String APPEND = "-";

    public ObjectNode apply(ObjectNode document, List<PatchOperation> patch) {
        ObjectNode working = document.deepCopy();
        for (int i = 0; i < patch.size(); i++) {
            PatchOperation operation = patch.get(i);
            try {
                applyOne(working, operation);
            } catch (EvaluationException e) {
                throw new EvaluationException(String.format("Patch operation %d (%s %s) failed: %s",
                        i, operation.op(), operation.path(), e.getMessage()), e);
            }
        }
        return working;
    }

    /** Top-level fields the patch modifies, in patch order. {@code test} operations are skipped. */
    public static List<String> affectedFields(List<PatchOperation> patch) {
        Set<String> fields = new LinkedHashSet<>();
        for (PatchOperation operation : patch) {
            if (operation.isTest() || operation.path() == null || !operation.path().startsWith("/")) {
                continue;
            }
            fields.add(PatchPathPolicy.topLevelField(operation.path()));
            if ("move".equals(operation.op()) && operation.from() != null && operation.from().startsWith("/")) {
                fields.add(PatchPathPolicy.topLevelField(operation.from()));
            }
        }
        return List.copyOf(fields);
    }

    /** Top-level fields whose values differ between two documents, sorted. */
    public static List<String> changedFields(ObjectNode before, ObjectNode after) {
        Set<String> changed = new TreeSet<>();
        Iterator<String> names = before.fieldNames();
        while (names.hasNext()) {
            String name = names.next();
            if (!before.get(name).equals(after.get(name))) {
                changed.add(name);
            }
        }
        names = after.fieldNames();
        while (names.hasNext()) {
            String name = names.next();
            if (!before.has(name)) {
                changed.add(name);
            }
        }
        return List.copyOf(changed);
    }

    // ========================================================================
    // OPERATIONS
    // ========================================================================

    private void applyOne(ObjectNode document, PatchOperation operation) {
        String op = operation.op();
        if (op == null || !PatchOperation.SUPPORTED_OPS.contains(op)) {
            throw new EvaluationException("Unsupported patch operation: " + op);
        }
        JsonPointer path = pointer(operation.path());
        switch (op) {
            case "add" -> add(document, path, requireValue(operation));
            case "remove" -> remove(document, path);
            case "replace" -> {
                requireExisting(document, path);
                remove(document, path);
                add(document, path, requireValue(operation));
            }
            case "test" -> test(document, path, requireValue(operation));
            case "copy" -> add(document, path, requireExisting(document, pointer(operation.from())).deepCopy());
            case "move" -> {
                JsonPointer from = pointer(operation.from());
                if (path.toString().startsWith(from.toString() + "/")) {
                    throw new EvaluationException("Cannot move " + from + " into its own child " + path);
                }
                JsonNode value = requireExisting(document, from);
                remove(document, from);
                add(document, path, value);
            }
            default -> throw new EvaluationException("Unsupported patch operation: " + op);
        }
    }

    private static void add(ObjectNode document, JsonPointer path, JsonNode value) {
        JsonNode parent = container(document, path);
        String token = path.last().getMatchingProperty();
        if (parent instanceof ObjectNode object) {
            object.set(token, value);
        } else if (parent instanceof ArrayNode array) {
            if (APPEND.equals(token)) {
                array.add(value);
            } else {
                int index = index(token, array.size());
                array.insert(index, value);
            }
        } else {
            throw new EvaluationException("Parent of " + path + " is not a container");
        }
    }

    private static void remove(ObjectNode document, JsonPointer path) {
        requireExisting(document, path);
        JsonNode parent = container(document, path);
        String token = path.last().getMatchingProperty();
        if (parent instanceof ObjectNode object) {
            object.remove(token);
        } else if (parent instanceof ArrayNode array) {
            array.remove(index(token, array.size() - 1));
        }
    }

    private static void test(ObjectNode document, JsonPointer path, JsonNode expected) {
        JsonNode actual = requireExisting(document, path);
        if (!sameValue(actual, expected)) {
            throw new EvaluationException(String.format("Test failed at %s: expected %s but was %s",
                    path, expected, actual));
        }
    }

    // ========================================================================
    // HELPERS
    // ========================================================================

    private static JsonPointer pointer(String text) {
        if (text == null || text.isEmpty()) {
            throw new EvaluationException("Patch operations cannot target the document root");
        }
        try {
            return JsonPointer.compile(text);
        } catch (IllegalArgumentException e) {
            throw new EvaluationException("Invalid JSON pointer: " + text, e);
        }
    }

    private static JsonNode container(ObjectNode document, JsonPointer path) {
        JsonNode parent = document.at(path.head());
        if (parent.isMissingNode()) {
            throw new EvaluationException("Parent of " + path + " does not exist");
        }
        return parent;
    }

    private static JsonNode requireExisting(ObjectNode document, JsonPointer path) {
        JsonNode node = document.at(path);
        if (node.isMissingNode()) {
            throw new EvaluationException("No value at " + path);
        }
        return node;
    }

    private static JsonNode requireValue(PatchOperation operation) {
        if (operation.value() == null) {
            throw new EvaluationException("Missing value for " + operation.op() + " " + operation.path());
        }
        return operation.value();
    }

    private static int index(String token, int max) {
        try {
            int index = Integer.parseInt(token);
            if (index < 0 || index > max) {
                throw new EvaluationException("Array index out of bounds: " + token);
            }
            return index;
        } catch (NumberFormatException e) {
            throw new EvaluationException("Invalid array index: " + token, e);
        }
    }

    /** JSON equality where {@code 5} equals {@code 5.0}. */
    private static boolean sameValue(JsonNode a, JsonNode b) {
        if (a.isNumber() && b.isNumber()) {
            return a.decimalValue().compareTo(b.decimalValue()) == 0;
        }
        return a.equals(b);
    }
}
