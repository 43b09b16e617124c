/*
 * Copyright (c) 2025 Chronicle Rule Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.chronicle.ruleengine.infra.effects;

import com.chronicle.ruleengine.api.exceptions.ForbiddenPathException;
import com.chronicle.ruleengine.api.model.PatchOperation;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Per-entity-type whitelist of the top-level fields an effect may patch.
 *
 * <p>Identifiers, timestamps, the version column and foreign keys (any top-level field ending in
 * {@code Id}) are never patchable, whatever the whitelist says. Nested paths are judged by their
 * first segment: {@code /variables/gold} is allowed when {@code variables} is.
 */
public final class PatchPathPolicy {

    private static final Set<String> PROTECTED_FIELDS =
            Set.of("id", "createdAt", "updatedAt", "deletedAt", "version");

    private static final String FOREIGN_KEY_SUFFIX = "Id";

    private final Map<String, Set<String>> whitelists;

    private PatchPathPolicy(Map<String, Set<String>> whitelists) {
        this.whitelists = Map.copyOf(whitelists);
    }

    public static PatchPathPolicy defaults() {
        Map<String, Set<String>> whitelists = new HashMap<>();
        whitelists.put("settlement", Set.of("name", "level", "variables", "population", "description"));
        whitelists.put("structure", Set.of("name", "level", "type", "variables", "operational", "description"));
        whitelists.put("kingdom", Set.of("name", "level", "variables", "description"));
        whitelists.put("encounter", Set.of("name", "difficulty", "variables", "description", "isResolved"));
        whitelists.put("event", Set.of("name", "variables", "description", "isCompleted"));
        return new PatchPathPolicy(whitelists);
    }

    public static PatchPathPolicy of(Map<String, Set<String>> whitelists) {
        Map<String, Set<String>> normalized = new HashMap<>();
        whitelists.forEach((type, fields) -> normalized.put(type.toLowerCase(Locale.ROOT), Set.copyOf(fields)));
        return new PatchPathPolicy(normalized);
    }

    public PatchPathPolicy withWhitelist(String entityType, Set<String> fields) {
        Map<String, Set<String>> copy = new HashMap<>(whitelists);
        copy.put(entityType.toLowerCase(Locale.ROOT), Set.copyOf(fields));
        return new PatchPathPolicy(copy);
    }

    public Set<String> whitelist(String entityType) {
        return whitelists.getOrDefault(entityType.toLowerCase(Locale.ROOT), Set.of());
    }

    /**
     * @throws ForbiddenPathException for the first offending {@code path} or {@code from}
     */
    public void validate(String entityType, PatchOperation operation) {
        checkPointer(entityType, operation.path());
        if (operation.readsFrom()) {
            checkPointer(entityType, operation.from());
        }
    }

    public void validate(String entityType, List<PatchOperation> patch) {
        for (PatchOperation operation : patch) {
            validate(entityType, operation);
        }
    }

    /** Every violation of the patch, empty when it is fully allowed. */
    public List<String> violations(String entityType, List<PatchOperation> patch) {
        List<String> errors = new ArrayList<>();
        for (PatchOperation operation : patch) {
            try {
                validate(entityType, operation);
            } catch (ForbiddenPathException e) {
                errors.add(e.getMessage());
            }
        }
        return errors;
    }

    private void checkPointer(String entityType, String pointer) {
        if (pointer == null || pointer.isEmpty() || pointer.equals("/")) {
            throw new ForbiddenPathException(entityType, String.valueOf(pointer), "the document root is not patchable");
        }
        if (!pointer.startsWith("/")) {
            throw new ForbiddenPathException(entityType, pointer, "not a JSON pointer");
        }
        String field = topLevelField(pointer);
        if (PROTECTED_FIELDS.contains(field)) {
            throw new ForbiddenPathException(entityType, pointer, "protected field");
        }
        if (field.endsWith(FOREIGN_KEY_SUFFIX) && field.length() > FOREIGN_KEY_SUFFIX.length()) {
            throw new ForbiddenPathException(entityType, pointer, "foreign keys are not patchable");
        }
        Set<String> allowed = whitelists.get(entityType.toLowerCase(Locale.ROOT));
        if (allowed == null) {
            throw new ForbiddenPathException(entityType, pointer, "no patchable fields for this entity type");
        }
        if (!allowed.contains(field)) {
            throw new ForbiddenPathException(entityType, pointer, "field is not whitelisted");
        }
    }

    /** First reference token of a pointer, unescaped. */
    static String topLevelField(String pointer) {
        int end = pointer.indexOf('/', 1);
        String token = end < 0 ? pointer.substring(1) : pointer.substring(1, end);
        return token.replace("~1", "/").replace("~0", "~");
    }
}
