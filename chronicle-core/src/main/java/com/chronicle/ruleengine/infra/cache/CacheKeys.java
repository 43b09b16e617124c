/*
 * Copyright (c) 2025 Chronicle Rule Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.chronicle.ruleengine.infra.cache;

import java.util.Arrays;
import java.util.List;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Cache key scheme. Keys are colon-joined segments {@code prefix:segments...:branchId}; the
 * branch always comes last so a whole branch can be dropped with {@code *:<branch>}.
 *
 * <pre>
 * computed-fields:settlement:s1:main
 * derived-variable:v42:main
 * structures:settlement:s1:main
 * </pre>
 */
public final class CacheKeys {

    public static final String COMPUTED_FIELDS = "computed-fields";
    public static final String DERIVED_VARIABLE = "derived-variable";

    private static final String SEPARATOR = ":";
    private static final String WILDCARD = "*";

    private CacheKeys() {
        throw new AssertionError("No instances");
    }

    public record ParsedKey(String prefix, List<String> segments, String branchId) {
    }

    public static String build(String prefix, String branchId, String... segments) {
        StringBuilder key = new StringBuilder(prefix);
        for (String segment : segments) {
            if (segment != null && !segment.isEmpty()) {
                key.append(SEPARATOR).append(segment);
            }
        }
        return key.append(SEPARATOR).append(branchId).toString();
    }

    public static String computedFields(String entityType, String entityId, String branchId) {
        return build(COMPUTED_FIELDS, branchId, entityType, entityId);
    }

    public static String derivedVariable(String variableId, String branchId) {
        return build(DERIVED_VARIABLE, branchId, variableId);
    }

    /** Cached list of {@code childType} entities owned by a parent, e.g. {@code structures:settlement:s1:main}. */
    public static String childList(String childType, String parentType, String parentId, String branchId) {
        return build(childType + "s", branchId, parentType, parentId);
    }

    public static String computedFieldsPattern(String entityType, String branchId) {
        return build(COMPUTED_FIELDS, branchId, entityType, WILDCARD);
    }

    /** Every cached entry about one entity, whatever its prefix. */
    public static String entityPattern(String entityType, String entityId, String branchId) {
        return build(WILDCARD, branchId, entityType, entityId);
    }

    public static String prefixPattern(String prefix) {
        return prefix + SEPARATOR + WILDCARD;
    }

    public static String branchPattern(String branchId) {
        return WILDCARD + SEPARATOR + branchId;
    }

    /**
     * Splits a key into prefix, middle segments and branch. Keys with fewer than two segments are not
     * engine keys.
     */
    public static Optional<ParsedKey> parse(String key) {
        if (key == null) {
            return Optional.empty();
        }
        String[] parts = key.split(SEPARATOR, -1);
        if (parts.length < 2) {
            return Optional.empty();
        }
        return Optional.of(new ParsedKey(parts[0],
                List.of(Arrays.copyOfRange(parts, 1, parts.length - 1)),
                parts[parts.length - 1]));
    }

    /**
     * Translates a Redis glob ({@code *}, {@code ?}, {@code [..]}) into a Java regex.
     */
    public static String globToRegex(String glob) {
        StringBuilder regex = new StringBuilder(glob.length() + 8);
        boolean inClass = false;
        for (int i = 0; i < glob.length(); i++) {
            char c = glob.charAt(i);
            if (inClass) {
                if (c == ']') {
                    inClass = false;
                }
                regex.append(c);
                continue;
            }
            switch (c) {
                case '*':
                    regex.append(".*");
                    break;
                case '?':
                    regex.append('.');
                    break;
                case '[':
                    inClass = true;
                    regex.append('[');
                    break;
                case '\\':
                    if (i + 1 < glob.length()) {
                        regex.append(Pattern.quote(String.valueOf(glob.charAt(++i))));
                    }
                    break;
                default:
                    if ("().+^$|{}".indexOf(c) >= 0) {
                        regex.append('\\');
                    }
                    regex.append(c);
            }
        }
        return regex.toString();
    }
}
