/*
 * Copyright (c) 2025 Chronicle Rule Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.chronicle.ruleengine.api.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.JsonNode;

import java.io.Serializable;
import java.util.Set;

/**
 * One JSON Patch operation. {@code from} is only meaningful for {@code copy} and {@code move}.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record PatchOperation(
        @JsonProperty("op") String op,
        @JsonProperty("path") String path,
        @JsonProperty("from") String from,
        @JsonProperty("value") JsonNode value
) implements Serializable {

    public static final Set<String> SUPPORTED_OPS = Set.of("add", "remove", "replace", "test", "copy", "move");

    public static PatchOperation add(String path, JsonNode value) {
        return new PatchOperation("add", path, null, value);
    }

    public static PatchOperation replace(String path, JsonNode value) {
        return new PatchOperation("replace", path, null, value);
    }

    public static PatchOperation remove(String path) {
        return new PatchOperation("remove", path, null, null);
    }

    public static PatchOperation test(String path, JsonNode value) {
        return new PatchOperation("test", path, null, value);
    }

    public static PatchOperation copy(String from, String path) {
        return new PatchOperation("copy", path, from, null);
    }

    public static PatchOperation move(String from, String path) {
        return new PatchOperation("move", path, from, null);
    }

    public boolean isTest() {
        return "test".equals(op);
    }

    public boolean readsFrom() {
        return "copy".equals(op) || "move".equals(op);
    }
}
