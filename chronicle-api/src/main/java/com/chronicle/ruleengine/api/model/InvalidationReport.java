/*
 * Copyright (c) 2025 Chronicle Rule Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.chronicle.ruleengine.api.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.io.Serializable;
import java.util.List;

/**
 * Cache keys and patterns an invalidation deleted, plus the graph nodes it reached.
 */
public record InvalidationReport(
        @JsonProperty("exact_keys") List<String> exactKeys,
        @JsonProperty("patterns") List<String> patterns,
        @JsonProperty("affected_nodes") List<String> affectedNodes,
        @JsonProperty("graph_dropped") boolean graphDropped
) implements Serializable {

    public InvalidationReport {
        exactKeys = List.copyOf(exactKeys);
        patterns = List.copyOf(patterns);
        affectedNodes = List.copyOf(affectedNodes);
    }
}
