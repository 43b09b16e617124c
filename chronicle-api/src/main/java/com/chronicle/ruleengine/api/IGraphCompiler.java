/*
 * Copyright (c) 2025 Chronicle Rule Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.chronicle.ruleengine.api;

import com.chronicle.ruleengine.api.model.Effect;
import com.chronicle.ruleengine.api.model.GraphOverlay;
import com.chronicle.ruleengine.runtime.model.DependencyGraph;

import java.util.Collection;

/**
 * Builds the dependency graph of a campaign branch from the stored definitions.
 */
public interface IGraphCompiler {

    /**
     * Compiles the graph for the live definitions of a campaign, including cycle analysis
     * and the evaluation order.
     */
    DependencyGraph compile(String campaignId, String branchId);

    /**
     * Compiles a candidate graph with proposed definitions layered over the stored ones.
     * Used to validate a definition before it is persisted.
     */
    DependencyGraph compile(String campaignId, String branchId, GraphOverlay overlay);

    /**
     * Graph restricted to the given effects and the names they read and write.
     */
    DependencyGraph compileEffects(String campaignId, String branchId, Collection<Effect> effects);
}
