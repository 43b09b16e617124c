/*
 * Copyright (c) 2025 Chronicle Rule Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.chronicle.ruleengine.infra.metrics;

/**
 * Point-in-time value that may go up or down (graph sizes, cache sizes).
 */
public interface Gauge {

    void set(double value);

    double value();
}
