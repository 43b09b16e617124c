/*
 * Copyright (c) 2025 Chronicle Rule Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.chronicle.ruleengine.testkit;

import com.chronicle.ruleengine.api.model.EffectExecution;
import com.chronicle.ruleengine.api.spi.EffectExecutionLog;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.stream.Collectors;

public class InMemoryEffectExecutionLog implements EffectExecutionLog {

    private final List<EffectExecution> records = new CopyOnWriteArrayList<>();

    @Override
    public void append(EffectExecution execution) {
        records.add(execution);
    }

    @Override
    public List<EffectExecution> findByEffect(String effectId) {
        return records.stream().filter(r -> r.effectId().equals(effectId)).collect(Collectors.toList());
    }

    public List<EffectExecution> all() {
        return new ArrayList<>(records);
    }
}
