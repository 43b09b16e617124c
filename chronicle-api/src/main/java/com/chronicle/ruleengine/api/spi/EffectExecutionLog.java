/*
 * Copyright (c) 2025 Chronicle Rule Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.chronicle.ruleengine.api.spi;

import com.chronicle.ruleengine.api.model.EffectExecution;

import java.util.List;

/**
 * Append-only audit trail of effect executions.
 */
public interface EffectExecutionLog {

    void append(EffectExecution execution);

    List<EffectExecution> findByEffect(String effectId);
}
