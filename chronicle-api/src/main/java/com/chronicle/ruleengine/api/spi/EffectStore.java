/*
 * Copyright (c) 2025 Chronicle Rule Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.chronicle.ruleengine.api.spi;

import com.chronicle.ruleengine.api.model.Effect;
import com.chronicle.ruleengine.api.model.EffectTiming;

import java.util.Collection;
import java.util.List;
import java.util.Optional;

public interface EffectStore {

    List<Effect> findActive(String entityType, String entityId, EffectTiming timing);

    /** Live effects with the given ids; unknown ids are skipped. */
    List<Effect> findByIds(Collection<String> ids);

    List<Effect> findActiveByCampaign(String campaignId);

    Optional<Effect> findById(String id);

    Effect save(Effect effect);
}
