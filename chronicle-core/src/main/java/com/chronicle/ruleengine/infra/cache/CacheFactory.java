/*
 * Copyright (c) 2025 Chronicle Rule Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.chronicle.ruleengine.infra.cache;

import com.chronicle.ruleengine.api.spi.EvaluationCache;

import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Creates the {@link EvaluationCache} selected by a {@link CacheConfig}.
 *
 * <pre>{@code
 * EvaluationCache cache = CacheFactory.create(CacheConfig.loadDefault());
 * }</pre>
 */
public final class CacheFactory {

    private static final Logger logger = Logger.getLogger(CacheFactory.class.getName());

    private CacheFactory() {
        throw new AssertionError("CacheFactory should not be instantiated");
    }

    /**
     * @throws IllegalStateException if the backend cannot be created (for example Redis is unreachable)
     */
    public static EvaluationCache create(CacheConfig config) {
        logger.info("Creating evaluation cache: " + config);
        try {
            return switch (config.getCacheType()) {
                case CAFFEINE -> new CaffeineEvaluationCache(config);
                case REDIS -> new RedisEvaluationCache(config);
                case NO_OP -> new NoOpEvaluationCache();
            };
        } catch (RuntimeException e) {
            String msg = "Failed to create cache: " + config.getCacheType();
            logger.log(Level.SEVERE, msg, e);
            throw new IllegalStateException(msg, e);
        }
    }
}
