/*
 * Copyright (c) 2025 Chronicle Rule Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.chronicle.ruleengine.config;

import java.io.IOException;
import java.io.InputStream;
import java.time.Duration;
import java.util.Map;
import java.util.Properties;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Engine settings. Defaults are overridden by {@code chronicle.properties} on the classpath,
 * which is in turn overridden by {@code RULES_*} environment variables.
 *
 * <table>
 *   <tr><th>property</th><th>environment</th><th>default</th></tr>
 *   <tr><td>rules.max.expression.depth</td><td>RULES_MAX_EXPRESSION_DEPTH</td><td>10</td></tr>
 *   <tr><td>rules.computed.fields.ttl.seconds</td><td>RULES_COMPUTED_FIELDS_TTL_SECONDS</td><td>300</td></tr>
 *   <tr><td>rules.cache.timeout.ms</td><td>RULES_CACHE_TIMEOUT_MS</td><td>2000</td></tr>
 *   <tr><td>rules.default.branch</td><td>RULES_DEFAULT_BRANCH</td><td>main</td></tr>
 * </table>
 */
public final class EngineConfig {

    private static final Logger logger = Logger.getLogger(EngineConfig.class.getName());

    public static final String DEFAULT_PROPERTIES = "chronicle.properties";

    private final int maxExpressionDepth;
    private final Duration computedFieldsTtl;
    private final Duration cacheTimeout;
    private final String defaultBranch;

    private EngineConfig(Builder builder) {
        if (builder.maxExpressionDepth < 1) {
            throw new IllegalArgumentException("maxExpressionDepth must be at least 1: " + builder.maxExpressionDepth);
        }
        if (builder.computedFieldsTtl.isNegative() || builder.computedFieldsTtl.isZero()) {
            throw new IllegalArgumentException("computedFieldsTtl must be positive: " + builder.computedFieldsTtl);
        }
        if (builder.cacheTimeout.isNegative() || builder.cacheTimeout.isZero()) {
            throw new IllegalArgumentException("cacheTimeout must be positive: " + builder.cacheTimeout);
        }
        this.maxExpressionDepth = builder.maxExpressionDepth;
        this.computedFieldsTtl = builder.computedFieldsTtl;
        this.cacheTimeout = builder.cacheTimeout;
        this.defaultBranch = builder.defaultBranch;
    }

    public static Builder builder() {
        return new Builder();
    }

    public static EngineConfig defaults() {
        return builder().build();
    }

    public static EngineConfig load() {
        Properties props = new Properties();
        try (InputStream is = EngineConfig.class.getClassLoader().getResourceAsStream(DEFAULT_PROPERTIES)) {
            if (is != null) {
                props.load(is);
            } else {
                logger.fine(DEFAULT_PROPERTIES + " not on classpath, using defaults");
            }
        } catch (IOException e) {
            logger.log(Level.WARNING, "Could not read " + DEFAULT_PROPERTIES + ", using defaults", e);
        }
        return fromSources(props, System.getenv());
    }

    static EngineConfig fromSources(Properties props, Map<String, String> env) {
        Builder builder = builder();
        String depth = pick(props, env, "rules.max.expression.depth", "RULES_MAX_EXPRESSION_DEPTH");
        String ttl = pick(props, env, "rules.computed.fields.ttl.seconds", "RULES_COMPUTED_FIELDS_TTL_SECONDS");
        String timeout = pick(props, env, "rules.cache.timeout.ms", "RULES_CACHE_TIMEOUT_MS");
        String branch = pick(props, env, "rules.default.branch", "RULES_DEFAULT_BRANCH");
        try {
            if (depth != null) {
                builder.maxExpressionDepth(Integer.parseInt(depth));
            }
            if (ttl != null) {
                builder.computedFieldsTtl(Duration.ofSeconds(Long.parseLong(ttl)));
            }
            if (timeout != null) {
                builder.cacheTimeout(Duration.ofMillis(Long.parseLong(timeout)));
            }
        } catch (NumberFormatException e) {
            logger.log(Level.WARNING, "Ignoring invalid numeric engine setting", e);
        }
        if (branch != null) {
            builder.defaultBranch(branch);
        }
        return builder.build();
    }

    private static String pick(Properties props, Map<String, String> env, String property, String variable) {
        String fromEnv = env.get(variable);
        if (fromEnv != null && !fromEnv.trim().isEmpty()) {
            return fromEnv.trim();
        }
        String fromProps = props.getProperty(property);
        return fromProps == null || fromProps.trim().isEmpty() ? null : fromProps.trim();
    }

    public int getMaxExpressionDepth() {
        return maxExpressionDepth;
    }

    public Duration getComputedFieldsTtl() {
        return computedFieldsTtl;
    }

    public Duration getCacheTimeout() {
        return cacheTimeout;
    }

    public String getDefaultBranch() {
        return defaultBranch;
    }

    @Override
    public String toString() {
        return String.format("EngineConfig{maxDepth=%d, ttl=%s, cacheTimeout=%s, defaultBranch=%s}",
                maxExpressionDepth, computedFieldsTtl, cacheTimeout, defaultBranch);
    }

    public static final class Builder {
        private int maxExpressionDepth = 10;
        private Duration computedFieldsTtl = Duration.ofSeconds(300);
        private Duration cacheTimeout = Duration.ofMillis(2000);
        private String defaultBranch = "main";

        private Builder() {
        }

        public Builder maxExpressionDepth(int depth) {
            this.maxExpressionDepth = depth;
            return this;
        }

        public Builder computedFieldsTtl(Duration ttl) {
            this.computedFieldsTtl = ttl;
            return this;
        }

        public Builder cacheTimeout(Duration timeout) {
            this.cacheTimeout = timeout;
            return this;
        }

        public Builder defaultBranch(String branch) {
            this.defaultBranch = branch;
            return this;
        }

        public EngineConfig build() {
            return new EngineConfig(this);
        }
    }
}
