/*
 * Copyright (c) 2025 Chronicle Rule Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.chronicle.ruleengine.infra.cache;

import org.redisson.config.Config;

import java.io.FileInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.time.Duration;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Properties;
import java.util.function.Function;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Immutable configuration of the evaluation cache.
 *
 * <p>Values come from, in increasing precedence: builder defaults, a properties file
 * ({@code cache.properties} on the classpath by default), and {@code CACHE_*} environment variables.
 *
 * <pre>
 * CACHE_TYPE=REDIS
 * CACHE_REDIS_ADDRESS=redis://prod-redis:6379
 * CACHE_DEFAULT_TTL_SECONDS=600
 * </pre>
 *
 * <pre>{@code
 * CacheConfig config = CacheConfig.builder()
 *     .cacheType(CacheConfig.CacheType.CAFFEINE)
 *     .maxSize(50_000)
 *     .build();
 * EvaluationCache cache = CacheFactory.create(config);
 * }</pre>
 */
public final class CacheConfig {

    private static final Logger logger = Logger.getLogger(CacheConfig.class.getName());

    public static final String DEFAULT_PROPERTIES = "cache.properties";

    // ========================================================================
    // ENVIRONMENT VARIABLE KEYS
    // ========================================================================

    private static final String ENV_CACHE_TYPE = "CACHE_TYPE";
    private static final String ENV_MAX_SIZE = "CACHE_MAX_SIZE";
    private static final String ENV_DEFAULT_TTL_SECONDS = "CACHE_DEFAULT_TTL_SECONDS";
    private static final String ENV_RECORD_STATS = "CACHE_RECORD_STATS";
    private static final String ENV_REDIS_ADDRESS = "CACHE_REDIS_ADDRESS";
    private static final String ENV_REDIS_PASSWORD = "CACHE_REDIS_PASSWORD";
    private static final String ENV_REDIS_CONNECTION_POOL_SIZE = "CACHE_REDIS_CONNECTION_POOL_SIZE";
    private static final String ENV_REDIS_MIN_IDLE_SIZE = "CACHE_REDIS_MIN_IDLE_SIZE";
    private static final String ENV_REDIS_TIMEOUT_MS = "CACHE_REDIS_TIMEOUT_MS";
    private static final String ENV_REDIS_USE_CLUSTER = "CACHE_REDIS_USE_CLUSTER";

    public enum CacheType {
        /** Local Caffeine cache, per process. */
        CAFFEINE,
        /** Shared Redis cache via Redisson. */
        REDIS,
        /** Caching disabled: every read is a miss. */
        NO_OP
    }

    private final CacheType cacheType;
    private final long maxSize;
    private final Duration defaultTtl;
    private final boolean recordStats;
    private final String redisAddress;
    private final String redisPassword;
    private final int redisConnectionPoolSize;
    private final int redisMinIdleSize;
    private final int redisTimeoutMs;
    private final boolean redisUseCluster;

    private CacheConfig(Builder builder) {
        this.cacheType = builder.cacheType;
        this.maxSize = builder.maxSize;
        this.defaultTtl = builder.defaultTtl;
        this.recordStats = builder.recordStats;
        this.redisAddress = builder.redisAddress;
        this.redisPassword = builder.redisPassword;
        this.redisConnectionPoolSize = builder.redisConnectionPoolSize;
        this.redisMinIdleSize = builder.redisMinIdleSize;
        this.redisTimeoutMs = builder.redisTimeoutMs;
        this.redisUseCluster = builder.redisUseCluster;
        validate();
    }

    // ========================================================================
    // FACTORY METHODS
    // ========================================================================

    public static Builder builder() {
        return new Builder();
    }

    /** Defaults overridden by {@code cache.properties} and the environment. */
    public static CacheConfig loadDefault() {
        return loadFromProperties(DEFAULT_PROPERTIES);
    }

    /**
     * Loads {@code propertiesPath} from the classpath, falling back to the file system.
     * A missing file leaves the defaults in place.
     */
    public static CacheConfig loadFromProperties(String propertiesPath) {
        Properties props = new Properties();
        try (InputStream is = CacheConfig.class.getClassLoader().getResourceAsStream(propertiesPath)) {
            if (is != null) {
                props.load(is);
            } else {
                try (InputStream fis = new FileInputStream(propertiesPath)) {
                    props.load(fis);
                }
            }
            logger.info(String.format("Loaded %d cache properties from %s", props.size(), propertiesPath));
        } catch (IOException e) {
            logger.log(Level.WARNING, "Could not load cache properties " + propertiesPath + ", using defaults", e);
        }
        return fromSources(props, System.getenv());
    }

    /**
     * Builds a config from explicit property and environment maps. Environment entries win.
     */
    static CacheConfig fromSources(Properties props, Map<String, String> env) {
        Builder builder = builder();
        apply(props.getProperty("cache.type"), v -> builder.cacheType(parseType(v)));
        apply(props.getProperty("cache.max.size"), v -> builder.maxSize(Long.parseLong(v)));
        apply(props.getProperty("cache.default.ttl.seconds"), v -> builder.defaultTtl(Duration.ofSeconds(Long.parseLong(v))));
        apply(props.getProperty("cache.record.stats"), v -> builder.recordStats(Boolean.parseBoolean(v)));
        apply(props.getProperty("cache.redis.address"), builder::redisAddress);
        apply(props.getProperty("cache.redis.password"), builder::redisPassword);
        apply(props.getProperty("cache.redis.connection.pool.size"), v -> builder.redisConnectionPoolSize(Integer.parseInt(v)));
        apply(props.getProperty("cache.redis.min.idle.size"), v -> builder.redisMinIdleSize(Integer.parseInt(v)));
        apply(props.getProperty("cache.redis.timeout.ms"), v -> builder.redisTimeoutMs(Integer.parseInt(v)));
        apply(props.getProperty("cache.redis.use.cluster"), v -> builder.redisUseCluster(Boolean.parseBoolean(v)));

        apply(env.get(ENV_CACHE_TYPE), v -> builder.cacheType(parseType(v)));
        apply(env.get(ENV_MAX_SIZE), v -> builder.maxSize(Long.parseLong(v)));
        apply(env.get(ENV_DEFAULT_TTL_SECONDS), v -> builder.defaultTtl(Duration.ofSeconds(Long.parseLong(v))));
        apply(env.get(ENV_RECORD_STATS), v -> builder.recordStats(parseFlag(v)));
        apply(env.get(ENV_REDIS_ADDRESS), builder::redisAddress);
        apply(env.get(ENV_REDIS_PASSWORD), builder::redisPassword);
        apply(env.get(ENV_REDIS_CONNECTION_POOL_SIZE), v -> builder.redisConnectionPoolSize(Integer.parseInt(v)));
        apply(env.get(ENV_REDIS_MIN_IDLE_SIZE), v -> builder.redisMinIdleSize(Integer.parseInt(v)));
        apply(env.get(ENV_REDIS_TIMEOUT_MS), v -> builder.redisTimeoutMs(Integer.parseInt(v)));
        apply(env.get(ENV_REDIS_USE_CLUSTER), v -> builder.redisUseCluster(parseFlag(v)));
        return builder.build();
    }

    private static void apply(String raw, Function<String, Builder> setter) {
        if (raw == null || raw.trim().isEmpty()) {
            return;
        }
        try {
            setter.apply(raw.trim());
        } catch (IllegalArgumentException e) {
            logger.warning(String.format("Ignoring invalid cache setting '%s': %s", raw, e.getMessage()));
        }
    }

    private static CacheType parseType(String value) {
        return CacheType.valueOf(value.toUpperCase(Locale.ROOT));
    }

    private static boolean parseFlag(String value) {
        String normalized = value.toLowerCase(Locale.ROOT);
        return "true".equals(normalized) || "1".equals(normalized) || "yes".equals(normalized);
    }

    private void validate() {
        if (maxSize <= 0) {
            throw new IllegalArgumentException("maxSize must be positive: " + maxSize);
        }
        if (defaultTtl.isNegative() || defaultTtl.isZero()) {
            throw new IllegalArgumentException("defaultTtl must be positive: " + defaultTtl);
        }
        if (cacheType == CacheType.REDIS && (redisAddress == null || redisAddress.isEmpty())) {
            throw new IllegalArgumentException("redisAddress is required for REDIS caches");
        }
    }

    // ========================================================================
    // REDISSON INTEGRATION
    // ========================================================================

    public Config toRedissonConfig() {
        Config config = new Config();
        String password = redisPassword != null && !redisPassword.isEmpty() ? redisPassword : null;
        if (redisUseCluster) {
            config.useClusterServers()
                    .addNodeAddress(redisAddress.split(","))
                    .setPassword(password)
                    .setMasterConnectionPoolSize(redisConnectionPoolSize)
                    .setMasterConnectionMinimumIdleSize(redisMinIdleSize)
                    .setTimeout(redisTimeoutMs)
                    .setRetryAttempts(3)
                    .setRetryInterval(1500);
        } else {
            config.useSingleServer()
                    .setAddress(redisAddress)
                    .setPassword(password)
                    .setConnectionPoolSize(redisConnectionPoolSize)
                    .setConnectionMinimumIdleSize(redisMinIdleSize)
                    .setTimeout(redisTimeoutMs)
                    .setRetryAttempts(3)
                    .setRetryInterval(1500);
        }
        return config;
    }

    // ========================================================================
    // GETTERS
    // ========================================================================

    public CacheType getCacheType() {
        return cacheType;
    }

    public long getMaxSize() {
        return maxSize;
    }

    public Duration getDefaultTtl() {
        return defaultTtl;
    }

    public boolean isRecordStats() {
        return recordStats;
    }

    public String getRedisAddress() {
        return redisAddress;
    }

    public Optional<String> getRedisPassword() {
        return Optional.ofNullable(redisPassword).filter(p -> !p.isEmpty());
    }

    public int getRedisConnectionPoolSize() {
        return redisConnectionPoolSize;
    }

    public int getRedisMinIdleSize() {
        return redisMinIdleSize;
    }

    public int getRedisTimeoutMs() {
        return redisTimeoutMs;
    }

    public boolean isRedisUseCluster() {
        return redisUseCluster;
    }

    @Override
    public String toString() {
        return String.format("CacheConfig{type=%s, maxSize=%d, defaultTtl=%s, redis=%s%s}",
                cacheType, maxSize, defaultTtl, redisAddress, redisUseCluster ? " (cluster)" : "");
    }

    // ========================================================================
    // BUILDER
    // ========================================================================

    public static final class Builder {
        private CacheType cacheType = CacheType.CAFFEINE;
        private long maxSize = 10_000;
        private Duration defaultTtl = Duration.ofSeconds(300);
        private boolean recordStats = true;
        private String redisAddress = "redis://localhost:6379";
        private String redisPassword;
        private int redisConnectionPoolSize = 64;
        private int redisMinIdleSize = 24;
        private int redisTimeoutMs = 3000;
        private boolean redisUseCluster;

        private Builder() {
        }

        public Builder cacheType(CacheType type) {
            this.cacheType = type;
            return this;
        }

        public Builder maxSize(long size) {
            this.maxSize = size;
            return this;
        }

        public Builder defaultTtl(Duration ttl) {
            this.defaultTtl = ttl;
            return this;
        }

        public Builder recordStats(boolean enable) {
            this.recordStats = enable;
            return this;
        }

        public Builder redisAddress(String address) {
            this.redisAddress = address;
            return this;
        }

        public Builder redisPassword(String password) {
            this.redisPassword = password;
            return this;
        }

        public Builder redisConnectionPoolSize(int size) {
            this.redisConnectionPoolSize = size;
            return this;
        }

        public Builder redisMinIdleSize(int size) {
            this.redisMinIdleSize = size;
            return this;
        }

        public Builder redisTimeoutMs(int timeoutMs) {
            this.redisTimeoutMs = timeoutMs;
            return this;
        }

        public Builder redisUseCluster(boolean useCluster) {
            this.redisUseCluster = useCluster;
            return this;
        }

        public CacheConfig build() {
            return new CacheConfig(this);
        }
    }
}
