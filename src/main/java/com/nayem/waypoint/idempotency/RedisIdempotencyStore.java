package com.nayem.waypoint.idempotency;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.data.redis.core.StringRedisTemplate;

import java.time.Duration;

/**
 * Redis-backed implementation of {@link IdempotencyStore}.
 * <p>
 * Transport errors never abort a transition. A failed {@link #exists} reports
 * the key as not yet processed, which can let a duplicate through rather than
 * block progress. A failed mark is logged and dropped.
 * </p>
 */
public class RedisIdempotencyStore implements IdempotencyStore {

    private static final Logger log = LoggerFactory.getLogger(RedisIdempotencyStore.class);
    public static final String DEFAULT_KEY_PREFIX = "waypoint:event:";

    private final StringRedisTemplate redisTemplate;
    private final String keyPrefix;
    private final Duration defaultTtl;

    public RedisIdempotencyStore(StringRedisTemplate redisTemplate) {
        this(redisTemplate, DEFAULT_KEY_PREFIX, Duration.ZERO);
    }

    public RedisIdempotencyStore(StringRedisTemplate redisTemplate, String keyPrefix, Duration defaultTtl) {
        this.redisTemplate = redisTemplate;
        this.keyPrefix = keyPrefix;
        this.defaultTtl = defaultTtl;
    }

    @Override
    public boolean exists(String key) {
        try {
            Boolean exists = redisTemplate.hasKey(keyPrefix + key);
            return exists != null && exists;
        } catch (DataAccessException e) {
            log.warn("Idempotency lookup for {} failed, treating as not processed: {}", key, e.getMessage());
            return false;
        }
    }

    @Override
    public void set(String key, String value, Duration ttl) {
        try {
            if (ttl == null || ttl.isZero() || ttl.isNegative()) {
                redisTemplate.opsForValue().set(keyPrefix + key, value);
            } else {
                redisTemplate.opsForValue().set(keyPrefix + key, value, ttl);
            }
        } catch (DataAccessException e) {
            log.error("Failed to record idempotency key {}: {}", key, e.getMessage());
        }
    }

    @Override
    public void markProcessed(String key) {
        set(key, "true", defaultTtl);
    }
}
