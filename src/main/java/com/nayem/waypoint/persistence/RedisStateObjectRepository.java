package com.nayem.waypoint.persistence;

import com.nayem.waypoint.core.StateObject;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.data.redis.core.StringRedisTemplate;

import java.nio.charset.StandardCharsets;
import java.util.Optional;

/**
 * Redis-backed implementation of {@link StateObjectRepository}. Each object is
 * stored as its serialized document under {@code keyPrefix + eventId}, without
 * expiry.
 */
public class RedisStateObjectRepository implements StateObjectRepository {

    private static final Logger log = LoggerFactory.getLogger(RedisStateObjectRepository.class);
    public static final String DEFAULT_KEY_PREFIX = "waypoint:state:";

    private final StringRedisTemplate redisTemplate;
    private final StateObjectSerializer serializer;
    private final String keyPrefix;

    public RedisStateObjectRepository(StringRedisTemplate redisTemplate, StateObjectSerializer serializer,
            String keyPrefix) {
        this.redisTemplate = redisTemplate;
        this.serializer = serializer;
        this.keyPrefix = keyPrefix;
    }

    @Override
    public void commit(StateObject object) {
        String eventId = StateObjectRepository.requireEventId(object);
        String document = new String(serializer.serialize(object), StandardCharsets.UTF_8);
        redisTemplate.opsForValue().set(keyPrefix + eventId, document);
        log.debug("Committed StateObject {} in state {}", eventId, object.getState());
    }

    @Override
    public Optional<StateObject> findByEventId(String eventId) {
        String document = redisTemplate.opsForValue().get(keyPrefix + eventId);
        if (document == null) {
            return Optional.empty();
        }
        return Optional.of(serializer.deserialize(document.getBytes(StandardCharsets.UTF_8)));
    }
}
