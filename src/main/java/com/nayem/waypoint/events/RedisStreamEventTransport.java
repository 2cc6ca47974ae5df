package com.nayem.waypoint.events;

import org.springframework.data.redis.connection.stream.StreamRecords;
import org.springframework.data.redis.core.StringRedisTemplate;

import java.util.Map;

/**
 * Appends events to a Redis stream as {@code {"data": payload}} records.
 */
public class RedisStreamEventTransport implements EventTransport {

    public static final String DEFAULT_STREAM_KEY = "waypoint:events";

    private final StringRedisTemplate redisTemplate;
    private final String streamKey;

    public RedisStreamEventTransport(StringRedisTemplate redisTemplate, String streamKey) {
        this.redisTemplate = redisTemplate;
        this.streamKey = streamKey;
    }

    @Override
    public String name() {
        return "redis-stream:" + streamKey;
    }

    @Override
    public void send(String payload) {
        redisTemplate.opsForStream().add(StreamRecords.newRecord()
                .in(streamKey)
                .ofStrings(Map.of("data", payload)));
    }
}
