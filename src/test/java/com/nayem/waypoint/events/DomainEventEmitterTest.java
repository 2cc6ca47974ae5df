package com.nayem.waypoint.events;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.data.redis.connection.stream.MapRecord;
import org.springframework.data.redis.core.StreamOperations;
import org.springframework.data.redis.core.StringRedisTemplate;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

class DomainEventEmitterTest {

    private DomainEventEmitter emitter;

    @BeforeEach
    void setUp() {
        emitter = new DomainEventEmitter(new ObjectMapper());
    }

    public record SubscriptionActivated(String msisdn, String plan) {
    }

    @Test
    void testEmitWithoutTransportDropsEvent() {
        assertFalse(emitter.emit(new SubscriptionActivated("4670000000", "gold")));
        assertTrue(emitter.getTransport().isEmpty());
    }

    @Test
    void testEmitSerializesToJson() {
        CapturingTransport transport = new CapturingTransport("capture");
        emitter.configure(transport);

        assertTrue(emitter.emit(new SubscriptionActivated("4670000000", "gold")));

        assertEquals(List.of("{\"msisdn\":\"4670000000\",\"plan\":\"gold\"}"), transport.sent);
    }

    @Test
    void testStringEventsSentAsIs() {
        CapturingTransport transport = new CapturingTransport("capture");
        emitter.configure(transport);

        emitter.emit("already-encoded");

        assertEquals(List.of("already-encoded"), transport.sent);
    }

    @Test
    void testConfigureReplacesPreviousTransport() {
        CapturingTransport first = new CapturingTransport("first");
        CapturingTransport second = new CapturingTransport("second");
        emitter.configure(first);
        emitter.configure(second);

        emitter.emit("event");

        assertTrue(first.sent.isEmpty());
        assertEquals(1, second.sent.size());
        assertSame(second, emitter.getTransport().orElseThrow());
    }

    @Test
    void testConfigureRejectsNullAndKeepsActiveTransport() {
        CapturingTransport transport = new CapturingTransport("capture");
        emitter.configure(transport);

        assertThrows(NullPointerException.class, () -> emitter.configure(null));

        assertSame(transport, emitter.getTransport().orElseThrow());
    }

    @Test
    void testClearRemovesTransport() {
        emitter.configure(new CapturingTransport("capture"));

        emitter.clear();

        assertFalse(emitter.emit("event"));
    }

    @Test
    @SuppressWarnings({"unchecked", "rawtypes"})
    void testRedisStreamTransportAppendsDataField() {
        StringRedisTemplate redisTemplate = mock(StringRedisTemplate.class);
        StreamOperations streamOps = mock(StreamOperations.class);
        when(redisTemplate.opsForStream()).thenReturn(streamOps);
        RedisStreamEventTransport transport = new RedisStreamEventTransport(redisTemplate, "events");

        transport.send("{\"a\":1}");

        ArgumentCaptor<MapRecord> captor = ArgumentCaptor.forClass(MapRecord.class);
        verify(streamOps).add(captor.capture());
        assertEquals("events", captor.getValue().getStream());
        assertEquals(Map.of("data", "{\"a\":1}"), captor.getValue().getValue());
        assertEquals("redis-stream:events", transport.name());
    }

    private static final class CapturingTransport implements EventTransport {
        private final String name;
        private final List<String> sent = new ArrayList<>();

        CapturingTransport(String name) {
            this.name = name;
        }

        @Override
        public String name() {
            return name;
        }

        @Override
        public void send(String payload) {
            sent.add(payload);
        }
    }
}
