package com.nayem.waypoint.persistence;

import com.nayem.waypoint.core.StateObject;
import org.junit.jupiter.api.Test;

import java.util.HashMap;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class InMemoryStateObjectRepositoryTest {

    private final InMemoryStateObjectRepository repository =
            new InMemoryStateObjectRepository(new JacksonStateObjectSerializer());

    @Test
    void testCommitAndFind() {
        StateObject object = new StateObject(Map.of("msisdn", "4670000000"), "Active", "evt-1");

        repository.commit(object);

        StateObject loaded = repository.findByEventId("evt-1").orElseThrow();
        assertEquals("Active", loaded.getState());
        assertEquals("4670000000", loaded.getData().get("msisdn"));
        assertEquals(1, repository.size());
    }

    @Test
    void testStoredCopyIsDetached() {
        StateObject object = new StateObject(new HashMap<>(Map.of("plan", "gold")), "Active", "evt-1");
        repository.commit(object);

        object.getData().put("plan", "silver");

        assertEquals("gold", repository.findByEventId("evt-1").orElseThrow().getData().get("plan"));
    }

    @Test
    void testCommitWithoutEventIdRejected() {
        StateObject object = new StateObject(Map.of(), "Pending");

        assertThrows(IllegalStateException.class, () -> repository.commit(object));
        assertEquals(0, repository.size());
    }

    @Test
    void testFindMissing() {
        assertTrue(repository.findByEventId("missing").isEmpty());
    }
}
