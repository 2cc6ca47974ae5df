package com.nayem.waypoint.handler;

import com.nayem.waypoint.core.StateObject;
import org.junit.jupiter.api.Test;

import java.util.HashMap;
import java.util.concurrent.atomic.AtomicReference;

import static org.junit.jupiter.api.Assertions.*;

class FunctionalHandlerTest {

    @Test
    void testBuilderDefaults() {
        FunctionalHandler handler = FunctionalHandler.builder()
                .handle((object, target) -> true)
                .build();

        assertEquals(HandlerKind.CUSTOM, handler.kind());
        assertEquals("custom-custom", handler.name());
        assertTrue(handler.rollback(new StateObject(new HashMap<>(), "Pending"), "Active"));
    }

    @Test
    void testHandleDelegatesToLambda() {
        AtomicReference<String> seenTarget = new AtomicReference<>();
        FunctionalHandler handler = FunctionalHandler.builder()
                .name("capture")
                .handle((object, target) -> {
                    seenTarget.set(target);
                    object.getData().put("touched", true);
                    return true;
                })
                .build();
        handler.setNext(FunctionalHandler.builder().handle((o, t) -> true).build());
        StateObject object = new StateObject(new HashMap<>(), "Pending");

        assertEquals(HandlerResult.CONTINUE, handler.handle(object, "Active"));
        assertEquals("Active", seenTarget.get());
        assertEquals(true, object.getData().get("touched"));
    }

    @Test
    void testFalseResultFails() {
        FunctionalHandler handler = FunctionalHandler.builder()
                .handle((object, target) -> false)
                .build();

        assertEquals(HandlerResult.FAILED, handler.handle(new StateObject(new HashMap<>(), "Pending"), "Active"));
    }

    @Test
    void testTerminalKindCompletesWithoutSuccessor() {
        FunctionalHandler handler = FunctionalHandler.builder()
                .kind(HandlerKind.MARK_PROCESSED)
                .handle((object, target) -> true)
                .build();

        assertEquals(HandlerResult.COMPLETE, handler.handle(new StateObject(new HashMap<>(), "Pending"), "Active"));
    }

    @Test
    void testBuilderFailsWithoutRequiredFields() {
        assertThrows(IllegalStateException.class, () -> FunctionalHandler.builder().build());

        assertThrows(IllegalStateException.class, () -> FunctionalHandler.builder()
                .kind(null)
                .handle((o, t) -> true)
                .build());

        assertThrows(IllegalStateException.class, () -> FunctionalHandler.builder()
                .handle((o, t) -> true)
                .rollback(null)
                .build());
    }
}
