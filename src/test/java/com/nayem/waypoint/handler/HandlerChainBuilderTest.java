package com.nayem.waypoint.handler;

import com.nayem.waypoint.core.HandlerConfig;
import com.nayem.waypoint.idempotency.InMemoryIdempotencyStore;
import com.nayem.waypoint.telemetry.TransitionMetrics;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class HandlerChainBuilderTest {

    private HandlerChainBuilder builder;
    private List<String> journal;

    @BeforeEach
    void setUp() {
        builder = new HandlerChainBuilder(new InMemoryIdempotencyStore(), TransitionMetrics.noOp(),
                alert -> {
                }, Clock.systemUTC());
        journal = new ArrayList<>();
    }

    @Test
    void testDefaultOrder() {
        List<Handler> chain = builder.assemble(HandlerConfig.defaults(), List.of());

        assertEquals(List.of(HandlerKind.EVENT_ID, HandlerKind.CHECK_PROCESSED, HandlerKind.TELEMETRY,
                HandlerKind.ALERTING, HandlerKind.MARK_PROCESSED), kinds(chain));
        assertInstanceOf(EventIdHandler.class, chain.get(0));
        assertInstanceOf(MarkProcessedHandler.class, chain.get(4));
    }

    @Test
    void testDisabledDefaultsAreLeftOut() {
        List<Handler> chain = builder.assemble(HandlerConfig.dedupOnly(), List.of());

        assertEquals(List.of(HandlerKind.EVENT_ID, HandlerKind.CHECK_PROCESSED, HandlerKind.MARK_PROCESSED),
                kinds(chain));
    }

    @Test
    void testTaggedCustomHandlerTakesTheDefaultSlot() {
        RecordingHandler telemetry = new RecordingHandler("my-telemetry", HandlerKind.TELEMETRY, journal);

        List<Handler> chain = builder.assemble(HandlerConfig.defaults(), List.of(telemetry));

        assertEquals(5, chain.size());
        assertSame(telemetry, chain.get(2));
        assertTrue(chain.stream().noneMatch(TelemetryHandler.class::isInstance));
    }

    @Test
    void testUntaggedHandlersAppendedBeforeMarkInCallerOrder() {
        RecordingHandler first = new RecordingHandler("first", journal);
        RecordingHandler second = new RecordingHandler("second", journal);
        RecordingHandler alerting = new RecordingHandler("my-alerting", HandlerKind.ALERTING, journal);

        List<Handler> chain = builder.assemble(HandlerConfig.defaults(), List.of(first, alerting, second));

        assertEquals(List.of(HandlerKind.EVENT_ID, HandlerKind.CHECK_PROCESSED, HandlerKind.TELEMETRY,
                HandlerKind.ALERTING, HandlerKind.CUSTOM, HandlerKind.CUSTOM, HandlerKind.MARK_PROCESSED),
                kinds(chain));
        assertSame(alerting, chain.get(3));
        assertSame(first, chain.get(4));
        assertSame(second, chain.get(5));
    }

    @Test
    void testCustomMarkHandlerIsLinkedLast() {
        RecordingHandler mark = new RecordingHandler("my-mark", HandlerKind.MARK_PROCESSED, journal);
        RecordingHandler extra = new RecordingHandler("extra", journal);

        List<Handler> chain = builder.assemble(HandlerConfig.defaults(), List.of(mark, extra));

        assertSame(mark, chain.get(chain.size() - 1));
        assertSame(extra, chain.get(chain.size() - 2));
        assertTrue(chain.stream().noneMatch(MarkProcessedHandler.class::isInstance));
    }

    @Test
    void testTaggedCustomHandlerPlacedEvenWhenDefaultDisabled() {
        RecordingHandler alerting = new RecordingHandler("my-alerting", HandlerKind.ALERTING, journal);

        List<Handler> chain = builder.assemble(HandlerConfig.dedupOnly(), List.of(alerting));

        assertEquals(List.of(HandlerKind.EVENT_ID, HandlerKind.CHECK_PROCESSED, HandlerKind.ALERTING,
                HandlerKind.MARK_PROCESSED), kinds(chain));
    }

    @Test
    void testBuildLinksEveryNodeAndTerminatesWithNull() {
        RecordingHandler custom = new RecordingHandler("custom", journal);

        Handler head = builder.build(HandlerConfig.defaults(), List.of(custom));

        int length = 0;
        Handler last = null;
        for (Handler h = head; h != null; h = h.next()) {
            length++;
            last = h;
        }
        assertEquals(6, length);
        assertInstanceOf(MarkProcessedHandler.class, last);
        assertSame(last, custom.next());
    }

    @Test
    void testTwoHandlersForSameSlotRejected() {
        RecordingHandler a = new RecordingHandler("a", HandlerKind.TELEMETRY, journal);
        RecordingHandler b = new RecordingHandler("b", HandlerKind.TELEMETRY, journal);

        assertThrows(IllegalArgumentException.class,
                () -> builder.assemble(HandlerConfig.defaults(), List.of(a, b)));
    }

    @Test
    void testSameInstanceTwiceRejected() {
        RecordingHandler a = new RecordingHandler("a", journal);

        assertThrows(IllegalArgumentException.class,
                () -> builder.assemble(HandlerConfig.defaults(), List.of(a, a)));
    }

    @Test
    void testEmptyChainRejected() {
        assertThrows(IllegalStateException.class, () -> builder.assemble(HandlerConfig.none(), List.of()));
    }

    @Test
    void testDefaultsAreFreshPerChain() {
        List<Handler> first = builder.assemble(HandlerConfig.defaults(), List.of());
        List<Handler> second = builder.assemble(HandlerConfig.defaults(), List.of());

        for (int i = 0; i < first.size(); i++) {
            assertNotSame(first.get(i), second.get(i));
        }
    }

    private static List<HandlerKind> kinds(List<Handler> chain) {
        return chain.stream().map(Handler::kind).toList();
    }
}
