package com.nayem.waypoint.handler;

import com.nayem.waypoint.core.HandlerConfig;
import com.nayem.waypoint.idempotency.IdempotencyStore;
import com.nayem.waypoint.telemetry.AlertPublisher;
import com.nayem.waypoint.telemetry.TransitionMetrics;

import java.time.Clock;
import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Assembles the chain for one transition.
 * <p>
 * Order: identity assignment, dedup check, telemetry, alerting, appended
 * custom handlers (caller order), dedup mark. Default handlers are included
 * only when enabled in the {@link HandlerConfig}. A custom handler tagged with
 * a default kind takes that kind's slot, replacing the default entirely, and
 * is placed even when the default itself is disabled.
 * </p>
 * <p>
 * Fresh default handler instances are created for every chain.
 * </p>
 */
public class HandlerChainBuilder {

    private final IdempotencyStore store;
    private final TransitionMetrics metrics;
    private final AlertPublisher alerts;
    private final EventIdGenerator eventIds;
    private final Clock clock;

    public HandlerChainBuilder(IdempotencyStore store, TransitionMetrics metrics, AlertPublisher alerts,
            Clock clock) {
        this.store = store;
        this.metrics = metrics;
        this.alerts = alerts;
        this.clock = clock;
        this.eventIds = new EventIdGenerator(clock);
    }

    /**
     * Builds and links the chain, returning its head.
     *
     * @throws IllegalStateException    if the resulting chain is empty
     * @throws IllegalArgumentException if two custom handlers claim the same
     *                                  default slot or one instance is given
     *                                  twice
     */
    public Handler build(HandlerConfig config, List<? extends Handler> customHandlers) {
        return HandlerChains.link(assemble(config, customHandlers));
    }

    /**
     * Computes the ordered handler sequence without linking it.
     */
    public List<Handler> assemble(HandlerConfig config, List<? extends Handler> customHandlers) {
        Map<HandlerKind, Handler> substitutes = new EnumMap<>(HandlerKind.class);
        List<Handler> appended = new ArrayList<>();
        Set<Handler> seen = Collections.newSetFromMap(new IdentityHashMap<>());

        for (Handler handler : customHandlers) {
            if (!seen.add(handler)) {
                throw new IllegalArgumentException("Handler " + handler.name() + " supplied more than once");
            }
            HandlerKind kind = handler.kind();
            if (kind == null || !kind.isDefaultSlot()) {
                appended.add(handler);
            } else if (substitutes.putIfAbsent(kind, handler) != null) {
                throw new IllegalArgumentException("More than one custom handler supplied for slot " + kind);
            }
        }

        List<Handler> sequence = new ArrayList<>();
        for (HandlerKind slot : HandlerKind.LEADING_SLOTS) {
            Handler substitute = substitutes.get(slot);
            if (substitute != null) {
                sequence.add(substitute);
            } else if (isEnabled(config, slot)) {
                sequence.add(createDefault(slot));
            }
        }
        sequence.addAll(appended);

        Handler terminal = substitutes.get(HandlerKind.MARK_PROCESSED);
        if (terminal != null) {
            sequence.add(terminal);
        } else if (config.markProcessed()) {
            sequence.add(createDefault(HandlerKind.MARK_PROCESSED));
        }

        if (sequence.isEmpty()) {
            throw new IllegalStateException("A transition chain must contain at least one handler");
        }
        return sequence;
    }

    static boolean isEnabled(HandlerConfig config, HandlerKind kind) {
        return switch (kind) {
            case EVENT_ID -> config.eventId();
            case CHECK_PROCESSED -> config.checkProcessed();
            case TELEMETRY -> config.telemetry();
            case ALERTING -> config.alerting();
            case MARK_PROCESSED -> config.markProcessed();
            case CUSTOM -> false;
        };
    }

    private Handler createDefault(HandlerKind kind) {
        return switch (kind) {
            case EVENT_ID -> new EventIdHandler(eventIds);
            case CHECK_PROCESSED -> new CheckProcessedHandler(store);
            case TELEMETRY -> new TelemetryHandler(metrics);
            case ALERTING -> new AlertingHandler(alerts, clock);
            case MARK_PROCESSED -> new MarkProcessedHandler(store);
            case CUSTOM -> throw new IllegalArgumentException("No default handler for " + kind);
        };
    }
}
