package com.nayem.waypoint.handler;

import com.nayem.waypoint.core.StateObject;
import com.nayem.waypoint.telemetry.AlertPublisher;
import com.nayem.waypoint.telemetry.TransitionAlert;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;

/**
 * Publishes a notice for the attempt. Publisher failures are isolated from the
 * chain.
 */
public class AlertingHandler extends AbstractHandler {

    private static final Logger log = LoggerFactory.getLogger(AlertingHandler.class);

    private final AlertPublisher publisher;
    private final Clock clock;

    public AlertingHandler(AlertPublisher publisher, Clock clock) {
        this.publisher = publisher;
        this.clock = clock;
    }

    @Override
    public HandlerKind kind() {
        return HandlerKind.ALERTING;
    }

    @Override
    public HandlerResult handle(StateObject object, String targetState) {
        try {
            publisher.publish(TransitionAlert.info(object.getEventId(), object.getState(), targetState,
                    "Transition in progress", clock.instant()));
        } catch (RuntimeException e) {
            log.warn("Alert for {} -> {} could not be published: {}", object.getState(), targetState,
                    e.getMessage());
        }
        return proceed();
    }
}
