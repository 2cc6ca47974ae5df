package com.nayem.waypoint.handler;

import com.nayem.waypoint.core.StateObject;
import com.nayem.waypoint.telemetry.TransitionMetrics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Records a telemetry event for the attempt. Never fails the chain on its own.
 */
public class TelemetryHandler extends AbstractHandler {

    private static final Logger log = LoggerFactory.getLogger(TelemetryHandler.class);

    private final TransitionMetrics metrics;

    public TelemetryHandler(TransitionMetrics metrics) {
        this.metrics = metrics;
    }

    @Override
    public HandlerKind kind() {
        return HandlerKind.TELEMETRY;
    }

    @Override
    public HandlerResult handle(StateObject object, String targetState) {
        try {
            metrics.recordTelemetry(object.getState(), targetState);
        } catch (RuntimeException e) {
            log.warn("Telemetry for {} -> {} failed: {}", object.getState(), targetState, e.getMessage());
        }
        return proceed();
    }
}
