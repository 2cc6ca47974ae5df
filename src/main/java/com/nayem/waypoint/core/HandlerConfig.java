package com.nayem.waypoint.core;

/**
 * Selects which default handlers take part when a chain is assembled.
 * <p>
 * Read at registration time only. Swapping the configuration on a
 * {@link StateMachine} never rebuilds chains that are already registered.
 * </p>
 *
 * @param eventId        include the identity-assignment handler
 * @param checkProcessed include the dedup-check handler
 * @param telemetry      include the telemetry handler
 * @param alerting       include the alerting handler
 * @param markProcessed  include the terminal dedup-mark handler
 */
public record HandlerConfig(
        boolean eventId,
        boolean checkProcessed,
        boolean telemetry,
        boolean alerting,
        boolean markProcessed) {

    public static HandlerConfig defaults() {
        return new HandlerConfig(true, true, true, true, true);
    }

    public static HandlerConfig none() {
        return new HandlerConfig(false, false, false, false, false);
    }

    /**
     * Identity assignment plus dedup check and mark, without the side channels.
     */
    public static HandlerConfig dedupOnly() {
        return new HandlerConfig(true, true, false, false, true);
    }
}
