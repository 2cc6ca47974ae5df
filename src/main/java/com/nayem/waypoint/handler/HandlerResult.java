package com.nayem.waypoint.handler;

/**
 * Outcome of a single {@link Handler#handle} call.
 */
public enum HandlerResult {

    /**
     * Step succeeded; run the successor.
     */
    CONTINUE,

    /**
     * Step succeeded and ends the pipeline successfully. Honoured from the
     * last handler and from the dedup check on a replayed event; anywhere
     * else the walk carries on as for {@link #CONTINUE}.
     */
    COMPLETE,

    /**
     * Step failed; roll back what ran before it.
     */
    FAILED
}
