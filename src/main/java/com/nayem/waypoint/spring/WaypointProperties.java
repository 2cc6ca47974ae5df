package com.nayem.waypoint.spring;

import com.nayem.waypoint.core.HandlerConfig;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.convert.DurationUnit;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;
import java.time.temporal.ChronoUnit;

/**
 * Configuration properties for the Waypoint state machine.
 * <p>
 * These properties can be configured in {@code application.yml} under the
 * {@code waypoint} prefix.
 * </p>
 */
@ConfigurationProperties(prefix = "waypoint")
@Validated
public class WaypointProperties {

    /**
     * Default handlers included in chains registered at startup.
     */
    @Valid
    private Handlers handlers = new Handlers();

    /**
     * Diagnostic logging flags.
     */
    @Valid
    private Logging logging = new Logging();

    /**
     * Store backing the dedup check and mark.
     */
    @Valid
    private Idempotency idempotency = new Idempotency();

    /**
     * Store used to commit state objects.
     */
    @Valid
    private Persistence persistence = new Persistence();

    /**
     * Domain event transport.
     */
    @Valid
    private Events events = new Events();

    public Handlers getHandlers() {
        return handlers;
    }

    public void setHandlers(Handlers handlers) {
        this.handlers = handlers;
    }

    public Logging getLogging() {
        return logging;
    }

    public void setLogging(Logging logging) {
        this.logging = logging;
    }

    public Idempotency getIdempotency() {
        return idempotency;
    }

    public void setIdempotency(Idempotency idempotency) {
        this.idempotency = idempotency;
    }

    public Persistence getPersistence() {
        return persistence;
    }

    public void setPersistence(Persistence persistence) {
        this.persistence = persistence;
    }

    public Events getEvents() {
        return events;
    }

    public void setEvents(Events events) {
        this.events = events;
    }

    /**
     * Toggles for the default handlers, one per kind.
     */
    public static class Handlers {
        /**
         * Assign a derived event id when the object has none.
         */
        private boolean eventId = true;

        /**
         * Short-circuit events already marked processed.
         */
        private boolean checkProcessed = true;

        /**
         * Record a telemetry event per attempt.
         */
        private boolean telemetry = true;

        /**
         * Publish an alert per attempt.
         */
        private boolean alerting = true;

        /**
         * Mark the event processed at the end of the chain.
         */
        private boolean markProcessed = true;

        public HandlerConfig toHandlerConfig() {
            return new HandlerConfig(eventId, checkProcessed, telemetry, alerting, markProcessed);
        }

        public boolean isEventId() {
            return eventId;
        }

        public void setEventId(boolean eventId) {
            this.eventId = eventId;
        }

        public boolean isCheckProcessed() {
            return checkProcessed;
        }

        public void setCheckProcessed(boolean checkProcessed) {
            this.checkProcessed = checkProcessed;
        }

        public boolean isTelemetry() {
            return telemetry;
        }

        public void setTelemetry(boolean telemetry) {
            this.telemetry = telemetry;
        }

        public boolean isAlerting() {
            return alerting;
        }

        public void setAlerting(boolean alerting) {
            this.alerting = alerting;
        }

        public boolean isMarkProcessed() {
            return markProcessed;
        }

        public void setMarkProcessed(boolean markProcessed) {
            this.markProcessed = markProcessed;
        }
    }

    public static class Logging {
        /**
         * Log transition start, finish and handler errors.
         */
        private boolean transitions = false;

        /**
         * Append caller sites to transition logs.
         */
        private boolean debug = false;

        public boolean isTransitions() {
            return transitions;
        }

        public void setTransitions(boolean transitions) {
            this.transitions = transitions;
        }

        public boolean isDebug() {
            return debug;
        }

        public void setDebug(boolean debug) {
            this.debug = debug;
        }
    }

    public static class Idempotency {
        /**
         * Backend: 'memory' (development) or 'redis' (production).
         */
        private String store = "memory";

        /**
         * Prefix prepended to event ids in Redis.
         */
        @NotBlank
        private String keyPrefix = "waypoint:event:";

        /**
         * Retention of processed markers. Zero keeps them forever.
         */
        @NotNull
        @DurationUnit(ChronoUnit.HOURS)
        private Duration ttl = Duration.ZERO;

        public String getStore() {
            return store;
        }

        public void setStore(String store) {
            this.store = store;
        }

        public String getKeyPrefix() {
            return keyPrefix;
        }

        public void setKeyPrefix(String keyPrefix) {
            this.keyPrefix = keyPrefix;
        }

        public Duration getTtl() {
            return ttl;
        }

        public void setTtl(Duration ttl) {
            this.ttl = ttl;
        }
    }

    public static class Persistence {
        /**
         * Backend: 'memory' or 'redis'.
         */
        private String store = "memory";

        @NotBlank
        private String keyPrefix = "waypoint:state:";

        public String getStore() {
            return store;
        }

        public void setStore(String store) {
            this.store = store;
        }

        public String getKeyPrefix() {
            return keyPrefix;
        }

        public void setKeyPrefix(String keyPrefix) {
            this.keyPrefix = keyPrefix;
        }
    }

    public static class Events {
        /**
         * Active transport: 'none' or 'redis-stream'. Only one may be active.
         */
        private String transport = "none";

        @NotBlank
        private String streamKey = "waypoint:events";

        public String getTransport() {
            return transport;
        }

        public void setTransport(String transport) {
            this.transport = transport;
        }

        public String getStreamKey() {
            return streamKey;
        }

        public void setStreamKey(String streamKey) {
            this.streamKey = streamKey;
        }
    }
}
