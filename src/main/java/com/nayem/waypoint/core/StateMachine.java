package com.nayem.waypoint.core;

import com.nayem.waypoint.handler.Handler;
import com.nayem.waypoint.handler.HandlerChainBuilder;
import com.nayem.waypoint.handler.HandlerKind;
import com.nayem.waypoint.handler.HandlerResult;
import com.nayem.waypoint.idempotency.IdempotencyStore;
import com.nayem.waypoint.idempotency.InMemoryIdempotencyStore;
import com.nayem.waypoint.telemetry.AlertPublisher;
import com.nayem.waypoint.telemetry.LoggingAlertPublisher;
import com.nayem.waypoint.telemetry.TransitionAlert;
import com.nayem.waypoint.telemetry.TransitionMetrics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Registers transitions and executes them against {@link StateObject}s.
 * <p>
 * Register every transition during startup, then execute. An attempt walks the
 * chain for {@code (object.state, target)} in order. Handlers that succeed are
 * pushed onto a rollback stack. When a handler fails, the stack is unwound in
 * reverse order. Only the dedup check on a replay, or the last handler, may
 * end the walk with {@link HandlerResult#COMPLETE}; an earlier {@code COMPLETE}
 * continues to the successor so the terminal mark always runs. A clean
 * unwind raises {@link TransitionFailedException} and leaves the state alone;
 * a failed rollback forces
 * {@link States#MANUAL_REVIEW} and raises {@link RollbackFailedException}.
 * Only a complete walk moves the object to the target state.
 * </p>
 * <p>
 * Attempts are synchronous and run on the caller's thread. Nothing stops two
 * threads from transitioning the same object at once; callers own that.
 * </p>
 */
public class StateMachine {

    private static final Logger log = LoggerFactory.getLogger(StateMachine.class);

    private final TransitionRegistry registry;
    private final HandlerChainBuilder chainBuilder;
    private final TransitionMetrics metrics;
    private final AlertPublisher alerts;
    private final Clock clock;
    private final TransitionLogger transitionLogger;
    private volatile HandlerConfig handlerConfig;

    private StateMachine(Builder builder) {
        this.registry = new TransitionRegistry();
        this.handlerConfig = builder.handlerConfig;
        this.metrics = builder.metrics;
        this.alerts = builder.alerts;
        this.clock = builder.clock;
        this.transitionLogger = new TransitionLogger(builder.logTransitions, builder.debugLogging);
        this.chainBuilder = new HandlerChainBuilder(builder.idempotencyStore, metrics, alerts, clock);
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Builds the chain for {@code (from, to)} from the current
     * {@link HandlerConfig} and the given custom handlers, replacing any chain
     * registered for the same pair.
     *
     * @return the registered transition
     */
    public Transition register(String from, String to, Handler... customHandlers) {
        return register(from, to, List.of(customHandlers));
    }

    public Transition register(String from, String to, List<? extends Handler> customHandlers) {
        Objects.requireNonNull(from, "from");
        Objects.requireNonNull(to, "to");
        Transition transition = new Transition(from, to, chainBuilder.build(handlerConfig, customHandlers));
        registry.register(transition).ifPresent(previous ->
                log.warn("Transition {} re-registered, previous chain replaced", previous.key()));
        log.debug("Registered transition {} with {} handlers", transition.key(), transition.handlers().size());
        return transition;
    }

    /**
     * Moves {@code object} to {@code targetState}.
     *
     * @throws UnknownTransitionException no chain registered for the pair
     * @throws TransitionFailedException  a handler failed and was rolled back
     * @throws RollbackFailedException    a rollback failed; object is in
     *                                    manual review
     */
    public void transition(StateObject object, String targetState) {
        String fromState = object.getState();
        transitionLogger.info("Starting transition from {} to {}", fromState, targetState);

        Transition transition = registry.find(fromState, targetState)
                .orElseThrow(() -> new UnknownTransitionException(fromState, targetState, object.getEventId()));

        metrics.recordAttempt();
        metrics.recordStatusChange(null, TransitionStatus.PENDING);
        long start = System.nanoTime();
        try {
            metrics.recordStatusChange(TransitionStatus.PENDING, TransitionStatus.RUNNING);
            run(transition, object, targetState);
        } finally {
            metrics.recordStatusChange(TransitionStatus.RUNNING, null);
            metrics.recordDuration(System.nanoTime() - start);
        }
    }

    private void run(Transition transition, StateObject object, String targetState) {
        String fromState = transition.from();
        Deque<Handler> executed = new ArrayDeque<>();

        Handler handler = transition.chain();
        while (handler != null) {
            HandlerResult result;
            RuntimeException cause = null;
            try {
                result = handler.handle(object, targetState);
            } catch (RuntimeException e) {
                result = HandlerResult.FAILED;
                cause = e;
            }

            if (result == HandlerResult.CONTINUE && handler.next() == null) {
                log.warn("Handler {} asked to continue but has no successor", handler.name());
                result = HandlerResult.FAILED;
            }
            if (result == null || result == HandlerResult.FAILED) {
                unwind(executed, object, fromState, targetState, handler, cause);
                return;
            }

            executed.push(handler);
            if (result == HandlerResult.COMPLETE) {
                if (handler.kind() == HandlerKind.CHECK_PROCESSED) {
                    metrics.recordReplay();
                    break;
                }
                if (handler.next() == null) {
                    break;
                }
                // only a replay may skip the terminal mark
                log.debug("Handler {} completed early, continuing to {}", handler.name(), handler.next().name());
            }
            handler = handler.next();
        }

        object.setState(targetState);
        metrics.recordOutcome(TransitionStatus.SUCCEEDED);
        transitionLogger.record(new StateTransitionLog(object.getEventId(), fromState, targetState, clock.instant()));
        transitionLogger.info("Successfully concluded transition from {} to {}", fromState, targetState);
    }

    private void unwind(Deque<Handler> executed, StateObject object, String fromState, String targetState,
            Handler failed, RuntimeException cause) {
        transitionLogger.error(String.format("Handler %s failed for eventId %s%s", failed.name(),
                object.getEventId(), cause != null ? ": " + cause.getMessage() : ""));

        // push() puts the most recent handler first
        for (Handler done : executed) {
            boolean rolledBack;
            RuntimeException rollbackCause = null;
            try {
                rolledBack = done.rollback(object, targetState);
            } catch (RuntimeException e) {
                rolledBack = false;
                rollbackCause = e;
            }
            if (!rolledBack) {
                escalate(object, fromState, targetState, failed, done, rollbackCause != null ? rollbackCause : cause);
            }
        }

        metrics.recordOutcome(TransitionStatus.ROLLED_BACK);
        throw new TransitionFailedException(fromState, targetState, object.getEventId(), failed.name(), cause);
    }

    private void escalate(StateObject object, String fromState, String targetState, Handler failed,
            Handler rollback, RuntimeException cause) {
        transitionLogger.error(String.format("Handler %s failed to rollback for eventId %s", rollback.name(),
                object.getEventId()));
        object.setState(States.MANUAL_REVIEW);
        metrics.recordOutcome(TransitionStatus.UNRECOVERABLE);

        RollbackFailedException error = new RollbackFailedException(fromState, targetState, object.getEventId(),
                failed.name(), rollback.name(), cause);
        try {
            alerts.publish(TransitionAlert.critical(object.getEventId(), fromState, targetState, error.getMessage(),
                    clock.instant()));
        } catch (RuntimeException e) {
            log.error("Could not publish manual review alert for eventId {}", object.getEventId(), e);
        }
        log.error("Object with eventId {} moved to {}: {}", object.getEventId(), States.MANUAL_REVIEW,
                error.getMessage());
        throw error;
    }

    public boolean isRegistered(String from, String to) {
        return registry.contains(from, to);
    }

    public Optional<Transition> getTransition(String from, String to) {
        return registry.find(from, to);
    }

    public TransitionRegistry getRegistry() {
        return registry;
    }

    public HandlerConfig getHandlerConfig() {
        return handlerConfig;
    }

    /**
     * Applies to transitions registered from now on. Existing chains keep the
     * handlers they were built with.
     */
    public void setHandlerConfig(HandlerConfig handlerConfig) {
        this.handlerConfig = Objects.requireNonNull(handlerConfig, "handlerConfig");
    }

    public boolean isLogTransitions() {
        return transitionLogger.isLogTransitions();
    }

    public boolean isDebugLogging() {
        return transitionLogger.isDebugLogging();
    }

    /**
     * Builder for creating a {@link StateMachine} instance.
     */
    public static class Builder {
        private HandlerConfig handlerConfig = HandlerConfig.defaults();
        private IdempotencyStore idempotencyStore;
        private TransitionMetrics metrics = TransitionMetrics.noOp();
        private AlertPublisher alerts = new LoggingAlertPublisher();
        private Clock clock = Clock.systemUTC();
        private boolean logTransitions;
        private boolean debugLogging;

        /**
         * Sets which default handlers new chains include. Default: all.
         *
         * @param handlerConfig the handler toggles
         * @return this builder
         */
        public Builder handlerConfig(HandlerConfig handlerConfig) {
            this.handlerConfig = handlerConfig;
            return this;
        }

        /**
         * Sets the store used by the dedup check and mark. Default: in-memory.
         *
         * @param idempotencyStore the store
         * @return this builder
         */
        public Builder idempotencyStore(IdempotencyStore idempotencyStore) {
            this.idempotencyStore = idempotencyStore;
            return this;
        }

        /**
         * @param metrics metrics sink for outcomes and telemetry
         * @return this builder
         */
        public Builder metrics(TransitionMetrics metrics) {
            this.metrics = metrics;
            return this;
        }

        /**
         * @param alerts sink for alerting-handler notices and manual review
         *               escalations
         * @return this builder
         */
        public Builder alertPublisher(AlertPublisher alerts) {
            this.alerts = alerts;
            return this;
        }

        /**
         * Sets the clock driving event id derivation and log timestamps.
         *
         * @param clock the clock
         * @return this builder
         */
        public Builder clock(Clock clock) {
            this.clock = clock;
            return this;
        }

        /**
         * @param logTransitions log start, finish and handler errors
         * @return this builder
         */
        public Builder logTransitions(boolean logTransitions) {
            this.logTransitions = logTransitions;
            return this;
        }

        /**
         * @param debugLogging append caller sites to transition logs
         * @return this builder
         */
        public Builder debugLogging(boolean debugLogging) {
            this.debugLogging = debugLogging;
            return this;
        }

        public StateMachine build() {
            if (handlerConfig == null) {
                throw new IllegalStateException("handlerConfig is required");
            }
            if (metrics == null || alerts == null || clock == null) {
                throw new IllegalStateException("metrics, alertPublisher and clock must not be null");
            }
            if (idempotencyStore == null) {
                idempotencyStore = new InMemoryIdempotencyStore(clock, Duration.ZERO);
            }
            return new StateMachine(this);
        }
    }
}
