package com.nayem.waypoint.telemetry;

import com.nayem.waypoint.core.TransitionStatus;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Micrometer metrics for transition attempts.
 */
public class TransitionMetrics {

    private static final List<TransitionStatus> TERMINAL = List.of(
            TransitionStatus.SUCCEEDED, TransitionStatus.ROLLED_BACK, TransitionStatus.UNRECOVERABLE);
    private static final List<TransitionStatus> IN_FLIGHT = List.of(
            TransitionStatus.PENDING, TransitionStatus.RUNNING);

    private final MeterRegistry registry;
    private final Map<TransitionStatus, Counter> outcomeCounters;
    private final Map<TransitionStatus, AtomicLong> activeByStatus;
    private final Counter attemptCounter;
    private final Counter replayCounter;
    private final Timer transitionTimer;

    public TransitionMetrics(MeterRegistry registry) {
        this.registry = registry;
        this.outcomeCounters = new EnumMap<>(TransitionStatus.class);
        this.activeByStatus = new EnumMap<>(TransitionStatus.class);

        if (registry != null) {
            for (TransitionStatus status : IN_FLIGHT) {
                AtomicLong count = new AtomicLong(0);
                activeByStatus.put(status, count);

                Gauge.builder("waypoint.transition.active", count, AtomicLong::get)
                        .description("Transition attempts in flight by status")
                        .tag("status", status.name().toLowerCase())
                        .register(registry);
            }

            for (TransitionStatus status : TERMINAL) {
                outcomeCounters.put(status, Counter.builder("waypoint.transition.outcome")
                        .description("Transition attempts by outcome")
                        .tag("status", status.name().toLowerCase())
                        .register(registry));
            }

            this.attemptCounter = Counter.builder("waypoint.transition.attempts")
                    .description("Transition attempts on registered pairs")
                    .register(registry);

            this.replayCounter = Counter.builder("waypoint.transition.replayed")
                    .description("Attempts short-circuited because the event was already processed")
                    .register(registry);

            this.transitionTimer = Timer.builder("waypoint.transition.duration")
                    .description("Time spent walking a transition chain")
                    .register(registry);
        } else {
            this.attemptCounter = null;
            this.replayCounter = null;
            this.transitionTimer = null;
        }
    }

    /**
     * Moves one attempt between in-flight statuses; null means outside the
     * tracked set. Terminal statuses go through {@link #recordOutcome}.
     */
    public void recordStatusChange(TransitionStatus oldStatus, TransitionStatus newStatus) {
        if (oldStatus != null && activeByStatus.containsKey(oldStatus)) {
            activeByStatus.get(oldStatus).decrementAndGet();
        }
        if (newStatus != null && activeByStatus.containsKey(newStatus)) {
            activeByStatus.get(newStatus).incrementAndGet();
        }
    }

    public void recordOutcome(TransitionStatus status) {
        Counter counter = outcomeCounters.get(status);
        if (counter != null) {
            counter.increment();
        }
    }

    public void recordAttempt() {
        if (attemptCounter != null) {
            attemptCounter.increment();
        }
    }

    public void recordReplay() {
        if (replayCounter != null) {
            replayCounter.increment();
        }
    }

    public void recordDuration(long durationNanos) {
        if (transitionTimer != null) {
            transitionTimer.record(durationNanos, TimeUnit.NANOSECONDS);
        }
    }

    /**
     * Telemetry event fired by the telemetry handler, tagged with the pair.
     */
    public void recordTelemetry(String fromState, String toState) {
        if (registry != null) {
            registry.counter("waypoint.transition.telemetry", "from", fromState, "to", toState).increment();
        }
    }

    public static TransitionMetrics noOp() {
        return new TransitionMetrics(null);
    }
}
