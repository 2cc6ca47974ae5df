package com.nayem.waypoint.core;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Optional;
import java.util.Set;

/**
 * Transition logging controlled by the two diagnostic flags.
 * <p>
 * {@code logTransitions} turns on start/finish/error lines. {@code debugLogging}
 * appends the caller site (the first frame outside the engine) to error lines
 * and to the per-object transition record.
 * </p>
 */
class TransitionLogger {

    private static final Logger log = LoggerFactory.getLogger(TransitionLogger.class);
    private static final Set<String> ENGINE_CLASSES = Set.of(
            TransitionLogger.class.getName(),
            StateMachine.class.getName(),
            StateObject.class.getName());

    private final boolean logTransitions;
    private final boolean debugLogging;

    TransitionLogger(boolean logTransitions, boolean debugLogging) {
        this.logTransitions = logTransitions;
        this.debugLogging = debugLogging;
    }

    boolean isLogTransitions() {
        return logTransitions;
    }

    boolean isDebugLogging() {
        return debugLogging;
    }

    void info(String format, Object... args) {
        if (logTransitions) {
            log.info(format, args);
        }
    }

    void error(String message) {
        if (!logTransitions) {
            return;
        }
        if (debugLogging) {
            log.error("{} [at {}]", message, callerSite().orElse("unknown"));
        } else {
            log.error(message);
        }
    }

    void record(StateTransitionLog entry) {
        if (!log.isDebugEnabled()) {
            return;
        }
        if (debugLogging) {
            log.debug("log_transition {timestamp: {}, event_id: {}, from_state: {}, to_state: {}, caller: {}}",
                    entry.timestamp(), entry.eventId(), entry.fromState(), entry.toState(),
                    callerSite().orElse("unknown"));
        } else {
            log.debug("log_transition {timestamp: {}, event_id: {}, from_state: {}, to_state: {}}",
                    entry.timestamp(), entry.eventId(), entry.fromState(), entry.toState());
        }
    }

    static Optional<String> callerSite() {
        return StackWalker.getInstance().walk(frames -> frames
                .filter(frame -> !ENGINE_CLASSES.contains(frame.getClassName()))
                .findFirst()
                .map(frame -> frame.getClassName() + "." + frame.getMethodName()
                        + "(" + frame.getFileName() + ":" + frame.getLineNumber() + ")"));
    }
}
