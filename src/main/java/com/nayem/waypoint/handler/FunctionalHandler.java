package com.nayem.waypoint.handler;

import com.nayem.waypoint.core.StateObject;

import java.util.function.BiPredicate;

/**
 * Custom handler defined with lambdas instead of a dedicated class.
 *
 * <h3>Example Usage:</h3>
 *
 * <pre>{@code
 * Handler reserveStock = FunctionalHandler.builder()
 *         .name("reserve-stock")
 *         .handle((order, target) -> inventory.reserve(order.getData()))
 *         .rollback((order, target) -> inventory.release(order.getData()))
 *         .build();
 *
 * machine.register("Pending", "Active", reserveStock);
 * }</pre>
 * <p>
 * Tag it with a default kind ({@code .kind(HandlerKind.TELEMETRY)}) to replace
 * that default handler instead of being appended.
 * </p>
 */
public class FunctionalHandler extends AbstractHandler {

    private final HandlerKind kind;
    private final String name;
    private final BiPredicate<StateObject, String> handler;
    private final BiPredicate<StateObject, String> rollback;

    private FunctionalHandler(Builder builder) {
        this.kind = builder.kind;
        this.name = builder.name;
        this.handler = builder.handler;
        this.rollback = builder.rollback;
    }

    public static Builder builder() {
        return new Builder();
    }

    @Override
    public HandlerKind kind() {
        return kind;
    }

    @Override
    public String name() {
        return name;
    }

    @Override
    public HandlerResult handle(StateObject object, String targetState) {
        if (!handler.test(object, targetState)) {
            return HandlerResult.FAILED;
        }
        return proceed();
    }

    @Override
    public boolean rollback(StateObject object, String targetState) {
        return rollback.test(object, targetState);
    }

    @Override
    public String toString() {
        return "FunctionalHandler{" + name + ", " + kind + '}';
    }

    public static class Builder {
        private HandlerKind kind = HandlerKind.CUSTOM;
        private String name;
        private BiPredicate<StateObject, String> handler;
        private BiPredicate<StateObject, String> rollback = (object, target) -> true;

        /**
         * Default slot to replace. Default: {@link HandlerKind#CUSTOM}
         * (appended).
         */
        public Builder kind(HandlerKind kind) {
            this.kind = kind;
            return this;
        }

        public Builder name(String name) {
            this.name = name;
            return this;
        }

        /**
         * Forward step; return false to fail the transition.
         */
        public Builder handle(BiPredicate<StateObject, String> handler) {
            this.handler = handler;
            return this;
        }

        /**
         * Undo step; return false when it cannot be undone. Default: no-op
         * success.
         */
        public Builder rollback(BiPredicate<StateObject, String> rollback) {
            this.rollback = rollback;
            return this;
        }

        /**
         * @throws IllegalStateException if kind or handle function is missing
         */
        public FunctionalHandler build() {
            if (kind == null) {
                throw new IllegalStateException("kind is required");
            }
            if (handler == null) {
                throw new IllegalStateException("handle function is required");
            }
            if (rollback == null) {
                throw new IllegalStateException("rollback function must not be null");
            }
            if (name == null || name.isBlank()) {
                name = "custom-" + kind.name().toLowerCase();
            }
            return new FunctionalHandler(this);
        }
    }
}
