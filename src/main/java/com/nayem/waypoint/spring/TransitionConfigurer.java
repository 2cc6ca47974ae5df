package com.nayem.waypoint.spring;

import com.nayem.waypoint.core.StateMachine;

/**
 * Beans implementing this interface register their transitions on the
 * application's {@link StateMachine} while the context starts, before any
 * transition runs.
 *
 * <h3>Usage Example</h3>
 *
 * <pre>
 * {@code
 * @Bean
 * TransitionConfigurer simLifecycle(BillingHandler billing) {
 *     return machine -> {
 *         machine.register("SIMNotActivated", "SIMActivated");
 *         machine.register("SIMActivated", "BillingPaid", billing);
 *     };
 * }
 * }
 * </pre>
 */
@FunctionalInterface
public interface TransitionConfigurer {

    void configure(StateMachine machine);
}
