package com.lodestar.succession.lifecycle;

import java.util.function.Function;

/**
 * Named precondition of a transition edge. Overridable guards may be bypassed by an admin
 * force-transition with a reason; the others never.
 */
public interface TransitionGuard {

    String name();

    boolean overridable();

    GuardResult check(TransitionContext context);

    static TransitionGuard of(String name, boolean overridable, Function<TransitionContext, GuardResult> check) {
        return new TransitionGuard() {
            @Override
            public String name() {
                return name;
            }

            @Override
            public boolean overridable() {
                return overridable;
            }

            @Override
            public GuardResult check(TransitionContext context) {
                return check.apply(context);
            }
        };
    }
}
