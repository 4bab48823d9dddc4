package com.lodestar.succession.lifecycle;

import java.util.function.Function;

/**
 * Side effect of a transition, split in two phases. {@link #prepare} does everything that can
 * fail and returns the write to perform; the returned {@link PreparedEffect} only touches the
 * working copy of the cycle and the context outbox, and is applied once every effect of the
 * edge prepared successfully.
 */
public interface TransitionEffect {

    String name();

    PreparedEffect prepare(TransitionContext context);

    @FunctionalInterface
    interface PreparedEffect {
        void apply();
    }

    static TransitionEffect of(String name, Function<TransitionContext, PreparedEffect> prepare) {
        return new TransitionEffect() {
            @Override
            public String name() {
                return name;
            }

            @Override
            public PreparedEffect prepare(TransitionContext context) {
                return prepare.apply(context);
            }
        };
    }
}
