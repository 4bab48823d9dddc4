package com.lodestar.succession.lifecycle;

/**
 * Outcome of one guard evaluation.
 */
public record GuardResult(boolean passed, String detail) {

    private static final GuardResult PASS = new GuardResult(true, null);

    public static GuardResult pass() {
        return PASS;
    }

    public static GuardResult fail(String detail) {
        return new GuardResult(false, detail);
    }
}
