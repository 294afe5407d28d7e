package com.sift.analytics;

/**
 * Saturating arithmetic for non-negative counters.
 * <p>
 * Analytics counters must never wrap or throw: a counter that reaches {@link Long#MAX_VALUE}
 * stays there, and a difference that would go below zero is clamped to zero.
 */
public final class Saturating {

    private Saturating() {
        // utility class
    }

    /**
     * Adds two counters, clamping at {@link Long#MAX_VALUE}.
     */
    public static long add(long a, long b) {
        long result = a + b;
        // overflow iff both operands have the same sign and the result's sign differs
        if (((a ^ result) & (b ^ result)) < 0) {
            return a < 0 ? Long.MIN_VALUE : Long.MAX_VALUE;
        }
        return result;
    }

    /**
     * Subtracts {@code b} from {@code a}, clamping at zero.
     */
    public static long sub(long a, long b) {
        return a <= b ? 0 : a - b;
    }

    /**
     * Multiplies two non-negative values, clamping at {@link Long#MAX_VALUE}.
     */
    public static long mul(long a, long b) {
        if (a <= 0 || b <= 0) {
            return 0;
        }
        if (a > Long.MAX_VALUE / b) {
            return Long.MAX_VALUE;
        }
        return a * b;
    }
}
