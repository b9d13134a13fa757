package com.bank.aml.service;

import java.time.Duration;

/**
 * Caller-supplied time limit for one pipeline run, measured on the monotonic clock.
 */
public final class Deadline {

    private static final Deadline NONE = new Deadline(null, Long.MAX_VALUE);

    private final Duration budget;
    private final long expiresAtNanos;

    private Deadline(Duration budget, long expiresAtNanos) {
        this.budget = budget;
        this.expiresAtNanos = expiresAtNanos;
    }

    public static Deadline after(Duration budget) {
        if (budget == null || budget.isNegative()) {
            throw new IllegalArgumentException("Deadline budget must be zero or positive");
        }
        return new Deadline(budget, System.nanoTime() + budgetNanos(budget));
    }

    // Saturates budgets past the nanosecond range (about 292 years).
    private static long budgetNanos(Duration budget) {
        try {
            return budget.toNanos();
        } catch (ArithmeticException e) {
            return Long.MAX_VALUE;
        }
    }

    /**
     * A deadline that never expires.
     */
    public static Deadline none() {
        return NONE;
    }

    public boolean isBounded() {
        return budget != null;
    }

    public boolean isExpired() {
        return isBounded() && System.nanoTime() - expiresAtNanos >= 0;
    }

    /**
     * Time left before expiry, never negative. Unbounded deadlines report the maximum duration.
     */
    public Duration remaining() {
        if (!isBounded()) {
            return Duration.ofNanos(Long.MAX_VALUE);
        }
        long left = expiresAtNanos - System.nanoTime();
        return left > 0 ? Duration.ofNanos(left) : Duration.ZERO;
    }

    public Duration getBudget() {
        return budget;
    }
}
