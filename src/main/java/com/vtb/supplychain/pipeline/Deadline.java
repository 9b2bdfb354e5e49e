package com.vtb.supplychain.pipeline;

import java.time.Duration;

/**
 * Глобальный дедлайн прогона. Отсчитывается по монотонным часам и не продлевается.
 */
final class Deadline {

    private final long startNanos;
    private final long budgetNanos;

    private Deadline(long startNanos, long budgetNanos) {
        this.startNanos = startNanos;
        this.budgetNanos = budgetNanos;
    }

    static Deadline after(Duration budget) {
        long nanos = budget.isNegative() ? 0L : saturatedNanos(budget);
        return new Deadline(System.nanoTime(), nanos);
    }

    Duration remaining() {
        long left = budgetNanos - (System.nanoTime() - startNanos);
        return left > 0 ? Duration.ofNanos(left) : Duration.ZERO;
    }

    boolean isExpired() {
        return remaining().isZero();
    }

    long elapsedMs() {
        return Duration.ofNanos(System.nanoTime() - startNanos).toMillis();
    }

    /**
     * Меньшее из таймаута этапа и остатка бюджета.
     */
    Duration cap(Duration timeout) {
        Duration left = remaining();
        return timeout.compareTo(left) < 0 ? timeout : left;
    }

    private static long saturatedNanos(Duration duration) {
        try {
            return duration.toNanos();
        } catch (ArithmeticException e) {
            return Long.MAX_VALUE;
        }
    }
}
