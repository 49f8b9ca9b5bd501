package net.spotter.core.service;

import java.time.Duration;

final class ExponentialRetryPolicy implements RetryPolicy {
    private final Duration base;
    private final Duration max;

    ExponentialRetryPolicy(Duration base, Duration max) {
        this.base = base;
        this.max = max == null || max.compareTo(base) < 0 ? base : max;
    }

    @Override
    public Duration nextBackoff(long attempt) {
        long shift = Math.max(0, Math.min(attempt - 1, 20));
        Duration d = base.multipliedBy(1L << shift);
        return d.compareTo(max) > 0 ? max : d;
    }
}
