package com.yerin.bgworker.infra;

import com.yerin.bgworker.config.ConfigResolver;
import com.yerin.bgworker.config.RetryConfig;
import com.yerin.bgworker.domain.BackoffStrategy;

import java.time.Duration;
import java.util.Optional;
import java.util.concurrent.ThreadLocalRandom;

/**
 * Retry delay policy shared by every backend. No I/O, so it is tested on its own.
 */
public final class Backoff {
    private Backoff() {}

    // 1L << 63 은 음수
    private static final int MAX_SHIFT = 62;

    /**
     * Delay before the next attempt of a job that has been tried {@code attempt} times, or empty
     * when it should not be retried.
     */
    public static Optional<Duration> retryDelay(RetryConfig global, RetryConfig worker, int attempt) {
        int maxRetries = ConfigResolver.resolve(global, worker, RetryConfig::getMaxRetries).orElse(0);
        if (attempt > maxRetries) return Optional.empty();

        Optional<Duration> delay = ConfigResolver.resolve(global, worker, RetryConfig::getDelay);
        if (delay.isEmpty()) return Optional.empty();

        BackoffStrategy strategy = ConfigResolver.resolve(global, worker, RetryConfig::getBackoffStrategy)
                .orElse(BackoffStrategy.NONE);
        Optional<Duration> maxDelay = ConfigResolver.resolve(global, worker, RetryConfig::getMaxDelay);
        Duration offset = ConfigResolver.resolve(global, worker, RetryConfig::getDelayOffset).orElse(Duration.ZERO);

        Duration base = cap(baseDelay(delay.get(), strategy, Math.max(1, attempt)), maxDelay);
        Duration withJitter = base.plus(jitter(offset));
        return Optional.of(cap(withJitter, maxDelay));
    }

    static Duration baseDelay(Duration delay, BackoffStrategy strategy, int attempt) {
        long millis = delay.toMillis();
        switch (strategy) {
            case EXPONENTIAL: {
                int shift = Math.min(attempt - 1, MAX_SHIFT);
                return Duration.ofMillis(saturatedMultiply(millis, 1L << shift));
            }
            case LINEAR:
                return Duration.ofMillis(saturatedMultiply(millis, attempt));
            case NONE:
            default:
                return delay;
        }
    }

    private static Duration jitter(Duration offset) {
        long bound = offset.toMillis();
        if (bound <= 0) return Duration.ZERO;
        return Duration.ofMillis(ThreadLocalRandom.current().nextLong(bound + 1));
    }

    private static Duration cap(Duration value, Optional<Duration> maxDelay) {
        return maxDelay.filter(max -> max.compareTo(value) < 0).orElse(value);
    }

    private static long saturatedMultiply(long a, long b) {
        try {
            return Math.multiplyExact(a, b);
        } catch (ArithmeticException overflow) {
            return Long.MAX_VALUE;
        }
    }
}
