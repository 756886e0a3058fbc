package com.demo.lending.monitor;

import com.demo.lending.exception.LedgerUnavailableException;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.util.List;
import java.util.function.Supplier;

/**
 * Bounded retry for ledger reads. Only {@link LedgerUnavailableException} is retried; any
 * other failure belongs to the loan being read and is returned to the caller at once.
 */
@Slf4j
public final class RetryPolicy {

    private final int maxAttempts;
    private final List<Duration> delays;
    private final Sleeper sleeper;

    public RetryPolicy(int maxAttempts, List<Duration> delays, Sleeper sleeper) {
        if (maxAttempts < 1) {
            throw new IllegalArgumentException("maxAttempts must be at least 1");
        }
        this.maxAttempts = maxAttempts;
        this.delays = delays.isEmpty() ? List.of(Duration.ZERO) : List.copyOf(delays);
        this.sleeper = sleeper;
    }

    public static RetryPolicy fixed(int maxAttempts, Duration delay, Sleeper sleeper) {
        return new RetryPolicy(maxAttempts, List.of(delay), sleeper);
    }

    public static RetryPolicy none() {
        return new RetryPolicy(1, List.of(Duration.ZERO), d -> { });
    }

    public <T> T call(String operation, Supplier<T> action) {
        LedgerUnavailableException last = null;
        for (int attempt = 1; attempt <= maxAttempts; attempt++) {
            try {
                return action.get();
            } catch (LedgerUnavailableException ex) {
                last = ex;
                if (attempt == maxAttempts) break;
                Duration wait = delayBefore(attempt);
                log.debug("{} failed (attempt {}/{}), retrying in {}ms", operation, attempt, maxAttempts, wait.toMillis());
                pause(operation, wait);
            }
        }
        throw last;
    }

    /** Delay after the given failed attempt (1-based); the schedule's last entry repeats. */
    public Duration delayBefore(int failedAttempt) {
        return delays.get(Math.min(failedAttempt - 1, delays.size() - 1));
    }

    public int maxAttempts() {
        return maxAttempts;
    }

    void pause(String operation, Duration wait) {
        try {
            sleeper.sleep(wait);
        } catch (InterruptedException ie) {
            Thread.currentThread().interrupt();
            throw new LedgerUnavailableException(operation, "interrupted while backing off");
        }
    }

    @FunctionalInterface
    public interface Sleeper {

        Sleeper SYSTEM = d -> Thread.sleep(d.toMillis());

        void sleep(Duration duration) throws InterruptedException;
    }
}
