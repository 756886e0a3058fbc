package com.demo.lending.monitor;

import java.time.Instant;

/** Counters of one monitor cycle. */
public record CycleReport(
        Instant startedAt,
        Instant finishedAt,
        long upperBound,
        int scanned,
        int eligible,
        int settled,
        int reverted,
        int timedOut,
        int failed,
        int valuationFallbacks
) {}
