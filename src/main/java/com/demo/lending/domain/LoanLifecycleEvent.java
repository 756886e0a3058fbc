package com.demo.lending.domain;

import java.math.BigInteger;
import java.time.Instant;

/** Appended to the ledger log and published to listeners after commit. */
public record LoanLifecycleEvent(
        long sequence,
        long loanId,
        LoanEventType type,
        String actor,
        BigInteger amount,
        String detail,
        Instant occurredAt
) {}
