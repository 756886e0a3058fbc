package com.demo.lending.exception;

import java.time.Duration;

/** Settlement submitted but not confirmed within the wait bound; re-evaluated next cycle. */
public class SettlementTimeoutException extends RuntimeException {

    private final long loanId;

    public SettlementTimeoutException(long loanId, Duration waited, Throwable cause) {
        super("Settlement for loan " + loanId + " not confirmed within " + waited.toMillis() + "ms", cause);
        this.loanId = loanId;
    }

    public long getLoanId() {
        return loanId;
    }
}
