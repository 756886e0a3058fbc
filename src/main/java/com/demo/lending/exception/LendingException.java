package com.demo.lending.exception;

/**
 * Rejected ledger operation. Thrown before or inside the write transaction, so the
 * ledger is left exactly as it was.
 */
public class LendingException extends RuntimeException {

    public enum Reason {
        INVALID_AMOUNT,
        INVALID_REQUEST,
        UNKNOWN_TOKEN,
        TOKEN_INACTIVE,
        TOKEN_ALREADY_ACTIVE,
        LOAN_NOT_FOUND,
        WRONG_STATUS,
        FUNDING_WINDOW_CLOSED,
        FUNDING_WINDOW_OPEN,
        EXCEEDS_REMAINING,
        BELOW_MIN_CONTRIBUTION,
        BORROWER_CANNOT_LEND,
        INSUFFICIENT_COLLATERAL,
        NOT_BORROWER,
        AMOUNT_MISMATCH,
        NOT_A_LENDER,
        ALREADY_VOTED,
        ALREADY_RESOLVED,
        VOTING_CLOSED,
        VOTE_PENDING,
        NOT_LIQUIDATABLE,
        INSUFFICIENT_BALANCE,
        INSUFFICIENT_ALLOWANCE,
        SEQUENCE_MISMATCH,
        STALE_QUOTE
    }

    private final Reason reason;

    public LendingException(Reason reason, String message) {
        super(message);
        this.reason = reason;
    }

    public LendingException(Reason reason, String message, Throwable cause) {
        super(message, cause);
        this.reason = reason;
    }

    public Reason getReason() {
        return reason;
    }
}
