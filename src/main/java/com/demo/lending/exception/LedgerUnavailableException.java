package com.demo.lending.exception;

/**
 * Ledger endpoint unreachable or a read failed in transport. Transient: retried by
 * the monitor, never recorded against a loan.
 */
public class LedgerUnavailableException extends RuntimeException {

    private final String operation;

    public LedgerUnavailableException(String operation, Throwable cause) {
        super(String.format("Ledger unavailable (operation=%s): %s", operation,
                cause == null ? "unknown" : cause.getMessage()), cause);
        this.operation = operation;
    }

    public LedgerUnavailableException(String operation, String message) {
        super(String.format("Ledger unavailable (operation=%s): %s", operation, message));
        this.operation = operation;
    }

    public String getOperation() {
        return operation;
    }
}
