package com.demo.lending.exception;

/**
 * No usable price: quote older than the freshness bound, feed missing, or the oracle
 * call itself failed. Callers fall back to time-based liquidation only.
 */
public class StaleQuoteException extends LendingException {

    public StaleQuoteException(String message) {
        super(Reason.STALE_QUOTE, message);
    }

    public StaleQuoteException(String message, Throwable cause) {
        super(Reason.STALE_QUOTE, message, cause);
    }
}
