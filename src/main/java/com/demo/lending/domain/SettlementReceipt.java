package com.demo.lending.domain;

/**
 * Result of one settlement call. A reverted call still consumed the caller's sequence
 * number, so the next call must use {@code sequence + 1}.
 */
public record SettlementReceipt(
        long loanId,
        String caller,
        long sequence,
        String txRef,
        boolean success,
        LoanStatus outcome,
        String revertReason
) {
    public static SettlementReceipt confirmed(long loanId, String caller, long sequence, String txRef, LoanStatus outcome) {
        return new SettlementReceipt(loanId, caller, sequence, txRef, true, outcome, null);
    }

    public static SettlementReceipt reverted(long loanId, String caller, long sequence, String txRef, String reason) {
        return new SettlementReceipt(loanId, caller, sequence, txRef, false, null, reason);
    }
}
