package com.demo.lending.monitor;

import java.math.BigInteger;
import java.time.Instant;

public record LedgerHealth(
        String mode,
        boolean reachable,
        long head,
        long nextLoanId,
        String signer,
        long signerSequence,
        BigInteger signerBalance,
        boolean contractPresent,
        String detail,
        Instant checkedAt
) {
    public static LedgerHealth unreachable(String mode, String signer, String detail, Instant at) {
        return new LedgerHealth(mode, false, -1, -1, signer, -1, null, false, detail, at);
    }

    public boolean healthy() {
        return reachable && contractPresent;
    }
}
