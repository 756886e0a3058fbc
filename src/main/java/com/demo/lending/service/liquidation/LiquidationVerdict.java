package com.demo.lending.service.liquidation;

import java.math.BigInteger;

/**
 * Outcome of one liquidation check. When {@code valued} is false the USD figures are
 * null and only the due date decided the outcome.
 */
public record LiquidationVerdict(
        boolean liquidatable,
        boolean pastDue,
        boolean underCollateralized,
        boolean valued,
        BigInteger loanValueUsd,
        BigInteger collateralValueUsd,
        String fallbackReason
) {
    static LiquidationVerdict timeOnly(boolean pastDue, String reason) {
        return new LiquidationVerdict(pastDue, pastDue, false, false, null, null, reason);
    }

    /** Collateral value as a percentage of loan value, or null when unvalued. */
    public BigInteger collateralRatioPercent() {
        if (!valued || loanValueUsd.signum() == 0) return null;
        return collateralValueUsd.multiply(BigInteger.valueOf(100)).divide(loanValueUsd);
    }

    public String describe() {
        if (!valued) {
            return "pastDue=" + pastDue + " (time-only: " + fallbackReason + ")";
        }
        return "pastDue=" + pastDue + " underCollateralized=" + underCollateralized
                + " ratio=" + collateralRatioPercent() + "%";
    }
}
