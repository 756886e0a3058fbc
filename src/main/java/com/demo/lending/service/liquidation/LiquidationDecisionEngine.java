package com.demo.lending.service.liquidation;

import com.demo.lending.domain.Loan;
import com.demo.lending.exception.LedgerUnavailableException;
import com.demo.lending.exception.StaleQuoteException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.math.BigInteger;
import java.time.Instant;

/**
 * Decides whether a loan may be force-settled: it is past due, or its collateral is
 * worth less than 120% of the principal.
 */
@Slf4j
@Component
public class LiquidationDecisionEngine {

    public static final BigInteger THRESHOLD_PERCENT = BigInteger.valueOf(120);
    private static final BigInteger HUNDRED = BigInteger.valueOf(100);

    public boolean isLiquidatable(Loan loan, BigInteger loanValueUsd, BigInteger collateralValueUsd, Instant now) {
        return loan.isPastDue(now) || isUnderCollateralized(loanValueUsd, collateralValueUsd);
    }

    public boolean isUnderCollateralized(BigInteger loanValueUsd, BigInteger collateralValueUsd) {
        return collateralValueUsd.multiply(HUNDRED).compareTo(loanValueUsd.multiply(THRESHOLD_PERCENT)) < 0;
    }

    /**
     * Values both legs through {@code valuer}. A failed valuation never reads as "safe":
     * the verdict falls back to the due-date check alone.
     */
    public LiquidationVerdict assess(Loan loan, Instant now, Valuer valuer) {
        boolean pastDue = loan.isPastDue(now);
        BigInteger loanValue;
        BigInteger collateralValue;
        try {
            loanValue = valuer.usdValue(loan.loanTokenId(), loan.principal());
            collateralValue = valuer.usdValue(loan.collateralTokenId(), loan.collateralAmount());
        } catch (StaleQuoteException | LedgerUnavailableException ex) {
            log.warn("Loan {}: valuation unavailable, deciding on due date only ({})", loan.id(), ex.getMessage());
            return LiquidationVerdict.timeOnly(pastDue, ex.getMessage());
        }
        boolean under = isUnderCollateralized(loanValue, collateralValue);
        return new LiquidationVerdict(pastDue || under, pastDue, under, true, loanValue, collateralValue, null);
    }

    /** Decision made without touching any price source. */
    public LiquidationVerdict timeOnly(Loan loan, Instant now, String reason) {
        return LiquidationVerdict.timeOnly(loan.isPastDue(now), reason);
    }

    @FunctionalInterface
    public interface Valuer {
        BigInteger usdValue(int tokenId, BigInteger rawAmount);
    }
}
