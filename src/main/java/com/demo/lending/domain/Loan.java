package com.demo.lending.domain;

import lombok.Builder;
import lombok.With;

import java.math.BigInteger;
import java.time.Instant;

@With
@Builder
public record Loan(
        long id,
        String borrower,
        int loanTokenId,
        int collateralTokenId,
        BigInteger principal,
        BigInteger collateralAmount,
        int interestRateBps,
        long durationSecs,
        BigInteger minContribution,
        long fundingPeriodSecs,
        Instant createdAt,
        Instant fundedAt,
        Instant dueDate,
        LoanStatus status,
        BigInteger amountFunded,
        int riskScore,
        boolean collateralClaimed,
        String documentRef,
        Instant votingDeadline,
        VoteChoice resolution
) {
    private static final BigInteger BPS = BigInteger.valueOf(10_000);

    public Instant fundingDeadline() {
        return createdAt.plusSeconds(fundingPeriodSecs);
    }

    public BigInteger remainingCapacity() {
        return principal.subtract(amountFunded);
    }

    /** floor(principal * bps / 10000) */
    public BigInteger interest() {
        return principal.multiply(BigInteger.valueOf(interestRateBps)).divide(BPS);
    }

    /** Exact amount a repayment or liquidation sale must pay. */
    public BigInteger outstanding() {
        return principal.add(interest());
    }

    public boolean isPastDue(Instant now) {
        return dueDate != null && now.isAfter(dueDate);
    }

    public boolean isFundingLapsed(Instant now) {
        return status == LoanStatus.REQUESTED
                && now.isAfter(fundingDeadline())
                && amountFunded.compareTo(principal) < 0;
    }

    /** A defaulted loan whose lenders chose a sale, or whose ballot closed undecided. */
    public boolean isAwaitingSale(Instant now) {
        if (status != LoanStatus.VOTING) return false;
        if (resolution == VoteChoice.LIQUIDATE) return true;
        return resolution == null && votingDeadline != null && now.isAfter(votingDeadline);
    }
}
