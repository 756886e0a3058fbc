package com.demo.lending.domain;

import lombok.Builder;

import java.math.BigInteger;

/**
 * Borrower's terms. {@code riskScore} comes from the external scoring collaborator and is
 * stored as given; {@code documentRef} is an opaque content address for the paperwork.
 */
@Builder
public record LoanRequest(
        String borrower,
        int loanTokenId,
        int collateralTokenId,
        BigInteger principal,
        BigInteger collateralAmount,
        int interestRateBps,
        long durationSecs,
        BigInteger minContribution,
        long fundingPeriodSecs,
        int riskScore,
        String documentRef
) {}
