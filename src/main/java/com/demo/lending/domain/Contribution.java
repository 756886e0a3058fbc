package com.demo.lending.domain;

import java.math.BigInteger;
import java.time.Instant;

/**
 * One lender's stake in one loan. {@code position} is the order in which the lender
 * first contributed; pro-rata remainders go to position 0.
 */
public record Contribution(
        long loanId,
        String lender,
        BigInteger amount,
        Instant timestamp,
        int position,
        boolean refunded
) {}
