package com.demo.lending.domain;

import java.math.BigInteger;
import java.time.Instant;

/** USD amount with {@link #DECIMALS} fractional digits, and the quote time it was derived from. */
public record UsdValue(BigInteger value, Instant asOf) {
    public static final int DECIMALS = 8;
}
