package com.demo.lending.domain;

import java.math.BigInteger;
import java.time.Instant;

/** Oracle observation: {@code price / 10^decimals} USD per whole unit. */
public record Quote(BigInteger price, int decimals, Instant updatedAt) {}
