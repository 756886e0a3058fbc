package com.demo.lending.domain;

import java.math.BigInteger;
import java.time.Instant;

public record Vote(long loanId, String lender, VoteChoice choice, BigInteger weight, Instant castAt) {}
