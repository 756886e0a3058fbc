package com.demo.lending.domain;

import java.math.BigInteger;

public record RepaymentQuote(long loanId, int loanTokenId, BigInteger principal, BigInteger interest, BigInteger total) {

    public static RepaymentQuote of(Loan loan) {
        return new RepaymentQuote(loan.id(), loan.loanTokenId(), loan.principal(), loan.interest(), loan.outstanding());
    }
}
