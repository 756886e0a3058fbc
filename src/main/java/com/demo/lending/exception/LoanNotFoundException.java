package com.demo.lending.exception;

public class LoanNotFoundException extends LendingException {

    private final long loanId;

    public LoanNotFoundException(long loanId) {
        super(Reason.LOAN_NOT_FOUND, "Loan " + loanId + " not found");
        this.loanId = loanId;
    }

    public long getLoanId() {
        return loanId;
    }
}
