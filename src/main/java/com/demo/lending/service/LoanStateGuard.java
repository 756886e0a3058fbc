package com.demo.lending.service;

import com.demo.lending.domain.Loan;
import com.demo.lending.domain.LoanStatus;
import com.demo.lending.exception.LendingException;
import com.demo.lending.exception.LendingException.Reason;
import com.demo.lending.exception.LoanNotFoundException;
import com.demo.lending.repository.LoanRepository;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

/** Loads loans and applies status changes only along legal edges of the lifecycle. */
@Component
@RequiredArgsConstructor
class LoanStateGuard {

    private final LoanRepository loans;

    Loan load(long loanId) {
        return loans.find(loanId).orElseThrow(() -> new LoanNotFoundException(loanId));
    }

    Loan transition(Loan loan, LoanStatus next) {
        if (!loan.status().canTransitionTo(next)) {
            throw new LendingException(Reason.WRONG_STATUS,
                    "Loan " + loan.id() + " cannot move from " + loan.status() + " to " + next);
        }
        return loan.withStatus(next);
    }

    void save(Loan loan, LoanStatus expected) {
        if (!loans.update(loan, expected)) {
            throw new LendingException(Reason.WRONG_STATUS,
                    "Loan " + loan.id() + " is no longer " + expected);
        }
    }
}
