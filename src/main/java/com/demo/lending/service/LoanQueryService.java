package com.demo.lending.service;

import com.demo.lending.domain.Contribution;
import com.demo.lending.domain.Loan;
import com.demo.lending.domain.LoanLifecycleEvent;
import com.demo.lending.domain.LoanStatus;
import com.demo.lending.domain.RepaymentQuote;
import com.demo.lending.domain.Vote;
import com.demo.lending.exception.LoanNotFoundException;
import com.demo.lending.repository.ContributionRepository;
import com.demo.lending.repository.LedgerEventRepository;
import com.demo.lending.repository.LoanRepository;
import com.demo.lending.repository.SequenceRepository;
import com.demo.lending.repository.VoteRepository;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;

import java.util.EnumSet;
import java.util.List;
import java.util.Optional;

/** Read-only views for presentation and analytics. Reads never take the writer lock. */
@Service
@RequiredArgsConstructor
public class LoanQueryService {

    private final LoanRepository loans;
    private final ContributionRepository contributions;
    private final VoteRepository votes;
    private final LedgerEventRepository events;
    private final SequenceRepository sequences;

    public Loan getLoan(long id) {
        return loans.find(id).orElseThrow(() -> new LoanNotFoundException(id));
    }

    public Optional<Loan> findLoan(long id) {
        return loans.find(id);
    }

    public List<Long> getActiveLoanIds() {
        return loans.findIdsByStatus(EnumSet.of(LoanStatus.ACTIVE));
    }

    public List<Long> getLoanIds(LoanStatus status) {
        return loans.findIdsByStatus(EnumSet.of(status));
    }

    public List<Contribution> getContributions(long id) {
        getLoan(id);
        return contributions.findByLoan(id);
    }

    public List<Vote> getVotes(long id) {
        getLoan(id);
        return votes.findByLoan(id);
    }

    public List<LoanLifecycleEvent> getEvents(long id) {
        getLoan(id);
        return events.findByLoan(id);
    }

    public RepaymentQuote repaymentQuote(long id) {
        return RepaymentQuote.of(getLoan(id));
    }

    public long nextLoanId() {
        return sequences.peekNextLoanId();
    }
}
