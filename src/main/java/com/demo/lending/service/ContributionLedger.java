package com.demo.lending.service;

import com.demo.lending.domain.Addresses;
import com.demo.lending.domain.Contribution;
import com.demo.lending.domain.Loan;
import com.demo.lending.domain.LoanEventType;
import com.demo.lending.domain.LoanStatus;
import com.demo.lending.domain.Token;
import com.demo.lending.exception.LendingException;
import com.demo.lending.exception.LendingException.Reason;
import com.demo.lending.repository.ContributionRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.math.BigInteger;
import java.time.Clock;
import java.time.Instant;
import java.util.List;

/**
 * Pooled funding of requested loans. The sum of contributions never exceeds the
 * principal; reaching it activates the loan and disburses in the same write.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ContributionLedger {

    private final LedgerWriter writer;
    private final LoanStateGuard guard;
    private final ContributionRepository contributions;
    private final TokenRegistry tokens;
    private final AssetVault vault;
    private final LoanEventPublisher events;
    private final Clock clock;

    public Loan contribute(long loanId, String lender, BigInteger amount) {
        if (amount == null || amount.signum() <= 0) {
            throw new LendingException(Reason.INVALID_AMOUNT, "Contribution must be positive");
        }
        if (Addresses.isEmpty(lender)) {
            throw new LendingException(Reason.INVALID_REQUEST, "Lender address required");
        }
        String who = Addresses.normalize(lender);
        if (expireIfLapsed(loanId)) {
            throw new LendingException(Reason.FUNDING_WINDOW_CLOSED, "Funding window of loan " + loanId + " has closed");
        }
        return writer.write(() -> {
            Instant now = clock.instant();
            Loan loan = guard.load(loanId);
            if (loan.status() != LoanStatus.REQUESTED) {
                throw new LendingException(Reason.WRONG_STATUS, "Loan " + loanId + " is " + loan.status() + ", not accepting funds");
            }
            if (now.isAfter(loan.fundingDeadline())) {
                throw new LendingException(Reason.FUNDING_WINDOW_CLOSED, "Funding window of loan " + loanId + " has closed");
            }
            if (who.equals(loan.borrower())) {
                throw new LendingException(Reason.BORROWER_CANNOT_LEND, "Borrower cannot fund their own loan");
            }
            BigInteger remaining = loan.remainingCapacity();
            if (amount.compareTo(remaining) > 0) {
                throw new LendingException(Reason.EXCEEDS_REMAINING,
                        "Contribution " + amount + " exceeds remaining " + remaining + " on loan " + loanId);
            }
            if (amount.compareTo(loan.minContribution()) < 0 && amount.compareTo(remaining) != 0) {
                throw new LendingException(Reason.BELOW_MIN_CONTRIBUTION,
                        "Contribution " + amount + " is below the minimum " + loan.minContribution());
            }

            Token loanToken = tokens.get(loan.loanTokenId());
            vault.collect(loanToken, who, amount);
            contributions.add(loanId, who, amount, now);
            Loan updated = loan.withAmountFunded(loan.amountFunded().add(amount));
            events.emit(loanId, LoanEventType.CONTRIBUTED, who, amount, null, now);

            if (updated.amountFunded().equals(updated.principal())) {
                updated = activate(updated, loanToken, now);
            }
            guard.save(updated, LoanStatus.REQUESTED);
            return updated;
        });
    }

    // Funded is passed through inside the same write; no committed state has a full pool still REQUESTED.
    private Loan activate(Loan loan, Token loanToken, Instant now) {
        Loan funded = guard.transition(loan, LoanStatus.FUNDED)
                .withFundedAt(now)
                .withDueDate(now.plusSeconds(loan.durationSecs()));
        Loan active = guard.transition(funded, LoanStatus.ACTIVE);
        vault.release(loanToken, loan.borrower(), loan.principal());
        events.emit(loan.id(), LoanEventType.FULLY_FUNDED, loan.borrower(), loan.principal(),
                "due " + active.dueDate(), now);
        log.info("Loan {} fully funded, {} disbursed to {}, due {}",
                loan.id(), loan.principal(), loan.borrower(), active.dueDate());
        return active;
    }

    /** Anyone may expire a loan whose funding window lapsed unmet. Collateral goes back to the borrower. */
    public Loan expire(long loanId) {
        return writer.write(() -> {
            Loan loan = guard.load(loanId);
            if (loan.status() != LoanStatus.REQUESTED) {
                throw new LendingException(Reason.WRONG_STATUS, "Loan " + loanId + " is " + loan.status());
            }
            if (!loan.isFundingLapsed(clock.instant())) {
                throw new LendingException(Reason.FUNDING_WINDOW_OPEN,
                        "Loan " + loanId + " accepts funds until " + loan.fundingDeadline());
            }
            return doExpire(loan, clock.instant());
        });
    }

    /** @return true if this call moved the loan to EXPIRED */
    public boolean expireIfLapsed(long loanId) {
        return writer.write(() -> {
            Loan loan = guard.load(loanId);
            Instant now = clock.instant();
            if (!loan.isFundingLapsed(now)) return false;
            doExpire(loan, now);
            return true;
        });
    }

    private Loan doExpire(Loan loan, Instant now) {
        Loan expired = guard.transition(loan, LoanStatus.EXPIRED);
        vault.release(tokens.get(loan.collateralTokenId()), loan.borrower(), loan.collateralAmount());
        guard.save(expired, LoanStatus.REQUESTED);
        events.emit(loan.id(), LoanEventType.EXPIRED, null, loan.amountFunded(),
                loan.amountFunded() + "/" + loan.principal() + " funded", now);
        log.info("Loan {} expired with {}/{} funded", loan.id(), loan.amountFunded(), loan.principal());
        return expired;
    }

    /**
     * Returns the lender's full contribution of an expired loan. A second call pays
     * nothing and returns zero.
     */
    public BigInteger refund(long loanId, String lender) {
        String who = Addresses.normalize(lender);
        expireIfLapsed(loanId);
        return writer.write(() -> {
            Loan loan = guard.load(loanId);
            if (loan.status() != LoanStatus.EXPIRED) {
                throw new LendingException(Reason.WRONG_STATUS,
                        "Loan " + loanId + " is " + loan.status() + "; refunds open only after expiry");
            }
            Contribution c = contributions.find(loanId, who)
                    .orElseThrow(() -> new LendingException(Reason.NOT_A_LENDER, who + " did not fund loan " + loanId));
            if (!contributions.markRefunded(loanId, who)) {
                log.debug("Loan {}: {} already refunded", loanId, who);
                return BigInteger.ZERO;
            }
            vault.release(tokens.get(loan.loanTokenId()), who, c.amount());
            events.emit(loanId, LoanEventType.REFUNDED, who, c.amount(), null, clock.instant());
            return c.amount();
        });
    }

    public List<Contribution> contributionsOf(long loanId) {
        return contributions.findByLoan(loanId);
    }
}
