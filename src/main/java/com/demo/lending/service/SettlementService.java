package com.demo.lending.service;

import com.demo.lending.domain.Addresses;
import com.demo.lending.domain.Loan;
import com.demo.lending.domain.LoanEventType;
import com.demo.lending.domain.LoanStatus;
import com.demo.lending.domain.SettlementReceipt;
import com.demo.lending.domain.Token;
import com.demo.lending.domain.VoteChoice;
import com.demo.lending.exception.LendingException;
import com.demo.lending.exception.LendingException.Reason;
import com.demo.lending.repository.ContributionRepository;
import com.demo.lending.repository.LoanRepository;
import com.demo.lending.repository.SequenceRepository;
import com.demo.lending.service.liquidation.LiquidationDecisionEngine;
import com.demo.lending.service.liquidation.LiquidationVerdict;
import com.demo.lending.service.valuation.ValuationEngine;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.math.BigInteger;
import java.time.Clock;
import java.time.Instant;
import java.util.Map;

/**
 * The ledger's settlement call. One entry point drives both default steps: an active
 * loan that is liquidatable opens the lenders' ballot, and a defaulted loan awaiting a
 * sale is sold to the caller.
 *
 * <p>Each call carries the caller's sequence number. A call with the expected sequence
 * consumes it even when the body reverts; a mismatching sequence is rejected and consumes
 * nothing.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class SettlementService {

    private final LedgerWriter writer;
    private final LoanStateGuard guard;
    private final LoanRepository loans;
    private final SequenceRepository sequences;
    private final ContributionRepository contributions;
    private final TokenRegistry tokens;
    private final AssetVault vault;
    private final ValuationEngine valuation;
    private final LiquidationDecisionEngine decisions;
    private final LoanEventPublisher events;
    private final Clock clock;

    @Value("${lending.voting-period-secs:259200}")
    private long votingPeriodSecs;

    public long nextSequence(String account) {
        return sequences.nextSequence(Addresses.normalize(account));
    }

    public SettlementReceipt liquidate(long loanId, String caller, long sequence) {
        String who = Addresses.normalize(caller);
        if (Addresses.isEmpty(who)) {
            throw new LendingException(Reason.INVALID_REQUEST, "Caller address required");
        }
        // Price reads stay outside the writer lock.
        LiquidationVerdict verdict = loans.find(loanId)
                .filter(l -> l.status() == LoanStatus.ACTIVE)
                .map(l -> decisions.assess(l, clock.instant(), valuation::usdValueOf))
                .orElse(null);
        String txRef = "local:" + who + ":" + sequence;

        return writer.exclusive(() -> {
            writer.run(() -> consumeSequence(who, sequence));
            try {
                LoanStatus outcome = writer.write(() -> settle(loanId, who, verdict));
                return SettlementReceipt.confirmed(loanId, who, sequence, txRef, outcome);
            } catch (LendingException ex) {
                log.info("Settlement of loan {} by {} (seq {}) reverted: {}", loanId, who, sequence, ex.getMessage());
                return SettlementReceipt.reverted(loanId, who, sequence, txRef, ex.getReason() + ": " + ex.getMessage());
            }
        });
    }

    private void consumeSequence(String caller, long sequence) {
        long expected = sequences.nextSequence(caller);
        if (sequence != expected) {
            throw new LendingException(Reason.SEQUENCE_MISMATCH,
                    "Sequence " + sequence + " rejected for " + caller + ", expected " + expected);
        }
        sequences.advance(caller, sequence);
    }

    private LoanStatus settle(long loanId, String caller, LiquidationVerdict preVerdict) {
        Instant now = clock.instant();
        Loan loan = guard.load(loanId);
        switch (loan.status()) {
            case ACTIVE:
                return openBallot(loan, preVerdict != null ? preVerdict
                        : decisions.timeOnly(loan, now, "loan became active after valuation"), now);
            case VOTING:
                if (!loan.isAwaitingSale(now)) {
                    throw new LendingException(Reason.VOTE_PENDING,
                            "Ballot on loan " + loanId + " open until " + loan.votingDeadline());
                }
                return sell(loan, caller, now);
            default:
                throw new LendingException(Reason.WRONG_STATUS, "Loan " + loanId + " is " + loan.status() + ", nothing to settle");
        }
    }

    private LoanStatus openBallot(Loan loan, LiquidationVerdict verdict, Instant now) {
        if (!verdict.liquidatable()) {
            throw new LendingException(Reason.NOT_LIQUIDATABLE, "Loan " + loan.id() + " is healthy: " + verdict.describe());
        }
        Loan pastDue = guard.transition(loan, LoanStatus.PAST_DUE);
        Loan voting = guard.transition(pastDue, LoanStatus.VOTING)
                .withVotingDeadline(now.plusSeconds(votingPeriodSecs));
        guard.save(voting, LoanStatus.ACTIVE);
        events.emit(loan.id(), LoanEventType.DEFAULTED, null, loan.outstanding(), verdict.describe(), now);
        log.info("Loan {} defaulted ({}), ballot open until {}", loan.id(), verdict.describe(), voting.votingDeadline());
        return voting.status();
    }

    private LoanStatus sell(Loan loan, String liquidator, Instant now) {
        Token loanToken = tokens.get(loan.loanTokenId());
        Token collateralToken = tokens.get(loan.collateralTokenId());
        BigInteger owed = loan.outstanding();
        vault.collect(loanToken, liquidator, owed);
        Map<String, BigInteger> proceeds = ProRata.split(owed, contributions.findByLoan(loan.id()), loan.amountFunded());
        proceeds.forEach((lender, share) -> vault.release(loanToken, lender, share));
        vault.release(collateralToken, liquidator, loan.collateralAmount());

        Loan sold = guard.transition(loan, LoanStatus.LIQUIDATED)
                .withCollateralClaimed(true)
                .withResolution(loan.resolution() == null ? VoteChoice.LIQUIDATE : loan.resolution());
        guard.save(sold, LoanStatus.VOTING);
        events.emit(loan.id(), LoanEventType.LIQUIDATED, liquidator, owed,
                loan.collateralAmount() + " " + collateralToken.symbol() + " to liquidator", now);
        log.info("Loan {} liquidated by {}: paid {}, {} lenders", loan.id(), liquidator, owed, proceeds.size());
        return sold.status();
    }
}
