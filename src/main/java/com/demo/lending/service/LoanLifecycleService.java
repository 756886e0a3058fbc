package com.demo.lending.service;

import com.demo.lending.domain.Addresses;
import com.demo.lending.domain.Contribution;
import com.demo.lending.domain.Loan;
import com.demo.lending.domain.LoanEventType;
import com.demo.lending.domain.LoanRequest;
import com.demo.lending.domain.LoanStatus;
import com.demo.lending.domain.Token;
import com.demo.lending.domain.Vote;
import com.demo.lending.domain.VoteChoice;
import com.demo.lending.exception.LendingException;
import com.demo.lending.exception.LendingException.Reason;
import com.demo.lending.repository.ContributionRepository;
import com.demo.lending.repository.LoanRepository;
import com.demo.lending.repository.SequenceRepository;
import com.demo.lending.repository.VoteRepository;
import com.demo.lending.service.valuation.ValuationEngine;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.math.BigInteger;
import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Map;

/** Borrower and lender operations on a loan: request, repayment and the default ballot. */
@Slf4j
@Service
@RequiredArgsConstructor
public class LoanLifecycleService {

    private static final int MAX_BPS = 10_000;
    private static final int MAX_RISK_SCORE = 0xFFFF;
    private static final long MAX_DURATION_SECS = 0xFFFF_FFFFL;

    private final LedgerWriter writer;
    private final LoanStateGuard guard;
    private final LoanRepository loans;
    private final SequenceRepository sequences;
    private final ContributionRepository contributions;
    private final VoteRepository votes;
    private final TokenRegistry tokens;
    private final AssetVault vault;
    private final ValuationEngine valuation;
    private final LoanEventPublisher events;
    private final Clock clock;

    @Value("${lending.min-collateral-ratio-percent:150}")
    private int minCollateralRatioPercent;

    /** Creates the loan and escrows the borrower's collateral in one write. */
    public Loan requestLoan(LoanRequest req) {
        validate(req);
        String borrower = Addresses.normalize(req.borrower());
        BigInteger minContribution = req.minContribution() == null ? BigInteger.ZERO : req.minContribution();
        checkCollateralRatio(req);

        return writer.write(() -> {
            Token loanToken = tokens.requireActive(req.loanTokenId());
            Token collateralToken = tokens.requireActive(req.collateralTokenId());
            Instant now = clock.instant();
            long id = sequences.allocateLoanId();
            Loan loan = Loan.builder()
                    .id(id)
                    .borrower(borrower)
                    .loanTokenId(loanToken.id())
                    .collateralTokenId(collateralToken.id())
                    .principal(req.principal())
                    .collateralAmount(req.collateralAmount())
                    .interestRateBps(req.interestRateBps())
                    .durationSecs(req.durationSecs())
                    .minContribution(minContribution)
                    .fundingPeriodSecs(req.fundingPeriodSecs())
                    .createdAt(now)
                    .status(LoanStatus.REQUESTED)
                    .amountFunded(BigInteger.ZERO)
                    .riskScore(req.riskScore())
                    .collateralClaimed(false)
                    .documentRef(req.documentRef())
                    .build();
            vault.collect(collateralToken, borrower, req.collateralAmount());
            loans.insert(loan);
            events.emit(id, LoanEventType.REQUESTED, borrower, req.principal(),
                    loanToken.symbol() + " against " + req.collateralAmount() + " " + collateralToken.symbol(), now);
            log.info("Loan {} requested by {}: {} {} at {} bps, {}s", id, borrower,
                    req.principal(), loanToken.symbol(), req.interestRateBps(), req.durationSecs());
            return loan;
        });
    }

    private void validate(LoanRequest req) {
        if (req == null || Addresses.isEmpty(req.borrower())) {
            throw new LendingException(Reason.INVALID_REQUEST, "Borrower address required");
        }
        if (req.principal() == null || req.principal().signum() <= 0) {
            throw new LendingException(Reason.INVALID_AMOUNT, "Principal must be positive");
        }
        if (req.collateralAmount() == null || req.collateralAmount().signum() <= 0) {
            throw new LendingException(Reason.INVALID_AMOUNT, "Collateral must be positive");
        }
        if (req.interestRateBps() < 0 || req.interestRateBps() > MAX_BPS) {
            throw new LendingException(Reason.INVALID_REQUEST, "Interest rate must be within 0..10000 bps");
        }
        if (req.durationSecs() <= 0 || req.durationSecs() > MAX_DURATION_SECS) {
            throw new LendingException(Reason.INVALID_REQUEST, "Duration out of range: " + req.durationSecs());
        }
        if (req.fundingPeriodSecs() <= 0) {
            throw new LendingException(Reason.INVALID_REQUEST, "Funding period must be positive");
        }
        if (req.riskScore() < 0 || req.riskScore() > MAX_RISK_SCORE) {
            throw new LendingException(Reason.INVALID_REQUEST, "Risk score out of range: " + req.riskScore());
        }
        BigInteger min = req.minContribution();
        if (min != null && (min.signum() < 0 || min.compareTo(req.principal()) > 0)) {
            throw new LendingException(Reason.INVALID_AMOUNT, "Minimum contribution must be within 0..principal");
        }
    }

    private void checkCollateralRatio(LoanRequest req) {
        if (minCollateralRatioPercent <= 0) return;
        Token loanToken = tokens.get(req.loanTokenId());
        Token collateralToken = tokens.get(req.collateralTokenId());
        if (!loanToken.hasPriceFeed() || !collateralToken.hasPriceFeed()) {
            log.debug("Skipping collateral ratio check, {} or {} has no price feed",
                    loanToken.symbol(), collateralToken.symbol());
            return;
        }
        BigInteger loanUsd = valuation.usdValueOf(loanToken.id(), req.principal());
        BigInteger collateralUsd = valuation.usdValueOf(collateralToken.id(), req.collateralAmount());
        BigInteger required = loanUsd.multiply(BigInteger.valueOf(minCollateralRatioPercent));
        if (collateralUsd.multiply(BigInteger.valueOf(100)).compareTo(required) < 0) {
            throw new LendingException(Reason.INSUFFICIENT_COLLATERAL,
                    "Collateral worth " + collateralUsd + " is below " + minCollateralRatioPercent + "% of " + loanUsd);
        }
    }

    /**
     * Pays {@code principal + interest} from the borrower, splits it pro-rata over the
     * lenders and returns the collateral.
     */
    public Loan repay(long loanId, String payer, BigInteger amount) {
        String who = Addresses.normalize(payer);
        return writer.write(() -> {
            Loan loan = guard.load(loanId);
            if (loan.status() != LoanStatus.ACTIVE) {
                throw new LendingException(Reason.WRONG_STATUS, "Loan " + loanId + " is " + loan.status() + ", not repayable");
            }
            if (!loan.borrower().equals(who)) {
                throw new LendingException(Reason.NOT_BORROWER, "Only the borrower may repay loan " + loanId);
            }
            BigInteger owed = loan.outstanding();
            if (amount == null || amount.compareTo(owed) != 0) {
                throw new LendingException(Reason.AMOUNT_MISMATCH, "Repayment must be exactly " + owed + ", got " + amount);
            }
            Instant now = clock.instant();
            Token loanToken = tokens.get(loan.loanTokenId());
            vault.collect(loanToken, who, owed);
            Map<String, BigInteger> payouts = ProRata.split(owed, contributions.findByLoan(loanId), loan.principal());
            payouts.forEach((lender, share) -> vault.release(loanToken, lender, share));
            vault.release(tokens.get(loan.collateralTokenId()), loan.borrower(), loan.collateralAmount());

            Loan repaid = guard.transition(loan, LoanStatus.REPAID);
            guard.save(repaid, LoanStatus.ACTIVE);
            events.emit(loanId, LoanEventType.REPAID, who, owed, payouts.size() + " lenders paid", now);
            log.info("Loan {} repaid: {} split over {} lenders", loanId, owed, payouts.size());
            return repaid;
        });
    }

    /**
     * Records a weighted ballot on a defaulted loan. A strict majority for a proportional
     * claim distributes the collateral at once; a majority for liquidation is executed by
     * the next settlement call.
     */
    public Loan castVote(long loanId, String lender, VoteChoice choice) {
        if (choice == null) {
            throw new LendingException(Reason.INVALID_REQUEST, "Vote choice required");
        }
        String who = Addresses.normalize(lender);
        return writer.write(() -> {
            Instant now = clock.instant();
            Loan loan = guard.load(loanId);
            if (loan.status() != LoanStatus.VOTING) {
                throw new LendingException(Reason.WRONG_STATUS, "Loan " + loanId + " is " + loan.status() + ", no ballot open");
            }
            if (loan.resolution() != null) {
                throw new LendingException(Reason.ALREADY_RESOLVED, "Loan " + loanId + " already resolved to " + loan.resolution());
            }
            if (now.isAfter(loan.votingDeadline())) {
                throw new LendingException(Reason.VOTING_CLOSED, "Ballot on loan " + loanId + " closed at " + loan.votingDeadline());
            }
            Contribution stake = contributions.find(loanId, who)
                    .orElseThrow(() -> new LendingException(Reason.NOT_A_LENDER, who + " did not fund loan " + loanId));
            if (votes.exists(loanId, who)) {
                throw new LendingException(Reason.ALREADY_VOTED, who + " already voted on loan " + loanId);
            }
            votes.insert(new Vote(loanId, who, choice, stake.amount(), now));
            events.emit(loanId, LoanEventType.VOTE_CAST, who, stake.amount(), choice.name(), now);

            BigInteger tally = votes.weightFor(loanId, choice);
            if (tally.shiftLeft(1).compareTo(loan.amountFunded()) <= 0) {
                return loan;
            }
            log.info("Loan {}: majority {} ({} of {})", loanId, choice, tally, loan.amountFunded());
            if (choice == VoteChoice.CLAIM_PROPORTIONAL) {
                return claimProportional(loan, now);
            }
            Loan resolved = loan.withResolution(VoteChoice.LIQUIDATE);
            guard.save(resolved, LoanStatus.VOTING);
            return resolved;
        });
    }

    private Loan claimProportional(Loan loan, Instant now) {
        Token collateralToken = tokens.get(loan.collateralTokenId());
        List<Contribution> stakes = contributions.findByLoan(loan.id());
        Map<String, BigInteger> shares = ProRata.split(loan.collateralAmount(), stakes, loan.amountFunded());
        shares.forEach((lender, share) -> vault.release(collateralToken, lender, share));
        Loan claimed = guard.transition(loan, LoanStatus.PARTIALLY_CLAIMED)
                .withCollateralClaimed(true)
                .withResolution(VoteChoice.CLAIM_PROPORTIONAL);
        guard.save(claimed, LoanStatus.VOTING);
        events.emit(loan.id(), LoanEventType.COLLATERAL_CLAIMED, null, loan.collateralAmount(),
                shares.size() + " lenders", now);
        return claimed;
    }
}
