package com.demo.lending.controller.dto;

import com.demo.lending.domain.Loan;
import com.demo.lending.domain.LoanRequest;
import com.demo.lending.domain.LoanStatus;
import com.demo.lending.domain.VoteChoice;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;

import java.math.BigInteger;
import java.time.Instant;

public final class LoanDtos {
    private LoanDtos() {}

    // -------- Requests ----------
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class RequestLoan {
        @NotBlank
        public String borrower;
        public int loanTokenId;
        public int collateralTokenId;
        @NotNull
        public BigInteger principal;
        @NotNull
        public BigInteger collateralAmount;
        public int interestRateBps;
        public long durationSecs;
        public BigInteger minContribution;   // optional, 0 when absent
        public long fundingPeriodSecs;
        public int riskScore;                // from the scoring service
        public String documentRef;           // content address, optional

        public LoanRequest toRequest() {
            return LoanRequest.builder()
                    .borrower(borrower)
                    .loanTokenId(loanTokenId)
                    .collateralTokenId(collateralTokenId)
                    .principal(principal)
                    .collateralAmount(collateralAmount)
                    .interestRateBps(interestRateBps)
                    .durationSecs(durationSecs)
                    .minContribution(minContribution)
                    .fundingPeriodSecs(fundingPeriodSecs)
                    .riskScore(riskScore)
                    .documentRef(documentRef)
                    .build();
        }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class Contribute {
        @NotBlank
        public String lender;
        @NotNull
        public BigInteger amount;
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class Refund {
        @NotBlank
        public String lender;
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class Repay {
        @NotBlank
        public String payer;
        @NotNull
        public BigInteger amount;
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class CastVote {
        @NotBlank
        public String lender;
        @NotNull
        public VoteChoice choice;
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class Liquidate {
        @NotBlank
        public String caller;
        public Long sequence;   // next expected sequence when absent
    }

    // -------- Responses ----------
    public static class LoanView {
        public long id;
        public String borrower;
        public int loanTokenId;
        public int collateralTokenId;
        public BigInteger principal;
        public BigInteger collateralAmount;
        public int interestRateBps;
        public long durationSecs;
        public BigInteger minContribution;
        public Instant createdAt;
        public Instant fundingDeadline;
        public Instant fundedAt;
        public Instant dueDate;
        public LoanStatus status;
        public BigInteger amountFunded;
        public BigInteger remaining;
        public BigInteger interest;
        public BigInteger outstanding;
        public int riskScore;
        public boolean collateralClaimed;
        public String documentRef;
        public Instant votingDeadline;
        public VoteChoice resolution;

        public static LoanView of(Loan l) {
            LoanView v = new LoanView();
            v.id = l.id();
            v.borrower = l.borrower();
            v.loanTokenId = l.loanTokenId();
            v.collateralTokenId = l.collateralTokenId();
            v.principal = l.principal();
            v.collateralAmount = l.collateralAmount();
            v.interestRateBps = l.interestRateBps();
            v.durationSecs = l.durationSecs();
            v.minContribution = l.minContribution();
            v.createdAt = l.createdAt();
            v.fundingDeadline = l.fundingDeadline();
            v.fundedAt = l.fundedAt();
            v.dueDate = l.dueDate();
            v.status = l.status();
            v.amountFunded = l.amountFunded();
            v.remaining = l.remainingCapacity();
            v.interest = l.interest();
            v.outstanding = l.outstanding();
            v.riskScore = l.riskScore();
            v.collateralClaimed = l.collateralClaimed();
            v.documentRef = l.documentRef();
            v.votingDeadline = l.votingDeadline();
            v.resolution = l.resolution();
            return v;
        }
    }

    public static class RefundResult {
        public long loanId;
        public String lender;
        public BigInteger refunded;

        public RefundResult(long loanId, String lender, BigInteger refunded) {
            this.loanId = loanId;
            this.lender = lender;
            this.refunded = refunded;
        }
    }
}
