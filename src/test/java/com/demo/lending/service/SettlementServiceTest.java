package com.demo.lending.service;

import com.demo.lending.domain.Loan;
import com.demo.lending.domain.LoanEventType;
import com.demo.lending.domain.LoanRequest;
import com.demo.lending.domain.LoanStatus;
import com.demo.lending.domain.SettlementReceipt;
import com.demo.lending.domain.VoteChoice;
import com.demo.lending.exception.LendingException.Reason;
import com.demo.lending.support.BaseIntegrationTest;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.math.BigInteger;
import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("SettlementService")
class SettlementServiceTest extends BaseIntegrationTest {

    private static final BigInteger E8 = BigInteger.TEN.pow(8);
    private static final BigInteger ONE_ETH = BigInteger.TEN.pow(18);
    private static final BigInteger THOUSAND_USDC = BigInteger.valueOf(1000).multiply(BigInteger.TEN.pow(6));

    private Loan activeLoan() {
        Loan loan = requestUsdcLoan(1000, 10);
        contribute(loan.id(), ALICE, 400);
        contribute(loan.id(), BOB, 300);
        contribute(loan.id(), CAROL, 300);
        return queries.getLoan(loan.id());
    }

    private SettlementReceipt settle(long loanId) {
        return settlement.liquidate(loanId, LIQUIDATOR, settlement.nextSequence(LIQUIDATOR));
    }

    @Test
    @DisplayName("a healthy loan reverts with NOT_LIQUIDATABLE but the sequence is consumed")
    void healthyLoanReverts() {
        Loan loan = activeLoan();

        SettlementReceipt r = settlement.liquidate(loan.id(), LIQUIDATOR, 0);

        assertThat(r.success()).isFalse();
        assertThat(r.revertReason()).startsWith(Reason.NOT_LIQUIDATABLE.name());
        assertThat(settlement.nextSequence(LIQUIDATOR)).isEqualTo(1L);
        assertThat(queries.getLoan(loan.id()).status()).isEqualTo(LoanStatus.ACTIVE);
    }

    @Test
    @DisplayName("a mismatching sequence is rejected and consumes nothing")
    void sequenceMismatch() {
        Loan loan = activeLoan();
        clock.advance(Duration.ofDays(31));

        assertThatThrownBy(() -> settlement.liquidate(loan.id(), LIQUIDATOR, 5))
                .hasFieldOrPropertyWithValue("reason", Reason.SEQUENCE_MISMATCH);

        assertThat(settlement.nextSequence(LIQUIDATOR)).isZero();
        assertThat(queries.getLoan(loan.id()).status()).isEqualTo(LoanStatus.ACTIVE);
    }

    @Test
    @DisplayName("past due without prices falls back to the due date and opens the ballot")
    void pastDueOpensBallot() {
        Loan loan = activeLoan();
        clock.advance(Duration.ofDays(30).plusSeconds(1));

        SettlementReceipt r = settle(loan.id());

        assertThat(r.success()).isTrue();
        assertThat(r.outcome()).isEqualTo(LoanStatus.VOTING);
        Loan voting = queries.getLoan(loan.id());
        assertThat(voting.votingDeadline()).isEqualTo(clock.instant().plusSeconds(86400));
        assertThat(queries.getEvents(loan.id())).extracting(e -> e.type()).contains(LoanEventType.DEFAULTED);
    }

    @Test
    @DisplayName("the settlement call waits for the ballot, then sells to the liquidator")
    void saleAfterLiquidationVote() {
        Loan loan = activeLoan();
        clock.advance(Duration.ofDays(31));
        settle(loan.id());

        SettlementReceipt pending = settle(loan.id());
        assertThat(pending.success()).isFalse();
        assertThat(pending.revertReason()).startsWith(Reason.VOTE_PENDING.name());

        lifecycle.castVote(loan.id(), ALICE, VoteChoice.LIQUIDATE);
        lifecycle.castVote(loan.id(), CAROL, VoteChoice.LIQUIDATE);
        fund(LIQUIDATOR, USDC, units(1100));

        SettlementReceipt sold = settle(loan.id());

        assertThat(sold.success()).isTrue();
        assertThat(sold.outcome()).isEqualTo(LoanStatus.LIQUIDATED);
        assertThat(vault.balanceOf(ALICE, USDC)).isEqualTo(units(440));
        assertThat(vault.balanceOf(BOB, USDC)).isEqualTo(units(330));
        assertThat(vault.balanceOf(CAROL, USDC)).isEqualTo(units(330));
        assertThat(vault.balanceOf(LIQUIDATOR, ETH)).isEqualTo(units(10));
        assertThat(vault.balanceOf(vault.escrow(), ETH)).isEqualTo(BigInteger.ZERO);
        assertThat(queries.getLoan(loan.id()).collateralClaimed()).isTrue();
    }

    @Test
    @DisplayName("a lapsed ballot without majority defaults to the sale")
    void lapsedBallotSells() {
        Loan loan = activeLoan();
        clock.advance(Duration.ofDays(31));
        settle(loan.id());
        clock.advance(Duration.ofDays(1).plusSeconds(1));
        fund(LIQUIDATOR, USDC, units(1100));

        SettlementReceipt sold = settle(loan.id());

        assertThat(sold.outcome()).isEqualTo(LoanStatus.LIQUIDATED);
        assertThat(queries.getLoan(loan.id()).resolution()).isEqualTo(VoteChoice.LIQUIDATE);
    }

    @Test
    @DisplayName("re-running settlement on a terminal loan moves no funds")
    void settlementIsIdempotent() {
        Loan loan = activeLoan();
        clock.advance(Duration.ofDays(31));
        settle(loan.id());
        clock.advance(Duration.ofDays(2));
        fund(LIQUIDATOR, USDC, units(2200));
        settle(loan.id());
        BigInteger liquidatorUsdc = vault.balanceOf(LIQUIDATOR, USDC);
        BigInteger aliceUsdc = vault.balanceOf(ALICE, USDC);

        SettlementReceipt again = settle(loan.id());

        assertThat(again.success()).isFalse();
        assertThat(again.revertReason()).startsWith(Reason.WRONG_STATUS.name());
        assertThat(vault.balanceOf(LIQUIDATOR, USDC)).isEqualTo(liquidatorUsdc);
        assertThat(vault.balanceOf(ALICE, USDC)).isEqualTo(aliceUsdc);
        assertThat(queries.getLoan(loan.id()).status()).isEqualTo(LoanStatus.LIQUIDATED);
        assertThat(queries.getEvents(loan.id()))
                .filteredOn(e -> e.type() == LoanEventType.LIQUIDATED).hasSize(1);
    }

    @Test
    @DisplayName("a liquidator without funds reverts the sale and the loan stays in VOTING")
    void unfundedSaleReverts() {
        Loan loan = activeLoan();
        clock.advance(Duration.ofDays(31));
        settle(loan.id());
        clock.advance(Duration.ofDays(2));

        SettlementReceipt r = settle(loan.id());

        assertThat(r.success()).isFalse();
        assertThat(r.revertReason()).startsWith(Reason.INSUFFICIENT_ALLOWANCE.name());
        assertThat(queries.getLoan(loan.id()).status()).isEqualTo(LoanStatus.VOTING);
        assertThat(settlement.nextSequence(LIQUIDATOR)).isEqualTo(2L);
    }

    @Test
    @DisplayName("collateral below 120% of the loan value defaults a loan before its due date")
    void underCollateralizedByPrice() {
        fund(BORROWER, ETH, ONE_ETH);
        Loan loan = lifecycle.requestLoan(LoanRequest.builder()
                .borrower(BORROWER).loanTokenId(USDC).collateralTokenId(ETH)
                .principal(THOUSAND_USDC).collateralAmount(ONE_ETH)
                .interestRateBps(500).durationSecs(30 * 86400L).fundingPeriodSecs(86400).build());
        fund(ALICE, USDC, THOUSAND_USDC);
        ledger.contribute(loan.id(), ALICE, THOUSAND_USDC);
        oracle.publish("USDC/USD", E8, 8, clock.instant());
        oracle.publish("ETH/USD", BigInteger.valueOf(2000).multiply(E8), 8, clock.instant());

        assertThat(settle(loan.id()).revertReason()).startsWith(Reason.NOT_LIQUIDATABLE.name());

        oracle.publish("ETH/USD", BigInteger.valueOf(1100).multiply(E8), 8, clock.instant());
        SettlementReceipt r = settle(loan.id());

        assertThat(r.success()).isTrue();
        assertThat(r.outcome()).isEqualTo(LoanStatus.VOTING);
    }
}
