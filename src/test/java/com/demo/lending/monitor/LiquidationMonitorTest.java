package com.demo.lending.monitor;

import com.demo.lending.domain.Loan;
import com.demo.lending.domain.LoanStatus;
import com.demo.lending.domain.SettlementReceipt;
import com.demo.lending.domain.VoteChoice;
import com.demo.lending.exception.LedgerUnavailableException;
import com.demo.lending.exception.SettlementTimeoutException;
import com.demo.lending.exception.StaleQuoteException;
import com.demo.lending.service.liquidation.LiquidationDecisionEngine;
import com.demo.lending.support.MutableClock;
import com.demo.lending.support.TestConfig;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InOrder;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.mockito.junit.jupiter.MockitoSettings;
import org.mockito.quality.Strictness;

import java.math.BigInteger;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicReference;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.argThat;
import static org.mockito.Mockito.doNothing;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.inOrder;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
@MockitoSettings(strictness = Strictness.LENIENT)
@DisplayName("LiquidationMonitor")
class LiquidationMonitorTest {

    private static final Instant DUE = TestConfig.T0.plusSeconds(30 * 86400L);

    @Mock private LedgerGateway gateway;
    @Mock private SettlementSubmitter submitter;

    private final List<Duration> slept = new ArrayList<>();
    private MutableClock clock;
    private LiquidationMonitor monitor;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(TestConfig.T0);
        when(gateway.mode()).thenReturn("local");
        when(submitter.signerAddress()).thenReturn("liquidator");
        when(gateway.nextLoanId()).thenReturn(1L);
        when(gateway.usdValue(anyInt(), any())).thenAnswer(inv -> inv.getArgument(1));
        when(gateway.readLoan(anyLong())).thenReturn(Optional.empty());
        monitor = newMonitor(true, 100);
    }

    private LiquidationMonitor newMonitor(boolean enabled, int cap) {
        return new LiquidationMonitor(gateway, submitter, new LiquidationDecisionEngine(), RetryPolicy.none(),
                slept::add, clock, enabled, cap, 5000, 10);
    }

    /** Principal 100 against collateral 1000 of a unit-priced token: healthy until due. */
    private static Loan loan(long id, LoanStatus status) {
        return Loan.builder()
                .id(id).borrower("0xb0rr0wer").loanTokenId(1).collateralTokenId(0)
                .principal(BigInteger.valueOf(100)).collateralAmount(BigInteger.valueOf(1000))
                .interestRateBps(1000).durationSecs(30 * 86400L)
                .minContribution(BigInteger.ZERO).fundingPeriodSecs(86400)
                .createdAt(TestConfig.T0).fundedAt(TestConfig.T0).dueDate(DUE)
                .status(status).amountFunded(BigInteger.valueOf(100))
                .build();
    }

    private void ledgerHolds(Loan... loans) {
        when(gateway.nextLoanId()).thenReturn(loans.length + 1L);
        for (Loan l : loans) {
            when(gateway.readLoan(l.id())).thenReturn(Optional.of(l));
        }
    }

    private static SettlementReceipt confirmed(Loan loan) {
        return SettlementReceipt.confirmed(loan.id(), "liquidator", 0, "local:liquidator:0", LoanStatus.VOTING);
    }

    @Nested
    @DisplayName("scanning")
    class Scanning {

        @Test
        @DisplayName("settles only past-due loans, one after another in id order")
        void settlesEligibleInOrder() {
            // Arrange
            Loan first = loan(1, LoanStatus.ACTIVE);
            Loan healthy = loan(2, LoanStatus.ACTIVE).withDueDate(DUE.plusSeconds(86400));
            Loan third = loan(3, LoanStatus.ACTIVE);
            Loan repaid = loan(4, LoanStatus.REPAID);
            ledgerHolds(first, healthy, third, repaid);
            when(submitter.submitAndAwait(any(), any())).thenAnswer(inv -> confirmed(inv.getArgument(0)));
            clock.set(DUE.plusSeconds(1));

            // Act
            CycleReport report = monitor.runCycle().orElseThrow();

            // Assert
            assertThat(report.scanned()).isEqualTo(4);
            assertThat(report.eligible()).isEqualTo(2);
            assertThat(report.settled()).isEqualTo(2);
            InOrder order = inOrder(submitter);
            order.verify(submitter).submitAndAwait(argThat(l -> l.id() == 1), any());
            order.verify(submitter).submitAndAwait(argThat(l -> l.id() == 3), any());
            verify(submitter, never()).submitAndAwait(argThat(l -> l.id() == 2), any());
        }

        @Test
        @DisplayName("a loan whose read fails is counted and the scan continues")
        void perLoanErrorContinues() {
            Loan second = loan(2, LoanStatus.ACTIVE);
            when(gateway.nextLoanId()).thenReturn(3L);
            when(gateway.readLoan(1L)).thenThrow(new IllegalStateException("malformed loan record"));
            when(gateway.readLoan(2L)).thenReturn(Optional.of(second));
            when(submitter.submitAndAwait(any(), any())).thenReturn(confirmed(second));
            clock.set(DUE.plusSeconds(1));

            CycleReport report = monitor.runCycle().orElseThrow();

            assertThat(report.failed()).isEqualTo(1);
            assertThat(report.settled()).isEqualTo(1);
        }

        @Test
        @DisplayName("scans up to the cap when the loan counter is unavailable and stops at an empty slot")
        void fallsBackToCapAndStopsAtEmptySlot() {
            when(gateway.nextLoanId()).thenThrow(new LedgerUnavailableException("nextLoanId", "timeout"));
            when(gateway.readLoan(1L)).thenReturn(Optional.of(loan(1, LoanStatus.ACTIVE)));
            when(gateway.readLoan(2L)).thenReturn(Optional.of(loan(2, LoanStatus.REPAID)));
            monitor = newMonitor(true, 5);

            CycleReport report = monitor.runCycle().orElseThrow();

            assertThat(report.upperBound()).isEqualTo(6L);
            assertThat(report.scanned()).isEqualTo(2);
            verify(gateway).readLoan(3L);
            verify(gateway, never()).readLoan(4L);
        }

        @Test
        @DisplayName("never scans past the cap")
        void capBoundsTheScan() {
            when(gateway.nextLoanId()).thenReturn(1_000L);
            when(gateway.readLoan(anyLong())).thenAnswer(inv -> Optional.of(loan(inv.getArgument(0), LoanStatus.REPAID)));
            monitor = newMonitor(true, 3);

            CycleReport report = monitor.runCycle().orElseThrow();

            assertThat(report.scanned()).isEqualTo(3);
            verify(gateway, never()).readLoan(4L);
        }
    }

    @Nested
    @DisplayName("decisions")
    class Decisions {

        @Test
        @DisplayName("a stale price before the due date leaves the loan alone and is counted")
        void staleValuationFallsBack() {
            ledgerHolds(loan(1, LoanStatus.ACTIVE));
            when(gateway.usdValue(anyInt(), any())).thenThrow(new StaleQuoteException("ETH/USD is 7200s old"));

            CycleReport report = monitor.runCycle().orElseThrow();

            assertThat(report.valuationFallbacks()).isEqualTo(1);
            assertThat(report.eligible()).isZero();
            verify(submitter, never()).submitAndAwait(any(), any());
        }

        @Test
        @DisplayName("collateral under the threshold is settled before the due date")
        void underCollateralized() {
            Loan thin = loan(1, LoanStatus.ACTIVE).withCollateralAmount(BigInteger.valueOf(119));
            ledgerHolds(thin);
            when(submitter.submitAndAwait(any(), any())).thenReturn(confirmed(thin));

            assertThat(monitor.runCycle().orElseThrow().settled()).isEqualTo(1);
        }

        @Test
        @DisplayName("a defaulted loan is submitted again once its ballot has closed, without valuation")
        void closedBallotIsSold() {
            Loan voting = loan(1, LoanStatus.VOTING).withVotingDeadline(DUE.plusSeconds(86400));
            ledgerHolds(voting);
            when(submitter.submitAndAwait(any(), any())).thenReturn(confirmed(voting));
            clock.set(DUE.plusSeconds(3600));

            assertThat(monitor.runCycle().orElseThrow().eligible()).isZero();

            clock.set(DUE.plusSeconds(86401));
            assertThat(monitor.runCycle().orElseThrow().settled()).isEqualTo(1);
            verify(gateway, never()).usdValue(anyInt(), any());
        }

        @Test
        @DisplayName("a ballot decided for a sale is submitted while the window is open")
        void decidedBallotIsSold() {
            Loan voting = loan(1, LoanStatus.VOTING)
                    .withVotingDeadline(DUE.plusSeconds(86400))
                    .withResolution(VoteChoice.LIQUIDATE);
            ledgerHolds(voting);
            when(submitter.submitAndAwait(any(), any())).thenReturn(confirmed(voting));

            assertThat(monitor.runCycle().orElseThrow().settled()).isEqualTo(1);
        }
    }

    @Nested
    @DisplayName("submission")
    class Submission {

        @Test
        @DisplayName("a timed-out settlement is counted and does not stop the scan")
        void timeoutCounted() {
            Loan first = loan(1, LoanStatus.ACTIVE);
            Loan second = loan(2, LoanStatus.ACTIVE);
            ledgerHolds(first, second);
            when(submitter.submitAndAwait(argThat(l -> l != null && l.id() == 1), any()))
                    .thenThrow(new SettlementTimeoutException(1, Duration.ofSeconds(5), null));
            when(submitter.submitAndAwait(argThat(l -> l != null && l.id() == 2), any()))
                    .thenReturn(confirmed(second));
            clock.set(DUE.plusSeconds(1));

            CycleReport report = monitor.runCycle().orElseThrow();

            assertThat(report.timedOut()).isEqualTo(1);
            assertThat(report.settled()).isEqualTo(1);
        }

        @Test
        @DisplayName("a reverted settlement is counted as reverted")
        void revertCounted() {
            Loan first = loan(1, LoanStatus.ACTIVE);
            ledgerHolds(first);
            when(submitter.submitAndAwait(any(), any())).thenReturn(
                    SettlementReceipt.reverted(1, "liquidator", 0, "local:liquidator:0", "VOTE_PENDING: ballot open"));
            clock.set(DUE.plusSeconds(1));

            assertThat(monitor.runCycle().orElseThrow().reverted()).isEqualTo(1);
        }

        @Test
        @DisplayName("a tick that fires during a running cycle is skipped")
        void overlappingTickSkipped() {
            Loan first = loan(1, LoanStatus.ACTIVE);
            ledgerHolds(first);
            AtomicReference<Optional<CycleReport>> nested = new AtomicReference<>();
            when(submitter.submitAndAwait(any(), any())).thenAnswer(inv -> {
                assertThat(monitor.isRunning()).isTrue();
                nested.set(monitor.runCycle());
                return confirmed(first);
            });
            clock.set(DUE.plusSeconds(1));

            Optional<CycleReport> outer = monitor.runCycle();

            assertThat(outer).isPresent();
            assertThat(nested.get()).isEmpty();
            assertThat(monitor.isRunning()).isFalse();
            assertThat(monitor.status().cyclesCompleted()).isEqualTo(1L);
        }
    }

    @Nested
    @DisplayName("connection")
    class Connection {

        @Test
        @DisplayName("waits for the ledger on a fixed delay and recovers")
        void reconnects() {
            doThrow(new LedgerUnavailableException("ping", "connection refused"))
                    .doThrow(new LedgerUnavailableException("ping", "connection refused"))
                    .doNothing()
                    .when(gateway).ping();

            assertThat(monitor.runCycle()).isPresent();

            assertThat(slept).containsExactly(Duration.ofMillis(10), Duration.ofMillis(10));
            assertThat(monitor.status().connectionLost()).isFalse();
        }

        @Test
        @DisplayName("a stopped monitor gives up after one failed probe")
        void stoppedMonitorDoesNotWait() {
            doThrow(new LedgerUnavailableException("ping", "connection refused")).when(gateway).ping();
            monitor.stop();

            assertThat(monitor.runCycle()).isEmpty();
            assertThat(slept).isEmpty();
            assertThat(monitor.status().connectionLost()).isTrue();

            doNothing().when(gateway).ping();
            assertThat(monitor.awaitConnection()).isTrue();
            assertThat(monitor.status().connectionLost()).isFalse();
        }

        @Test
        @DisplayName("a disabled monitor ignores scheduled ticks")
        void disabledIgnoresTicks() {
            monitor = newMonitor(false, 100);

            monitor.tick();

            verify(gateway, never()).ping();
            assertThat(monitor.isActive()).isFalse();
        }
    }
}
