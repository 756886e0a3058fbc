package com.demo.lending.monitor;

import com.demo.lending.domain.Loan;
import com.demo.lending.domain.LoanStatus;
import com.demo.lending.domain.SettlementReceipt;
import com.demo.lending.exception.LedgerUnavailableException;
import com.demo.lending.exception.SettlementTimeoutException;
import com.demo.lending.service.liquidation.LiquidationDecisionEngine;
import com.demo.lending.service.liquidation.LiquidationVerdict;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Periodically scans the ledger for loans due for settlement and settles them one at a
 * time. A tick that fires while a cycle is still running is skipped.
 */
@Slf4j
@Component
public class LiquidationMonitor {

    private final LedgerGateway gateway;
    private final SettlementSubmitter submitter;
    private final LiquidationDecisionEngine decisions;
    private final RetryPolicy retry;
    private final RetryPolicy.Sleeper sleeper;
    private final Clock clock;
    private final int scanCap;
    private final Duration settlementTimeout;
    private final Duration reconnectDelay;

    private final AtomicBoolean active = new AtomicBoolean();
    private final AtomicBoolean running = new AtomicBoolean();
    private final AtomicBoolean connectionLost = new AtomicBoolean();
    private final AtomicLong cycles = new AtomicLong();
    private final AtomicReference<CycleReport> lastReport = new AtomicReference<>();

    public LiquidationMonitor(LedgerGateway gateway,
                              SettlementSubmitter submitter,
                              LiquidationDecisionEngine decisions,
                              RetryPolicy retry,
                              RetryPolicy.Sleeper sleeper,
                              Clock clock,
                              @Value("${monitor.enabled:true}") boolean enabled,
                              @Value("${monitor.scan-cap:100}") int scanCap,
                              @Value("${monitor.settlement-timeout-ms:60000}") long settlementTimeoutMs,
                              @Value("${monitor.reconnect-delay-ms:5000}") long reconnectDelayMs) {
        this.gateway = gateway;
        this.submitter = submitter;
        this.decisions = decisions;
        this.retry = retry;
        this.sleeper = sleeper;
        this.clock = clock;
        this.scanCap = scanCap;
        this.settlementTimeout = Duration.ofMillis(settlementTimeoutMs);
        this.reconnectDelay = Duration.ofMillis(reconnectDelayMs);
        this.active.set(enabled);
        log.info("Liquidation monitor {} (ledger={}, signer={}, cap={})",
                enabled ? "enabled" : "disabled", gateway.mode(), submitter.signerAddress(), scanCap);
    }

    @Scheduled(fixedRateString = "${monitor.interval-ms:10000}", initialDelayString = "${monitor.initial-delay-ms:5000}")
    public void tick() {
        if (!active.get()) return;
        runCycle();
    }

    /** Runs one scan unless one is already in progress. Never throws. */
    public Optional<CycleReport> runCycle() {
        if (!running.compareAndSet(false, true)) {
            log.debug("Previous liquidation cycle still running, skipping tick");
            return Optional.empty();
        }
        try {
            if (!awaitConnection()) {
                return Optional.empty();
            }
            CycleReport report = scan();
            lastReport.set(report);
            cycles.incrementAndGet();
            if (report.eligible() > 0 || report.failed() > 0) {
                log.info("Liquidation cycle: scanned={} eligible={} settled={} reverted={} timedOut={} failed={}",
                        report.scanned(), report.eligible(), report.settled(), report.reverted(),
                        report.timedOut(), report.failed());
            }
            return Optional.of(report);
        } catch (RuntimeException ex) {
            log.error("Liquidation cycle aborted", ex);
            return Optional.empty();
        } finally {
            running.set(false);
        }
    }

    /**
     * Blocks until the ledger answers. Keeps retrying on a fixed delay while the monitor is
     * active; a manual check on a stopped monitor tries once. Only the first failure of an
     * outage is logged at warn.
     */
    boolean awaitConnection() {
        while (true) {
            try {
                gateway.ping();
                if (connectionLost.compareAndSet(true, false)) {
                    log.info("Ledger connection restored");
                }
                return true;
            } catch (LedgerUnavailableException ex) {
                if (connectionLost.compareAndSet(false, true)) {
                    log.warn("Ledger unreachable, waiting to reconnect: {}", ex.getMessage());
                } else {
                    log.debug("Ledger still unreachable: {}", ex.getMessage());
                }
                if (!active.get()) {
                    return false;
                }
                try {
                    sleeper.sleep(reconnectDelay);
                } catch (InterruptedException ie) {
                    Thread.currentThread().interrupt();
                    return false;
                }
            }
        }
    }

    private CycleReport scan() {
        Instant startedAt = clock.instant();
        long upper = scanUpperBound();
        Tally tally = new Tally();
        for (long id = 1; id < upper; id++) {
            final long loanId = id;
            Optional<Loan> read;
            try {
                read = retry.call("loans(" + loanId + ")", () -> gateway.readLoan(loanId));
            } catch (RuntimeException ex) {
                log.warn("Loan {}: read failed: {}", loanId, ex.getMessage());
                tally.failed++;
                continue;
            }
            if (read.isEmpty()) {
                if (loanId > 1) break;
                continue;
            }
            Loan loan = read.get();
            tally.scanned++;
            if (loan.status() != LoanStatus.ACTIVE && loan.status() != LoanStatus.VOTING) continue;
            try {
                check(loan, tally);
            } catch (RuntimeException ex) {
                log.warn("Loan {}: check failed: {}", loanId, ex.getMessage());
                tally.failed++;
            }
        }
        return new CycleReport(startedAt, clock.instant(), upper, tally.scanned, tally.eligible, tally.settled,
                tally.reverted, tally.timedOut, tally.failed, tally.fallbacks);
    }

    private long scanUpperBound() {
        long cap = scanCap + 1L;
        try {
            return Math.min(retry.call("nextLoanId", gateway::nextLoanId), cap);
        } catch (LedgerUnavailableException ex) {
            log.debug("nextLoanId unavailable, scanning up to the cap: {}", ex.getMessage());
            return cap;
        }
    }

    private void check(Loan loan, Tally tally) {
        Instant now = clock.instant();
        String why;
        if (loan.status() == LoanStatus.VOTING && loan.votingDeadline() != null) {
            if (!loan.isAwaitingSale(now)) return;
            why = loan.resolution() != null ? "lenders chose " + loan.resolution() : "ballot closed undecided";
        } else {
            LiquidationVerdict verdict = decisions.assess(loan, now,
                    (tokenId, amount) -> retry.call("usdValue", () -> gateway.usdValue(tokenId, amount)));
            if (!verdict.valued()) tally.fallbacks++;
            if (!verdict.liquidatable()) return;
            why = verdict.describe();
        }
        tally.eligible++;
        log.info("Loan {} ({}) due for settlement: {}", loan.id(), loan.status(), why);
        try {
            SettlementReceipt receipt = submitter.submitAndAwait(loan, settlementTimeout);
            if (receipt.success()) {
                tally.settled++;
                log.info("Loan {} settled -> {} ({})", loan.id(), receipt.outcome(), receipt.txRef());
            } else {
                tally.reverted++;
                log.warn("Loan {} settlement reverted: {}", loan.id(), receipt.revertReason());
            }
        } catch (SettlementTimeoutException ex) {
            tally.timedOut++;
            log.warn("{}; will re-check next cycle", ex.getMessage());
        }
    }

    public void start() {
        if (active.compareAndSet(false, true)) {
            log.info("Liquidation monitor started");
        }
    }

    public void stop() {
        if (active.compareAndSet(true, false)) {
            log.info("Liquidation monitor stopped");
        }
    }

    public boolean isActive() {
        return active.get();
    }

    public boolean isRunning() {
        return running.get();
    }

    public Optional<CycleReport> lastReport() {
        return Optional.ofNullable(lastReport.get());
    }

    public MonitorStatus status() {
        return new MonitorStatus(active.get(), running.get(), cycles.get(), submitter.signerAddress(),
                gateway.mode(), connectionLost.get(), lastReport.get());
    }

    public LedgerHealth health() {
        return gateway.health(submitter.signerAddress());
    }

    private static final class Tally {
        int scanned;
        int eligible;
        int settled;
        int reverted;
        int timedOut;
        int failed;
        int fallbacks;
    }
}
