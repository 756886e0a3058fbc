package com.demo.lending.monitor;

import com.demo.lending.domain.Addresses;
import com.demo.lending.domain.Loan;
import com.demo.lending.domain.LoanStatus;
import com.demo.lending.domain.SettlementReceipt;
import com.demo.lending.domain.Token;
import com.demo.lending.domain.TokenKind;
import com.demo.lending.exception.LedgerUnavailableException;
import com.demo.lending.exception.SettlementTimeoutException;
import com.demo.lending.service.AssetVault;
import com.demo.lending.service.SettlementService;
import com.demo.lending.service.TokenRegistry;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Signs settlement calls against the in-process ledger as the liquidator account. Calls
 * run on one dedicated thread and each reads the account's sequence when it starts, so a
 * call that outlives its wait still never shares a sequence with the next one.
 */
@Slf4j
@Component
@ConditionalOnProperty(name = "ledger.mode", havingValue = "local", matchIfMissing = true)
public class LocalSettlementSubmitter implements SettlementSubmitter {

    private final SettlementService settlement;
    private final AssetVault vault;
    private final TokenRegistry tokens;
    private final String signer;
    private final ReentrantLock signerLock = new ReentrantLock();
    private final ExecutorService executor = Executors.newSingleThreadExecutor(r -> {
        Thread t = new Thread(r, "settlement-signer");
        t.setDaemon(true);
        return t;
    });

    public LocalSettlementSubmitter(SettlementService settlement, AssetVault vault, TokenRegistry tokens,
                                    @Value("${monitor.liquidator-address:liquidator}") String signer) {
        this.settlement = settlement;
        this.vault = vault;
        this.tokens = tokens;
        this.signer = Addresses.normalize(signer);
    }

    @Override
    public String signerAddress() {
        return signer;
    }

    @Override
    public SettlementReceipt submitAndAwait(Loan loan, Duration timeout) {
        signerLock.lock();
        try {
            Future<SettlementReceipt> call = executor.submit(() -> sign(loan));
            try {
                return call.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
            } catch (TimeoutException ex) {
                throw new SettlementTimeoutException(loan.id(), timeout, ex);
            } catch (InterruptedException ex) {
                Thread.currentThread().interrupt();
                throw new SettlementTimeoutException(loan.id(), timeout, ex);
            } catch (ExecutionException ex) {
                Throwable cause = ex.getCause();
                if (cause instanceof DataAccessException) {
                    throw new LedgerUnavailableException("liquidate(" + loan.id() + ")", cause);
                }
                if (cause instanceof RuntimeException) {
                    throw (RuntimeException) cause;
                }
                throw new LedgerUnavailableException("liquidate(" + loan.id() + ")", cause);
            }
        } finally {
            signerLock.unlock();
        }
    }

    private SettlementReceipt sign(Loan loan) {
        Token loanToken = tokens.get(loan.loanTokenId());
        if (loan.status() == LoanStatus.VOTING && loanToken.kind() == TokenKind.FUNGIBLE) {
            vault.approve(signer, loanToken.id(), loan.outstanding());
        }
        long sequence = settlement.nextSequence(signer);
        SettlementReceipt receipt = settlement.liquidate(loan.id(), signer, sequence);
        log.debug("Loan {}: settlement seq {} -> {}", loan.id(), sequence, receipt.success() ? receipt.outcome() : receipt.revertReason());
        return receipt;
    }

    @PreDestroy
    void shutdown() {
        executor.shutdownNow();
    }
}
