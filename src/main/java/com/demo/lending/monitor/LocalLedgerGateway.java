package com.demo.lending.monitor;

import com.demo.lending.domain.Loan;
import com.demo.lending.exception.LedgerUnavailableException;
import com.demo.lending.service.AssetVault;
import com.demo.lending.service.LoanQueryService;
import com.demo.lending.service.SettlementService;
import com.demo.lending.service.TokenRegistry;
import com.demo.lending.service.valuation.ValuationEngine;
import lombok.RequiredArgsConstructor;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.dao.DataAccessException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Component;

import java.math.BigInteger;
import java.time.Clock;
import java.util.Optional;
import java.util.function.Supplier;

/** Reads the in-process ledger. Database errors are transport errors from the monitor's point of view. */
@Component
@RequiredArgsConstructor
@ConditionalOnProperty(name = "ledger.mode", havingValue = "local", matchIfMissing = true)
public class LocalLedgerGateway implements LedgerGateway {

    static final String MODE = "local";

    private final LoanQueryService queries;
    private final ValuationEngine valuation;
    private final SettlementService settlement;
    private final AssetVault vault;
    private final TokenRegistry tokens;
    private final JdbcTemplate jdbc;
    private final Clock clock;

    @Override
    public long nextLoanId() {
        return guarded("nextLoanId", queries::nextLoanId);
    }

    @Override
    public Optional<Loan> readLoan(long loanId) {
        return guarded("loans(" + loanId + ")", () -> queries.findLoan(loanId));
    }

    @Override
    public BigInteger usdValue(int tokenId, BigInteger rawAmount) {
        return guarded("usdValue", () -> valuation.usdValueOf(tokenId, rawAmount));
    }

    @Override
    public void ping() {
        guarded("ping", () -> jdbc.queryForObject("SELECT 1", Integer.class));
    }

    @Override
    public LedgerHealth health(String signer) {
        try {
            long next = nextLoanId();
            BigInteger balance = tokens.exists(0) ? vault.balanceOf(signer, 0) : BigInteger.ZERO;
            return new LedgerHealth(MODE, true, next - 1, next, signer, settlement.nextSequence(signer),
                    balance, true, "in-process ledger", clock.instant());
        } catch (LedgerUnavailableException ex) {
            return LedgerHealth.unreachable(MODE, signer, ex.getMessage(), clock.instant());
        }
    }

    @Override
    public String mode() {
        return MODE;
    }

    private static <T> T guarded(String operation, Supplier<T> read) {
        try {
            return read.get();
        } catch (DataAccessException ex) {
            throw new LedgerUnavailableException(operation, ex);
        }
    }
}
