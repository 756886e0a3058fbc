package com.demo.lending.monitor;

import com.demo.lending.domain.Loan;

import java.math.BigInteger;
import java.util.Optional;

/**
 * The monitor's read side of the ledger. Transport failures surface as
 * {@link com.demo.lending.exception.LedgerUnavailableException}; a price that cannot be
 * trusted surfaces as {@link com.demo.lending.exception.StaleQuoteException}.
 */
public interface LedgerGateway {

    /** Id the next created loan will get; loans below it exist. */
    long nextLoanId();

    /** Empty when the slot holds no loan (zero borrower). */
    Optional<Loan> readLoan(long loanId);

    BigInteger usdValue(int tokenId, BigInteger rawAmount);

    /** Cheap reachability probe; throws when the ledger cannot be reached. */
    void ping();

    /** Read-only; safe to call while a scan is running. */
    LedgerHealth health(String signer);

    String mode();
}
