package com.demo.lending.monitor;

import com.demo.lending.domain.Loan;
import com.demo.lending.domain.SettlementReceipt;

import java.time.Duration;

/**
 * Submits the settlement call for one loan with the monitor's signing account and blocks
 * until the ledger has accepted it, so the account's sequence has advanced before the
 * next submission. Implementations allow one call in flight at a time.
 *
 * @throws com.demo.lending.exception.SettlementTimeoutException when no confirmation
 *         arrives within {@code timeout}
 */
public interface SettlementSubmitter {

    String signerAddress();

    SettlementReceipt submitAndAwait(Loan loan, Duration timeout);
}
