package com.demo.lending.web3;

import com.demo.lending.domain.Loan;
import com.demo.lending.domain.Token;
import com.demo.lending.exception.LedgerUnavailableException;
import com.demo.lending.exception.StaleQuoteException;
import com.demo.lending.monitor.LedgerGateway;
import com.demo.lending.monitor.LedgerHealth;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;
import org.web3j.abi.datatypes.Function;
import org.web3j.protocol.Web3j;
import org.web3j.protocol.core.DefaultBlockParameterName;
import org.web3j.protocol.core.methods.request.Transaction;
import org.web3j.protocol.core.methods.response.EthCall;

import java.io.IOException;
import java.math.BigInteger;
import java.time.Clock;
import java.util.Optional;

/** Reads the deployed lending contract over JSON-RPC with {@code eth_call}. */
@Slf4j
@Component
@ConditionalOnProperty(name = "ledger.mode", havingValue = "web3")
public class Web3jLedgerGateway implements LedgerGateway {

    static final String MODE = "web3";

    private final Web3j web3j;
    private final String contract;
    private final Clock clock;

    public Web3jLedgerGateway(Web3j web3j, @Value("${ledger.web3.contract-address}") String contractAddress, Clock clock) {
        this.web3j = web3j;
        this.contract = contractAddress;
        this.clock = clock;
    }

    @Override
    public long nextLoanId() {
        Function f = LoanLedgerAbi.nextLoanId();
        return LoanLedgerAbi.decodeUint(f, call(f, "nextLoanId")).longValueExact();
    }

    @Override
    public Optional<Loan> readLoan(long loanId) {
        return LoanLedgerAbi.decodeLoan(call(LoanLedgerAbi.loans(loanId), "loans(" + loanId + ")"));
    }

    public Token readToken(int tokenId) {
        return LoanLedgerAbi.decodeToken(tokenId, call(LoanLedgerAbi.supportedTokens(tokenId), "supportedTokens(" + tokenId + ")"));
    }

    /** A revert here means the contract's oracle read failed, which counts as a stale quote. */
    @Override
    public BigInteger usdValue(int tokenId, BigInteger rawAmount) {
        Function f = LoanLedgerAbi.calculateUsdValue(tokenId, rawAmount);
        EthCall resp = send(f, "calculateUSDValue");
        if (resp.isReverted() || resp.hasError()) {
            String reason = resp.isReverted() ? resp.getRevertReason() : resp.getError().getMessage();
            throw new StaleQuoteException("calculateUSDValue(" + tokenId + ") reverted: " + reason);
        }
        return LoanLedgerAbi.decodeUint(f, resp.getValue());
    }

    @Override
    public void ping() {
        try {
            web3j.ethBlockNumber().send();
        } catch (IOException ex) {
            throw new LedgerUnavailableException("eth_blockNumber", ex);
        }
    }

    @Override
    public LedgerHealth health(String signer) {
        try {
            long head = web3j.ethBlockNumber().send().getBlockNumber().longValueExact();
            BigInteger balance = web3j.ethGetBalance(signer, DefaultBlockParameterName.LATEST).send().getBalance();
            long nonce = web3j.ethGetTransactionCount(signer, DefaultBlockParameterName.PENDING).send()
                    .getTransactionCount().longValueExact();
            String code = web3j.ethGetCode(contract, DefaultBlockParameterName.LATEST).send().getCode();
            boolean present = code != null && !"0x".equals(code);
            long next = present ? nextLoanId() : -1;
            return new LedgerHealth(MODE, true, head, next, signer, nonce, balance, present,
                    present ? "contract " + contract : "no code at " + contract, clock.instant());
        } catch (IOException | LedgerUnavailableException ex) {
            log.debug("Health check failed: {}", ex.getMessage());
            return LedgerHealth.unreachable(MODE, signer, ex.getMessage(), clock.instant());
        }
    }

    @Override
    public String mode() {
        return MODE;
    }

    String contractAddress() {
        return contract;
    }

    private String call(Function f, String operation) {
        EthCall resp = send(f, operation);
        if (resp.hasError()) {
            throw new LedgerUnavailableException(operation, resp.getError().getMessage());
        }
        if (resp.isReverted()) {
            throw new IllegalStateException(operation + " reverted: " + resp.getRevertReason());
        }
        return resp.getValue();
    }

    private EthCall send(Function f, String operation) {
        try {
            return web3j.ethCall(
                    Transaction.createEthCallTransaction(null, contract, LoanLedgerAbi.encode(f)),
                    DefaultBlockParameterName.LATEST).send();
        } catch (IOException ex) {
            throw new LedgerUnavailableException(operation, ex);
        }
    }
}
