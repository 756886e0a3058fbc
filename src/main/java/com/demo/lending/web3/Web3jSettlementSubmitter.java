package com.demo.lending.web3;

import com.demo.lending.domain.Loan;
import com.demo.lending.domain.LoanStatus;
import com.demo.lending.domain.SettlementReceipt;
import com.demo.lending.domain.Token;
import com.demo.lending.domain.TokenKind;
import com.demo.lending.exception.LedgerUnavailableException;
import com.demo.lending.exception.SettlementTimeoutException;
import com.demo.lending.monitor.SettlementSubmitter;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;
import org.web3j.crypto.Credentials;
import org.web3j.protocol.Web3j;
import org.web3j.protocol.core.methods.response.EthSendTransaction;
import org.web3j.protocol.core.methods.response.TransactionReceipt;
import org.web3j.protocol.exceptions.TransactionException;
import org.web3j.tx.RawTransactionManager;
import org.web3j.tx.TransactionManager;
import org.web3j.tx.response.PollingTransactionReceiptProcessor;

import java.io.IOException;
import java.math.BigInteger;
import java.time.Duration;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Signs {@code liquidate(uint256)} with the liquidator key and waits for the receipt. The
 * signer lock keeps one transaction in flight, so each transaction's nonce is read only
 * after the previous one was mined.
 */
@Slf4j
@Component
@ConditionalOnProperty(name = "ledger.mode", havingValue = "web3")
public class Web3jSettlementSubmitter implements SettlementSubmitter {

    private final Web3j web3j;
    private final Credentials credentials;
    private final Web3jLedgerGateway gateway;
    private final ReentrantLock signerLock = new ReentrantLock();

    @Value("${ledger.web3.chain-id:31337}")
    private long chainId;

    @Value("${ledger.web3.gas-limit:1000000}")
    private long gasLimit;

    @Value("${ledger.web3.poll-interval-ms:1000}")
    private long pollIntervalMs;

    public Web3jSettlementSubmitter(Web3j web3j, Credentials credentials, Web3jLedgerGateway gateway) {
        this.web3j = web3j;
        this.credentials = credentials;
        this.gateway = gateway;
    }

    @Override
    public String signerAddress() {
        return credentials.getAddress();
    }

    @Override
    public SettlementReceipt submitAndAwait(Loan loan, Duration timeout) {
        signerLock.lock();
        try {
            PollingTransactionReceiptProcessor receipts = receiptProcessor(timeout);
            TransactionManager tx = new RawTransactionManager(web3j, credentials, chainId, receipts);
            BigInteger gasPrice = web3j.ethGasPrice().send().getGasPrice();
            BigInteger owed = loan.outstanding();
            BigInteger value = BigInteger.ZERO;
            if (loan.status() == LoanStatus.VOTING) {
                Token token = gateway.readToken(loan.loanTokenId());
                if (token.kind() == TokenKind.NATIVE) {
                    value = owed;
                } else {
                    EthSendTransaction sent = tx.sendTransaction(gasPrice, BigInteger.valueOf(gasLimit),
                            token.assetRef(), LoanLedgerAbi.encode(LoanLedgerAbi.approve(gateway.contractAddress(), owed)),
                            BigInteger.ZERO);
                    if (sent.hasError()) {
                        return rejected(loan, "approve rejected: " + sent.getError().getMessage());
                    }
                    TransactionReceipt approval = receipts.waitForTransactionReceipt(sent.getTransactionHash());
                    if (!approval.isStatusOK()) {
                        return SettlementReceipt.reverted(loan.id(), signerAddress(), nonceOf(approval),
                                approval.getTransactionHash(), "approve reverted: " + approval.getRevertReason());
                    }
                }
            }
            EthSendTransaction sent = tx.sendTransaction(gasPrice, BigInteger.valueOf(gasLimit),
                    gateway.contractAddress(), LoanLedgerAbi.encode(LoanLedgerAbi.liquidate(loan.id())), value);
            if (sent.hasError()) {
                return rejected(loan, sent.getError().getMessage());
            }
            TransactionReceipt receipt = receipts.waitForTransactionReceipt(sent.getTransactionHash());
            long nonce = nonceOf(receipt);
            if (!receipt.isStatusOK()) {
                return SettlementReceipt.reverted(loan.id(), signerAddress(), nonce,
                        receipt.getTransactionHash(), receipt.getRevertReason());
            }
            LoanStatus outcome = gateway.readLoan(loan.id()).map(Loan::status).orElse(null);
            log.info("Loan {}: liquidate mined in {} (block {})", loan.id(), receipt.getTransactionHash(), receipt.getBlockNumber());
            return SettlementReceipt.confirmed(loan.id(), signerAddress(), nonce, receipt.getTransactionHash(), outcome);
        } catch (TransactionException ex) {
            throw new SettlementTimeoutException(loan.id(), timeout, ex);
        } catch (IOException ex) {
            throw new LedgerUnavailableException("liquidate(" + loan.id() + ")", ex);
        } finally {
            signerLock.unlock();
        }
    }

    private PollingTransactionReceiptProcessor receiptProcessor(Duration timeout) {
        int attempts = (int) Math.max(1, timeout.toMillis() / pollIntervalMs);
        return new PollingTransactionReceiptProcessor(web3j, pollIntervalMs, attempts);
    }

    /** Refused by the node before mining; no nonce was used. */
    private SettlementReceipt rejected(Loan loan, String reason) {
        log.warn("Loan {}: transaction rejected by node: {}", loan.id(), reason);
        return SettlementReceipt.reverted(loan.id(), signerAddress(), -1, null, reason);
    }

    // Receipts do not carry the nonce; fetch it from the mined transaction.
    private long nonceOf(TransactionReceipt receipt) throws IOException {
        return web3j.ethGetTransactionByHash(receipt.getTransactionHash()).send().getTransaction()
                .map(t -> t.getNonce().longValueExact())
                .orElse(-1L);
    }
}
