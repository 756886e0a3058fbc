package com.demo.lending.service;

import com.demo.lending.domain.Addresses;
import com.demo.lending.domain.Token;
import com.demo.lending.domain.TokenKind;
import com.demo.lending.exception.LendingException;
import com.demo.lending.exception.LendingException.Reason;
import com.demo.lending.repository.BalanceRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.math.BigInteger;

/** Asset balances on the ledger, including the escrow account loans lock value in. */
@Slf4j
@Component
@RequiredArgsConstructor
public class AssetVault {

    private final BalanceRepository balances;
    private final TokenRegistry tokens;
    private final LedgerWriter writer;

    @Value("${lending.escrow-address:ledger-escrow}")
    private String escrowAddress;

    /** Payer → escrow. Caller must already be inside a ledger write. */
    void collect(Token token, String payer, BigInteger amount) {
        if (amount.signum() == 0) return;
        TransferStrategy.of(token.kind()).collect(balances, token.id(), payer, escrow(), amount);
    }

    /** Escrow → payee. Caller must already be inside a ledger write. */
    void release(Token token, String payee, BigInteger amount) {
        if (amount.signum() == 0) return;
        TransferStrategy.of(token.kind()).release(balances, token.id(), escrow(), payee, amount);
    }

    /** Test and demo funding. */
    public BigInteger faucet(String holder, int tokenId, BigInteger amount) {
        requirePositive(amount);
        String who = Addresses.normalize(holder);
        return writer.write(() -> {
            tokens.get(tokenId);
            balances.credit(who, tokenId, amount);
            log.info("Faucet credited {} of token {} to {}", amount, tokenId, who);
            return balances.balanceOf(who, tokenId);
        });
    }

    /** Sets (not adds to) the amount of a fungible token the ledger may pull from {@code owner}. */
    public void approve(String owner, int tokenId, BigInteger amount) {
        if (amount == null || amount.signum() < 0) {
            throw new LendingException(Reason.INVALID_AMOUNT, "Allowance must be zero or positive");
        }
        String who = Addresses.normalize(owner);
        writer.run(() -> {
            Token t = tokens.get(tokenId);
            if (t.kind() == TokenKind.NATIVE) {
                throw new LendingException(Reason.INVALID_REQUEST, "Native " + t.symbol() + " is attached, not approved");
            }
            balances.setAllowance(who, tokenId, amount);
        });
    }

    public BigInteger balanceOf(String holder, int tokenId) {
        return balances.balanceOf(Addresses.normalize(holder), tokenId);
    }

    public BigInteger allowanceOf(String owner, int tokenId) {
        return balances.allowanceOf(Addresses.normalize(owner), tokenId);
    }

    public String escrow() {
        return Addresses.normalize(escrowAddress);
    }

    private static void requirePositive(BigInteger amount) {
        if (amount == null || amount.signum() <= 0) {
            throw new LendingException(Reason.INVALID_AMOUNT, "Amount must be positive");
        }
    }
}
