package com.demo.lending.service;

import com.demo.lending.domain.TokenKind;
import com.demo.lending.repository.BalanceRepository;

import java.math.BigInteger;

/**
 * How value moves into escrow for each asset kind. Native value is attached to the
 * call and debited directly; fungible tokens are pulled against an allowance the
 * payer granted the ledger beforehand.
 */
public enum TransferStrategy {

    NATIVE {
        @Override
        void collect(BalanceRepository balances, int tokenId, String payer, String escrow, BigInteger amount) {
            balances.debit(payer, tokenId, amount);
            balances.credit(escrow, tokenId, amount);
        }
    },

    FUNGIBLE {
        @Override
        void collect(BalanceRepository balances, int tokenId, String payer, String escrow, BigInteger amount) {
            balances.spendAllowance(payer, tokenId, amount);
            balances.debit(payer, tokenId, amount);
            balances.credit(escrow, tokenId, amount);
        }
    };

    abstract void collect(BalanceRepository balances, int tokenId, String payer, String escrow, BigInteger amount);

    void release(BalanceRepository balances, int tokenId, String escrow, String payee, BigInteger amount) {
        balances.debit(escrow, tokenId, amount);
        balances.credit(payee, tokenId, amount);
    }

    public static TransferStrategy of(TokenKind kind) {
        return kind == TokenKind.NATIVE ? NATIVE : FUNGIBLE;
    }
}
