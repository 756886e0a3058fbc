package com.demo.lending.repository;

import com.demo.lending.exception.LendingException;
import com.demo.lending.exception.LendingException.Reason;
import lombok.RequiredArgsConstructor;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Repository;

import java.math.BigDecimal;
import java.math.BigInteger;

import static com.demo.lending.repository.SqlValues.dec;

/** Holder balances and the allowances owners grant the ledger for fungible tokens. */
@Repository
@RequiredArgsConstructor
public class BalanceRepository {

    private final JdbcTemplate jdbc;

    public BigInteger balanceOf(String holder, int tokenId) {
        return read("SELECT amount FROM balance WHERE holder = ? AND token_id = ?", holder, tokenId);
    }

    public void credit(String holder, int tokenId, BigInteger amount) {
        int updated = jdbc.update("UPDATE balance SET amount = amount + ? WHERE holder = ? AND token_id = ?",
                dec(amount), holder, tokenId);
        if (updated == 0) {
            jdbc.update("INSERT INTO balance (holder, token_id, amount) VALUES (?, ?, ?)", holder, tokenId, dec(amount));
        }
    }

    public void debit(String holder, int tokenId, BigInteger amount) {
        int updated = jdbc.update("""
            UPDATE balance SET amount = amount - ? WHERE holder = ? AND token_id = ? AND amount >= ?
        """, dec(amount), holder, tokenId, dec(amount));
        if (updated == 0) {
            throw new LendingException(Reason.INSUFFICIENT_BALANCE,
                    holder + " holds less than " + amount + " of token " + tokenId);
        }
    }

    public BigInteger allowanceOf(String owner, int tokenId) {
        return read("SELECT amount FROM allowance WHERE owner = ? AND token_id = ?", owner, tokenId);
    }

    public void setAllowance(String owner, int tokenId, BigInteger amount) {
        int updated = jdbc.update("UPDATE allowance SET amount = ? WHERE owner = ? AND token_id = ?",
                dec(amount), owner, tokenId);
        if (updated == 0) {
            jdbc.update("INSERT INTO allowance (owner, token_id, amount) VALUES (?, ?, ?)", owner, tokenId, dec(amount));
        }
    }

    public void spendAllowance(String owner, int tokenId, BigInteger amount) {
        int updated = jdbc.update("""
            UPDATE allowance SET amount = amount - ? WHERE owner = ? AND token_id = ? AND amount >= ?
        """, dec(amount), owner, tokenId, dec(amount));
        if (updated == 0) {
            throw new LendingException(Reason.INSUFFICIENT_ALLOWANCE,
                    owner + " has not approved " + amount + " of token " + tokenId);
        }
    }

    private BigInteger read(String sql, String who, int tokenId) {
        return jdbc.queryForList(sql, BigDecimal.class, who, tokenId).stream()
                .findFirst()
                .map(BigDecimal::toBigIntegerExact)
                .orElse(BigInteger.ZERO);
    }
}
