package com.demo.lending.repository;

import lombok.RequiredArgsConstructor;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Repository;

/**
 * Monotonic counters: the next loan id, and each signing account's next expected
 * call sequence. Only the ledger's write path touches them.
 */
@Repository
@RequiredArgsConstructor
public class SequenceRepository {

    private static final String LOAN_COUNTER = "loan";

    private final JdbcTemplate jdbc;

    public long peekNextLoanId() {
        return jdbc.queryForList("SELECT next_value FROM ledger_counter WHERE counter_name = ?", Long.class, LOAN_COUNTER)
                .stream().findFirst().orElse(1L);
    }

    public long allocateLoanId() {
        long id = peekNextLoanId();
        int updated = jdbc.update("UPDATE ledger_counter SET next_value = ? WHERE counter_name = ?", id + 1, LOAN_COUNTER);
        if (updated == 0) {
            jdbc.update("INSERT INTO ledger_counter (counter_name, next_value) VALUES (?, ?)", LOAN_COUNTER, id + 1);
        }
        return id;
    }

    public long nextSequence(String account) {
        return jdbc.queryForList("SELECT next_sequence FROM account_sequence WHERE account = ?", Long.class, account)
                .stream().findFirst().orElse(0L);
    }

    public void advance(String account, long consumed) {
        int updated = jdbc.update("UPDATE account_sequence SET next_sequence = ? WHERE account = ?", consumed + 1, account);
        if (updated == 0) {
            jdbc.update("INSERT INTO account_sequence (account, next_sequence) VALUES (?, ?)", account, consumed + 1);
        }
    }
}
