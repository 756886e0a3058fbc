package com.demo.lending.repository;

import com.demo.lending.domain.Contribution;
import lombok.RequiredArgsConstructor;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Repository;

import java.math.BigInteger;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

import static com.demo.lending.repository.SqlValues.*;

@Repository
@RequiredArgsConstructor
public class ContributionRepository {

    private final JdbcTemplate jdbc;

    /** Ordered by first contribution. */
    public List<Contribution> findByLoan(long loanId) {
        return jdbc.query("SELECT * FROM contribution WHERE loan_id = ? ORDER BY seq_no", rm(), loanId);
    }

    public Optional<Contribution> find(long loanId, String lender) {
        return jdbc.query("SELECT * FROM contribution WHERE loan_id = ? AND lender = ?", rm(), loanId, lender)
                .stream().findFirst();
    }

    /** Adds to an existing stake or opens a new one at the next position. */
    public Contribution add(long loanId, String lender, BigInteger amount, Instant at) {
        int updated = jdbc.update("""
            UPDATE contribution SET amount = amount + ?, updated_at = ?
            WHERE loan_id = ? AND lender = ?
        """, dec(amount), epoch(at), loanId, lender);
        if (updated == 0) {
            Integer next = jdbc.queryForObject(
                    "SELECT COALESCE(MAX(seq_no) + 1, 0) FROM contribution WHERE loan_id = ?", Integer.class, loanId);
            jdbc.update("""
                INSERT INTO contribution (loan_id, lender, amount, updated_at, seq_no, refunded)
                VALUES (?, ?, ?, ?, ?, FALSE)
            """, loanId, lender, dec(amount), epoch(at), next);
        }
        return find(loanId, lender).orElseThrow();
    }

    public boolean markRefunded(long loanId, String lender) {
        return jdbc.update("""
            UPDATE contribution SET refunded = TRUE WHERE loan_id = ? AND lender = ? AND refunded = FALSE
        """, loanId, lender) == 1;
    }

    public BigInteger totalFor(long loanId) {
        var sum = jdbc.queryForObject(
                "SELECT COALESCE(SUM(amount), 0) FROM contribution WHERE loan_id = ?", java.math.BigDecimal.class, loanId);
        return sum == null ? BigInteger.ZERO : sum.toBigIntegerExact();
    }

    private RowMapper<Contribution> rm() {
        return (rs, i) -> new Contribution(
                rs.getLong("loan_id"),
                rs.getString("lender"),
                amount(rs, "amount"),
                instant(rs, "updated_at"),
                rs.getInt("seq_no"),
                rs.getBoolean("refunded")
        );
    }
}
