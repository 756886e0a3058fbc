package com.demo.lending.repository;

import com.demo.lending.domain.Vote;
import com.demo.lending.domain.VoteChoice;
import lombok.RequiredArgsConstructor;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Repository;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.List;

import static com.demo.lending.repository.SqlValues.*;

@Repository
@RequiredArgsConstructor
public class VoteRepository {

    private final JdbcTemplate jdbc;

    public boolean exists(long loanId, String lender) {
        Integer n = jdbc.queryForObject(
                "SELECT COUNT(*) FROM vote WHERE loan_id = ? AND lender = ?", Integer.class, loanId, lender);
        return n != null && n > 0;
    }

    public void insert(Vote v) {
        jdbc.update("""
            INSERT INTO vote (loan_id, lender, choice, weight, cast_at) VALUES (?, ?, ?, ?, ?)
        """, v.loanId(), v.lender(), v.choice().name(), dec(v.weight()), epoch(v.castAt()));
    }

    public BigInteger weightFor(long loanId, VoteChoice choice) {
        BigDecimal sum = jdbc.queryForObject(
                "SELECT COALESCE(SUM(weight), 0) FROM vote WHERE loan_id = ? AND choice = ?",
                BigDecimal.class, loanId, choice.name());
        return sum == null ? BigInteger.ZERO : sum.toBigIntegerExact();
    }

    public List<Vote> findByLoan(long loanId) {
        return jdbc.query("SELECT * FROM vote WHERE loan_id = ? ORDER BY cast_at, lender", rm(), loanId);
    }

    private RowMapper<Vote> rm() {
        return (rs, i) -> new Vote(
                rs.getLong("loan_id"),
                rs.getString("lender"),
                VoteChoice.valueOf(rs.getString("choice")),
                amount(rs, "weight"),
                instant(rs, "cast_at")
        );
    }
}
