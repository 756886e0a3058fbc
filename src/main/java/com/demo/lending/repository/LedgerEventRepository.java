package com.demo.lending.repository;

import com.demo.lending.domain.LoanEventType;
import com.demo.lending.domain.LoanLifecycleEvent;
import lombok.RequiredArgsConstructor;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.jdbc.support.GeneratedKeyHolder;
import org.springframework.stereotype.Repository;

import java.math.BigInteger;
import java.sql.PreparedStatement;
import java.sql.Statement;
import java.sql.Types;
import java.time.Instant;
import java.util.List;

import static com.demo.lending.repository.SqlValues.*;

/** Append-only lifecycle log. */
@Repository
@RequiredArgsConstructor
public class LedgerEventRepository {

    private final JdbcTemplate jdbc;

    public LoanLifecycleEvent append(long loanId, LoanEventType type, String actor,
                                     BigInteger amount, String detail, Instant at) {
        GeneratedKeyHolder keys = new GeneratedKeyHolder();
        jdbc.update(con -> {
            PreparedStatement ps = con.prepareStatement("""
                INSERT INTO ledger_event (loan_id, event_type, actor, amount, detail, occurred_at)
                VALUES (?, ?, ?, ?, ?, ?)
            """, Statement.RETURN_GENERATED_KEYS);
            ps.setLong(1, loanId);
            ps.setString(2, type.name());
            ps.setString(3, actor);
            if (amount == null) ps.setNull(4, Types.DECIMAL); else ps.setBigDecimal(4, dec(amount));
            ps.setString(5, detail);
            ps.setLong(6, at.getEpochSecond());
            return ps;
        }, keys);
        Number seq = keys.getKey();
        return new LoanLifecycleEvent(seq == null ? -1 : seq.longValue(), loanId, type, actor, amount, detail, at);
    }

    public List<LoanLifecycleEvent> findByLoan(long loanId) {
        return jdbc.query("SELECT * FROM ledger_event WHERE loan_id = ? ORDER BY seq", rm(), loanId);
    }

    private RowMapper<LoanLifecycleEvent> rm() {
        return (rs, i) -> new LoanLifecycleEvent(
                rs.getLong("seq"),
                rs.getLong("loan_id"),
                LoanEventType.valueOf(rs.getString("event_type")),
                rs.getString("actor"),
                amount(rs, "amount"),
                rs.getString("detail"),
                instant(rs, "occurred_at")
        );
    }
}
