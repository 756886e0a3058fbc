package com.demo.lending.repository;

import com.demo.lending.domain.Loan;
import com.demo.lending.domain.LoanStatus;
import com.demo.lending.domain.VoteChoice;
import lombok.RequiredArgsConstructor;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Repository;

import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;

import static com.demo.lending.repository.SqlValues.*;

@Repository
@RequiredArgsConstructor
public class LoanRepository {

    private final JdbcTemplate jdbc;

    public Optional<Loan> find(long id) {
        return jdbc.query("SELECT * FROM loan WHERE id = ?", rm(), id).stream().findFirst();
    }

    public List<Long> findIdsByStatus(Collection<LoanStatus> statuses) {
        if (statuses.isEmpty()) return List.of();
        String in = statuses.stream().map(s -> "'" + s.name() + "'").collect(Collectors.joining(","));
        return jdbc.queryForList("SELECT id FROM loan WHERE status IN (" + in + ") ORDER BY id", Long.class);
    }

    public void insert(Loan l) {
        jdbc.update("""
            INSERT INTO loan (id, borrower, loan_token_id, collateral_token_id, principal, collateral_amount,
                              interest_rate_bps, duration_secs, min_contribution, funding_period_secs,
                              created_at, funded_at, due_date, status, amount_funded, risk_score,
                              collateral_claimed, document_ref, voting_deadline, resolution)
            VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?)
        """,
                l.id(), l.borrower(), l.loanTokenId(), l.collateralTokenId(), dec(l.principal()),
                dec(l.collateralAmount()), l.interestRateBps(), l.durationSecs(), dec(l.minContribution()),
                l.fundingPeriodSecs(), epoch(l.createdAt()), epoch(l.fundedAt()), epoch(l.dueDate()),
                l.status().name(), dec(l.amountFunded()), l.riskScore(), l.collateralClaimed(),
                l.documentRef(), epoch(l.votingDeadline()), l.resolution() == null ? null : l.resolution().name());
    }

    /**
     * Writes the mutable part of the record. The {@code expected} status acts as a
     * compare-and-set guard: zero rows updated means someone else moved the loan first.
     */
    public boolean update(Loan l, LoanStatus expected) {
        int n = jdbc.update("""
            UPDATE loan SET funded_at = ?, due_date = ?, status = ?, amount_funded = ?,
                            collateral_claimed = ?, voting_deadline = ?, resolution = ?
            WHERE id = ? AND status = ?
        """,
                epoch(l.fundedAt()), epoch(l.dueDate()), l.status().name(), dec(l.amountFunded()),
                l.collateralClaimed(), epoch(l.votingDeadline()),
                l.resolution() == null ? null : l.resolution().name(),
                l.id(), expected.name());
        return n == 1;
    }

    private RowMapper<Loan> rm() {
        return (rs, i) -> Loan.builder()
                .id(rs.getLong("id"))
                .borrower(rs.getString("borrower"))
                .loanTokenId(rs.getInt("loan_token_id"))
                .collateralTokenId(rs.getInt("collateral_token_id"))
                .principal(amount(rs, "principal"))
                .collateralAmount(amount(rs, "collateral_amount"))
                .interestRateBps(rs.getInt("interest_rate_bps"))
                .durationSecs(rs.getLong("duration_secs"))
                .minContribution(amount(rs, "min_contribution"))
                .fundingPeriodSecs(rs.getLong("funding_period_secs"))
                .createdAt(instant(rs, "created_at"))
                .fundedAt(instant(rs, "funded_at"))
                .dueDate(instant(rs, "due_date"))
                .status(LoanStatus.valueOf(rs.getString("status")))
                .amountFunded(amount(rs, "amount_funded"))
                .riskScore(rs.getInt("risk_score"))
                .collateralClaimed(rs.getBoolean("collateral_claimed"))
                .documentRef(rs.getString("document_ref"))
                .votingDeadline(instant(rs, "voting_deadline"))
                .resolution(rs.getString("resolution") == null ? null : VoteChoice.valueOf(rs.getString("resolution")))
                .build();
    }
}
