package com.demo.lending.repository;

import com.demo.lending.domain.Token;
import com.demo.lending.domain.TokenKind;
import lombok.RequiredArgsConstructor;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;

@Repository
@RequiredArgsConstructor
public class TokenRepository {

    private final JdbcTemplate jdbc;

    public Optional<Token> find(int id) {
        return jdbc.query("SELECT * FROM token WHERE id = ?", rm(), id).stream().findFirst();
    }

    public List<Token> findAll() {
        return jdbc.query("SELECT * FROM token ORDER BY id", rm());
    }

    /** Insert, or replace a previously deactivated entry under the same id. */
    public void save(Token t) {
        int updated = jdbc.update("""
            UPDATE token SET kind = ?, asset_ref = ?, symbol = ?, decimals = ?, active = ?, price_feed_ref = ?
            WHERE id = ?
        """, t.kind().name(), t.assetRef(), t.symbol(), t.decimals(), t.active(), t.priceFeedRef(), t.id());
        if (updated == 0) {
            jdbc.update("""
                INSERT INTO token (id, kind, asset_ref, symbol, decimals, active, price_feed_ref)
                VALUES (?, ?, ?, ?, ?, ?, ?)
            """, t.id(), t.kind().name(), t.assetRef(), t.symbol(), t.decimals(), t.active(), t.priceFeedRef());
        }
    }

    public int setActive(int id, boolean active) {
        return jdbc.update("UPDATE token SET active = ? WHERE id = ?", active, id);
    }

    private RowMapper<Token> rm() {
        return (rs, i) -> new Token(
                rs.getInt("id"),
                TokenKind.valueOf(rs.getString("kind")),
                rs.getString("asset_ref"),
                rs.getString("symbol"),
                rs.getInt("decimals"),
                rs.getBoolean("active"),
                rs.getString("price_feed_ref")
        );
    }
}
