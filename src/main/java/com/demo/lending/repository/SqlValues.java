package com.demo.lending.repository;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.Instant;

/** Column conversions shared by the ledger repositories: uint256 as DECIMAL(78,0), times as epoch seconds. */
final class SqlValues {

    private SqlValues() {}

    static BigDecimal dec(BigInteger v) {
        return v == null ? null : new BigDecimal(v);
    }

    static BigInteger amount(ResultSet rs, String col) throws SQLException {
        BigDecimal d = rs.getBigDecimal(col);
        return d == null ? null : d.toBigIntegerExact();
    }

    static Long epoch(Instant t) {
        return t == null ? null : t.getEpochSecond();
    }

    static Instant instant(ResultSet rs, String col) throws SQLException {
        long v = rs.getLong(col);
        return rs.wasNull() ? null : Instant.ofEpochSecond(v);
    }
}
