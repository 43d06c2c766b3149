package com.thermo.db;

import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Types;
import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;

/**
 * Преобразования {@link Instant} в TIMESTAMPTZ и обратно.
 */
final class JdbcTimes {

  static void setInstant(PreparedStatement pstmt, int index, Instant value) throws SQLException {
    if (value == null) {
      pstmt.setNull(index, Types.TIMESTAMP_WITH_TIMEZONE);
    } else {
      pstmt.setObject(index, OffsetDateTime.ofInstant(value, ZoneOffset.UTC));
    }
  }

  static Instant getInstant(ResultSet rs, String column) throws SQLException {
    OffsetDateTime value = rs.getObject(column, OffsetDateTime.class);
    return value == null ? null : value.toInstant();
  }

  static Double getNullableDouble(ResultSet rs, String column) throws SQLException {
    double value = rs.getDouble(column);
    return rs.wasNull() ? null : value;
  }

  private JdbcTimes() {
  }
}
