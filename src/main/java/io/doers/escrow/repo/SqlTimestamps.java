package io.doers.escrow.repo;

import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.time.Instant;
import java.util.UUID;

/**
 * Conversions between java.time and JDBC column values shared by the repositories.
 */
final class SqlTimestamps {

  private SqlTimestamps() {
  }

  static Timestamp ts(Instant instant) {
    return instant != null ? Timestamp.from(instant) : null;
  }

  static Instant instant(ResultSet rs, String column) throws SQLException {
    Timestamp value = rs.getTimestamp(column);
    return value != null ? value.toInstant() : null;
  }

  static UUID uuid(ResultSet rs, String column) throws SQLException {
    Object value = rs.getObject(column);
    if (value == null) {
      return null;
    }
    return value instanceof UUID ? (UUID) value : UUID.fromString(value.toString());
  }
}
