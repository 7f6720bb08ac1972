package com.chatroom.db.util;

import com.chatroom.common.status.Status;
import com.chatroom.common.status.StatusOr;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.Instant;
import java.util.Optional;
import javax.annotation.Nonnull;

/** Utility methods for database operations. */
public final class DbUtil {

  /** SQLSTATE for a unique constraint violation. */
  public static final String UNIQUE_VIOLATION = "23505";

  /** SQLSTATE for a foreign key violation. */
  public static final String FOREIGN_KEY_VIOLATION = "23503";

  /** SQLSTATE for a serialization failure under REPEATABLE READ or SERIALIZABLE. */
  public static final String SERIALIZATION_FAILURE = "40001";

  /** SQLSTATE for a detected deadlock. */
  public static final String DEADLOCK_DETECTED = "40P01";

  /** SQLSTATE class for connection exceptions. */
  private static final String CONNECTION_EXCEPTION_CLASS = "08";

  private DbUtil() {
    // Utility class, no instances
  }

  /** Converts a java.time.Instant to java.sql.Timestamp. */
  @Nonnull
  public static java.sql.Timestamp toSqlTimestamp(Instant instant) {
    if (instant == null) {
      throw new IllegalArgumentException("Instant cannot be null");
    }
    return java.sql.Timestamp.from(instant);
  }

  /** Gets a non-null Instant from a ResultSet column. */
  @Nonnull
  public static StatusOr<Instant> getInstant(ResultSet rs, String columnName) {
    try {
      java.sql.Timestamp timestamp = rs.getTimestamp(columnName);
      if (rs.wasNull() || timestamp == null) {
        return StatusOr.ofStatus(Status.internal("Column " + columnName + " is null", null));
      }
      return StatusOr.ofValue(timestamp.toInstant());
    } catch (SQLException e) {
      return StatusOr.ofStatus(Status.internal("Failed to get Instant: " + e.getMessage(), e));
    }
  }

  /**
   * Gets an optional Instant from a ResultSet column, returning Optional.empty() if the column is
   * null.
   */
  @Nonnull
  public static StatusOr<Optional<Instant>> getOptionalInstant(ResultSet rs, String columnName) {
    try {
      java.sql.Timestamp timestamp = rs.getTimestamp(columnName);
      if (rs.wasNull() || timestamp == null) {
        return StatusOr.ofValue(Optional.empty());
      }
      return StatusOr.ofValue(Optional.of(timestamp.toInstant()));
    } catch (SQLException e) {
      return StatusOr.ofStatus(Status.internal("Failed to get Instant: " + e.getMessage(), e));
    }
  }

  /**
   * Maps a driver exception onto the status taxonomy using its SQLSTATE, so callers can tell a
   * constraint violation from an outage without inspecting driver-specific types.
   */
  @Nonnull
  public static Status toStatus(SQLException e, String message) {
    String sqlState = e.getSQLState();
    if (UNIQUE_VIOLATION.equals(sqlState)) {
      return Status.alreadyExists(message, e);
    }
    if (FOREIGN_KEY_VIOLATION.equals(sqlState)) {
      return Status.failedPrecondition(message, e);
    }
    if (SERIALIZATION_FAILURE.equals(sqlState) || DEADLOCK_DETECTED.equals(sqlState)) {
      return Status.aborted(message, e);
    }
    if (sqlState != null && sqlState.startsWith(CONNECTION_EXCEPTION_CLASS)) {
      return Status.unavailable(message, e);
    }
    return Status.internal(message + ": " + e.getMessage(), e);
  }

  /** Same as {@link #toStatus(SQLException, String)}, wrapped as a failed StatusOr. */
  @Nonnull
  public static <T> StatusOr<T> failure(SQLException e, String message) {
    return StatusOr.ofStatus(toStatus(e, message));
  }
}
