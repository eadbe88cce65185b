package io.iamcore.jdbc;

import java.sql.SQLException;

/**
 * Unchecked wrapper for the {@link SQLException}s raised by {@link JdbcTemplate}.
 *
 * <p>{@link JdbcEventLog} translates it into a {@link io.iamcore.CommandException} before it
 * leaves the module.
 */
public final class EventStoreException extends RuntimeException {

  public EventStoreException(String message, SQLException cause) {
    super(message, cause);
  }

  public SQLException sqlException() {
    return (SQLException) getCause();
  }
}
