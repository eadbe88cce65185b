package io.iamcore.jdbc.tx;

import java.sql.Connection;

/**
 * Holds the connection of the transaction running on the current thread.
 *
 * <p>Bound and cleared by {@link JdbcTransactionManager}. {@link io.iamcore.jdbc.JdbcEventLog}
 * joins a bound transaction instead of opening its own, so events can be appended together
 * with other writes of the caller.
 *
 * @see JdbcTransactionManager
 */
public final class ThreadLocalTxContext {
  private final ThreadLocal<Connection> current = new ThreadLocal<>();

  public boolean isTransactionActive() {
    return current.get() != null;
  }

  public Connection currentConnection() {
    Connection connection = current.get();
    if (connection == null) {
      throw new IllegalStateException("No active transaction");
    }
    return connection;
  }

  void bind(Connection connection) {
    if (current.get() != null) {
      throw new IllegalStateException("Transaction already active");
    }
    current.set(connection);
  }

  void clear() {
    current.remove();
  }
}
