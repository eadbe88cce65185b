package io.iamcore.jdbc.store;

import java.sql.SQLException;
import java.util.List;

/**
 * MySQL event store. Also handles TiDB, which speaks the MySQL protocol.
 */
public final class MySqlEventStore extends AbstractJdbcEventStore {
  private static final int ER_DUP_ENTRY = 1062;

  public MySqlEventStore() {
    super();
  }

  public MySqlEventStore(String tableName) {
    super(tableName);
  }

  @Override
  public AbstractJdbcEventStore withTableName(String tableName) {
    return new MySqlEventStore(tableName);
  }

  @Override
  public String name() {
    return "mysql";
  }

  @Override
  public List<String> jdbcUrlPrefixes() {
    return List.of("jdbc:mysql:", "jdbc:tidb:");
  }

  @Override
  public boolean isUniqueViolation(SQLException e) {
    return e.getErrorCode() == ER_DUP_ENTRY || super.isUniqueViolation(e);
  }
}
