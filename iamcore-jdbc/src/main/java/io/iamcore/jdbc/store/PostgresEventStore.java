package io.iamcore.jdbc.store;

import java.util.List;

/**
 * PostgreSQL event store.
 *
 * <p>Duplicate stream sequences surface as SQLState {@code 23505}.
 */
public final class PostgresEventStore extends AbstractJdbcEventStore {

  public PostgresEventStore() {
    super();
  }

  public PostgresEventStore(String tableName) {
    super(tableName);
  }

  @Override
  public AbstractJdbcEventStore withTableName(String tableName) {
    return new PostgresEventStore(tableName);
  }

  @Override
  public String name() {
    return "postgresql";
  }

  @Override
  public List<String> jdbcUrlPrefixes() {
    return List.of("jdbc:postgresql:");
  }
}
