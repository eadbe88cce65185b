package io.iamcore.jdbc.store;

import java.util.List;

/**
 * H2 event store. Primarily for testing and embedded use.
 */
public final class H2EventStore extends AbstractJdbcEventStore {

  public H2EventStore() {
    super();
  }

  public H2EventStore(String tableName) {
    super(tableName);
  }

  @Override
  public AbstractJdbcEventStore withTableName(String tableName) {
    return new H2EventStore(tableName);
  }

  @Override
  public String name() {
    return "h2";
  }

  @Override
  public List<String> jdbcUrlPrefixes() {
    return List.of("jdbc:h2:");
  }
}
