package io.iamcore.jdbc.store;

import io.iamcore.jdbc.JdbcTemplate;
import io.iamcore.spi.ReplayQuery;

import java.sql.Connection;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Base JDBC event store with standard SQL implementations.
 *
 * <p>Every method works on a caller-supplied {@link Connection}; transaction boundaries belong
 * to {@link io.iamcore.jdbc.JdbcEventLog}. Subclasses name the database they handle and
 * override {@link #isUniqueViolation} where the vendor reports duplicate keys differently.
 * Register custom implementations via
 * {@code META-INF/services/io.iamcore.jdbc.store.AbstractJdbcEventStore}.
 *
 * @see JdbcEventStores
 */
public abstract class AbstractJdbcEventStore {
  protected static final String DEFAULT_TABLE = "iam_event";

  protected static final String COLUMNS = "event_id, aggregate_type, aggregate_id, resource_owner, "
      + "event_sequence, event_type, payload, editor_user, created_at";

  protected static final JdbcTemplate.RowMapper<EventRow> EVENT_ROW_MAPPER = rs -> new EventRow(
      rs.getString("event_id"),
      rs.getString("aggregate_type"),
      rs.getString("aggregate_id"),
      rs.getString("resource_owner"),
      rs.getLong("event_sequence"),
      rs.getString("event_type"),
      rs.getString("payload"),
      rs.getString("editor_user"),
      rs.getTimestamp("created_at").toInstant());

  private final String tableName;

  protected AbstractJdbcEventStore() {
    this(DEFAULT_TABLE);
  }

  protected AbstractJdbcEventStore(String tableName) {
    Objects.requireNonNull(tableName, "tableName");
    if (!tableName.matches("[a-zA-Z_][a-zA-Z0-9_]*")) {
      throw new IllegalArgumentException("Invalid table name: " + tableName);
    }
    this.tableName = tableName;
  }

  /**
   * Unique identifier for this event store (e.g., "mysql", "postgresql", "h2").
   */
  public abstract String name();

  /**
   * JDBC URL prefixes this event store handles (e.g., "jdbc:mysql:", "jdbc:tidb:").
   */
  public abstract List<String> jdbcUrlPrefixes();

  /**
   * Returns a copy of this store writing to another table.
   */
  public abstract AbstractJdbcEventStore withTableName(String tableName);

  public String tableName() {
    return tableName;
  }

  public void insert(Connection conn, EventRow row) {
    String sql = "INSERT INTO " + tableName() + " (" + COLUMNS + ") VALUES (?,?,?,?,?,?,?,?,?)";
    JdbcTemplate.update(conn, sql,
        row.eventId(), row.aggregateType(), row.aggregateId(), row.resourceOwner(),
        row.sequence(), row.eventType(), row.payload(), row.editorUser(),
        Timestamp.from(row.createdAt()));
  }

  /**
   * Returns the highest stored sequence of the stream, or 0 when it has no events.
   */
  public long head(Connection conn, String aggregateType, String aggregateId) {
    String sql = "SELECT MAX(event_sequence) FROM " + tableName()
        + " WHERE aggregate_type=? AND aggregate_id=?";
    return JdbcTemplate.queryForLong(conn, sql, aggregateType, aggregateId);
  }

  /**
   * Returns the resource owner recorded by the first event of the stream.
   */
  public Optional<String> streamOwner(Connection conn, String aggregateType, String aggregateId) {
    String sql = "SELECT resource_owner FROM " + tableName()
        + " WHERE aggregate_type=? AND aggregate_id=? AND event_sequence=1";
    List<String> owners = JdbcTemplate.query(conn, sql, rs -> rs.getString(1), aggregateType, aggregateId);
    return owners.isEmpty() ? Optional.empty() : Optional.ofNullable(owners.get(0));
  }

  public List<EventRow> select(Connection conn, ReplayQuery query) {
    StringBuilder sql = new StringBuilder("SELECT " + COLUMNS + " FROM " + tableName()
        + " WHERE aggregate_type=? AND aggregate_id=?");
    List<Object> params = new ArrayList<>();
    params.add(query.aggregateType());
    params.add(query.aggregateId());
    if (query.sequenceAtMost() != Long.MAX_VALUE) {
      sql.append(" AND event_sequence<=?");
      params.add(query.sequenceAtMost());
    }
    if (query.resourceOwner() != null) {
      sql.append(" AND resource_owner=?");
      params.add(query.resourceOwner());
    }
    if (!query.eventTypes().isEmpty()) {
      sql.append(" AND event_type IN (");
      sql.append(String.join(",", Collections.nCopies(query.eventTypes().size(), "?")));
      sql.append(")");
      params.addAll(query.eventTypes());
    }
    sql.append(" ORDER BY event_sequence");
    return JdbcTemplate.query(conn, sql.toString(), EVENT_ROW_MAPPER, params.toArray());
  }

  /**
   * Returns aggregate ids of the given type in order of their first event.
   */
  public List<String> aggregateIds(Connection conn, String aggregateType, String resourceOwner) {
    String sql = "SELECT aggregate_id FROM " + tableName()
        + " WHERE aggregate_type=? AND event_sequence=1"
        + (resourceOwner == null ? "" : " AND resource_owner=?")
        + " ORDER BY created_at, event_id";
    JdbcTemplate.RowMapper<String> mapper = rs -> rs.getString(1);
    return resourceOwner == null
        ? JdbcTemplate.query(conn, sql, mapper, aggregateType)
        : JdbcTemplate.query(conn, sql, mapper, aggregateType, resourceOwner);
  }

  /**
   * Returns whether the exception reports a duplicate key, which for this table means another
   * writer stored the same stream sequence first.
   */
  public boolean isUniqueViolation(SQLException e) {
    return "23505".equals(e.getSQLState());
  }
}
