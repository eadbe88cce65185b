package io.iamcore.jdbc;

import io.iamcore.AggregateRef;
import io.iamcore.CommandContext;
import io.iamcore.CommandException;
import io.iamcore.ErrorKind;
import io.iamcore.Event;
import io.iamcore.EventPayload;
import io.iamcore.EventType;
import io.iamcore.PendingEvent;
import io.iamcore.UnreadableEventType;
import io.iamcore.UnreadablePayload;
import io.iamcore.codec.EventCodec;
import io.iamcore.codec.EventTypeRegistry;
import io.iamcore.codec.JacksonEventCodec;
import io.iamcore.jdbc.store.AbstractJdbcEventStore;
import io.iamcore.jdbc.store.EventRow;
import io.iamcore.jdbc.store.JdbcEventStores;
import io.iamcore.jdbc.tx.JdbcTransactionManager;
import io.iamcore.jdbc.tx.ThreadLocalTxContext;
import io.iamcore.spi.EventLog;
import io.iamcore.spi.ReplayQuery;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.SQLException;
import java.time.Clock;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * {@link EventLog} stored in a relational table.
 *
 * <p>Each append runs in one transaction: the heads of all touched streams are read, checked
 * against the expected sequences and the rows inserted. A unique index on
 * {@code (aggregate_type, aggregate_id, event_sequence)} turns a racing writer into
 * {@link io.iamcore.ErrorKind#CONCURRENCY_CONFLICT}. When a transaction is already bound to
 * the {@link ThreadLocalTxContext}, the append joins it and leaves commit to the caller.
 *
 * <pre>{@code
 * JdbcEventLog log = JdbcEventLog.builder()
 *     .dataSource(dataSource)
 *     .build();
 * }</pre>
 */
public final class JdbcEventLog implements EventLog {
  private static final Logger logger = Logger.getLogger(JdbcEventLog.class.getName());

  private final ConnectionProvider connectionProvider;
  private final JdbcTransactionManager txManager;
  private final ThreadLocalTxContext txContext;
  private final AbstractJdbcEventStore store;
  private final EventCodec codec;
  private final EventTypeRegistry registry;
  private final Clock clock;

  private JdbcEventLog(Builder builder) {
    this.connectionProvider = Objects.requireNonNull(builder.connectionProvider, "connectionProvider");
    this.store = Objects.requireNonNull(builder.store, "store");
    this.codec = builder.codec == null ? new JacksonEventCodec() : builder.codec;
    this.registry = builder.registry == null ? EventTypeRegistry.defaults() : builder.registry;
    this.clock = builder.clock == null ? Clock.systemUTC() : builder.clock;
    this.txContext = builder.txContext == null ? new ThreadLocalTxContext() : builder.txContext;
    this.txManager = new JdbcTransactionManager(connectionProvider, txContext);
  }

  public static Builder builder() {
    return new Builder();
  }

  public AbstractJdbcEventStore store() {
    return store;
  }

  /**
   * Returns the transaction manager sharing this log's thread context.
   */
  public JdbcTransactionManager transactionManager() {
    return txManager;
  }

  @Override
  public List<Event> append(CommandContext context, List<PendingEvent> events) {
    Objects.requireNonNull(context, "context");
    Objects.requireNonNull(events, "events");
    if (events.isEmpty()) {
      return List.of();
    }
    context.checkActive();
    try {
      if (txContext.isTransactionActive()) {
        return appendOn(txContext.currentConnection(), events);
      }
      try (JdbcTransactionManager.Transaction tx = txManager.begin()) {
        List<Event> appended = appendOn(tx.connection(), events);
        tx.commit();
        logger.log(Level.FINE, "Appended {0} event(s) to {1}",
            new Object[] {appended.size(), store.tableName()});
        return appended;
      }
    } catch (EventStoreException e) {
      throw translate(e, events);
    } catch (SQLException e) {
      throw CommandException.unavailable("JDBC-APPEND", e);
    }
  }

  @Override
  public List<Event> replay(CommandContext context, ReplayQuery query) {
    Objects.requireNonNull(query, "query");
    context.checkActive();
    List<EventRow> rows = read(conn -> store.select(conn, query));
    List<Event> events = new ArrayList<>(rows.size());
    for (EventRow row : rows) {
      events.add(decode(row));
    }
    return events;
  }

  @Override
  public List<String> aggregateIds(CommandContext context, String aggregateType, String resourceOwner) {
    Objects.requireNonNull(aggregateType, "aggregateType");
    context.checkActive();
    return read(conn -> store.aggregateIds(conn, aggregateType, resourceOwner));
  }

  private List<Event> appendOn(Connection conn, List<PendingEvent> events) {
    Map<String, StreamHead> streams = new HashMap<>();
    for (PendingEvent pending : events) {
      AggregateRef aggregate = pending.aggregate();
      StreamHead stream = streams.computeIfAbsent(aggregate.toString(), key -> open(conn, aggregate));
      if (pending.hasExpectedSequence() && pending.expectedSequence() != stream.head) {
        throw CommandException.concurrencyConflict(aggregate.toString(), pending.expectedSequence(), stream.head);
      }
      stream.head++;
    }

    Instant now = clock.instant().truncatedTo(ChronoUnit.MILLIS);
    Map<String, Long> next = new HashMap<>();
    List<Event> appended = new ArrayList<>(events.size());
    for (PendingEvent pending : events) {
      StreamHead stream = streams.get(pending.aggregate().toString());
      long sequence = next.merge(pending.aggregate().toString(), stream.initialHead + 1, (a, b) -> a + 1);
      AggregateRef aggregate = stream.owner == null
          ? pending.aggregate()
          : new AggregateRef(pending.aggregate().type(), pending.aggregate().id(), stream.owner);
      store.insert(conn, new EventRow(
          pending.eventId(),
          aggregate.type(),
          aggregate.id(),
          aggregate.resourceOwner(),
          sequence,
          pending.type().name(),
          codec.encode(pending.payload()),
          pending.editorUser(),
          now));
      appended.add(new Event(pending.eventId(), aggregate, sequence, pending.type(),
          pending.payload(), pending.editorUser(), now));
    }
    return List.copyOf(appended);
  }

  private StreamHead open(Connection conn, AggregateRef aggregate) {
    long head = store.head(conn, aggregate.type(), aggregate.id());
    String owner = head == 0
        ? aggregate.resourceOwner()
        : store.streamOwner(conn, aggregate.type(), aggregate.id()).orElse(aggregate.resourceOwner());
    return new StreamHead(head, owner);
  }

  // Rows this reader cannot interpret are kept as unreadable events so folding still reaches the head.
  private Event decode(EventRow row) {
    EventType type;
    EventPayload payload;
    Optional<EventType> registered = registry.find(row.eventType());
    if (registered.isEmpty()) {
      logger.log(Level.WARNING, "Event {0} has unknown type {1}, replaying it as unreadable",
          new Object[] {row.eventId(), row.eventType()});
      type = UnreadableEventType.of(row.eventType(), row.aggregateType());
      payload = new UnreadablePayload(row.payload(), "unknown event type");
    } else {
      try {
        type = registered.get();
        payload = codec.decode(type, row.payload());
      } catch (CommandException e) {
        logger.log(Level.WARNING, "Event " + row.eventId() + " of type " + row.eventType()
            + " cannot be decoded, replaying it as unreadable", e);
        type = UnreadableEventType.of(row.eventType(), row.aggregateType());
        payload = new UnreadablePayload(row.payload(), e.getMessage());
      }
    }
    return new Event(
        row.eventId(),
        new AggregateRef(row.aggregateType(), row.aggregateId(), row.resourceOwner()),
        row.sequence(),
        type,
        payload,
        row.editorUser(),
        row.createdAt());
  }

  private <T> T read(ConnectionCallback<T> callback) {
    try {
      if (txContext.isTransactionActive()) {
        return callback.doInConnection(txContext.currentConnection());
      }
      try (Connection conn = connectionProvider.getConnection()) {
        return callback.doInConnection(conn);
      }
    } catch (EventStoreException | SQLException e) {
      throw CommandException.unavailable("JDBC-READ", e);
    }
  }

  private CommandException translate(EventStoreException e, List<PendingEvent> events) {
    if (store.isUniqueViolation(e.sqlException())) {
      logger.log(Level.FINE, "Concurrent append detected", e);
      return new CommandException(ErrorKind.CONCURRENCY_CONFLICT, "EVENTLOG-CONFLICT",
          "Errors.Concurrency: " + events.get(0).aggregate() + " was written concurrently", e);
    }
    return CommandException.unavailable("JDBC-APPEND", e);
  }

  @FunctionalInterface
  private interface ConnectionCallback<T> {
    T doInConnection(Connection conn) throws SQLException;
  }

  private static final class StreamHead {
    private final long initialHead;
    private final String owner;
    private long head;

    private StreamHead(long head, String owner) {
      this.initialHead = head;
      this.head = head;
      this.owner = owner;
    }
  }

  /**
   * Builder for {@link JdbcEventLog}.
   */
  public static final class Builder {
    private ConnectionProvider connectionProvider;
    private AbstractJdbcEventStore store;
    private EventCodec codec;
    private EventTypeRegistry registry;
    private Clock clock;
    private ThreadLocalTxContext txContext;
    private String tableName;

    private Builder() {
    }

    /**
     * Uses the data source for connections and detects the event store from its URL unless
     * one is set explicitly.
     */
    public Builder dataSource(DataSource dataSource) {
      Objects.requireNonNull(dataSource, "dataSource");
      this.connectionProvider = new DataSourceConnectionProvider(dataSource);
      if (store == null) {
        this.store = JdbcEventStores.detect(dataSource);
      }
      return this;
    }

    public Builder connectionProvider(ConnectionProvider connectionProvider) {
      this.connectionProvider = connectionProvider;
      return this;
    }

    public Builder store(AbstractJdbcEventStore store) {
      this.store = store;
      return this;
    }

    /**
     * Overrides the table name of the configured store.
     */
    public Builder tableName(String tableName) {
      this.tableName = tableName;
      return this;
    }

    public Builder codec(EventCodec codec) {
      this.codec = codec;
      return this;
    }

    /**
     * Sets the registry resolving stored type names. Defaults to
     * {@link EventTypeRegistry#defaults()}.
     */
    public Builder registry(EventTypeRegistry registry) {
      this.registry = registry;
      return this;
    }

    public Builder clock(Clock clock) {
      this.clock = clock;
      return this;
    }

    /**
     * Shares a thread context with other JDBC writers of the application.
     */
    public Builder txContext(ThreadLocalTxContext txContext) {
      this.txContext = txContext;
      return this;
    }

    public JdbcEventLog build() {
      if (tableName != null && store != null) {
        store = store.withTableName(tableName);
      }
      return new JdbcEventLog(this);
    }
  }
}
