package io.eventlog.jdbc;

import io.eventlog.ConcurrencyException;
import io.eventlog.DomainEvent;
import io.eventlog.EventStore;
import io.eventlog.EventStoreException;
import io.eventlog.EventStoreStatistics;
import io.eventlog.EventStreamPage;
import io.eventlog.codec.EventRecord;
import io.eventlog.codec.EventRecordCodec;
import io.eventlog.jdbc.store.AbstractJdbcEventRecordStore;
import io.eventlog.jdbc.tx.JdbcTransactionManager;
import io.eventlog.spi.ConnectionProvider;
import io.eventlog.spi.MetricsExporter;
import io.eventlog.spi.TenantContext;

import java.sql.Connection;
import java.sql.SQLException;
import java.time.Clock;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * JDBC {@link EventStore}.
 *
 * <p>{@link #saveEvents} reads the stream's current version and inserts the batch in
 * one transaction on a dedicated connection. The version check rejects stale writers
 * up front; the unique {@code (aggregate_id, version)} constraint catches writers that
 * raced past the check, which are then reported as {@link ConcurrencyException} as well.
 * Every other operation borrows its own connection and returns it before completing.
 *
 * <p>Events saved without a tenant are stamped from the store's {@link TenantContext},
 * or {@value DomainEvent#DEFAULT_TENANT} when it has none. {@link #forTenant(String)}
 * returns a view of the same store bound to one tenant.
 *
 * <h2>Usage</h2>
 * <pre>{@code
 * JdbcEventStore store = JdbcEventStore.builder()
 *     .connectionProvider(new DataSourceConnectionProvider(dataSource))
 *     .recordStore(JdbcEventRecordStores.detect(dataSource))
 *     .build();
 *
 * store.forTenant("acme").saveEvents("order-1", List.of(
 *     DomainEvent.of("OrderPlaced", "order-1", "{\"total\":42}")), 0);
 * }</pre>
 */
public final class JdbcEventStore implements EventStore {
  private static final Logger logger = Logger.getLogger(JdbcEventStore.class.getName());

  private final ConnectionProvider connectionProvider;
  private final JdbcTransactionManager txManager;
  private final AbstractJdbcEventRecordStore recordStore;
  private final EventRecordCodec codec;
  private final TenantContext tenantContext;
  private final MetricsExporter metrics;
  private final Clock clock;

  private JdbcEventStore(Builder builder) {
    this(builder.connectionProvider, builder.recordStore, builder.codec,
        builder.tenantContext, builder.metrics, builder.clock);
  }

  private JdbcEventStore(ConnectionProvider connectionProvider, AbstractJdbcEventRecordStore recordStore,
      EventRecordCodec codec, TenantContext tenantContext, MetricsExporter metrics, Clock clock) {
    this.connectionProvider = connectionProvider;
    this.txManager = new JdbcTransactionManager(connectionProvider);
    this.recordStore = recordStore;
    this.codec = codec;
    this.tenantContext = tenantContext;
    this.metrics = metrics;
    this.clock = clock;
  }

  public static Builder builder() {
    return new Builder();
  }

  /**
   * Returns a view of this store that stamps {@code tenantId} on events saved without one.
   * The view shares connections, record store and metrics with this store.
   *
   * @param tenantId the tenant for writes through the view
   * @return a tenant-bound store
   */
  public JdbcEventStore forTenant(String tenantId) {
    requireText(tenantId, "tenantId");
    return new JdbcEventStore(connectionProvider, recordStore, codec,
        TenantContext.of(tenantId), metrics, clock);
  }

  @Override
  public void saveEvents(String aggregateId, List<DomainEvent> events, long expectedVersion) {
    requireText(aggregateId, "aggregateId");
    Objects.requireNonNull(events, "events");
    if (expectedVersion < 0) {
      throw new IllegalArgumentException("expectedVersion must be >= 0");
    }
    if (events.isEmpty()) {
      return;
    }
    List<EventRecord> records = encode(aggregateId, events, expectedVersion);

    long start = System.nanoTime();
    try (JdbcTransactionManager.Transaction tx = txManager.begin()) {
      Connection conn = tx.connection();
      long actualVersion = recordStore.currentVersion(conn, aggregateId);
      if (actualVersion != expectedVersion) {
        tx.rollback();
        throw conflict(aggregateId, expectedVersion, actualVersion, null);
      }
      try {
        for (EventRecord record : records) {
          recordStore.insert(conn, record);
        }
      } catch (EventStoreException e) {
        tx.rollback();
        throw translateInsertFailure(aggregateId, expectedVersion, e);
      }
      tx.commit();
    } catch (SQLException e) {
      logger.log(Level.SEVERE, "Failed to save events for aggregate " + aggregateId, e);
      throw new EventStoreException("Failed to save events for aggregate " + aggregateId, e);
    } finally {
      metrics.recordAppendDurationMs((System.nanoTime() - start) / 1_000_000);
    }

    metrics.incrementEventsAppended(records.size());
    logger.log(Level.INFO, "Appended {0} event(s) to {1} (versions {2}..{3})",
        new Object[]{records.size(), aggregateId, expectedVersion + 1, expectedVersion + records.size()});
  }

  @Override
  public List<DomainEvent> getEvents(String aggregateId, long fromVersion) {
    requireText(aggregateId, "aggregateId");
    List<EventRecord> rows = withConnection("read events of aggregate " + aggregateId,
        conn -> recordStore.findByAggregate(conn, aggregateId, fromVersion));
    logger.log(Level.FINE, "Read {0} event(s) of {1} from version {2}",
        new Object[]{rows.size(), aggregateId, fromVersion});
    return decodeAll(rows);
  }

  @Override
  public List<DomainEvent> getEventsByType(String eventType, Instant fromDate) {
    requireText(eventType, "eventType");
    List<EventRecord> rows = withConnection("read events of type " + eventType,
        conn -> recordStore.findByType(conn, eventType, fromDate));
    logger.log(Level.FINE, "Read {0} event(s) of type {1}", new Object[]{rows.size(), eventType});
    return decodeAll(rows);
  }

  /**
   * {@inheritDoc}
   *
   * <p>Fetches one row beyond {@code limit}, so {@code hasMore} is exact. The cursor is
   * the storage sequence of the page's last event; an empty page echoes the given cursor
   * so a caller tailing the stream can poll with it again.
   */
  @Override
  public EventStreamPage getEventStream(String fromCursor, int limit) {
    if (limit < 1) {
      throw new IllegalArgumentException("limit must be >= 1");
    }
    long afterSequence = parseCursor(fromCursor);
    int fetch = limit == Integer.MAX_VALUE ? limit : limit + 1;
    List<EventRecord> rows = withConnection("read event stream",
        conn -> recordStore.findAfter(conn, afterSequence, fetch));

    boolean hasMore = rows.size() > limit;
    List<EventRecord> page = hasMore ? rows.subList(0, limit) : rows;
    if (page.isEmpty()) {
      return new EventStreamPage(List.of(), fromCursor, false);
    }
    String nextCursor = Long.toString(page.get(page.size() - 1).sequence());
    return new EventStreamPage(decodeAll(page), nextCursor, hasMore);
  }

  @Override
  public long getCurrentVersion(String aggregateId) {
    requireText(aggregateId, "aggregateId");
    return withConnection("read version of aggregate " + aggregateId,
        conn -> recordStore.currentVersion(conn, aggregateId));
  }

  @Override
  public boolean exists(String aggregateId) {
    requireText(aggregateId, "aggregateId");
    return withConnection("check aggregate " + aggregateId,
        conn -> recordStore.exists(conn, aggregateId));
  }

  @Override
  public void deleteEvents(String aggregateId) {
    requireText(aggregateId, "aggregateId");
    int deleted = withConnection("delete events of aggregate " + aggregateId,
        conn -> recordStore.deleteByAggregate(conn, aggregateId));
    logger.log(Level.INFO, "Deleted {0} event(s) of aggregate {1}", new Object[]{deleted, aggregateId});
  }

  @Override
  public Optional<DomainEvent> getEvent(String eventId) {
    requireText(eventId, "eventId");
    return withConnection("read event " + eventId, conn -> recordStore.findById(conn, eventId))
        .map(codec::decode);
  }

  @Override
  public EventStoreStatistics getStatistics() {
    return withConnection("read statistics", conn -> new EventStoreStatistics(
        recordStore.countEvents(conn),
        recordStore.countAggregates(conn),
        recordStore.countByType(conn),
        recordStore.countByTenant(conn)));
  }

  public AbstractJdbcEventRecordStore recordStore() {
    return recordStore;
  }

  private List<EventRecord> encode(String aggregateId, List<DomainEvent> events, long expectedVersion) {
    String defaultTenant = tenantContext.resolveTenantId();
    Instant storedAt = clock.instant().truncatedTo(ChronoUnit.MILLIS);
    List<EventRecord> records = new ArrayList<>(events.size());
    long version = expectedVersion;
    for (DomainEvent event : events) {
      Objects.requireNonNull(event, "events cannot contain null");
      DomainEvent bound = event;
      if (event.aggregateId() == null) {
        bound = event.withAggregateId(aggregateId);
      } else if (!event.aggregateId().equals(aggregateId)) {
        throw new IllegalArgumentException("Event " + event.eventId() + " belongs to aggregate "
            + event.aggregateId() + ", not " + aggregateId);
      }
      String tenantId = event.tenantId() != null ? event.tenantId() : defaultTenant;
      records.add(codec.encode(bound, ++version, tenantId, storedAt));
    }
    return records;
  }

  private RuntimeException translateInsertFailure(String aggregateId, long expectedVersion, EventStoreException e) {
    if (!(e.getCause() instanceof SQLException sqlException) || !recordStore.isWriteConflict(sqlException)) {
      logger.log(Level.SEVERE, "Failed to insert events for aggregate " + aggregateId, e);
      return e;
    }
    long actualVersion = getCurrentVersion(aggregateId);
    if (actualVersion != expectedVersion) {
      return conflict(aggregateId, expectedVersion, actualVersion, e);
    }
    logger.log(Level.SEVERE, "Insert conflict for aggregate " + aggregateId
        + " without a concurrent append", e);
    return e;
  }

  private ConcurrencyException conflict(String aggregateId, long expectedVersion, long actualVersion,
      Throwable cause) {
    metrics.incrementConcurrencyConflicts();
    logger.log(Level.WARNING, "Concurrency conflict on {0}: expected version {1} but was {2}",
        new Object[]{aggregateId, expectedVersion, actualVersion});
    return new ConcurrencyException(aggregateId, expectedVersion, actualVersion, cause);
  }

  private List<DomainEvent> decodeAll(List<EventRecord> rows) {
    List<DomainEvent> events = new ArrayList<>(rows.size());
    for (EventRecord row : rows) {
      events.add(codec.decode(row));
    }
    return List.copyOf(events);
  }

  private <T> T withConnection(String action, ConnectionCallback<T> callback) {
    try (Connection conn = connectionProvider.getConnection()) {
      return callback.apply(conn);
    } catch (SQLException e) {
      logger.log(Level.SEVERE, "Failed to " + action, e);
      throw new EventStoreException("Failed to " + action, e);
    } catch (EventStoreException e) {
      logger.log(Level.SEVERE, "Failed to " + action, e);
      throw e;
    }
  }

  private static long parseCursor(String cursor) {
    if (cursor == null) {
      return 0L;
    }
    try {
      long sequence = Long.parseLong(cursor);
      if (sequence < 0) {
        throw new IllegalArgumentException("Invalid cursor: " + cursor);
      }
      return sequence;
    } catch (NumberFormatException e) {
      throw new IllegalArgumentException("Invalid cursor: " + cursor, e);
    }
  }

  private static void requireText(String value, String name) {
    Objects.requireNonNull(value, name);
    if (value.isBlank()) {
      throw new IllegalArgumentException(name + " cannot be blank");
    }
  }

  @FunctionalInterface
  private interface ConnectionCallback<T> {
    T apply(Connection conn) throws SQLException;
  }

  /**
   * Builder for {@link JdbcEventStore}.
   */
  public static final class Builder {
    private ConnectionProvider connectionProvider;
    private AbstractJdbcEventRecordStore recordStore;
    private EventRecordCodec codec = new EventRecordCodec();
    private TenantContext tenantContext = TenantContext.NONE;
    private MetricsExporter metrics = MetricsExporter.NOOP;
    private Clock clock = Clock.systemUTC();

    private Builder() {
    }

    /**
     * Sets the source of JDBC connections.
     *
     * <p><b>Required.</b>
     *
     * @param connectionProvider the connection provider
     * @return this builder
     */
    public Builder connectionProvider(ConnectionProvider connectionProvider) {
      this.connectionProvider = connectionProvider;
      return this;
    }

    /**
     * Sets the database-specific record store, e.g. from {@code JdbcEventRecordStores.detect}.
     *
     * <p><b>Required.</b>
     *
     * @param recordStore the record store
     * @return this builder
     */
    public Builder recordStore(AbstractJdbcEventRecordStore recordStore) {
      this.recordStore = recordStore;
      return this;
    }

    /**
     * Sets the codec between events and rows.
     *
     * <p>Optional. Defaults to an {@link EventRecordCodec} using the built-in JSON codec.
     *
     * @param codec the record codec
     * @return this builder
     */
    public Builder codec(EventRecordCodec codec) {
      this.codec = Objects.requireNonNull(codec, "codec");
      return this;
    }

    /**
     * Sets the tenant context consulted for events saved without a tenant.
     *
     * <p>Optional. Defaults to {@link TenantContext#NONE}, which yields
     * {@value DomainEvent#DEFAULT_TENANT}.
     *
     * @param tenantContext the tenant context
     * @return this builder
     */
    public Builder tenantContext(TenantContext tenantContext) {
      this.tenantContext = Objects.requireNonNull(tenantContext, "tenantContext");
      return this;
    }

    /**
     * Sets the metrics exporter for append counters and latency.
     *
     * <p>Optional. Defaults to {@link MetricsExporter#NOOP}.
     *
     * @param metrics the metrics exporter
     * @return this builder
     */
    public Builder metrics(MetricsExporter metrics) {
      this.metrics = Objects.requireNonNull(metrics, "metrics");
      return this;
    }

    /**
     * Sets the clock for {@code stored_at}.
     *
     * <p>Optional. Defaults to {@link Clock#systemUTC()}.
     *
     * @param clock the clock
     * @return this builder
     */
    public Builder clock(Clock clock) {
      this.clock = Objects.requireNonNull(clock, "clock");
      return this;
    }

    /**
     * Builds the event store.
     *
     * @throws NullPointerException if a required setting is missing
     */
    public JdbcEventStore build() {
      Objects.requireNonNull(connectionProvider, "connectionProvider");
      Objects.requireNonNull(recordStore, "recordStore");
      return new JdbcEventStore(this);
    }
  }
}
