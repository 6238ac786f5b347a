package io.eventlog.jdbc;

import io.eventlog.ConcurrencyException;
import io.eventlog.CorruptEventException;
import io.eventlog.DomainEvent;
import io.eventlog.EventStoreException;
import io.eventlog.jdbc.store.AbstractJdbcEventRecordStore;
import io.eventlog.jdbc.store.H2EventRecordStore;
import io.eventlog.spi.MetricsExporter;
import org.h2.jdbcx.JdbcDataSource;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import javax.sql.DataSource;
import java.sql.SQLException;
import java.time.Instant;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;

import static org.junit.jupiter.api.Assertions.*;

class H2EventStoreTest extends AbstractEventStoreIntegrationTest {

  private static final H2EventRecordStore STORE = new H2EventRecordStore();

  private final JdbcDataSource dataSource = new JdbcDataSource();

  H2EventStoreTest() {
    dataSource.setURL("jdbc:h2:mem:events_" + UUID.randomUUID() + ";DB_CLOSE_DELAY=-1;LOCK_TIMEOUT=10000");
  }

  @BeforeEach
  void initSchema() throws Exception {
    SchemaScripts.apply(dataSource, "h2");
  }

  @Override
  DataSource dataSource() {
    return dataSource;
  }

  @Override
  AbstractJdbcEventRecordStore recordStore() {
    return STORE;
  }

  @Test
  void occurredAtSurvivesStorage() {
    Instant occurredAt = Instant.parse("2024-03-15T08:30:45.123Z");
    DomainEvent event = DomainEvent.builder("A").payloadJson("{}").occurredAt(occurredAt).build();

    store.saveEvents("agg-1", List.of(event), 0);

    assertEquals(occurredAt, store.getEvents("agg-1").get(0).occurredAt());
  }

  @Test
  void emptyBatchNeverOpensConnection() {
    AtomicInteger connections = new AtomicInteger();
    JdbcEventStore counting = JdbcEventStore.builder()
        .connectionProvider(() -> {
          connections.incrementAndGet();
          return dataSource.getConnection();
        })
        .recordStore(STORE)
        .build();

    counting.saveEvents("agg-1", List.of(), 0);

    assertEquals(0, connections.get());
  }

  @Test
  void corruptMetadataNamesTheEvent() throws Exception {
    store.saveEvents("agg-1", List.of(event("A")), 0);
    String eventId = store.getEvents("agg-1").get(0).eventId();
    SchemaScripts.execute(dataSource,
        "UPDATE event_store SET metadata='{not json' WHERE event_id='" + eventId + "'");

    CorruptEventException ex = assertThrows(CorruptEventException.class, () -> store.getEvents("agg-1"));
    assertEquals(eventId, ex.eventId());
    assertTrue(ex.getMessage().contains(eventId));
  }

  @Test
  void blankEventTypeIsCorrupt() throws Exception {
    DomainEvent event = event("A");
    store.saveEvents("agg-1", List.of(event), 0);
    SchemaScripts.execute(dataSource,
        "UPDATE event_store SET event_type=' ' WHERE event_id='" + event.eventId() + "'");

    CorruptEventException ex = assertThrows(CorruptEventException.class,
        () -> store.getEvent(event.eventId()));
    assertEquals(event.eventId(), ex.eventId());
  }

  @Test
  void storageFailureKeepsSqlCause() throws Exception {
    SchemaScripts.execute(dataSource, "DROP TABLE event_store");

    EventStoreException save = assertThrows(EventStoreException.class,
        () -> store.saveEvents("agg-1", List.of(event("A")), 0));
    EventStoreException read = assertThrows(EventStoreException.class,
        () -> store.getEvents("agg-1"));

    assertInstanceOf(SQLException.class, save.getCause());
    assertInstanceOf(SQLException.class, read.getCause());
  }

  @Test
  void customTableName() throws Exception {
    SchemaScripts.execute(dataSource, "CREATE TABLE audit_events ("
        + "seq BIGINT GENERATED BY DEFAULT AS IDENTITY PRIMARY KEY, "
        + "event_id VARCHAR(64) NOT NULL UNIQUE, "
        + "aggregate_id VARCHAR(255) NOT NULL, "
        + "event_type VARCHAR(255) NOT NULL, "
        + "payload CLOB NOT NULL, "
        + "metadata CLOB, "
        + "version BIGINT NOT NULL, "
        + "occurred_at TIMESTAMP(3) NOT NULL, "
        + "tenant_id VARCHAR(128) NOT NULL, "
        + "stored_at TIMESTAMP(3) NOT NULL, "
        + "UNIQUE (aggregate_id, version))");
    JdbcEventStore audit = JdbcEventStore.builder()
        .connectionProvider(new DataSourceConnectionProvider(dataSource))
        .recordStore(STORE.withTableName("audit_events"))
        .build();

    audit.saveEvents("agg-1", List.of(event("A"), event("B")), 0);

    assertEquals(2, audit.getCurrentVersion("agg-1"));
    assertFalse(store.exists("agg-1"));
    assertEquals("audit_events", audit.recordStore().tableName());
  }

  @Test
  void tenantContextStampsWrites() {
    JdbcEventStore scoped = JdbcEventStore.builder()
        .connectionProvider(new DataSourceConnectionProvider(dataSource))
        .recordStore(STORE)
        .tenantContext(() -> "initech")
        .build();

    scoped.saveEvents("agg-1", List.of(event("A")), 0);

    assertEquals("initech", store.getEvents("agg-1").get(0).tenantId());
  }

  @Test
  void metricsRecordAppendsAndConflicts() {
    CountingMetrics metrics = new CountingMetrics();
    JdbcEventStore measured = JdbcEventStore.builder()
        .connectionProvider(new DataSourceConnectionProvider(dataSource))
        .recordStore(STORE)
        .metrics(metrics)
        .build();

    measured.saveEvents("agg-1", List.of(event("A"), event("B")), 0);
    assertThrows(ConcurrencyException.class,
        () -> measured.saveEvents("agg-1", List.of(event("C")), 1));

    assertEquals(2, metrics.appended.get());
    assertEquals(1, metrics.conflicts.get());
    assertEquals(2, metrics.timings.get());
  }

  private static final class CountingMetrics implements MetricsExporter {
    final AtomicLong appended = new AtomicLong();
    final AtomicInteger conflicts = new AtomicInteger();
    final AtomicInteger timings = new AtomicInteger();

    @Override
    public void incrementEventsAppended(int count) {
      appended.addAndGet(count);
    }

    @Override
    public void incrementConcurrencyConflicts() {
      conflicts.incrementAndGet();
    }

    @Override
    public void recordAppendDurationMs(long durationMs) {
      timings.incrementAndGet();
    }

    @Override
    public void incrementCommandsSucceeded() {
    }

    @Override
    public void incrementCommandsFailed() {
    }

    @Override
    public void incrementQueriesExecuted() {
    }

    @Override
    public void incrementQueryCacheHits() {
    }

    @Override
    public void incrementQueryCacheMisses() {
    }

    @Override
    public void incrementEventsPublished() {
    }

    @Override
    public void incrementEventHandlerFailures() {
    }
  }
}
