package io.eventlog.micrometer;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class MicrometerMetricsExporterTest {

  private SimpleMeterRegistry registry;
  private MicrometerMetricsExporter exporter;

  @BeforeEach
  void setUp() {
    registry = new SimpleMeterRegistry();
    exporter = new MicrometerMetricsExporter(registry);
  }

  @Test
  void incrementEventsAppendedAddsBatchSize() {
    exporter.incrementEventsAppended(3);
    exporter.incrementEventsAppended(2);
    assertEquals(5.0, counter("eventlog.store.appended").count());
  }

  @Test
  void incrementConcurrencyConflicts() {
    exporter.incrementConcurrencyConflicts();
    assertEquals(1.0, counter("eventlog.store.conflicts").count());
  }

  @Test
  void recordAppendDuration() {
    exporter.recordAppendDurationMs(12);
    exporter.recordAppendDurationMs(8);

    DistributionSummary summary = registry.find("eventlog.store.append.duration.ms").summary();
    assertNotNull(summary);
    assertEquals(2, summary.count());
    assertEquals(20.0, summary.totalAmount());
  }

  @Test
  void commandOutcomesAreTagged() {
    exporter.incrementCommandsSucceeded();
    exporter.incrementCommandsSucceeded();
    exporter.incrementCommandsFailed();

    assertEquals(2.0, registry.find("eventlog.bus.commands").tag("outcome", "success").counter().count());
    assertEquals(1.0, registry.find("eventlog.bus.commands").tag("outcome", "failure").counter().count());
  }

  @Test
  void queryCacheLookupsAreTagged() {
    exporter.incrementQueriesExecuted();
    exporter.incrementQueriesExecuted();
    exporter.incrementQueryCacheMisses();
    exporter.incrementQueryCacheHits();

    assertEquals(2.0, counter("eventlog.bus.queries").count());
    assertEquals(1.0, registry.find("eventlog.bus.query.cache").tag("result", "hit").counter().count());
    assertEquals(1.0, registry.find("eventlog.bus.query.cache").tag("result", "miss").counter().count());
  }

  @Test
  void eventPublicationCounters() {
    exporter.incrementEventsPublished();
    exporter.incrementEventsPublished();
    exporter.incrementEventHandlerFailures();

    assertEquals(2.0, counter("eventlog.bus.events.published").count());
    assertEquals(1.0, counter("eventlog.bus.events.handler.failures").count());
  }

  @Test
  void customNamePrefix() {
    MicrometerMetricsExporter custom = new MicrometerMetricsExporter(registry, "orders.eventlog");
    custom.incrementEventsAppended(1);

    assertEquals(1.0, counter("orders.eventlog.store.appended").count());
    assertEquals(0.0, counter("eventlog.store.appended").count());
  }

  @Test
  void invalidArgumentsThrow() {
    assertThrows(NullPointerException.class, () -> new MicrometerMetricsExporter(null));
    assertThrows(NullPointerException.class, () -> new MicrometerMetricsExporter(registry, null));
    assertThrows(IllegalArgumentException.class, () -> new MicrometerMetricsExporter(registry, ""));
    assertThrows(IllegalArgumentException.class, () -> new MicrometerMetricsExporter(registry, "eventlog."));
  }

  @Test
  void closeRemovesMetersAndIgnoresLaterUpdates() {
    exporter.close();
    exporter.incrementEventsAppended(1);
    exporter.incrementCommandsFailed();

    assertNull(registry.find("eventlog.store.appended").counter());
    assertNull(registry.find("eventlog.bus.commands").counter());
    assertNull(registry.find("eventlog.store.append.duration.ms").summary());
  }

  private Counter counter(String name) {
    Counter c = registry.find(name).counter();
    assertNotNull(c, "Counter not found: " + name);
    return c;
  }
}
