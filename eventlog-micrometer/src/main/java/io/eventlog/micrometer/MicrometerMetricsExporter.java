package io.eventlog.micrometer;

import io.eventlog.spi.MetricsExporter;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.Meter;
import io.micrometer.core.instrument.MeterRegistry;

import java.util.List;
import java.util.Objects;

/**
 * Micrometer-based implementation of {@link MetricsExporter}.
 *
 * <p>Registers counters and a distribution summary with a {@link MeterRegistry} for
 * export to Prometheus, Grafana, Datadog, and other monitoring backends.
 *
 * <h3>Counters</h3>
 * <ul>
 *   <li>{@code eventlog.store.appended} - events committed to the store</li>
 *   <li>{@code eventlog.store.conflicts} - appends rejected by optimistic concurrency</li>
 *   <li>{@code eventlog.bus.commands}, tag {@code outcome=success|failure} - executed commands</li>
 *   <li>{@code eventlog.bus.queries} - executed queries (cache hits included)</li>
 *   <li>{@code eventlog.bus.query.cache}, tag {@code result=hit|miss} - query cache lookups</li>
 *   <li>{@code eventlog.bus.events.published} - events delivered to subscribers</li>
 *   <li>{@code eventlog.bus.events.handler.failures} - subscribers that threw</li>
 * </ul>
 *
 * <h3>Distribution Summaries</h3>
 * <ul>
 *   <li>{@code eventlog.store.append.duration.ms} - {@code saveEvents} transaction time</li>
 * </ul>
 *
 * @see MetricsExporter
 */
public final class MicrometerMetricsExporter implements MetricsExporter, AutoCloseable {

  private final MeterRegistry registry;
  private final Counter eventsAppended;
  private final Counter concurrencyConflicts;
  private final Counter commandsSucceeded;
  private final Counter commandsFailed;
  private final Counter queriesExecuted;
  private final Counter queryCacheHits;
  private final Counter queryCacheMisses;
  private final Counter eventsPublished;
  private final Counter eventHandlerFailures;
  private final DistributionSummary appendDuration;
  private volatile boolean closed;

  /**
   * Creates an exporter with the default metric name prefix {@code "eventlog"}.
   *
   * @param registry the Micrometer meter registry
   */
  public MicrometerMetricsExporter(MeterRegistry registry) {
    this(registry, "eventlog");
  }

  /**
   * Creates an exporter with a custom metric name prefix for multi-instance use.
   *
   * @param registry   the Micrometer meter registry
   * @param namePrefix prefix for all meter names (e.g. {@code "orders.eventlog"})
   */
  public MicrometerMetricsExporter(MeterRegistry registry, String namePrefix) {
    Objects.requireNonNull(registry, "registry");
    Objects.requireNonNull(namePrefix, "namePrefix");
    if (namePrefix.isEmpty()) {
      throw new IllegalArgumentException("namePrefix must not be empty");
    }
    if (namePrefix.endsWith(".")) {
      throw new IllegalArgumentException("namePrefix must not end with '.'");
    }

    this.registry = registry;
    this.eventsAppended = Counter.builder(namePrefix + ".store.appended")
        .description("Events committed to the event store")
        .register(registry);
    this.concurrencyConflicts = Counter.builder(namePrefix + ".store.conflicts")
        .description("Appends rejected by optimistic concurrency control")
        .register(registry);
    this.commandsSucceeded = Counter.builder(namePrefix + ".bus.commands")
        .tag("outcome", "success")
        .description("Commands executed")
        .register(registry);
    this.commandsFailed = Counter.builder(namePrefix + ".bus.commands")
        .tag("outcome", "failure")
        .description("Commands executed")
        .register(registry);
    this.queriesExecuted = Counter.builder(namePrefix + ".bus.queries")
        .description("Queries executed, including cache hits")
        .register(registry);
    this.queryCacheHits = Counter.builder(namePrefix + ".bus.query.cache")
        .tag("result", "hit")
        .description("Query cache lookups")
        .register(registry);
    this.queryCacheMisses = Counter.builder(namePrefix + ".bus.query.cache")
        .tag("result", "miss")
        .description("Query cache lookups")
        .register(registry);
    this.eventsPublished = Counter.builder(namePrefix + ".bus.events.published")
        .description("Events delivered to subscribers")
        .register(registry);
    this.eventHandlerFailures = Counter.builder(namePrefix + ".bus.events.handler.failures")
        .description("Event subscribers that threw")
        .register(registry);

    this.appendDuration = DistributionSummary.builder(namePrefix + ".store.append.duration.ms")
        .description("saveEvents transaction time in milliseconds")
        .register(registry);
  }

  @Override
  public void incrementEventsAppended(int count) {
    if (closed) return;
    eventsAppended.increment(count);
  }

  @Override
  public void incrementConcurrencyConflicts() {
    if (closed) return;
    concurrencyConflicts.increment();
  }

  @Override
  public void recordAppendDurationMs(long durationMs) {
    if (closed) return;
    appendDuration.record(durationMs);
  }

  @Override
  public void incrementCommandsSucceeded() {
    if (closed) return;
    commandsSucceeded.increment();
  }

  @Override
  public void incrementCommandsFailed() {
    if (closed) return;
    commandsFailed.increment();
  }

  @Override
  public void incrementQueriesExecuted() {
    if (closed) return;
    queriesExecuted.increment();
  }

  @Override
  public void incrementQueryCacheHits() {
    if (closed) return;
    queryCacheHits.increment();
  }

  @Override
  public void incrementQueryCacheMisses() {
    if (closed) return;
    queryCacheMisses.increment();
  }

  @Override
  public void incrementEventsPublished() {
    if (closed) return;
    eventsPublished.increment();
  }

  @Override
  public void incrementEventHandlerFailures() {
    if (closed) return;
    eventHandlerFailures.increment();
  }

  /**
   * Removes all meters registered by this exporter from the registry.
   *
   * <p>Call this when the exporter is no longer needed, for example when the
   * application context that owns the event store shuts down.
   */
  @Override
  public void close() {
    closed = true;
    RuntimeException first = null;
    for (Meter meter : List.of(eventsAppended, concurrencyConflicts,
        commandsSucceeded, commandsFailed, queriesExecuted,
        queryCacheHits, queryCacheMisses, eventsPublished, eventHandlerFailures,
        appendDuration)) {
      try {
        registry.remove(meter);
      } catch (RuntimeException e) {
        if (first == null) first = e;
        else first.addSuppressed(e);
      }
    }
    if (first != null) throw first;
  }
}
