package io.eventlog.spi;

/**
 * Observability hook for exporting event-store and bus counters to a metrics backend.
 *
 * <p>The {@link #NOOP} instance discards everything. Implementations must not throw;
 * metrics never influence store or bus behavior.
 *
 * @see io.eventlog.micrometer.MicrometerMetricsExporter
 */
public interface MetricsExporter {

  /**
   * No-op instance that discards all metrics.
   */
  MetricsExporter NOOP = new Noop();

  /**
   * Records a committed append of {@code count} events.
   */
  void incrementEventsAppended(int count);

  /**
   * Records a {@code saveEvents} call rejected with a concurrency conflict.
   */
  void incrementConcurrencyConflicts();

  /**
   * Records the wall time of a {@code saveEvents} transaction, successful or not.
   */
  void recordAppendDurationMs(long durationMs);

  void incrementCommandsSucceeded();

  void incrementCommandsFailed();

  void incrementQueriesExecuted();

  void incrementQueryCacheHits();

  void incrementQueryCacheMisses();

  /**
   * Records one event delivered to its subscribers (whatever the outcome).
   */
  void incrementEventsPublished();

  /**
   * Records one subscriber that threw while handling an event.
   */
  void incrementEventHandlerFailures();

  /**
   * Default no-op implementation that discards all metrics.
   */
  final class Noop implements MetricsExporter {
    @Override
    public void incrementEventsAppended(int count) {
    }

    @Override
    public void incrementConcurrencyConflicts() {
    }

    @Override
    public void recordAppendDurationMs(long durationMs) {
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
