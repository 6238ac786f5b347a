package io.eventlog.spring.boot;

import io.eventlog.util.DaemonThreadFactory;

import java.util.Optional;
import java.util.concurrent.Executor;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

/**
 * Thread pool behind the auto-configured event bus fan-out, closed with the context.
 * Holds no pool when the worker count is zero.
 */
public final class EventBusWorkers implements AutoCloseable {
  private final ExecutorService executor;

  public EventBusWorkers(int workerCount) {
    if (workerCount < 0) {
      throw new IllegalArgumentException("eventlog.event-bus.worker-count must be >= 0");
    }
    this.executor = workerCount == 0
        ? null
        : Executors.newFixedThreadPool(workerCount, new DaemonThreadFactory("eventlog-events-"));
  }

  public Optional<Executor> executor() {
    return Optional.ofNullable(executor);
  }

  @Override
  public void close() {
    if (executor != null) {
      executor.shutdown();
    }
  }
}
