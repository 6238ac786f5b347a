package io.eventlog.bus.event;

import io.eventlog.DomainEvent;
import io.eventlog.bus.AggregateHandlerException;
import io.eventlog.bus.BusStatistics;
import io.eventlog.bus.DispatchInterceptor;
import io.eventlog.bus.HandlerExecutionException;
import io.eventlog.bus.HandlerFailure;
import io.eventlog.bus.Interceptors;
import io.eventlog.spi.MetricsExporter;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.Executor;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Thread-safe {@link EventBus}.
 *
 * <p>Without an executor, subscribers run sequentially on the publishing thread in
 * subscription order (type-specific first, then wildcard). With an executor, all
 * subscribers of one event run concurrently and {@code publish} returns once every
 * one of them has finished. A subscriber that publishes again while running on the
 * executor gets its nested fan-out run sequentially on its own thread, so pool
 * threads never block waiting on tasks queued behind them.
 *
 * <h2>Usage</h2>
 * <pre>{@code
 * DefaultEventBus bus = DefaultEventBus.builder()
 *     .executor(Executors.newFixedThreadPool(4, new DaemonThreadFactory("projection-")))
 *     .build();
 * bus.subscribe("OrderPlaced", event -> readModel.apply(event));
 * bus.subscribeAll(EventHandler.named("audit", event -> audit.log(event)));
 * }</pre>
 */
public final class DefaultEventBus implements EventBus {
  public static final String ALL_EVENTS = "*";

  private static final Logger logger = Logger.getLogger(DefaultEventBus.class.getName());
  private static final ThreadLocal<Boolean> IN_FAN_OUT = new ThreadLocal<>();

  private final Map<String, CopyOnWriteArrayList<EventHandler>> subscriptions = new ConcurrentHashMap<>();
  private final Interceptors<DomainEvent> interceptors = new Interceptors<>();
  private final Executor executor;
  private final MetricsExporter metrics;

  private DefaultEventBus(Builder builder) {
    this.executor = builder.executor;
    this.metrics = builder.metrics;
  }

  public static Builder builder() {
    return new Builder();
  }

  @Override
  public void subscribe(String eventType, EventHandler handler) {
    Objects.requireNonNull(eventType, "eventType");
    Objects.requireNonNull(handler, "handler");
    if (!ALL_EVENTS.equals(eventType) && !handler.supports(eventType)) {
      throw new IllegalArgumentException("Handler does not support event type: " + eventType);
    }
    subscriptions.computeIfAbsent(eventType, ignored -> new CopyOnWriteArrayList<>()).add(handler);
    logger.log(Level.FINE, "Subscribed {0} to {1}", new Object[]{handler.name(), eventType});
  }

  @Override
  public void subscribeAll(EventHandler handler) {
    subscribe(ALL_EVENTS, handler);
  }

  @Override
  public boolean unsubscribe(String eventType, EventHandler handler) {
    CopyOnWriteArrayList<EventHandler> handlers = subscriptions.get(eventType);
    return handlers != null && handlers.remove(handler);
  }

  @Override
  public void publish(DomainEvent event) {
    List<HandlerFailure> failures = dispatch(event);
    if (!failures.isEmpty()) {
      throw new AggregateHandlerException(failures);
    }
  }

  @Override
  public void publishAll(List<DomainEvent> events) {
    Objects.requireNonNull(events, "events");
    List<HandlerFailure> failures = new ArrayList<>();
    for (DomainEvent event : events) {
      try {
        failures.addAll(dispatch(event));
      } catch (HandlerExecutionException e) {
        if (!failures.isEmpty()) {
          e.addSuppressed(new AggregateHandlerException(failures));
        }
        throw e;
      }
    }
    if (!failures.isEmpty()) {
      throw new AggregateHandlerException(failures);
    }
  }

  @Override
  public void addInterceptor(DispatchInterceptor<DomainEvent> interceptor) {
    interceptors.add(interceptor);
  }

  @Override
  public void clear() {
    subscriptions.clear();
    interceptors.clear();
  }

  @Override
  public Set<String> registeredTypes() {
    List<String> types = new ArrayList<>();
    subscriptions.forEach((eventType, handlers) -> {
      if (!handlers.isEmpty()) {
        types.add(eventType);
      }
    });
    return Set.copyOf(types);
  }

  @Override
  public boolean supports(String eventType) {
    return !handlersFor(eventType).isEmpty();
  }

  @Override
  public BusStatistics statistics() {
    int types = 0;
    int count = 0;
    for (List<EventHandler> handlers : subscriptions.values()) {
      if (!handlers.isEmpty()) {
        types++;
        count += handlers.size();
      }
    }
    return new BusStatistics(types, count, interceptors.size(), 0);
  }

  List<EventHandler> handlersFor(String eventType) {
    List<EventHandler> result = new ArrayList<>();
    CopyOnWriteArrayList<EventHandler> specific = subscriptions.get(eventType);
    if (specific != null) {
      result.addAll(specific);
    }
    CopyOnWriteArrayList<EventHandler> all = subscriptions.get(ALL_EVENTS);
    if (all != null) {
      result.addAll(all);
    }
    return result;
  }

  private List<HandlerFailure> dispatch(DomainEvent event) {
    Objects.requireNonNull(event, "event");
    List<HandlerEntry> entries = new ArrayList<>();
    for (EventHandler handler : handlersFor(event.eventType())) {
      entries.add(new HandlerEntry(handler));
    }
    if (entries.isEmpty()) {
      logger.log(Level.FINE, "No subscribers for {0}", event.eventType());
    }
    List<HandlerFailure> failures;
    try {
      failures = interceptors.invoke(event, () -> {
        List<HandlerFailure> result = fanOut(event, entries);
        if (!result.isEmpty()) {
          throw new AggregateHandlerException(result);
        }
        return result;
      });
    } catch (AggregateHandlerException e) {
      failures = e.failures();
    } catch (Exception e) {
      throw new HandlerExecutionException(event.eventType(), e);
    }
    metrics.incrementEventsPublished();
    return failures;
  }

  private List<HandlerFailure> fanOut(DomainEvent event, List<HandlerEntry> entries) {
    if (executor == null || entries.size() < 2 || IN_FAN_OUT.get() != null) {
      for (HandlerEntry entry : entries) {
        entry.run(event);
      }
    } else {
      CompletableFuture<?>[] futures = new CompletableFuture<?>[entries.size()];
      for (int i = 0; i < entries.size(); i++) {
        HandlerEntry entry = entries.get(i);
        try {
          futures[i] = CompletableFuture.runAsync(() -> runInFanOut(entry, event), executor);
        } catch (RuntimeException rejected) {
          entry.fail(rejected);
          futures[i] = CompletableFuture.completedFuture(null);
        }
      }
      CompletableFuture.allOf(futures).join();
    }

    List<HandlerFailure> failures = new ArrayList<>();
    for (HandlerEntry entry : entries) {
      Exception error = entry.error;
      if (error != null) {
        metrics.incrementEventHandlerFailures();
        logger.log(Level.WARNING, "Event handler " + entry.handler.name()
            + " failed for eventId=" + event.eventId(), error);
        failures.add(new HandlerFailure(event.eventId(), event.eventType(), entry.handler.name(), error));
      }
    }
    return failures;
  }

  private static void runInFanOut(HandlerEntry entry, DomainEvent event) {
    IN_FAN_OUT.set(Boolean.TRUE);
    try {
      entry.run(event);
    } finally {
      IN_FAN_OUT.remove();
    }
  }

  private static final class HandlerEntry {
    final EventHandler handler;
    volatile Exception error;

    HandlerEntry(EventHandler handler) {
      this.handler = handler;
    }

    void run(DomainEvent event) {
      try {
        handler.handle(event);
      } catch (Exception e) {
        fail(e);
      }
    }

    void fail(Exception e) {
      error = e;
    }
  }

  /**
   * Builder for {@link DefaultEventBus}.
   */
  public static final class Builder {
    private Executor executor;
    private MetricsExporter metrics = MetricsExporter.NOOP;

    private Builder() {
    }

    /**
     * Sets the executor subscribers run on.
     *
     * <p>Optional. When unset, subscribers run sequentially on the publishing thread.
     * The bus never shuts the executor down; its owner does.
     *
     * @param executor the fan-out executor
     * @return this builder
     */
    public Builder executor(Executor executor) {
      this.executor = executor;
      return this;
    }

    /**
     * Sets the metrics exporter for publish and failure counters.
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

    public DefaultEventBus build() {
      return new DefaultEventBus(this);
    }
  }
}
