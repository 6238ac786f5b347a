package io.eventlog.bus.query;

import io.eventlog.bus.BusStatistics;
import io.eventlog.bus.DispatchInterceptor;
import io.eventlog.bus.DuplicateHandlerException;
import io.eventlog.bus.HandlerExecutionException;
import io.eventlog.bus.Interceptors;
import io.eventlog.bus.NoHandlerException;
import io.eventlog.spi.MetricsExporter;

import java.time.Clock;
import java.time.Duration;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Thread-safe {@link QueryBus} with a bounded TTL result cache.
 *
 * <p>Concurrent identical queries on a cold key may both run their handler; the
 * last result stored wins. A result whose handler was still running when the cache
 * was invalidated is returned to its caller but not cached. Interceptors wrap
 * handler invocation only, so cache hits bypass them.
 *
 * <h2>Usage</h2>
 * <pre>{@code
 * DefaultQueryBus bus = DefaultQueryBus.builder()
 *     .defaultTtl(Duration.ofSeconds(30))
 *     .maxEntries(5_000)
 *     .build();
 * bus.register(OrderById.class, query -> orders.find(query.orderId()));
 * Order order = bus.execute(new OrderById("order-1"));
 * }</pre>
 */
public final class DefaultQueryBus implements QueryBus {
  private static final Logger logger = Logger.getLogger(DefaultQueryBus.class.getName());

  private final Map<String, Registration> handlers = new ConcurrentHashMap<>();
  private final Interceptors<Query<?>> interceptors = new Interceptors<>();
  private final QueryCache cache;
  private final Duration defaultTtl;
  private final MetricsExporter metrics;

  private DefaultQueryBus(Builder builder) {
    this.cache = new QueryCache(builder.clock, builder.maxEntries);
    this.defaultTtl = builder.defaultTtl;
    this.metrics = builder.metrics;
  }

  public static Builder builder() {
    return new Builder();
  }

  @Override
  public <Q extends Query<R>, R> void register(String queryType, QueryHandler<Q, R> handler) {
    register(queryType, handler, defaultTtl);
  }

  @Override
  @SuppressWarnings("unchecked")
  public <Q extends Query<R>, R> void register(String queryType, QueryHandler<Q, R> handler, Duration ttl) {
    Objects.requireNonNull(queryType, "queryType");
    Objects.requireNonNull(handler, "handler");
    Objects.requireNonNull(ttl, "ttl");
    if (ttl.isNegative()) {
      throw new IllegalArgumentException("ttl must be >= 0");
    }
    if (!handler.supports(queryType)) {
      throw new IllegalArgumentException("Handler does not support query type: " + queryType);
    }
    Registration registration = new Registration((QueryHandler<Query<Object>, Object>) (QueryHandler<?, ?>) handler, ttl);
    if (handlers.putIfAbsent(queryType, registration) != null) {
      throw new DuplicateHandlerException("query", queryType);
    }
    logger.log(Level.FINE, "Registered query handler for {0} (ttl={1})", new Object[]{queryType, ttl});
  }

  @Override
  public boolean unregister(String queryType) {
    boolean removed = handlers.remove(queryType) != null;
    cache.invalidateType(queryType);
    return removed;
  }

  @Override
  public boolean hasHandler(String queryType) {
    return handlers.containsKey(queryType);
  }

  @Override
  public Set<String> registeredTypes() {
    return Set.copyOf(handlers.keySet());
  }

  @Override
  public boolean supports(String queryType) {
    return hasHandler(queryType);
  }

  @Override
  @SuppressWarnings("unchecked")
  public <R> R execute(Query<R> query) {
    Objects.requireNonNull(query, "query");
    String queryType = query.queryType();
    Registration registration = handlers.get(queryType);
    if (registration == null) {
      throw new NoHandlerException("query", queryType);
    }
    metrics.incrementQueriesExecuted();

    boolean cacheable = !registration.ttl.isZero();
    if (cacheable) {
      Optional<QueryCache.Hit> hit = cache.get(queryType, query.cacheKey());
      if (hit.isPresent()) {
        metrics.incrementQueryCacheHits();
        return (R) hit.get().value();
      }
      metrics.incrementQueryCacheMisses();
    }

    long generation = cache.generation();
    Object result;
    try {
      result = interceptors.invoke(query, () -> registration.handler.handle((Query<Object>) (Query<?>) query));
    } catch (Exception e) {
      logger.log(Level.WARNING, "Query handler failed for " + queryType, e);
      throw new HandlerExecutionException(queryType, e);
    }
    if (cacheable) {
      cache.putIfCurrent(generation, queryType, query.cacheKey(), result, registration.ttl);
    }
    return (R) result;
  }

  @Override
  public void invalidate(Query<?> query) {
    cache.invalidate(query.queryType(), query.cacheKey());
  }

  @Override
  public void invalidateType(String queryType) {
    cache.invalidateType(queryType);
  }

  @Override
  public void clearCache() {
    cache.clear();
  }

  @Override
  public void addInterceptor(DispatchInterceptor<Query<?>> interceptor) {
    interceptors.add(interceptor);
  }

  @Override
  public void clear() {
    handlers.clear();
    interceptors.clear();
    cache.clear();
  }

  @Override
  public BusStatistics statistics() {
    int registered = handlers.size();
    return new BusStatistics(registered, registered, interceptors.size(), cache.size());
  }

  private static final class Registration {
    final QueryHandler<Query<Object>, Object> handler;
    final Duration ttl;

    Registration(QueryHandler<Query<Object>, Object> handler, Duration ttl) {
      this.handler = handler;
      this.ttl = ttl;
    }
  }

  /**
   * Builder for {@link DefaultQueryBus}.
   */
  public static final class Builder {
    private Clock clock = Clock.systemUTC();
    private Duration defaultTtl = Duration.ZERO;
    private int maxEntries = 1_000;
    private MetricsExporter metrics = MetricsExporter.NOOP;

    private Builder() {
    }

    /**
     * Sets the clock used for cache expiry.
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
     * Sets the cache TTL applied by {@link QueryBus#register(String, QueryHandler)}.
     *
     * <p>Optional. Defaults to {@link Duration#ZERO} (no caching).
     *
     * @param defaultTtl the default TTL
     * @return this builder
     */
    public Builder defaultTtl(Duration defaultTtl) {
      this.defaultTtl = Objects.requireNonNull(defaultTtl, "defaultTtl");
      return this;
    }

    /**
     * Sets the cache capacity; the oldest entry is evicted beyond it.
     *
     * <p>Optional. Defaults to 1000.
     *
     * @param maxEntries the capacity, &ge; 1
     * @return this builder
     */
    public Builder maxEntries(int maxEntries) {
      this.maxEntries = maxEntries;
      return this;
    }

    /**
     * Sets the metrics exporter for execution and cache counters.
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
     * Builds the query bus.
     *
     * @throws IllegalArgumentException if {@code defaultTtl} is negative or {@code maxEntries < 1}
     */
    public DefaultQueryBus build() {
      if (defaultTtl.isNegative()) {
        throw new IllegalArgumentException("defaultTtl must be >= 0");
      }
      if (maxEntries < 1) {
        throw new IllegalArgumentException("maxEntries must be >= 1");
      }
      return new DefaultQueryBus(this);
    }
  }
}
