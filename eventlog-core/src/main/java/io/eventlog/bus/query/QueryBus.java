package io.eventlog.bus.query;

import io.eventlog.bus.DispatchInterceptor;
import io.eventlog.bus.SubBus;

import java.time.Duration;

/**
 * Routes each query to the single handler registered for its type, optionally
 * serving results from a TTL cache.
 *
 * @see DefaultQueryBus
 */
public interface QueryBus extends SubBus {

  /**
   * Registers the handler with the bus's default cache TTL.
   *
   * @throws io.eventlog.bus.DuplicateHandlerException if the type already has a handler
   */
  <Q extends Query<R>, R> void register(String queryType, QueryHandler<Q, R> handler);

  /**
   * Registers the handler and caches its results for {@code ttl}.
   * {@link Duration#ZERO} disables caching for this type.
   */
  <Q extends Query<R>, R> void register(String queryType, QueryHandler<Q, R> handler, Duration ttl);

  default <Q extends Query<R>, R> void register(Class<Q> queryClass, QueryHandler<Q, R> handler) {
    register(queryClass.getSimpleName(), handler);
  }

  /**
   * Removes the handler and its cached results.
   *
   * @return true if a handler was removed
   */
  boolean unregister(String queryType);

  boolean hasHandler(String queryType);

  /**
   * Returns the (possibly cached) result of the query.
   *
   * @throws io.eventlog.bus.NoHandlerException        if no handler is registered
   * @throws io.eventlog.bus.HandlerExecutionException if the handler or an interceptor fails
   */
  <R> R execute(Query<R> query);

  /**
   * Drops the cached result for this exact query.
   */
  void invalidate(Query<?> query);

  /**
   * Drops every cached result of {@code queryType}.
   */
  void invalidateType(String queryType);

  void clearCache();

  void addInterceptor(DispatchInterceptor<Query<?>> interceptor);
}
