package io.eventlog.bus.query;

/**
 * Read request answered by exactly one {@link QueryHandler}.
 *
 * <p>Cached results are keyed by {@link #queryType()} plus {@link #cacheKey()}, which
 * defaults to the query itself; records therefore give value-based cache identity.
 *
 * @param <R> the result type
 */
public interface Query<R> {

  default String queryType() {
    return getClass().getSimpleName();
  }

  /**
   * Returns the identity used for result caching. Must implement {@code equals}
   * and {@code hashCode} consistently.
   */
  default Object cacheKey() {
    return this;
  }
}
