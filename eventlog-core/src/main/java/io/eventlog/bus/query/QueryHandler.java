package io.eventlog.bus.query;

/**
 * Answers one query type.
 *
 * @param <Q> the query type
 * @param <R> the result type
 */
@FunctionalInterface
public interface QueryHandler<Q extends Query<R>, R> {

  R handle(Q query) throws Exception;

  default boolean supports(String queryType) {
    return true;
  }
}
