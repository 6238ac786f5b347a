package io.eventlog;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Append-only, per-aggregate event log with optimistic concurrency control.
 *
 * <p>Every aggregate owns a stream whose stored versions are exactly
 * {@code 1..currentVersion}. {@link #saveEvents} is the only write path and the only
 * concurrency gate: it succeeds only when the caller's {@code expectedVersion} equals
 * the stream's current version, and then appends the whole batch atomically.
 *
 * <h2>Errors</h2>
 * <ul>
 *   <li>{@link ConcurrencyException}: the expected version is stale</li>
 *   <li>{@link CorruptEventException}: a stored row could not be decoded</li>
 *   <li>{@link EventStoreException}: the database call failed</li>
 * </ul>
 *
 * <p>Implementations never retry internally. Reads are finite and restartable.
 *
 * <h2>Usage</h2>
 * <pre>{@code
 * long version = store.getCurrentVersion("order-1");
 * store.saveEvents("order-1", List.of(
 *     DomainEvent.of("OrderPlaced", "order-1", "{\"total\":42}")), version);
 * }</pre>
 */
public interface EventStore {

  /**
   * Appends {@code events} to the aggregate's stream. The events receive versions
   * {@code expectedVersion + 1, expectedVersion + 2, ...} in list order.
   *
   * <p>An empty list returns immediately without touching storage.
   *
   * @param aggregateId     the aggregate whose stream is appended to
   * @param events          events to append, in order
   * @param expectedVersion the version the caller last observed ({@code 0} for a new aggregate)
   * @throws ConcurrencyException if the stream's current version differs from {@code expectedVersion}
   * @throws EventStoreException  if storage fails; no event of the batch is stored
   */
  void saveEvents(String aggregateId, List<DomainEvent> events, long expectedVersion);

  /**
   * Returns the aggregate's full stream in ascending version order.
   */
  default List<DomainEvent> getEvents(String aggregateId) {
    return getEvents(aggregateId, 1);
  }

  /**
   * Returns the aggregate's events with {@code version >= fromVersion}, ascending.
   */
  List<DomainEvent> getEvents(String aggregateId, long fromVersion);

  /**
   * Returns all events of the given type across aggregates, ascending by {@code occurredAt}.
   */
  default List<DomainEvent> getEventsByType(String eventType) {
    return getEventsByType(eventType, null);
  }

  /**
   * Returns events of the given type with {@code occurredAt >= fromDate}, ascending by
   * {@code occurredAt}. A {@code null} {@code fromDate} means no lower bound.
   */
  List<DomainEvent> getEventsByType(String eventType, Instant fromDate);

  /**
   * Reads one page of the global stream in storage order.
   *
   * @param fromCursor cursor from a previous page's {@link EventStreamPage#nextCursor()},
   *                   or {@code null} to start at the beginning
   * @param limit      maximum number of events to return, &ge; 1
   * @throws IllegalArgumentException if {@code limit < 1} or the cursor is malformed
   */
  EventStreamPage getEventStream(String fromCursor, int limit);

  /**
   * Returns the aggregate's current version, {@code 0} if it has no events.
   */
  long getCurrentVersion(String aggregateId);

  boolean exists(String aggregateId);

  /**
   * Hard-deletes the aggregate's whole stream. Not reversible; meant for test
   * cleanup and compensating actions, not normal domain flow.
   */
  void deleteEvents(String aggregateId);

  /**
   * Looks up a single event by id.
   */
  Optional<DomainEvent> getEvent(String eventId);

  /**
   * Returns event and aggregate counts over the whole store.
   */
  EventStoreStatistics getStatistics();
}
