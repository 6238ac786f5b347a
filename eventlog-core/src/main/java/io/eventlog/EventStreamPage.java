package io.eventlog;

import java.util.List;
import java.util.Objects;

/**
 * One page of the global event stream, ordered by the storage-assigned sequence.
 *
 * @param events     events on this page, in storage order
 * @param nextCursor opaque cursor to pass to {@link EventStore#getEventStream} for the
 *                   next page, or {@code null} when the page is empty
 * @param hasMore    whether at least one further event existed when this page was read
 */
public record EventStreamPage(List<DomainEvent> events, String nextCursor, boolean hasMore) {

  public EventStreamPage {
    events = List.copyOf(Objects.requireNonNull(events, "events"));
  }

  public static EventStreamPage empty() {
    return new EventStreamPage(List.of(), null, false);
  }
}
