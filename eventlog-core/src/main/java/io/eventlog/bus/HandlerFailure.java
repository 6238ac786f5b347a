package io.eventlog.bus;

import java.util.Objects;

/**
 * One subscriber's failure while handling a published event.
 *
 * @param eventId   the event being handled
 * @param eventType the event's type
 * @param handler   a description of the failing handler
 * @param error     what the handler threw
 */
public record HandlerFailure(String eventId, String eventType, String handler, Exception error) {

  public HandlerFailure {
    Objects.requireNonNull(eventId, "eventId");
    Objects.requireNonNull(eventType, "eventType");
    Objects.requireNonNull(handler, "handler");
    Objects.requireNonNull(error, "error");
  }
}
