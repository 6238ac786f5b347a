package io.eventlog;

/**
 * Thrown when a stored event row cannot be turned back into a {@link DomainEvent}.
 *
 * <p>Not recoverable by retrying; the row named by {@link #eventId()} needs manual repair.
 */
public final class CorruptEventException extends RuntimeException {

  private final String eventId;

  public CorruptEventException(String eventId, String message) {
    this(eventId, message, null);
  }

  public CorruptEventException(String eventId, String message, Throwable cause) {
    super("Failed to deserialize event " + eventId + ": " + message, cause);
    this.eventId = eventId;
  }

  public String eventId() {
    return eventId;
  }
}
