package io.eventlog.bus;

/**
 * Thrown at registration time when a type that admits exactly one handler
 * already has one.
 */
public final class DuplicateHandlerException extends IllegalStateException {
  private final String messageType;

  public DuplicateHandlerException(String kind, String messageType) {
    super("A " + kind + " handler is already registered for type: " + messageType);
    this.messageType = messageType;
  }

  public String messageType() {
    return messageType;
  }
}
