package io.eventlog.bus;

/**
 * Thrown when a command or query is dispatched and no handler is registered for its type.
 */
public final class NoHandlerException extends RuntimeException {
  private final String messageType;

  public NoHandlerException(String kind, String messageType) {
    super("No " + kind + " handler registered for type: " + messageType);
    this.messageType = messageType;
  }

  public String messageType() {
    return messageType;
  }
}
