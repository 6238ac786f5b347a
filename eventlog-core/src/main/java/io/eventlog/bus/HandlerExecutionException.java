package io.eventlog.bus;

/**
 * Wraps the failure of a command or query handler (or of an interceptor's
 * before hook). The original error is preserved as the cause.
 */
public final class HandlerExecutionException extends RuntimeException {
  private final String messageType;

  public HandlerExecutionException(String messageType, Throwable cause) {
    super("Handler failed for type " + messageType + ": " + cause, cause);
    this.messageType = messageType;
  }

  public String messageType() {
    return messageType;
  }
}
