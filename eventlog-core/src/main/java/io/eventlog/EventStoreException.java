package io.eventlog;

/**
 * Unchecked exception wrapping storage-transport errors raised while reading or
 * writing events. The original driver exception is always kept as the cause.
 */
public class EventStoreException extends RuntimeException {

  public EventStoreException(String message, Throwable cause) {
    super(message, cause);
  }
}
