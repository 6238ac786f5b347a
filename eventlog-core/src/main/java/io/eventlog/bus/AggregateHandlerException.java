package io.eventlog.bus;

import java.util.List;

/**
 * Raised after a publish once every subscriber has been attempted, listing each
 * subscriber that failed. Each failure is also attached as a suppressed exception.
 */
public final class AggregateHandlerException extends RuntimeException {
  private final List<HandlerFailure> failures;

  public AggregateHandlerException(List<HandlerFailure> failures) {
    super(describe(failures));
    this.failures = List.copyOf(failures);
    for (HandlerFailure failure : this.failures) {
      addSuppressed(failure.error());
    }
  }

  public List<HandlerFailure> failures() {
    return failures;
  }

  private static String describe(List<HandlerFailure> failures) {
    if (failures.isEmpty()) {
      throw new IllegalArgumentException("failures cannot be empty");
    }
    StringBuilder sb = new StringBuilder()
        .append(failures.size()).append(" event handler(s) failed");
    for (HandlerFailure failure : failures) {
      sb.append("; ").append(failure.handler())
          .append(" on ").append(failure.eventType()).append('/').append(failure.eventId())
          .append(": ").append(failure.error());
    }
    return sb.toString();
  }
}
