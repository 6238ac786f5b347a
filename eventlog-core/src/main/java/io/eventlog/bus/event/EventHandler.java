package io.eventlog.bus.event;

import io.eventlog.DomainEvent;

/**
 * Reacts to published domain events. Any number of handlers may subscribe to one
 * event type; each is invoked once per published event.
 *
 * <p>Handlers should be idempotent with respect to {@link DomainEvent#eventId()}:
 * a caller that republishes after an {@link io.eventlog.bus.AggregateHandlerException}
 * reaches the handlers that succeeded again.
 */
@FunctionalInterface
public interface EventHandler {

  void handle(DomainEvent event) throws Exception;

  /**
   * Returns whether this handler accepts events of {@code eventType}.
   * Subscription is rejected for unsupported types.
   */
  default boolean supports(String eventType) {
    return true;
  }

  /**
   * Returns the name reported in {@link io.eventlog.bus.HandlerFailure}s.
   */
  default String name() {
    return getClass().getName();
  }

  /**
   * Wraps {@code handler} so failures report {@code name}.
   */
  static EventHandler named(String name, EventHandler handler) {
    return new EventHandler() {
      @Override
      public void handle(DomainEvent event) throws Exception {
        handler.handle(event);
      }

      @Override
      public boolean supports(String eventType) {
        return handler.supports(eventType);
      }

      @Override
      public String name() {
        return name;
      }

      @Override
      public String toString() {
        return name;
      }
    };
  }
}
