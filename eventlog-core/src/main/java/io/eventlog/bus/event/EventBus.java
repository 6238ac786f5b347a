package io.eventlog.bus.event;

import io.eventlog.DomainEvent;
import io.eventlog.EventType;
import io.eventlog.bus.DispatchInterceptor;
import io.eventlog.bus.SubBus;

import java.util.List;
import java.util.Set;

/**
 * Fans each published event out to every handler subscribed to its type, plus
 * every wildcard subscriber.
 *
 * @see DefaultEventBus
 */
public interface EventBus extends SubBus {

  void subscribe(String eventType, EventHandler handler);

  default void subscribe(EventType eventType, EventHandler handler) {
    subscribe(eventType.name(), handler);
  }

  /**
   * Subscribes {@code handler} to every event type.
   */
  void subscribeAll(EventHandler handler);

  /**
   * Removes one subscription of {@code handler} to {@code eventType}.
   *
   * @return true if a subscription was removed
   */
  boolean unsubscribe(String eventType, EventHandler handler);

  /**
   * Delivers the event to all matching subscribers. Every subscriber is attempted
   * exactly once before any failure is reported.
   *
   * @throws io.eventlog.bus.AggregateHandlerException if one or more subscribers failed
   * @throws io.eventlog.bus.HandlerExecutionException if an interceptor aborted delivery
   */
  void publish(DomainEvent event);

  /**
   * Publishes each event in order. Subscriber failures from all events are reported
   * together in one {@link io.eventlog.bus.AggregateHandlerException} at the end.
   *
   * <p>An interceptor that aborts delivery of one event stops the batch: the remaining
   * events are not published, and the {@link io.eventlog.bus.HandlerExecutionException}
   * carries the subscriber failures of earlier events as a suppressed
   * {@code AggregateHandlerException}.
   */
  void publishAll(List<DomainEvent> events);

  void addInterceptor(DispatchInterceptor<DomainEvent> interceptor);

  /**
   * Returns the event types with at least one subscriber, including {@code "*"}
   * while wildcard subscribers exist.
   */
  @Override
  Set<String> registeredTypes();

  /**
   * Reports whether publishing an event of {@code eventType} would reach a
   * subscriber, counting wildcard subscribers.
   */
  @Override
  boolean supports(String eventType);
}
