package io.eventlog;

/**
 * Identifies the schema and behavior of a {@link DomainEvent}.
 *
 * <p>Enums satisfy the contract without overriding anything:
 * <pre>{@code
 * public enum OrderEvents implements EventType {
 *   ORDER_PLACED,
 *   ORDER_SHIPPED
 * }
 *
 * DomainEvent event = DomainEvent.builder(OrderEvents.ORDER_PLACED)
 *     .payloadJson("{\"sku\":\"A-1\"}")
 *     .build();
 * }</pre>
 */
public interface EventType {

  /**
   * Returns the event type tag. This value is persisted and used for
   * event-bus routing and {@link EventStore#getEventsByType} queries.
   *
   * @return the event type name, never null
   */
  default String name() {
    return this.getClass().getName();
  }
}
