package io.eventlog.bus;

import java.util.Set;

/**
 * Capabilities every sub-bus offers to the {@link CqrsBus} façade.
 *
 * @see io.eventlog.bus.command.CommandBus
 * @see io.eventlog.bus.query.QueryBus
 * @see io.eventlog.bus.event.EventBus
 */
public interface SubBus {

  /**
   * Removes every handler, subscription, interceptor and cached entry.
   */
  void clear();

  /**
   * Returns current counts; read-only.
   */
  BusStatistics statistics();

  /**
   * Returns a snapshot of the message types this bus has handlers for.
   */
  Set<String> registeredTypes();

  /**
   * Reports whether a message of {@code type} would reach at least one handler.
   */
  default boolean supports(String type) {
    return registeredTypes().contains(type);
  }

  /**
   * Reports whether this bus can dispatch. Buses without a deeper check are always healthy.
   */
  default boolean isHealthy() {
    return true;
  }
}
