package io.eventlog;

import java.util.Map;

/**
 * Point-in-time counts over the whole event store.
 *
 * @param totalEvents     number of stored events
 * @param totalAggregates number of distinct aggregates with at least one event
 * @param eventsByType    event count per event type
 * @param eventsByTenant  event count per tenant
 */
public record EventStoreStatistics(
    long totalEvents,
    long totalAggregates,
    Map<String, Long> eventsByType,
    Map<String, Long> eventsByTenant
) {

  public EventStoreStatistics {
    eventsByType = Map.copyOf(eventsByType);
    eventsByTenant = Map.copyOf(eventsByTenant);
  }
}
