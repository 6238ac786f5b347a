package io.eventlog.bus;

import java.util.Objects;

/**
 * Aggregated counts over the three sub-buses of a {@link CqrsBus}.
 */
public record CqrsBusStatistics(
    BusState state,
    BusStatistics commands,
    BusStatistics queries,
    BusStatistics events) {

  public CqrsBusStatistics {
    Objects.requireNonNull(state, "state");
    Objects.requireNonNull(commands, "commands");
    Objects.requireNonNull(queries, "queries");
    Objects.requireNonNull(events, "events");
  }

  public int totalHandlers() {
    return commands.handlers() + queries.handlers() + events.handlers();
  }

  public int totalSubscriptions() {
    return commands.subscriptions() + queries.subscriptions() + events.subscriptions();
  }

  public int totalInterceptors() {
    return commands.interceptors() + queries.interceptors() + events.interceptors();
  }

  public int totalCacheEntries() {
    return commands.cacheEntries() + queries.cacheEntries() + events.cacheEntries();
  }
}
