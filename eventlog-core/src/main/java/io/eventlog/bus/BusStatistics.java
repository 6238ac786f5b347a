package io.eventlog.bus;

/**
 * Point-in-time counts for one sub-bus.
 *
 * @param handlers      registered message types
 * @param subscriptions registered handlers; differs from {@code handlers} only on the
 *                      event bus, where one type can have many subscribers
 * @param interceptors  registered {@link DispatchInterceptor}s
 * @param cacheEntries  live cached results; always {@code 0} for buses without a cache
 */
public record BusStatistics(int handlers, int subscriptions, int interceptors, int cacheEntries) {

  public static final BusStatistics EMPTY = new BusStatistics(0, 0, 0, 0);
}
