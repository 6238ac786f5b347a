/**
 * Query side of the bus: one handler per query type plus a TTL result cache.
 *
 * <p>{@link io.eventlog.bus.query.QueryCache} never returns an entry after it has
 * expired or been invalidated.
 */
package io.eventlog.bus.query;
