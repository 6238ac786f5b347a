/**
 * Spring Boot auto-configuration for the event store and CQRS bus.
 *
 * <p>Add this module and a {@link javax.sql.DataSource}; the starter provides an
 * {@link io.eventlog.EventStore} and an initialized {@link io.eventlog.bus.CqrsBus}.
 * Configure it under the {@code eventlog.*} prefix (see
 * {@link io.eventlog.spring.boot.EventLogProperties}) and register handlers with
 * {@link io.eventlog.spring.boot.BusConfigurer} beans. The event table itself is not
 * created; run {@code META-INF/eventlog/schema-<database>.sql} from {@code eventlog-jdbc}
 * through your migration tool or {@code spring.sql.init}.
 */
package io.eventlog.spring.boot;
