/**
 * Per-database SQL for the event table, discovered via {@link java.util.ServiceLoader}.
 *
 * <h2>Built-in Record Stores</h2>
 * <ul>
 *   <li>{@link io.eventlog.jdbc.store.H2EventRecordStore} - {@code jdbc:h2:}</li>
 *   <li>{@link io.eventlog.jdbc.store.MySqlEventRecordStore} - {@code jdbc:mysql:},
 *       {@code jdbc:tidb:}, {@code jdbc:mariadb:}</li>
 *   <li>{@link io.eventlog.jdbc.store.PostgresEventRecordStore} - {@code jdbc:postgresql:}</li>
 * </ul>
 *
 * @see io.eventlog.jdbc.store.JdbcEventRecordStores
 */
package io.eventlog.jdbc.store;
