/**
 * JDBC implementation of the event store.
 *
 * <h2>Key Components</h2>
 * <ul>
 *   <li>{@link io.eventlog.jdbc.JdbcEventStore} - the {@link io.eventlog.EventStore}</li>
 *   <li>{@link io.eventlog.jdbc.store.JdbcEventRecordStores} - per-database SQL, auto-detected</li>
 *   <li>{@link io.eventlog.jdbc.tx.JdbcTransactionManager} - connection-per-transaction handling</li>
 *   <li>{@link io.eventlog.jdbc.DataSourceConnectionProvider} - {@link javax.sql.DataSource} adapter</li>
 * </ul>
 *
 * <p>Table DDL for each database ships as {@code META-INF/eventlog/schema-<name>.sql}.
 */
package io.eventlog.jdbc;
