/**
 * JDBC transaction handling for the append path.
 *
 * <p>A {@link io.eventlog.jdbc.tx.JdbcTransactionManager.Transaction} owns exactly one
 * connection and is never shared between threads or calls.
 */
package io.eventlog.jdbc.tx;
