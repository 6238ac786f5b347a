package io.eventlog.spi;

import java.sql.Connection;
import java.sql.SQLException;

/**
 * Source of JDBC connections for the event store. Every store operation obtains its
 * own connection and closes it before returning; connections are never shared
 * between concurrent operations.
 *
 * @see io.eventlog.jdbc.DataSourceConnectionProvider
 */
@FunctionalInterface
public interface ConnectionProvider {

  /**
   * Obtains a new JDBC connection.
   *
   * @return an open connection; the caller must close it
   * @throws SQLException if a connection cannot be obtained
   */
  Connection getConnection() throws SQLException;
}
