package io.eventlog.jdbc.tx;

import io.eventlog.spi.ConnectionProvider;

import java.sql.Connection;
import java.sql.SQLException;
import java.util.Objects;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Transaction manager for the event store's append path. Each {@link #begin()} obtains
 * a fresh connection with auto-commit disabled; the connection belongs to the returned
 * {@link Transaction} alone and is closed when the transaction completes.
 *
 * <p>Use via try-with-resources on the returned {@link Transaction}:
 * <pre>{@code
 * try (var tx = txManager.begin()) {
 *     recordStore.insert(tx.connection(), record);
 *     tx.commit();
 * }
 * }</pre>
 */
public final class JdbcTransactionManager {
  private static final Logger logger = Logger.getLogger(JdbcTransactionManager.class.getName());

  private final ConnectionProvider connectionProvider;

  public JdbcTransactionManager(ConnectionProvider connectionProvider) {
    this.connectionProvider = Objects.requireNonNull(connectionProvider, "connectionProvider");
  }

  /**
   * Begins a new transaction on a newly obtained connection.
   *
   * @return a new {@link Transaction} handle (use with try-with-resources)
   * @throws SQLException if a connection cannot be obtained or configured
   */
  public Transaction begin() throws SQLException {
    Connection connection = connectionProvider.getConnection();
    try {
      connection.setAutoCommit(false);
    } catch (SQLException e) {
      closeQuietly(connection, e);
      throw e;
    }
    return new Transaction(connection);
  }

  private static void closeQuietly(Connection connection, SQLException primary) {
    try {
      connection.close();
    } catch (SQLException e) {
      primary.addSuppressed(e);
    }
  }

  /**
   * An active transaction handle. Supports explicit {@link #commit()} and {@link #rollback()}.
   * If neither is called, {@link #close()} triggers a rollback automatically.
   */
  public static final class Transaction implements AutoCloseable {
    private final Connection connection;
    private boolean completed;

    private Transaction(Connection connection) {
      this.connection = connection;
    }

    /**
     * Returns the connection bound to this transaction.
     *
     * @throws IllegalStateException if the transaction has completed
     */
    public Connection connection() {
      if (completed) {
        throw new IllegalStateException("Transaction already completed");
      }
      return connection;
    }

    public boolean isCompleted() {
      return completed;
    }

    public void commit() throws SQLException {
      if (completed) {
        return;
      }
      try {
        connection.commit();
      } catch (SQLException e) {
        safeRollback(e);
        finalizeTx(e);
        throw e;
      }
      finalizeTx(null);
    }

    public void rollback() throws SQLException {
      if (completed) {
        return;
      }
      try {
        connection.rollback();
      } catch (SQLException e) {
        finalizeTx(e);
        throw e;
      }
      finalizeTx(null);
    }

    @Override
    public void close() throws SQLException {
      if (!completed) {
        rollback();
      }
    }

    private void finalizeTx(SQLException primary) throws SQLException {
      completed = true;
      try {
        connection.setAutoCommit(true);
      } catch (SQLException e) {
        if (primary != null) {
          primary.addSuppressed(e);
        } else {
          logger.log(Level.FINE, "Failed to restore auto-commit", e);
        }
      } finally {
        try {
          connection.close();
        } catch (SQLException e) {
          if (primary == null) {
            throw e;
          }
          primary.addSuppressed(e);
        }
      }
    }

    private void safeRollback(SQLException primary) {
      try {
        connection.rollback();
      } catch (SQLException e) {
        primary.addSuppressed(e);
      }
    }
  }
}
