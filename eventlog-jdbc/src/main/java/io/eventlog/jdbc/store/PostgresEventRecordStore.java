package io.eventlog.jdbc.store;

import java.sql.SQLException;
import java.util.List;

/**
 * PostgreSQL record store.
 *
 * <p>Only SQLState {@code 23505} (unique_violation) and class {@code 40} (serialization
 * failure, deadlock) count as write conflicts; other integrity errors such as not-null
 * violations stay storage failures.
 */
public final class PostgresEventRecordStore extends AbstractJdbcEventRecordStore {
  private static final String UNIQUE_VIOLATION = "23505";

  public PostgresEventRecordStore() {
    super();
  }

  public PostgresEventRecordStore(String tableName) {
    super(tableName);
  }

  @Override
  public String name() {
    return "postgresql";
  }

  @Override
  public List<String> jdbcUrlPrefixes() {
    return List.of("jdbc:postgresql:");
  }

  @Override
  public AbstractJdbcEventRecordStore withTableName(String tableName) {
    return new PostgresEventRecordStore(tableName);
  }

  @Override
  public boolean isWriteConflict(SQLException e) {
    for (SQLException current = e; current != null; current = current.getNextException()) {
      String state = current.getSQLState();
      if (UNIQUE_VIOLATION.equals(state) || (state != null && state.startsWith("40"))) {
        return true;
      }
    }
    return false;
  }
}
