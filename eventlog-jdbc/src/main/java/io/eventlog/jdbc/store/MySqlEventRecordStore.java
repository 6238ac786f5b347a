package io.eventlog.jdbc.store;

import java.sql.SQLException;
import java.util.List;

/**
 * MySQL record store (also handles TiDB and MariaDB URLs).
 *
 * <p>MySQL reports duplicate keys as vendor code 1062 and deadlocks as 1213.
 */
public final class MySqlEventRecordStore extends AbstractJdbcEventRecordStore {
  private static final int ER_DUP_ENTRY = 1062;
  private static final int ER_LOCK_DEADLOCK = 1213;

  public MySqlEventRecordStore() {
    super();
  }

  public MySqlEventRecordStore(String tableName) {
    super(tableName);
  }

  @Override
  public String name() {
    return "mysql";
  }

  @Override
  public List<String> jdbcUrlPrefixes() {
    return List.of("jdbc:mysql:", "jdbc:tidb:", "jdbc:mariadb:");
  }

  @Override
  public AbstractJdbcEventRecordStore withTableName(String tableName) {
    return new MySqlEventRecordStore(tableName);
  }

  @Override
  public boolean isWriteConflict(SQLException e) {
    for (SQLException current = e; current != null; current = current.getNextException()) {
      int code = current.getErrorCode();
      if (code == ER_DUP_ENTRY || code == ER_LOCK_DEADLOCK) {
        return true;
      }
    }
    return super.isWriteConflict(e);
  }
}
