package io.eventlog.jdbc.store;

import java.util.List;

/**
 * H2 record store. Primarily for testing.
 */
public final class H2EventRecordStore extends AbstractJdbcEventRecordStore {

  public H2EventRecordStore() {
    super();
  }

  public H2EventRecordStore(String tableName) {
    super(tableName);
  }

  @Override
  public String name() {
    return "h2";
  }

  @Override
  public List<String> jdbcUrlPrefixes() {
    return List.of("jdbc:h2:");
  }

  @Override
  public AbstractJdbcEventRecordStore withTableName(String tableName) {
    return new H2EventRecordStore(tableName);
  }
}
