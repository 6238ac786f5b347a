package io.eventlog.jdbc;

import io.eventlog.jdbc.store.AbstractJdbcEventRecordStore;
import io.eventlog.jdbc.store.PostgresEventRecordStore;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.BeforeEach;
import org.testcontainers.containers.PostgreSQLContainer;
import org.testcontainers.junit.jupiter.Container;
import org.testcontainers.junit.jupiter.Testcontainers;

import javax.sql.DataSource;

@DockerAvailable
@Testcontainers
class PostgresEventStoreIntegrationTest extends AbstractEventStoreIntegrationTest {

  @Container
  static final PostgreSQLContainer<?> postgres = new PostgreSQLContainer<>("postgres:16-alpine")
      .withDatabaseName("eventlog_test");

  private static final PostgresEventRecordStore STORE = new PostgresEventRecordStore();
  private static SimpleDataSource dataSource;

  @BeforeAll
  static void initSchema() throws Exception {
    dataSource = new SimpleDataSource(postgres.getJdbcUrl(), postgres.getUsername(), postgres.getPassword());
    SchemaScripts.apply(dataSource, "postgresql");
  }

  @BeforeEach
  void truncate() throws Exception {
    SchemaScripts.execute(dataSource, "TRUNCATE TABLE event_store");
  }

  @Override
  DataSource dataSource() {
    return dataSource;
  }

  @Override
  AbstractJdbcEventRecordStore recordStore() {
    return STORE;
  }
}
