package io.eventlog.jdbc.store;

import org.h2.jdbcx.JdbcDataSource;
import org.junit.jupiter.api.Test;

import java.sql.SQLException;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class JdbcEventRecordStoresTest {

  @Test
  void allReturnsBuiltInRecordStores() {
    List<AbstractJdbcEventRecordStore> stores = JdbcEventRecordStores.all();

    assertTrue(stores.size() >= 3);
    assertTrue(stores.stream().anyMatch(s -> s.name().equals("mysql")));
    assertTrue(stores.stream().anyMatch(s -> s.name().equals("postgresql")));
    assertTrue(stores.stream().anyMatch(s -> s.name().equals("h2")));
  }

  @Test
  void getByNameIsCaseInsensitive() {
    assertEquals("mysql", JdbcEventRecordStores.get("MySQL").name());
    assertEquals("postgresql", JdbcEventRecordStores.get("POSTGRESQL").name());
    assertEquals("h2", JdbcEventRecordStores.get("h2").name());
  }

  @Test
  void getByNameThrowsForUnknown() {
    IllegalArgumentException ex = assertThrows(IllegalArgumentException.class,
        () -> JdbcEventRecordStores.get("oracle"));
    assertTrue(ex.getMessage().contains("Unknown record store"));
    assertTrue(ex.getMessage().contains("oracle"));
  }

  @Test
  void detectFromJdbcUrl() {
    assertEquals("mysql", JdbcEventRecordStores.detect("jdbc:mysql://localhost:3306/app").name());
    assertEquals("mysql", JdbcEventRecordStores.detect("jdbc:tidb://localhost:4000/app").name());
    assertEquals("mysql", JdbcEventRecordStores.detect("jdbc:mariadb://localhost:3306/app").name());
    assertEquals("postgresql", JdbcEventRecordStores.detect("jdbc:postgresql://localhost/app").name());
    assertEquals("h2", JdbcEventRecordStores.detect("jdbc:h2:mem:app").name());
  }

  @Test
  void detectFromJdbcUrlThrowsForUnknownOrEmpty() {
    IllegalArgumentException ex = assertThrows(IllegalArgumentException.class,
        () -> JdbcEventRecordStores.detect("jdbc:oracle:thin:@localhost:1521:xe"));
    assertTrue(ex.getMessage().contains("No record store found"));
    assertThrows(IllegalArgumentException.class, () -> JdbcEventRecordStores.detect((String) null));
    assertThrows(IllegalArgumentException.class, () -> JdbcEventRecordStores.detect(""));
  }

  @Test
  void detectFromDataSource() {
    JdbcDataSource ds = new JdbcDataSource();
    ds.setURL("jdbc:h2:mem:detect_test;DB_CLOSE_DELAY=-1");

    assertEquals("h2", JdbcEventRecordStores.detect(ds).name());
  }

  @Test
  void withTableNameReturnsNewStoreOfSameDatabase() {
    AbstractJdbcEventRecordStore postgres = JdbcEventRecordStores.get("postgresql");
    AbstractJdbcEventRecordStore renamed = postgres.withTableName("orders_events");

    assertEquals(AbstractJdbcEventRecordStore.DEFAULT_TABLE, postgres.tableName());
    assertEquals("orders_events", renamed.tableName());
    assertEquals("postgresql", renamed.name());
    assertNotSame(postgres, renamed);
  }

  @Test
  void rejectsUnsafeTableNames() {
    assertThrows(IllegalArgumentException.class, () -> new H2EventRecordStore("events; DROP TABLE x"));
    assertThrows(IllegalArgumentException.class, () -> new MySqlEventRecordStore("1events"));
    assertThrows(IllegalArgumentException.class, () -> new PostgresEventRecordStore(""));
    assertThrows(NullPointerException.class, () -> new H2EventRecordStore(null));
  }

  @Test
  void writeConflictBySqlState() {
    AbstractJdbcEventRecordStore h2 = new H2EventRecordStore();

    assertTrue(h2.isWriteConflict(new SQLException("dup", "23505")));
    assertTrue(h2.isWriteConflict(new SQLException("deadlock", "40001")));
    assertFalse(h2.isWriteConflict(new SQLException("no table", "42S02")));
    assertFalse(h2.isWriteConflict(new SQLException("unknown")));
  }

  @Test
  void mySqlWriteConflictByVendorCode() {
    AbstractJdbcEventRecordStore mysql = new MySqlEventRecordStore();

    assertTrue(mysql.isWriteConflict(new SQLException("Duplicate entry", "HY000", 1062)));
    assertTrue(mysql.isWriteConflict(new SQLException("Deadlock found", "HY000", 1213)));
    assertFalse(mysql.isWriteConflict(new SQLException("Table doesn't exist", "42S02", 1146)));
  }

  @Test
  void postgresWriteConflictBySqlState() {
    AbstractJdbcEventRecordStore postgres = new PostgresEventRecordStore();

    assertTrue(postgres.isWriteConflict(new SQLException("unique_violation", "23505")));
    assertTrue(postgres.isWriteConflict(new SQLException("serialization_failure", "40001")));
    assertFalse(postgres.isWriteConflict(new SQLException("not_null_violation", "23502")));
  }
}
