package io.eventlog.jdbc.store;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.SQLException;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.ServiceLoader;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Registry for JDBC record stores with auto-detection support.
 *
 * <p>Record stores are loaded via {@link ServiceLoader} from
 * {@code META-INF/services/io.eventlog.jdbc.store.AbstractJdbcEventRecordStore}.
 *
 * <h2>Usage</h2>
 * <pre>{@code
 * // Auto-detect from DataSource
 * AbstractJdbcEventRecordStore store = JdbcEventRecordStores.detect(dataSource);
 *
 * // Auto-detect from JDBC URL, custom table
 * AbstractJdbcEventRecordStore store =
 *     JdbcEventRecordStores.detect("jdbc:mysql://localhost/app").withTableName("order_events");
 *
 * // Get by name
 * AbstractJdbcEventRecordStore store = JdbcEventRecordStores.get("postgresql");
 * }</pre>
 */
public final class JdbcEventRecordStores {

  private static final List<AbstractJdbcEventRecordStore> STORES;
  private static final Map<String, AbstractJdbcEventRecordStore> BY_NAME = new ConcurrentHashMap<>();

  static {
    STORES = ServiceLoader.load(AbstractJdbcEventRecordStore.class)
        .stream()
        .map(ServiceLoader.Provider::get)
        .toList();

    for (AbstractJdbcEventRecordStore store : STORES) {
      BY_NAME.put(store.name().toLowerCase(Locale.ROOT), store);
    }
  }

  private JdbcEventRecordStores() {
  }

  /**
   * Returns all registered record stores.
   */
  public static List<AbstractJdbcEventRecordStore> all() {
    return STORES;
  }

  /**
   * Gets a record store by name.
   *
   * @param name record store name (case-insensitive)
   * @return the record store
   * @throws IllegalArgumentException if no record store is registered under that name
   */
  public static AbstractJdbcEventRecordStore get(String name) {
    Objects.requireNonNull(name, "name");
    AbstractJdbcEventRecordStore store = BY_NAME.get(name.toLowerCase(Locale.ROOT));
    if (store == null) {
      throw new IllegalArgumentException("Unknown record store: " + name +
          ". Available: " + BY_NAME.keySet());
    }
    return store;
  }

  /**
   * Auto-detects the record store from a DataSource.
   *
   * @param dataSource the data source
   * @return detected record store
   * @throws IllegalStateException if detection fails or no record store matches
   */
  public static AbstractJdbcEventRecordStore detect(DataSource dataSource) {
    Objects.requireNonNull(dataSource, "dataSource");
    try (Connection conn = dataSource.getConnection()) {
      String url = conn.getMetaData().getURL();
      return detect(url);
    } catch (SQLException e) {
      throw new IllegalStateException("Failed to detect record store from DataSource", e);
    }
  }

  /**
   * Auto-detects the record store from a JDBC URL.
   *
   * @param jdbcUrl the JDBC URL
   * @return detected record store
   * @throws IllegalArgumentException if no record store matches
   */
  public static AbstractJdbcEventRecordStore detect(String jdbcUrl) {
    if (jdbcUrl == null || jdbcUrl.isEmpty()) {
      throw new IllegalArgumentException("JDBC URL cannot be null or empty");
    }
    String normalized = jdbcUrl.toLowerCase(Locale.ROOT);
    for (AbstractJdbcEventRecordStore store : STORES) {
      for (String prefix : store.jdbcUrlPrefixes()) {
        if (normalized.startsWith(prefix.toLowerCase(Locale.ROOT))) {
          return store;
        }
      }
    }
    throw new IllegalArgumentException("No record store found for JDBC URL: " + jdbcUrl +
        ". Supported prefixes: " + allPrefixes());
  }

  private static List<String> allPrefixes() {
    return STORES.stream()
        .flatMap(s -> s.jdbcUrlPrefixes().stream())
        .toList();
  }
}
