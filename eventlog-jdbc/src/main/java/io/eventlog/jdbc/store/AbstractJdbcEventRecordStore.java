package io.eventlog.jdbc.store;

import io.eventlog.codec.EventRecord;
import io.eventlog.jdbc.JdbcTemplate;

import java.sql.Connection;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Base JDBC record store holding the SQL for the event table.
 *
 * <p>Every method runs on a caller-supplied connection and never commits; transaction
 * boundaries belong to the event store. Subclasses name the database and its JDBC URL
 * prefixes and may override {@link #isWriteConflict}. Register custom implementations
 * via {@code META-INF/services/io.eventlog.jdbc.store.AbstractJdbcEventRecordStore}.
 *
 * <p>Expected table layout (see {@code META-INF/eventlog/schema-<name>.sql}):
 * {@code seq} identity, {@code event_id} unique, {@code aggregate_id}, {@code event_type},
 * {@code payload}, {@code metadata}, {@code version}, {@code occurred_at}, {@code tenant_id},
 * {@code stored_at}, and a unique constraint on {@code (aggregate_id, version)}.
 *
 * @see JdbcEventRecordStores
 */
public abstract class AbstractJdbcEventRecordStore {
  public static final String DEFAULT_TABLE = "event_store";

  protected static final String COLUMNS =
      "seq, event_id, aggregate_id, event_type, payload, metadata, version, occurred_at, tenant_id, stored_at";

  protected static final JdbcTemplate.RowMapper<EventRecord> RECORD_ROW_MAPPER = rs -> new EventRecord(
      rs.getLong("seq"),
      rs.getString("event_id"),
      rs.getString("aggregate_id"),
      rs.getString("event_type"),
      rs.getString("payload"),
      rs.getString("metadata"),
      rs.getLong("version"),
      toInstant(rs.getTimestamp("occurred_at")),
      rs.getString("tenant_id"),
      toInstant(rs.getTimestamp("stored_at")));

  private final String tableName;

  protected AbstractJdbcEventRecordStore() {
    this(DEFAULT_TABLE);
  }

  protected AbstractJdbcEventRecordStore(String tableName) {
    Objects.requireNonNull(tableName, "tableName");
    if (!tableName.matches("[a-zA-Z_][a-zA-Z0-9_]*")) {
      throw new IllegalArgumentException("Invalid table name: " + tableName);
    }
    this.tableName = tableName;
  }

  /**
   * Unique identifier for this record store (e.g., "mysql", "postgresql", "h2").
   */
  public abstract String name();

  /**
   * JDBC URL prefixes this record store handles (e.g., "jdbc:mysql:", "jdbc:mariadb:").
   */
  public abstract List<String> jdbcUrlPrefixes();

  /**
   * Returns a copy of this record store that targets {@code tableName}.
   */
  public abstract AbstractJdbcEventRecordStore withTableName(String tableName);

  public String tableName() {
    return tableName;
  }

  public void insert(Connection conn, EventRecord record) {
    String sql = "INSERT INTO " + tableName() + " (" +
        "event_id, aggregate_id, event_type, payload, metadata, version, occurred_at, tenant_id, stored_at" +
        ") VALUES (?,?,?,?,?,?,?,?,?)";
    JdbcTemplate.update(conn, sql,
        record.eventId(), record.aggregateId(), record.eventType(), record.payload(),
        record.metadata(), record.version(), record.occurredAt(), record.tenantId(),
        record.storedAt());
  }

  /**
   * Returns the highest stored version of the aggregate, {@code 0} if it has none.
   */
  public long currentVersion(Connection conn, String aggregateId) {
    String sql = "SELECT COALESCE(MAX(version), 0) FROM " + tableName() + " WHERE aggregate_id=?";
    return JdbcTemplate.queryForLong(conn, sql, aggregateId);
  }

  public List<EventRecord> findByAggregate(Connection conn, String aggregateId, long fromVersion) {
    String sql = "SELECT " + COLUMNS + " FROM " + tableName() +
        " WHERE aggregate_id=? AND version>=? ORDER BY version";
    return JdbcTemplate.query(conn, sql, RECORD_ROW_MAPPER, aggregateId, fromVersion);
  }

  /**
   * Returns events of one type ordered by {@code occurred_at}, ties broken by {@code seq}.
   *
   * @param fromDate inclusive lower bound, or {@code null} for none
   */
  public List<EventRecord> findByType(Connection conn, String eventType, Instant fromDate) {
    if (fromDate == null) {
      String sql = "SELECT " + COLUMNS + " FROM " + tableName() +
          " WHERE event_type=? ORDER BY occurred_at, seq";
      return JdbcTemplate.query(conn, sql, RECORD_ROW_MAPPER, eventType);
    }
    String sql = "SELECT " + COLUMNS + " FROM " + tableName() +
        " WHERE event_type=? AND occurred_at>=? ORDER BY occurred_at, seq";
    return JdbcTemplate.query(conn, sql, RECORD_ROW_MAPPER, eventType, fromDate);
  }

  /**
   * Returns up to {@code limit} records with {@code seq > afterSequence}, ascending.
   */
  public List<EventRecord> findAfter(Connection conn, long afterSequence, int limit) {
    String sql = "SELECT " + COLUMNS + " FROM " + tableName() +
        " WHERE seq>? ORDER BY seq LIMIT ?";
    return JdbcTemplate.query(conn, sql, RECORD_ROW_MAPPER, afterSequence, limit);
  }

  public Optional<EventRecord> findById(Connection conn, String eventId) {
    String sql = "SELECT " + COLUMNS + " FROM " + tableName() + " WHERE event_id=?";
    List<EventRecord> rows = JdbcTemplate.query(conn, sql, RECORD_ROW_MAPPER, eventId);
    return rows.isEmpty() ? Optional.empty() : Optional.of(rows.get(0));
  }

  public boolean exists(Connection conn, String aggregateId) {
    String sql = "SELECT 1 FROM " + tableName() + " WHERE aggregate_id=? LIMIT 1";
    return !JdbcTemplate.query(conn, sql, rs -> rs.getInt(1), aggregateId).isEmpty();
  }

  public int deleteByAggregate(Connection conn, String aggregateId) {
    String sql = "DELETE FROM " + tableName() + " WHERE aggregate_id=?";
    return JdbcTemplate.update(conn, sql, aggregateId);
  }

  public long countEvents(Connection conn) {
    return JdbcTemplate.queryForLong(conn, "SELECT COUNT(*) FROM " + tableName());
  }

  public long countAggregates(Connection conn) {
    return JdbcTemplate.queryForLong(conn, "SELECT COUNT(DISTINCT aggregate_id) FROM " + tableName());
  }

  public Map<String, Long> countByType(Connection conn) {
    return countGroupedBy(conn, "event_type");
  }

  public Map<String, Long> countByTenant(Connection conn) {
    return countGroupedBy(conn, "tenant_id");
  }

  /**
   * Returns whether {@code e} reports a write conflict with another transaction: a
   * unique-constraint violation on {@code (aggregate_id, version)} or {@code event_id},
   * or a serialization failure or deadlock. The event store re-reads the stream version
   * to decide whether such a failure was a concurrent append.
   *
   * <p>The default checks for SQLState class {@code 23} (integrity constraint violation)
   * and class {@code 40} (transaction rollback).
   */
  public boolean isWriteConflict(SQLException e) {
    for (SQLException current = e; current != null; current = current.getNextException()) {
      String state = current.getSQLState();
      if (state != null && (state.startsWith("23") || state.startsWith("40"))) {
        return true;
      }
    }
    return false;
  }

  private Map<String, Long> countGroupedBy(Connection conn, String column) {
    String sql = "SELECT " + column + ", COUNT(*) FROM " + tableName() +
        " GROUP BY " + column + " ORDER BY " + column;
    Map<String, Long> counts = new LinkedHashMap<>();
    for (Map.Entry<String, Long> row : JdbcTemplate.query(conn, sql,
        rs -> Map.entry(String.valueOf(rs.getString(1)), rs.getLong(2)))) {
      counts.merge(row.getKey(), row.getValue(), Long::sum);
    }
    return counts;
  }

  private static Instant toInstant(Timestamp timestamp) {
    return timestamp == null ? null : timestamp.toInstant();
  }
}
