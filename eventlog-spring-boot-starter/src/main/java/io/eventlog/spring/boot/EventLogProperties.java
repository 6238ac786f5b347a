package io.eventlog.spring.boot;

import io.eventlog.jdbc.store.AbstractJdbcEventRecordStore;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

/**
 * Configuration properties for the event store and CQRS bus.
 *
 * @see EventLogAutoConfiguration
 */
@ConfigurationProperties(prefix = "eventlog")
public class EventLogProperties {

  /**
   * Database table name for stored events.
   */
  private String tableName = AbstractJdbcEventRecordStore.DEFAULT_TABLE;

  /**
   * Tenant stamped on events saved without one. Unset means "default".
   */
  private String defaultTenantId;

  private final QueryCache queryCache = new QueryCache();
  private final EventBus eventBus = new EventBus();
  private final Bus bus = new Bus();
  private final Metrics metrics = new Metrics();

  public String getTableName() {
    return tableName;
  }

  public void setTableName(String tableName) {
    this.tableName = tableName;
  }

  public String getDefaultTenantId() {
    return defaultTenantId;
  }

  public void setDefaultTenantId(String defaultTenantId) {
    this.defaultTenantId = defaultTenantId;
  }

  public QueryCache getQueryCache() {
    return queryCache;
  }

  public EventBus getEventBus() {
    return eventBus;
  }

  public Bus getBus() {
    return bus;
  }

  public Metrics getMetrics() {
    return metrics;
  }

  public static class QueryCache {
    /**
     * TTL for query handlers registered without one. Zero disables caching.
     */
    private Duration defaultTtl = Duration.ZERO;
    private int maxEntries = 1000;

    public Duration getDefaultTtl() {
      return defaultTtl;
    }

    public void setDefaultTtl(Duration defaultTtl) {
      this.defaultTtl = defaultTtl;
    }

    public int getMaxEntries() {
      return maxEntries;
    }

    public void setMaxEntries(int maxEntries) {
      this.maxEntries = maxEntries;
    }
  }

  public static class EventBus {
    /**
     * Threads used to fan events out to subscribers. Zero runs subscribers on the
     * publishing thread.
     */
    private int workerCount = 0;

    public int getWorkerCount() {
      return workerCount;
    }

    public void setWorkerCount(int workerCount) {
      this.workerCount = workerCount;
    }
  }

  public static class Bus {
    private int asyncWorkers = 4;

    /**
     * Whether the bus is initialized once all {@link BusConfigurer} beans have run.
     */
    private boolean autoInitialize = true;

    public int getAsyncWorkers() {
      return asyncWorkers;
    }

    public void setAsyncWorkers(int asyncWorkers) {
      this.asyncWorkers = asyncWorkers;
    }

    public boolean isAutoInitialize() {
      return autoInitialize;
    }

    public void setAutoInitialize(boolean autoInitialize) {
      this.autoInitialize = autoInitialize;
    }
  }

  public static class Metrics {
    private boolean enabled = true;
    private String namePrefix = "eventlog";

    public boolean isEnabled() {
      return enabled;
    }

    public void setEnabled(boolean enabled) {
      this.enabled = enabled;
    }

    public String getNamePrefix() {
      return namePrefix;
    }

    public void setNamePrefix(String namePrefix) {
      this.namePrefix = namePrefix;
    }
  }
}
