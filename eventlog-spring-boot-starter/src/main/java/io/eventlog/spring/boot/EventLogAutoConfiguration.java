package io.eventlog.spring.boot;

import io.eventlog.EventStore;
import io.eventlog.bus.CqrsBus;
import io.eventlog.bus.command.CommandBus;
import io.eventlog.bus.command.DefaultCommandBus;
import io.eventlog.bus.event.DefaultEventBus;
import io.eventlog.bus.event.EventBus;
import io.eventlog.bus.query.DefaultQueryBus;
import io.eventlog.bus.query.QueryBus;
import io.eventlog.jdbc.DataSourceConnectionProvider;
import io.eventlog.jdbc.JdbcEventStore;
import io.eventlog.jdbc.store.AbstractJdbcEventRecordStore;
import io.eventlog.jdbc.store.JdbcEventRecordStores;
import io.eventlog.spi.ConnectionProvider;
import io.eventlog.spi.MetricsExporter;
import io.eventlog.spi.TenantContext;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnClass;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.jdbc.DataSourceAutoConfiguration;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;

import javax.sql.DataSource;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Auto-configuration for the event store and CQRS bus.
 *
 * <p>Wires a {@link JdbcEventStore} over the application {@link DataSource}, detecting the
 * database from its JDBC URL, and a {@link CqrsBus} over default command, query and event
 * buses. {@link BusConfigurer} beans register handlers before the bus is initialized.
 * Every bean backs off when the application defines its own.
 *
 * @see EventLogProperties
 * @see EventLogMicrometerAutoConfiguration
 */
@AutoConfiguration(after = DataSourceAutoConfiguration.class)
@ConditionalOnClass(JdbcEventStore.class)
@ConditionalOnBean(DataSource.class)
@EnableConfigurationProperties(EventLogProperties.class)
public class EventLogAutoConfiguration {
  private static final Logger logger = Logger.getLogger(EventLogAutoConfiguration.class.getName());

  @Bean
  @ConditionalOnMissingBean
  public AbstractJdbcEventRecordStore eventRecordStore(DataSource dataSource, EventLogProperties props) {
    AbstractJdbcEventRecordStore detected = JdbcEventRecordStores.detect(dataSource);
    if (!AbstractJdbcEventRecordStore.DEFAULT_TABLE.equals(props.getTableName())) {
      return detected.withTableName(props.getTableName());
    }
    return detected;
  }

  @Bean
  @ConditionalOnMissingBean(ConnectionProvider.class)
  public DataSourceConnectionProvider connectionProvider(DataSource dataSource) {
    return new DataSourceConnectionProvider(dataSource);
  }

  @Bean
  @ConditionalOnMissingBean
  public TenantContext tenantContext(EventLogProperties props) {
    String tenantId = props.getDefaultTenantId();
    return tenantId == null || tenantId.isBlank() ? TenantContext.NONE : TenantContext.of(tenantId);
  }

  @Bean
  @ConditionalOnMissingBean(EventStore.class)
  public JdbcEventStore eventStore(ConnectionProvider connectionProvider,
                                   AbstractJdbcEventRecordStore eventRecordStore,
                                   TenantContext tenantContext,
                                   ObjectProvider<MetricsExporter> metricsProvider) {
    return JdbcEventStore.builder()
        .connectionProvider(connectionProvider)
        .recordStore(eventRecordStore)
        .tenantContext(tenantContext)
        .metrics(metricsProvider.getIfAvailable(() -> MetricsExporter.NOOP))
        .build();
  }

  @Bean
  @ConditionalOnMissingBean(CommandBus.class)
  public DefaultCommandBus commandBus(ObjectProvider<MetricsExporter> metricsProvider) {
    return new DefaultCommandBus(metricsProvider.getIfAvailable(() -> MetricsExporter.NOOP));
  }

  @Bean
  @ConditionalOnMissingBean(QueryBus.class)
  public DefaultQueryBus queryBus(EventLogProperties props, ObjectProvider<MetricsExporter> metricsProvider) {
    return DefaultQueryBus.builder()
        .defaultTtl(props.getQueryCache().getDefaultTtl())
        .maxEntries(props.getQueryCache().getMaxEntries())
        .metrics(metricsProvider.getIfAvailable(() -> MetricsExporter.NOOP))
        .build();
  }

  @Bean
  @ConditionalOnMissingBean
  public EventBusWorkers eventBusWorkers(EventLogProperties props) {
    return new EventBusWorkers(props.getEventBus().getWorkerCount());
  }

  @Bean
  @ConditionalOnMissingBean(EventBus.class)
  public DefaultEventBus eventBus(EventBusWorkers workers, ObjectProvider<MetricsExporter> metricsProvider) {
    DefaultEventBus.Builder builder = DefaultEventBus.builder()
        .metrics(metricsProvider.getIfAvailable(() -> MetricsExporter.NOOP));
    workers.executor().ifPresent(builder::executor);
    return builder.build();
  }

  @Bean(destroyMethod = "close")
  @ConditionalOnMissingBean
  public CqrsBus cqrsBus(EventLogProperties props,
                         CommandBus commandBus,
                         QueryBus queryBus,
                         EventBus eventBus,
                         ObjectProvider<BusConfigurer> configurers) {
    CqrsBus bus = CqrsBus.builder()
        .commandBus(commandBus)
        .queryBus(queryBus)
        .eventBus(eventBus)
        .asyncWorkers(props.getBus().getAsyncWorkers())
        .build();
    configurers.orderedStream().forEach(configurer -> configurer.configure(bus));
    if (props.getBus().isAutoInitialize()) {
      bus.initialize();
    } else {
      logger.log(Level.INFO, "CQRS bus left uninitialized (eventlog.bus.auto-initialize=false)");
    }
    return bus;
  }
}
