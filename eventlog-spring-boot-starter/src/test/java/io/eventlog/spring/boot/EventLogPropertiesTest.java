package io.eventlog.spring.boot;

import org.junit.jupiter.api.Test;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.boot.test.context.runner.ApplicationContextRunner;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;

class EventLogPropertiesTest {

  private final ApplicationContextRunner runner = new ApplicationContextRunner()
      .withUserConfiguration(PropsConfig.class);

  @Test
  void defaultValues() {
    runner.run(ctx -> {
      EventLogProperties props = ctx.getBean(EventLogProperties.class);
      assertEquals("event_store", props.getTableName());
      assertNull(props.getDefaultTenantId());
      assertEquals(Duration.ZERO, props.getQueryCache().getDefaultTtl());
      assertEquals(1000, props.getQueryCache().getMaxEntries());
      assertEquals(0, props.getEventBus().getWorkerCount());
      assertEquals(4, props.getBus().getAsyncWorkers());
      assertTrue(props.getBus().isAutoInitialize());
      assertTrue(props.getMetrics().isEnabled());
      assertEquals("eventlog", props.getMetrics().getNamePrefix());
    });
  }

  @Test
  void customValues() {
    runner.withPropertyValues(
        "eventlog.table-name=orders_events",
        "eventlog.default-tenant-id=acme",
        "eventlog.query-cache.default-ttl=30s",
        "eventlog.query-cache.max-entries=50",
        "eventlog.event-bus.worker-count=3",
        "eventlog.bus.async-workers=8",
        "eventlog.bus.auto-initialize=false",
        "eventlog.metrics.enabled=false",
        "eventlog.metrics.name-prefix=orders.eventlog"
    ).run(ctx -> {
      EventLogProperties props = ctx.getBean(EventLogProperties.class);
      assertEquals("orders_events", props.getTableName());
      assertEquals("acme", props.getDefaultTenantId());
      assertEquals(Duration.ofSeconds(30), props.getQueryCache().getDefaultTtl());
      assertEquals(50, props.getQueryCache().getMaxEntries());
      assertEquals(3, props.getEventBus().getWorkerCount());
      assertEquals(8, props.getBus().getAsyncWorkers());
      assertFalse(props.getBus().isAutoInitialize());
      assertFalse(props.getMetrics().isEnabled());
      assertEquals("orders.eventlog", props.getMetrics().getNamePrefix());
    });
  }

  @Configuration
  @EnableConfigurationProperties(EventLogProperties.class)
  static class PropsConfig {
  }
}
