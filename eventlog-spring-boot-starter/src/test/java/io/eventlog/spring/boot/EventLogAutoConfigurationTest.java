package io.eventlog.spring.boot;

import io.eventlog.DomainEvent;
import io.eventlog.EventStore;
import io.eventlog.bus.BusState;
import io.eventlog.bus.CqrsBus;
import io.eventlog.bus.command.Command;
import io.eventlog.bus.command.CommandBus;
import io.eventlog.bus.command.DefaultCommandBus;
import io.eventlog.bus.event.DefaultEventBus;
import io.eventlog.bus.query.DefaultQueryBus;
import io.eventlog.bus.query.Query;
import io.eventlog.jdbc.DataSourceConnectionProvider;
import io.eventlog.jdbc.JdbcEventStore;
import io.eventlog.jdbc.store.AbstractJdbcEventRecordStore;
import io.eventlog.jdbc.store.H2EventRecordStore;
import io.eventlog.spi.ConnectionProvider;
import io.eventlog.spi.TenantContext;
import org.junit.jupiter.api.Test;
import org.springframework.boot.autoconfigure.AutoConfigurations;
import org.springframework.boot.autoconfigure.jdbc.DataSourceAutoConfiguration;
import org.springframework.boot.autoconfigure.sql.init.SqlInitializationAutoConfiguration;
import org.springframework.boot.test.context.runner.ApplicationContextRunner;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.List;
import java.util.UUID;
import java.util.concurrent.CopyOnWriteArrayList;

import static org.junit.jupiter.api.Assertions.*;

class EventLogAutoConfigurationTest {

  record PlaceOrder(String orderId, int total) implements Command {
  }

  record OrdersPlaced() implements Query<Integer> {
  }

  private final ApplicationContextRunner runner = new ApplicationContextRunner()
      .withConfiguration(AutoConfigurations.of(
          DataSourceAutoConfiguration.class,
          SqlInitializationAutoConfiguration.class,
          EventLogAutoConfiguration.class))
      .withPropertyValues(
          "spring.datasource.url=jdbc:h2:mem:eventlog_" + UUID.randomUUID() + ";DB_CLOSE_DELAY=-1",
          "spring.datasource.driver-class-name=org.h2.Driver",
          "spring.sql.init.schema-locations=classpath:META-INF/eventlog/schema-h2.sql");

  @Test
  void createsAllBeans() {
    runner.run(ctx -> {
      assertTrue(ctx.containsBean("eventRecordStore"));
      assertTrue(ctx.containsBean("connectionProvider"));
      assertTrue(ctx.containsBean("tenantContext"));
      assertTrue(ctx.containsBean("eventStore"));
      assertTrue(ctx.containsBean("commandBus"));
      assertTrue(ctx.containsBean("queryBus"));
      assertTrue(ctx.containsBean("eventBus"));
      assertTrue(ctx.containsBean("cqrsBus"));

      assertInstanceOf(H2EventRecordStore.class, ctx.getBean(AbstractJdbcEventRecordStore.class));
      assertInstanceOf(DataSourceConnectionProvider.class, ctx.getBean(ConnectionProvider.class));
      assertInstanceOf(JdbcEventStore.class, ctx.getBean(EventStore.class));
      assertInstanceOf(DefaultCommandBus.class, ctx.getBean(CommandBus.class));
      assertInstanceOf(DefaultQueryBus.class, ctx.getBean(DefaultQueryBus.class));
      assertInstanceOf(DefaultEventBus.class, ctx.getBean(DefaultEventBus.class));
      assertEquals(BusState.INITIALIZED, ctx.getBean(CqrsBus.class).state());
    });
  }

  @Test
  void configuredHandlersServeCommandsQueriesAndEvents() {
    runner.withUserConfiguration(OrderHandlersConfig.class).run(ctx -> {
      CqrsBus bus = ctx.getBean(CqrsBus.class);
      EventStore store = ctx.getBean(EventStore.class);
      OrderProjection projection = ctx.getBean(OrderProjection.class);

      bus.executeCommand(new PlaceOrder("order-1", 42));
      bus.executeCommand(new PlaceOrder("order-2", 7));

      assertEquals(1, store.getCurrentVersion("order-1"));
      assertEquals(List.of("order-1", "order-2"), projection.orderIds);
      assertEquals(2, bus.executeQuery(new OrdersPlaced()));
    });
  }

  @Test
  void closingContextShutsBusDown() {
    CqrsBus[] captured = new CqrsBus[1];
    runner.run(ctx -> captured[0] = ctx.getBean(CqrsBus.class));

    assertEquals(BusState.SHUT_DOWN, captured[0].state());
  }

  @Test
  void autoInitializeCanBeDisabled() {
    runner.withPropertyValues("eventlog.bus.auto-initialize=false").run(ctx -> {
      CqrsBus bus = ctx.getBean(CqrsBus.class);
      assertEquals(BusState.UNINITIALIZED, bus.state());
      bus.initialize();
      assertTrue(bus.healthCheck());
    });
  }

  @Test
  void defaultTenantIsStamped() {
    runner.withPropertyValues("eventlog.default-tenant-id=acme").run(ctx -> {
      EventStore store = ctx.getBean(EventStore.class);
      store.saveEvents("agg-1", List.of(DomainEvent.builder("Created").payloadJson("{}").build()), 0);

      assertEquals("acme", ctx.getBean(TenantContext.class).resolveTenantId());
      assertEquals("acme", store.getEvents("agg-1").get(0).tenantId());
    });
  }

  @Test
  void customTableName() {
    runner
        .withPropertyValues("eventlog.table-name=audit_events",
            "spring.sql.init.schema-locations=classpath:schema-audit.sql")
        .run(ctx -> {
          AbstractJdbcEventRecordStore recordStore = ctx.getBean(AbstractJdbcEventRecordStore.class);
          assertInstanceOf(H2EventRecordStore.class, recordStore);
          assertEquals("audit_events", recordStore.tableName());

          EventStore store = ctx.getBean(EventStore.class);
          store.saveEvents("agg-1", List.of(DomainEvent.builder("Created").payloadJson("{}").build()), 0);
          assertTrue(store.exists("agg-1"));
        });
  }

  @Test
  void eventBusWorkersFanOut() {
    runner.withPropertyValues("eventlog.event-bus.worker-count=2").run(ctx -> {
      assertTrue(ctx.getBean(EventBusWorkers.class).executor().isPresent());
      CqrsBus bus = ctx.getBean(CqrsBus.class);
      List<String> seen = new CopyOnWriteArrayList<>();
      bus.events().subscribe("Pinged", event -> seen.add("a"));
      bus.events().subscribe("Pinged", event -> seen.add("b"));

      bus.publishEvent(DomainEvent.of("Pinged", "agg-1", "{}"));

      assertEquals(2, seen.size());
    });
  }

  @Test
  void invalidWorkerCountFailsStartup() {
    runner.withPropertyValues("eventlog.event-bus.worker-count=-1").run(ctx -> {
      assertNotNull(ctx.getStartupFailure());
      assertInstanceOf(IllegalArgumentException.class, findRootCause(ctx.getStartupFailure()));
    });
  }

  @Test
  void notLoadedWithoutDataSource() {
    new ApplicationContextRunner()
        .withConfiguration(AutoConfigurations.of(EventLogAutoConfiguration.class))
        .run(ctx -> {
          assertFalse(ctx.containsBean("eventStore"));
          assertFalse(ctx.containsBean("cqrsBus"));
        });
  }

  @Test
  void respectsConditionalOnMissingBean() {
    runner.withUserConfiguration(CustomBeansConfig.class).run(ctx -> {
      assertEquals("myRecordStore", ctx.getBeanNamesForType(AbstractJdbcEventRecordStore.class)[0]);
      assertEquals("custom_events", ctx.getBean(AbstractJdbcEventRecordStore.class).tableName());
      assertEquals("myCommandBus", ctx.getBeanNamesForType(CommandBus.class)[0]);
      assertSame(ctx.getBean(CommandBus.class), ctx.getBean(CqrsBus.class).commands());
    });
  }

  // -- Test configurations --

  static class OrderProjection {
    final List<String> orderIds = new CopyOnWriteArrayList<>();
  }

  @Configuration
  static class OrderHandlersConfig {
    @Bean
    OrderProjection orderProjection() {
      return new OrderProjection();
    }

    @Bean
    BusConfigurer orderHandlers(EventStore store, OrderProjection projection) {
      return bus -> {
        bus.commands().register(PlaceOrder.class, command -> {
          DomainEvent placed = DomainEvent.of("OrderPlaced", command.orderId(),
              "{\"total\":" + command.total() + "}");
          store.saveEvents(command.orderId(), List.of(placed), 0);
          bus.publishEvent(placed);
        });
        bus.queries().register(OrdersPlaced.class, query -> projection.orderIds.size());
        bus.events().subscribe("OrderPlaced", event -> projection.orderIds.add(event.aggregateId()));
      };
    }
  }

  @Configuration
  static class CustomBeansConfig {
    @Bean
    AbstractJdbcEventRecordStore myRecordStore() {
      return new H2EventRecordStore("custom_events");
    }

    @Bean
    CommandBus myCommandBus() {
      return new DefaultCommandBus();
    }
  }

  private static Throwable findRootCause(Throwable t) {
    while (t.getCause() != null && t.getCause() != t) {
      t = t.getCause();
    }
    return t;
  }
}
