/**
 * Root API for eventlog: an append-only event store with optimistic concurrency
 * and a CQRS command/query/event bus.
 *
 * <h2>Core Design</h2>
 * <p>Each aggregate owns a stream of {@link io.eventlog.DomainEvent}s versioned
 * {@code 1..N}. {@link io.eventlog.EventStore#saveEvents} appends a batch atomically
 * and only when the caller's expected version matches the stream; otherwise it throws
 * {@link io.eventlog.ConcurrencyException} and the caller reloads and retries. The store
 * never retries on its own.
 *
 * <p>The {@linkplain io.eventlog.bus.CqrsBus CQRS bus} routes commands to exactly one
 * handler, queries to exactly one handler (optionally cached), and fans events out to
 * every subscriber.
 *
 * <h2>Module Layout</h2>
 * <ul>
 *   <li><b>eventlog-core</b> - model, store contract, record codec, bus, SPIs</li>
 *   <li><b>eventlog-jdbc</b> - {@code JdbcEventStore} with H2, MySQL and PostgreSQL dialects</li>
 *   <li><b>eventlog-micrometer</b> - Micrometer metrics exporter</li>
 *   <li><b>eventlog-spring-boot-starter</b> - Spring Boot auto-configuration</li>
 * </ul>
 *
 * <h2>Quick Start</h2>
 * <pre>{@code
 * EventStore store = JdbcEventStore.builder()
 *     .connectionProvider(new DataSourceConnectionProvider(dataSource))
 *     .recordStore(JdbcEventRecordStores.detect(dataSource))
 *     .build();
 *
 * CqrsBus bus = CqrsBus.builder().build();
 * bus.commands().register(PlaceOrder.class, command -> {
 *   long version = store.getCurrentVersion(command.orderId());
 *   store.saveEvents(command.orderId(),
 *       List.of(DomainEvent.of("OrderPlaced", command.orderId(), command.json())), version);
 * });
 * bus.initialize();
 * }</pre>
 */
package io.eventlog;
