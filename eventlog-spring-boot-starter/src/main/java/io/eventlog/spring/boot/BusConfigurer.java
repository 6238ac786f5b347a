package io.eventlog.spring.boot;

import io.eventlog.bus.CqrsBus;

/**
 * Callback for registering handlers, subscriptions and interceptors on the
 * auto-configured {@link CqrsBus} before it is initialized.
 *
 * <pre>{@code
 * @Bean
 * BusConfigurer orderHandlers(EventStore store) {
 *   return bus -> {
 *     bus.commands().register(PlaceOrder.class, new PlaceOrderHandler(store));
 *     bus.events().subscribe("OrderPlaced", new OrderProjection());
 *   };
 * }
 * }</pre>
 *
 * <p>Configurers run in {@link org.springframework.core.Ordered} order.
 */
@FunctionalInterface
public interface BusConfigurer {

  void configure(CqrsBus bus);
}
