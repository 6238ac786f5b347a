package io.eventlog.bus.command;

import io.eventlog.bus.BusStatistics;
import io.eventlog.bus.DispatchInterceptor;
import io.eventlog.bus.DuplicateHandlerException;
import io.eventlog.bus.HandlerExecutionException;
import io.eventlog.bus.Interceptors;
import io.eventlog.bus.NoHandlerException;
import io.eventlog.spi.MetricsExporter;

import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Thread-safe {@link CommandBus}. A second registration for the same type fails
 * immediately, so two handlers can never both run for one command.
 *
 * <h2>Usage</h2>
 * <pre>{@code
 * CommandBus bus = new DefaultCommandBus();
 * bus.register(PlaceOrder.class, command -> orders.place(command));
 * bus.execute(new PlaceOrder("order-1", 42));
 * }</pre>
 */
public final class DefaultCommandBus implements CommandBus {
  private static final Logger logger = Logger.getLogger(DefaultCommandBus.class.getName());

  private final Map<String, CommandHandler<Command>> handlers = new ConcurrentHashMap<>();
  private final Interceptors<Command> interceptors = new Interceptors<>();
  private final MetricsExporter metrics;

  public DefaultCommandBus() {
    this(MetricsExporter.NOOP);
  }

  public DefaultCommandBus(MetricsExporter metrics) {
    this.metrics = Objects.requireNonNull(metrics, "metrics");
  }

  @Override
  @SuppressWarnings("unchecked")
  public <C extends Command> void register(String commandType, CommandHandler<C> handler) {
    Objects.requireNonNull(commandType, "commandType");
    Objects.requireNonNull(handler, "handler");
    if (!handler.supports(commandType)) {
      throw new IllegalArgumentException("Handler does not support command type: " + commandType);
    }
    if (handlers.putIfAbsent(commandType, (CommandHandler<Command>) handler) != null) {
      throw new DuplicateHandlerException("command", commandType);
    }
    logger.log(Level.FINE, "Registered command handler for {0}", commandType);
  }

  @Override
  public boolean unregister(String commandType) {
    return handlers.remove(commandType) != null;
  }

  @Override
  public boolean hasHandler(String commandType) {
    return handlers.containsKey(commandType);
  }

  @Override
  public Set<String> registeredTypes() {
    return Set.copyOf(handlers.keySet());
  }

  @Override
  public boolean supports(String commandType) {
    return hasHandler(commandType);
  }

  @Override
  public void execute(Command command) {
    Objects.requireNonNull(command, "command");
    String commandType = command.commandType();
    CommandHandler<Command> handler = handlers.get(commandType);
    if (handler == null) {
      metrics.incrementCommandsFailed();
      throw new NoHandlerException("command", commandType);
    }
    try {
      interceptors.invoke(command, () -> {
        handler.handle(command);
        return null;
      });
      metrics.incrementCommandsSucceeded();
    } catch (Exception e) {
      metrics.incrementCommandsFailed();
      logger.log(Level.WARNING, "Command handler failed for " + commandType, e);
      throw new HandlerExecutionException(commandType, e);
    }
  }

  @Override
  public void addInterceptor(DispatchInterceptor<Command> interceptor) {
    interceptors.add(interceptor);
  }

  @Override
  public void clear() {
    handlers.clear();
    interceptors.clear();
  }

  @Override
  public BusStatistics statistics() {
    int registered = handlers.size();
    return new BusStatistics(registered, registered, interceptors.size(), 0);
  }
}
