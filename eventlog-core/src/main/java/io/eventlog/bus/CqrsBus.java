package io.eventlog.bus;

import io.eventlog.DomainEvent;
import io.eventlog.bus.command.Command;
import io.eventlog.bus.command.CommandBus;
import io.eventlog.bus.command.DefaultCommandBus;
import io.eventlog.bus.event.DefaultEventBus;
import io.eventlog.bus.event.EventBus;
import io.eventlog.bus.query.DefaultQueryBus;
import io.eventlog.bus.query.Query;
import io.eventlog.bus.query.QueryBus;
import io.eventlog.util.DaemonThreadFactory;

import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Supplier;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Lifecycle-managed façade over a {@link CommandBus}, a {@link QueryBus} and an
 * {@link EventBus}.
 *
 * <p>Dispatch is only allowed while {@link BusState#INITIALIZED}. The state moves
 * {@code UNINITIALIZED -> INITIALIZED -> SHUT_DOWN} by compare-and-set, so concurrent
 * lifecycle calls never observe a torn state. {@link #shutdown()} clears every
 * sub-bus; a shut-down bus cannot be initialized again.
 *
 * <h2>Usage</h2>
 * <pre>{@code
 * CqrsBus bus = CqrsBus.builder()
 *     .queryBus(DefaultQueryBus.builder().defaultTtl(Duration.ofSeconds(30)).build())
 *     .build();
 * bus.commands().register(PlaceOrder.class, placeOrderHandler);
 * bus.events().subscribe("OrderPlaced", projection);
 * bus.initialize();
 *
 * bus.executeCommand(new PlaceOrder("order-1", 42));
 * }</pre>
 */
public final class CqrsBus implements AutoCloseable {
  private static final Logger logger = Logger.getLogger(CqrsBus.class.getName());

  private final CommandBus commandBus;
  private final QueryBus queryBus;
  private final EventBus eventBus;
  private final Executor asyncExecutor;
  private final ExecutorService ownedExecutor;
  private final AtomicReference<BusState> state = new AtomicReference<>(BusState.UNINITIALIZED);

  private CqrsBus(Builder builder) {
    this.commandBus = builder.commandBus != null ? builder.commandBus : new DefaultCommandBus();
    this.queryBus = builder.queryBus != null ? builder.queryBus : DefaultQueryBus.builder().build();
    this.eventBus = builder.eventBus != null ? builder.eventBus : DefaultEventBus.builder().build();
    if (builder.asyncExecutor != null) {
      this.asyncExecutor = builder.asyncExecutor;
      this.ownedExecutor = null;
    } else {
      this.ownedExecutor = Executors.newFixedThreadPool(
          builder.asyncWorkers, new DaemonThreadFactory("eventlog-bus-"));
      this.asyncExecutor = ownedExecutor;
    }
  }

  public static Builder builder() {
    return new Builder();
  }

  /**
   * Moves the bus to {@link BusState#INITIALIZED}.
   *
   * @throws BusAlreadyInitializedException if the bus is initialized or shut down
   */
  public void initialize() {
    if (!state.compareAndSet(BusState.UNINITIALIZED, BusState.INITIALIZED)) {
      throw new BusAlreadyInitializedException(state.get());
    }
    logger.log(Level.INFO, "CQRS bus initialized: {0}", statisticsFor(BusState.INITIALIZED));
  }

  /**
   * Clears every handler, subscription, interceptor and cache, then leaves the bus
   * in the terminal {@link BusState#SHUT_DOWN} state.
   *
   * @throws BusNotInitializedException if the bus is not initialized, including a second shutdown
   */
  public void shutdown() {
    if (!state.compareAndSet(BusState.INITIALIZED, BusState.SHUT_DOWN)) {
      throw new BusNotInitializedException(state.get());
    }
    release();
  }

  /**
   * Moves the bus to {@link BusState#SHUT_DOWN} from any state and releases it as
   * {@link #shutdown()} does. Does nothing if the bus is already shut down.
   */
  @Override
  public void close() {
    if (state.getAndSet(BusState.SHUT_DOWN) != BusState.SHUT_DOWN) {
      release();
    }
  }

  public BusState state() {
    return state.get();
  }

  /**
   * Routes the command to its single handler.
   *
   * @throws BusNotInitializedException if the bus is not initialized
   * @throws NoHandlerException         if no handler is registered
   * @throws HandlerExecutionException  if the handler fails
   */
  public void executeCommand(Command command) {
    requireInitialized();
    commandBus.execute(command);
  }

  /**
   * Returns the (possibly cached) result of the query.
   *
   * @throws BusNotInitializedException if the bus is not initialized
   * @throws NoHandlerException         if no handler is registered
   * @throws HandlerExecutionException  if the handler fails
   */
  public <R> R executeQuery(Query<R> query) {
    requireInitialized();
    return queryBus.execute(query);
  }

  /**
   * Delivers the event to every subscriber.
   *
   * @throws BusNotInitializedException if the bus is not initialized
   * @throws AggregateHandlerException  if one or more subscribers failed
   */
  public void publishEvent(DomainEvent event) {
    requireInitialized();
    eventBus.publish(event);
  }

  /**
   * Delivers each event in order, reporting subscriber failures together at the end.
   */
  public void publishEvents(List<DomainEvent> events) {
    requireInitialized();
    eventBus.publishAll(events);
  }

  public CompletableFuture<Void> executeCommandAsync(Command command) {
    return async(() -> {
      executeCommand(command);
      return null;
    });
  }

  public <R> CompletableFuture<R> executeQueryAsync(Query<R> query) {
    return async(() -> executeQuery(query));
  }

  public CompletableFuture<Void> publishEventAsync(DomainEvent event) {
    return async(() -> {
      publishEvent(event);
      return null;
    });
  }

  /**
   * Returns true iff the bus is initialized and every sub-bus reports healthy.
   */
  public boolean healthCheck() {
    return state.get() == BusState.INITIALIZED
        && commandBus.isHealthy()
        && queryBus.isHealthy()
        && eventBus.isHealthy();
  }

  public CqrsBusStatistics getStatistics() {
    return statisticsFor(state.get());
  }

  /**
   * Returns the command types that have a handler; a snapshot.
   */
  public Set<String> getSupportedCommandTypes() {
    return commandBus.registeredTypes();
  }

  public Set<String> getSupportedQueryTypes() {
    return queryBus.registeredTypes();
  }

  /**
   * Returns the event types with at least one subscriber, including {@code "*"} while
   * wildcard subscribers exist.
   */
  public Set<String> getSupportedEventTypes() {
    return eventBus.registeredTypes();
  }

  public boolean supportsCommand(String commandType) {
    return commandBus.supports(commandType);
  }

  public boolean supportsQuery(String queryType) {
    return queryBus.supports(queryType);
  }

  /**
   * Returns true if publishing {@code eventType} would reach a subscriber, wildcard
   * subscribers included.
   */
  public boolean supportsEvent(String eventType) {
    return eventBus.supports(eventType);
  }

  public CommandBus commands() {
    return commandBus;
  }

  public QueryBus queries() {
    return queryBus;
  }

  public EventBus events() {
    return eventBus;
  }

  private CqrsBusStatistics statisticsFor(BusState current) {
    return new CqrsBusStatistics(
        current, commandBus.statistics(), queryBus.statistics(), eventBus.statistics());
  }

  private void release() {
    commandBus.clear();
    queryBus.clear();
    eventBus.clear();
    if (ownedExecutor != null) {
      ownedExecutor.shutdown();
    }
    logger.log(Level.INFO, "CQRS bus shut down");
  }

  private void requireInitialized() {
    BusState current = state.get();
    if (current != BusState.INITIALIZED) {
      throw new BusNotInitializedException(current);
    }
  }

  private <T> CompletableFuture<T> async(Supplier<T> call) {
    BusState current = state.get();
    if (current != BusState.INITIALIZED) {
      return CompletableFuture.failedFuture(new BusNotInitializedException(current));
    }
    try {
      return CompletableFuture.supplyAsync(call, asyncExecutor);
    } catch (RuntimeException rejected) {
      return CompletableFuture.failedFuture(rejected);
    }
  }

  /**
   * Builder for {@link CqrsBus}.
   */
  public static final class Builder {
    private CommandBus commandBus;
    private QueryBus queryBus;
    private EventBus eventBus;
    private Executor asyncExecutor;
    private int asyncWorkers = 4;

    private Builder() {
    }

    /**
     * Sets the command bus.
     *
     * <p>Optional. Defaults to a new {@link DefaultCommandBus}.
     *
     * @param commandBus the command bus
     * @return this builder
     */
    public Builder commandBus(CommandBus commandBus) {
      this.commandBus = commandBus;
      return this;
    }

    /**
     * Sets the query bus.
     *
     * <p>Optional. Defaults to a {@link DefaultQueryBus} without caching.
     *
     * @param queryBus the query bus
     * @return this builder
     */
    public Builder queryBus(QueryBus queryBus) {
      this.queryBus = queryBus;
      return this;
    }

    /**
     * Sets the event bus.
     *
     * <p>Optional. Defaults to a sequential {@link DefaultEventBus}.
     *
     * @param eventBus the event bus
     * @return this builder
     */
    public Builder eventBus(EventBus eventBus) {
      this.eventBus = eventBus;
      return this;
    }

    /**
     * Sets the executor for the {@code *Async} methods. The bus does not shut it down.
     *
     * <p>Optional. When unset, the bus owns a fixed pool of {@link #asyncWorkers}
     * daemon threads and shuts it down with the bus.
     *
     * @param asyncExecutor the executor
     * @return this builder
     */
    public Builder asyncExecutor(Executor asyncExecutor) {
      this.asyncExecutor = asyncExecutor;
      return this;
    }

    /**
     * Sets the size of the bus-owned async pool.
     *
     * <p>Optional. Defaults to 4. Ignored when an {@link #asyncExecutor} is set.
     *
     * @param asyncWorkers number of threads, &ge; 1
     * @return this builder
     */
    public Builder asyncWorkers(int asyncWorkers) {
      this.asyncWorkers = asyncWorkers;
      return this;
    }

    public CqrsBus build() {
      if (asyncExecutor == null && asyncWorkers < 1) {
        throw new IllegalArgumentException("asyncWorkers must be >= 1");
      }
      return new CqrsBus(this);
    }
  }
}
