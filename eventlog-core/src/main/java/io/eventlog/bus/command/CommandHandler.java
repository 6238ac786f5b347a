package io.eventlog.bus.command;

/**
 * Handles one command type. Handlers that mutate aggregates append the resulting
 * events to the event store under the version they loaded.
 *
 * @param <C> the command type
 */
@FunctionalInterface
public interface CommandHandler<C extends Command> {

  /**
   * Executes the command.
   *
   * @throws Exception any failure; the bus wraps it in a
   *                   {@link io.eventlog.bus.HandlerExecutionException}
   */
  void handle(C command) throws Exception;

  /**
   * Returns whether this handler accepts commands of {@code commandType}.
   * Registration is rejected for unsupported types.
   */
  default boolean supports(String commandType) {
    return true;
  }
}
