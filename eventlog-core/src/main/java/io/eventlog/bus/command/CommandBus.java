package io.eventlog.bus.command;

import io.eventlog.bus.DispatchInterceptor;
import io.eventlog.bus.SubBus;

/**
 * Routes each command to the single handler registered for its type.
 *
 * @see DefaultCommandBus
 */
public interface CommandBus extends SubBus {

  /**
   * Registers the handler for {@code commandType}.
   *
   * @throws io.eventlog.bus.DuplicateHandlerException if the type already has a handler
   * @throws IllegalArgumentException                  if the handler does not support the type
   */
  <C extends Command> void register(String commandType, CommandHandler<C> handler);

  /**
   * Registers the handler under the simple name of {@code commandClass}.
   */
  default <C extends Command> void register(Class<C> commandClass, CommandHandler<C> handler) {
    register(commandClass.getSimpleName(), handler);
  }

  /**
   * Removes the handler for {@code commandType}.
   *
   * @return true if a handler was removed
   */
  boolean unregister(String commandType);

  boolean hasHandler(String commandType);

  /**
   * Invokes the handler registered for {@code command.commandType()}.
   *
   * @throws io.eventlog.bus.NoHandlerException        if none is registered
   * @throws io.eventlog.bus.HandlerExecutionException if the handler or an interceptor fails
   */
  void execute(Command command);

  void addInterceptor(DispatchInterceptor<Command> interceptor);
}
