package io.eventlog.bus.command;

/**
 * Intent to change state, routed to exactly one {@link CommandHandler}.
 *
 * <p>Commands are plain value objects; records work well. The routing type defaults
 * to the simple class name.
 *
 * <pre>{@code
 * record PlaceOrder(String orderId, long total) implements Command {}
 * }</pre>
 */
public interface Command {

  default String commandType() {
    return getClass().getSimpleName();
  }
}
