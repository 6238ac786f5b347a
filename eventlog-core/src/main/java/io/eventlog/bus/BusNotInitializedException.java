package io.eventlog.bus;

/**
 * Thrown when the bus is used outside the {@link BusState#INITIALIZED} state.
 */
public final class BusNotInitializedException extends IllegalStateException {

  public BusNotInitializedException(BusState state) {
    super("CQRS bus is not initialized (state=" + state + ")");
  }
}
