package io.eventlog.bus;

/**
 * Thrown by {@link CqrsBus#initialize()} when the bus has already left
 * {@link BusState#UNINITIALIZED}, including after shutdown.
 */
public final class BusAlreadyInitializedException extends IllegalStateException {

  public BusAlreadyInitializedException(BusState state) {
    super("CQRS bus cannot be initialized (state=" + state + ")");
  }
}
