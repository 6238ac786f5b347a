package io.eventlog.bus;

/**
 * Lifecycle of a {@link CqrsBus}. Transitions only move forward;
 * {@link #SHUT_DOWN} is terminal and a fresh bus is needed to dispatch again.
 */
public enum BusState {
  UNINITIALIZED,
  INITIALIZED,
  SHUT_DOWN
}
