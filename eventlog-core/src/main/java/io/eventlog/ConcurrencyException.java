package io.eventlog;

/**
 * Thrown by {@link EventStore#saveEvents} when the aggregate's stored version does
 * not match the version the caller last observed.
 *
 * <p>Nothing was written. The caller should reload the stream, recompute its
 * events against the new state, and save again with the new version. The store
 * never retries on the caller's behalf.
 */
public final class ConcurrencyException extends RuntimeException {

  private final String aggregateId;
  private final long expectedVersion;
  private final long actualVersion;

  public ConcurrencyException(String aggregateId, long expectedVersion, long actualVersion) {
    this(aggregateId, expectedVersion, actualVersion, null);
  }

  public ConcurrencyException(String aggregateId, long expectedVersion, long actualVersion, Throwable cause) {
    super("Concurrency conflict on aggregate " + aggregateId
        + ": expected version " + expectedVersion + " but was " + actualVersion, cause);
    this.aggregateId = aggregateId;
    this.expectedVersion = expectedVersion;
    this.actualVersion = actualVersion;
  }

  public String aggregateId() {
    return aggregateId;
  }

  public long expectedVersion() {
    return expectedVersion;
  }

  public long actualVersion() {
    return actualVersion;
  }
}
