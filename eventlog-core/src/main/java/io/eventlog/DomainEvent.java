package io.eventlog;

import com.github.f4b6a3.ulid.UlidCreator;

import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Immutable domain event recorded in an aggregate's stream.
 *
 * <p>Each event is assigned a ULID-based {@code eventId} by default. The payload is
 * JSON text limited to {@value #MAX_PAYLOAD_BYTES} bytes. The {@code aggregateVersion}
 * is {@code 0} until the event store assigns the event its position in the stream;
 * stored events always carry a version &ge; 1.
 *
 * <p>Events are never mutated. {@link #withVersion}, {@link #withAggregateId} and
 * {@link #withTenantId} return copies.
 *
 * @see EventStore
 * @see EventType
 */
public final class DomainEvent {
  public static final int MAX_PAYLOAD_BYTES = 1024 * 1024; // 1MB
  public static final String DEFAULT_TENANT = "default";

  private final String eventId;
  private final String aggregateId;
  private final String eventType;
  private final String payloadJson;
  private final Map<String, String> metadata;
  private final long aggregateVersion;
  private final Instant occurredAt;
  private final String tenantId;

  private DomainEvent(Builder builder) {
    this.eventId = builder.eventId == null ? newEventId() : builder.eventId;
    if (this.eventId.isEmpty()) {
      throw new IllegalArgumentException("eventId cannot be empty");
    }
    this.eventType = Objects.requireNonNull(builder.eventType, "eventType");
    if (this.eventType.isEmpty()) {
      throw new IllegalArgumentException("eventType cannot be empty");
    }
    this.aggregateId = builder.aggregateId;
    if (builder.aggregateVersion < 0) {
      throw new IllegalArgumentException("aggregateVersion must be >= 0");
    }
    this.aggregateVersion = builder.aggregateVersion;
    this.occurredAt = builder.occurredAt == null
        ? Instant.now().truncatedTo(ChronoUnit.MILLIS) : builder.occurredAt;
    this.tenantId = builder.tenantId;

    Map<String, String> metadataCopy = builder.metadata == null
        ? Collections.emptyMap()
        : Collections.unmodifiableMap(new LinkedHashMap<>(builder.metadata));
    if (metadataCopy.containsKey(null)) {
      throw new IllegalArgumentException("metadata cannot contain null keys");
    }
    if (metadataCopy.containsValue(null)) {
      throw new IllegalArgumentException("metadata cannot contain null values");
    }
    this.metadata = metadataCopy;

    this.payloadJson = Objects.requireNonNull(builder.payloadJson, "payloadJson");
    if (payloadJson.getBytes(StandardCharsets.UTF_8).length > MAX_PAYLOAD_BYTES) {
      throw new IllegalArgumentException("Payload exceeds maximum size of " + MAX_PAYLOAD_BYTES + " bytes");
    }
  }

  /**
   * Creates a builder with a type-safe event type.
   *
   * @param eventType the event type (enum or other EventType implementation)
   * @return a new builder
   */
  public static Builder builder(EventType eventType) {
    Objects.requireNonNull(eventType, "eventType");
    return new Builder(eventType.name());
  }

  /**
   * Creates a builder with a string event type.
   *
   * @param eventType the event type name
   * @return a new builder
   */
  public static Builder builder(String eventType) {
    return new Builder(eventType);
  }

  /**
   * Creates an event for the given aggregate with a JSON payload.
   *
   * @param eventType   the event type name
   * @param aggregateId the owning aggregate
   * @param payloadJson the JSON payload
   * @return a new, not yet stored event
   */
  public static DomainEvent of(String eventType, String aggregateId, String payloadJson) {
    return builder(eventType).aggregateId(aggregateId).payloadJson(payloadJson).build();
  }

  public String eventId() {
    return eventId;
  }

  /**
   * Returns the owning aggregate, or {@code null} if the event has not been
   * bound to a stream yet.
   */
  public String aggregateId() {
    return aggregateId;
  }

  public String eventType() {
    return eventType;
  }

  public String payloadJson() {
    return payloadJson;
  }

  public Map<String, String> metadata() {
    return metadata;
  }

  /**
   * Returns the 1-based position of this event in its aggregate's stream,
   * or {@code 0} if the event has not been stored.
   */
  public long aggregateVersion() {
    return aggregateVersion;
  }

  public Instant occurredAt() {
    return occurredAt;
  }

  /**
   * Returns the tenant, or {@code null} when the event was built without one and
   * has not been stored yet.
   */
  public String tenantId() {
    return tenantId;
  }

  public boolean isStored() {
    return aggregateVersion > 0;
  }

  public DomainEvent withVersion(long version) {
    return toBuilder().aggregateVersion(version).build();
  }

  public DomainEvent withAggregateId(String aggregateId) {
    return toBuilder().aggregateId(aggregateId).build();
  }

  public DomainEvent withTenantId(String tenantId) {
    return toBuilder().tenantId(tenantId).build();
  }

  private Builder toBuilder() {
    return new Builder(eventType)
        .eventId(eventId)
        .aggregateId(aggregateId)
        .payloadJson(payloadJson)
        .metadata(metadata)
        .aggregateVersion(aggregateVersion)
        .occurredAt(occurredAt)
        .tenantId(tenantId);
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) return true;
    if (!(o instanceof DomainEvent)) return false;
    DomainEvent that = (DomainEvent) o;
    return aggregateVersion == that.aggregateVersion
        && eventId.equals(that.eventId)
        && Objects.equals(aggregateId, that.aggregateId)
        && eventType.equals(that.eventType)
        && payloadJson.equals(that.payloadJson)
        && metadata.equals(that.metadata)
        && occurredAt.equals(that.occurredAt)
        && Objects.equals(tenantId, that.tenantId);
  }

  @Override
  public int hashCode() {
    return eventId.hashCode();
  }

  @Override
  public String toString() {
    return "DomainEvent{eventId=" + eventId
        + ", eventType=" + eventType
        + ", aggregateId=" + aggregateId
        + ", version=" + aggregateVersion
        + ", tenantId=" + tenantId + '}';
  }

  /**
   * Builder for {@link DomainEvent}.
   */
  public static final class Builder {
    private final String eventType;
    private String eventId;
    private String aggregateId;
    private String payloadJson;
    private Map<String, String> metadata;
    private long aggregateVersion;
    private Instant occurredAt;
    private String tenantId;

    private Builder(String eventType) {
      this.eventType = eventType;
    }

    /**
     * Sets a custom event identifier.
     *
     * <p>Optional. Defaults to a monotonic ULID.
     *
     * @param eventId the event identifier
     * @return this builder
     */
    public Builder eventId(String eventId) {
      this.eventId = eventId;
      return this;
    }

    /**
     * Sets the owning aggregate.
     *
     * <p>Optional. When unset, the event store binds the event to the aggregate
     * it is saved under.
     *
     * @param aggregateId the aggregate identifier
     * @return this builder
     */
    public Builder aggregateId(String aggregateId) {
      this.aggregateId = aggregateId;
      return this;
    }

    /**
     * Sets the event payload as JSON text.
     *
     * <p><b>Required.</b> Maximum size: {@value DomainEvent#MAX_PAYLOAD_BYTES} bytes (UTF-8).
     *
     * @param payloadJson the JSON payload
     * @return this builder
     */
    public Builder payloadJson(String payloadJson) {
      this.payloadJson = payloadJson;
      return this;
    }

    /**
     * Sets flat key-value metadata (correlation id, causation id, user id).
     * The map is defensively copied at build time.
     *
     * @param metadata the metadata entries
     * @return this builder
     */
    public Builder metadata(Map<String, String> metadata) {
      this.metadata = metadata;
      return this;
    }

    /**
     * Sets the stream position. Normally assigned by the event store.
     *
     * @param aggregateVersion the version, {@code 0} for "not stored"
     * @return this builder
     */
    public Builder aggregateVersion(long aggregateVersion) {
      this.aggregateVersion = aggregateVersion;
      return this;
    }

    /**
     * Sets the domain time of the event.
     *
     * <p>Optional. Defaults to {@link Instant#now()} truncated to milliseconds.
     *
     * @param occurredAt the event timestamp
     * @return this builder
     */
    public Builder occurredAt(Instant occurredAt) {
      this.occurredAt = occurredAt;
      return this;
    }

    /**
     * Sets the tenant identifier.
     *
     * <p>Optional. When unset, the event store stamps its tenant context or
     * {@value DomainEvent#DEFAULT_TENANT}.
     *
     * @param tenantId the tenant identifier
     * @return this builder
     */
    public Builder tenantId(String tenantId) {
      this.tenantId = tenantId;
      return this;
    }

    /**
     * Builds an immutable {@link DomainEvent}.
     *
     * @return a new event
     * @throws NullPointerException     if the payload is missing
     * @throws IllegalArgumentException if {@code eventType} is empty, the payload is too large,
     *                                  the version is negative, or metadata contains nulls
     */
    public DomainEvent build() {
      return new DomainEvent(this);
    }
  }

  private static String newEventId() {
    return UlidCreator.getMonotonicUlid().toString();
  }
}
