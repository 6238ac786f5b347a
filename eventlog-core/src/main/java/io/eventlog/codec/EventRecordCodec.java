package io.eventlog.codec;

import io.eventlog.CorruptEventException;
import io.eventlog.DomainEvent;
import io.eventlog.util.JsonCodec;

import java.time.Instant;
import java.util.Map;
import java.util.Objects;

/**
 * Converts between {@link DomainEvent} and {@link EventRecord}. Pure; performs no I/O.
 *
 * <p>Metadata is written as a flat JSON object through the configured {@link JsonCodec}.
 * The payload is stored as the event's JSON text unchanged.
 */
public final class EventRecordCodec {

  private final JsonCodec jsonCodec;

  public EventRecordCodec() {
    this(JsonCodec.getDefault());
  }

  public EventRecordCodec(JsonCodec jsonCodec) {
    this.jsonCodec = Objects.requireNonNull(jsonCodec, "jsonCodec");
  }

  /**
   * Builds the row for {@code event} at stream position {@code version}.
   *
   * @param event    the event; its aggregate id must already be bound
   * @param version  the version assigned by the store, &ge; 1
   * @param tenantId the resolved tenant, never null
   * @param storedAt storage time
   * @return the record to insert
   */
  public EventRecord encode(DomainEvent event, long version, String tenantId, Instant storedAt) {
    Objects.requireNonNull(event, "event");
    Objects.requireNonNull(event.aggregateId(), "event.aggregateId");
    Objects.requireNonNull(tenantId, "tenantId");
    Objects.requireNonNull(storedAt, "storedAt");
    if (version < 1) {
      throw new IllegalArgumentException("version must be >= 1");
    }
    return new EventRecord(
        0L,
        event.eventId(),
        event.aggregateId(),
        event.eventType(),
        event.payloadJson(),
        jsonCodec.toJson(event.metadata()),
        version,
        event.occurredAt(),
        tenantId,
        storedAt);
  }

  /**
   * Rebuilds the stored event described by {@code record}.
   *
   * @throws CorruptEventException if a required column is missing or malformed
   */
  public DomainEvent decode(EventRecord record) {
    Objects.requireNonNull(record, "record");
    String eventId = record.eventId();
    if (isBlank(eventId)) {
      throw new CorruptEventException(String.valueOf(eventId), "event_id is blank");
    }
    if (isBlank(record.aggregateId())) {
      throw new CorruptEventException(eventId, "aggregate_id is blank");
    }
    if (isBlank(record.eventType())) {
      throw new CorruptEventException(eventId, "event_type is blank");
    }
    if (record.payload() == null) {
      throw new CorruptEventException(eventId, "payload is null");
    }
    if (record.version() < 1) {
      throw new CorruptEventException(eventId, "version " + record.version() + " is not positive");
    }
    if (record.occurredAt() == null) {
      throw new CorruptEventException(eventId, "occurred_at is null");
    }

    Map<String, String> metadata;
    try {
      metadata = jsonCodec.parseObject(record.metadata());
    } catch (RuntimeException e) {
      throw new CorruptEventException(eventId, "metadata is not a JSON object: " + e.getMessage(), e);
    }

    try {
      return DomainEvent.builder(record.eventType())
          .eventId(eventId)
          .aggregateId(record.aggregateId())
          .payloadJson(record.payload())
          .metadata(metadata)
          .aggregateVersion(record.version())
          .occurredAt(record.occurredAt())
          .tenantId(isBlank(record.tenantId()) ? DomainEvent.DEFAULT_TENANT : record.tenantId())
          .build();
    } catch (IllegalArgumentException e) {
      throw new CorruptEventException(eventId, e.getMessage(), e);
    }
  }

  private static boolean isBlank(String value) {
    return value == null || value.isBlank();
  }
}
