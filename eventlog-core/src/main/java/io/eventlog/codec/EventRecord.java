package io.eventlog.codec;

import java.time.Instant;

/**
 * Storable form of a {@link io.eventlog.DomainEvent}, one field per persisted column.
 *
 * <p>Rows read back from storage may hold anything; {@link EventRecordCodec#decode}
 * validates them. {@code sequence} is assigned by storage on insert and is {@code 0}
 * for records that have not been written yet.
 */
public record EventRecord(
    long sequence,
    String eventId,
    String aggregateId,
    String eventType,
    String payload,
    String metadata,
    long version,
    Instant occurredAt,
    String tenantId,
    Instant storedAt
) {}
