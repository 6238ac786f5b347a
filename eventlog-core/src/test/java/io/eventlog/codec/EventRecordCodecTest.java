package io.eventlog.codec;

import io.eventlog.CorruptEventException;
import io.eventlog.DomainEvent;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class EventRecordCodecTest {

  private static final Instant OCCURRED = Instant.parse("2024-03-01T10:15:30.123Z");
  private static final Instant STORED = Instant.parse("2024-03-01T10:15:31Z");

  private final EventRecordCodec codec = new EventRecordCodec();

  @Test
  void encodeMapsEveryColumn() {
    DomainEvent event = DomainEvent.builder("OrderPlaced")
        .eventId("evt-1")
        .aggregateId("order-1")
        .payloadJson("{\"total\":42}")
        .metadata(Map.of("correlationId", "c-1"))
        .occurredAt(OCCURRED)
        .build();

    EventRecord record = codec.encode(event, 3, "acme", STORED);

    assertEquals("evt-1", record.eventId());
    assertEquals("order-1", record.aggregateId());
    assertEquals("OrderPlaced", record.eventType());
    assertEquals("{\"total\":42}", record.payload());
    assertEquals("{\"correlationId\":\"c-1\"}", record.metadata());
    assertEquals(3, record.version());
    assertEquals(OCCURRED, record.occurredAt());
    assertEquals("acme", record.tenantId());
    assertEquals(STORED, record.storedAt());
  }

  @Test
  void encodeRequiresBoundAggregateAndPositiveVersion() {
    DomainEvent unbound = DomainEvent.builder("A").payloadJson("{}").build();
    DomainEvent bound = unbound.withAggregateId("agg");

    assertThrows(NullPointerException.class, () -> codec.encode(unbound, 1, "t", STORED));
    assertThrows(IllegalArgumentException.class, () -> codec.encode(bound, 0, "t", STORED));
  }

  @Test
  void decodeRebuildsStoredEvent() {
    EventRecord record = new EventRecord(7L, "evt-1", "order-1", "OrderPlaced",
        "{\"total\":42}", "{\"userId\":\"u-1\"}", 2, OCCURRED, "acme", STORED);

    DomainEvent event = codec.decode(record);

    assertEquals("evt-1", event.eventId());
    assertEquals("order-1", event.aggregateId());
    assertEquals(2, event.aggregateVersion());
    assertEquals("u-1", event.metadata().get("userId"));
    assertEquals(OCCURRED, event.occurredAt());
    assertEquals("acme", event.tenantId());
  }

  @Test
  void decodeDefaultsMissingTenant() {
    EventRecord record = new EventRecord(1L, "evt-1", "agg", "A", "{}", null, 1, OCCURRED, null, STORED);

    assertEquals(DomainEvent.DEFAULT_TENANT, codec.decode(record).tenantId());
  }

  @Test
  void decodeRejectsMissingColumnsNamingTheEvent() {
    CorruptEventException noType = assertThrows(CorruptEventException.class, () -> codec.decode(
        new EventRecord(1L, "evt-9", "agg", " ", "{}", null, 1, OCCURRED, "t", STORED)));
    assertEquals("evt-9", noType.eventId());

    assertThrows(CorruptEventException.class, () -> codec.decode(
        new EventRecord(1L, "evt-9", "agg", "A", null, null, 1, OCCURRED, "t", STORED)));
    assertThrows(CorruptEventException.class, () -> codec.decode(
        new EventRecord(1L, "evt-9", "agg", "A", "{}", null, 0, OCCURRED, "t", STORED)));
    assertThrows(CorruptEventException.class, () -> codec.decode(
        new EventRecord(1L, "evt-9", "agg", "A", "{}", null, 1, null, "t", STORED)));
  }

  @Test
  void decodeRejectsMalformedMetadata() {
    EventRecord record = new EventRecord(1L, "evt-3", "agg", "A", "{}", "{not json", 1, OCCURRED, "t", STORED);

    CorruptEventException ex = assertThrows(CorruptEventException.class, () -> codec.decode(record));

    assertEquals("evt-3", ex.eventId());
    assertTrue(ex.getMessage().contains("evt-3"));
    assertInstanceOf(IllegalArgumentException.class, ex.getCause());
  }
}
