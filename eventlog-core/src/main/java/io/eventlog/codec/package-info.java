/**
 * Event Record Codec: maps {@link io.eventlog.DomainEvent} to and from the storable
 * {@link io.eventlog.codec.EventRecord} row shape.
 *
 * <p>Decoding failures surface as {@link io.eventlog.CorruptEventException}
 * naming the offending event id.
 */
package io.eventlog.codec;
