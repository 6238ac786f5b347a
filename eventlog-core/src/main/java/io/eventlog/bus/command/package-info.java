/**
 * Command side of the bus: exactly one handler per command type.
 */
package io.eventlog.bus.command;
