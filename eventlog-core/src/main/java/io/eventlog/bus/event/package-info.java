/**
 * Event side of the bus: fan-out of each published event to all of its subscribers.
 *
 * <p>A failing subscriber never prevents the others from running; failures are
 * reported together after the whole fan-out has completed.
 */
package io.eventlog.bus.event;
