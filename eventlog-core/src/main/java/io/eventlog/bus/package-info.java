/**
 * CQRS bus: lifecycle-managed façade over command, query and event dispatch.
 *
 * <p>Commands route to exactly one handler, queries to exactly one handler with an
 * optional result cache, and events fan out to every subscriber.
 *
 * <h2>Key Components</h2>
 * <ul>
 *   <li>{@link io.eventlog.bus.CqrsBus} - the façade and its lifecycle</li>
 *   <li>{@link io.eventlog.bus.SubBus} - capabilities shared by the three sub-buses</li>
 *   <li>{@link io.eventlog.bus.DispatchInterceptor} - before/after hooks around dispatch</li>
 * </ul>
 */
package io.eventlog.bus;
