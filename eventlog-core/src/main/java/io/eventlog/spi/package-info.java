/**
 * Service Provider Interfaces for plugging eventlog into an application.
 *
 * <p>These interfaces are the seams integrators implement: connection provisioning,
 * tenant resolution, and metrics export.
 *
 * @see io.eventlog.spi.ConnectionProvider
 * @see io.eventlog.spi.TenantContext
 * @see io.eventlog.spi.MetricsExporter
 */
package io.eventlog.spi;
