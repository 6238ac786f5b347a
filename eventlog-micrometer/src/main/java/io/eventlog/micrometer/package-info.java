/**
 * Micrometer bridge for exporting event store and bus metrics to Prometheus, Grafana,
 * and other backends.
 *
 * <p>{@link io.eventlog.micrometer.MicrometerMetricsExporter} implements the
 * {@link io.eventlog.spi.MetricsExporter} SPI using Micrometer counters.
 */
package io.eventlog.micrometer;
