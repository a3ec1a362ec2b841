/**
 * Micrometer bridge for exporting command pipeline metrics to Prometheus, Grafana, and
 * other backends.
 *
 * <p>{@link uibridge.micrometer.MicrometerMetricsExporter} implements the
 * {@link uibridge.spi.MetricsExporter} SPI using Micrometer counters, gauges and timers.
 *
 * @see uibridge.micrometer.MicrometerMetricsExporter
 */
package uibridge.micrometer;
