/**
 * Micrometer bridge for exporting sync engine metrics to Prometheus, Grafana, and other backends.
 *
 * <p>{@link syncengine.micrometer.MicrometerMetricsExporter} implements the
 * {@link syncengine.spi.MetricsExporter} SPI using Micrometer counters, gauges and a timer.
 *
 * @see syncengine.micrometer.MicrometerMetricsExporter
 */
package syncengine.micrometer;
