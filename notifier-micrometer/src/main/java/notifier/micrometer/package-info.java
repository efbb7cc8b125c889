/**
 * Micrometer bridge for exporting notifier metrics to Prometheus, Grafana, and other backends.
 *
 * <p>{@link notifier.micrometer.MicrometerMetricsExporter} implements the
 * {@link notifier.spi.MetricsExporter} SPI using Micrometer counters and timers.
 *
 * @see notifier.micrometer.MicrometerMetricsExporter
 */
package notifier.micrometer;
