/**
 * Micrometer bridge for exporting event manager metrics to Prometheus, Grafana, and other backends.
 *
 * <p>{@link eventmanager.micrometer.MicrometerMetricsExporter} implements the
 * {@link eventmanager.spi.MetricsExporter} SPI using Micrometer counters and a gauge.
 *
 * @see eventmanager.micrometer.MicrometerMetricsExporter
 */
package eventmanager.micrometer;
