/**
 * Service provider interfaces implemented outside the core module.
 *
 * @see eventmanager.spi.MetricsExporter
 */
package eventmanager.spi;
