/**
 * Service Provider Interfaces (SPI) for plugging the notifier into a messaging endpoint
 * and a metrics backend.
 *
 * @see notifier.spi.MessageTransport
 * @see notifier.spi.MetricsExporter
 */
package notifier.spi;
