/**
 * Service Provider Interfaces (SPI) for extending the event bus.
 *
 * <p>These interfaces define the extension points that integrators implement
 * to plug in persistence and metrics.
 *
 * @see eventbus.spi.EventStore
 * @see eventbus.spi.MetricsExporter
 */
package eventbus.spi;
