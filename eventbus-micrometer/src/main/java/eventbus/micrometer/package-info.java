/**
 * Micrometer bridge for the event bus {@link eventbus.spi.MetricsExporter} SPI.
 */
package eventbus.micrometer;
