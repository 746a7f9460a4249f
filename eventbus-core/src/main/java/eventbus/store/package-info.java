/**
 * Built-in {@link eventbus.spi.EventStore} implementations.
 */
package eventbus.store;
