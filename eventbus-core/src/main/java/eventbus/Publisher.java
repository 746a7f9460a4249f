package eventbus;

import eventbus.model.DeliveryConfig;

/**
 * Entry point for producers.
 *
 * <p>{@code publish} always returns the event id once the event has been accepted, even when
 * delivery happens later or eventually fails. Callers query status rather than expecting
 * handler failures to be thrown.
 */
public interface Publisher {

    /**
     * Publishes an event with the publisher's default delivery configuration.
     *
     * @param event the event to publish
     * @return the event id
     * @throws eventbus.spi.EventStoreException if the event cannot be persisted
     */
    String publish(EventEnvelope event);

    /**
     * Publishes an event with an explicit delivery configuration.
     *
     * @param event  the event to publish
     * @param config how the event is delivered and retried
     * @return the event id
     * @throws eventbus.spi.EventStoreException if the event cannot be persisted
     */
    String publish(EventEnvelope event, DeliveryConfig config);
}
