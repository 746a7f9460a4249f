package eventbus.sweep;

import eventbus.model.EventRecord;

/**
 * Callback receiving pending records found by an {@link EventSweeper}.
 */
@FunctionalInterface
public interface PendingEventHandler {

    /**
     * Hands over a pending record for processing.
     *
     * @param record the pending record
     * @return {@code true} if the record was accepted, {@code false} if it is already being
     *         processed or cannot be accepted now
     */
    boolean handle(EventRecord record);

    /**
     * Reports whether this process is still working on an event. The sweep never reclaims a
     * {@code PROCESSING} record that is still in flight.
     *
     * @param eventId the event id
     * @return {@code true} if the event is owned by a live processing path
     */
    default boolean isInFlight(String eventId) {
        return false;
    }
}
