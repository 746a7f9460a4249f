package eventbus.publisher;

/**
 * Set of event ids currently owned by a processing path in this process.
 *
 * <p>An id is acquired when an event is handed to a dispatch path (async worker, batch, sweep)
 * and released when processing ends, so no other path dispatches it meanwhile.
 */
public interface InFlightTracker {

    boolean tryAcquire(String eventId);

    void release(String eventId);

    boolean isInFlight(String eventId);

    int size();
}
