package eventbus.spi;

/**
 * Thrown when an {@link EventStore} cannot read or write its backing storage.
 */
public class EventStoreException extends RuntimeException {

    public EventStoreException(String message) {
        super(message);
    }

    public EventStoreException(String message, Throwable cause) {
        super(message, cause);
    }
}
