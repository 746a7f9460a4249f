package eventbus;

/**
 * Thrown when an {@link EventEnvelope} cannot be built because its type or payload is malformed.
 *
 * <p>Validation happens once, at construction. Events that fail it are never published or retried.
 */
public class EventValidationException extends IllegalArgumentException {

    public EventValidationException(String message) {
        super(message);
    }
}
