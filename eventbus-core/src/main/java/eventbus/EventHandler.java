package eventbus;

/**
 * Callback invoked for each event routed to it by a handler registry.
 *
 * <p>Any exception thrown counts as a failed execution and may be retried according to the
 * handler's options and the event's delivery configuration. Delivery is at-least-once, so
 * implementations should be idempotent.
 */
@FunctionalInterface
public interface EventHandler {

    void handle(EventEnvelope event) throws Exception;
}
