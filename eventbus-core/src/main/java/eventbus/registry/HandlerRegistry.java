package eventbus.registry;

import eventbus.EventEnvelope;
import eventbus.EventHandler;
import eventbus.EventType;
import eventbus.handler.HandlerOptions;

/**
 * Binds handlers to event types and dispatches events to them.
 *
 * @see DefaultHandlerRegistry
 */
public interface HandlerRegistry {

    /** Event type under which a handler receives every event. */
    String ALL_EVENTS = "*";

    /**
     * Registers a handler.
     *
     * @param eventType event type name, or {@link #ALL_EVENTS}
     * @param handler   the handler
     * @param options   registration metadata
     * @return the handler id
     * @throws IllegalArgumentException if a handler with the same name is already registered
     */
    String register(String eventType, EventHandler handler, HandlerOptions options);

    default String register(EventType eventType, EventHandler handler, HandlerOptions options) {
        return register(eventType.name(), handler, options);
    }

    default String register(String eventType, EventHandler handler) {
        return register(eventType, handler, HandlerOptions.defaults());
    }

    default String registerAll(EventHandler handler, HandlerOptions options) {
        return register(ALL_EVENTS, handler, options);
    }

    /**
     * Removes a handler.
     *
     * @param eventType the event type it was registered for
     * @param handlerId the handler id
     * @return {@code true} if it was registered
     */
    boolean unregister(String eventType, String handlerId);

    /**
     * Runs every handler bound to the event's type (and wildcard handlers): sync handlers in
     * order, then async handlers concurrently, then background handlers without waiting.
     *
     * @param event the event
     * @return results of the sync and async handlers; empty if no handler is bound
     */
    DispatchOutcome dispatch(EventEnvelope event);

    boolean hasHandlers(String eventType);
}
