/**
 * Handler registration and per-event dispatch.
 *
 * <p>{@link eventbus.registry.DefaultHandlerRegistry} orders handlers by priority and runs
 * them by {@linkplain eventbus.handler.HandlerMode mode}. Handlers registered for
 * {@value eventbus.registry.HandlerRegistry#ALL_EVENTS} receive every event type.
 */
package eventbus.registry;
