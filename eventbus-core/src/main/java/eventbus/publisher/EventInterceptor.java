package eventbus.publisher;

import eventbus.EventEnvelope;

/**
 * Cross-cutting hook around every dispatch the publisher performs.
 *
 * <p>Interceptors run around handler dispatch:
 * <ol>
 *   <li>{@link #beforeDispatch} in registration order</li>
 *   <li>handler dispatch</li>
 *   <li>{@link #afterDispatch} in reverse order, for every interceptor whose
 *       {@code beforeDispatch} ran</li>
 * </ol>
 *
 * <p>If {@code beforeDispatch} throws, handlers are skipped and the attempt counts as a failed
 * dispatch, entering the retry state machine. {@code afterDispatch} exceptions are logged and
 * ignored.
 *
 * <h2>Example</h2>
 * <pre>{@code
 * EventPublisher.builder()
 *     .interceptor(EventInterceptor.before(event ->
 *         MDC.put("correlationId", event.correlationId())))
 *     .interceptor(EventInterceptor.after((event, error) -> {
 *         if (error != null) alerts.notify(event.eventType(), error);
 *     }))
 *     .build();
 * }</pre>
 */
public interface EventInterceptor {

    /**
     * Called before handlers run.
     *
     * @param event the event about to be dispatched
     * @throws Exception to fail this dispatch attempt
     */
    default void beforeDispatch(EventEnvelope event) throws Exception {
    }

    /**
     * Called after dispatch, or after a {@code beforeDispatch} failure.
     *
     * @param event the event that was dispatched
     * @param error {@code null} on success, otherwise the failure
     */
    default void afterDispatch(EventEnvelope event, Exception error) {
    }

    static EventInterceptor before(BeforeHook hook) {
        return new EventInterceptor() {
            @Override
            public void beforeDispatch(EventEnvelope event) throws Exception {
                hook.accept(event);
            }
        };
    }

    static EventInterceptor after(AfterHook hook) {
        return new EventInterceptor() {
            @Override
            public void afterDispatch(EventEnvelope event, Exception error) {
                hook.accept(event, error);
            }
        };
    }

    @FunctionalInterface
    interface BeforeHook {
        void accept(EventEnvelope event) throws Exception;
    }

    @FunctionalInterface
    interface AfterHook {
        void accept(EventEnvelope event, Exception error);
    }
}
