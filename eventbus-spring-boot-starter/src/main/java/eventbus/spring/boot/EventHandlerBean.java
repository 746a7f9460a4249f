package eventbus.spring.boot;

import eventbus.EventType;
import eventbus.Priority;
import eventbus.handler.HandlerMode;

import java.lang.annotation.Documented;
import java.lang.annotation.ElementType;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

/**
 * Marks a Spring bean as an event handler.
 *
 * <p>The annotated bean must implement {@link eventbus.EventHandler}. The remaining attributes
 * become the handler's {@link eventbus.handler.HandlerOptions}.
 *
 * <h2>String-based registration</h2>
 * <pre>{@code
 * @Component
 * @EventHandlerBean(eventType = "OrderPlaced", priority = Priority.HIGH, mode = HandlerMode.SYNC)
 * public class OrderHandler implements EventHandler {
 *   public void handle(EventEnvelope event) { ... }
 * }
 * }</pre>
 *
 * <h2>Type-safe class-based registration</h2>
 * <pre>{@code
 * @Component
 * @EventHandlerBean(eventTypeClass = OrderEvents.class)
 * public class OrderHandler implements EventHandler { ... }
 * }</pre>
 *
 * <p>Resolution rules:
 * <ul>
 *   <li>{@code eventTypeClass} takes precedence over {@code eventType}</li>
 *   <li>Exactly one of {@code eventType}/{@code eventTypeClass} must be specified</li>
 *   <li>{@code eventType = "*"} receives every event type</li>
 *   <li>The handler name defaults to the bean name</li>
 * </ul>
 *
 * @see EventHandlerRegistrar
 */
@Target(ElementType.TYPE)
@Retention(RetentionPolicy.RUNTIME)
@Documented
public @interface EventHandlerBean {

    /**
     * Event type name (string-based).
     */
    String eventType() default "";

    /**
     * Event type class (type-safe). Takes precedence over {@link #eventType()}.
     * Must have a no-arg constructor (or be an enum, whose first constant is used).
     */
    Class<? extends EventType> eventTypeClass() default EventType.class;

    /**
     * Handler name. Defaults to the bean name.
     */
    String name() default "";

    Priority priority() default Priority.NORMAL;

    HandlerMode mode() default HandlerMode.ASYNC;

    int retryCount() default 3;

    long timeoutMs() default 30_000;

    boolean ignoreErrors() default false;

    /**
     * Maximum executions per rolling minute; {@code 0} disables rate limiting.
     */
    int rateLimitPerMinute() default 0;
}
