package eventbus.publisher;

import com.github.f4b6a3.ulid.UlidCreator;
import eventbus.EventEnvelope;
import eventbus.Publisher;
import eventbus.model.DeliveryConfig;

import java.util.List;
import java.util.Objects;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Publishes a causal chain of events.
 *
 * <p>Every event published through a context carries the context's correlation id, and its
 * causation id is the id of the previous event published through the same context (or of the
 * triggering event for the first one).
 *
 * <pre>{@code
 * EventContext ctx = EventContext.continueFrom(publisher, triggeringEvent);
 * ctx.publish(EventEnvelope.of("CareScheduled", payload));
 * ctx.publish(EventEnvelope.of("ReminderCreated", payload));
 * }</pre>
 */
public final class EventContext {
    private final Publisher publisher;
    private final String correlationId;
    private final List<String> publishedIds = new CopyOnWriteArrayList<>();
    private String lastEventId;

    private EventContext(Publisher publisher, String correlationId, String lastEventId) {
        this.publisher = Objects.requireNonNull(publisher, "publisher");
        this.correlationId = Objects.requireNonNull(correlationId, "correlationId");
        this.lastEventId = lastEventId;
    }

    /**
     * Starts a new chain with a fresh correlation id.
     *
     * @param publisher the publisher to use
     * @return a new context
     */
    public static EventContext start(Publisher publisher) {
        return new EventContext(publisher, UlidCreator.getMonotonicUlid().toString(), null);
    }

    public static EventContext start(Publisher publisher, String correlationId) {
        return new EventContext(publisher, correlationId, null);
    }

    /**
     * Continues the chain of a triggering event: reuses its correlation id (or its id when it has
     * none) and makes it the cause of the first event published.
     *
     * @param publisher the publisher to use
     * @param trigger   the triggering event
     * @return a new context
     */
    public static EventContext continueFrom(Publisher publisher, EventEnvelope trigger) {
        String correlationId = trigger.correlationId() != null ? trigger.correlationId() : trigger.eventId();
        return new EventContext(publisher, correlationId, trigger.eventId());
    }

    public String publish(EventEnvelope event) {
        return publish(event, null);
    }

    /**
     * Stamps correlation and causation ids on the event and publishes it.
     *
     * @param event  the event
     * @param config delivery configuration, or {@code null} for the publisher default
     * @return the event id
     */
    public synchronized String publish(EventEnvelope event, DeliveryConfig config) {
        EventEnvelope stamped = event.withCorrelation(correlationId, lastEventId);
        String eventId = config == null ? publisher.publish(stamped) : publisher.publish(stamped, config);
        lastEventId = eventId;
        publishedIds.add(eventId);
        return eventId;
    }

    public String correlationId() {
        return correlationId;
    }

    public List<String> publishedEventIds() {
        return List.copyOf(publishedIds);
    }
}
