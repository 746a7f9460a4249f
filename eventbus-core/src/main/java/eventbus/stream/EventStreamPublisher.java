package eventbus.stream;

import eventbus.EventEnvelope;
import eventbus.Publisher;
import eventbus.model.DeliveryConfig;
import eventbus.util.DaemonThreadFactory;

import java.time.Instant;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Deque;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Publisher decorator that keeps a bounded buffer of recent events and notifies stream
 * subscribers.
 *
 * <p>Events are appended to the buffer after the delegate accepted them. Subscribers registered
 * for the event type are notified first, then subscribers registered for
 * {@link #ALL_EVENTS}. Notification runs on a dedicated pool and never blocks the publisher.
 * When the buffer is full the oldest event is dropped.
 */
public final class EventStreamPublisher implements Publisher, AutoCloseable {
    private static final Logger logger = Logger.getLogger(EventStreamPublisher.class.getName());

    public static final String ALL_EVENTS = "*";
    public static final int DEFAULT_CAPACITY = 1000;
    public static final int DEFAULT_SUBSCRIBER_THREADS = 4;

    private final Publisher delegate;
    private final int capacity;
    private final Deque<StreamEvent> buffer;
    private final Map<String, List<StreamSubscriber>> subscribers = new ConcurrentHashMap<>();
    private final ExecutorService notifier;

    public EventStreamPublisher(Publisher delegate) {
        this(delegate, DEFAULT_CAPACITY, DEFAULT_SUBSCRIBER_THREADS);
    }

    public EventStreamPublisher(Publisher delegate, int capacity, int subscriberThreads) {
        this.delegate = Objects.requireNonNull(delegate, "delegate");
        if (capacity <= 0) {
            throw new IllegalArgumentException("capacity must be > 0");
        }
        if (subscriberThreads <= 0) {
            throw new IllegalArgumentException("subscriberThreads must be > 0");
        }
        this.capacity = capacity;
        this.buffer = new ArrayDeque<>(capacity);
        this.notifier = Executors.newFixedThreadPool(subscriberThreads, new DaemonThreadFactory("eventbus-stream-"));
    }

    @Override
    public String publish(EventEnvelope event) {
        String eventId = delegate.publish(event);
        stream(eventId, event);
        return eventId;
    }

    @Override
    public String publish(EventEnvelope event, DeliveryConfig config) {
        String eventId = delegate.publish(event, config);
        stream(eventId, event);
        return eventId;
    }

    /**
     * Registers a subscriber for an event type, or {@link #ALL_EVENTS} for every type.
     */
    public void subscribe(String eventType, StreamSubscriber subscriber) {
        Objects.requireNonNull(eventType, "eventType");
        Objects.requireNonNull(subscriber, "subscriber");
        subscribers.computeIfAbsent(eventType, k -> new CopyOnWriteArrayList<>()).add(subscriber);
        logger.log(Level.INFO, "Added stream subscriber for {0} events", eventType);
    }

    /**
     * Removes a subscriber previously registered for {@code eventType}.
     *
     * @return {@code true} if the subscriber was registered
     */
    public boolean unsubscribe(String eventType, StreamSubscriber subscriber) {
        List<StreamSubscriber> list = subscribers.get(eventType);
        boolean removed = list != null && list.remove(subscriber);
        if (removed) {
            logger.log(Level.INFO, "Removed stream subscriber for {0} events", eventType);
        }
        return removed;
    }

    /**
     * Returns up to {@code limit} of the newest buffered events, oldest first.
     *
     * @param eventTypes types to include, or {@code null}/empty for all
     * @param limit      maximum number of events
     */
    public List<StreamEvent> recentEvents(Collection<String> eventTypes, int limit) {
        if (limit < 0) {
            throw new IllegalArgumentException("limit must be >= 0");
        }
        Set<String> filter = eventTypes == null ? Set.of() : Set.copyOf(eventTypes);
        List<StreamEvent> newestFirst = new ArrayList<>();
        synchronized (buffer) {
            Iterator<StreamEvent> it = buffer.descendingIterator();
            while (it.hasNext() && newestFirst.size() < limit) {
                StreamEvent e = it.next();
                if (filter.isEmpty() || filter.contains(e.eventType())) {
                    newestFirst.add(e);
                }
            }
        }
        List<StreamEvent> result = new ArrayList<>(newestFirst.size());
        for (int i = newestFirst.size() - 1; i >= 0; i--) {
            result.add(newestFirst.get(i));
        }
        return result;
    }

    public int bufferedCount() {
        synchronized (buffer) {
            return buffer.size();
        }
    }

    public int capacity() {
        return capacity;
    }

    private void stream(String eventId, EventEnvelope event) {
        StreamEvent streamEvent = StreamEvent.of(eventId, event, Instant.now());
        synchronized (buffer) {
            if (buffer.size() == capacity) {
                buffer.pollFirst();
            }
            buffer.addLast(streamEvent);
        }
        notifySubscribers(subscribers.get(event.eventType()), streamEvent);
        notifySubscribers(subscribers.get(ALL_EVENTS), streamEvent);
    }

    private void notifySubscribers(List<StreamSubscriber> targets, StreamEvent event) {
        if (targets == null) {
            return;
        }
        for (StreamSubscriber subscriber : targets) {
            try {
                notifier.execute(() -> deliver(subscriber, event));
            } catch (RejectedExecutionException e) {
                logger.log(Level.WARNING, "Stream notifier rejected event {0}", event.eventId());
            }
        }
    }

    private static void deliver(StreamSubscriber subscriber, StreamEvent event) {
        try {
            subscriber.onEvent(event);
        } catch (RuntimeException e) {
            logger.log(Level.WARNING, "Stream subscriber failed for " + event.eventType() + " event "
                    + event.eventId(), e);
        }
    }

    /**
     * Stops the notification pool. Does not close the delegate.
     */
    @Override
    public void close() {
        notifier.shutdown();
        try {
            if (!notifier.awaitTermination(5, TimeUnit.SECONDS)) {
                notifier.shutdownNow();
            }
        } catch (InterruptedException e) {
            notifier.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }
}
