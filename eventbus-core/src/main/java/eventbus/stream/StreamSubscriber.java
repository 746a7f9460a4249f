package eventbus.stream;

/**
 * Receives events published through an {@link EventStreamPublisher}. Called on a subscriber
 * pool thread; exceptions are logged and do not affect delivery.
 */
@FunctionalInterface
public interface StreamSubscriber {

    void onEvent(StreamEvent event);
}
