package eventbus.model;

/** How a publisher delivers an accepted event. */
public enum DeliveryMode {
    /** Dispatch on the caller's thread; {@code publish} returns after the first attempt. */
    IMMEDIATE,
    /** Dispatch on a worker thread; {@code publish} returns at once. */
    ASYNC,
    /** Group with events of the same priority and type; flush on size or time. */
    BATCH,
    /** Persist only; the background sweep delivers the event. */
    PERSISTENT
}
