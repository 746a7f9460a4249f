/**
 * The event publisher and its supporting pieces.
 *
 * <p>{@link eventbus.publisher.EventPublisher} persists each published event as a
 * {@link eventbus.model.EventRecord} and delivers it according to its
 * {@link eventbus.model.DeliveryMode}: immediately on the caller's thread, asynchronously on a
 * worker pool, in batches keyed by priority and type, or only when the background sweep picks it
 * up. Failed dispatches move through the retry state machine until they complete, exhaust their
 * retries into dead letter, or stop in {@code FAILED} when dead-lettering is disabled.
 *
 * <p>{@link eventbus.publisher.InFlightTracker} keeps one event from being dispatched by two
 * paths at once; {@link eventbus.publisher.EventContext} stamps correlation and causation ids.
 */
package eventbus.publisher;
