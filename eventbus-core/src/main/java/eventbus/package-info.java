/**
 * Root API for the event bus: an in-process publisher with persisted delivery state,
 * prioritized handlers, retries with backoff and a dead-letter state.
 *
 * <h2>Core Design</h2>
 * <p>Producers build an {@link eventbus.EventEnvelope} and hand it to a
 * {@link eventbus.Publisher}. The {@linkplain eventbus.publisher.EventPublisher publisher}
 * persists the event as {@code PENDING} in an {@linkplain eventbus.spi.EventStore event store}
 * and delivers it according to its {@linkplain eventbus.model.DeliveryMode delivery mode}. A
 * scheduled {@linkplain eventbus.sweep.EventSweeper sweep} picks up whatever the direct paths
 * did not deliver. Delivery is at-least-once; handlers must deduplicate by
 * {@link eventbus.EventEnvelope#eventId() eventId}.
 *
 * <p>Handlers are routed by event type via a {@linkplain eventbus.registry.HandlerRegistry
 * registry}: sync handlers run first in priority order, async handlers run in parallel, and
 * background handlers are started without being awaited.
 *
 * <h2>Module Layout</h2>
 * <ul>
 *   <li><b>eventbus-core</b>: envelope, handlers, registry, publisher, in-memory store</li>
 *   <li><b>eventbus-jdbc</b>: {@linkplain eventbus.jdbc JDBC event store hierarchy}
 *       (H2, MySQL, PostgreSQL)</li>
 *   <li><b>eventbus-micrometer</b>: Micrometer metrics exporter</li>
 *   <li><b>eventbus-spring-boot-starter</b>: auto-configuration</li>
 * </ul>
 *
 * <h2>Quick Start</h2>
 * <pre>{@code
 * var registry = new DefaultHandlerRegistry();
 * registry.register("PlantWatered", event ->
 *     System.out.println("Watered: " + event.payload().get("plantId")));
 *
 * try (EventPublisher publisher = EventPublisher.builder()
 *     .store(new InMemoryEventStore())
 *     .registry(registry)
 *     .build()) {
 *   publisher.start();
 *   publisher.publish(EventEnvelope.of("PlantWatered", Map.of("plantId", "p-1")));
 * }
 * }</pre>
 *
 * @see eventbus.EventEnvelope
 * @see eventbus.EventType
 * @see eventbus.EventHandler
 * @see eventbus.Publisher
 */
package eventbus;
