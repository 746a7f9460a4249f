/**
 * Spring Boot auto-configuration for the event bus: {@code eventbus.*} properties, store
 * selection, publisher lifecycle, {@link eventbus.spring.boot.EventHandlerBean} registration and
 * Micrometer wiring.
 */
package eventbus.spring.boot;
