package eventbus;

import java.util.Set;

/**
 * Type-safe event type identifier, typically implemented by an enum owned by the producing module.
 *
 * <p>An event type may declare payload keys that every event of that type must carry. The check
 * runs once, when the {@link EventEnvelope} is built.
 *
 * <pre>{@code
 * enum PlantEvents implements EventType {
 *     PLANT_WATERED(Set.of("plantId", "userId")),
 *     PLANT_ARCHIVED(Set.of("plantId"));
 *
 *     private final Set<String> required;
 *
 *     PlantEvents(Set<String> required) { this.required = required; }
 *
 *     public Set<String> requiredFields() { return required; }
 * }
 * }</pre>
 *
 * @see StringEventType
 */
public interface EventType {

    /**
     * Returns the event type name used for handler routing.
     *
     * @return the event type name
     */
    String name();

    /**
     * Returns the payload keys that must be present on every event of this type.
     *
     * @return required payload keys, empty by default
     */
    default Set<String> requiredFields() {
        return Set.of();
    }
}
