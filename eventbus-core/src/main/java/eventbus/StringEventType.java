package eventbus;

import java.util.Objects;
import java.util.Set;

/**
 * String-based {@link EventType} for dynamic or ad-hoc event types.
 *
 * @param name           the event type name (must not be null or empty)
 * @param requiredFields payload keys every event of this type must carry
 */
public record StringEventType(String name, Set<String> requiredFields) implements EventType {

    public StringEventType {
        Objects.requireNonNull(name, "name");
        if (name.isEmpty()) {
            throw new IllegalArgumentException("name cannot be empty");
        }
        requiredFields = requiredFields == null ? Set.of() : Set.copyOf(requiredFields);
    }

    public StringEventType(String name) {
        this(name, Set.of());
    }

    public static StringEventType of(String name, String... requiredFields) {
        return new StringEventType(name, Set.of(requiredFields));
    }
}
