package eventbus.model;

import java.util.EnumSet;
import java.util.Set;

/**
 * Lifecycle of a published event.
 *
 * <pre>
 * PENDING -&gt; PROCESSING -&gt; COMPLETED
 *                        \-&gt; FAILED -&gt; RETRYING -&gt; PENDING
 *                                  \-&gt; DEAD_LETTER
 * PENDING -&gt; DEAD_LETTER (cancelled)
 * FAILED | DEAD_LETTER -&gt; PENDING (manual retry)
 * </pre>
 */
public enum EventStatus {
    PENDING,
    PROCESSING,
    COMPLETED,
    FAILED,
    RETRYING,
    DEAD_LETTER;

    /**
     * Returns whether moving from this status to {@code target} is a legal edge. Re-applying the
     * current status is always allowed.
     *
     * @param target the next status
     * @return whether the transition is legal
     */
    public boolean canTransitionTo(EventStatus target) {
        if (target == this) {
            return true;
        }
        return successors().contains(target);
    }

    public boolean isTerminal() {
        return this == COMPLETED || this == DEAD_LETTER;
    }

    private Set<EventStatus> successors() {
        return switch (this) {
            case PENDING -> EnumSet.of(PROCESSING, DEAD_LETTER);
            case PROCESSING -> EnumSet.of(COMPLETED, FAILED);
            case FAILED -> EnumSet.of(RETRYING, DEAD_LETTER, PENDING);
            case RETRYING -> EnumSet.of(PENDING, DEAD_LETTER);
            case DEAD_LETTER -> EnumSet.of(PENDING);
            case COMPLETED -> EnumSet.noneOf(EventStatus.class);
        };
    }
}
