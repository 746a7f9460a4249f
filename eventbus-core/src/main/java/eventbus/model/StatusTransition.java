package eventbus.model;

import java.time.Instant;
import java.util.Objects;

/**
 * One entry of a record's transition log.
 *
 * @param status the status entered
 * @param at     when it was entered
 * @param error  error that caused it, may be {@code null}
 */
public record StatusTransition(EventStatus status, Instant at, String error) {

    public StatusTransition {
        Objects.requireNonNull(status, "status");
        Objects.requireNonNull(at, "at");
    }
}
