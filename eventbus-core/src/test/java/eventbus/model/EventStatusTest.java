package eventbus.model;

import org.junit.jupiter.api.Test;

import static eventbus.model.EventStatus.COMPLETED;
import static eventbus.model.EventStatus.DEAD_LETTER;
import static eventbus.model.EventStatus.FAILED;
import static eventbus.model.EventStatus.PENDING;
import static eventbus.model.EventStatus.PROCESSING;
import static eventbus.model.EventStatus.RETRYING;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class EventStatusTest {

    @Test
    void legalEdges() {
        assertTrue(PENDING.canTransitionTo(PROCESSING));
        assertTrue(PROCESSING.canTransitionTo(COMPLETED));
        assertTrue(PROCESSING.canTransitionTo(FAILED));
        assertTrue(FAILED.canTransitionTo(RETRYING));
        assertTrue(FAILED.canTransitionTo(DEAD_LETTER));
        assertTrue(RETRYING.canTransitionTo(PENDING));
        assertTrue(DEAD_LETTER.canTransitionTo(PENDING));
    }

    @Test
    void illegalEdges() {
        assertFalse(PENDING.canTransitionTo(COMPLETED));
        assertFalse(COMPLETED.canTransitionTo(PENDING));
        assertFalse(PROCESSING.canTransitionTo(PENDING));
        assertFalse(RETRYING.canTransitionTo(COMPLETED));
    }

    @Test
    void sameStatusIsAllowed() {
        for (EventStatus status : EventStatus.values()) {
            assertTrue(status.canTransitionTo(status));
        }
    }

    @Test
    void terminalStatuses() {
        assertTrue(COMPLETED.isTerminal());
        assertTrue(DEAD_LETTER.isTerminal());
        assertFalse(FAILED.isTerminal());
        assertFalse(RETRYING.isTerminal());
    }
}
