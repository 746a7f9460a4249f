package eventbus.util;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class DaemonThreadFactoryTest {

    @Test
    void createsNamedDaemonThreads() {
        DaemonThreadFactory factory = new DaemonThreadFactory("eventbus-worker-");

        Thread thread = factory.newThread(() -> {
        });

        assertTrue(thread.isDaemon());
        assertEquals("eventbus-worker-1", thread.getName());
    }

    @Test
    void sequentialNaming() {
        DaemonThreadFactory factory = new DaemonThreadFactory("test-");

        factory.newThread(() -> {
        });
        Thread second = factory.newThread(() -> {
        });

        assertEquals("test-2", second.getName());
    }

    @Test
    void nullPrefixThrows() {
        assertThrows(NullPointerException.class, () -> new DaemonThreadFactory(null));
    }
}
