package eventbus.handler;

import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;

import static org.junit.jupiter.api.Assertions.assertEquals;

class HandlerStatsTest {

    private static HandlerExecutionResult ok(long ms) {
        return HandlerExecutionResult.success("h", Duration.ofMillis(ms), 0, Instant.now());
    }

    @Test
    void firstExecutionSeedsAverage() {
        HandlerStats stats = new HandlerStats();

        stats.record(ok(100));

        assertEquals(100.0, stats.averageMs(), 0.001);
    }

    @Test
    void averageIsExponentiallyWeighted() {
        HandlerStats stats = new HandlerStats();

        stats.record(ok(100));
        stats.record(ok(200));

        assertEquals(110.0, stats.averageMs(), 0.001);
    }

    @Test
    void emptySuccessRateIsZero() {
        assertEquals(0.0, new HandlerStats().successRate());
    }

    @Test
    void historyIsBounded() {
        HandlerStats stats = new HandlerStats(3);
        for (int i = 0; i < 5; i++) {
            stats.record(ok(i));
        }

        assertEquals(3, stats.history(10).size());
        assertEquals(Duration.ofMillis(4), stats.history(1).get(0).executionTime());
        assertEquals(5, stats.total());
    }

    @Test
    void failureRecordsLastError() {
        HandlerStats stats = new HandlerStats();

        stats.record(HandlerExecutionResult.failure("h", Duration.ofMillis(1), ErrorKind.HANDLER_ERROR,
                "boom", 0, Instant.now()));
        stats.record(ok(1));

        assertEquals("boom", stats.lastError());
        assertEquals(0.5, stats.successRate());
    }
}
