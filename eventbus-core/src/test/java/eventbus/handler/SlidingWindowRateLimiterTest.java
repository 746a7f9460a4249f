package eventbus.handler;

import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZoneOffset;

import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class SlidingWindowRateLimiterTest {

    @Test
    void allowsUpToLimitWithinWindow() {
        MutableClock clock = new MutableClock();
        var limiter = new SlidingWindowRateLimiter(2, Duration.ofSeconds(60), clock);

        assertTrue(limiter.tryAcquire());
        assertTrue(limiter.tryAcquire());
        assertFalse(limiter.tryAcquire());
    }

    @Test
    void windowSlides() {
        MutableClock clock = new MutableClock();
        var limiter = new SlidingWindowRateLimiter(1, Duration.ofSeconds(60), clock);

        assertTrue(limiter.tryAcquire());
        clock.advance(Duration.ofSeconds(30));
        assertFalse(limiter.tryAcquire());
        clock.advance(Duration.ofSeconds(30));
        assertTrue(limiter.tryAcquire());
    }

    @Test
    void rejectedCallsDoNotConsumeCapacity() {
        MutableClock clock = new MutableClock();
        var limiter = new SlidingWindowRateLimiter(1, Duration.ofSeconds(60), clock);

        assertTrue(limiter.tryAcquire());
        clock.advance(Duration.ofSeconds(59));
        assertFalse(limiter.tryAcquire());
        clock.advance(Duration.ofSeconds(1));
        assertTrue(limiter.tryAcquire());
    }

    @Test
    void rejectsNonPositiveLimit() {
        assertThrows(IllegalArgumentException.class, () -> new SlidingWindowRateLimiter(0));
    }

    private static final class MutableClock extends Clock {
        private Instant now = Instant.parse("2024-01-01T00:00:00Z");

        void advance(Duration duration) {
            now = now.plus(duration);
        }

        @Override
        public ZoneId getZone() {
            return ZoneOffset.UTC;
        }

        @Override
        public Clock withZone(ZoneId zone) {
            return this;
        }

        @Override
        public Instant instant() {
            return now;
        }
    }
}
