package eventbus.handler;

import java.time.Clock;
import java.time.Duration;
import java.util.ArrayDeque;
import java.util.Deque;

/**
 * Sliding-window call limiter. A call is recorded only when it is allowed.
 *
 * <p>This class is thread-safe.
 */
public final class SlidingWindowRateLimiter {
    public static final Duration DEFAULT_WINDOW = Duration.ofSeconds(60);

    private final int maxCalls;
    private final long windowMs;
    private final Clock clock;
    private final Deque<Long> calls = new ArrayDeque<>();

    public SlidingWindowRateLimiter(int maxCallsPerMinute) {
        this(maxCallsPerMinute, DEFAULT_WINDOW, Clock.systemUTC());
    }

    public SlidingWindowRateLimiter(int maxCalls, Duration window, Clock clock) {
        if (maxCalls <= 0) {
            throw new IllegalArgumentException("maxCalls must be > 0");
        }
        if (window.isZero() || window.isNegative()) {
            throw new IllegalArgumentException("window must be positive");
        }
        this.maxCalls = maxCalls;
        this.windowMs = window.toMillis();
        this.clock = clock;
    }

    /**
     * Records a call if the window has room.
     *
     * @return {@code true} if the call is allowed
     */
    public synchronized boolean tryAcquire() {
        long now = clock.millis();
        while (!calls.isEmpty() && now - calls.peekFirst() >= windowMs) {
            calls.removeFirst();
        }
        if (calls.size() >= maxCalls) {
            return false;
        }
        calls.addLast(now);
        return true;
    }

    public int maxCalls() {
        return maxCalls;
    }
}
