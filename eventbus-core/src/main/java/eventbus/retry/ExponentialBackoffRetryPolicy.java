package eventbus.retry;

/**
 * Deterministic exponential backoff.
 *
 * <p>Delay formula: {@code baseDelay * multiplier^(retryNumber-1)}, capped at {@code maxDelay}.
 */
public final class ExponentialBackoffRetryPolicy implements RetryPolicy {
    private final long baseDelayMs;
    private final double multiplier;
    private final long maxDelayMs;
    private final int maxRetries;

    /**
     * @param baseDelayMs delay before the first retry (milliseconds)
     * @param multiplier  growth factor per retry (must be &ge; 1)
     * @param maxDelayMs  maximum delay cap (milliseconds)
     * @param maxRetries  number of retries allowed after the first attempt
     */
    public ExponentialBackoffRetryPolicy(long baseDelayMs, double multiplier, long maxDelayMs, int maxRetries) {
        if (baseDelayMs < 0) {
            throw new IllegalArgumentException("baseDelayMs must be >= 0, got: " + baseDelayMs);
        }
        if (multiplier < 1.0 || Double.isNaN(multiplier)) {
            throw new IllegalArgumentException("multiplier must be >= 1, got: " + multiplier);
        }
        if (maxDelayMs < baseDelayMs) {
            throw new IllegalArgumentException("maxDelayMs must be >= baseDelayMs, got: " + maxDelayMs);
        }
        if (maxRetries < 0) {
            throw new IllegalArgumentException("maxRetries must be >= 0, got: " + maxRetries);
        }
        this.baseDelayMs = baseDelayMs;
        this.multiplier = multiplier;
        this.maxDelayMs = maxDelayMs;
        this.maxRetries = maxRetries;
    }

    @Override
    public int maxRetries() {
        return maxRetries;
    }

    @Override
    public long computeDelayMs(int retryNumber) {
        if (retryNumber <= 0) {
            return 0L;
        }
        double delay = baseDelayMs * Math.pow(multiplier, retryNumber - 1);
        if (Double.isInfinite(delay) || delay >= maxDelayMs) {
            return maxDelayMs;
        }
        return (long) delay;
    }

    @Override
    public String toString() {
        return "ExponentialBackoffRetryPolicy{baseDelayMs=" + baseDelayMs
                + ", multiplier=" + multiplier
                + ", maxDelayMs=" + maxDelayMs
                + ", maxRetries=" + maxRetries + '}';
    }
}
