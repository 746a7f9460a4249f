package eventbus.retry;

/**
 * Outcome of a {@link RetryPolicy} decision.
 */
public sealed interface RetryDecision {

    /**
     * Retry after the given delay.
     *
     * @param retryNumber the retry being scheduled (1-based)
     * @param delayMs     delay before the retry in milliseconds
     */
    record Retry(int retryNumber, long delayMs) implements RetryDecision {
        public Retry {
            if (delayMs < 0) {
                throw new IllegalArgumentException("delayMs must be >= 0");
            }
        }
    }

    /**
     * Retries are exhausted.
     *
     * @param retryNumber the retry that was refused
     */
    record GiveUp(int retryNumber) implements RetryDecision {
    }
}
