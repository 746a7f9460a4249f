package eventbus.retry;

/**
 * Strategy deciding whether, and after how long, a failed delivery is retried.
 *
 * <p>Implementations are pure functions of the retry number, so the same inputs always yield
 * the same decision.
 *
 * @see ExponentialBackoffRetryPolicy
 */
public interface RetryPolicy {

    /**
     * Returns the number of retries allowed after the first attempt.
     *
     * @return the retry ceiling (0 disables retries)
     */
    int maxRetries();

    /**
     * Computes the delay in milliseconds before the given retry.
     *
     * @param retryNumber the retry about to happen (1-based)
     * @return delay in milliseconds (non-negative)
     */
    long computeDelayMs(int retryNumber);

    /**
     * Decides what happens after a failure that brings the retry count to {@code retryNumber}.
     *
     * @param retryNumber the retry that would happen next (1-based)
     * @return {@link RetryDecision.Retry} while {@code retryNumber <= maxRetries()},
     *         otherwise {@link RetryDecision.GiveUp}
     */
    default RetryDecision decide(int retryNumber) {
        if (retryNumber >= 1 && retryNumber <= maxRetries()) {
            return new RetryDecision.Retry(retryNumber, computeDelayMs(retryNumber));
        }
        return new RetryDecision.GiveUp(retryNumber);
    }
}
