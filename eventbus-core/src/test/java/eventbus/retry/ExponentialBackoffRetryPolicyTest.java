package eventbus.retry;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertThrows;

class ExponentialBackoffRetryPolicyTest {

    @Test
    void delayDoublesUntilCap() {
        var policy = new ExponentialBackoffRetryPolicy(1000, 2.0, 5000, 10);

        assertEquals(1000, policy.computeDelayMs(1));
        assertEquals(2000, policy.computeDelayMs(2));
        assertEquals(4000, policy.computeDelayMs(3));
        assertEquals(5000, policy.computeDelayMs(4));
        assertEquals(5000, policy.computeDelayMs(60));
    }

    @Test
    void hugeExponentIsCapped() {
        var policy = new ExponentialBackoffRetryPolicy(1000, 10.0, 300_000, 10);

        assertEquals(300_000, policy.computeDelayMs(1000));
    }

    @Test
    void decideRetriesUpToMax() {
        var policy = new ExponentialBackoffRetryPolicy(100, 2.0, 1000, 2);

        RetryDecision first = policy.decide(1);
        RetryDecision second = policy.decide(2);
        RetryDecision third = policy.decide(3);

        assertEquals(new RetryDecision.Retry(1, 100), first);
        assertEquals(new RetryDecision.Retry(2, 200), second);
        assertInstanceOf(RetryDecision.GiveUp.class, third);
    }

    @Test
    void zeroRetriesAlwaysGivesUp() {
        var policy = new ExponentialBackoffRetryPolicy(100, 2.0, 1000, 0);

        assertInstanceOf(RetryDecision.GiveUp.class, policy.decide(1));
    }

    @Test
    void rejectsInvalidArguments() {
        assertThrows(IllegalArgumentException.class, () -> new ExponentialBackoffRetryPolicy(-1, 2.0, 10, 1));
        assertThrows(IllegalArgumentException.class, () -> new ExponentialBackoffRetryPolicy(10, 0.5, 10, 1));
        assertThrows(IllegalArgumentException.class, () -> new ExponentialBackoffRetryPolicy(10, 2.0, 5, 1));
        assertThrows(IllegalArgumentException.class, () -> new ExponentialBackoffRetryPolicy(10, 2.0, 50, -1));
    }
}
