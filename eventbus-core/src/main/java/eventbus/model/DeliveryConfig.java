package eventbus.model;

import eventbus.Priority;
import eventbus.retry.ExponentialBackoffRetryPolicy;
import eventbus.retry.RetryPolicy;

import java.time.Duration;
import java.util.Objects;

/**
 * Per-event delivery settings: mode, priority, retry backoff and dead-letter routing.
 *
 * <p>Create instances via {@link #builder()} or use {@link #defaults()}.
 */
public final class DeliveryConfig {
    private static final DeliveryConfig DEFAULTS = builder().build();

    private final DeliveryMode mode;
    private final Priority priority;
    private final int maxRetries;
    private final Duration retryDelay;
    private final double backoffMultiplier;
    private final Duration maxRetryDelay;
    private final Duration timeout;
    private final boolean deadLetterEnabled;

    private DeliveryConfig(Builder builder) {
        this.mode = Objects.requireNonNull(builder.mode, "mode");
        this.priority = Objects.requireNonNull(builder.priority, "priority");
        this.retryDelay = Objects.requireNonNull(builder.retryDelay, "retryDelay");
        this.maxRetryDelay = Objects.requireNonNull(builder.maxRetryDelay, "maxRetryDelay");
        this.timeout = Objects.requireNonNull(builder.timeout, "timeout");
        if (builder.maxRetries < 0) {
            throw new IllegalArgumentException("maxRetries must be >= 0");
        }
        if (retryDelay.isNegative()) {
            throw new IllegalArgumentException("retryDelay must be >= 0");
        }
        if (builder.backoffMultiplier < 1.0) {
            throw new IllegalArgumentException("backoffMultiplier must be >= 1.0");
        }
        if (maxRetryDelay.compareTo(retryDelay) < 0) {
            throw new IllegalArgumentException("maxRetryDelay must be >= retryDelay");
        }
        if (timeout.isZero() || timeout.isNegative()) {
            throw new IllegalArgumentException("timeout must be positive");
        }
        this.maxRetries = builder.maxRetries;
        this.backoffMultiplier = builder.backoffMultiplier;
        this.deadLetterEnabled = builder.deadLetterEnabled;
    }

    public static Builder builder() {
        return new Builder();
    }

    public static DeliveryConfig defaults() {
        return DEFAULTS;
    }

    public static DeliveryConfig of(DeliveryMode mode) {
        return builder().mode(mode).build();
    }

    public DeliveryMode mode() {
        return mode;
    }

    public Priority priority() {
        return priority;
    }

    public int maxRetries() {
        return maxRetries;
    }

    public Duration retryDelay() {
        return retryDelay;
    }

    public double backoffMultiplier() {
        return backoffMultiplier;
    }

    public Duration maxRetryDelay() {
        return maxRetryDelay;
    }

    /**
     * Returns the processing timeout the producer expects. The value is informational: it is stored
     * with the record for consumers and operators, but dispatch does not enforce it. Each handler's
     * run time is bounded by its own {@link eventbus.handler.HandlerOptions} timeout, and a record
     * stuck in {@code PROCESSING} is reclaimed by the sweep's processing timeout.
     *
     * @return the suggested timeout
     */
    public Duration timeout() {
        return timeout;
    }

    public boolean deadLetterEnabled() {
        return deadLetterEnabled;
    }

    /**
     * Returns the event-level retry policy:
     * {@code min(retryDelay * backoffMultiplier^(retryCount-1), maxRetryDelay)}.
     *
     * @return the retry policy
     */
    public RetryPolicy retryPolicy() {
        return new ExponentialBackoffRetryPolicy(retryDelay.toMillis(), backoffMultiplier,
                maxRetryDelay.toMillis(), maxRetries);
    }

    public Builder toBuilder() {
        return new Builder()
                .mode(mode)
                .priority(priority)
                .maxRetries(maxRetries)
                .retryDelay(retryDelay)
                .backoffMultiplier(backoffMultiplier)
                .maxRetryDelay(maxRetryDelay)
                .timeout(timeout)
                .deadLetterEnabled(deadLetterEnabled);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof DeliveryConfig that)) return false;
        return maxRetries == that.maxRetries
                && Double.compare(backoffMultiplier, that.backoffMultiplier) == 0
                && deadLetterEnabled == that.deadLetterEnabled
                && mode == that.mode
                && priority == that.priority
                && retryDelay.equals(that.retryDelay)
                && maxRetryDelay.equals(that.maxRetryDelay)
                && timeout.equals(that.timeout);
    }

    @Override
    public int hashCode() {
        return Objects.hash(mode, priority, maxRetries, retryDelay, backoffMultiplier, maxRetryDelay,
                timeout, deadLetterEnabled);
    }

    @Override
    public String toString() {
        return "DeliveryConfig{mode=" + mode
                + ", priority=" + priority
                + ", maxRetries=" + maxRetries
                + ", retryDelay=" + retryDelay
                + ", backoffMultiplier=" + backoffMultiplier
                + ", maxRetryDelay=" + maxRetryDelay
                + ", timeout=" + timeout
                + ", deadLetterEnabled=" + deadLetterEnabled + '}';
    }

    /**
     * Builder for {@link DeliveryConfig}.
     */
    public static final class Builder {
        private DeliveryMode mode = DeliveryMode.ASYNC;
        private Priority priority = Priority.NORMAL;
        private int maxRetries = 3;
        private Duration retryDelay = Duration.ofSeconds(1);
        private double backoffMultiplier = 2.0;
        private Duration maxRetryDelay = Duration.ofSeconds(300);
        private Duration timeout = Duration.ofSeconds(60);
        private boolean deadLetterEnabled = true;

        private Builder() {
        }

        /**
         * Sets the delivery mode.
         *
         * <p>Optional. Defaults to {@link DeliveryMode#ASYNC}.
         *
         * @param mode the delivery mode
         * @return this builder
         */
        public Builder mode(DeliveryMode mode) {
            this.mode = mode;
            return this;
        }

        /**
         * Sets the delivery priority. Low-priority async events are slightly delayed and batches
         * are keyed by priority.
         *
         * <p>Optional. Defaults to {@link Priority#NORMAL}.
         *
         * @param priority the priority
         * @return this builder
         */
        public Builder priority(Priority priority) {
            this.priority = priority;
            return this;
        }

        /**
         * Sets how many times a failed dispatch is retried before the event is dead-lettered.
         *
         * <p>Optional. Defaults to {@code 3}. Must be &ge; 0.
         *
         * @param maxRetries retries after the first attempt
         * @return this builder
         */
        public Builder maxRetries(int maxRetries) {
            this.maxRetries = maxRetries;
            return this;
        }

        /**
         * Sets the delay before the first retry.
         *
         * <p>Optional. Defaults to 1 second.
         *
         * @param retryDelay the base retry delay
         * @return this builder
         */
        public Builder retryDelay(Duration retryDelay) {
            this.retryDelay = retryDelay;
            return this;
        }

        /**
         * Sets the growth factor applied to the retry delay after each retry.
         *
         * <p>Optional. Defaults to {@code 2.0}. Must be &ge; 1.
         *
         * @param backoffMultiplier the multiplier
         * @return this builder
         */
        public Builder backoffMultiplier(double backoffMultiplier) {
            this.backoffMultiplier = backoffMultiplier;
            return this;
        }

        /**
         * Sets the cap on retry delays.
         *
         * <p>Optional. Defaults to 300 seconds.
         *
         * @param maxRetryDelay the delay cap
         * @return this builder
         */
        public Builder maxRetryDelay(Duration maxRetryDelay) {
            this.maxRetryDelay = maxRetryDelay;
            return this;
        }

        /**
         * Sets the processing timeout recorded with the event. Not enforced during dispatch; see
         * {@link DeliveryConfig#timeout()}.
         *
         * <p>Optional. Defaults to 60 seconds.
         *
         * @param timeout the timeout
         * @return this builder
         */
        public Builder timeout(Duration timeout) {
            this.timeout = timeout;
            return this;
        }

        /**
         * Sets whether exhausted events move to {@link EventStatus#DEAD_LETTER}. When disabled
         * they stay {@link EventStatus#FAILED}.
         *
         * <p>Optional. Defaults to {@code true}.
         *
         * @param deadLetterEnabled whether dead-letter routing is enabled
         * @return this builder
         */
        public Builder deadLetterEnabled(boolean deadLetterEnabled) {
            this.deadLetterEnabled = deadLetterEnabled;
            return this;
        }

        public DeliveryConfig build() {
            return new DeliveryConfig(this);
        }
    }
}
