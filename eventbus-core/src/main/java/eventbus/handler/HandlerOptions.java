package eventbus.handler;

import eventbus.Priority;
import eventbus.retry.ExponentialBackoffRetryPolicy;
import eventbus.retry.RetryPolicy;

import java.time.Duration;
import java.util.Objects;

/**
 * Registration metadata for a handler: identity, ordering, execution mode and failure policy.
 *
 * <p>Create instances via {@link #builder()} or use {@link #defaults()}.
 */
public final class HandlerOptions {
    private static final HandlerOptions DEFAULTS = builder().build();

    private final String name;
    private final Priority priority;
    private final HandlerMode mode;
    private final int retryCount;
    private final Duration retryBaseDelay;
    private final Duration maxRetryDelay;
    private final Duration timeout;
    private final boolean ignoreErrors;
    private final int rateLimitPerMinute;

    private HandlerOptions(Builder builder) {
        this.name = builder.name;
        if (name != null && name.isEmpty()) {
            throw new IllegalArgumentException("name cannot be empty");
        }
        this.priority = Objects.requireNonNull(builder.priority, "priority");
        this.mode = Objects.requireNonNull(builder.mode, "mode");
        this.retryBaseDelay = Objects.requireNonNull(builder.retryBaseDelay, "retryBaseDelay");
        this.maxRetryDelay = Objects.requireNonNull(builder.maxRetryDelay, "maxRetryDelay");
        this.timeout = Objects.requireNonNull(builder.timeout, "timeout");
        if (builder.retryCount < 0) {
            throw new IllegalArgumentException("retryCount must be >= 0");
        }
        if (retryBaseDelay.isNegative()) {
            throw new IllegalArgumentException("retryBaseDelay must be >= 0");
        }
        if (maxRetryDelay.compareTo(retryBaseDelay) < 0) {
            throw new IllegalArgumentException("maxRetryDelay must be >= retryBaseDelay");
        }
        if (timeout.isZero() || timeout.isNegative()) {
            throw new IllegalArgumentException("timeout must be positive");
        }
        if (builder.rateLimitPerMinute < 0) {
            throw new IllegalArgumentException("rateLimitPerMinute must be >= 0");
        }
        this.retryCount = builder.retryCount;
        this.ignoreErrors = builder.ignoreErrors;
        this.rateLimitPerMinute = builder.rateLimitPerMinute;
    }

    public static Builder builder() {
        return new Builder();
    }

    public static HandlerOptions defaults() {
        return DEFAULTS;
    }

    /**
     * Returns the configured handler name, or {@code null} to let the registry generate one.
     *
     * @return the handler name
     */
    public String name() {
        return name;
    }

    public Priority priority() {
        return priority;
    }

    public HandlerMode mode() {
        return mode;
    }

    public int retryCount() {
        return retryCount;
    }

    public Duration retryBaseDelay() {
        return retryBaseDelay;
    }

    public Duration maxRetryDelay() {
        return maxRetryDelay;
    }

    public Duration timeout() {
        return timeout;
    }

    public boolean ignoreErrors() {
        return ignoreErrors;
    }

    public int rateLimitPerMinute() {
        return rateLimitPerMinute;
    }

    public boolean isRateLimited() {
        return rateLimitPerMinute > 0;
    }

    /**
     * Returns the in-call retry policy: doubling delays from {@code retryBaseDelay}, capped at
     * {@code maxRetryDelay}, at most {@code retryCount} retries.
     *
     * @return the retry policy
     */
    public RetryPolicy retryPolicy() {
        return new ExponentialBackoffRetryPolicy(
                retryBaseDelay.toMillis(), 2.0, maxRetryDelay.toMillis(), retryCount);
    }

    /**
     * Returns a builder initialised with these options.
     *
     * @return a new builder
     */
    public Builder toBuilder() {
        return new Builder()
                .name(name)
                .priority(priority)
                .mode(mode)
                .retryCount(retryCount)
                .retryBaseDelay(retryBaseDelay)
                .maxRetryDelay(maxRetryDelay)
                .timeout(timeout)
                .ignoreErrors(ignoreErrors)
                .rateLimitPerMinute(rateLimitPerMinute);
    }

    @Override
    public String toString() {
        return "HandlerOptions{name=" + name
                + ", priority=" + priority
                + ", mode=" + mode
                + ", retryCount=" + retryCount
                + ", timeout=" + timeout
                + ", ignoreErrors=" + ignoreErrors
                + ", rateLimitPerMinute=" + rateLimitPerMinute + '}';
    }

    /**
     * Builder for {@link HandlerOptions}.
     */
    public static final class Builder {
        private String name;
        private Priority priority = Priority.NORMAL;
        private HandlerMode mode = HandlerMode.ASYNC;
        private int retryCount = 3;
        private Duration retryBaseDelay = Duration.ofSeconds(1);
        private Duration maxRetryDelay = Duration.ofSeconds(30);
        private Duration timeout = Duration.ofSeconds(30);
        private boolean ignoreErrors;
        private int rateLimitPerMinute;

        private Builder() {
        }

        /**
         * Sets the handler name. Names must be unique within a registry.
         *
         * <p>Optional. Defaults to a name generated from the event type.
         *
         * @param name the handler name
         * @return this builder
         */
        public Builder name(String name) {
            this.name = name;
            return this;
        }

        /**
         * Sets the priority used to order handlers within the same execution mode.
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
         * Sets the execution mode.
         *
         * <p>Optional. Defaults to {@link HandlerMode#ASYNC}.
         *
         * @param mode the execution mode
         * @return this builder
         */
        public Builder mode(HandlerMode mode) {
            this.mode = mode;
            return this;
        }

        /**
         * Sets how many times a failing invocation is retried within the timeout window.
         *
         * <p>Optional. Defaults to {@code 3}. Must be &ge; 0.
         *
         * @param retryCount retries after the first attempt
         * @return this builder
         */
        public Builder retryCount(int retryCount) {
            this.retryCount = retryCount;
            return this;
        }

        /**
         * Sets the delay before the first in-call retry; later retries double it.
         *
         * <p>Optional. Defaults to 1 second.
         *
         * @param retryBaseDelay the base delay
         * @return this builder
         */
        public Builder retryBaseDelay(Duration retryBaseDelay) {
            this.retryBaseDelay = retryBaseDelay;
            return this;
        }

        /**
         * Sets the cap on in-call retry delays.
         *
         * <p>Optional. Defaults to 30 seconds.
         *
         * @param maxRetryDelay the delay cap
         * @return this builder
         */
        public Builder maxRetryDelay(Duration maxRetryDelay) {
            this.maxRetryDelay = maxRetryDelay;
            return this;
        }

        /**
         * Sets the hard time limit for one invocation, retries included.
         *
         * <p>Optional. Defaults to 30 seconds. Must be positive.
         *
         * @param timeout the timeout
         * @return this builder
         */
        public Builder timeout(Duration timeout) {
            this.timeout = timeout;
            return this;
        }

        /**
         * When set, failures of this handler are recorded but do not fail the dispatch.
         *
         * <p>Optional. Defaults to {@code false}.
         *
         * @param ignoreErrors whether failures are ignored
         * @return this builder
         */
        public Builder ignoreErrors(boolean ignoreErrors) {
            this.ignoreErrors = ignoreErrors;
            return this;
        }

        /**
         * Sets the maximum number of invocations per sliding 60-second window.
         *
         * <p>Optional. Defaults to {@code 0} (unlimited).
         *
         * @param rateLimitPerMinute calls per minute, or 0 for no limit
         * @return this builder
         */
        public Builder rateLimitPerMinute(int rateLimitPerMinute) {
            this.rateLimitPerMinute = rateLimitPerMinute;
            return this;
        }

        public HandlerOptions build() {
            return new HandlerOptions(this);
        }
    }
}
