package eventbus.handler;

/**
 * Base type for handler failures surfaced to callers that ask for exceptions instead of results.
 *
 * @see HandlerInvoker#executeOrThrow
 */
public abstract class HandlerException extends RuntimeException {
    private final String handlerId;
    private final String eventType;

    protected HandlerException(String handlerId, String eventType, String message, Throwable cause) {
        super(message, cause);
        this.handlerId = handlerId;
        this.eventType = eventType;
    }

    public String handlerId() {
        return handlerId;
    }

    public String eventType() {
        return eventType;
    }

    public abstract ErrorKind errorKind();

    /**
     * Creates the exception matching a failed result.
     *
     * @param result    a failed result
     * @param eventType the event type that was being handled
     * @return the matching exception
     * @throws IllegalArgumentException if the result is successful
     */
    public static HandlerException from(HandlerExecutionResult result, String eventType) {
        if (result.success()) {
            throw new IllegalArgumentException("result is successful");
        }
        return switch (result.errorKind()) {
            case TIMEOUT -> new HandlerTimeoutException(result.handlerId(), eventType, result.errorMessage());
            case RATE_LIMITED -> new RateLimitExceededException(result.handlerId(), eventType, result.errorMessage());
            case HANDLER_ERROR -> new HandlerExecutionException(result.handlerId(), eventType, result.errorMessage(), null);
        };
    }
}
