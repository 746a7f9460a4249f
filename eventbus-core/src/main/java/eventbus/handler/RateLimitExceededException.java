package eventbus.handler;

/** A handler was not invoked because its calls-per-minute ceiling was reached. */
public class RateLimitExceededException extends HandlerException {

    public RateLimitExceededException(String handlerId, String eventType, String message) {
        super(handlerId, eventType, message, null);
    }

    @Override
    public ErrorKind errorKind() {
        return ErrorKind.RATE_LIMITED;
    }
}
