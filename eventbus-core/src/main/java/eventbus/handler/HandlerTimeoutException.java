package eventbus.handler;

/** A handler invocation, retries included, exceeded its timeout. */
public class HandlerTimeoutException extends HandlerException {

    public HandlerTimeoutException(String handlerId, String eventType, String message) {
        super(handlerId, eventType, message, null);
    }

    @Override
    public ErrorKind errorKind() {
        return ErrorKind.TIMEOUT;
    }
}
