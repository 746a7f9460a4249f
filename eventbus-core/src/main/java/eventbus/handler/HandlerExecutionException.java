package eventbus.handler;

/** A handler threw. The original failure is the cause when it is still available. */
public class HandlerExecutionException extends HandlerException {

    public HandlerExecutionException(String handlerId, String eventType, String message, Throwable cause) {
        super(handlerId, eventType, message, cause);
    }

    @Override
    public ErrorKind errorKind() {
        return ErrorKind.HANDLER_ERROR;
    }
}
