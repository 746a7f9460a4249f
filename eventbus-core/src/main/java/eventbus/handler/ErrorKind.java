package eventbus.handler;

/** Classification of a failed handler execution. */
public enum ErrorKind {
    TIMEOUT,
    RATE_LIMITED,
    HANDLER_ERROR
}
