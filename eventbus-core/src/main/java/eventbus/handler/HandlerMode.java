package eventbus.handler;

/**
 * How a registry runs a handler relative to the dispatching caller.
 */
public enum HandlerMode {
    /** Runs sequentially on the dispatch path; the next handler waits for it. */
    SYNC,
    /** Runs concurrently with the other async handlers; dispatch waits for all of them. */
    ASYNC,
    /** Launched and not awaited; outcomes never affect the dispatch result. */
    BACKGROUND
}
