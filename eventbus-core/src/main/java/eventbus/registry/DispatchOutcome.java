package eventbus.registry;

import eventbus.handler.HandlerException;
import eventbus.handler.HandlerExecutionResult;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * Aggregate result of one dispatch.
 *
 * <p>{@code results} holds sync and async handler results in execution order. Background
 * handlers are counted in {@code backgroundLaunched} but never affect {@link #isSuccess()}.
 * Failures of handlers registered with {@code ignoreErrors} appear in {@code results} but not in
 * {@code failedHandlers}.
 *
 * @param eventId            the event
 * @param eventType          its type
 * @param results            sync and async results keyed by handler id
 * @param failedHandlers     handlers whose failure fails the dispatch
 * @param backgroundLaunched number of background handlers launched
 */
public record DispatchOutcome(
        String eventId,
        String eventType,
        Map<String, HandlerExecutionResult> results,
        List<String> failedHandlers,
        int backgroundLaunched) {

    public DispatchOutcome {
        Objects.requireNonNull(eventId, "eventId");
        results = Collections.unmodifiableMap(new LinkedHashMap<>(results));
        failedHandlers = List.copyOf(failedHandlers);
    }

    static DispatchOutcome empty(String eventId, String eventType) {
        return new DispatchOutcome(eventId, eventType, Map.of(), List.of(), 0);
    }

    public boolean isSuccess() {
        return failedHandlers.isEmpty();
    }

    /**
     * Returns whether no sync, async or background handler was bound to the event.
     *
     * @return {@code true} if the dispatch was a no-op
     */
    public boolean isEmpty() {
        return results.isEmpty() && backgroundLaunched == 0;
    }

    /**
     * Summarises the failures as {@code "handler: message; ..."}.
     *
     * @return the summary, or {@code null} when the dispatch succeeded
     */
    public String errorSummary() {
        if (isSuccess()) {
            return null;
        }
        return failedHandlers.stream()
                .map(id -> id + ": " + results.get(id).errorMessage())
                .collect(Collectors.joining("; "));
    }

    /**
     * Returns the exception matching the first failure, with later failures attached as suppressed.
     *
     * @return the exception, or {@code null} when the dispatch succeeded
     */
    public HandlerException toException() {
        if (isSuccess()) {
            return null;
        }
        HandlerException first = HandlerException.from(results.get(failedHandlers.get(0)), eventType);
        for (String id : failedHandlers.subList(1, failedHandlers.size())) {
            first.addSuppressed(HandlerException.from(results.get(id), eventType));
        }
        return first;
    }

    /**
     * Throws {@link #toException()} if any counted handler failed.
     *
     * @throws HandlerException describing the first failure
     */
    public void throwIfFailed() {
        HandlerException failure = toException();
        if (failure != null) {
            throw failure;
        }
    }
}
