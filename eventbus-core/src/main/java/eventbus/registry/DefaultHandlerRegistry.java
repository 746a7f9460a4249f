package eventbus.registry;

import eventbus.EventEnvelope;
import eventbus.EventHandler;
import eventbus.HealthStatus;
import eventbus.handler.ErrorKind;
import eventbus.handler.HandlerExecutionResult;
import eventbus.handler.HandlerInvoker;
import eventbus.handler.HandlerMetrics;
import eventbus.handler.HandlerMode;
import eventbus.handler.HandlerOptions;
import eventbus.spi.MetricsExporter;
import eventbus.util.DaemonThreadFactory;
import eventbus.util.TaskTracker;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Thread-safe {@link HandlerRegistry} with priority ordering, execution modes and per-handler
 * statistics.
 *
 * <p>Dispatch partitions the handlers bound to an event's type, plus wildcard ({@code "*"})
 * handlers, into {@link HandlerMode} buckets. Within a bucket handlers are ordered by priority
 * (critical first), type-specific before wildcard, then registration order:
 * <ol>
 *   <li>{@code SYNC} handlers run one after another on the calling thread's behalf</li>
 *   <li>{@code ASYNC} handlers are all launched, then awaited</li>
 *   <li>{@code BACKGROUND} handlers are launched and tracked, but not awaited</li>
 * </ol>
 * Every handler runs through a {@link HandlerInvoker}, so a failing handler never stops the
 * others. Background handlers get their own thread pools, so a backlog of slow background work
 * never delays the sync and async buckets of later events.
 *
 * <h2>Usage</h2>
 * <pre>{@code
 * DefaultHandlerRegistry registry = new DefaultHandlerRegistry();
 * registry.register("UserRegistered", event -> mailer.sendWelcome(event),
 *     HandlerOptions.builder().name("welcome-mail").mode(HandlerMode.ASYNC).build());
 * registry.registerAll(event -> audit.log(event),
 *     HandlerOptions.builder().name("audit").mode(HandlerMode.BACKGROUND).ignoreErrors(true).build());
 * }</pre>
 *
 * <p>Create instances via {@link #builder()} or the no-argument constructor. Call
 * {@link #close()} to join background handlers and release the thread pools.
 */
public final class DefaultHandlerRegistry implements HandlerRegistry, AutoCloseable {
    private static final Logger logger = Logger.getLogger(DefaultHandlerRegistry.class.getName());

    public static final double HEALTHY_SUCCESS_RATE = 0.9;

    private static final Comparator<Registration> EXECUTION_ORDER =
            Comparator.<Registration>comparingInt(r -> r.invoker().options().priority().level())
                    .thenComparing(Registration::wildcard)
                    .thenComparingLong(Registration::sequence);

    private final Map<String, CopyOnWriteArrayList<Registration>> byType = new ConcurrentHashMap<>();
    private final Map<String, Registration> byId = new ConcurrentHashMap<>();
    private final ExecutorService handlerExecutor;
    private final ExecutorService dispatchExecutor;
    private final ExecutorService backgroundExecutor;
    private final ExecutorService backgroundHandlerExecutor;
    private final TaskTracker backgroundTasks = new TaskTracker();
    private final MetricsExporter metrics;
    private final Duration shutdownTimeout;
    private long sequence;
    private volatile boolean closed;

    public DefaultHandlerRegistry() {
        this(builder());
    }

    private DefaultHandlerRegistry(Builder builder) {
        if (builder.handlerPoolSize <= 0) {
            throw new IllegalArgumentException("handlerPoolSize must be > 0");
        }
        if (builder.dispatchPoolSize <= 0) {
            throw new IllegalArgumentException("dispatchPoolSize must be > 0");
        }
        if (builder.backgroundPoolSize <= 0) {
            throw new IllegalArgumentException("backgroundPoolSize must be > 0");
        }
        Objects.requireNonNull(builder.shutdownTimeout, "shutdownTimeout");
        if (builder.shutdownTimeout.isNegative()) {
            throw new IllegalArgumentException("shutdownTimeout must be >= 0");
        }
        this.metrics = builder.metrics != null ? builder.metrics : MetricsExporter.NOOP;
        this.shutdownTimeout = builder.shutdownTimeout;
        this.handlerExecutor = Executors.newFixedThreadPool(builder.handlerPoolSize,
                new DaemonThreadFactory("eventbus-handler-"));
        this.dispatchExecutor = Executors.newFixedThreadPool(builder.dispatchPoolSize,
                new DaemonThreadFactory("eventbus-dispatch-"));
        this.backgroundExecutor = Executors.newFixedThreadPool(builder.backgroundPoolSize,
                new DaemonThreadFactory("eventbus-background-"));
        this.backgroundHandlerExecutor = Executors.newFixedThreadPool(builder.backgroundPoolSize,
                new DaemonThreadFactory("eventbus-background-handler-"));
    }

    public static Builder builder() {
        return new Builder();
    }

    @Override
    public synchronized String register(String eventType, EventHandler handler, HandlerOptions options) {
        Objects.requireNonNull(eventType, "eventType");
        Objects.requireNonNull(handler, "handler");
        Objects.requireNonNull(options, "options");
        if (eventType.isEmpty()) {
            throw new IllegalArgumentException("eventType cannot be empty");
        }
        if (closed) {
            throw new IllegalStateException("DefaultHandlerRegistry has been closed");
        }
        long seq = ++sequence;
        String handlerId = options.name() != null ? options.name() : defaultName(eventType, seq);
        if (byId.containsKey(handlerId)) {
            throw new IllegalArgumentException("Handler already registered: " + handlerId);
        }
        ExecutorService executor = options.mode() == HandlerMode.BACKGROUND
                ? backgroundHandlerExecutor
                : handlerExecutor;
        HandlerInvoker invoker = new HandlerInvoker(handlerId, eventType, handler, options, executor);
        Registration registration = new Registration(invoker, seq, ALL_EVENTS.equals(eventType));
        byId.put(handlerId, registration);
        byType.computeIfAbsent(eventType, ignored -> new CopyOnWriteArrayList<>()).add(registration);
        logger.log(Level.FINE, "Registered handler {0} for {1} ({2}, {3})",
                new Object[]{handlerId, eventType, options.mode(), options.priority()});
        return handlerId;
    }

    @Override
    public synchronized boolean unregister(String eventType, String handlerId) {
        Registration registration = byId.get(handlerId);
        if (registration == null || !registration.invoker().eventType().equals(eventType)) {
            return false;
        }
        byId.remove(handlerId);
        CopyOnWriteArrayList<Registration> list = byType.get(eventType);
        if (list != null) {
            list.remove(registration);
        }
        return true;
    }

    @Override
    public boolean hasHandlers(String eventType) {
        return !isEmpty(byType.get(eventType)) || !isEmpty(byType.get(ALL_EVENTS));
    }

    @Override
    public DispatchOutcome dispatch(EventEnvelope event) {
        Objects.requireNonNull(event, "event");
        List<Registration> handlers = handlersFor(event.eventType());
        if (handlers.isEmpty()) {
            logger.log(Level.FINE, "No handlers for event type {0}", event.eventType());
            return DispatchOutcome.empty(event.eventId(), event.eventType());
        }

        Map<String, HandlerExecutionResult> results = new LinkedHashMap<>();
        List<String> failed = new ArrayList<>();

        for (Registration r : handlers) {
            if (r.mode() == HandlerMode.SYNC) {
                collect(r, invoke(r, event), results, failed);
            }
        }

        List<Registration> asyncHandlers = new ArrayList<>();
        List<CompletableFuture<HandlerExecutionResult>> asyncResults = new ArrayList<>();
        for (Registration r : handlers) {
            if (r.mode() == HandlerMode.ASYNC) {
                asyncHandlers.add(r);
                asyncResults.add(launch(r, event, dispatchExecutor));
            }
        }
        for (int i = 0; i < asyncHandlers.size(); i++) {
            collect(asyncHandlers.get(i), asyncResults.get(i).join(), results, failed);
        }

        int background = 0;
        for (Registration r : handlers) {
            if (r.mode() == HandlerMode.BACKGROUND) {
                backgroundTasks.track(launch(r, event, backgroundExecutor));
                background++;
            }
        }

        return new DispatchOutcome(event.eventId(), event.eventType(), results, failed, background);
    }

    private CompletableFuture<HandlerExecutionResult> launch(Registration r, EventEnvelope event,
                                                             ExecutorService executor) {
        try {
            return CompletableFuture.supplyAsync(() -> invoke(r, event), executor);
        } catch (RejectedExecutionException e) {
            logger.log(Level.WARNING, "Executor rejected handler {0} for event {1}",
                    new Object[]{r.handlerId(), event.eventId()});
            return CompletableFuture.completedFuture(HandlerExecutionResult.failure(r.handlerId(), Duration.ZERO,
                    ErrorKind.HANDLER_ERROR, "Dispatch executor rejected the task", 0, Instant.now()));
        }
    }

    private HandlerExecutionResult invoke(Registration r, EventEnvelope event) {
        HandlerExecutionResult result = r.invoker().execute(event);
        metrics.recordHandlerDurationMs(r.handlerId(), result.executionTime().toMillis());
        return result;
    }

    private static void collect(Registration r, HandlerExecutionResult result,
                                Map<String, HandlerExecutionResult> results, List<String> failed) {
        results.put(r.handlerId(), result);
        if (!result.success() && !r.invoker().options().ignoreErrors()) {
            failed.add(r.handlerId());
        }
    }

    private List<Registration> handlersFor(String eventType) {
        List<Registration> result = new ArrayList<>();
        CopyOnWriteArrayList<Registration> specific = byType.get(eventType);
        if (specific != null) {
            result.addAll(specific);
        }
        if (!ALL_EVENTS.equals(eventType)) {
            CopyOnWriteArrayList<Registration> wildcard = byType.get(ALL_EVENTS);
            if (wildcard != null) {
                result.addAll(wildcard);
            }
        }
        result.sort(EXECUTION_ORDER);
        return result;
    }

    /**
     * Returns a statistics snapshot of every registered handler, in registration order.
     *
     * @return handler metrics
     */
    public List<HandlerMetrics> metrics() {
        return byId.values().stream()
                .sorted(Comparator.comparingLong(Registration::sequence))
                .map(r -> r.invoker().metrics())
                .toList();
    }

    public Optional<HandlerMetrics> metrics(String handlerId) {
        return Optional.ofNullable(byId.get(handlerId)).map(r -> r.invoker().metrics());
    }

    /**
     * Returns up to {@code limit} of a handler's most recent results, oldest first.
     *
     * @param handlerId the handler
     * @param limit     maximum results
     * @return the results, empty for unknown handlers
     */
    public List<HandlerExecutionResult> history(String handlerId, int limit) {
        Registration r = byId.get(handlerId);
        return r == null ? List.of() : r.invoker().stats().history(limit);
    }

    public HandlerHealth health() {
        List<String> unhealthy = new ArrayList<>();
        for (HandlerMetrics m : metrics()) {
            if (m.totalExecutions() > 0 && m.successRate() < HEALTHY_SUCCESS_RATE) {
                unhealthy.add(m.handlerId());
            }
        }
        HealthStatus status = unhealthy.isEmpty() ? HealthStatus.HEALTHY : HealthStatus.DEGRADED;
        return new HandlerHealth(status, byId.size(), unhealthy);
    }

    public int handlerCount() {
        return byId.size();
    }

    public int backgroundTaskCount() {
        return backgroundTasks.size();
    }

    /**
     * Waits for background handlers up to the shutdown timeout, then stops the thread pools.
     */
    @Override
    public void close() {
        synchronized (this) {
            if (closed) {
                return;
            }
            closed = true;
        }
        if (!backgroundTasks.awaitAll(shutdownTimeout)) {
            logger.log(Level.WARNING, "{0} background handlers still running after {1} ms; cancelling",
                    new Object[]{backgroundTasks.size(), shutdownTimeout.toMillis()});
            backgroundTasks.cancelAll();
        }
        List<ExecutorService> pools = List.of(dispatchExecutor, backgroundExecutor, handlerExecutor,
                backgroundHandlerExecutor);
        pools.forEach(ExecutorService::shutdownNow);
        try {
            for (ExecutorService pool : pools) {
                pool.awaitTermination(5, TimeUnit.SECONDS);
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    private static boolean isEmpty(List<?> list) {
        return list == null || list.isEmpty();
    }

    private static String defaultName(String eventType, long seq) {
        return (ALL_EVENTS.equals(eventType) ? "all-events" : eventType) + "-handler-" + seq;
    }

    private record Registration(HandlerInvoker invoker, long sequence, boolean wildcard) {
        String handlerId() {
            return invoker.handlerId();
        }

        HandlerMode mode() {
            return invoker.options().mode();
        }
    }

    /**
     * Builder for {@link DefaultHandlerRegistry}.
     */
    public static final class Builder {
        private int handlerPoolSize = 16;
        private int dispatchPoolSize = 16;
        private int backgroundPoolSize = 4;
        private MetricsExporter metrics;
        private Duration shutdownTimeout = Duration.ofSeconds(30);

        private Builder() {
        }

        /**
         * Sets the number of threads that run handler code.
         *
         * <p>Optional. Defaults to {@code 16}. Must be &gt; 0.
         *
         * @param handlerPoolSize handler threads
         * @return this builder
         */
        public Builder handlerPoolSize(int handlerPoolSize) {
            this.handlerPoolSize = handlerPoolSize;
            return this;
        }

        /**
         * Sets the number of threads that launch and supervise async handlers.
         *
         * <p>Optional. Defaults to {@code 16}. Must be &gt; 0.
         *
         * @param dispatchPoolSize dispatch threads
         * @return this builder
         */
        public Builder dispatchPoolSize(int dispatchPoolSize) {
            this.dispatchPoolSize = dispatchPoolSize;
            return this;
        }

        /**
         * Sets the number of threads reserved for background handlers. Background handlers never
         * use the handler or dispatch pools.
         *
         * <p>Optional. Defaults to {@code 4}. Must be &gt; 0.
         *
         * @param backgroundPoolSize background threads
         * @return this builder
         */
        public Builder backgroundPoolSize(int backgroundPoolSize) {
            this.backgroundPoolSize = backgroundPoolSize;
            return this;
        }

        /**
         * Sets the metrics exporter that receives handler durations.
         *
         * <p>Optional. Defaults to {@link MetricsExporter#NOOP}.
         *
         * @param metrics the metrics exporter
         * @return this builder
         */
        public Builder metrics(MetricsExporter metrics) {
            this.metrics = metrics;
            return this;
        }

        /**
         * Sets how long {@link DefaultHandlerRegistry#close()} waits for background handlers.
         *
         * <p>Optional. Defaults to 30 seconds.
         *
         * @param shutdownTimeout the grace period
         * @return this builder
         */
        public Builder shutdownTimeout(Duration shutdownTimeout) {
            this.shutdownTimeout = shutdownTimeout;
            return this;
        }

        public DefaultHandlerRegistry build() {
            return new DefaultHandlerRegistry(this);
        }
    }
}
