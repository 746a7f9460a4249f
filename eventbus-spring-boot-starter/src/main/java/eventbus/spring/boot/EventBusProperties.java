package eventbus.spring.boot;

import eventbus.Priority;
import eventbus.jdbc.TableNames;
import eventbus.model.DeliveryConfig;
import eventbus.model.DeliveryMode;
import eventbus.store.InMemoryEventStore;
import eventbus.stream.EventStreamPublisher;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

/**
 * Configuration properties for the event bus.
 *
 * @see EventBusAutoConfiguration
 */
@ConfigurationProperties(prefix = "eventbus")
public class EventBusProperties {

    /**
     * Event store. When unset, JDBC is used if a DataSource bean exists, otherwise memory.
     */
    private StoreType store;

    private final Memory memory = new Memory();
    private final Jdbc jdbc = new Jdbc();
    private final Delivery delivery = new Delivery();
    private final Publisher publisher = new Publisher();
    private final Batch batch = new Batch();
    private final Sweep sweep = new Sweep();
    private final Purge purge = new Purge();
    private final Handlers handlers = new Handlers();
    private final Stream stream = new Stream();
    private final Metrics metrics = new Metrics();

    public StoreType getStore() {
        return store;
    }

    public void setStore(StoreType store) {
        this.store = store;
    }

    public Memory getMemory() {
        return memory;
    }

    public Jdbc getJdbc() {
        return jdbc;
    }

    public Delivery getDelivery() {
        return delivery;
    }

    public Publisher getPublisher() {
        return publisher;
    }

    public Batch getBatch() {
        return batch;
    }

    public Sweep getSweep() {
        return sweep;
    }

    public Purge getPurge() {
        return purge;
    }

    public Handlers getHandlers() {
        return handlers;
    }

    public Stream getStream() {
        return stream;
    }

    public Metrics getMetrics() {
        return metrics;
    }

    public enum StoreType {
        MEMORY,
        JDBC
    }

    public static class Memory {
        private int capacity = InMemoryEventStore.DEFAULT_CAPACITY;

        public int getCapacity() {
            return capacity;
        }

        public void setCapacity(int capacity) {
            this.capacity = capacity;
        }
    }

    public static class Jdbc {
        private String tableName = TableNames.DEFAULT_TABLE;

        /**
         * Create the event table from the bundled DDL on startup.
         */
        private boolean initializeSchema;

        public String getTableName() {
            return tableName;
        }

        public void setTableName(String tableName) {
            this.tableName = tableName;
        }

        public boolean isInitializeSchema() {
            return initializeSchema;
        }

        public void setInitializeSchema(boolean initializeSchema) {
            this.initializeSchema = initializeSchema;
        }
    }

    /**
     * Default delivery configuration for events published without one.
     */
    public static class Delivery {
        private DeliveryMode mode = DeliveryMode.ASYNC;
        private Priority priority = Priority.NORMAL;
        private int maxRetries = 3;
        private Duration retryDelay = Duration.ofSeconds(1);
        private double backoffMultiplier = 2.0;
        private Duration maxRetryDelay = Duration.ofSeconds(300);
        private Duration timeout = Duration.ofSeconds(60);
        private boolean deadLetterEnabled = true;

        public DeliveryConfig toConfig() {
            return DeliveryConfig.builder()
                    .mode(mode)
                    .priority(priority)
                    .maxRetries(maxRetries)
                    .retryDelay(retryDelay)
                    .backoffMultiplier(backoffMultiplier)
                    .maxRetryDelay(maxRetryDelay)
                    .timeout(timeout)
                    .deadLetterEnabled(deadLetterEnabled)
                    .build();
        }

        public DeliveryMode getMode() {
            return mode;
        }

        public void setMode(DeliveryMode mode) {
            this.mode = mode;
        }

        public Priority getPriority() {
            return priority;
        }

        public void setPriority(Priority priority) {
            this.priority = priority;
        }

        public int getMaxRetries() {
            return maxRetries;
        }

        public void setMaxRetries(int maxRetries) {
            this.maxRetries = maxRetries;
        }

        public Duration getRetryDelay() {
            return retryDelay;
        }

        public void setRetryDelay(Duration retryDelay) {
            this.retryDelay = retryDelay;
        }

        public double getBackoffMultiplier() {
            return backoffMultiplier;
        }

        public void setBackoffMultiplier(double backoffMultiplier) {
            this.backoffMultiplier = backoffMultiplier;
        }

        public Duration getMaxRetryDelay() {
            return maxRetryDelay;
        }

        public void setMaxRetryDelay(Duration maxRetryDelay) {
            this.maxRetryDelay = maxRetryDelay;
        }

        public Duration getTimeout() {
            return timeout;
        }

        public void setTimeout(Duration timeout) {
            this.timeout = timeout;
        }

        public boolean isDeadLetterEnabled() {
            return deadLetterEnabled;
        }

        public void setDeadLetterEnabled(boolean deadLetterEnabled) {
            this.deadLetterEnabled = deadLetterEnabled;
        }
    }

    public static class Publisher {
        private int workerCount = 4;
        private Duration lowPriorityDelay = Duration.ofMillis(100);
        private Duration shutdownTimeout = Duration.ofSeconds(30);

        public int getWorkerCount() {
            return workerCount;
        }

        public void setWorkerCount(int workerCount) {
            this.workerCount = workerCount;
        }

        public Duration getLowPriorityDelay() {
            return lowPriorityDelay;
        }

        public void setLowPriorityDelay(Duration lowPriorityDelay) {
            this.lowPriorityDelay = lowPriorityDelay;
        }

        public Duration getShutdownTimeout() {
            return shutdownTimeout;
        }

        public void setShutdownTimeout(Duration shutdownTimeout) {
            this.shutdownTimeout = shutdownTimeout;
        }
    }

    public static class Batch {
        private Duration window = Duration.ofSeconds(5);
        private int maxSize = 10;

        public Duration getWindow() {
            return window;
        }

        public void setWindow(Duration window) {
            this.window = window;
        }

        public int getMaxSize() {
            return maxSize;
        }

        public void setMaxSize(int maxSize) {
            this.maxSize = maxSize;
        }
    }

    public static class Sweep {
        private boolean enabled = true;
        private Duration interval = Duration.ofSeconds(5);
        private int batchSize = 50;
        private Duration processingTimeout = Duration.ofMinutes(5);

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }

        public Duration getInterval() {
            return interval;
        }

        public void setInterval(Duration interval) {
            this.interval = interval;
        }

        public int getBatchSize() {
            return batchSize;
        }

        public void setBatchSize(int batchSize) {
            this.batchSize = batchSize;
        }

        public Duration getProcessingTimeout() {
            return processingTimeout;
        }

        public void setProcessingTimeout(Duration processingTimeout) {
            this.processingTimeout = processingTimeout;
        }
    }

    public static class Purge {
        private boolean enabled = true;
        private Duration interval = Duration.ofHours(1);
        private Duration retention = Duration.ofDays(7);

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }

        public Duration getInterval() {
            return interval;
        }

        public void setInterval(Duration interval) {
            this.interval = interval;
        }

        public Duration getRetention() {
            return retention;
        }

        public void setRetention(Duration retention) {
            this.retention = retention;
        }
    }

    public static class Handlers {
        private int poolSize = 16;
        private int backgroundPoolSize = 4;

        public int getPoolSize() {
            return poolSize;
        }

        public void setPoolSize(int poolSize) {
            this.poolSize = poolSize;
        }

        public int getBackgroundPoolSize() {
            return backgroundPoolSize;
        }

        public void setBackgroundPoolSize(int backgroundPoolSize) {
            this.backgroundPoolSize = backgroundPoolSize;
        }
    }

    public static class Stream {
        private boolean enabled;
        private int capacity = EventStreamPublisher.DEFAULT_CAPACITY;
        private int subscriberThreads = EventStreamPublisher.DEFAULT_SUBSCRIBER_THREADS;

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }

        public int getCapacity() {
            return capacity;
        }

        public void setCapacity(int capacity) {
            this.capacity = capacity;
        }

        public int getSubscriberThreads() {
            return subscriberThreads;
        }

        public void setSubscriberThreads(int subscriberThreads) {
            this.subscriberThreads = subscriberThreads;
        }
    }

    public static class Metrics {
        private boolean enabled = true;
        private String namePrefix = "eventbus";

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }

        public String getNamePrefix() {
            return namePrefix;
        }

        public void setNamePrefix(String namePrefix) {
            this.namePrefix = namePrefix;
        }
    }
}
