package eventbus.spring.boot;

import eventbus.dead.DeadLetterManager;
import eventbus.jdbc.AbstractJdbcEventStore;
import eventbus.jdbc.JdbcEventStores;
import eventbus.publisher.EventInterceptor;
import eventbus.publisher.EventPublisher;
import eventbus.registry.DefaultHandlerRegistry;
import eventbus.registry.HandlerRegistry;
import eventbus.spi.EventStore;
import eventbus.spi.MetricsExporter;
import eventbus.store.InMemoryEventStore;
import eventbus.stream.EventStreamPublisher;

import org.springframework.beans.factory.ListableBeanFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnClass;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.autoconfigure.jdbc.DataSourceAutoConfiguration;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;

import javax.sql.DataSource;
import java.util.List;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Auto-configuration for the event bus.
 *
 * <p>Wires an {@link EventStore} (JDBC when a {@link DataSource} is available, in-memory
 * otherwise), a {@link DefaultHandlerRegistry}, a started {@link EventPublisher}, a
 * {@link DeadLetterManager} and, when {@code eventbus.stream.enabled=true}, an
 * {@link EventStreamPublisher}. Beans annotated with {@link EventHandlerBean} are registered
 * after singleton instantiation.
 *
 * @see EventBusProperties
 * @see EventBusMicrometerAutoConfiguration
 */
@AutoConfiguration(after = DataSourceAutoConfiguration.class)
@ConditionalOnClass(EventPublisher.class)
@EnableConfigurationProperties(EventBusProperties.class)
public class EventBusAutoConfiguration {
  private static final Logger logger = Logger.getLogger(EventBusAutoConfiguration.class.getName());

  @Bean
  @ConditionalOnMissingBean(EventStore.class)
  public EventStore eventStore(EventBusProperties props, ObjectProvider<DataSource> dataSourceProvider) {
    DataSource dataSource = dataSourceProvider.getIfAvailable();
    EventBusProperties.StoreType type = props.getStore();
    if (type == null) {
      type = dataSource != null ? EventBusProperties.StoreType.JDBC : EventBusProperties.StoreType.MEMORY;
    }
    return switch (type) {
      case MEMORY -> new InMemoryEventStore(props.getMemory().getCapacity());
      case JDBC -> {
        if (dataSource == null) {
          throw new IllegalStateException("eventbus.store=jdbc requires a DataSource bean");
        }
        AbstractJdbcEventStore store = JdbcEventStores.detect(dataSource, props.getJdbc().getTableName());
        if (props.getJdbc().isInitializeSchema()) {
          store.createSchema();
        }
        logger.log(Level.INFO, "Using {0} event store on table {1}",
            new Object[]{store.name(), store.tableName()});
        yield store;
      }
    };
  }

  @Bean(destroyMethod = "close")
  @ConditionalOnMissingBean(HandlerRegistry.class)
  public DefaultHandlerRegistry handlerRegistry(EventBusProperties props,
      ObjectProvider<MetricsExporter> metricsProvider) {
    return DefaultHandlerRegistry.builder()
        .handlerPoolSize(props.getHandlers().getPoolSize())
        .backgroundPoolSize(props.getHandlers().getBackgroundPoolSize())
        .metrics(metricsProvider.getIfAvailable())
        .shutdownTimeout(props.getPublisher().getShutdownTimeout())
        .build();
  }

  @Bean
  @ConditionalOnMissingBean
  public EventHandlerRegistrar eventHandlerRegistrar(ListableBeanFactory beanFactory,
      HandlerRegistry handlerRegistry) {
    return new EventHandlerRegistrar(beanFactory, handlerRegistry);
  }

  @Bean(initMethod = "start", destroyMethod = "close")
  @ConditionalOnMissingBean
  public EventPublisher eventPublisher(EventBusProperties props,
      EventStore eventStore,
      HandlerRegistry handlerRegistry,
      ObjectProvider<MetricsExporter> metricsProvider,
      ObjectProvider<EventInterceptor> interceptorProvider) {

    List<EventInterceptor> interceptors = interceptorProvider.orderedStream().toList();
    var builder = EventPublisher.builder()
        .store(eventStore)
        .registry(handlerRegistry)
        .defaultConfig(props.getDelivery().toConfig())
        .interceptors(interceptors)
        .workerCount(props.getPublisher().getWorkerCount())
        .lowPriorityDelay(props.getPublisher().getLowPriorityDelay())
        .shutdownTimeout(props.getPublisher().getShutdownTimeout())
        .batchWindow(props.getBatch().getWindow())
        .batchMaxSize(props.getBatch().getMaxSize())
        .sweepEnabled(props.getSweep().isEnabled())
        .sweepInterval(props.getSweep().getInterval())
        .sweepBatchSize(props.getSweep().getBatchSize())
        .processingTimeout(props.getSweep().getProcessingTimeout())
        .purgeEnabled(props.getPurge().isEnabled())
        .purgeInterval(props.getPurge().getInterval())
        .purgeRetention(props.getPurge().getRetention());
    MetricsExporter metrics = metricsProvider.getIfAvailable();
    if (metrics != null) {
      builder.metrics(metrics);
    }
    return builder.build();
  }

  @Bean
  @ConditionalOnMissingBean
  public DeadLetterManager deadLetterManager(EventStore eventStore) {
    return new DeadLetterManager(eventStore);
  }

  @Bean(destroyMethod = "close")
  @ConditionalOnMissingBean
  @ConditionalOnProperty(prefix = "eventbus.stream", name = "enabled", havingValue = "true")
  public EventStreamPublisher eventStreamPublisher(EventPublisher eventPublisher, EventBusProperties props) {
    return new EventStreamPublisher(eventPublisher,
        props.getStream().getCapacity(), props.getStream().getSubscriberThreads());
  }
}
