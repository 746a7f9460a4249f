package eventbus.spring.boot;

import eventbus.EventEnvelope;
import eventbus.EventHandler;
import eventbus.EventType;
import eventbus.Priority;
import eventbus.handler.HandlerMetrics;
import eventbus.registry.DefaultHandlerRegistry;

import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.BeanCreationException;
import org.springframework.beans.factory.ListableBeanFactory;
import org.springframework.boot.test.context.runner.ApplicationContextRunner;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import static org.junit.jupiter.api.Assertions.*;

class EventHandlerRegistrarTest {

  private final ApplicationContextRunner runner = new ApplicationContextRunner()
      .withUserConfiguration(RegistryConfig.class);

  @Test
  void registersStringBasedHandlerWithOptions() {
    runner.withUserConfiguration(StringHandlerConfig.class).run(ctx -> {
      var registry = ctx.getBean(DefaultHandlerRegistry.class);
      assertTrue(registry.hasHandlers("TestEvent"));
      HandlerMetrics metrics = registry.metrics("stringHandler").orElseThrow();
      assertEquals(Priority.HIGH, metrics.priority());
      assertEquals(120, metrics.rateLimitPerMinute());
    });
  }

  @Test
  void explicitNameOverridesBeanName() {
    runner.withUserConfiguration(NamedHandlerConfig.class).run(ctx -> {
      var registry = ctx.getBean(DefaultHandlerRegistry.class);
      assertTrue(registry.metrics("audit-trail").isPresent());
    });
  }

  @Test
  void registersEnumBasedEventType() {
    runner.withUserConfiguration(EnumHandlerConfig.class).run(ctx -> {
      var registry = ctx.getBean(DefaultHandlerRegistry.class);
      assertTrue(registry.hasHandlers("ORDER_SHIPPED"));
    });
  }

  @Test
  void classBasedTakesPrecedenceOverString() {
    runner.withUserConfiguration(PrecedenceHandlerConfig.class).run(ctx -> {
      var registry = ctx.getBean(DefaultHandlerRegistry.class);
      assertTrue(registry.hasHandlers("ORDER_SHIPPED"));
      assertFalse(registry.hasHandlers("IgnoredEvent"));
    });
  }

  @Test
  void wildcardHandlerSeesEveryType() {
    runner.withUserConfiguration(WildcardHandlerConfig.class).run(ctx -> {
      var registry = ctx.getBean(DefaultHandlerRegistry.class);
      assertTrue(registry.hasHandlers("AnythingAtAll"));
    });
  }

  @Test
  void failsForBeanThatIsNotAHandler() {
    runner.withUserConfiguration(NotAHandlerConfig.class).run(ctx -> {
      assertNotNull(ctx.getStartupFailure());
      assertInstanceOf(BeanCreationException.class, rootBeanCreation(ctx.getStartupFailure()));
    });
  }

  @Test
  void failsWithoutEventType() {
    runner.withUserConfiguration(MissingTypeConfig.class).run(ctx ->
        assertNotNull(ctx.getStartupFailure()));
  }

  private static Throwable rootBeanCreation(Throwable failure) {
    Throwable current = failure;
    while (current != null && !(current instanceof BeanCreationException)) {
      current = current.getCause();
    }
    return current;
  }

  // ── Fixtures ────────────────────────────────────────────────────

  enum OrderEvents implements EventType {
    ORDER_SHIPPED
  }

  @Configuration
  static class RegistryConfig {
    @Bean(destroyMethod = "close")
    DefaultHandlerRegistry handlerRegistry() {
      return new DefaultHandlerRegistry();
    }

    @Bean
    EventHandlerRegistrar registrar(ListableBeanFactory beanFactory, DefaultHandlerRegistry registry) {
      return new EventHandlerRegistrar(beanFactory, registry);
    }
  }

  @EventHandlerBean(eventType = "TestEvent", priority = Priority.HIGH, rateLimitPerMinute = 120)
  static class StringHandler implements EventHandler {
    @Override
    public void handle(EventEnvelope event) {
    }
  }

  @Configuration
  static class StringHandlerConfig {
    @Bean
    StringHandler stringHandler() {
      return new StringHandler();
    }
  }

  @EventHandlerBean(eventType = "TestEvent", name = "audit-trail")
  static class NamedHandler implements EventHandler {
    @Override
    public void handle(EventEnvelope event) {
    }
  }

  @Configuration
  static class NamedHandlerConfig {
    @Bean
    NamedHandler namedHandler() {
      return new NamedHandler();
    }
  }

  @EventHandlerBean(eventTypeClass = OrderEvents.class)
  static class EnumHandler implements EventHandler {
    @Override
    public void handle(EventEnvelope event) {
    }
  }

  @Configuration
  static class EnumHandlerConfig {
    @Bean
    EnumHandler enumHandler() {
      return new EnumHandler();
    }
  }

  @EventHandlerBean(eventType = "IgnoredEvent", eventTypeClass = OrderEvents.class)
  static class PrecedenceHandler implements EventHandler {
    @Override
    public void handle(EventEnvelope event) {
    }
  }

  @Configuration
  static class PrecedenceHandlerConfig {
    @Bean
    PrecedenceHandler precedenceHandler() {
      return new PrecedenceHandler();
    }
  }

  @EventHandlerBean(eventType = "*")
  static class WildcardHandler implements EventHandler {
    @Override
    public void handle(EventEnvelope event) {
    }
  }

  @Configuration
  static class WildcardHandlerConfig {
    @Bean
    WildcardHandler wildcardHandler() {
      return new WildcardHandler();
    }
  }

  @EventHandlerBean(eventType = "TestEvent")
  static class NotAHandler {
  }

  @Configuration
  static class NotAHandlerConfig {
    @Bean
    NotAHandler notAHandler() {
      return new NotAHandler();
    }
  }

  @EventHandlerBean
  static class MissingTypeHandler implements EventHandler {
    @Override
    public void handle(EventEnvelope event) {
    }
  }

  @Configuration
  static class MissingTypeConfig {
    @Bean
    MissingTypeHandler missingTypeHandler() {
      return new MissingTypeHandler();
    }
  }
}
