package eventbus.spring.boot;

import eventbus.EventHandler;
import eventbus.EventType;
import eventbus.handler.HandlerOptions;
import eventbus.registry.HandlerRegistry;

import org.springframework.beans.factory.BeanCreationException;
import org.springframework.beans.factory.ListableBeanFactory;
import org.springframework.beans.factory.SmartInitializingSingleton;
import org.springframework.core.annotation.AnnotationUtils;

import java.time.Duration;
import java.util.Map;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Scans for beans annotated with {@link EventHandlerBean} and registers them
 * in the {@link HandlerRegistry}.
 *
 * <p>Runs after all singleton beans are initialized via {@link SmartInitializingSingleton}.
 *
 * @see EventHandlerBean
 */
public class EventHandlerRegistrar implements SmartInitializingSingleton {
    private static final Logger logger = Logger.getLogger(EventHandlerRegistrar.class.getName());

    private final ListableBeanFactory beanFactory;
    private final HandlerRegistry registry;

    public EventHandlerRegistrar(ListableBeanFactory beanFactory, HandlerRegistry registry) {
        this.beanFactory = beanFactory;
        this.registry = registry;
    }

    @Override
    public void afterSingletonsInstantiated() {
        Map<String, Object> beans = beanFactory.getBeansWithAnnotation(EventHandlerBean.class);
        for (Map.Entry<String, Object> entry : beans.entrySet()) {
            String beanName = entry.getKey();
            Object bean = entry.getValue();

            if (!(bean instanceof EventHandler handler)) {
                throw new BeanCreationException(beanName,
                        "Bean annotated with @EventHandlerBean must implement EventHandler, " +
                                "but " + bean.getClass().getName() + " does not");
            }

            // proxies may hide the annotation
            EventHandlerBean annotation = AnnotationUtils.findAnnotation(bean.getClass(), EventHandlerBean.class);
            if (annotation == null) {
                throw new BeanCreationException(beanName,
                        "Could not find @EventHandlerBean annotation on " + bean.getClass().getName());
            }

            String eventType = resolveEventType(beanName, annotation);
            HandlerOptions options = toOptions(beanName, annotation);
            String handlerId = registry.register(eventType, handler, options);
            logger.log(Level.INFO, "Registered handler {0} for {1}", new Object[]{handlerId, eventType});
        }
    }

    private HandlerOptions toOptions(String beanName, EventHandlerBean annotation) {
        try {
            return HandlerOptions.builder()
                    .name(annotation.name().isEmpty() ? beanName : annotation.name())
                    .priority(annotation.priority())
                    .mode(annotation.mode())
                    .retryCount(annotation.retryCount())
                    .timeout(Duration.ofMillis(annotation.timeoutMs()))
                    .ignoreErrors(annotation.ignoreErrors())
                    .rateLimitPerMinute(annotation.rateLimitPerMinute())
                    .build();
        } catch (IllegalArgumentException e) {
            throw new BeanCreationException(beanName, "Invalid @EventHandlerBean options: " + e.getMessage(), e);
        }
    }

    private String resolveEventType(String beanName, EventHandlerBean annotation) {
        Class<? extends EventType> eventTypeClass = annotation.eventTypeClass();
        if (eventTypeClass != EventType.class) {
            return instantiateAndGetName(beanName, eventTypeClass);
        }
        String eventType = annotation.eventType();
        if (eventType.isEmpty()) {
            throw new BeanCreationException(beanName,
                    "@EventHandlerBean must specify either eventType or eventTypeClass");
        }
        return eventType;
    }

    private String instantiateAndGetName(String beanName, Class<? extends EventType> clazz) {
        try {
            if (clazz.isEnum()) {
                EventType[] constants = clazz.getEnumConstants();
                if (constants == null || constants.length == 0) {
                    throw new BeanCreationException(beanName,
                            "@EventHandlerBean eventTypeClass enum " + clazz.getName() + " has no constants");
                }
                return constants[0].name();
            }
            return clazz.getDeclaredConstructor().newInstance().name();
        } catch (BeanCreationException e) {
            throw e;
        } catch (Exception e) {
            throw new BeanCreationException(beanName,
                    "Failed to instantiate @EventHandlerBean eventTypeClass: " + clazz.getName(), e);
        }
    }
}
