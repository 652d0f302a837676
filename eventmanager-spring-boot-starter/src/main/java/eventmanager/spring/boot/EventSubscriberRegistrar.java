package eventmanager.spring.boot;

import eventmanager.EventManager;
import eventmanager.EventSubscriber;
import org.springframework.beans.factory.ListableBeanFactory;
import org.springframework.beans.factory.SmartInitializingSingleton;
import org.springframework.core.annotation.AnnotationUtils;

import java.util.List;
import java.util.Map;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Registers every {@link EventSubscriber} bean with the {@link EventManager}.
 *
 * <p>Runs after all singleton beans are initialized via {@link SmartInitializingSingleton}.
 * The priority comes from {@link SubscriberPriority} on the bean class, if present.
 *
 * <p>Handler methods are looked up on the bean's runtime class. A subscriber exposed
 * through a JDK interface proxy only carries the {@link EventSubscriber} methods, so
 * dispatching to it fails with {@link eventmanager.MissingHandlerException}; proxy such
 * beans by class (CGLIB) instead.
 *
 * @see SubscriberPriority
 */
public class EventSubscriberRegistrar implements SmartInitializingSingleton {
    private static final Logger logger = Logger.getLogger(EventSubscriberRegistrar.class.getName());

    private final ListableBeanFactory beanFactory;
    private final EventManager eventManager;

    public EventSubscriberRegistrar(ListableBeanFactory beanFactory, EventManager eventManager) {
        this.beanFactory = beanFactory;
        this.eventManager = eventManager;
    }

    @Override
    public void afterSingletonsInstantiated() {
        Map<String, EventSubscriber> subscribers = beanFactory.getBeansOfType(EventSubscriber.class);
        for (Map.Entry<String, EventSubscriber> entry : subscribers.entrySet()) {
            EventSubscriber subscriber = entry.getValue();
            List<String> eventNames = subscriber.getSubscribedEvents();
            int priority = resolvePriority(subscriber);
            eventManager.registerSubscriber(subscriber, priority);
            logger.log(Level.FINE, "Registered subscriber bean {0} for {1} with priority {2}",
                    new Object[] {entry.getKey(), eventNames, priority});
        }
    }

    private int resolvePriority(EventSubscriber subscriber) {
        // Proxies may hide the annotation; findAnnotation walks the hierarchy
        SubscriberPriority annotation = AnnotationUtils.findAnnotation(subscriber.getClass(), SubscriberPriority.class);
        return annotation != null ? annotation.value() : 0;
    }
}
