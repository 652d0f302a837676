package eventmanager.spring.boot;

import java.lang.annotation.Documented;
import java.lang.annotation.ElementType;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

/**
 * Priority used when an {@link eventmanager.EventSubscriber} bean is registered
 * by {@link EventSubscriberRegistrar}. Subscribers without it register with priority 0.
 *
 * <pre>{@code
 * @Component
 * @SubscriberPriority(100)
 * public class AuditSubscriber implements EventSubscriber {
 *   public List<String> getSubscribedEvents() { return List.of("prePersist"); }
 *   public void prePersist(EntityArgs args) { ... }
 * }
 * }</pre>
 *
 * @see EventSubscriberRegistrar
 */
@Target(ElementType.TYPE)
@Retention(RetentionPolicy.RUNTIME)
@Documented
public @interface SubscriberPriority {

    /**
     * The higher this value, the earlier the subscriber is invoked.
     */
    int value();
}
