package eventmanager;

import java.util.List;

/**
 * Listener that declares the events it is interested in.
 *
 * <p>{@link EventManager#registerSubscriber(EventSubscriber)} registers the
 * subscriber for every returned event name. The subscriber must expose a public
 * method named after each of these events, taking the payload and optionally the
 * event name first:
 *
 * <pre>{@code
 * public class CacheInvalidator implements EventSubscriber {
 *   @Override
 *   public List<String> getSubscribedEvents() {
 *     return List.of("postPersist", "postRemove");
 *   }
 *
 *   public void postPersist(EntityArgs args) { ... }
 *
 *   public void postRemove(String eventName, EntityArgs args) { ... }
 * }
 * }</pre>
 */
public interface EventSubscriber {

  /**
   * Returns the names of the events this subscriber listens to, in registration order.
   *
   * @return event names, never null
   */
  List<String> getSubscribedEvents();
}
