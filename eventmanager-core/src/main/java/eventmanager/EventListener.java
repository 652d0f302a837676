package eventmanager;

/**
 * Callable listener, typically a lambda or method reference.
 *
 * <p>The instance passed to {@link EventManager#register(String, EventListener)} is
 * the listener's identity. Keep the reference if you need to unregister it later;
 * an equivalent lambda written a second time is a different listener.
 *
 * <pre>{@code
 * EventListener audit = (eventName, args) -> auditLog.record(eventName);
 * eventManager.register(List.of("preFlush", "postFlush"), audit, 100);
 * ...
 * eventManager.unregister(List.of("preFlush", "postFlush"), audit);
 * }</pre>
 *
 * <p>Objects that do not implement this interface are registered as method-dispatch
 * listeners instead: the manager calls their public method named after the event.
 *
 * @see EventManager
 */
@FunctionalInterface
public interface EventListener {

  /**
   * Handles a dispatched event.
   *
   * <p>Unchecked exceptions propagate to the caller of
   * {@link EventManager#dispatch(String, EventArgs)} and abort the remaining listeners.
   *
   * @param eventName the dispatched event, useful when one listener handles several
   * @param args the payload shared by all listeners of this dispatch
   */
  void onEvent(String eventName, EventArgs args);
}
