package eventmanager.dispatch;

import eventmanager.EventArgs;
import eventmanager.EventListener;

import java.util.Objects;

/**
 * A registered listener together with the way it is invoked.
 *
 * <ul>
 *   <li>{@link Callable}: an {@link EventListener}, called directly.</li>
 *   <li>{@link MethodDispatch}: any other object; the public method named after
 *       the event is looked up in a {@link HandlerTable} built when the listener
 *       was registered.</li>
 * </ul>
 */
public sealed interface ListenerTarget permits ListenerTarget.Callable, ListenerTarget.MethodDispatch {

  /**
   * Returns the object the caller registered.
   */
  Object listener();

  /**
   * Invokes the listener for one event.
   *
   * @throws eventmanager.MissingHandlerException if a method-dispatch listener cannot handle the event
   */
  void invoke(String eventName, EventArgs args);

  /**
   * Picks the variant from the listener's runtime type.
   */
  static ListenerTarget of(Object listener) {
    Objects.requireNonNull(listener, "listener");
    if (listener instanceof EventListener callable) {
      return new Callable(callable);
    }
    return methodDispatch(listener);
  }

  /**
   * Forces method dispatch, even for objects that also implement {@link EventListener}.
   */
  static ListenerTarget methodDispatch(Object listener) {
    Objects.requireNonNull(listener, "listener");
    return new MethodDispatch(listener, HandlerTable.forClass(listener.getClass()));
  }

  record Callable(EventListener listener) implements ListenerTarget {
    @Override
    public void invoke(String eventName, EventArgs args) {
      listener.onEvent(eventName, args);
    }
  }

  record MethodDispatch(Object listener, HandlerTable handlers) implements ListenerTarget {
    @Override
    public void invoke(String eventName, EventArgs args) {
      handlers.invoke(listener, eventName, args);
    }
  }
}
