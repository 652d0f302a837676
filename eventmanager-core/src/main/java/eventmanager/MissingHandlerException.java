package eventmanager;

/**
 * Thrown during dispatch when a method-dispatch listener has no public method
 * named after the dispatched event that accepts the dispatched payload.
 *
 * <p>The exception is not caught by the {@link EventManager}: it reaches the
 * caller of {@code dispatch}, and listeners ordered after the faulty one are not
 * invoked.
 */
public final class MissingHandlerException extends RuntimeException {

  private final String eventName;
  private final Class<?> listenerType;

  public MissingHandlerException(String eventName, Class<?> listenerType, String message) {
    super(message);
    this.eventName = eventName;
    this.listenerType = listenerType;
  }

  public String eventName() {
    return eventName;
  }

  public Class<?> listenerType() {
    return listenerType;
  }
}
