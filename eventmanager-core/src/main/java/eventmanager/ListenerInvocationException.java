package eventmanager;

/**
 * Wraps a checked exception thrown by a method-dispatch handler.
 *
 * <p>Unchecked exceptions and errors thrown by listeners propagate unchanged;
 * only checked exceptions, which cannot cross {@link EventManager#dispatch} as-is,
 * are wrapped. The original exception is available from {@link #getCause()}.
 */
public class ListenerInvocationException extends RuntimeException {

  public ListenerInvocationException(String message, Throwable cause) {
    super(message, cause);
  }
}
