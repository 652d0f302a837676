package eventmanager.registry;

import java.util.Objects;

/**
 * Identity of a registered listener instance.
 *
 * <p>Two keys are equal only if they wrap the very same object. Listeners that
 * are {@code equals} to each other but distinct instances get distinct keys, so
 * both stay registered.
 */
public final class ListenerKey {
  private final Object listener;

  private ListenerKey(Object listener) {
    this.listener = listener;
  }

  public static ListenerKey of(Object listener) {
    return new ListenerKey(Objects.requireNonNull(listener, "listener"));
  }

  public Object listener() {
    return listener;
  }

  @Override
  public boolean equals(Object o) {
    return o instanceof ListenerKey other && other.listener == listener;
  }

  @Override
  public int hashCode() {
    return System.identityHashCode(listener);
  }

  @Override
  public String toString() {
    return listener.getClass().getName() + "@" + Integer.toHexString(hashCode());
  }
}
