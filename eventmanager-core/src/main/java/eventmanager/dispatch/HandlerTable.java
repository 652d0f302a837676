package eventmanager.dispatch;

import eventmanager.EventArgs;
import eventmanager.ListenerInvocationException;
import eventmanager.MissingHandlerException;

import java.lang.reflect.InvocationTargetException;
import java.lang.reflect.Method;
import java.lang.reflect.Modifier;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Event-name to handler-method table of a method-dispatch listener class.
 *
 * <p>A handler is a public instance method whose name is the event name and whose
 * parameters are either {@code (P)} or {@code (String, P)}, where {@code P} is
 * {@link EventArgs} or a subclass. When several overloads share a name, the one
 * with the most specific payload type that accepts the dispatched payload wins.
 *
 * <p>Tables are built once per class and cached for the lifetime of the class.
 */
public final class HandlerTable {
  private static final Logger logger = Logger.getLogger(HandlerTable.class.getName());

  private static final ClassValue<HandlerTable> TABLES = new ClassValue<>() {
    @Override
    protected HandlerTable computeValue(Class<?> type) {
      return scan(type);
    }
  };

  private static final Comparator<Handler> MOST_SPECIFIC_FIRST =
      Comparator.comparingInt((Handler h) -> depth(h.argsType())).reversed();

  private final Class<?> type;
  private final Map<String, List<Handler>> handlers;

  private HandlerTable(Class<?> type, Map<String, List<Handler>> handlers) {
    this.type = type;
    this.handlers = handlers;
  }

  /**
   * Returns the (cached) handler table of the given listener class.
   */
  public static HandlerTable forClass(Class<?> type) {
    return TABLES.get(type);
  }

  public Class<?> type() {
    return type;
  }

  /**
   * Returns the names of all events this class has a handler for.
   */
  public Set<String> eventNames() {
    return handlers.keySet();
  }

  public boolean handles(String eventName) {
    return handlers.containsKey(eventName);
  }

  /**
   * Calls the handler for {@code eventName} on {@code target}.
   *
   * @throws MissingHandlerException if no handler accepts {@code args}
   * @throws ListenerInvocationException if the handler throws a checked exception
   */
  public void invoke(Object target, String eventName, EventArgs args) {
    Handler handler = resolve(eventName, args);
    try {
      if (handler.withEventName()) {
        handler.method().invoke(target, eventName, args);
      } else {
        handler.method().invoke(target, args);
      }
    } catch (InvocationTargetException e) {
      Throwable cause = e.getCause();
      if (cause instanceof RuntimeException runtime) {
        throw runtime;
      }
      if (cause instanceof Error error) {
        throw error;
      }
      throw new ListenerInvocationException(
          "Handler " + describe(handler.method()) + " failed for event '" + eventName + "'", cause);
    } catch (IllegalAccessException e) {
      throw new ListenerInvocationException(
          "Handler " + describe(handler.method()) + " is not accessible", e);
    }
  }

  private Handler resolve(String eventName, EventArgs args) {
    List<Handler> candidates = handlers.get(eventName);
    if (candidates == null) {
      throw new MissingHandlerException(eventName, type,
          "Listener " + type.getName() + " has no public method '" + eventName + "' for event '"
              + eventName + "'");
    }
    for (Handler candidate : candidates) {
      if (candidate.argsType().isInstance(args)) {
        return candidate;
      }
    }
    throw new MissingHandlerException(eventName, type,
        "Listener " + type.getName() + " has no method '" + eventName + "' accepting "
            + args.getClass().getName());
  }

  private static HandlerTable scan(Class<?> type) {
    Map<String, List<Handler>> found = new LinkedHashMap<>();
    for (Method method : type.getMethods()) {
      if (Modifier.isStatic(method.getModifiers()) || method.isBridge() || method.isSynthetic()) {
        continue;
      }
      Handler handler = asHandler(method);
      if (handler == null) {
        continue;
      }
      if (!method.trySetAccessible()) {
        logger.log(Level.FINE, "Handler {0} is not accessible; invocation will fail", describe(method));
      }
      found.computeIfAbsent(method.getName(), ignored -> new ArrayList<>()).add(handler);
    }
    Map<String, List<Handler>> table = new LinkedHashMap<>();
    found.forEach((name, list) -> {
      list.sort(MOST_SPECIFIC_FIRST);
      table.put(name, List.copyOf(list));
    });
    logger.log(Level.FINE, "Scanned {0}: handlers for {1}", new Object[] {type.getName(), table.keySet()});
    return new HandlerTable(type, Collections.unmodifiableMap(table));
  }

  private static Handler asHandler(Method method) {
    Class<?>[] params = method.getParameterTypes();
    if (params.length == 1 && EventArgs.class.isAssignableFrom(params[0])) {
      return new Handler(method, false, params[0]);
    }
    if (params.length == 2 && params[0] == String.class && EventArgs.class.isAssignableFrom(params[1])) {
      return new Handler(method, true, params[1]);
    }
    return null;
  }

  private static int depth(Class<?> type) {
    int depth = 0;
    for (Class<?> c = type; c != null; c = c.getSuperclass()) {
      depth++;
    }
    return depth;
  }

  private static String describe(Method method) {
    return method.getDeclaringClass().getName() + "#" + method.getName();
  }

  private record Handler(Method method, boolean withEventName, Class<?> argsType) {
  }
}
