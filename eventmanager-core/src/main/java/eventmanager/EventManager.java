package eventmanager;

import eventmanager.dispatch.DispatchInterceptor;
import eventmanager.dispatch.ListenerTarget;
import eventmanager.registry.EventRegistry;
import eventmanager.registry.ListenerKey;
import eventmanager.registry.Registration;
import eventmanager.spi.MetricsExporter;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.locks.ReentrantLock;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Central point of the event listener system. Listeners are registered on the
 * manager and events are dispatched through it.
 *
 * <p>Each event name owns an {@link EventRegistry}. Listeners are identified by
 * instance: registering the same object twice for an event keeps one entry and
 * updates its priority. Higher priorities are invoked first; equal priorities keep
 * registration order. Sorting is lazy and cached until the next registration change.
 *
 * <h2>Usage</h2>
 * <pre>{@code
 * EventManager events = new EventManager()
 *     .register("preFlush", (eventName, args) -> validator.check(), 10)
 *     .register(List.of("postPersist", "postUpdate"), searchIndexer)
 *     .registerSubscriber(new CacheInvalidator());
 *
 * EventArgs args = events.dispatch("preFlush");
 * if (args.isPropagationStopped()) { ... }
 * }</pre>
 *
 * <h2>Listener variants</h2>
 * <ul>
 *   <li>{@link EventListener} instances are called directly.</li>
 *   <li>Any other object is a method-dispatch listener: its public method named
 *       after the event is invoked with the payload (or the event name and the
 *       payload). A missing method surfaces as {@link MissingHandlerException}
 *       when the event is dispatched.</li>
 * </ul>
 *
 * <h2>Thread Safety</h2>
 * <p>Instances created with {@code new EventManager()} are meant for a single
 * thread. {@link Builder#threadSafe(boolean) threadSafe(true)} guards every
 * operation with one reentrant lock; listeners then run while the lock is held.
 *
 * <p>Registering or unregistering listeners of an event from inside one of its
 * listeners is unsupported: the running dispatch keeps iterating the order it
 * started with and the change only shows from the next dispatch on.
 *
 * @see EventArgs
 * @see EventSubscriber
 */
public final class EventManager {
  private static final Logger logger = Logger.getLogger(EventManager.class.getName());

  private final Map<String, EventRegistry> registries = new LinkedHashMap<>();
  private final ReentrantLock lock;
  private final MetricsExporter metrics;
  private final List<DispatchInterceptor> interceptors;

  /**
   * Creates a single-threaded manager without metrics or interceptors.
   */
  public EventManager() {
    this(new Builder());
  }

  private EventManager(Builder builder) {
    this.lock = builder.threadSafe ? new ReentrantLock() : null;
    this.metrics = builder.metrics != null ? builder.metrics : MetricsExporter.NOOP;
    this.interceptors = Collections.unmodifiableList(new ArrayList<>(builder.interceptors));
  }

  public static Builder builder() {
    return new Builder();
  }

  /**
   * Registers a callable listener for one event with priority 0.
   *
   * @param eventName the event to listen on
   * @param listener the listener
   * @return this manager for chaining
   */
  public EventManager register(String eventName, EventListener listener) {
    return register(List.of(eventName), (Object) listener, 0);
  }

  /**
   * Registers a callable listener for one event.
   *
   * @param eventName the event to listen on
   * @param listener the listener
   * @param priority the higher this value, the earlier the listener is invoked
   * @return this manager for chaining
   */
  public EventManager register(String eventName, EventListener listener, int priority) {
    return register(List.of(eventName), (Object) listener, priority);
  }

  /**
   * Registers a callable listener for several events with priority 0.
   */
  public EventManager register(Collection<String> eventNames, EventListener listener) {
    return register(eventNames, (Object) listener, 0);
  }

  /**
   * Registers a callable listener for several events.
   */
  public EventManager register(Collection<String> eventNames, EventListener listener, int priority) {
    return register(eventNames, (Object) listener, priority);
  }

  /**
   * Registers a listener object for one event with priority 0.
   *
   * @see #register(Collection, Object, int)
   */
  public EventManager register(String eventName, Object listener) {
    return register(List.of(eventName), listener, 0);
  }

  /**
   * Registers a listener object for one event.
   *
   * @see #register(Collection, Object, int)
   */
  public EventManager register(String eventName, Object listener, int priority) {
    return register(List.of(eventName), listener, priority);
  }

  /**
   * Registers a listener object for several events with priority 0.
   *
   * @see #register(Collection, Object, int)
   */
  public EventManager register(Collection<String> eventNames, Object listener) {
    return register(eventNames, listener, 0);
  }

  /**
   * Registers a listener object for the given events.
   *
   * <p>An {@link EventListener} is invoked directly; any other object must expose a
   * public method per event name. Registering an instance that is already
   * registered for an event replaces its priority.
   *
   * @param eventNames the events to listen on
   * @param listener the listener
   * @param priority the higher this value, the earlier the listener is invoked
   * @return this manager for chaining
   */
  public EventManager register(Collection<String> eventNames, Object listener, int priority) {
    add(eventNames, ListenerTarget.of(listener), priority);
    return this;
  }

  /**
   * Removes a listener from one event. Does nothing if it is not registered.
   */
  public EventManager unregister(String eventName, Object listener) {
    return unregister(List.of(eventName), listener);
  }

  /**
   * Removes a listener from the given events. Events the listener is not
   * registered for, and unknown events, are ignored.
   *
   * @param eventNames the events to stop listening on
   * @param listener the registered instance
   * @return this manager for chaining
   */
  public EventManager unregister(Collection<String> eventNames, Object listener) {
    Objects.requireNonNull(eventNames, "eventNames");
    ListenerKey key = ListenerKey.of(listener);
    acquire();
    try {
      for (String eventName : eventNames) {
        EventRegistry registry = registries.get(Objects.requireNonNull(eventName, "eventName"));
        if (registry == null) {
          continue;
        }
        if (registry.remove(key)) {
          logger.log(Level.FINE, "Unregistered {0} from {1}", new Object[] {key, eventName});
          metrics.recordListenerChange(-1);
        }
      }
    } finally {
      release();
    }
    return this;
  }

  /**
   * Registers a subscriber with priority 0.
   *
   * @see #registerSubscriber(EventSubscriber, int)
   */
  public EventManager registerSubscriber(EventSubscriber subscriber) {
    return registerSubscriber(subscriber, 0);
  }

  /**
   * Registers the subscriber as a method-dispatch listener for every event it
   * declares, all with the same priority.
   *
   * @param subscriber the subscriber
   * @param priority the higher this value, the earlier the subscriber is invoked
   * @return this manager for chaining
   */
  public EventManager registerSubscriber(EventSubscriber subscriber, int priority) {
    Objects.requireNonNull(subscriber, "subscriber");
    List<String> eventNames = Objects.requireNonNull(subscriber.getSubscribedEvents(),
        "getSubscribedEvents() returned null");
    add(eventNames, ListenerTarget.methodDispatch(subscriber), priority);
    return this;
  }

  /**
   * Removes the subscriber from every event it currently declares.
   */
  public EventManager unregisterSubscriber(EventSubscriber subscriber) {
    Objects.requireNonNull(subscriber, "subscriber");
    List<String> eventNames = Objects.requireNonNull(subscriber.getSubscribedEvents(),
        "getSubscribedEvents() returned null");
    return unregister(eventNames, subscriber);
  }

  /**
   * Checks whether an event has any registered listeners. Never sorts.
   */
  public boolean hasListeners(String eventName) {
    Objects.requireNonNull(eventName, "eventName");
    acquire();
    try {
      EventRegistry registry = registries.get(eventName);
      return registry != null && !registry.isEmpty();
    } finally {
      release();
    }
  }

  /**
   * Returns the listeners of an event in dispatch order, sorting them first if needed.
   *
   * @param eventName the event
   * @return immutable snapshot, listener key to listener; empty for unknown events
   */
  public Map<ListenerKey, Object> listeners(String eventName) {
    Objects.requireNonNull(eventName, "eventName");
    acquire();
    try {
      EventRegistry registry = registries.get(eventName);
      if (registry == null) {
        return Map.of();
      }
      sort(registry);
      return registry.snapshot();
    } finally {
      release();
    }
  }

  /**
   * Returns the listeners of all events, each in dispatch order. Events whose
   * listeners were all removed are omitted.
   *
   * @return immutable snapshot keyed by event name, in first-registration order
   */
  public Map<String, Map<ListenerKey, Object>> listeners() {
    acquire();
    try {
      Map<String, Map<ListenerKey, Object>> all = new LinkedHashMap<>();
      for (EventRegistry registry : registries.values()) {
        if (registry.isEmpty()) {
          continue;
        }
        sort(registry);
        all.put(registry.eventName(), registry.snapshot());
      }
      return Collections.unmodifiableMap(all);
    } finally {
      release();
    }
  }

  /**
   * Dispatches an event with a fresh, empty payload.
   *
   * @see #dispatch(String, EventArgs)
   */
  public EventArgs dispatch(String eventName) {
    return dispatch(eventName, EventArgs.empty());
  }

  /**
   * Dispatches an event to all its listeners, highest priority first.
   *
   * <p>Iteration stops as soon as a listener calls {@link EventArgs#stopPropagation()}.
   * Exceptions thrown by listeners, including {@link MissingHandlerException},
   * propagate unchanged and skip the remaining listeners. Dispatching an event
   * without listeners does nothing.
   *
   * @param eventName the event
   * @param args the payload handed to every listener; {@code null} means a fresh
   *     {@link EventArgs#empty() empty} payload
   * @return the payload, as mutated by the listeners
   */
  public EventArgs dispatch(String eventName, EventArgs args) {
    Objects.requireNonNull(eventName, "eventName");
    if (args == null) {
      args = EventArgs.empty();
    }
    acquire();
    try {
      EventRegistry registry = registries.get(eventName);
      if (registry == null || registry.isEmpty()) {
        metrics.incrementDispatchedWithoutListeners();
        return args;
      }
      sort(registry);
      metrics.incrementDispatched();
      try {
        for (Registration registration : registry.ordered()) {
          invoke(registration.target(), eventName, args);
          metrics.incrementListenerInvoked();
          if (args.isPropagationStopped()) {
            metrics.incrementPropagationStopped();
            break;
          }
        }
      } catch (RuntimeException | Error e) {
        metrics.incrementDispatchFailure();
        throw e;
      }
      return args;
    } finally {
      release();
    }
  }

  private void add(Collection<String> eventNames, ListenerTarget target, int priority) {
    Objects.requireNonNull(eventNames, "eventNames");
    ListenerKey key = ListenerKey.of(target.listener());
    acquire();
    try {
      for (String eventName : eventNames) {
        Objects.requireNonNull(eventName, "eventName");
        EventRegistry registry = registries.computeIfAbsent(eventName, EventRegistry::new);
        boolean added = !registry.contains(key);
        registry.put(key, target, priority);
        logger.log(Level.FINE, "Registered {0} for {1} with priority {2}",
            new Object[] {key, eventName, priority});
        if (added) {
          metrics.recordListenerChange(1);
        }
      }
    } finally {
      release();
    }
  }

  private void sort(EventRegistry registry) {
    if (registry.ensureSorted()) {
      metrics.incrementSort();
      logger.log(Level.FINEST, "Sorted {0} listeners of {1}",
          new Object[] {registry.size(), registry.eventName()});
    }
  }

  private void invoke(ListenerTarget target, String eventName, EventArgs args) {
    if (interceptors.isEmpty()) {
      target.invoke(eventName, args);
      return;
    }
    Object listener = target.listener();
    Throwable error = null;
    try {
      for (DispatchInterceptor interceptor : interceptors) {
        interceptor.beforeListener(eventName, listener, args);
      }
      target.invoke(eventName, args);
    } catch (RuntimeException | Error e) {
      error = e;
      throw e;
    } finally {
      for (int i = interceptors.size() - 1; i >= 0; i--) {
        try {
          interceptors.get(i).afterListener(eventName, listener, args, error);
        } catch (RuntimeException e) {
          logger.log(Level.WARNING, "afterListener interceptor failed for event " + eventName, e);
        }
      }
    }
  }

  private void acquire() {
    if (lock != null) {
      lock.lock();
    }
  }

  private void release() {
    if (lock != null) {
      lock.unlock();
    }
  }

  /**
   * Builder for {@link EventManager}.
   */
  public static final class Builder {
    private boolean threadSafe;
    private MetricsExporter metrics;
    private final List<DispatchInterceptor> interceptors = new ArrayList<>();

    private Builder() {
    }

    /**
     * Guards all operations with a single reentrant lock. Defaults to {@code false}.
     */
    public Builder threadSafe(boolean threadSafe) {
      this.threadSafe = threadSafe;
      return this;
    }

    public Builder metrics(MetricsExporter metrics) {
      this.metrics = metrics;
      return this;
    }

    /**
     * Adds an interceptor; interceptors run in the order they are added.
     */
    public Builder interceptor(DispatchInterceptor interceptor) {
      this.interceptors.add(Objects.requireNonNull(interceptor, "interceptor"));
      return this;
    }

    public EventManager build() {
      return new EventManager(this);
    }
  }
}
