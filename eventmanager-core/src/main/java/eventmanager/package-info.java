/**
 * Root API of the event manager: an in-process, synchronous listener registry.
 *
 * <h2>Core Design</h2>
 * <p>Listeners register on an {@link eventmanager.EventManager} for one or more
 * event names, each with an integer priority. {@link eventmanager.EventManager#dispatch
 * dispatch} invokes the listeners of an event on the calling thread, highest priority
 * first, equal priorities in registration order. A listener can end the current
 * dispatch early through {@link eventmanager.EventArgs#stopPropagation()}.
 *
 * <p>Listener ordering is computed lazily: registering or removing a listener marks
 * the event's {@linkplain eventmanager.registry.EventRegistry registry} unsorted, and
 * the next dispatch or listener query sorts it once. Repeated dispatches reuse the
 * cached order.
 *
 * <h2>Module Layout</h2>
 * <ul>
 *   <li><b>eventmanager-core</b>: manager, registries, listener invocation (zero external deps)</li>
 *   <li><b>eventmanager-micrometer</b>: {@linkplain eventmanager.spi.MetricsExporter metrics}
 *       bridge to Micrometer</li>
 *   <li><b>eventmanager-spring-boot-starter</b>: auto-configuration and subscriber bean
 *       registration</li>
 * </ul>
 *
 * <h2>Quick Start</h2>
 * <pre>{@code
 * EventManager events = EventManager.builder()
 *     .threadSafe(true)
 *     .build();
 *
 * events.register("preUpdate", (eventName, args) -> audit.touch(), 10);
 * events.registerSubscriber(new TimestampSubscriber());
 *
 * events.dispatch("preUpdate", new EntityArgs(entity));
 * }</pre>
 *
 * @see eventmanager.EventManager
 * @see eventmanager.EventArgs
 * @see eventmanager.EventListener
 * @see eventmanager.EventSubscriber
 */
package eventmanager;
