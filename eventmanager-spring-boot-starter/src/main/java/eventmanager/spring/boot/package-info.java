/**
 * Spring Boot auto-configuration for the event manager.
 *
 * <p>Add the starter to the classpath to get an {@link eventmanager.EventManager}
 * bean. Beans implementing {@link eventmanager.EventSubscriber} are registered on it
 * automatically; {@link eventmanager.spring.boot.SubscriberPriority} sets their priority.
 *
 * <h2>Properties</h2>
 * <ul>
 *   <li>{@code eventmanager.thread-safe} (default {@code false})</li>
 *   <li>{@code eventmanager.metrics.enabled} (default {@code true})</li>
 *   <li>{@code eventmanager.metrics.name-prefix} (default {@code eventmanager})</li>
 * </ul>
 *
 * @see eventmanager.spring.boot.EventManagerAutoConfiguration
 * @see eventmanager.spring.boot.EventManagerProperties
 */
package eventmanager.spring.boot;
