package eventmanager.registry;

import eventmanager.dispatch.ListenerTarget;

/**
 * One listener entry of an {@link EventRegistry}: the invocation target and its priority.
 */
public record Registration(ListenerTarget target, int priority) {
}
