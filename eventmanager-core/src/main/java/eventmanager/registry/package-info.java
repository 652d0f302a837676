/**
 * Per-event listener storage: identity keys, priorities and the cached sort state.
 *
 * <p>An {@link eventmanager.registry.EventRegistry} moves between two states:
 * {@link eventmanager.registry.SortState#UNSORTED UNSORTED} after every put or
 * remove, and {@link eventmanager.registry.SortState#SORTED SORTED} after
 * {@link eventmanager.registry.EventRegistry#ensureSorted()}. Sorting an already
 * sorted registry is a no-op.
 *
 * @see eventmanager.registry.EventRegistry
 * @see eventmanager.registry.ListenerKey
 */
package eventmanager.registry;
