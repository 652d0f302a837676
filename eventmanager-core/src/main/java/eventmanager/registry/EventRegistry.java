package eventmanager.registry;

import eventmanager.dispatch.ListenerTarget;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Listeners of a single event name, keyed by {@link ListenerKey}.
 *
 * <p>Entries keep insertion order until {@link #ensureSorted()} reorders them by
 * descending priority. The sort is stable and its result is cached: the registry
 * stays {@link SortState#SORTED} until the next {@link #put} or {@link #remove}.
 *
 * <p>Not thread-safe; the owning {@link eventmanager.EventManager} serializes access
 * when configured to.
 */
public final class EventRegistry {
  private static final Comparator<Map.Entry<ListenerKey, Registration>> BY_PRIORITY_DESC =
      (a, b) -> Integer.compare(b.getValue().priority(), a.getValue().priority());

  private final String eventName;
  private LinkedHashMap<ListenerKey, Registration> entries = new LinkedHashMap<>();
  private SortState sortState = SortState.UNSORTED;
  private List<Registration> ordered = List.of();

  public EventRegistry(String eventName) {
    this.eventName = Objects.requireNonNull(eventName, "eventName");
  }

  public String eventName() {
    return eventName;
  }

  /**
   * Inserts or replaces the entry for {@code key}. A replaced entry keeps its position.
   */
  public void put(ListenerKey key, ListenerTarget target, int priority) {
    entries.put(key, new Registration(target, priority));
    sortState = SortState.UNSORTED;
  }

  /**
   * Removes the entry for {@code key}.
   *
   * @return whether an entry was removed
   */
  public boolean remove(ListenerKey key) {
    boolean removed = entries.remove(key) != null;
    sortState = SortState.UNSORTED;
    return removed;
  }

  public boolean contains(ListenerKey key) {
    return entries.containsKey(key);
  }

  public boolean isEmpty() {
    return entries.isEmpty();
  }

  public int size() {
    return entries.size();
  }

  public SortState sortState() {
    return sortState;
  }

  /**
   * Sorts the entries by descending priority unless already sorted.
   *
   * @return whether a sort was performed
   */
  public boolean ensureSorted() {
    if (sortState == SortState.SORTED) {
      return false;
    }
    List<Map.Entry<ListenerKey, Registration>> sorted = new ArrayList<>(entries.entrySet());
    sorted.sort(BY_PRIORITY_DESC);

    LinkedHashMap<ListenerKey, Registration> reordered = new LinkedHashMap<>();
    List<Registration> registrations = new ArrayList<>(sorted.size());
    for (Map.Entry<ListenerKey, Registration> entry : sorted) {
      reordered.put(entry.getKey(), entry.getValue());
      registrations.add(entry.getValue());
    }
    entries = reordered;
    ordered = List.copyOf(registrations);
    sortState = SortState.SORTED;
    return true;
  }

  /**
   * Returns the entries in dispatch order. The list is immutable and is not
   * affected by later mutations of this registry.
   *
   * @throws IllegalStateException if the registry is not sorted
   */
  public List<Registration> ordered() {
    if (sortState != SortState.SORTED) {
      throw new IllegalStateException("Registry for '" + eventName + "' is not sorted");
    }
    return ordered;
  }

  /**
   * Returns an immutable copy of the entries, listener key to listener object,
   * in the current iteration order.
   */
  public Map<ListenerKey, Object> snapshot() {
    Map<ListenerKey, Object> copy = new LinkedHashMap<>();
    entries.forEach((key, registration) -> copy.put(key, registration.target().listener()));
    return Collections.unmodifiableMap(copy);
  }
}
