package eventmanager.registry;

/**
 * Whether an {@link EventRegistry}'s iteration order currently reflects its priorities.
 */
public enum SortState {
  /** Entries were added or removed since the last sort. */
  UNSORTED,
  /** Entries are in dispatch order. */
  SORTED
}
