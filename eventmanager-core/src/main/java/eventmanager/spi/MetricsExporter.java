package eventmanager.spi;

/**
 * Observability hook for exporting event manager counters and gauges to a metrics backend.
 *
 * <p>The {@link #NOOP} instance discards all metrics silently. Implement this interface
 * to bridge into Micrometer, Prometheus, or other monitoring systems.
 */
public interface MetricsExporter {

    /**
     * No-op instance that discards all metrics.
     */
    MetricsExporter NOOP = new Noop();

    /**
     * Increments the count of dispatches that reached at least one listener.
     */
    void incrementDispatched();

    /**
     * Increments the count of dispatches of events without any listener.
     */
    void incrementDispatchedWithoutListeners();

    /**
     * Increments the count of individual listener invocations.
     */
    void incrementListenerInvoked();

    /**
     * Increments the count of dispatches cut short by a listener stopping propagation.
     */
    void incrementPropagationStopped();

    /**
     * Increments the count of dispatches aborted by an exception.
     */
    void incrementDispatchFailure();

    /**
     * Increments the count of registry sorts (cache misses of the sort state).
     */
    default void incrementSort() {
    }

    /**
     * Records a change in the number of registered listeners. Reported as a delta so
     * several managers can share one exporter.
     *
     * @param delta {@code +1} for a new registration, {@code -1} for a removal
     */
    default void recordListenerChange(int delta) {
    }

    /**
     * Default no-op implementation that discards all metrics.
     */
    final class Noop implements MetricsExporter {
        @Override
        public void incrementDispatched() {
        }

        @Override
        public void incrementDispatchedWithoutListeners() {
        }

        @Override
        public void incrementListenerInvoked() {
        }

        @Override
        public void incrementPropagationStopped() {
        }

        @Override
        public void incrementDispatchFailure() {
        }
    }
}
