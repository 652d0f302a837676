package eventmanager.micrometer;

import eventmanager.spi.MetricsExporter;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.Meter;
import io.micrometer.core.instrument.MeterRegistry;

import java.util.List;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Micrometer-based implementation of {@link MetricsExporter}.
 *
 * <p>Registers counters and a gauge with a {@link MeterRegistry} for export to
 * Prometheus, Grafana, Datadog, and other monitoring backends.
 *
 * <h3>Counters</h3>
 * <ul>
 *   <li>{@code eventmanager.dispatch}: dispatches that reached at least one listener</li>
 *   <li>{@code eventmanager.dispatch.unheard}: dispatches of events without listeners</li>
 *   <li>{@code eventmanager.listener.invoked}: individual listener invocations</li>
 *   <li>{@code eventmanager.dispatch.stopped}: dispatches ended by stopPropagation</li>
 *   <li>{@code eventmanager.dispatch.failure}: dispatches aborted by an exception</li>
 *   <li>{@code eventmanager.sort}: listener re-sorts</li>
 * </ul>
 *
 * <h3>Gauges</h3>
 * <ul>
 *   <li>{@code eventmanager.listeners}: listener registrations across all events and all
 *       managers reporting to this exporter</li>
 * </ul>
 *
 * @see MetricsExporter
 */
public final class MicrometerMetricsExporter implements MetricsExporter, AutoCloseable {

  private final MeterRegistry registry;
  private final Counter dispatched;
  private final Counter unheard;
  private final Counter listenerInvoked;
  private final Counter propagationStopped;
  private final Counter dispatchFailure;
  private final Counter sorts;
  private final Gauge listenersGauge;

  private final AtomicInteger totalListeners = new AtomicInteger();
  private volatile boolean closed;

  /**
   * Creates an exporter with the default metric name prefix {@code "eventmanager"}.
   *
   * @param registry the Micrometer meter registry
   */
  public MicrometerMetricsExporter(MeterRegistry registry) {
    this(registry, "eventmanager");
  }

  /**
   * Creates an exporter with a custom metric name prefix for multi-instance use.
   *
   * @param registry   the Micrometer meter registry
   * @param namePrefix prefix for all meter names (e.g. {@code "orders.events"})
   */
  public MicrometerMetricsExporter(MeterRegistry registry, String namePrefix) {
    Objects.requireNonNull(registry, "registry");
    Objects.requireNonNull(namePrefix, "namePrefix");
    if (namePrefix.isEmpty()) {
      throw new IllegalArgumentException("namePrefix must not be empty");
    }
    if (namePrefix.endsWith(".")) {
      throw new IllegalArgumentException("namePrefix must not end with '.'");
    }

    this.registry = registry;
    this.dispatched = Counter.builder(namePrefix + ".dispatch")
        .description("Dispatches that reached at least one listener")
        .register(registry);
    this.unheard = Counter.builder(namePrefix + ".dispatch.unheard")
        .description("Dispatches of events without listeners")
        .register(registry);
    this.listenerInvoked = Counter.builder(namePrefix + ".listener.invoked")
        .description("Listener invocations")
        .register(registry);
    this.propagationStopped = Counter.builder(namePrefix + ".dispatch.stopped")
        .description("Dispatches ended early by a listener stopping propagation")
        .register(registry);
    this.dispatchFailure = Counter.builder(namePrefix + ".dispatch.failure")
        .description("Dispatches aborted by an exception")
        .register(registry);
    this.sorts = Counter.builder(namePrefix + ".sort")
        .description("Listener re-sorts after registration changes")
        .register(registry);

    this.listenersGauge = Gauge.builder(namePrefix + ".listeners", totalListeners, AtomicInteger::get)
        .description("Registered listeners across all events")
        .register(registry);
  }

  @Override
  public void incrementDispatched() {
    if (closed) return;
    dispatched.increment();
  }

  @Override
  public void incrementDispatchedWithoutListeners() {
    if (closed) return;
    unheard.increment();
  }

  @Override
  public void incrementListenerInvoked() {
    if (closed) return;
    listenerInvoked.increment();
  }

  @Override
  public void incrementPropagationStopped() {
    if (closed) return;
    propagationStopped.increment();
  }

  @Override
  public void incrementDispatchFailure() {
    if (closed) return;
    dispatchFailure.increment();
  }

  @Override
  public void incrementSort() {
    if (closed) return;
    sorts.increment();
  }

  @Override
  public void recordListenerChange(int delta) {
    if (closed) return;
    totalListeners.addAndGet(delta);
  }

  /**
   * Removes all meters registered by this exporter from the registry.
   *
   * <p>Call this when the {@link eventmanager.EventManager} using the exporter is
   * discarded, to prevent stale gauges.
   */
  @Override
  public void close() {
    closed = true;
    RuntimeException first = null;
    for (Meter meter : List.of(dispatched, unheard, listenerInvoked,
        propagationStopped, dispatchFailure, sorts, listenersGauge)) {
      try {
        registry.remove(meter);
      } catch (RuntimeException e) {
        if (first == null) first = e; else first.addSuppressed(e);
      }
    }
    if (first != null) throw first;
  }
}
