package eventmanager.micrometer;

import eventmanager.EventListener;
import eventmanager.EventManager;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class MicrometerMetricsExporterTest {

  private SimpleMeterRegistry registry;
  private MicrometerMetricsExporter exporter;

  @BeforeEach
  void setUp() {
    registry = new SimpleMeterRegistry();
    exporter = new MicrometerMetricsExporter(registry);
  }

  @Test
  void incrementDispatched() {
    exporter.incrementDispatched();
    exporter.incrementDispatched();
    assertEquals(2.0, counter("eventmanager.dispatch").count());
  }

  @Test
  void incrementDispatchedWithoutListeners() {
    exporter.incrementDispatchedWithoutListeners();
    assertEquals(1.0, counter("eventmanager.dispatch.unheard").count());
  }

  @Test
  void incrementListenerInvoked() {
    exporter.incrementListenerInvoked();
    exporter.incrementListenerInvoked();
    exporter.incrementListenerInvoked();
    assertEquals(3.0, counter("eventmanager.listener.invoked").count());
  }

  @Test
  void incrementPropagationStopped() {
    exporter.incrementPropagationStopped();
    assertEquals(1.0, counter("eventmanager.dispatch.stopped").count());
  }

  @Test
  void incrementDispatchFailure() {
    exporter.incrementDispatchFailure();
    assertEquals(1.0, counter("eventmanager.dispatch.failure").count());
  }

  @Test
  void incrementSort() {
    exporter.incrementSort();
    assertEquals(1.0, counter("eventmanager.sort").count());
  }

  @Test
  void listenerGaugeAppliesChanges() {
    exporter.recordListenerChange(1);
    exporter.recordListenerChange(1);
    exporter.recordListenerChange(1);
    assertEquals(3.0, gauge("eventmanager.listeners").value());

    exporter.recordListenerChange(-1);
    assertEquals(2.0, gauge("eventmanager.listeners").value());
  }

  @Test
  void listenerGaugeCountsEveryManagerSharingTheExporter() {
    EventManager first = EventManager.builder().metrics(exporter).build();
    EventManager second = EventManager.builder().metrics(exporter).build();
    EventListener audit = (eventName, args) -> {};

    first.register("saved", (eventName, args) -> {});
    second.register("saved", (eventName, args) -> {});
    second.register("saved", audit);
    assertEquals(3.0, gauge("eventmanager.listeners").value());

    second.unregister("saved", audit);
    assertEquals(2.0, gauge("eventmanager.listeners").value());
  }

  @Test
  void reRegistrationAndUnknownRemovalLeaveGaugeUnchanged() {
    EventManager manager = EventManager.builder().metrics(exporter).build();
    EventListener listener = (eventName, args) -> {};

    manager.register("saved", listener);
    manager.register("saved", listener, 10);
    manager.unregister("deleted", listener);
    manager.unregister("saved", (EventListener) (eventName, args) -> {});

    assertEquals(1.0, gauge("eventmanager.listeners").value());
  }

  @Test
  void customNamePrefix() {
    var custom = new MicrometerMetricsExporter(registry, "orders.events");
    custom.incrementDispatched();
    custom.recordListenerChange(1);

    assertEquals(1.0, counter("orders.events.dispatch").count());
    assertEquals(1.0, gauge("orders.events.listeners").value());
  }

  @Test
  void closeRemovesMeters() {
    exporter.close();

    assertNull(registry.find("eventmanager.dispatch").counter());
    assertNull(registry.find("eventmanager.listeners").gauge());
    assertDoesNotThrow(() -> exporter.incrementDispatched());
  }

  @Test
  void wiredIntoEventManager() {
    EventManager manager = EventManager.builder().metrics(exporter).build();
    EventListener stopper = (eventName, args) -> args.stopPropagation();
    manager.register("preFoo", stopper);
    manager.register("preFoo", (eventName, args) -> {}, -1);

    manager.dispatch("preFoo");
    manager.dispatch("postFoo");
    manager.unregister("preFoo", stopper);

    assertEquals(1.0, counter("eventmanager.dispatch").count());
    assertEquals(1.0, counter("eventmanager.dispatch.unheard").count());
    assertEquals(1.0, counter("eventmanager.listener.invoked").count());
    assertEquals(1.0, counter("eventmanager.dispatch.stopped").count());
    assertEquals(1.0, gauge("eventmanager.listeners").value());
  }

  @Test
  void nullRegistryThrows() {
    assertThrows(NullPointerException.class, () -> new MicrometerMetricsExporter(null));
  }

  @Test
  void nullPrefixThrows() {
    assertThrows(NullPointerException.class, () -> new MicrometerMetricsExporter(registry, null));
  }

  @Test
  void invalidPrefixThrows() {
    assertThrows(IllegalArgumentException.class, () -> new MicrometerMetricsExporter(registry, ""));
    assertThrows(IllegalArgumentException.class, () -> new MicrometerMetricsExporter(registry, "events."));
  }

  private Counter counter(String name) {
    Counter c = registry.find(name).counter();
    assertNotNull(c, "Counter not found: " + name);
    return c;
  }

  private Gauge gauge(String name) {
    Gauge g = registry.find(name).gauge();
    assertNotNull(g, "Gauge not found: " + name);
    return g;
  }
}
