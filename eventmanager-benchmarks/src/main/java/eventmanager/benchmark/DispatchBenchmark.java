package eventmanager.benchmark;

import eventmanager.EventArgs;
import eventmanager.EventListener;
import eventmanager.EventManager;
import org.openjdk.jmh.annotations.*;

import java.util.concurrent.TimeUnit;

/**
 * Measures dispatch cost with a cached listener order against dispatch right after
 * a registration change, which forces a re-sort.
 *
 * <p>Run: {@code java -jar eventmanager-benchmarks/target/benchmarks.jar DispatchBenchmark}
 */
@BenchmarkMode(Mode.AverageTime)
@OutputTimeUnit(TimeUnit.NANOSECONDS)
@State(Scope.Benchmark)
@Warmup(iterations = 3, time = 2)
@Measurement(iterations = 5, time = 2)
@Fork(1)
public class DispatchBenchmark {

  private static final String EVENT = "benchEvent";

  @Param({"1", "10", "100"})
  private int listenerCount;

  @Param({"false", "true"})
  private boolean threadSafe;

  private EventManager eventManager;
  private EventListener churn;
  private long invocations;

  @Setup(Level.Trial)
  public void setup() {
    eventManager = EventManager.builder().threadSafe(threadSafe).build();
    for (int i = 0; i < listenerCount; i++) {
      int priority = i % 5;
      eventManager.register(EVENT, (eventName, args) -> invocations += priority, priority);
    }
    churn = (eventName, args) -> invocations++;
  }

  @Benchmark
  public EventArgs dispatchCachedOrder() {
    return eventManager.dispatch(EVENT);
  }

  @Benchmark
  public EventArgs dispatchAfterRegistration() {
    eventManager.register(EVENT, churn, 3);
    return eventManager.dispatch(EVENT);
  }

  @Benchmark
  public boolean hasListeners() {
    return eventManager.hasListeners(EVENT);
  }
}
