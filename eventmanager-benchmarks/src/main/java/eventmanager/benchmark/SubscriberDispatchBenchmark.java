package eventmanager.benchmark;

import eventmanager.EventArgs;
import eventmanager.EventListener;
import eventmanager.EventManager;
import eventmanager.EventSubscriber;
import org.openjdk.jmh.annotations.*;

import java.util.List;
import java.util.concurrent.TimeUnit;

/**
 * Compares invoking a callable listener with invoking a subscriber's handler method.
 *
 * <p>Run: {@code java -jar eventmanager-benchmarks/target/benchmarks.jar SubscriberDispatchBenchmark}
 */
@BenchmarkMode(Mode.AverageTime)
@OutputTimeUnit(TimeUnit.NANOSECONDS)
@State(Scope.Benchmark)
@Warmup(iterations = 3, time = 2)
@Measurement(iterations = 5, time = 2)
@Fork(1)
public class SubscriberDispatchBenchmark {

  private EventManager callables;
  private EventManager subscribers;

  @Setup(Level.Trial)
  public void setup() {
    CountingSubscriber subscriber = new CountingSubscriber();
    EventListener callable = (eventName, args) -> subscriber.count++;
    callables = new EventManager().register("onTick", callable);
    subscribers = new EventManager().registerSubscriber(subscriber);
  }

  @Benchmark
  public EventArgs callableListener() {
    return callables.dispatch("onTick");
  }

  @Benchmark
  public EventArgs methodDispatchListener() {
    return subscribers.dispatch("onTick");
  }

  public static class CountingSubscriber implements EventSubscriber {
    long count;

    @Override
    public List<String> getSubscribedEvents() {
      return List.of("onTick");
    }

    public void onTick(EventArgs args) {
      count++;
    }
  }
}
