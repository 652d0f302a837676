package eventmanager.spring.boot;

import eventmanager.EventArgs;
import eventmanager.EventManager;
import eventmanager.EventSubscriber;
import eventmanager.dispatch.DispatchInterceptor;

import org.junit.jupiter.api.Test;
import org.springframework.boot.autoconfigure.AutoConfigurations;
import org.springframework.boot.test.context.runner.ApplicationContextRunner;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.annotation.Order;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

import static org.junit.jupiter.api.Assertions.*;

class EventManagerAutoConfigurationTest {

  private final ApplicationContextRunner runner = new ApplicationContextRunner()
      .withConfiguration(AutoConfigurations.of(EventManagerAutoConfiguration.class));

  @Test
  void createsAllBeans() {
    runner.run(ctx -> {
      assertTrue(ctx.containsBean("eventManager"));
      assertTrue(ctx.containsBean("eventSubscriberRegistrar"));
      assertInstanceOf(EventManager.class, ctx.getBean(EventManager.class));
    });
  }

  @Test
  void registersSubscriberBeans() {
    runner.withUserConfiguration(SubscriberConfig.class).run(ctx -> {
      var eventManager = ctx.getBean(EventManager.class);
      var subscriber = ctx.getBean(AuditSubscriber.class);

      assertTrue(eventManager.hasListeners("prePersist"));
      assertTrue(eventManager.hasListeners("postPersist"));

      eventManager.dispatch("prePersist");
      assertEquals(List.of("prePersist"), subscriber.seen);
    });
  }

  @Test
  void subscriberPriorityAnnotationOrdersSubscribers() {
    runner.withUserConfiguration(PrioritizedConfig.class).run(ctx -> {
      var eventManager = ctx.getBean(EventManager.class);
      var calls = ctx.getBean(CallLog.class).calls;

      eventManager.dispatch("prePersist");

      assertEquals(List.of("urgent", "relaxed"), calls);
    });
  }

  @Test
  void interceptorBeansAreAppliedInOrder() {
    runner.withUserConfiguration(SubscriberConfig.class, InterceptorConfig.class).run(ctx -> {
      var eventManager = ctx.getBean(EventManager.class);
      var calls = ctx.getBean(CallLog.class).calls;

      eventManager.dispatch("prePersist");

      assertEquals(List.of("first", "second"), calls);
    });
  }

  @Test
  void threadSafePropertyLocksTheEventManager() {
    runner.withPropertyValues("eventmanager.thread-safe=true").run(ctx -> {
      assertTrue(ctx.getBean(EventManagerProperties.class).isThreadSafe());
      var eventManager = ctx.getBean(EventManager.class);
      var entered = new CountDownLatch(1);
      var release = new CountDownLatch(1);
      eventManager.register("slow", (eventName, args) -> {
        entered.countDown();
        await(release);
      });

      ExecutorService pool = Executors.newFixedThreadPool(2);
      try {
        Future<EventArgs> dispatching = pool.submit(() -> eventManager.dispatch("slow"));
        assertTrue(entered.await(5, TimeUnit.SECONDS));

        // the dispatching thread holds the lock, so the query has to wait for it
        Future<Boolean> query = pool.submit(() -> eventManager.hasListeners("slow"));
        assertThrows(TimeoutException.class, () -> query.get(200, TimeUnit.MILLISECONDS));

        release.countDown();
        assertTrue(query.get(5, TimeUnit.SECONDS));
        assertNotNull(dispatching.get(5, TimeUnit.SECONDS));
      } finally {
        release.countDown();
        pool.shutdownNow();
      }
    });
  }

  @Test
  void eventManagerIsUnlockedByDefault() {
    runner.run(ctx -> {
      var eventManager = ctx.getBean(EventManager.class);
      var entered = new CountDownLatch(1);
      var release = new CountDownLatch(1);
      eventManager.register("slow", (eventName, args) -> {
        entered.countDown();
        await(release);
      });

      ExecutorService pool = Executors.newFixedThreadPool(2);
      try {
        Future<EventArgs> dispatching = pool.submit(() -> eventManager.dispatch("slow"));
        assertTrue(entered.await(5, TimeUnit.SECONDS));

        Future<Boolean> query = pool.submit(() -> eventManager.hasListeners("slow"));
        assertTrue(query.get(5, TimeUnit.SECONDS));
        assertFalse(dispatching.isDone());

        release.countDown();
        assertNotNull(dispatching.get(5, TimeUnit.SECONDS));
      } finally {
        release.countDown();
        pool.shutdownNow();
      }
    });
  }

  @Test
  void backsOffWhenCustomEventManagerPresent() {
    runner.withUserConfiguration(CustomManagerConfig.class).run(ctx -> {
      assertSame(CustomManagerConfig.CUSTOM, ctx.getBean(EventManager.class));
    });
  }

  // ── Test support ─────────────────────────────────────────────

  private static void await(CountDownLatch latch) {
    try {
      if (!latch.await(10, TimeUnit.SECONDS)) {
        throw new IllegalStateException("latch not released");
      }
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      throw new IllegalStateException(e);
    }
  }

  static class CallLog {
    final List<String> calls = new ArrayList<>();
  }

  static class AuditSubscriber implements EventSubscriber {
    final List<String> seen = new ArrayList<>();

    @Override
    public List<String> getSubscribedEvents() {
      return List.of("prePersist", "postPersist");
    }

    public void prePersist(EventArgs args) {
      seen.add("prePersist");
    }

    public void postPersist(EventArgs args) {
      seen.add("postPersist");
    }
  }

  static class LoggingSubscriber implements EventSubscriber {
    private final String name;
    private final CallLog log;

    LoggingSubscriber(String name, CallLog log) {
      this.name = name;
      this.log = log;
    }

    @Override
    public List<String> getSubscribedEvents() {
      return List.of("prePersist");
    }

    public void prePersist(EventArgs args) {
      log.calls.add(name);
    }
  }

  @SubscriberPriority(-5)
  static class RelaxedSubscriber extends LoggingSubscriber {
    RelaxedSubscriber(CallLog log) {
      super("relaxed", log);
    }
  }

  @SubscriberPriority(50)
  static class UrgentSubscriber extends LoggingSubscriber {
    UrgentSubscriber(CallLog log) {
      super("urgent", log);
    }
  }

  @Configuration
  static class SubscriberConfig {
    @Bean
    AuditSubscriber auditSubscriber() {
      return new AuditSubscriber();
    }

    @Bean
    CallLog callLog() {
      return new CallLog();
    }
  }

  @Configuration
  static class PrioritizedConfig {
    @Bean
    CallLog callLog() {
      return new CallLog();
    }

    @Bean
    RelaxedSubscriber relaxedSubscriber(CallLog log) {
      return new RelaxedSubscriber(log);
    }

    @Bean
    UrgentSubscriber urgentSubscriber(CallLog log) {
      return new UrgentSubscriber(log);
    }
  }

  @Configuration
  static class InterceptorConfig {
    @Bean
    @Order(2)
    DispatchInterceptor second(CallLog log) {
      return DispatchInterceptor.before((eventName, listener, args) -> log.calls.add("second"));
    }

    @Bean
    @Order(1)
    DispatchInterceptor first(CallLog log) {
      return DispatchInterceptor.before((eventName, listener, args) -> log.calls.add("first"));
    }
  }

  @Configuration
  static class CustomManagerConfig {
    static final EventManager CUSTOM = new EventManager();

    @Bean
    EventManager eventManager() {
      return CUSTOM;
    }
  }
}
