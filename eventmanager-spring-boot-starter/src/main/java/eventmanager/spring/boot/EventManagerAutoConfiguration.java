package eventmanager.spring.boot;

import eventmanager.EventManager;
import eventmanager.dispatch.DispatchInterceptor;
import eventmanager.spi.MetricsExporter;

import org.springframework.beans.factory.ListableBeanFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnClass;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;

/**
 * Auto-configuration for the event manager.
 *
 * <p>Creates an {@link EventManager} from {@link EventManagerProperties}, the
 * optional {@link MetricsExporter} bean and all {@link DispatchInterceptor} beans
 * (in {@code @Order} order), then registers every
 * {@link eventmanager.EventSubscriber} bean on it.
 *
 * @see EventManagerProperties
 * @see EventManagerMicrometerAutoConfiguration
 */
@AutoConfiguration
@ConditionalOnClass(EventManager.class)
@EnableConfigurationProperties(EventManagerProperties.class)
public class EventManagerAutoConfiguration {

  @Bean
  @ConditionalOnMissingBean
  public EventManager eventManager(EventManagerProperties props,
      ObjectProvider<MetricsExporter> metricsProvider,
      ObjectProvider<DispatchInterceptor> interceptorProvider) {
    EventManager.Builder builder = EventManager.builder()
        .threadSafe(props.isThreadSafe());
    MetricsExporter metrics = metricsProvider.getIfAvailable();
    if (metrics != null) {
      builder.metrics(metrics);
    }
    interceptorProvider.orderedStream().forEach(builder::interceptor);
    return builder.build();
  }

  @Bean
  @ConditionalOnMissingBean
  public EventSubscriberRegistrar eventSubscriberRegistrar(ListableBeanFactory beanFactory,
      EventManager eventManager) {
    return new EventSubscriberRegistrar(beanFactory, eventManager);
  }
}
