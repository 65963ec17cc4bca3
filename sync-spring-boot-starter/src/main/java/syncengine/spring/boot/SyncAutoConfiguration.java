package syncengine.spring.boot;

import syncengine.SyncEngine;
import syncengine.broadcast.InMemoryPubSubTransport;
import syncengine.cache.InMemoryCacheLayer;
import syncengine.dispatch.ExponentialBackoffRetryPolicy;
import syncengine.spi.CacheLayer;
import syncengine.spi.CalculationLayer;
import syncengine.spi.MetricsExporter;
import syncengine.spi.PubSubTransport;

import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnClass;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;

/**
 * Auto-configuration for the sync engine.
 *
 * <p>Wires a {@link SyncEngine} around the application's {@link CalculationLayer} bean,
 * falling back to in-process cache and transport implementations when the application
 * does not define its own. The engine is started with the context and closed with it.
 *
 * @see SyncProperties
 * @see SyncMicrometerAutoConfiguration
 */
@AutoConfiguration
@ConditionalOnClass(SyncEngine.class)
@ConditionalOnProperty(prefix = "sync", name = "enabled", matchIfMissing = true)
@EnableConfigurationProperties(SyncProperties.class)
public class SyncAutoConfiguration {

  @Bean
  @ConditionalOnMissingBean(CacheLayer.class)
  public InMemoryCacheLayer syncCacheLayer() {
    return new InMemoryCacheLayer();
  }

  @Bean
  @ConditionalOnMissingBean(PubSubTransport.class)
  public InMemoryPubSubTransport syncTransport() {
    return new InMemoryPubSubTransport();
  }

  @Bean(initMethod = "start", destroyMethod = "close")
  @ConditionalOnMissingBean
  @ConditionalOnBean(CalculationLayer.class)
  public SyncEngine syncEngine(SyncProperties props,
      CacheLayer cacheLayer,
      CalculationLayer calculationLayer,
      PubSubTransport transport,
      ObjectProvider<MetricsExporter> metricsProvider) {

    var builder = SyncEngine.builder()
        .cacheLayer(cacheLayer)
        .calculationLayer(calculationLayer)
        .transport(transport)
        .retryPolicy(new ExponentialBackoffRetryPolicy(
            props.getRetry().getBaseDelayMs(), props.getRetry().getMaxDelayMs()))
        .workerCount(props.getBatch().getWorkerCount())
        .batchSize(props.getBatch().getSize())
        .batchIntervalMs(props.getBatch().getIntervalMs())
        .maxQueueLength(props.getQueue().getMaxLength())
        .dedupWindowMs(props.getQueue().getDedupWindowMs())
        .healthIntervalMs(props.getHealth().getIntervalMs())
        .syncTimeoutMs(props.getHealth().getSyncTimeoutMs())
        .maxRetryAttempts(props.getHealth().getMaxRetryAttempts())
        .clientIdleTimeoutMs(props.getHealth().getClientIdleTimeoutMs())
        .errorRateThreshold(props.getHealth().getErrorRateThreshold())
        .callTimeoutMs(props.getCallTimeoutMs())
        .resubscribeDelayMs(props.getResubscribeDelayMs());
    MetricsExporter metrics = metricsProvider.getIfAvailable();
    if (metrics != null) {
      builder.metrics(metrics);
    }
    return builder.build();
  }
}
