package com.ospicorp.anomalyapi.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.ospicorp.anomalyapi.detection.ModelFactory;
import com.ospicorp.anomalyapi.metrics.AnomalyMetrics;
import com.ospicorp.anomalyapi.storage.StorageBackend;
import com.ospicorp.anomalyapi.store.BackoffPolicy;
import com.ospicorp.anomalyapi.store.ModelRecordCodec;
import com.ospicorp.anomalyapi.store.ModelStore;
import java.time.Clock;
import java.time.Duration;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

@Configuration
public class ModelStoreConfig {

  @Bean
  Clock clock() {
    return Clock.systemUTC();
  }

  @Bean
  ModelRecordCodec modelRecordCodec(ObjectMapper objectMapper) {
    return new ModelRecordCodec(objectMapper);
  }

  @Bean
  ModelStore modelStore(StorageBackend storageBackend, ModelFactory modelFactory,
      ModelRecordCodec modelRecordCodec, AnomalyMetrics metrics, Clock clock,
      @Value("${anomaly.model.type:statistical}") String modelType,
      @Value("${anomaly.cache.max-entries:1000}") long cacheMaxEntries,
      @Value("${anomaly.storage.retry.count:3}") int retryCount,
      @Value("${anomaly.storage.retry.backoff-ms:50}") long backoffMs,
      @Value("${anomaly.storage.retry.max-backoff-ms:2000}") long maxBackoffMs,
      @Value("${anomaly.storage.retain-versions:0}") int retainVersions) {
    BackoffPolicy backoff = new BackoffPolicy(retryCount, Duration.ofMillis(backoffMs),
        Duration.ofMillis(maxBackoffMs));
    return new ModelStore(storageBackend, modelFactory, modelRecordCodec, metrics,
        new ModelStore.Settings(modelType, cacheMaxEntries, backoff, retainVersions), clock);
  }

  @Bean
  ThreadPoolTaskExecutor anomalyWorkerPool(
      @Value("${anomaly.service.worker-pool-size:8}") int poolSize,
      @Value("${anomaly.service.queue-capacity:256}") int queueCapacity) {
    ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
    executor.setCorePoolSize(poolSize);
    executor.setMaxPoolSize(poolSize);
    executor.setQueueCapacity(queueCapacity);
    executor.setThreadNamePrefix("anomaly-worker-");
    executor.setWaitForTasksToCompleteOnShutdown(true);
    executor.setAwaitTerminationSeconds(30);
    return executor;
  }
}
