package com.ospicorp.anomalyapi.config;

import com.ospicorp.anomalyapi.detection.ModelFactory;
import com.ospicorp.anomalyapi.detection.RandomCutForestStrategy;
import com.ospicorp.anomalyapi.detection.StatisticalStrategy;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class DetectionConfig {

  @Bean
  StatisticalStrategy.Settings statisticalSettings(
      @Value("${anomaly.detection.statistical.k:3.0}") double k,
      @Value("${anomaly.detection.statistical.min-samples:2}") int minSamples) {
    return new StatisticalStrategy.Settings(k, minSamples);
  }

  @Bean
  RandomCutForestStrategy.Settings forestSettings(
      @Value("${anomaly.detection.rcf.trees:50}") int trees,
      @Value("${anomaly.detection.rcf.sample-size:256}") int sampleSize,
      @Value("${anomaly.detection.rcf.seed:#{null}}") Long seed,
      @Value("${anomaly.detection.rcf.score-threshold:1.5}") double scoreThreshold,
      @Value("${anomaly.detection.rcf.min-samples:8}") int minSamples) {
    return new RandomCutForestStrategy.Settings(trees, sampleSize, seed, scoreThreshold,
        minSamples);
  }

  @Bean
  ModelFactory modelFactory(StatisticalStrategy.Settings statisticalSettings,
      RandomCutForestStrategy.Settings forestSettings) {
    return new ModelFactory(statisticalSettings, forestSettings);
  }
}
