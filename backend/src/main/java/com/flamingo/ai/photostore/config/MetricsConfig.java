package com.flamingo.ai.photostore.config;

import io.micrometer.core.aop.TimedAspect;
import io.micrometer.core.instrument.MeterRegistry;
import org.springframework.boot.actuate.autoconfigure.metrics.MeterRegistryCustomizer;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/** Metrics for the photo store: {@code @Timed} support and tags shared by every meter. */
@Configuration
public class MetricsConfig {

  static final String SERVICE_TAG = "photo-store";

  /** Lets ingestion and query methods be timed with {@code @Timed}. */
  @Bean
  public TimedAspect timedAspect(MeterRegistry registry) {
    return new TimedAspect(registry);
  }

  /** Tags ingestion counters, query timers and API error counters with the service name. */
  @Bean
  public MeterRegistryCustomizer<MeterRegistry> photoStoreCommonTags() {
    return registry -> registry.config().commonTags("service", SERVICE_TAG);
  }
}
