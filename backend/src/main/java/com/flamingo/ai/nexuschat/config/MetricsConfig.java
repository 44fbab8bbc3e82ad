package com.flamingo.ai.nexuschat.config;

import io.micrometer.core.aop.TimedAspect;
import io.micrometer.core.instrument.MeterRegistry;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/** Registers the Micrometer timing aspect. */
@Configuration
public class MetricsConfig {

  /** Backs the {@code @Timed} service timings, such as {@code ingestion.ingest}. */
  @Bean
  public TimedAspect timedAspect(MeterRegistry registry) {
    return new TimedAspect(registry);
  }
}
