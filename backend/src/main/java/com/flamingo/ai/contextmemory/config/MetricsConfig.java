package com.flamingo.ai.contextmemory.config;

import io.micrometer.core.aop.TimedAspect;
import io.micrometer.core.instrument.MeterRegistry;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/** Configuration for engine metrics. */
@Configuration
public class MetricsConfig {

  /** Enables {@code @Timed} on the assembly, search and writer entry points. */
  @Bean
  public TimedAspect timedAspect(MeterRegistry registry) {
    return new TimedAspect(registry);
  }
}
