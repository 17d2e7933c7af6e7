package com.flamingo.ai.knowledgedesk.config;

import io.micrometer.core.aop.TimedAspect;
import io.micrometer.core.instrument.MeterRegistry;
import java.time.Clock;
import org.springframework.boot.actuate.autoconfigure.metrics.MeterRegistryCustomizer;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/** Configuration for application metrics and the shared clock. */
@Configuration
public class MetricsConfig {

  /** Enables {@code @Timed} on external calls. */
  @Bean
  public TimedAspect timedAspect(MeterRegistry registry) {
    return new TimedAspect(registry);
  }

  @Bean
  public MeterRegistryCustomizer<MeterRegistry> commonTags() {
    return registry -> registry.config().commonTags("application", "knowledge-desk");
  }

  /** Staleness checks and ledger timestamps read this clock so tests can pin time. */
  @Bean
  public Clock clock() {
    return Clock.systemUTC();
  }
}
