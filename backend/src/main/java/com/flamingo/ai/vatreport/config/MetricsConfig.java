package com.flamingo.ai.vatreport.config;

import io.micrometer.core.aop.TimedAspect;
import io.micrometer.core.instrument.MeterRegistry;
import java.time.Clock;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/** Configuration for parse metrics and the clock used for date fallbacks. */
@Configuration
public class MetricsConfig {

  /**
   * Enables the @Timed annotation on the parsing facade.
   *
   * @param registry the meter registry
   * @return the timed aspect bean
   */
  @Bean
  public TimedAspect timedAspect(MeterRegistry registry) {
    return new TimedAspect(registry);
  }

  @Bean
  public Clock clock() {
    return Clock.systemDefaultZone();
  }
}
