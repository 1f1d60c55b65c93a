package com.flamingo.ai.llmchat.config;

import io.micrometer.core.aop.TimedAspect;
import io.micrometer.core.instrument.MeterRegistry;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/** Method timing for the store and provider layers. */
@Configuration
public class MetricsConfig {

  /**
   * Backs the {@code @Timed} timers of this service: {@code conversation.messages} and {@code
   * conversation.append} on the conversation store, and {@code provider.listModels} on the provider
   * manager. Generation, retry and tool metrics are plain counters and need no aspect.
   *
   * @param registry the meter registry
   * @return the timed aspect bean
   */
  @Bean
  public TimedAspect timedAspect(MeterRegistry registry) {
    return new TimedAspect(registry);
  }
}
