package com.flamingo.ai.llmchat.config;

import java.time.Clock;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import reactor.core.scheduler.Scheduler;
import reactor.core.scheduler.Schedulers;

/** Schedulers and clock shared by the chat services. */
@Configuration
public class SchedulingConfig {

  /** Runs delayed session cleanup tasks. */
  @Bean(name = "sessionCleanupScheduler", destroyMethod = "dispose")
  public Scheduler sessionCleanupScheduler() {
    return Schedulers.newSingle("session-cleanup", true);
  }

  @Bean
  public Clock clock() {
    return Clock.systemUTC();
  }
}
