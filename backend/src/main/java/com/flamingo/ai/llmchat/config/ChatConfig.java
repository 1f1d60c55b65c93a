package com.flamingo.ai.llmchat.config;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

/** Configuration properties for chat sessions, generation, retries and providers. */
@Configuration
@ConfigurationProperties(prefix = "chat")
@Getter
@Setter
public class ChatConfig {

  private Retry retry = new Retry();
  private Session session = new Session();
  private Generation generation = new Generation();
  private Provider provider = new Provider();

  @Getter
  @Setter
  public static class Retry {
    /** Retries after the first attempt; total attempts is one more. */
    private int maxRetries = 3;

    private long baseDelayMs = 1000;
    private long maxDelayMs = 30000;

    /** Fraction of the exponential delay applied as symmetric jitter. */
    private double jitter = 0.2;
  }

  @Getter
  @Setter
  public static class Session {
    /** Grace period a session survives with no viewers before it is destroyed. */
    private long cleanupDelayMs = 5000;

    private int titleMaxLength = 50;
  }

  @Getter
  @Setter
  public static class Generation {
    private double temperature = 0.7;

    /** Null leaves the limit to the provider. */
    private Integer maxOutputTokens;

    private int maxToolRounds = 10;
    private int toolConcurrency = 4;
  }

  @Getter
  @Setter
  public static class Provider {
    private long modelCacheTtlMs = 3_600_000;
    private long requestTimeoutMs = 120_000;
    private int maxInMemorySizeBytes = 2 * 1024 * 1024;
  }
}
