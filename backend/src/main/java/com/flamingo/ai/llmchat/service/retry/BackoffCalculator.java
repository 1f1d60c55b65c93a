package com.flamingo.ai.llmchat.service.retry;

import com.flamingo.ai.llmchat.config.ChatConfig;
import java.util.concurrent.ThreadLocalRandom;
import java.util.function.DoubleSupplier;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

/** Computes the wait before a retried attempt: exponential with jitter, bounded by a maximum. */
@Component
public class BackoffCalculator {

  private final ChatConfig chatConfig;
  private final DoubleSupplier random;

  @Autowired
  public BackoffCalculator(ChatConfig chatConfig) {
    this(chatConfig, () -> ThreadLocalRandom.current().nextDouble());
  }

  /**
   * @param random source of uniform values in [0, 1)
   */
  public BackoffCalculator(ChatConfig chatConfig, DoubleSupplier random) {
    this.chatConfig = chatConfig;
    this.random = random;
  }

  /**
   * Returns the delay before the retry following attempt {@code attempt} (0 = first attempt).
   *
   * @param attempt zero-based index of the attempt that failed
   * @param suggestedDelayMs provider hint, wins over the exponential value when positive
   * @return delay in milliseconds within [0, maxDelay]
   */
  public long calculate(int attempt, Long suggestedDelayMs) {
    ChatConfig.Retry retry = chatConfig.getRetry();
    long maxDelay = retry.getMaxDelayMs();
    if (suggestedDelayMs != null && suggestedDelayMs > 0) {
      return Math.min(suggestedDelayMs, maxDelay);
    }

    double exponential = retry.getBaseDelayMs() * Math.pow(2, attempt);
    double jitterRange = exponential * retry.getJitter();
    double jitter = random.getAsDouble() * jitterRange * 2 - jitterRange;
    double delay = Math.min(exponential + jitter, maxDelay);
    return Math.max(0L, Math.round(delay));
  }
}
