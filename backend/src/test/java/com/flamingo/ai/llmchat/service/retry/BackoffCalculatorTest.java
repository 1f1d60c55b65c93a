package com.flamingo.ai.llmchat.service.retry;

import static org.assertj.core.api.Assertions.assertThat;

import com.flamingo.ai.llmchat.config.ChatConfig;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class BackoffCalculatorTest {

  private ChatConfig chatConfig;

  @BeforeEach
  void setUp() {
    chatConfig = new ChatConfig();
  }

  @Test
  @DisplayName("Should double the delay per attempt when jitter is centred")
  void shouldDoubleDelayPerAttempt() {
    BackoffCalculator calculator = new BackoffCalculator(chatConfig, () -> 0.5);

    assertThat(calculator.calculate(0, null)).isEqualTo(1000);
    assertThat(calculator.calculate(1, null)).isEqualTo(2000);
    assertThat(calculator.calculate(2, null)).isEqualTo(4000);
    assertThat(calculator.calculate(3, null)).isEqualTo(8000);
  }

  @Test
  @DisplayName("Should keep jitter within the configured fraction")
  void shouldBoundJitter() {
    assertThat(new BackoffCalculator(chatConfig, () -> 0.0).calculate(0, null)).isEqualTo(800);
    assertThat(new BackoffCalculator(chatConfig, () -> 0.999999).calculate(0, null))
        .isBetween(1199L, 1200L);
  }

  @Test
  @DisplayName("Should cap the delay at the maximum")
  void shouldCapAtMaximum() {
    BackoffCalculator calculator = new BackoffCalculator(chatConfig, () -> 1.0);

    assertThat(calculator.calculate(10, null)).isEqualTo(30000);
  }

  @Test
  @DisplayName("Should prefer a positive provider hint, capped at the maximum")
  void shouldPreferSuggestedDelay() {
    BackoffCalculator calculator = new BackoffCalculator(chatConfig, () -> 0.5);

    assertThat(calculator.calculate(0, 5000L)).isEqualTo(5000);
    assertThat(calculator.calculate(0, 120_000L)).isEqualTo(30000);
  }

  @Test
  @DisplayName("Should ignore a zero or negative hint")
  void shouldIgnoreNonPositiveHint() {
    BackoffCalculator calculator = new BackoffCalculator(chatConfig, () -> 0.5);

    assertThat(calculator.calculate(1, 0L)).isEqualTo(2000);
    assertThat(calculator.calculate(1, -5L)).isEqualTo(2000);
  }

  @Test
  @DisplayName("Should never return a negative delay")
  void shouldNeverBeNegative() {
    chatConfig.getRetry().setJitter(2.0);
    BackoffCalculator calculator = new BackoffCalculator(chatConfig, () -> 0.0);

    assertThat(calculator.calculate(0, null)).isZero();
  }
}
