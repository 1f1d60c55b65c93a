package com.flamingo.ai.llmchat.service.retry;

import com.flamingo.ai.llmchat.config.ChatConfig;
import com.flamingo.ai.llmchat.domain.enums.ErrorCategory;
import com.flamingo.ai.llmchat.service.stream.CancellationToken;
import com.flamingo.ai.llmchat.service.stream.ChatStreamEvent;
import io.micrometer.core.instrument.MeterRegistry;
import java.time.Duration;
import java.util.function.Supplier;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

/**
 * Runs a streaming completion with automatic retries. Non-terminal events of every attempt are
 * forwarded as they arrive; a failed attempt is followed by a {@link ChatStreamEvent.Retry} notice,
 * a cancellable backoff sleep, and a fresh attempt. Only the final outcome is surfaced as a
 * {@link ChatStreamEvent.Failure}. Cancellation ends the stream quietly at any point.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class RetryingChatStream {

  private final ErrorClassifier errorClassifier;
  private final BackoffCalculator backoffCalculator;
  private final ChatConfig chatConfig;
  private final MeterRegistry meterRegistry;

  /**
   * @param attempts supplies a new provider stream per attempt
   * @param token cancels the current attempt or sleep
   * @return events of all attempts, ending in {@code Done}, a classified {@code Failure}, or
   *     nothing when cancelled
   */
  public Flux<ChatStreamEvent> stream(
      Supplier<Flux<ChatStreamEvent>> attempts, CancellationToken token) {
    return attempt(attempts, token, 0);
  }

  private Flux<ChatStreamEvent> attempt(
      Supplier<Flux<ChatStreamEvent>> attempts, CancellationToken token, int attempt) {
    return Flux.defer(attempts)
        .concatMap(
            event ->
                event instanceof ChatStreamEvent.Failure failure
                    ? Flux.<ChatStreamEvent>error(new FailureSignal(failure))
                    : Flux.just(event))
        .onErrorResume(error -> recover(attempts, token, attempt, error));
  }

  private Flux<ChatStreamEvent> recover(
      Supplier<Flux<ChatStreamEvent>> attempts,
      CancellationToken token,
      int attempt,
      Throwable error) {
    if (token.isCancelled()) {
      log.debug("Attempt {} ended after cancellation: {}", attempt + 1, error.getMessage());
      return Flux.empty();
    }

    ClassifiedError classified =
        error instanceof FailureSignal signal
            ? errorClassifier.classify(signal.failure)
            : errorClassifier.classify(error);
    if (classified.category() == ErrorCategory.CANCELLED) {
      return Flux.empty();
    }

    int maxRetries = chatConfig.getRetry().getMaxRetries();
    if (!classified.retryable() || attempt >= maxRetries) {
      log.error(
          "Stream failed after {} attempt(s) [{}]: {}",
          attempt + 1,
          classified.category(),
          error.getMessage());
      return Flux.just(
          ChatStreamEvent.failure(classified.message(), classified.category(), classified.cause()));
    }

    long delayMs = backoffCalculator.calculate(attempt, classified.retryAfterMs());
    int retryNumber = attempt + 1;
    log.warn(
        "Stream attempt {} failed [{}], retry {}/{} in {}ms: {}",
        attempt + 1,
        classified.category(),
        retryNumber,
        maxRetries,
        delayMs,
        error.getMessage());
    meterRegistry
        .counter("chat.retries", "category", classified.category().name().toLowerCase())
        .increment();

    ChatStreamEvent notice =
        new ChatStreamEvent.Retry(
            retryNumber, maxRetries + 1, delayMs, true, classified.category(), classified.message());
    Flux<ChatStreamEvent> next =
        Mono.delay(Duration.ofMillis(delayMs))
            .takeUntilOther(token.whenCancelled())
            .flatMapMany(tick -> attempt(attempts, token, attempt + 1));
    return Flux.concat(Flux.just(notice), next);
  }

  /** Carries an in-band failure event through the error channel. */
  private static final class FailureSignal extends RuntimeException {

    private final transient ChatStreamEvent.Failure failure;

    private FailureSignal(ChatStreamEvent.Failure failure) {
      super(failure.message(), failure.cause(), false, false);
      this.failure = failure;
    }
  }
}
