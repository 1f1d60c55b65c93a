package com.flamingo.ai.llmchat.service.stream;

import java.util.Optional;
import java.util.concurrent.atomic.AtomicReference;
import reactor.core.publisher.Mono;
import reactor.core.publisher.Sinks;

/**
 * One-shot cancellation signal for a single generation. Pipelines, backoff sleeps and tool calls
 * all stop on {@link #whenCancelled()}.
 */
public final class CancellationToken {

  private final AtomicReference<String> reason = new AtomicReference<>();
  private final Sinks.One<String> signal = Sinks.one();

  public static CancellationToken create() {
    return new CancellationToken();
  }

  /**
   * Requests cancellation. Only the first call has an effect.
   *
   * @return true if this call cancelled the token
   */
  public boolean cancel(String why) {
    String value = why != null ? why : "cancelled";
    if (!reason.compareAndSet(null, value)) {
      return false;
    }
    signal.tryEmitValue(value);
    return true;
  }

  public boolean isCancelled() {
    return reason.get() != null;
  }

  public Optional<String> reason() {
    return Optional.ofNullable(reason.get());
  }

  /** Emits the reason once cancelled; never completes otherwise. */
  public Mono<String> whenCancelled() {
    return signal.asMono();
  }
}
