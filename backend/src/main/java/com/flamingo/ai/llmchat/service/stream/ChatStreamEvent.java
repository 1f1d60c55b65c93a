package com.flamingo.ai.llmchat.service.stream;

import com.flamingo.ai.llmchat.domain.enums.ErrorCategory;

/**
 * Typed event produced while streaming one chat completion. A run ends with at most one terminal
 * event ({@link Done} or {@link Failure}); a run that ends without one was cancelled.
 */
public sealed interface ChatStreamEvent {

  /** Whether this event ends the run. */
  default boolean isTerminal() {
    return false;
  }

  /** Text delta of the assistant answer. */
  record Token(String text) implements ChatStreamEvent {}

  /** Delta of the model's reasoning output, kept apart from the answer. */
  record Reasoning(String text) implements ChatStreamEvent {}

  /**
   * Partial tool call. Fragments sharing an index belong to the same call; the id and name usually
   * arrive once and the arguments text arrives in pieces.
   */
  record ToolCallFragment(int index, String callId, String functionName, String argumentsFragment)
      implements ChatStreamEvent {}

  /** Normal completion. Cost is only set when the provider reported one. */
  record Done(TokenUsage usage, String finishReason, String model, Double cost)
      implements ChatStreamEvent {
    @Override
    public boolean isTerminal() {
      return true;
    }
  }

  /** Failed completion. Category is null until the failure has been classified. */
  record Failure(String message, ErrorCategory category, Throwable cause)
      implements ChatStreamEvent {
    @Override
    public boolean isTerminal() {
      return true;
    }
  }

  /** Announces that a failed attempt will be retried after {@code delayMs}. */
  record Retry(
      int attempt,
      int maxAttempts,
      long delayMs,
      boolean retryable,
      ErrorCategory category,
      String message)
      implements ChatStreamEvent {}

  static ChatStreamEvent token(String text) {
    return new Token(text);
  }

  static ChatStreamEvent reasoning(String text) {
    return new Reasoning(text);
  }

  static ChatStreamEvent toolCallFragment(
      int index, String callId, String functionName, String argumentsFragment) {
    return new ToolCallFragment(index, callId, functionName, argumentsFragment);
  }

  static ChatStreamEvent done(TokenUsage usage, String finishReason, String model, Double cost) {
    return new Done(usage, finishReason, model, cost);
  }

  static ChatStreamEvent failure(String message) {
    return new Failure(message, null, null);
  }

  static ChatStreamEvent failure(String message, ErrorCategory category, Throwable cause) {
    return new Failure(message, category, cause);
  }
}
