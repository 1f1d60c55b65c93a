package com.flamingo.ai.llmchat.domain.enums;

/** Classification of provider failures, with retry policy and user-facing message. */
public enum ErrorCategory {
  AUTH(false, "Invalid API key. Please check your provider credentials."),
  BILLING(false, "Insufficient balance. Please top up your account."),
  NOT_FOUND(false, "Model not found. Please select a different model."),
  RATE_LIMIT(true, "Rate limit exceeded. Please wait a moment and try again."),
  SERVER(true, "The provider is experiencing issues. Please try again later."),
  NETWORK(true, "Network error. Please check your connection."),
  TIMEOUT(true, "The request timed out. Please try again."),
  CANCELLED(false, "Request was cancelled."),
  UNKNOWN(false, "An unexpected error occurred.");

  private final boolean retryable;
  private final String userMessage;

  ErrorCategory(boolean retryable, String userMessage) {
    this.retryable = retryable;
    this.userMessage = userMessage;
  }

  public boolean isRetryable() {
    return retryable;
  }

  public String getUserMessage() {
    return userMessage;
  }
}
