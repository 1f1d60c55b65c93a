package com.flamingo.ai.llmchat.exception;

/** Exception thrown when an LLM provider answers with an error status. */
public class ProviderException extends RuntimeException {

  private final int status;
  private final String retryAfter;
  private final String userMessage;

  public ProviderException(int status, String retryAfter, String message) {
    super(message);
    this.status = status;
    this.retryAfter = retryAfter;
    this.userMessage =
        status == 429
            ? "Service is temporarily busy. Please try again in a moment."
            : "AI service is temporarily unavailable. Please try again later.";
  }

  public ProviderException(int status, String message, Throwable cause) {
    super(message, cause);
    this.status = status;
    this.retryAfter = null;
    this.userMessage = "AI service is temporarily unavailable. Please try again later.";
  }

  /** HTTP status reported by the provider, or 0 when none was available. */
  public int getStatus() {
    return status;
  }

  /** Raw Retry-After header value, may be null. */
  public String getRetryAfter() {
    return retryAfter;
  }

  public String getUserMessage() {
    return userMessage;
  }
}
