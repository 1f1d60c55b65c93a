package com.flamingo.ai.llmchat.service.retry;

import com.flamingo.ai.llmchat.domain.enums.ErrorCategory;

/**
 * A failure mapped onto the error taxonomy.
 *
 * @param category the taxonomy bucket
 * @param message user-facing message
 * @param status HTTP status when one was reported, otherwise null
 * @param retryAfterMs provider-suggested delay, otherwise null
 * @param cause the original failure, may be null
 */
public record ClassifiedError(
    ErrorCategory category, String message, Integer status, Long retryAfterMs, Throwable cause) {

  public boolean retryable() {
    return category.isRetryable();
  }
}
