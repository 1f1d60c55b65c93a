package com.flamingo.ai.llmchat.service.session;

import com.flamingo.ai.llmchat.domain.enums.ErrorCategory;

/** Retry in progress, shown to viewers while the backoff sleep runs. */
public record RetryStatus(
    int attempt, int maxAttempts, long delayMs, ErrorCategory category, String message) {}
