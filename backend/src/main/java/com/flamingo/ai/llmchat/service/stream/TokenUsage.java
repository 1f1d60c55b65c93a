package com.flamingo.ai.llmchat.service.stream;

/** Token counts reported by a provider for one completion. */
public record TokenUsage(int promptTokens, int completionTokens) {

  public int totalTokens() {
    return promptTokens + completionTokens;
  }
}
