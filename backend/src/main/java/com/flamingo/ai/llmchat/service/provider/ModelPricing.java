package com.flamingo.ai.llmchat.service.provider;

/** Prices in currency units per million tokens. */
public record ModelPricing(double inputPerMillion, double outputPerMillion) {

  /** Cost of a completion with the given token counts. */
  public double costOf(int promptTokens, int completionTokens) {
    return (promptTokens / 1_000_000.0) * inputPerMillion
        + (completionTokens / 1_000_000.0) * outputPerMillion;
  }
}
