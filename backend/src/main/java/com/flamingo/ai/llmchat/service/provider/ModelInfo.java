package com.flamingo.ai.llmchat.service.provider;

import java.util.regex.Pattern;

/** A model offered by a provider instance. Pricing is null when the provider does not publish it. */
public record ModelInfo(String id, String name, Integer contextLength, ModelPricing pricing) {

  private static final Pattern VENDOR_PREFIX =
      Pattern.compile("^(openai/|anthropic/|google/|meta-llama/|mistralai/)");
  private static final Pattern DATE_SUFFIX = Pattern.compile("-\\d{4}-\\d{2}-\\d{2}$");
  private static final Pattern FREE_SUFFIX = Pattern.compile(":free$");

  /** Builds a display name from a raw model id: strips vendor prefix and date suffix. */
  public static String displayName(String modelId) {
    String name = VENDOR_PREFIX.matcher(modelId).replaceFirst("");
    name = DATE_SUFFIX.matcher(name).replaceFirst("");
    return FREE_SUFFIX.matcher(name).replaceFirst(" (Free)");
  }
}
