package com.flamingo.ai.llmchat.exception;

/** Exception thrown when a provider instance is unknown or disabled. */
public class ProviderInstanceNotFoundException extends RuntimeException {

  private final String providerInstanceId;

  public ProviderInstanceNotFoundException(String providerInstanceId) {
    super("Provider instance not found: " + providerInstanceId);
    this.providerInstanceId = providerInstanceId;
  }

  public String getProviderInstanceId() {
    return providerInstanceId;
  }
}
