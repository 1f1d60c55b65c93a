package com.flamingo.ai.llmchat.api.dto.response;

import com.flamingo.ai.llmchat.domain.entity.ProviderInstance;
import com.flamingo.ai.llmchat.domain.enums.ProviderType;
import java.time.LocalDateTime;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Response DTO for a provider instance. The API key is never returned. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ProviderResponse {

  private String id;
  private String name;
  private ProviderType type;
  private String baseUrl;
  private boolean hasApiKey;
  private boolean enabled;
  private LocalDateTime lastUsedAt;
  private String lastModelId;
  private LocalDateTime createdAt;

  public static ProviderResponse fromEntity(ProviderInstance instance) {
    return ProviderResponse.builder()
        .id(instance.getId())
        .name(instance.getName())
        .type(instance.getType())
        .baseUrl(instance.getBaseUrl())
        .hasApiKey(instance.getApiKey() != null && !instance.getApiKey().isBlank())
        .enabled(instance.isEnabled())
        .lastUsedAt(instance.getLastUsedAt())
        .lastModelId(instance.getLastModelId())
        .createdAt(instance.getCreatedAt())
        .build();
  }
}
