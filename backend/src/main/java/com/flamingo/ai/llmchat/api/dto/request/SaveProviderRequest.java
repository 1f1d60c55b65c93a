package com.flamingo.ai.llmchat.api.dto.request;

import com.flamingo.ai.llmchat.domain.enums.ProviderType;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Request DTO for creating or updating a provider instance. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SaveProviderRequest {

  @NotBlank(message = "Name is required")
  @Size(max = 100, message = "Name must not exceed 100 characters")
  private String name;

  @NotNull(message = "Provider type is required")
  private ProviderType type;

  @NotBlank(message = "Base URL is required")
  private String baseUrl;

  /** Write-only. On update, null keeps the stored key. */
  private String apiKey;

  private Boolean enabled;
}
