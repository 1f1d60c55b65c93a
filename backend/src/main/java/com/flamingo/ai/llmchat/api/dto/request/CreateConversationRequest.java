package com.flamingo.ai.llmchat.api.dto.request;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Request DTO for creating a conversation. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CreateConversationRequest {

  @NotBlank(message = "Provider instance is required")
  private String providerInstanceId;

  @NotBlank(message = "Model is required")
  private String modelId;

  /** Optional; a blank title falls back to the default. */
  @Size(max = 255, message = "Title must not exceed 255 characters")
  private String title;
}
