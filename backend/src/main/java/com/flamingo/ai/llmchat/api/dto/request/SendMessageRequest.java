package com.flamingo.ai.llmchat.api.dto.request;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Request DTO for sending a chat message. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SendMessageRequest {

  @NotBlank(message = "Message is required")
  @Size(max = 100000, message = "Message must not exceed 100000 characters")
  private String message;
}
