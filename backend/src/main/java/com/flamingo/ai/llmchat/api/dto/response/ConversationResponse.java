package com.flamingo.ai.llmchat.api.dto.response;

import com.flamingo.ai.llmchat.domain.entity.Conversation;
import java.time.LocalDateTime;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Response DTO for conversation data. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ConversationResponse {

  private String id;
  private String title;
  private String providerInstanceId;
  private String modelId;
  private long promptTokens;
  private long completionTokens;
  private double totalCost;
  private boolean active;
  private LocalDateTime createdAt;
  private LocalDateTime updatedAt;

  /** Creates a ConversationResponse from a Conversation entity. */
  public static ConversationResponse fromEntity(Conversation conversation, boolean active) {
    return ConversationResponse.builder()
        .id(conversation.getId())
        .title(conversation.getTitle())
        .providerInstanceId(conversation.getProviderInstanceId())
        .modelId(conversation.getModelId())
        .promptTokens(conversation.getPromptTokens())
        .completionTokens(conversation.getCompletionTokens())
        .totalCost(conversation.getTotalCost())
        .active(active)
        .createdAt(conversation.getCreatedAt())
        .updatedAt(conversation.getUpdatedAt())
        .build();
  }
}
