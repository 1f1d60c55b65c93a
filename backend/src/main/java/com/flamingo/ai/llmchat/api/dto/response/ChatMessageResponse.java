package com.flamingo.ai.llmchat.api.dto.response;

import com.flamingo.ai.llmchat.domain.entity.ChatMessage;
import com.flamingo.ai.llmchat.domain.enums.MessageRole;
import java.time.LocalDateTime;
import java.util.UUID;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Response DTO for chat message data. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ChatMessageResponse {

  private UUID id;
  private long sequence;
  private MessageRole role;
  private String content;
  private String reasoning;
  private String toolCallsJson;
  private String toolCallId;
  private String toolName;
  private String modelId;
  private Integer promptTokens;
  private Integer completionTokens;
  private Double cost;
  private LocalDateTime createdAt;

  /** Creates a ChatMessageResponse from a ChatMessage entity. */
  public static ChatMessageResponse fromEntity(ChatMessage message) {
    return ChatMessageResponse.builder()
        .id(message.getId())
        .sequence(message.getSequence())
        .role(message.getRole())
        .content(message.getContent())
        .reasoning(message.getReasoning())
        .toolCallsJson(message.getToolCallsJson())
        .toolCallId(message.getToolCallId())
        .toolName(message.getToolName())
        .modelId(message.getModelId())
        .promptTokens(message.getPromptTokens())
        .completionTokens(message.getCompletionTokens())
        .cost(message.getCost())
        .createdAt(message.getCreatedAt())
        .build();
  }
}
