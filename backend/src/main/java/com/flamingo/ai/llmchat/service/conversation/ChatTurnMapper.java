package com.flamingo.ai.llmchat.service.conversation;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.flamingo.ai.llmchat.domain.entity.ChatMessage;
import com.flamingo.ai.llmchat.domain.entity.Conversation;
import com.flamingo.ai.llmchat.service.provider.ChatTurn;
import com.flamingo.ai.llmchat.service.stream.ToolCall;
import java.util.ArrayList;
import java.util.List;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

/** Converts stored messages into provider turns and tool calls to and from their JSON column. */
@Component
@RequiredArgsConstructor
public class ChatTurnMapper {

  private static final TypeReference<List<ToolCall>> TOOL_CALLS_TYPE = new TypeReference<>() {};

  private final ObjectMapper objectMapper;

  /** Builds the provider history: the system prompt (if any) followed by every stored message. */
  public List<ChatTurn> toTurns(Conversation conversation, List<ChatMessage> messages) {
    List<ChatTurn> turns = new ArrayList<>();
    if (conversation != null
        && conversation.getSystemPrompt() != null
        && !conversation.getSystemPrompt().isBlank()) {
      turns.add(ChatTurn.system(conversation.getSystemPrompt()));
    }
    for (ChatMessage message : messages) {
      turns.add(
          new ChatTurn(
              message.getRole(),
              message.getContent(),
              readToolCalls(message.getToolCallsJson()),
              message.getToolCallId(),
              message.getToolName()));
    }
    return turns;
  }

  public List<ToolCall> readToolCalls(String json) {
    if (json == null || json.isBlank()) {
      return List.of();
    }
    try {
      return objectMapper.readValue(json, TOOL_CALLS_TYPE);
    } catch (JsonProcessingException e) {
      throw new IllegalStateException("Stored tool calls are not valid JSON", e);
    }
  }

  /** Serializes tool calls; null when there are none. */
  public String writeToolCalls(List<ToolCall> toolCalls) {
    if (toolCalls == null || toolCalls.isEmpty()) {
      return null;
    }
    try {
      return objectMapper.writeValueAsString(toolCalls);
    } catch (JsonProcessingException e) {
      throw new IllegalStateException("Cannot serialize tool calls", e);
    }
  }
}
