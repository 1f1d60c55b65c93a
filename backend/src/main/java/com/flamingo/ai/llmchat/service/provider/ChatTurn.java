package com.flamingo.ai.llmchat.service.provider;

import com.flamingo.ai.llmchat.domain.enums.MessageRole;
import com.flamingo.ai.llmchat.service.stream.ToolCall;
import java.util.List;

/** One role/content turn of the history sent to a provider. */
public record ChatTurn(
    MessageRole role, String content, List<ToolCall> toolCalls, String toolCallId, String toolName) {

  public ChatTurn {
    content = content != null ? content : "";
    toolCalls = toolCalls != null ? List.copyOf(toolCalls) : List.of();
  }

  public static ChatTurn system(String content) {
    return new ChatTurn(MessageRole.SYSTEM, content, null, null, null);
  }

  public static ChatTurn user(String content) {
    return new ChatTurn(MessageRole.USER, content, null, null, null);
  }

  public static ChatTurn assistant(String content, List<ToolCall> toolCalls) {
    return new ChatTurn(MessageRole.ASSISTANT, content, toolCalls, null, null);
  }

  public static ChatTurn tool(String toolCallId, String toolName, String content) {
    return new ChatTurn(MessageRole.TOOL, content, null, toolCallId, toolName);
  }

  public boolean hasToolCalls() {
    return !toolCalls.isEmpty();
  }
}
