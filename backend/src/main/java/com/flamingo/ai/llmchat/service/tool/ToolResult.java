package com.flamingo.ai.llmchat.service.tool;

/** Outcome of one tool execution. {@code content} is sent back to the model on success. */
public record ToolResult(boolean success, String content, String error) {

  public static ToolResult success(String content) {
    return new ToolResult(true, content, null);
  }

  public static ToolResult failure(String error) {
    return new ToolResult(false, "", error);
  }
}
