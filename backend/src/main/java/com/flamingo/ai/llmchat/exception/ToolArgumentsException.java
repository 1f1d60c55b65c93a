package com.flamingo.ai.llmchat.exception;

/** Exception thrown when tool call arguments are not a valid JSON object. */
public class ToolArgumentsException extends RuntimeException {

  private final String toolName;

  public ToolArgumentsException(String toolName, Throwable cause) {
    super("Failed to parse tool arguments as JSON for tool: " + toolName, cause);
    this.toolName = toolName;
  }

  public String getToolName() {
    return toolName;
  }
}
