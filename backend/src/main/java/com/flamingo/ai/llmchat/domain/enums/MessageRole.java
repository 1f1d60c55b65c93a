package com.flamingo.ai.llmchat.domain.enums;

/** Defines the role of a chat message sender. */
public enum MessageRole {
  /** Message from the user. */
  USER,

  /** Message from the AI assistant, possibly carrying tool calls. */
  ASSISTANT,

  /** System message (instructions). */
  SYSTEM,

  /** Result of a tool execution, linked to the call that produced it. */
  TOOL
}
