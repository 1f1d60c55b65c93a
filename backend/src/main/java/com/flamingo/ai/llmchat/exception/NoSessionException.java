package com.flamingo.ai.llmchat.exception;

/** Exception thrown when an operation targets a conversation that has no live chat session. */
public class NoSessionException extends RuntimeException {

  private final String conversationId;

  public NoSessionException(String conversationId) {
    super("No active session for conversation: " + conversationId);
    this.conversationId = conversationId;
  }

  public String getConversationId() {
    return conversationId;
  }
}
