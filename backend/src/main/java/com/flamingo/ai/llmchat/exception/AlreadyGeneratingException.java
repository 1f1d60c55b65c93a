package com.flamingo.ai.llmchat.exception;

/** Exception thrown when a message is sent while a generation is still running. */
public class AlreadyGeneratingException extends RuntimeException {

  private final String conversationId;

  public AlreadyGeneratingException(String conversationId) {
    super("Generation already in progress for conversation: " + conversationId);
    this.conversationId = conversationId;
  }

  public String getConversationId() {
    return conversationId;
  }
}
