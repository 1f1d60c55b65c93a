package com.flamingo.ai.llmchat.service.session;

import com.flamingo.ai.llmchat.domain.enums.ErrorCategory;
import com.flamingo.ai.llmchat.domain.enums.TerminalReason;
import com.flamingo.ai.llmchat.service.stream.TokenUsage;
import java.time.Instant;
import lombok.Builder;
import lombok.Value;

/** Immutable view of a chat session, broadcast to every viewer after each change. */
@Value
@Builder
public class ChatSessionSnapshot {

  String conversationId;
  String providerInstanceId;
  String modelId;
  boolean loading;

  /** Assistant text streamed so far in the current turn. */
  String streamingContent;

  String reasoningContent;

  /** Cost accumulated by this session since it was opened. */
  double sessionCost;

  TokenUsage lastUsage;
  int viewerCount;
  String lastError;
  ErrorCategory lastErrorCategory;

  /** Null while running, after a stop, or for a fresh session. */
  TerminalReason terminalReason;

  RetryStatus retry;
  Instant lastActivity;

  /** True when the session is idle and the last generation was interrupted rather than ended. */
  public boolean isResumable() {
    return !loading && terminalReason == null;
  }
}
