package com.flamingo.ai.llmchat.service.session;

import com.flamingo.ai.llmchat.domain.enums.ErrorCategory;
import com.flamingo.ai.llmchat.domain.enums.MessageRole;
import java.time.Instant;
import lombok.Builder;
import lombok.Value;

/** Change notification published on the registry-wide event stream. */
@Value
@Builder
public class ChatSessionEvent {

  /** Kind of change. */
  public enum Type {
    MESSAGE_ADDED,
    LOADING_CHANGED,
    STREAMING_UPDATE,
    RETRYING,
    ERROR
  }

  Type type;
  String conversationId;

  /** Event payload, one of the nested data records. */
  Object data;

  Instant timestamp;

  public static ChatSessionEvent messageAdded(
      String conversationId, String messageId, MessageRole role) {
    return of(Type.MESSAGE_ADDED, conversationId, new MessageData(messageId, role));
  }

  public static ChatSessionEvent loadingChanged(String conversationId, boolean loading) {
    return of(Type.LOADING_CHANGED, conversationId, new LoadingData(loading));
  }

  public static ChatSessionEvent streamingUpdate(String conversationId, String content) {
    return of(Type.STREAMING_UPDATE, conversationId, new StreamingData(content));
  }

  public static ChatSessionEvent retrying(String conversationId, RetryStatus retry) {
    return of(Type.RETRYING, conversationId, retry);
  }

  public static ChatSessionEvent error(
      String conversationId, String message, ErrorCategory category) {
    return of(Type.ERROR, conversationId, new ErrorData(message, category));
  }

  private static ChatSessionEvent of(Type type, String conversationId, Object data) {
    return ChatSessionEvent.builder()
        .type(type)
        .conversationId(conversationId)
        .data(data)
        .timestamp(Instant.now())
        .build();
  }

  /** A message was appended to the store. */
  public record MessageData(String messageId, MessageRole role) {}

  public record LoadingData(boolean loading) {}

  /** Full streamed text of the current turn. */
  public record StreamingData(String content) {}

  public record ErrorData(String message, ErrorCategory category) {}
}
