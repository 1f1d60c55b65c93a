package com.flamingo.ai.llmchat.service.conversation;

import com.flamingo.ai.llmchat.domain.entity.ChatMessage;
import com.flamingo.ai.llmchat.domain.entity.Conversation;
import java.util.List;
import java.util.Optional;

/**
 * Durable, append-only message log per conversation. Callers serialize writers per conversation;
 * the store does no locking of its own.
 */
public interface ConversationStore {

  Optional<Conversation> get(String conversationId);

  /** All conversations, most recently updated first. */
  List<Conversation> list();

  /** Messages of a conversation in append order. */
  List<ChatMessage> messages(String conversationId);

  /**
   * Appends a message and adds its usage and cost to the conversation totals.
   *
   * @throws com.flamingo.ai.llmchat.exception.ConversationNotFoundException if absent
   */
  ChatMessage append(String conversationId, ChatMessage message);

  /** Creates a conversation; a blank title becomes the default title. */
  Conversation create(String providerInstanceId, String modelId, String title);

  void delete(String conversationId);

  void updateTitle(String conversationId, String title);

  Conversation updateMetadata(String conversationId, ConversationPatch patch);
}
