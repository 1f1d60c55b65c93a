package com.flamingo.ai.llmchat.domain.repository;

import com.flamingo.ai.llmchat.domain.entity.ChatMessage;
import java.util.List;
import java.util.UUID;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

/** Repository for ChatMessage entities. */
@Repository
public interface ChatMessageRepository extends JpaRepository<ChatMessage, UUID> {

  /** Finds all messages of a conversation in append order. */
  List<ChatMessage> findByConversationIdOrderBySequenceAsc(String conversationId);

  /** Counts messages of a conversation. */
  long countByConversationId(String conversationId);

  /** Deletes all messages of a conversation. */
  void deleteByConversationId(String conversationId);
}
