package com.flamingo.ai.llmchat.domain.repository;

import com.flamingo.ai.llmchat.domain.entity.Conversation;
import java.util.List;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

/** Repository for Conversation entities. */
@Repository
public interface ConversationRepository extends JpaRepository<Conversation, String> {

  /** Finds all conversations, most recently updated first. */
  List<Conversation> findAllByOrderByUpdatedAtDesc();
}
