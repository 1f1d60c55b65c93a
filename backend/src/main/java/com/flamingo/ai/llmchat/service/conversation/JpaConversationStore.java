package com.flamingo.ai.llmchat.service.conversation;

import com.flamingo.ai.llmchat.domain.entity.ChatMessage;
import com.flamingo.ai.llmchat.domain.entity.Conversation;
import com.flamingo.ai.llmchat.domain.repository.ChatMessageRepository;
import com.flamingo.ai.llmchat.domain.repository.ConversationRepository;
import com.flamingo.ai.llmchat.exception.ConversationNotFoundException;
import io.micrometer.core.annotation.Timed;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/** JPA-backed conversation store. */
@Service
@RequiredArgsConstructor
@Slf4j
public class JpaConversationStore implements ConversationStore {

  private final ConversationRepository conversationRepository;
  private final ChatMessageRepository chatMessageRepository;

  @Override
  @Transactional(readOnly = true)
  public Optional<Conversation> get(String conversationId) {
    return conversationRepository.findById(conversationId);
  }

  @Override
  @Transactional(readOnly = true)
  public List<Conversation> list() {
    return conversationRepository.findAllByOrderByUpdatedAtDesc();
  }

  @Override
  @Transactional(readOnly = true)
  @Timed(value = "conversation.messages", description = "Time to load conversation messages")
  public List<ChatMessage> messages(String conversationId) {
    return chatMessageRepository.findByConversationIdOrderBySequenceAsc(conversationId);
  }

  @Override
  @Transactional
  @Timed(value = "conversation.append", description = "Time to append a message")
  public ChatMessage append(String conversationId, ChatMessage message) {
    Conversation conversation = findOrThrow(conversationId);
    message.setConversation(conversation);
    message.setSequence(chatMessageRepository.countByConversationId(conversationId));
    ChatMessage saved = chatMessageRepository.save(message);

    conversation.addUsage(message.getPromptTokens(), message.getCompletionTokens(), message.getCost());
    conversationRepository.save(conversation);

    log.debug(
        "Appended {} message #{} to conversation {}",
        saved.getRole(),
        saved.getSequence(),
        conversationId);
    return saved;
  }

  @Override
  @Transactional
  public Conversation create(String providerInstanceId, String modelId, String title) {
    Conversation conversation =
        Conversation.builder()
            .id(UUID.randomUUID().toString())
            .title(title != null && !title.isBlank() ? title : Conversation.DEFAULT_TITLE)
            .providerInstanceId(providerInstanceId)
            .modelId(modelId)
            .build();
    Conversation saved = conversationRepository.save(conversation);
    log.info("Created conversation {}", saved.getId());
    return saved;
  }

  @Override
  @Transactional
  public void delete(String conversationId) {
    Conversation conversation = findOrThrow(conversationId);
    chatMessageRepository.deleteByConversationId(conversationId);
    conversationRepository.delete(conversation);
    log.info("Deleted conversation {}", conversationId);
  }

  @Override
  @Transactional
  public void updateTitle(String conversationId, String title) {
    Conversation conversation = findOrThrow(conversationId);
    conversation.setTitle(title);
    conversationRepository.save(conversation);
  }

  @Override
  @Transactional
  public Conversation updateMetadata(String conversationId, ConversationPatch patch) {
    Conversation conversation = findOrThrow(conversationId);
    if (patch.getTitle() != null) {
      conversation.setTitle(patch.getTitle());
    }
    if (patch.getProviderInstanceId() != null) {
      conversation.setProviderInstanceId(patch.getProviderInstanceId());
    }
    if (patch.getModelId() != null) {
      conversation.setModelId(patch.getModelId());
    }
    if (patch.getSystemPrompt() != null) {
      conversation.setSystemPrompt(patch.getSystemPrompt());
    }
    return conversationRepository.save(conversation);
  }

  private Conversation findOrThrow(String conversationId) {
    return conversationRepository
        .findById(conversationId)
        .orElseThrow(() -> new ConversationNotFoundException(conversationId));
  }
}
