package com.flamingo.ai.llmchat.api.rest;

import com.flamingo.ai.llmchat.api.dto.request.CreateConversationRequest;
import com.flamingo.ai.llmchat.api.dto.response.ChatMessageResponse;
import com.flamingo.ai.llmchat.api.dto.response.ConversationResponse;
import com.flamingo.ai.llmchat.domain.entity.Conversation;
import com.flamingo.ai.llmchat.exception.ConversationNotFoundException;
import com.flamingo.ai.llmchat.service.conversation.ConversationStore;
import com.flamingo.ai.llmchat.service.session.ChatSessionManager;
import jakarta.validation.Valid;
import java.util.List;
import java.util.Set;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/** REST controller for conversations and their stored messages. */
@RestController
@RequestMapping("/api/conversations")
@RequiredArgsConstructor
public class ConversationController {

  private final ConversationStore conversationStore;
  private final ChatSessionManager sessionManager;

  /** Creates a new conversation. */
  @PostMapping
  public ResponseEntity<ConversationResponse> createConversation(
      @Valid @RequestBody CreateConversationRequest request) {
    Conversation conversation =
        sessionManager.createConversation(
            request.getProviderInstanceId(), request.getModelId(), request.getTitle());
    return ResponseEntity.status(HttpStatus.CREATED)
        .body(ConversationResponse.fromEntity(conversation, false));
  }

  /** Gets all conversations, most recently updated first. */
  @GetMapping
  public ResponseEntity<List<ConversationResponse>> getAllConversations() {
    Set<String> active = sessionManager.getActiveSessionIds();
    List<ConversationResponse> responses =
        conversationStore.list().stream()
            .map(c -> ConversationResponse.fromEntity(c, active.contains(c.getId())))
            .toList();
    return ResponseEntity.ok(responses);
  }

  @GetMapping("/{conversationId}")
  public ResponseEntity<ConversationResponse> getConversation(
      @PathVariable String conversationId) {
    Conversation conversation =
        conversationStore
            .get(conversationId)
            .orElseThrow(() -> new ConversationNotFoundException(conversationId));
    boolean active = sessionManager.getSession(conversationId).isPresent();
    return ResponseEntity.ok(ConversationResponse.fromEntity(conversation, active));
  }

  /** Gets the stored messages of a conversation in append order. */
  @GetMapping("/{conversationId}/messages")
  public ResponseEntity<List<ChatMessageResponse>> getMessages(
      @PathVariable String conversationId) {
    if (conversationStore.get(conversationId).isEmpty()) {
      throw new ConversationNotFoundException(conversationId);
    }
    List<ChatMessageResponse> response =
        conversationStore.messages(conversationId).stream()
            .map(ChatMessageResponse::fromEntity)
            .toList();
    return ResponseEntity.ok(response);
  }

  /** Deletes a conversation, cancelling any running generation. */
  @DeleteMapping("/{conversationId}")
  public ResponseEntity<Void> deleteConversation(@PathVariable String conversationId) {
    sessionManager.deleteConversation(conversationId);
    return ResponseEntity.noContent().build();
  }
}
