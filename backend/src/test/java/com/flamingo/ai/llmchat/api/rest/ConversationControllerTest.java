package com.flamingo.ai.llmchat.api.rest;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.delete;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import com.flamingo.ai.llmchat.domain.entity.ChatMessage;
import com.flamingo.ai.llmchat.domain.entity.Conversation;
import com.flamingo.ai.llmchat.domain.enums.MessageRole;
import com.flamingo.ai.llmchat.exception.ConversationNotFoundException;
import com.flamingo.ai.llmchat.exception.GlobalExceptionHandler;
import com.flamingo.ai.llmchat.service.conversation.ConversationStore;
import com.flamingo.ai.llmchat.service.session.ChatSessionManager;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.mockito.junit.jupiter.MockitoSettings;
import org.mockito.quality.Strictness;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

@ExtendWith(MockitoExtension.class)
@MockitoSettings(strictness = Strictness.LENIENT)
@DisplayName("ConversationController Tests")
class ConversationControllerTest {

  private MockMvc mockMvc;

  @Mock private ConversationStore conversationStore;
  @Mock private ChatSessionManager sessionManager;

  private Conversation conversation;

  @BeforeEach
  void setUp() {
    mockMvc =
        MockMvcBuilders.standaloneSetup(new ConversationController(conversationStore, sessionManager))
            .setControllerAdvice(new GlobalExceptionHandler(new SimpleMeterRegistry()))
            .build();
    conversation =
        Conversation.builder().id("c1").title("Chat").providerInstanceId("p1").modelId("m1").build();
  }

  @Test
  @DisplayName("Should create a conversation")
  void shouldCreateConversation() throws Exception {
    when(sessionManager.createConversation("p1", "m1", null)).thenReturn(conversation);

    mockMvc
        .perform(
            post("/api/conversations")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"providerInstanceId\":\"p1\",\"modelId\":\"m1\"}"))
        .andExpect(status().isCreated())
        .andExpect(jsonPath("$.id").value("c1"))
        .andExpect(jsonPath("$.active").value(false));
  }

  @Test
  void shouldRequireModel() throws Exception {
    mockMvc
        .perform(
            post("/api/conversations")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"providerInstanceId\":\"p1\"}"))
        .andExpect(status().isBadRequest());
  }

  @Test
  @DisplayName("Should flag conversations with a live session")
  void shouldListConversations() throws Exception {
    Conversation other = Conversation.builder().id("c2").title("Other").build();
    when(conversationStore.list()).thenReturn(List.of(conversation, other));
    when(sessionManager.getActiveSessionIds()).thenReturn(Set.of("c2"));

    mockMvc
        .perform(get("/api/conversations"))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.length()").value(2))
        .andExpect(jsonPath("$[0].active").value(false))
        .andExpect(jsonPath("$[1].active").value(true));
  }

  @Test
  void shouldReturnMessagesInOrder() throws Exception {
    when(conversationStore.get("c1")).thenReturn(Optional.of(conversation));
    when(conversationStore.messages("c1"))
        .thenReturn(
            List.of(
                ChatMessage.builder().sequence(0).role(MessageRole.USER).content("Hi").build(),
                ChatMessage.builder()
                    .sequence(1)
                    .role(MessageRole.ASSISTANT)
                    .content("Hello")
                    .build()));

    mockMvc
        .perform(get("/api/conversations/{id}/messages", "c1"))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$[0].role").value("USER"))
        .andExpect(jsonPath("$[1].content").value("Hello"));
  }

  @Test
  void shouldReturn404ForUnknownConversation() throws Exception {
    when(conversationStore.get(any())).thenReturn(Optional.empty());

    mockMvc
        .perform(get("/api/conversations/{id}", "missing"))
        .andExpect(status().isNotFound())
        .andExpect(jsonPath("$.code").value("CONVERSATION_001"));
  }

  @Test
  void shouldDeleteConversation() throws Exception {
    mockMvc.perform(delete("/api/conversations/{id}", "c1")).andExpect(status().isNoContent());

    verify(sessionManager).deleteConversation("c1");
  }

  @Test
  void shouldReturn404WhenDeletingUnknownConversation() throws Exception {
    doThrow(new ConversationNotFoundException("missing"))
        .when(sessionManager)
        .deleteConversation("missing");

    mockMvc
        .perform(delete("/api/conversations/{id}", "missing"))
        .andExpect(status().isNotFound());
  }
}
