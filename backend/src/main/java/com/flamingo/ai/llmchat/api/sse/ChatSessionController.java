package com.flamingo.ai.llmchat.api.sse;

import com.flamingo.ai.llmchat.api.dto.request.SendMessageRequest;
import com.flamingo.ai.llmchat.exception.NoSessionException;
import com.flamingo.ai.llmchat.service.session.ChatSessionManager;
import com.flamingo.ai.llmchat.service.session.ChatSessionSnapshot;
import io.micrometer.core.instrument.MeterRegistry;
import jakarta.validation.Valid;
import java.util.concurrent.atomic.AtomicInteger;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Flux;

/**
 * Live chat session endpoints. Each SSE subscriber is one viewer of the session; commands return
 * immediately and their effect arrives on the snapshot stream.
 */
@RestController
@RequestMapping("/api/conversations/{conversationId}/session")
@Slf4j
public class ChatSessionController {

  private final ChatSessionManager sessionManager;
  private final AtomicInteger activeConnections;

  public ChatSessionController(ChatSessionManager sessionManager, MeterRegistry meterRegistry) {
    this.sessionManager = sessionManager;
    this.activeConnections = meterRegistry.gauge("sse.connections.active", new AtomicInteger(0));
  }

  /**
   * Opens a viewer and streams session snapshots until the client disconnects.
   *
   * @param conversationId the conversation
   * @param providerInstanceId optional provider selection
   * @param modelId optional model selection
   * @return the current snapshot followed by every change
   */
  @GetMapping(value = "/stream", produces = MediaType.TEXT_EVENT_STREAM_VALUE)
  public Flux<ChatSessionSnapshot> stream(
      @PathVariable String conversationId,
      @RequestParam(required = false) String providerInstanceId,
      @RequestParam(required = false) String modelId) {
    return Flux.defer(
        () -> {
          sessionManager.open(conversationId, providerInstanceId, modelId);
          activeConnections.incrementAndGet();
          log.debug("Viewer connected to {}", conversationId);
          return sessionManager
              .watch(conversationId)
              .doFinally(
                  signal -> {
                    activeConnections.decrementAndGet();
                    log.debug("Viewer of {} disconnected ({})", conversationId, signal);
                    sessionManager.close(conversationId);
                  });
        });
  }

  @GetMapping
  public ResponseEntity<ChatSessionSnapshot> getSession(@PathVariable String conversationId) {
    return ResponseEntity.ok(
        sessionManager
            .getSession(conversationId)
            .orElseThrow(() -> new NoSessionException(conversationId)));
  }

  /** Appends a user message and starts generating; progress is streamed to viewers. */
  @PostMapping("/messages")
  public ResponseEntity<Void> sendMessage(
      @PathVariable String conversationId, @Valid @RequestBody SendMessageRequest request) {
    sessionManager.sendMessage(conversationId, request.getMessage());
    return ResponseEntity.accepted().build();
  }

  @PostMapping("/stop")
  public ResponseEntity<Void> stop(@PathVariable String conversationId) {
    sessionManager.stopGeneration(conversationId);
    return ResponseEntity.noContent().build();
  }

  /** Regenerates from the stored history, e.g. after a stop. */
  @PostMapping("/resume")
  public ResponseEntity<Void> resume(@PathVariable String conversationId) {
    sessionManager.startGeneration(conversationId);
    return ResponseEntity.accepted().build();
  }
}
