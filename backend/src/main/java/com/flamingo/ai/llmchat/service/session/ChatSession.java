package com.flamingo.ai.llmchat.service.session;

import com.flamingo.ai.llmchat.domain.enums.ErrorCategory;
import com.flamingo.ai.llmchat.domain.enums.TerminalReason;
import com.flamingo.ai.llmchat.exception.AlreadyGeneratingException;
import com.flamingo.ai.llmchat.service.stream.CancellationToken;
import com.flamingo.ai.llmchat.service.stream.TokenUsage;
import com.flamingo.ai.llmchat.service.stream.ToolCall;
import java.time.Clock;
import java.util.List;
import lombok.extern.slf4j.Slf4j;
import reactor.core.Disposable;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Sinks;

/**
 * Mutable state of one live session. Every mutation holds the instance monitor and publishes the
 * resulting snapshot before releasing it, so all viewers see the same ordered sequence.
 * Generation callbacks pass their token; updates from a superseded or cancelled generation are
 * ignored.
 */
@Slf4j
final class ChatSession {

  /** Provider and model in effect when a turn starts. */
  record Selection(String providerInstanceId, String modelId) {}

  private final String conversationId;
  private final Clock clock;
  private final Sinks.Many<ChatSessionSnapshot> snapshots = Sinks.many().replay().latest();
  private final Object storeLock = new Object();

  private String providerInstanceId;
  private String modelId;
  private boolean loading;
  private final StringBuilder streamingContent = new StringBuilder();
  private final StringBuilder reasoningContent = new StringBuilder();
  private boolean turnCommitted;
  private double sessionCost;
  private TokenUsage lastUsage;
  private int viewerCount;
  private CancellationToken token;
  private String lastError;
  private ErrorCategory lastErrorCategory;
  private TerminalReason terminalReason;
  private RetryStatus retry;
  private Disposable pendingCleanup;
  private boolean destroyed;

  /** Calls of a persisted assistant turn whose results are not stored yet. */
  private List<ToolCall> pendingToolCalls = List.of();

  ChatSession(String conversationId, Clock clock) {
    this.conversationId = conversationId;
    this.clock = clock;
  }

  String getConversationId() {
    return conversationId;
  }

  Flux<ChatSessionSnapshot> watch() {
    return snapshots.asFlux();
  }

  /**
   * Serializes writes of this conversation's messages. Taken before the instance monitor, never
   * while holding it.
   */
  Object storeLock() {
    return storeLock;
  }

  synchronized ChatSessionSnapshot snapshot() {
    return ChatSessionSnapshot.builder()
        .conversationId(conversationId)
        .providerInstanceId(providerInstanceId)
        .modelId(modelId)
        .loading(loading)
        .streamingContent(streamingContent.toString())
        .reasoningContent(reasoningContent.toString())
        .sessionCost(sessionCost)
        .lastUsage(lastUsage)
        .viewerCount(viewerCount)
        .lastError(lastError)
        .lastErrorCategory(lastErrorCategory)
        .terminalReason(terminalReason)
        .retry(retry)
        .lastActivity(clock.instant())
        .build();
  }

  synchronized void attach(String providerInstanceId, String modelId) {
    viewerCount++;
    if (pendingCleanup != null) {
      pendingCleanup.dispose();
      pendingCleanup = null;
    }
    if (providerInstanceId != null) {
      this.providerInstanceId = providerInstanceId;
    }
    if (modelId != null) {
      this.modelId = modelId;
    }
    publish();
  }

  /** Drops one viewer and returns how many remain. */
  synchronized int detach() {
    viewerCount = Math.max(0, viewerCount - 1);
    publish();
    return viewerCount;
  }

  /** Keeps the cleanup task unless a viewer re-attached meanwhile, which cancels it. */
  synchronized void scheduleCleanup(Disposable task) {
    if (viewerCount > 0 || destroyed) {
      task.dispose();
      return;
    }
    if (pendingCleanup != null) {
      pendingCleanup.dispose();
    }
    pendingCleanup = task;
  }

  synchronized boolean isIdle() {
    return viewerCount == 0;
  }

  /**
   * Cancels any generation, completes the snapshot stream and returns the text streamed but not
   * yet persisted.
   */
  synchronized String destroy(String reason) {
    if (destroyed) {
      return "";
    }
    String partial = loading && !turnCommitted ? streamingContent.toString() : "";
    destroyed = true;
    loading = false;
    if (token != null) {
      token.cancel(reason);
    }
    if (pendingCleanup != null) {
      pendingCleanup.dispose();
      pendingCleanup = null;
    }
    snapshots.tryEmitComplete();
    return partial;
  }

  /**
   * Claims the session for a new generation.
   *
   * @throws AlreadyGeneratingException if a generation is running
   */
  synchronized CancellationToken beginGeneration() {
    CancellationToken claimed = tryBeginGeneration();
    if (claimed == null) {
      throw new AlreadyGeneratingException(conversationId);
    }
    return claimed;
  }

  /** Claims the session for a new generation, or returns null if one is running. */
  synchronized CancellationToken tryBeginGeneration() {
    if (loading || destroyed) {
      return null;
    }
    token = CancellationToken.create();
    loading = true;
    lastError = null;
    lastErrorCategory = null;
    terminalReason = null;
    retry = null;
    clearTurn();
    publish();
    return token;
  }

  synchronized boolean isCurrent(CancellationToken candidate) {
    return !destroyed && token == candidate && !candidate.isCancelled();
  }

  synchronized Selection selection() {
    return new Selection(providerInstanceId, modelId);
  }

  synchronized void startTurn(CancellationToken caller) {
    if (!isCurrent(caller)) {
      return;
    }
    clearTurn();
    retry = null;
    publish();
  }

  /** Appends a token and returns the accumulated text, or null if the caller is stale. */
  synchronized String appendContent(CancellationToken caller, String text) {
    if (!isCurrent(caller)) {
      return null;
    }
    retry = null;
    streamingContent.append(text);
    publish();
    return streamingContent.toString();
  }

  synchronized void appendReasoning(CancellationToken caller, String text) {
    if (!isCurrent(caller)) {
      return;
    }
    reasoningContent.append(text);
    publish();
  }

  /** A failed attempt is being retried; its partial output is discarded. */
  synchronized boolean markRetrying(CancellationToken caller, RetryStatus status) {
    if (!isCurrent(caller)) {
      return false;
    }
    clearTurn();
    retry = status;
    publish();
    return true;
  }

  /**
   * Hands the streamed text over to the caller for persistence, so a later stop does not persist it
   * a second time.
   */
  synchronized boolean commitTurn(CancellationToken caller) {
    if (!isCurrent(caller)) {
      return false;
    }
    turnCommitted = true;
    return true;
  }

  /**
   * Records the calls of a just persisted assistant turn as awaiting results.
   *
   * @return false if the caller is stale, in which case the calls will never run
   */
  synchronized boolean beginTools(CancellationToken caller, List<ToolCall> calls) {
    if (!isCurrent(caller)) {
      return false;
    }
    pendingToolCalls = List.copyOf(calls);
    return true;
  }

  /**
   * Claims the pending calls for storing their results.
   *
   * @return false if the caller is stale or a stop already answered the calls
   */
  synchronized boolean completeTools(CancellationToken caller) {
    if (!isCurrent(caller) || pendingToolCalls.isEmpty()) {
      return false;
    }
    pendingToolCalls = List.of();
    return true;
  }

  /** Removes and returns the calls still awaiting results, whoever started them. */
  synchronized List<ToolCall> takePendingToolCalls() {
    List<ToolCall> pending = pendingToolCalls;
    pendingToolCalls = List.of();
    return pending;
  }

  synchronized void addCost(CancellationToken caller, double cost, TokenUsage usage) {
    if (destroyed || token != caller) {
      return;
    }
    sessionCost += cost;
    if (usage != null) {
      lastUsage = usage;
    }
    publish();
  }

  /** Ends the current generation with a terminal reason. */
  synchronized boolean finish(
      CancellationToken caller, TerminalReason reason, String error, ErrorCategory category) {
    if (!isCurrent(caller)) {
      return false;
    }
    loading = false;
    terminalReason = reason;
    lastError = error;
    lastErrorCategory = category;
    retry = null;
    clearTurn();
    publish();
    return true;
  }

  /**
   * Ends the current generation as interrupted (resumable).
   *
   * @return unpersisted streamed text, or null if the caller is stale
   */
  synchronized String interrupt(CancellationToken caller) {
    if (!isCurrent(caller)) {
      return null;
    }
    String partial = turnCommitted ? "" : streamingContent.toString();
    loading = false;
    terminalReason = null;
    retry = null;
    clearTurn();
    publish();
    return partial;
  }

  /**
   * Cancels the in-flight generation, if any, and marks the session resumable.
   *
   * @return unpersisted streamed text, or null when nothing was generating
   */
  synchronized String stop(String reason) {
    if (!loading) {
      return null;
    }
    token.cancel(reason);
    String partial = turnCommitted ? "" : streamingContent.toString();
    loading = false;
    terminalReason = null;
    retry = null;
    clearTurn();
    publish();
    return partial;
  }

  synchronized boolean canResume() {
    return !destroyed && !loading && terminalReason == null;
  }

  private void clearTurn() {
    streamingContent.setLength(0);
    reasoningContent.setLength(0);
    turnCommitted = false;
  }

  private void publish() {
    Sinks.EmitResult result = snapshots.tryEmitNext(snapshot());
    if (result.isFailure()) {
      log.warn("Failed to publish snapshot for {}: {}", conversationId, result);
    }
  }
}
