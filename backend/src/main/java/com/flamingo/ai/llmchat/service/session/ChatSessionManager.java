package com.flamingo.ai.llmchat.service.session;

import com.flamingo.ai.llmchat.config.ChatConfig;
import com.flamingo.ai.llmchat.domain.entity.ChatMessage;
import com.flamingo.ai.llmchat.domain.entity.Conversation;
import com.flamingo.ai.llmchat.domain.enums.ErrorCategory;
import com.flamingo.ai.llmchat.domain.enums.MessageRole;
import com.flamingo.ai.llmchat.domain.enums.TerminalReason;
import com.flamingo.ai.llmchat.exception.ConversationNotFoundException;
import com.flamingo.ai.llmchat.exception.NoSessionException;
import com.flamingo.ai.llmchat.service.conversation.ChatTurnMapper;
import com.flamingo.ai.llmchat.service.conversation.ConversationStore;
import com.flamingo.ai.llmchat.service.provider.ChatTurn;
import com.flamingo.ai.llmchat.service.provider.ProviderManager;
import com.flamingo.ai.llmchat.service.retry.ClassifiedError;
import com.flamingo.ai.llmchat.service.retry.ErrorClassifier;
import com.flamingo.ai.llmchat.service.retry.RetryingChatStream;
import com.flamingo.ai.llmchat.service.stream.CancellationToken;
import com.flamingo.ai.llmchat.service.stream.ChatStreamEvent;
import com.flamingo.ai.llmchat.service.stream.ChatStreamingPipeline;
import com.flamingo.ai.llmchat.service.stream.TokenUsage;
import com.flamingo.ai.llmchat.service.stream.ToolCall;
import com.flamingo.ai.llmchat.service.stream.ToolCallAccumulator;
import com.flamingo.ai.llmchat.service.tool.ToolContext;
import com.flamingo.ai.llmchat.service.tool.ToolDefinition;
import com.flamingo.ai.llmchat.service.tool.ToolExecutionService;
import com.flamingo.ai.llmchat.service.tool.ToolRegistry;
import com.flamingo.ai.llmchat.service.tool.ToolResultMessage;
import io.micrometer.core.instrument.MeterRegistry;
import jakarta.annotation.PreDestroy;
import java.time.Clock;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;
import reactor.core.Disposable;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.publisher.Sinks;
import reactor.core.scheduler.Scheduler;
import reactor.core.scheduler.Schedulers;

/**
 * Registry of live chat sessions, one per conversation with viewers. Viewers are reference
 * counted; a session whose count stays at zero for the cleanup delay is destroyed. At most one
 * generation runs per session. A generation keeps running independently of the callers that
 * started it and is stopped only through its cancellation token.
 */
@Service
@Slf4j
public class ChatSessionManager {

  static final String STOP_MARKER = "\n\n_(generation stopped)_";
  static final String TOOL_CANCELLED = "cancelled";
  static final String TOOL_LIMIT_REACHED = "Tool call limit reached";

  private final ConversationStore conversationStore;
  private final ChatTurnMapper chatTurnMapper;
  private final ChatStreamingPipeline streamingPipeline;
  private final RetryingChatStream retryingChatStream;
  private final ErrorClassifier errorClassifier;
  private final ToolRegistry toolRegistry;
  private final ToolExecutionService toolExecutionService;
  private final ProviderManager providerManager;
  private final ChatConfig chatConfig;
  private final MeterRegistry meterRegistry;
  private final Scheduler cleanupScheduler;
  private final Clock clock;

  private final Map<String, ChatSession> sessions = new ConcurrentHashMap<>();
  private final Sinks.Many<ChatSessionEvent> events = Sinks.many().multicast().directBestEffort();

  public ChatSessionManager(
      ConversationStore conversationStore,
      ChatTurnMapper chatTurnMapper,
      ChatStreamingPipeline streamingPipeline,
      RetryingChatStream retryingChatStream,
      ErrorClassifier errorClassifier,
      ToolRegistry toolRegistry,
      ToolExecutionService toolExecutionService,
      ProviderManager providerManager,
      ChatConfig chatConfig,
      MeterRegistry meterRegistry,
      @Qualifier("sessionCleanupScheduler") Scheduler cleanupScheduler,
      Clock clock) {
    this.conversationStore = conversationStore;
    this.chatTurnMapper = chatTurnMapper;
    this.streamingPipeline = streamingPipeline;
    this.retryingChatStream = retryingChatStream;
    this.errorClassifier = errorClassifier;
    this.toolRegistry = toolRegistry;
    this.toolExecutionService = toolExecutionService;
    this.providerManager = providerManager;
    this.chatConfig = chatConfig;
    this.meterRegistry = meterRegistry;
    this.cleanupScheduler = cleanupScheduler;
    this.clock = clock;
  }

  /**
   * Attaches a viewer, creating the session if needed. A pending cleanup is cancelled and the
   * provider/model selection is updated when given.
   */
  public ChatSessionSnapshot open(String conversationId, String providerInstanceId, String modelId) {
    AtomicBoolean created = new AtomicBoolean();
    ChatSession session =
        sessions.compute(
            conversationId,
            (id, existing) -> {
              ChatSession target = existing;
              if (target == null) {
                target = new ChatSession(id, clock);
                created.set(true);
              }
              target.attach(providerInstanceId, modelId);
              return target;
            });

    if (created.get()) {
      meterRegistry.counter("chat.sessions.opened").increment();
      log.info("Opened session for conversation {}", conversationId);
    } else {
      log.debug("Viewer attached to session {}", conversationId);
    }
    return session.snapshot();
  }

  /** Detaches a viewer. The last one out schedules destruction after the cleanup delay. */
  public void close(String conversationId) {
    ChatSession session = sessions.get(conversationId);
    if (session == null) {
      log.debug("Ignoring close for conversation {} without session", conversationId);
      return;
    }
    if (session.detach() > 0) {
      return;
    }
    long delayMs = chatConfig.getSession().getCleanupDelayMs();
    Disposable task =
        cleanupScheduler.schedule(
            () -> destroyIfIdle(conversationId, session), delayMs, TimeUnit.MILLISECONDS);
    session.scheduleCleanup(task);
    log.debug("Session {} has no viewers, cleanup in {}ms", conversationId, delayMs);
  }

  public Optional<ChatSessionSnapshot> getSession(String conversationId) {
    return Optional.ofNullable(sessions.get(conversationId)).map(ChatSession::snapshot);
  }

  /** Latest snapshot followed by every later one; completes when the session is destroyed. */
  public Flux<ChatSessionSnapshot> watch(String conversationId) {
    return requireSession(conversationId).watch();
  }

  /** Registry-wide change notifications. */
  public Flux<ChatSessionEvent> events() {
    return events.asFlux();
  }

  public Set<String> getActiveSessionIds() {
    return Set.copyOf(sessions.keySet());
  }

  public boolean canResume(String conversationId) {
    ChatSession session = sessions.get(conversationId);
    return session != null && session.canResume();
  }

  /**
   * Appends a user message and starts generating the answer.
   *
   * @return completes when the generation has ended
   * @throws NoSessionException if no viewer has opened the conversation
   * @throws com.flamingo.ai.llmchat.exception.AlreadyGeneratingException if a generation is running
   */
  public Mono<Void> sendMessage(String conversationId, String text) {
    ChatSession session = requireSession(conversationId);
    CancellationToken token = session.beginGeneration();
    Mono<Void> work =
        Mono.fromCallable(() -> appendUserMessage(conversationId, text))
            .subscribeOn(Schedulers.boundedElastic())
            .doOnNext(
                message ->
                    emit(
                        ChatSessionEvent.messageAdded(
                            conversationId, String.valueOf(message.getId()), MessageRole.USER)))
            .then(runTurn(session, token, 0));
    return launch(session, token, work);
  }

  /**
   * Generates an answer to the stored history. Does nothing while a generation is running.
   *
   * @return completes when the generation has ended
   * @throws NoSessionException if no viewer has opened the conversation
   */
  public Mono<Void> startGeneration(String conversationId) {
    ChatSession session = requireSession(conversationId);
    CancellationToken token = session.tryBeginGeneration();
    if (token == null) {
      log.debug("Generation already running for {}", conversationId);
      return Mono.empty();
    }
    return launch(session, token, runTurn(session, token, 0));
  }

  /**
   * Cancels the running generation. Text streamed so far is persisted with a stop marker and the
   * session is left resumable.
   *
   * @throws NoSessionException if no viewer has opened the conversation
   */
  public void stopGeneration(String conversationId) {
    ChatSession session = requireSession(conversationId);
    synchronized (session.storeLock()) {
      String partial = session.stop("Generation stopped by user");
      if (partial == null) {
        log.debug("Nothing to stop for {}", conversationId);
        return;
      }
      meterRegistry.counter("chat.generations.stopped").increment();
      log.info("Generation stopped for {}", conversationId);
      emit(ChatSessionEvent.loadingChanged(conversationId, false));
      persistPartial(conversationId, session.selection().modelId(), partial);
      answerPendingTools(session, TOOL_CANCELLED);
    }
  }

  public Conversation createConversation(String providerInstanceId, String modelId, String title) {
    return conversationStore.create(providerInstanceId, modelId, title);
  }

  /** Cancels any generation, drops the session and deletes the conversation. */
  public void deleteConversation(String conversationId) {
    ChatSession session = sessions.remove(conversationId);
    if (session != null) {
      session.destroy("Conversation deleted");
      meterRegistry.counter("chat.sessions.destroyed").increment();
    }
    conversationStore.delete(conversationId);
  }

  @PreDestroy
  public void shutdown() {
    log.info("Shutting down {} chat session(s)", sessions.size());
    sessions.values().forEach(this::shutdownSession);
    sessions.clear();
    synchronized (events) {
      events.tryEmitComplete();
    }
  }

  private void shutdownSession(ChatSession session) {
    synchronized (session.storeLock()) {
      session.destroy("Shutting down");
      try {
        answerPendingTools(session, TOOL_CANCELLED);
      } catch (RuntimeException e) {
        log.warn(
            "Could not store cancelled tool results for {}: {}",
            session.getConversationId(),
            e.getMessage());
      }
    }
  }

  private ChatSession requireSession(String conversationId) {
    ChatSession session = sessions.get(conversationId);
    if (session == null) {
      throw new NoSessionException(conversationId);
    }
    return session;
  }

  private void destroyIfIdle(String conversationId, ChatSession session) {
    AtomicReference<String> partial = new AtomicReference<>();
    sessions.computeIfPresent(
        conversationId,
        (id, current) -> {
          if (current != session || !current.isIdle()) {
            return current;
          }
          partial.set(current.destroy("Session closed"));
          return null;
        });
    if (partial.get() == null) {
      return;
    }
    meterRegistry.counter("chat.sessions.destroyed").increment();
    log.info("Destroyed idle session for conversation {}", conversationId);
    synchronized (session.storeLock()) {
      persistPartial(conversationId, session.selection().modelId(), partial.get());
      answerPendingTools(session, TOOL_CANCELLED);
    }
  }

  /** Runs a claimed generation detached from the caller. */
  private Mono<Void> launch(ChatSession session, CancellationToken token, Mono<Void> work) {
    String conversationId = session.getConversationId();
    meterRegistry.counter("chat.generations.started").increment();
    log.info("Generation started for {}", conversationId);
    emit(ChatSessionEvent.loadingChanged(conversationId, true));

    Sinks.Empty<Void> finished = Sinks.empty();
    work.onErrorResume(
            error -> fail(session, token, errorClassifier.classify(error)))
        .doFinally(signal -> finished.tryEmitEmpty())
        .subscribe();
    return finished.asMono();
  }

  private ChatMessage appendUserMessage(String conversationId, String text) {
    Conversation conversation =
        conversationStore
            .get(conversationId)
            .orElseThrow(() -> new ConversationNotFoundException(conversationId));
    boolean first = conversationStore.messages(conversationId).isEmpty();
    ChatMessage saved =
        conversationStore.append(
            conversationId,
            ChatMessage.builder().role(MessageRole.USER).content(text).build());
    if (first) {
      String title = deriveTitle(text);
      conversationStore.updateTitle(conversationId, title);
      log.debug("Titled conversation {} '{}'", conversation.getId(), title);
    }
    return saved;
  }

  String deriveTitle(String text) {
    int max = chatConfig.getSession().getTitleMaxLength();
    String trimmed = text.strip();
    return trimmed.length() > max ? trimmed.substring(0, max) + "..." : trimmed;
  }

  /**
   * One model turn; recurses after tool calls until the model answers without them. Tool rounds
   * are counted from zero, so at most {@code max-tool-rounds} rounds of tools execute.
   */
  private Mono<Void> runTurn(ChatSession session, CancellationToken token, int round) {
    return Mono.defer(
        () -> {
          if (!session.isCurrent(token)) {
            return Mono.empty();
          }
          ChatSession.Selection selection = session.selection();
          session.startTurn(token);
          return Mono.fromCallable(() -> loadHistory(session.getConversationId()))
              .subscribeOn(Schedulers.boundedElastic())
              .flatMap(history -> streamTurn(session, token, selection, history))
              .flatMap(turn -> completeTurn(session, token, selection, turn, round));
        });
  }

  private List<ChatTurn> loadHistory(String conversationId) {
    Conversation conversation =
        conversationStore
            .get(conversationId)
            .orElseThrow(() -> new ConversationNotFoundException(conversationId));
    List<ChatMessage> messages = conversationStore.messages(conversationId);
    if (messages.isEmpty()) {
      throw new IllegalStateException("No messages in conversation");
    }
    return chatTurnMapper.toTurns(conversation, messages);
  }

  private Mono<TurnState> streamTurn(
      ChatSession session,
      CancellationToken token,
      ChatSession.Selection selection,
      List<ChatTurn> history) {
    TurnState turn = new TurnState();
    List<ToolDefinition> tools = toolRegistry.definitions();
    return retryingChatStream
        .stream(
            () ->
                streamingPipeline.stream(
                    selection.providerInstanceId(), selection.modelId(), history, tools, token),
            token)
        .takeUntilOther(token.whenCancelled())
        .doOnNext(event -> onEvent(session, token, turn, event))
        .then(Mono.just(turn));
  }

  private void onEvent(
      ChatSession session, CancellationToken token, TurnState turn, ChatStreamEvent event) {
    String conversationId = session.getConversationId();
    if (event instanceof ChatStreamEvent.Token delta) {
      turn.content.append(delta.text());
      String content = session.appendContent(token, delta.text());
      if (content != null) {
        emit(ChatSessionEvent.streamingUpdate(conversationId, content));
      }
    } else if (event instanceof ChatStreamEvent.Reasoning delta) {
      turn.reasoning.append(delta.text());
      session.appendReasoning(token, delta.text());
    } else if (event instanceof ChatStreamEvent.ToolCallFragment fragment) {
      turn.toolCalls.accept(fragment);
    } else if (event instanceof ChatStreamEvent.Retry retry) {
      turn.reset();
      RetryStatus status =
          new RetryStatus(
              retry.attempt(),
              retry.maxAttempts(),
              retry.delayMs(),
              retry.category(),
              retry.message());
      if (session.markRetrying(token, status)) {
        emit(ChatSessionEvent.retrying(conversationId, status));
      }
    } else if (event instanceof ChatStreamEvent.Done done) {
      turn.done = done;
    } else if (event instanceof ChatStreamEvent.Failure failure) {
      turn.failure = failure;
    }
  }

  private Mono<Void> completeTurn(
      ChatSession session,
      CancellationToken token,
      ChatSession.Selection selection,
      TurnState turn,
      int round) {
    if (token.isCancelled()) {
      return Mono.empty();
    }
    if (turn.failure != null) {
      ClassifiedError error =
          turn.failure.category() != null
              ? new ClassifiedError(
                  turn.failure.category(), turn.failure.message(), null, null, turn.failure.cause())
              : errorClassifier.classify(turn.failure);
      return fail(session, token, error);
    }
    if (turn.done == null) {
      return interrupt(session, token);
    }
    if (!session.commitTurn(token)) {
      return Mono.empty();
    }

    List<ToolCall> toolCalls = turn.toolCalls.build();
    int maxRounds = chatConfig.getGeneration().getMaxToolRounds();
    boolean overLimit = !toolCalls.isEmpty() && round + 1 > maxRounds;
    return Mono.fromCallable(
            () -> persistAssistant(session, token, selection, turn, toolCalls, overLimit))
        .subscribeOn(Schedulers.boundedElastic())
        .flatMap(
            saved -> {
              if (toolCalls.isEmpty()) {
                return finish(session, token, selection);
              }
              if (overLimit) {
                return fail(
                    session,
                    token,
                    new ClassifiedError(
                        ErrorCategory.UNKNOWN,
                        TOOL_LIMIT_REACHED + " after " + maxRounds + " rounds.",
                        null,
                        null,
                        null));
              }
              return runTools(session, token, selection, toolCalls)
                  .then(runTurn(session, token, round + 1));
            });
  }

  private ChatMessage persistAssistant(
      ChatSession session,
      CancellationToken token,
      ChatSession.Selection selection,
      TurnState turn,
      List<ToolCall> toolCalls,
      boolean overLimit) {
    synchronized (session.storeLock()) {
      ChatMessage saved = appendAssistant(session, token, selection, turn, toolCalls);
      if (toolCalls.isEmpty()) {
        return saved;
      }
      // Every stored tool call gets a stored result, even when it never runs.
      if (overLimit) {
        persistToolResults(
            session.getConversationId(), rejectedResults(toolCalls, TOOL_LIMIT_REACHED));
      } else if (!session.beginTools(token, toolCalls)) {
        persistToolResults(session.getConversationId(), rejectedResults(toolCalls, TOOL_CANCELLED));
      }
      return saved;
    }
  }

  private ChatMessage appendAssistant(
      ChatSession session,
      CancellationToken token,
      ChatSession.Selection selection,
      TurnState turn,
      List<ToolCall> toolCalls) {
    ChatStreamEvent.Done done = turn.done;
    TokenUsage usage = done.usage();
    double cost = calculateCost(selection, usage, done.cost());

    ChatMessage saved =
        conversationStore.append(
            session.getConversationId(),
            ChatMessage.builder()
                .role(MessageRole.ASSISTANT)
                .content(turn.content.toString())
                .reasoning(turn.reasoning.length() > 0 ? turn.reasoning.toString() : null)
                .toolCallsJson(chatTurnMapper.writeToolCalls(toolCalls))
                .modelId(done.model() != null ? done.model() : selection.modelId())
                .promptTokens(usage != null ? usage.promptTokens() : null)
                .completionTokens(usage != null ? usage.completionTokens() : null)
                .cost(cost)
                .build());
    session.addCost(token, cost, usage);
    emit(
        ChatSessionEvent.messageAdded(
            session.getConversationId(), String.valueOf(saved.getId()), MessageRole.ASSISTANT));
    return saved;
  }

  /** Provider-reported cost wins; otherwise pricing times usage, zero when either is missing. */
  double calculateCost(ChatSession.Selection selection, TokenUsage usage, Double reportedCost) {
    if (reportedCost != null) {
      return reportedCost;
    }
    if (usage == null) {
      return 0.0;
    }
    return providerManager
        .findPricing(selection.providerInstanceId(), selection.modelId())
        .map(pricing -> pricing.costOf(usage.promptTokens(), usage.completionTokens()))
        .orElse(0.0);
  }

  private Mono<Void> runTools(
      ChatSession session,
      CancellationToken token,
      ChatSession.Selection selection,
      List<ToolCall> toolCalls) {
    String conversationId = session.getConversationId();
    ToolContext context =
        new ToolContext(conversationId, selection.providerInstanceId(), selection.modelId(), token);
    log.debug("Executing {} tool call(s) for {}", toolCalls.size(), conversationId);
    return toolExecutionService
        .executeAll(toolCalls, context)
        .flatMap(
            results ->
                Mono.<Void>fromRunnable(
                        () -> {
                          synchronized (session.storeLock()) {
                            if (session.completeTools(token)) {
                              persistToolResults(conversationId, results);
                            }
                          }
                        })
                    .subscribeOn(Schedulers.boundedElastic()));
  }

  /** Stores an error result for each call still awaiting one. Caller holds the store lock. */
  private void answerPendingTools(ChatSession session, String error) {
    List<ToolCall> pending = session.takePendingToolCalls();
    if (!pending.isEmpty()) {
      log.debug(
          "Answering {} pending tool call(s) for {}", pending.size(), session.getConversationId());
      persistToolResults(session.getConversationId(), rejectedResults(pending, error));
    }
  }

  private List<ToolResultMessage> rejectedResults(List<ToolCall> calls, String error) {
    return calls.stream().map(call -> toolExecutionService.errorResult(call, error)).toList();
  }

  private void persistToolResults(String conversationId, List<ToolResultMessage> results) {
    for (ToolResultMessage result : results) {
      ChatMessage saved =
          conversationStore.append(
              conversationId,
              ChatMessage.builder()
                  .role(MessageRole.TOOL)
                  .content(result.content())
                  .toolCallId(result.toolCallId())
                  .toolName(result.toolName())
                  .build());
      emit(
          ChatSessionEvent.messageAdded(
              conversationId, String.valueOf(saved.getId()), MessageRole.TOOL));
    }
  }

  private Mono<Void> finish(
      ChatSession session, CancellationToken token, ChatSession.Selection selection) {
    String conversationId = session.getConversationId();
    if (!session.finish(token, TerminalReason.STOP, null, null)) {
      return Mono.empty();
    }
    meterRegistry.counter("chat.generations.completed").increment();
    log.info("Generation completed for {}", conversationId);
    emit(ChatSessionEvent.loadingChanged(conversationId, false));
    return Mono.<Void>fromRunnable(
            () -> providerManager.markUsed(selection.providerInstanceId(), selection.modelId()))
        .subscribeOn(Schedulers.boundedElastic())
        .onErrorResume(
            e -> {
              log.warn("Could not record provider usage for {}: {}", conversationId, e.getMessage());
              return Mono.empty();
            });
  }

  private Mono<Void> fail(ChatSession session, CancellationToken token, ClassifiedError error) {
    if (error.category() == ErrorCategory.CANCELLED) {
      return interrupt(session, token);
    }
    String conversationId = session.getConversationId();
    if (!session.finish(token, TerminalReason.ERROR, error.message(), error.category())) {
      return Mono.empty();
    }
    meterRegistry
        .counter("chat.generations.failed", "category", error.category().name().toLowerCase(Locale.ROOT))
        .increment();
    log.error(
        "Generation failed for {} [{}]: {}",
        conversationId,
        error.category(),
        error.message(),
        error.cause());
    emit(ChatSessionEvent.error(conversationId, error.message(), error.category()));
    emit(ChatSessionEvent.loadingChanged(conversationId, false));
    return Mono.empty();
  }

  /** Stream ended without a terminal event: keep what was streamed and leave it resumable. */
  private Mono<Void> interrupt(ChatSession session, CancellationToken token) {
    String conversationId = session.getConversationId();
    String partial = session.interrupt(token);
    if (partial == null) {
      return Mono.empty();
    }
    log.info("Generation interrupted for {}", conversationId);
    emit(ChatSessionEvent.loadingChanged(conversationId, false));
    String modelId = session.selection().modelId();
    return Mono.<Void>fromRunnable(() -> persistPartial(conversationId, modelId, partial))
        .subscribeOn(Schedulers.boundedElastic());
  }

  private void persistPartial(String conversationId, String modelId, String partial) {
    if (partial == null || partial.isBlank()) {
      return;
    }
    ChatMessage saved =
        conversationStore.append(
            conversationId,
            ChatMessage.builder()
                .role(MessageRole.ASSISTANT)
                .content(partial + STOP_MARKER)
                .modelId(modelId)
                .build());
    emit(
        ChatSessionEvent.messageAdded(
            conversationId, String.valueOf(saved.getId()), MessageRole.ASSISTANT));
  }

  private void emit(ChatSessionEvent event) {
    synchronized (events) {
      Sinks.EmitResult result = events.tryEmitNext(event);
      if (result.isFailure() && result != Sinks.EmitResult.FAIL_ZERO_SUBSCRIBER) {
        log.warn("Dropped {} event for {}: {}", event.getType(), event.getConversationId(), result);
      }
    }
  }

  /** Output of one model turn, reset when the attempt is retried. */
  private static final class TurnState {
    private final StringBuilder content = new StringBuilder();
    private final StringBuilder reasoning = new StringBuilder();
    private final ToolCallAccumulator toolCalls = new ToolCallAccumulator();
    private ChatStreamEvent.Done done;
    private ChatStreamEvent.Failure failure;

    private void reset() {
      content.setLength(0);
      reasoning.setLength(0);
      toolCalls.reset();
    }
  }
}
