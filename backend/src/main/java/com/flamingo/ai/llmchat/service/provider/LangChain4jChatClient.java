package com.flamingo.ai.llmchat.service.provider;

import com.flamingo.ai.llmchat.exception.ProviderException;
import com.flamingo.ai.llmchat.service.stream.CancellationToken;
import com.flamingo.ai.llmchat.service.stream.ChatStreamEvent;
import com.flamingo.ai.llmchat.service.stream.TokenUsage;
import dev.langchain4j.agent.tool.ToolExecutionRequest;
import dev.langchain4j.data.message.AiMessage;
import dev.langchain4j.data.message.ChatMessage;
import dev.langchain4j.data.message.SystemMessage;
import dev.langchain4j.data.message.ToolExecutionResultMessage;
import dev.langchain4j.data.message.UserMessage;
import dev.langchain4j.exception.HttpException;
import dev.langchain4j.model.chat.StreamingChatModel;
import dev.langchain4j.model.chat.request.ChatRequest;
import dev.langchain4j.model.chat.response.ChatResponse;
import dev.langchain4j.model.chat.response.StreamingChatResponseHandler;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Function;
import lombok.extern.slf4j.Slf4j;
import reactor.core.publisher.Flux;
import reactor.core.publisher.FluxSink;

/**
 * Streams completions through a LangChain4j {@link StreamingChatModel}. Text arrives as tokens;
 * tool calls, usage and finish reason arrive with the final response. Tool definitions are not
 * forwarded to the model.
 */
@Slf4j
public class LangChain4jChatClient implements ChatCompletionClient {

  private final Function<String, StreamingChatModel> modelFactory;
  private final ChatCompletionClient modelCatalog;
  private final Map<String, StreamingChatModel> models = new ConcurrentHashMap<>();

  /**
   * @param modelFactory builds a streaming model for a model id; results are cached per id
   * @param modelCatalog client used to list the endpoint's models
   */
  public LangChain4jChatClient(
      Function<String, StreamingChatModel> modelFactory, ChatCompletionClient modelCatalog) {
    this.modelFactory = modelFactory;
    this.modelCatalog = modelCatalog;
  }

  @Override
  public Flux<ChatStreamEvent> streamChat(ChatCompletionRequest request, CancellationToken token) {
    return Flux.create(
        sink -> {
          StreamingChatModel model = models.computeIfAbsent(request.getModel(), modelFactory);
          ChatRequest chatRequest = ChatRequest.builder().messages(toMessages(request)).build();
          model.chat(chatRequest, new SinkHandler(sink, token));
        });
  }

  @Override
  public List<ModelInfo> listModels() {
    return modelCatalog.listModels();
  }

  private static List<ChatMessage> toMessages(ChatCompletionRequest request) {
    List<ChatMessage> messages = new ArrayList<>();
    for (ChatTurn turn : request.getTurns()) {
      switch (turn.role()) {
        case SYSTEM -> messages.add(SystemMessage.from(turn.content()));
        case USER -> messages.add(UserMessage.from(turn.content()));
        case TOOL ->
            messages.add(
                ToolExecutionResultMessage.from(
                    turn.toolCallId(), turn.toolName(), turn.content()));
        case ASSISTANT -> messages.add(toAiMessage(turn));
        default -> throw new IllegalArgumentException("Unsupported role: " + turn.role());
      }
    }
    return messages;
  }

  private static AiMessage toAiMessage(ChatTurn turn) {
    if (!turn.hasToolCalls()) {
      return AiMessage.from(turn.content());
    }
    List<ToolExecutionRequest> requests =
        turn.toolCalls().stream()
            .map(
                call ->
                    ToolExecutionRequest.builder()
                        .id(call.id())
                        .name(call.name())
                        .arguments(call.arguments())
                        .build())
            .toList();
    return turn.content().isEmpty()
        ? AiMessage.from(requests)
        : AiMessage.from(turn.content(), requests);
  }

  private static Throwable translate(Throwable error) {
    if (error instanceof HttpException http) {
      return new ProviderException(http.statusCode(), http.getMessage(), http);
    }
    return error;
  }

  /** Bridges LangChain4j callbacks onto a Reactor sink. */
  private static final class SinkHandler implements StreamingChatResponseHandler {

    private final FluxSink<ChatStreamEvent> sink;
    private final CancellationToken token;

    private SinkHandler(FluxSink<ChatStreamEvent> sink, CancellationToken token) {
      this.sink = sink;
      this.token = token;
    }

    @Override
    public void onPartialResponse(String partialResponse) {
      if (!token.isCancelled() && partialResponse != null && !partialResponse.isEmpty()) {
        sink.next(ChatStreamEvent.token(partialResponse));
      }
    }

    @Override
    public void onCompleteResponse(ChatResponse response) {
      if (token.isCancelled()) {
        sink.complete();
        return;
      }
      AiMessage message = response.aiMessage();
      if (message != null && message.hasToolExecutionRequests()) {
        List<ToolExecutionRequest> requests = message.toolExecutionRequests();
        for (int i = 0; i < requests.size(); i++) {
          ToolExecutionRequest request = requests.get(i);
          sink.next(
              ChatStreamEvent.toolCallFragment(
                  i, request.id(), request.name(), request.arguments()));
        }
      }

      TokenUsage usage = null;
      if (response.tokenUsage() != null) {
        Integer input = response.tokenUsage().inputTokenCount();
        Integer output = response.tokenUsage().outputTokenCount();
        usage = new TokenUsage(input != null ? input : 0, output != null ? output : 0);
      }
      String finishReason =
          response.finishReason() != null
              ? response.finishReason().name().toLowerCase(Locale.ROOT)
              : "stop";
      String modelName = response.metadata() != null ? response.metadata().modelName() : null;
      sink.next(ChatStreamEvent.done(usage, finishReason, modelName, null));
      sink.complete();
    }

    @Override
    public void onError(Throwable error) {
      log.debug("LangChain4j stream failed: {}", error.getMessage());
      sink.error(translate(error));
    }
  }
}
