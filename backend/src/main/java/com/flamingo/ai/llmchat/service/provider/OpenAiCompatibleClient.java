package com.flamingo.ai.llmchat.service.provider;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.flamingo.ai.llmchat.exception.ProviderException;
import com.flamingo.ai.llmchat.service.stream.CancellationToken;
import com.flamingo.ai.llmchat.service.stream.ChatStreamEvent;
import com.flamingo.ai.llmchat.service.stream.TokenUsage;
import com.flamingo.ai.llmchat.service.stream.ToolCall;
import com.flamingo.ai.llmchat.service.tool.ToolDefinition;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.ParameterizedTypeReference;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatusCode;
import org.springframework.http.MediaType;
import org.springframework.http.codec.ServerSentEvent;
import org.springframework.web.reactive.function.client.ClientResponse;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

/**
 * WebClient client for endpoints speaking the OpenAI chat-completions protocol with SSE streaming.
 * Forwards tool definitions, and surfaces reasoning deltas, tool-call fragments, usage and any
 * provider-reported cost.
 */
@Slf4j
public class OpenAiCompatibleClient implements ChatCompletionClient {

  private static final String DONE_MARKER = "[DONE]";
  private static final ParameterizedTypeReference<ServerSentEvent<String>> SSE_TYPE =
      new ParameterizedTypeReference<>() {};

  private final WebClient webClient;
  private final ObjectMapper objectMapper;
  private final Duration idleTimeout;

  public OpenAiCompatibleClient(
      WebClient webClient, ObjectMapper objectMapper, Duration idleTimeout) {
    this.webClient = webClient;
    this.objectMapper = objectMapper;
    this.idleTimeout = idleTimeout;
  }

  @Override
  public Flux<ChatStreamEvent> streamChat(ChatCompletionRequest request, CancellationToken token) {
    return Flux.defer(
        () -> {
          StreamState state = new StreamState();
          Flux<ChatStreamEvent> body =
              webClient
                  .post()
                  .uri("/chat/completions")
                  .contentType(MediaType.APPLICATION_JSON)
                  .accept(MediaType.TEXT_EVENT_STREAM)
                  .bodyValue(buildBody(request))
                  .retrieve()
                  .onStatus(HttpStatusCode::isError, this::toProviderException)
                  .bodyToFlux(SSE_TYPE)
                  .timeout(idleTimeout)
                  .takeWhile(sse -> !token.isCancelled())
                  .concatMap(sse -> Flux.fromIterable(parseEvent(sse.data(), state)))
                  .takeUntil(ChatStreamEvent::isTerminal);

          // Some endpoints close the stream without a [DONE] marker.
          return body.concatWith(
              Mono.fromSupplier(
                  () -> state.terminated || token.isCancelled() ? null : state.done()));
        });
  }

  @Override
  public List<ModelInfo> listModels() {
    JsonNode response =
        webClient
            .get()
            .uri("/models")
            .accept(MediaType.APPLICATION_JSON)
            .retrieve()
            .onStatus(HttpStatusCode::isError, this::toProviderException)
            .bodyToMono(JsonNode.class)
            .block(idleTimeout);

    List<ModelInfo> models = new ArrayList<>();
    if (response == null || !response.path("data").isArray()) {
      return models;
    }
    for (JsonNode model : response.path("data")) {
      String id = model.path("id").asText(null);
      if (id == null) {
        continue;
      }
      Integer contextLength =
          model.hasNonNull("context_length")
              ? Integer.valueOf(model.get("context_length").asInt())
              : model.hasNonNull("context_window")
                  ? Integer.valueOf(model.get("context_window").asInt())
                  : null;
      models.add(
          new ModelInfo(id, ModelInfo.displayName(id), contextLength, parsePricing(model)));
    }
    return models;
  }

  private Mono<? extends Throwable> toProviderException(ClientResponse response) {
    int status = response.statusCode().value();
    String retryAfter =
        response.headers().header(HttpHeaders.RETRY_AFTER).stream().findFirst().orElse(null);
    return response
        .bodyToMono(String.class)
        .defaultIfEmpty("")
        .map(text -> new ProviderException(status, retryAfter, "API error: " + status + " - " + text));
  }

  ObjectNode buildBody(ChatCompletionRequest request) {
    ObjectNode body = objectMapper.createObjectNode();
    body.put("model", request.getModel());
    body.put("stream", true);
    body.putObject("stream_options").put("include_usage", true);
    if (request.getTemperature() != null) {
      body.put("temperature", request.getTemperature());
    }
    if (request.getMaxOutputTokens() != null) {
      body.put("max_tokens", request.getMaxOutputTokens());
    }

    ArrayNode messages = body.putArray("messages");
    for (ChatTurn turn : request.getTurns()) {
      ObjectNode message = messages.addObject();
      message.put("role", turn.role().name().toLowerCase(Locale.ROOT));
      message.put("content", turn.content());
      if (turn.hasToolCalls()) {
        ArrayNode calls = message.putArray("tool_calls");
        for (ToolCall call : turn.toolCalls()) {
          ObjectNode node = calls.addObject();
          node.put("id", call.id());
          node.put("type", "function");
          node.putObject("function").put("name", call.name()).put("arguments", call.arguments());
        }
      }
      if (turn.toolCallId() != null) {
        message.put("tool_call_id", turn.toolCallId());
      }
    }

    if (!request.getTools().isEmpty()) {
      ArrayNode tools = body.putArray("tools");
      for (ToolDefinition tool : request.getTools()) {
        ObjectNode function = tools.addObject().put("type", "function").putObject("function");
        function.put("name", tool.name());
        function.put("description", tool.description());
        function.set("parameters", objectMapper.valueToTree(tool.parameters()));
      }
    }
    return body;
  }

  private List<ChatStreamEvent> parseEvent(String data, StreamState state) {
    List<ChatStreamEvent> events = new ArrayList<>();
    if (data == null || data.isBlank()) {
      return events;
    }
    String payload = data.trim();
    if (DONE_MARKER.equals(payload)) {
      state.terminated = true;
      events.add(state.done());
      return events;
    }

    JsonNode chunk;
    try {
      chunk = objectMapper.readTree(payload);
    } catch (JsonProcessingException e) {
      log.debug("Skipping malformed stream chunk: {}", e.getOriginalMessage());
      return events;
    }

    if (chunk.hasNonNull("error")) {
      JsonNode error = chunk.get("error");
      String message = error.isTextual() ? error.asText() : error.path("message").asText("error");
      state.terminated = true;
      events.add(ChatStreamEvent.failure(message));
      return events;
    }

    if (chunk.hasNonNull("model")) {
      state.model = chunk.get("model").asText();
    }
    if (chunk.hasNonNull("usage")) {
      JsonNode usage = chunk.get("usage");
      state.usage =
          new TokenUsage(
              usage.path("prompt_tokens").asInt(0), usage.path("completion_tokens").asInt(0));
      if (usage.hasNonNull("cost")) {
        state.cost = usage.get("cost").asDouble();
      }
    }

    JsonNode choice = chunk.path("choices").path(0);
    JsonNode delta = choice.path("delta");
    String content = delta.path("content").asText("");
    if (!content.isEmpty()) {
      events.add(ChatStreamEvent.token(content));
    }
    String reasoning =
        delta.hasNonNull("reasoning_content")
            ? delta.get("reasoning_content").asText("")
            : delta.path("reasoning").asText("");
    if (!reasoning.isEmpty()) {
      events.add(ChatStreamEvent.reasoning(reasoning));
    }
    for (JsonNode call : delta.path("tool_calls")) {
      JsonNode function = call.path("function");
      events.add(
          ChatStreamEvent.toolCallFragment(
              call.path("index").asInt(0),
              call.path("id").asText(null),
              function.path("name").asText(null),
              function.path("arguments").asText(null)));
    }
    if (choice.hasNonNull("finish_reason")) {
      state.finishReason = choice.get("finish_reason").asText();
    }
    return events;
  }

  private static ModelPricing parsePricing(JsonNode model) {
    JsonNode pricing = model.path("pricing");
    if (pricing.isMissingNode() || pricing.isNull()) {
      return null;
    }
    return new ModelPricing(
        perMillion(pricing.path("prompt")), perMillion(pricing.path("completion")));
  }

  private static double perMillion(JsonNode perToken) {
    if (perToken.isNumber()) {
      return perToken.asDouble() * 1_000_000;
    }
    try {
      return Double.parseDouble(perToken.asText("0")) * 1_000_000;
    } catch (NumberFormatException e) {
      return 0.0;
    }
  }

  /** Values collected across chunks of one response. */
  private static final class StreamState {
    private TokenUsage usage;
    private String finishReason;
    private String model;
    private Double cost;
    private boolean terminated;

    private ChatStreamEvent done() {
      return ChatStreamEvent.done(usage, finishReason != null ? finishReason : "stop", model, cost);
    }
  }
}
