package com.flamingo.ai.llmchat.service.provider;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.flamingo.ai.llmchat.exception.ProviderException;
import com.flamingo.ai.llmchat.service.stream.CancellationToken;
import com.flamingo.ai.llmchat.service.stream.ChatStreamEvent;
import com.flamingo.ai.llmchat.service.stream.TokenUsage;
import com.flamingo.ai.llmchat.service.stream.ToolCall;
import com.flamingo.ai.llmchat.service.tool.ToolDefinition;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicReference;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.web.reactive.function.client.ClientRequest;
import org.springframework.web.reactive.function.client.ClientResponse;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;
import reactor.test.StepVerifier;

class OpenAiCompatibleClientTest {

  private final ObjectMapper objectMapper = new ObjectMapper();
  private final AtomicReference<ClientRequest> lastRequest = new AtomicReference<>();

  private CancellationToken token;
  private ChatCompletionRequest request;

  @BeforeEach
  void setUp() {
    token = CancellationToken.create();
    request =
        ChatCompletionRequest.builder()
            .model("gpt-x")
            .turn(ChatTurn.user("What time is it?"))
            .temperature(0.7)
            .build();
  }

  private OpenAiCompatibleClient clientReturning(ClientResponse response) {
    WebClient webClient =
        WebClient.builder()
            .baseUrl("http://provider.test/v1")
            .exchangeFunction(
                clientRequest -> {
                  lastRequest.set(clientRequest);
                  return Mono.just(response);
                })
            .build();
    return new OpenAiCompatibleClient(webClient, objectMapper, Duration.ofSeconds(5));
  }

  private static ClientResponse sse(String... dataLines) {
    StringBuilder body = new StringBuilder();
    for (String data : dataLines) {
      body.append("data: ").append(data).append("\n\n");
    }
    return ClientResponse.create(HttpStatus.OK)
        .header(HttpHeaders.CONTENT_TYPE, MediaType.TEXT_EVENT_STREAM_VALUE)
        .body(body.toString())
        .build();
  }

  @Nested
  @DisplayName("streamChat")
  class StreamChatTests {

    @Test
    @DisplayName("Should map content, reasoning, tool calls and usage")
    void shouldParseFullStream() {
      OpenAiCompatibleClient client =
          clientReturning(
              sse(
                  "{\"model\":\"gpt-x-0613\",\"choices\":[{\"delta\":{\"content\":\"Hel\"}}]}",
                  "{\"choices\":[{\"delta\":{\"content\":\"lo\",\"reasoning_content\":\"hmm\"}}]}",
                  "{\"choices\":[{\"delta\":{\"tool_calls\":[{\"index\":0,\"id\":\"call_1\","
                      + "\"function\":{\"name\":\"get_current_time\",\"arguments\":\"{}\"}}]},"
                      + "\"finish_reason\":\"tool_calls\"}]}",
                  "{\"choices\":[],\"usage\":{\"prompt_tokens\":12,\"completion_tokens\":7,"
                      + "\"cost\":0.0021}}",
                  "[DONE]"));

      StepVerifier.create(client.streamChat(request, token))
          .expectNext(ChatStreamEvent.token("Hel"))
          .expectNext(ChatStreamEvent.token("lo"))
          .expectNext(ChatStreamEvent.reasoning("hmm"))
          .expectNext(ChatStreamEvent.toolCallFragment(0, "call_1", "get_current_time", "{}"))
          .expectNext(
              ChatStreamEvent.done(new TokenUsage(12, 7), "tool_calls", "gpt-x-0613", 0.0021))
          .verifyComplete();

      assertThat(lastRequest.get().url().toString())
          .isEqualTo("http://provider.test/v1/chat/completions");
    }

    @Test
    @DisplayName("Should synthesize completion when the stream ends without [DONE]")
    void shouldCompleteWithoutDoneMarker() {
      OpenAiCompatibleClient client =
          clientReturning(sse("{\"choices\":[{\"delta\":{\"content\":\"Hi\"}}]}"));

      StepVerifier.create(client.streamChat(request, token))
          .expectNext(ChatStreamEvent.token("Hi"))
          .expectNext(ChatStreamEvent.done(null, "stop", null, null))
          .verifyComplete();
    }

    @Test
    @DisplayName("Should turn an in-stream error object into a failure event")
    void shouldEmitFailureForErrorChunk() {
      OpenAiCompatibleClient client =
          clientReturning(sse("{\"error\":{\"message\":\"quota exhausted\"}}", "[DONE]"));

      StepVerifier.create(client.streamChat(request, token))
          .expectNext(ChatStreamEvent.failure("quota exhausted"))
          .verifyComplete();
    }

    @Test
    @DisplayName("Should skip malformed chunks")
    void shouldSkipMalformedChunk() {
      OpenAiCompatibleClient client =
          clientReturning(
              sse("not json", "{\"choices\":[{\"delta\":{\"content\":\"ok\"}}]}", "[DONE]"));

      StepVerifier.create(client.streamChat(request, token))
          .expectNext(ChatStreamEvent.token("ok"))
          .expectNextMatches(event -> event instanceof ChatStreamEvent.Done)
          .verifyComplete();
    }

    @Test
    @DisplayName("Should raise a provider exception with status and Retry-After")
    void shouldRaiseProviderExceptionOnErrorStatus() {
      OpenAiCompatibleClient client =
          clientReturning(
              ClientResponse.create(HttpStatus.TOO_MANY_REQUESTS)
                  .header(HttpHeaders.RETRY_AFTER, "5")
                  .header(HttpHeaders.CONTENT_TYPE, MediaType.APPLICATION_JSON_VALUE)
                  .body("{\"error\":\"slow down\"}")
                  .build());

      StepVerifier.create(client.streamChat(request, token))
          .expectErrorSatisfies(
              error -> {
                assertThat(error).isInstanceOf(ProviderException.class);
                ProviderException provider = (ProviderException) error;
                assertThat(provider.getStatus()).isEqualTo(429);
                assertThat(provider.getRetryAfter()).isEqualTo("5");
                assertThat(provider.getMessage()).contains("429").contains("slow down");
              })
          .verify();
    }

    @Test
    @DisplayName("Should emit nothing once cancelled")
    void shouldStopWhenCancelled() {
      OpenAiCompatibleClient client =
          clientReturning(sse("{\"choices\":[{\"delta\":{\"content\":\"Hi\"}}]}", "[DONE]"));
      token.cancel("stop");

      StepVerifier.create(client.streamChat(request, token)).verifyComplete();
    }
  }

  @Nested
  @DisplayName("buildBody")
  class BuildBodyTests {

    @Test
    @DisplayName("Should include tools, tool calls and tool results")
    void shouldSerializeToolTraffic() {
      ChatCompletionRequest withTools =
          ChatCompletionRequest.builder()
              .model("gpt-x")
              .turn(ChatTurn.system("Be brief"))
              .turn(ChatTurn.user("Time?"))
              .turn(
                  ChatTurn.assistant(
                      "", List.of(new ToolCall("call_1", "get_current_time", "{}"))))
              .turn(ChatTurn.tool("call_1", "get_current_time", "{\"time\":\"12:00\"}"))
              .tool(
                  new ToolDefinition(
                      "get_current_time", "Current time", Map.of("type", "object")))
              .maxOutputTokens(100)
              .build();

      ObjectNode body =
          clientReturning(sse("[DONE]")).buildBody(withTools);

      assertThat(body.path("stream").asBoolean()).isTrue();
      assertThat(body.path("stream_options").path("include_usage").asBoolean()).isTrue();
      assertThat(body.path("max_tokens").asInt()).isEqualTo(100);
      assertThat(body.path("messages")).hasSize(4);
      assertThat(body.path("messages").path(0).path("role").asText()).isEqualTo("system");
      assertThat(body.path("messages").path(2).path("tool_calls").path(0).path("id").asText())
          .isEqualTo("call_1");
      assertThat(body.path("messages").path(3).path("tool_call_id").asText()).isEqualTo("call_1");
      assertThat(body.path("tools").path(0).path("function").path("name").asText())
          .isEqualTo("get_current_time");
      assertThat(body.path("tools").path(0).path("function").path("parameters").path("type").asText())
          .isEqualTo("object");
    }

    @Test
    void shouldOmitToolsWhenNoneGiven() {
      ObjectNode body = clientReturning(sse("[DONE]")).buildBody(request);

      assertThat(body.has("tools")).isFalse();
      assertThat(body.has("max_tokens")).isFalse();
    }
  }

  @Nested
  @DisplayName("listModels")
  class ListModelsTests {

    @Test
    @DisplayName("Should read ids, context length and per-million pricing")
    void shouldParseModels() {
      OpenAiCompatibleClient client =
          clientReturning(
              ClientResponse.create(HttpStatus.OK)
                  .header(HttpHeaders.CONTENT_TYPE, MediaType.APPLICATION_JSON_VALUE)
                  .body(
                      "{\"data\":[{\"id\":\"openai/gpt-4o-2024-08-06\",\"context_length\":128000,"
                          + "\"pricing\":{\"prompt\":\"0.0000025\",\"completion\":\"0.00001\"}},"
                          + "{\"id\":\"local-model\",\"context_window\":8192}]}")
                  .build());

      List<ModelInfo> models = client.listModels();

      assertThat(models).hasSize(2);
      ModelInfo first = models.get(0);
      assertThat(first.name()).isEqualTo("gpt-4o");
      assertThat(first.contextLength()).isEqualTo(128000);
      assertThat(first.pricing().inputPerMillion()).isCloseTo(2.5, within(1e-9));
      assertThat(first.pricing().outputPerMillion()).isCloseTo(10.0, within(1e-9));
      assertThat(models.get(1).contextLength()).isEqualTo(8192);
      assertThat(models.get(1).pricing()).isNull();
    }
  }
}
