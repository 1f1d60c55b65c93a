package com.flamingo.ai.llmchat.service.stream;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.flamingo.ai.llmchat.config.ChatConfig;
import com.flamingo.ai.llmchat.service.provider.ChatCompletionClient;
import com.flamingo.ai.llmchat.service.provider.ChatCompletionRequest;
import com.flamingo.ai.llmchat.service.provider.ChatTurn;
import com.flamingo.ai.llmchat.service.provider.ProviderManager;
import com.flamingo.ai.llmchat.service.tool.ToolDefinition;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.mockito.junit.jupiter.MockitoSettings;
import org.mockito.quality.Strictness;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Sinks;
import reactor.test.StepVerifier;

@ExtendWith(MockitoExtension.class)
@MockitoSettings(strictness = Strictness.LENIENT)
class ChatStreamingPipelineTest {

  @Mock private ProviderManager providerManager;
  @Mock private ChatCompletionClient client;

  private ChatStreamingPipeline pipeline;
  private CancellationToken token;
  private final List<ChatTurn> history = List.of(ChatTurn.user("Hi"));

  @BeforeEach
  void setUp() {
    ChatConfig chatConfig = new ChatConfig();
    chatConfig.getGeneration().setMaxOutputTokens(256);
    pipeline = new ChatStreamingPipeline(providerManager, chatConfig);
    token = CancellationToken.create();
    when(providerManager.getClient("p1")).thenReturn(client);
  }

  @Test
  @DisplayName("Should build the request from history, tools and generation settings")
  void shouldBuildRequest() {
    ToolDefinition tool = new ToolDefinition("get_current_time", "Current time", Map.of());
    when(client.streamChat(any(), eq(token)))
        .thenReturn(Flux.just(ChatStreamEvent.done(null, "stop", "m1", null)));

    StepVerifier.create(pipeline.stream("p1", "m1", history, List.of(tool), token))
        .expectNextCount(1)
        .verifyComplete();

    ArgumentCaptor<ChatCompletionRequest> captor =
        ArgumentCaptor.forClass(ChatCompletionRequest.class);
    verify(client).streamChat(captor.capture(), eq(token));
    ChatCompletionRequest request = captor.getValue();
    assertThat(request.getModel()).isEqualTo("m1");
    assertThat(request.getTurns()).isEqualTo(history);
    assertThat(request.getTools()).containsExactly(tool);
    assertThat(request.getTemperature()).isEqualTo(0.7);
    assertThat(request.getMaxOutputTokens()).isEqualTo(256);
  }

  @Test
  @DisplayName("Should stop after the first terminal event")
  void shouldStopAtTerminalEvent() {
    when(client.streamChat(any(), any()))
        .thenReturn(
            Flux.just(
                ChatStreamEvent.token("a"),
                ChatStreamEvent.failure("boom"),
                ChatStreamEvent.token("ignored")));

    StepVerifier.create(pipeline.stream("p1", "m1", history, List.of(), token))
        .expectNext(ChatStreamEvent.token("a"))
        .expectNext(ChatStreamEvent.failure("boom"))
        .verifyComplete();
  }

  @Test
  @DisplayName("Should not call the provider when already cancelled")
  void shouldSkipWhenCancelled() {
    token.cancel("stop");

    StepVerifier.create(pipeline.stream("p1", "m1", history, List.of(), token)).verifyComplete();

    verify(providerManager, never()).getClient(any());
  }

  @Test
  @DisplayName("Should end without a terminal event once cancelled mid-stream")
  void shouldEndQuietlyOnCancel() {
    Sinks.Many<ChatStreamEvent> upstream = Sinks.many().unicast().onBackpressureBuffer();
    when(client.streamChat(any(), any())).thenReturn(upstream.asFlux());

    StepVerifier.create(pipeline.stream("p1", "m1", history, List.of(), token))
        .then(() -> upstream.tryEmitNext(ChatStreamEvent.token("part")))
        .expectNext(ChatStreamEvent.token("part"))
        .then(() -> token.cancel("Generation stopped by user"))
        .then(() -> upstream.tryEmitNext(ChatStreamEvent.token("late")))
        .verifyComplete();
  }
}
