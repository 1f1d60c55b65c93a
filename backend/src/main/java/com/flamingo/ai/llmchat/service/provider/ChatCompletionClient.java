package com.flamingo.ai.llmchat.service.provider;

import com.flamingo.ai.llmchat.service.stream.CancellationToken;
import com.flamingo.ai.llmchat.service.stream.ChatStreamEvent;
import java.util.List;
import reactor.core.publisher.Flux;

/** Streaming chat-completion endpoint of one provider instance. */
public interface ChatCompletionClient {

  /**
   * Streams one completion. HTTP failures are signalled as errors ({@code ProviderException} where
   * a status is known); failures reported inside the stream become a {@code Failure} event.
   *
   * @param request the model, history and generation options
   * @param token checked before each emitted event
   * @return lazy event sequence, nothing happens until subscribed
   */
  Flux<ChatStreamEvent> streamChat(ChatCompletionRequest request, CancellationToken token);

  /** Lists the models available on this endpoint. Blocking. */
  List<ModelInfo> listModels();
}
