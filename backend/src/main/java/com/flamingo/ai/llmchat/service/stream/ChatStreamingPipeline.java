package com.flamingo.ai.llmchat.service.stream;

import com.flamingo.ai.llmchat.config.ChatConfig;
import com.flamingo.ai.llmchat.service.provider.ChatCompletionRequest;
import com.flamingo.ai.llmchat.service.provider.ChatTurn;
import com.flamingo.ai.llmchat.service.provider.ProviderManager;
import com.flamingo.ai.llmchat.service.tool.ToolDefinition;
import java.util.List;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Flux;

/**
 * Drives one provider call for a conversation history. The result is lazy, stops at the first
 * terminal event, and ends without a synthetic terminal event as soon as the token is cancelled.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class ChatStreamingPipeline {

  private final ProviderManager providerManager;
  private final ChatConfig chatConfig;

  public Flux<ChatStreamEvent> stream(
      String providerInstanceId,
      String modelId,
      List<ChatTurn> history,
      List<ToolDefinition> tools,
      CancellationToken token) {
    return Flux.defer(
        () -> {
          if (token.isCancelled()) {
            return Flux.empty();
          }
          ChatConfig.Generation generation = chatConfig.getGeneration();
          ChatCompletionRequest request =
              ChatCompletionRequest.builder()
                  .model(modelId)
                  .turns(history)
                  .tools(tools)
                  .temperature(generation.getTemperature())
                  .maxOutputTokens(generation.getMaxOutputTokens())
                  .build();
          log.debug(
              "Streaming {} turn(s) to {}/{} with {} tool(s)",
              history.size(),
              providerInstanceId,
              modelId,
              tools.size());

          return providerManager
              .getClient(providerInstanceId)
              .streamChat(request, token)
              .takeUntilOther(token.whenCancelled())
              .filter(event -> !token.isCancelled())
              .takeUntil(ChatStreamEvent::isTerminal);
        });
  }
}
