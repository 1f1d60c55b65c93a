package com.flamingo.ai.llmchat.service.provider;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.flamingo.ai.llmchat.config.ChatConfig;
import com.flamingo.ai.llmchat.domain.entity.ProviderInstance;
import dev.langchain4j.model.openai.OpenAiStreamingChatModel;
import java.time.Duration;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpHeaders;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;

/** Builds the client matching a provider instance's type. */
@Component
@RequiredArgsConstructor
@Slf4j
public class ChatCompletionClientFactory {

  private final WebClient.Builder webClientBuilder;
  private final ObjectMapper objectMapper;
  private final ChatConfig chatConfig;

  public ChatCompletionClient create(ProviderInstance instance) {
    ChatConfig.Provider providerConfig = chatConfig.getProvider();
    Duration timeout = Duration.ofMillis(providerConfig.getRequestTimeoutMs());

    WebClient.Builder builder =
        webClientBuilder
            .clone()
            .baseUrl(instance.getBaseUrl())
            .codecs(
                configurer ->
                    configurer
                        .defaultCodecs()
                        .maxInMemorySize(providerConfig.getMaxInMemorySizeBytes()));
    if (instance.getApiKey() != null && !instance.getApiKey().isBlank()) {
      builder.defaultHeader(HttpHeaders.AUTHORIZATION, "Bearer " + instance.getApiKey());
    }
    OpenAiCompatibleClient httpClient =
        new OpenAiCompatibleClient(builder.build(), objectMapper, timeout);

    log.info(
        "Chat client created: instance={}, type={}, baseUrl={}",
        instance.getId(),
        instance.getType(),
        instance.getBaseUrl());

    return switch (instance.getType()) {
      case OPENAI_COMPATIBLE -> httpClient;
      case LANGCHAIN4J_OPENAI ->
          new LangChain4jChatClient(
              modelId ->
                  OpenAiStreamingChatModel.builder()
                      .baseUrl(instance.getBaseUrl())
                      .apiKey(instance.getApiKey())
                      .modelName(modelId)
                      .temperature(chatConfig.getGeneration().getTemperature())
                      .maxCompletionTokens(chatConfig.getGeneration().getMaxOutputTokens())
                      .timeout(timeout)
                      .logRequests(false)
                      .logResponses(false)
                      .build(),
              httpClient);
    };
  }
}
