package com.flamingo.ai.llmchat.service.provider;

import com.flamingo.ai.llmchat.service.tool.ToolDefinition;
import java.util.List;
import lombok.Builder;
import lombok.Singular;
import lombok.Value;

/** Input of one streaming chat completion. */
@Value
@Builder
public class ChatCompletionRequest {

  String model;

  @Singular List<ChatTurn> turns;

  @Singular List<ToolDefinition> tools;

  Double temperature;

  /** Null leaves the limit to the provider. */
  Integer maxOutputTokens;
}
