package com.flamingo.ai.llmchat.service.conversation;

import lombok.Builder;
import lombok.Value;

/** Partial update of conversation metadata; null fields are left unchanged. */
@Value
@Builder
public class ConversationPatch {
  String title;
  String providerInstanceId;
  String modelId;
  String systemPrompt;
}
