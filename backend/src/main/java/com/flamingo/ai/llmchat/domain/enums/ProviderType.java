package com.flamingo.ai.llmchat.domain.enums;

/** Wire protocol used to talk to a configured provider instance. */
public enum ProviderType {
  /** Any endpoint speaking the OpenAI chat-completions SSE protocol, called through WebClient. */
  OPENAI_COMPATIBLE,

  /** OpenAI (or compatible) endpoint called through the LangChain4j streaming model. */
  LANGCHAIN4J_OPENAI
}
