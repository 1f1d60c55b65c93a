package com.flamingo.ai.llmchat.service.stream;

/** A fully reassembled tool call; {@code arguments} is the raw JSON text sent by the model. */
public record ToolCall(String id, String name, String arguments) {}
