package com.flamingo.ai.llmchat.service.tool;

import java.util.Map;
import reactor.core.publisher.Mono;

/** A function the model may call during a conversation. */
public interface Tool {

  /** Unique name, as advertised to the model. */
  String name();

  String description();

  /** JSON schema of the arguments object. */
  Map<String, Object> parameters();

  /**
   * Executes the tool. Implementations should stop early once the context's token is cancelled.
   *
   * @param arguments parsed arguments object
   * @param context conversation and cancellation context
   * @return the result; an error signal is reported to the model as a failed result
   */
  Mono<ToolResult> execute(Map<String, Object> arguments, ToolContext context);

  default ToolDefinition definition() {
    return new ToolDefinition(name(), description(), parameters());
  }
}
