package com.flamingo.ai.llmchat.service.tool;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.flamingo.ai.llmchat.config.ChatConfig;
import com.flamingo.ai.llmchat.exception.ToolArgumentsException;
import com.flamingo.ai.llmchat.service.stream.ToolCall;
import io.micrometer.core.instrument.MeterRegistry;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

/**
 * Executes the tool calls of one assistant turn. Calls run concurrently; results come back in the
 * order of the calls. A call never fails the turn: unknown tools, malformed arguments and tool
 * errors all become a tool message with a JSON error payload.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class ToolExecutionService {

  private static final TypeReference<Map<String, Object>> ARGUMENTS_TYPE =
      new TypeReference<>() {};

  private final ToolRegistry toolRegistry;
  private final ObjectMapper objectMapper;
  private final ChatConfig chatConfig;
  private final MeterRegistry meterRegistry;

  /**
   * Runs all calls and joins their results.
   *
   * @return results in call order; calls cut short by cancellation are omitted
   */
  public Mono<List<ToolResultMessage>> executeAll(List<ToolCall> calls, ToolContext context) {
    int concurrency = Math.max(1, chatConfig.getGeneration().getToolConcurrency());
    return Flux.fromIterable(calls)
        .flatMapSequential(call -> execute(call, context), concurrency)
        .collectList();
  }

  /** Runs one call; empty if the context is cancelled before it finishes. */
  public Mono<ToolResultMessage> execute(ToolCall call, ToolContext context) {
    Optional<Tool> tool = toolRegistry.get(call.name());
    if (tool.isEmpty()) {
      log.warn("Model requested unknown tool: {}", call.name());
      record(call, "unknown");
      return Mono.just(errorResult(call, "Unknown tool: " + call.name()));
    }

    Map<String, Object> arguments;
    try {
      arguments = parseArguments(call);
    } catch (ToolArgumentsException e) {
      log.warn("{}: {}", e.getMessage(), call.arguments());
      record(call, "invalid_arguments");
      return Mono.just(errorResult(call, "Failed to parse tool arguments as JSON"));
    }

    log.debug("Executing tool {} (call {})", call.name(), call.id());
    return Mono.defer(() -> tool.get().execute(arguments, context))
        .map(
            result -> {
              record(call, result.success() ? "success" : "failure");
              return result.success()
                  ? new ToolResultMessage(call.id(), call.name(), result.content(), true)
                  : errorResult(
                      call,
                      result.error() != null ? result.error() : "Tool execution failed");
            })
        .switchIfEmpty(Mono.fromSupplier(() -> errorResult(call, "Tool returned no result")))
        .onErrorResume(
            e -> {
              log.warn("Tool {} failed: {}", call.name(), e.getMessage());
              record(call, "error");
              return Mono.just(
                  errorResult(call, e.getMessage() != null ? e.getMessage() : "Unknown error"));
            })
        .takeUntilOther(context.cancellationToken().whenCancelled());
  }

  private Map<String, Object> parseArguments(ToolCall call) {
    if (call.arguments() == null || call.arguments().isBlank()) {
      return Map.of();
    }
    try {
      Map<String, Object> parsed = objectMapper.readValue(call.arguments(), ARGUMENTS_TYPE);
      return parsed != null ? parsed : Map.of();
    } catch (JsonProcessingException e) {
      throw new ToolArgumentsException(call.name(), e);
    }
  }

  /** Failed result for a call, with a {@code {"error": message}} payload. */
  public ToolResultMessage errorResult(ToolCall call, String message) {
    String payload;
    try {
      payload = objectMapper.writeValueAsString(Map.of("error", message));
    } catch (JsonProcessingException e) {
      throw new IllegalStateException("Cannot serialize tool error", e);
    }
    return new ToolResultMessage(call.id(), call.name(), payload, false);
  }

  private void record(ToolCall call, String outcome) {
    meterRegistry.counter("chat.tools.executed", "tool", call.name(), "outcome", outcome).increment();
  }
}
