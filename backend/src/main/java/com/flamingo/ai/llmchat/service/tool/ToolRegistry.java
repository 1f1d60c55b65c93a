package com.flamingo.ai.llmchat.service.tool;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/** Registry of callable tools, keyed by name. Tool beans are registered at startup. */
@Component
@Slf4j
public class ToolRegistry {

  private final Map<String, Tool> tools = new ConcurrentHashMap<>();

  public ToolRegistry(List<Tool> toolBeans) {
    toolBeans.forEach(this::register);
    log.info("Tool registry initialized with {} tool(s): {}", tools.size(), tools.keySet());
  }

  /** Registers a tool, replacing any tool with the same name. */
  public void register(Tool tool) {
    Tool previous = tools.put(tool.name(), tool);
    if (previous != null) {
      log.warn("Tool \"{}\" is already registered, overwriting", tool.name());
    }
  }

  public void unregister(String name) {
    tools.remove(name);
  }

  public Optional<Tool> get(String name) {
    return name != null ? Optional.ofNullable(tools.get(name)) : Optional.empty();
  }

  public boolean has(String name) {
    return name != null && tools.containsKey(name);
  }

  public List<Tool> list() {
    return List.copyOf(tools.values());
  }

  /** Definitions sent to the model with each request. */
  public List<ToolDefinition> definitions() {
    return tools.values().stream().map(Tool::definition).toList();
  }

  public void clear() {
    tools.clear();
  }
}
