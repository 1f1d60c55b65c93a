package com.flamingo.ai.llmchat.service.tool;

import java.util.Map;

/** Function definition advertised to the model: name, description and JSON-schema parameters. */
public record ToolDefinition(String name, String description, Map<String, Object> parameters) {}
