package com.flamingo.ai.llmchat.service.tool;

/** Tool-role message answering one tool call. Failures carry a JSON error payload. */
public record ToolResultMessage(
    String toolCallId, String toolName, String content, boolean success) {}
