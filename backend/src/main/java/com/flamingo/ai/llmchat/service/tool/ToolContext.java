package com.flamingo.ai.llmchat.service.tool;

import com.flamingo.ai.llmchat.service.stream.CancellationToken;

/** Context passed to tool executions. */
public record ToolContext(
    String conversationId,
    String providerInstanceId,
    String modelId,
    CancellationToken cancellationToken) {}
