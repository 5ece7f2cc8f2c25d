package com.example.clusteragent.agent;

import java.util.List;

/**
 * Reply of the model service: text content, the tool calls it requests (possibly none)
 * and the token usage of the call.
 */
public record ModelResponse(String content, List<AgentMessage.ToolCall> toolCalls, TokenUsage usage) {

    public ModelResponse {
        toolCalls = toolCalls != null ? List.copyOf(toolCalls) : List.of();
        usage = usage != null ? usage : TokenUsage.NONE;
    }

    public static ModelResponse text(String content) {
        return new ModelResponse(content, List.of(), TokenUsage.NONE);
    }

    public boolean hasToolCalls() {
        return !toolCalls.isEmpty();
    }

    public AgentMessage toAssistantMessage() {
        return AgentMessage.assistant(content, hasToolCalls() ? toolCalls : null);
    }
}
