package com.example.clusteragent.agent;

import java.util.List;

/**
 * AI model collaborator. Implementations are provider specific; failures they consider
 * retryable must surface as TRANSIENT {@link com.example.clusteragent.error.AgentException}s.
 */
public interface ModelService {

    ModelResponse sendMessage(List<AgentMessage> context, List<AgentTool> availableTools);

    float[] embed(String text);

    /**
     * Whether the provider is configured well enough to be called at all.
     */
    default boolean isAvailable() {
        return true;
    }
}
