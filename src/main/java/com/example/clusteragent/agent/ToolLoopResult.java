package com.example.clusteragent.agent;

import java.util.List;

/**
 * Outcome of a bounded model/tool loop. {@code converged} is false when the loop hit
 * its iteration bound while the model was still requesting tools.
 */
public record ToolLoopResult(String finalContent, List<ToolInvocation> invocations,
                             int iterations, boolean converged, TokenUsage usage) {
}
