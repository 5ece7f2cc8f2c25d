package com.example.clusteragent.agent;

import com.example.clusteragent.config.AgentProperties;
import com.example.clusteragent.error.AgentException;
import com.example.clusteragent.error.ErrorKind;
import com.example.clusteragent.retry.FailureClassifier;
import com.example.clusteragent.retry.RetryExecutor;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;

/**
 * The agentic loop, bounded:
 * 1. send the conversation plus the tools allowed in this phase to the model
 * 2. if the model requests tools, run each through the gateway, in order
 * 3. append the results to the conversation
 * 4. repeat until the model answers without tool calls or the bound is reached
 *
 * Model calls are retried on transient failures. Tool calls the gateway refuses
 * (unknown, not permitted, bad arguments) are reported back to the model instead of
 * aborting the loop; every attempt is recorded.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class ToolLoop {

    private final ModelService modelService;
    private final ToolGateway gateway;
    private final ToolRegistry registry;
    private final RetryExecutor retryExecutor;
    private final AgentProperties properties;

    public ToolLoopResult run(List<AgentMessage> conversation, Set<RiskClass> allowedRiskClasses,
                              ToolContext context, int maxIterations) {
        List<AgentTool> tools = registry.getToolsForRiskClasses(allowedRiskClasses);
        Duration toolTimeout = Duration.ofSeconds(properties.getWorkflow().getToolTimeoutSeconds());
        List<ToolInvocation> invocations = new ArrayList<>();
        TokenUsage usage = TokenUsage.NONE;
        String lastContent = null;

        for (int iteration = 1; iteration <= maxIterations; iteration++) {
            ModelResponse response = callModel(conversation, tools);
            usage = usage.plus(response.usage());
            conversation.add(response.toAssistantMessage());
            lastContent = response.content();

            if (!response.hasToolCalls()) {
                log.debug("Session {} loop converged after {} iterations", context.getSessionId(), iteration);
                return new ToolLoopResult(lastContent, invocations, iteration, true, usage);
            }

            for (AgentMessage.ToolCall call : response.toolCalls()) {
                log.debug("Session {} iteration {}: tool call {}", context.getSessionId(), iteration, call.getName());
                ToolInvocation invocation = dispatch(call, allowedRiskClasses, context, toolTimeout);
                invocations.add(invocation);
                conversation.add(AgentMessage.toolResult(call.getId(), describe(invocation)));
            }
        }

        log.warn("Session {} loop did not converge within {} iterations", context.getSessionId(), maxIterations);
        return new ToolLoopResult(lastContent, invocations, maxIterations, false, usage);
    }

    /**
     * Single model call with transient-failure retries; no tool dispatch.
     */
    public ModelResponse callModel(List<AgentMessage> conversation, List<AgentTool> tools) {
        AgentProperties.RetryConfig retry = properties.getRetry();
        return retryExecutor.withRetry("model call",
                () -> modelService.sendMessage(conversation, tools),
                FailureClassifier::isTransient, retry.getRetryCount(), retry.toBackoff());
    }

    private ToolInvocation dispatch(AgentMessage.ToolCall call, Set<RiskClass> allowed,
                                    ToolContext context, Duration timeout) {
        try {
            return gateway.invoke(call.getName(), call.getArguments(), allowed, context, timeout);
        } catch (AgentException e) {
            if (e.getKind() == ErrorKind.PERMISSION || e.getKind() == ErrorKind.NOT_FOUND
                    || e.getKind() == ErrorKind.VALIDATION) {
                return ToolInvocation.rejected(call.getName(), call.getArguments(), e.getMessage());
            }
            throw e;
        }
    }

    private static String describe(ToolInvocation invocation) {
        return switch (invocation.getOutcome()) {
            case SUCCEEDED -> invocation.getOutput() != null ? invocation.getOutput() : "";
            case TIMED_OUT, FAILED, REJECTED -> "Error: " + invocation.getError();
        };
    }
}
