package com.example.clusteragent.agent;

import com.example.clusteragent.error.AgentException;
import com.example.clusteragent.error.ErrorKind;
import com.example.clusteragent.error.ToolNotFoundException;
import com.example.clusteragent.error.ToolPermissionException;
import com.example.clusteragent.service.AuditService;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.core.task.AsyncTaskExecutor;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Single entry point for executing tools. Every invocation goes through the same
 * checks, in order: the tool exists, its risk class is allowed in the caller's phase,
 * a mutating tool has an approval recorded in the session history, and the arguments
 * match the tool's schema. Execution is bounded by the caller's timeout; a timed-out
 * call is cancelled and reported, never retried here.
 */
@Slf4j
@Service
public class ToolGateway {

    private final ToolRegistry registry;
    private final ToolArgumentValidator argumentValidator;
    private final AuditService auditService;
    private final AsyncTaskExecutor toolExecutor;

    public ToolGateway(ToolRegistry registry, ToolArgumentValidator argumentValidator,
                       AuditService auditService, @Qualifier("toolExecutor") AsyncTaskExecutor toolExecutor) {
        this.registry = registry;
        this.argumentValidator = argumentValidator;
        this.auditService = auditService;
        this.toolExecutor = toolExecutor;
    }

    public ToolInvocation invoke(String toolName, Map<String, Object> arguments,
                                 Set<RiskClass> allowedRiskClasses, ToolContext context, Duration timeout) {
        Map<String, Object> args = arguments != null ? arguments : Map.of();

        RegisteredTool registered = registry.getTool(toolName)
                .orElseThrow(() -> new ToolNotFoundException(toolName));
        AgentTool tool = registered.tool();

        if (!allowedRiskClasses.contains(tool.getRiskClass())) {
            deny(toolName, context, "risk class " + tool.getRiskClass() + " is not allowed in phase " + context.getPhase());
        }
        if (tool.isMutating() && !context.hasRecordedApproval()) {
            deny(toolName, context, "mutating tool requires an approval recorded in the session history");
        }

        List<String> problems = argumentValidator.validate(tool.getParameterSchema(), args);
        if (!problems.isEmpty()) {
            throw AgentException.validation("Invalid arguments for tool '" + toolName + "': " + String.join("; ", problems));
        }

        return execute(registered, args, context, timeout);
    }

    private ToolInvocation execute(RegisteredTool registered, Map<String, Object> args,
                                   ToolContext context, Duration timeout) {
        AgentTool tool = registered.tool();
        Instant started = Instant.now();
        ToolInvocation.ToolInvocationBuilder invocation = ToolInvocation.builder()
                .toolName(tool.getName())
                .pluginId(registered.pluginId())
                .arguments(args)
                .timestamp(started);

        log.info("Executing tool {} for session {} (timeout {}s)", tool.getName(), context.getSessionId(),
                timeout.toSeconds());
        Future<ToolResult> future = toolExecutor.submit(() -> tool.execute(args, context));
        try {
            ToolResult result = future.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
            invocation.outcome(result.isSuccess() ? InvocationOutcome.SUCCEEDED : InvocationOutcome.FAILED)
                    .output(result.getOutput())
                    .data(result.getData())
                    .error(result.isSuccess() ? null : result.getError());
        } catch (TimeoutException e) {
            future.cancel(true);
            log.warn("Tool {} timed out after {} ms", tool.getName(), timeout.toMillis());
            invocation.outcome(InvocationOutcome.TIMED_OUT)
                    .error("Tool '" + tool.getName() + "' timed out after " + timeout.toMillis() + " ms");
        } catch (ExecutionException e) {
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            if (cause instanceof AgentException agentError && agentError.getKind() == ErrorKind.TIMEOUT) {
                // the tool's own bound, e.g. the kubectl command timeout, fired first
                log.warn("Tool {} timed out: {}", tool.getName(), cause.getMessage());
                invocation.outcome(InvocationOutcome.TIMED_OUT).error(cause.getMessage());
            } else {
                log.error("Tool {} failed: {}", tool.getName(), cause.getMessage(), cause);
                invocation.outcome(InvocationOutcome.FAILED).error(cause.getMessage());
            }
        } catch (InterruptedException e) {
            future.cancel(true);
            Thread.currentThread().interrupt();
            invocation.outcome(InvocationOutcome.FAILED).error("Interrupted while executing " + tool.getName());
        }

        ToolInvocation record = invocation
                .durationMs(Duration.between(started, Instant.now()).toMillis())
                .build();
        audit(record, context);
        return record;
    }

    private void deny(String toolName, ToolContext context, String reason) {
        log.warn("Denied tool {} for session {}: {}", toolName, context.getSessionId(), reason);
        auditService.log("agent", "TOOL_DENIED", toolName, Map.of("reason", reason),
                context.getSessionId(), false);
        throw new ToolPermissionException(toolName, "Tool '" + toolName + "' denied: " + reason);
    }

    private void audit(ToolInvocation record, ToolContext context) {
        Map<String, Object> details = new LinkedHashMap<>();
        details.put("plugin", record.getPluginId());
        details.put("arguments", record.getArguments());
        details.put("outcome", record.getOutcome());
        details.put("durationMs", record.getDurationMs());
        if (record.getError() != null) {
            details.put("error", record.getError());
        }
        auditService.log("agent", "TOOL_EXECUTED", record.getToolName(), details,
                context.getSessionId(), record.isSuccess());
    }
}
