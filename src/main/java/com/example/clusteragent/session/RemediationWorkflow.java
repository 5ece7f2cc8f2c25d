package com.example.clusteragent.session;

import com.example.clusteragent.agent.AgentMessage;
import com.example.clusteragent.agent.AgentTool;
import com.example.clusteragent.agent.InvocationOutcome;
import com.example.clusteragent.agent.ModelJson;
import com.example.clusteragent.agent.ModelResponse;
import com.example.clusteragent.agent.RiskClass;
import com.example.clusteragent.agent.ToolGateway;
import com.example.clusteragent.agent.ToolInvocation;
import com.example.clusteragent.agent.ToolLoop;
import com.example.clusteragent.agent.ToolLoopResult;
import com.example.clusteragent.agent.ToolPolicyEngine;
import com.example.clusteragent.agent.ToolRegistry;
import com.example.clusteragent.config.AgentProperties;
import com.example.clusteragent.error.AgentException;
import com.example.clusteragent.error.ErrorKind;
import com.example.clusteragent.error.InvalidRequestException;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.Data;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;

/**
 * Investigating → Analyzed → AwaitingApproval → Remediating → Executed → Validated.
 * <p>
 * Investigation and validation only ever see read-only tools. The analysis actions run
 * after an approval transition; a timed-out action leaves the session in Remediating
 * until the caller asks for a retry.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class RemediationWorkflow implements Workflow {

    private final ToolLoop toolLoop;
    private final ToolGateway gateway;
    private final ToolRegistry registry;
    private final ToolPolicyEngine policyEngine;
    private final AutomationPolicy automationPolicy;
    private final PromptBuilder prompts;
    private final AgentProperties properties;
    private final ObjectMapper objectMapper;

    @Override
    public WorkflowKind kind() {
        return WorkflowKind.REMEDIATION;
    }

    @Override
    public void start(Session session) {
        SessionContext context = session.getContext();
        RemediationAnalysis analysis = investigate(session);
        context.setAnalysis(analysis);
        session.transitionTo(Phase.ANALYZED, "system", analysis.getActions().size() + " actions proposed");
        session.transitionTo(Phase.AWAITING_APPROVAL, "system", null);

        AutomationDecision decision = automationPolicy.decide(context.getOptions(), analysis.getConfidence(),
                analysis.getRisk());
        context.setAutomation(decision);
        if (decision.automatic()) {
            log.info("Session {}: {}", session.getId(), decision.reason());
            remediate(session, "automatic", decision.reason());
        } else {
            log.info("Session {} awaiting approval: {}", session.getId(), decision.reason());
        }
    }

    @Override
    public void advance(Session session, AdvanceRequest request) {
        AdvanceAction action = request.effectiveAction();
        switch (session.getPhase()) {
            case AWAITING_APPROVAL -> {
                if (action != AdvanceAction.APPROVE) {
                    throw new InvalidRequestException("Session " + session.getId()
                            + " awaits approval; approve or reject it");
                }
                remediate(session, request.effectiveActor(), request.getComment());
            }
            case REMEDIATING -> {
                if (action != AdvanceAction.RETRY) {
                    throw new InvalidRequestException("Session " + session.getId()
                            + " has unfinished actions; retry or reject them");
                }
                executeActions(session);
            }
            case EXECUTED -> {
                if (action != AdvanceAction.RETRY && action != AdvanceAction.CONTINUE) {
                    throw new InvalidRequestException("Action " + action + " is not valid in phase EXECUTED");
                }
                validateFix(session);
            }
            default -> throw new InvalidRequestException("Session " + session.getId() + " is " + session.getPhase()
                    + " and cannot be advanced");
        }
    }

    private RemediationAnalysis investigate(Session session) {
        SessionContext context = session.getContext();
        Set<RiskClass> allowed = policyEngine.allowedRiskClasses(session);
        List<AgentTool> tools = registry.getToolsForRiskClasses(allowed);
        List<AgentMessage> conversation = prompts.investigation(context.getIssue(), tools);

        int maxIterations = properties.getWorkflow().getMaxToolIterations();
        ToolLoopResult result = toolLoop.run(conversation, allowed, session.toolContext(), maxIterations);
        context.getInvestigation().addAll(result.invocations());
        context.addUsage(result.usage());
        if (!result.converged()) {
            throw AgentException.validation("Investigation did not reach a conclusion within "
                    + maxIterations + " iterations");
        }

        try {
            return parseAnalysis(result.finalContent());
        } catch (AgentException e) {
            if (e.getKind() != ErrorKind.VALIDATION) {
                throw e;
            }
            log.warn("Session {}: unusable analysis ({}), asking again", session.getId(), e.getMessage());
            ModelResponse retry = toolLoop.callModel(prompts.analysisReminder(conversation, e.getMessage()), List.of());
            context.addUsage(retry.usage());
            return parseAnalysis(retry.content());
        }
    }

    private RemediationAnalysis parseAnalysis(String content) {
        RemediationAnalysis analysis = ModelJson.parse(objectMapper, content, RemediationAnalysis.class);
        analysis.validate();
        return analysis;
    }

    private void remediate(Session session, String actor, String note) {
        session.approveAndTransitionTo(Phase.REMEDIATING, actor, note);
        executeActions(session);
    }

    /**
     * Runs the actions that have not completed yet, in order. Never retries on its own.
     */
    private void executeActions(Session session) {
        SessionContext context = session.getContext();
        List<RemediationAction> actions = context.getAnalysis().getActions();
        Set<RiskClass> allowed = policyEngine.allowedRiskClasses(session);
        Duration timeout = Duration.ofSeconds(properties.getWorkflow().getToolTimeoutSeconds());

        while (context.getExecutedActions() < actions.size()) {
            RemediationAction action = actions.get(context.getExecutedActions());
            ToolInvocation invocation = gateway.invoke(action.getTool(), action.getArguments(), allowed,
                    session.toolContext(), timeout);
            context.getExecutionResults().add(invocation);

            if (invocation.getOutcome() == InvocationOutcome.TIMED_OUT) {
                log.warn("Session {}: action '{}' timed out; waiting for the caller to retry", session.getId(),
                        action.getDescription());
                return;
            }
            if (!invocation.isSuccess()) {
                throw new AgentException(ErrorKind.INTERNAL, "Remediation action '" + action.getDescription()
                        + "' failed: " + invocation.getError());
            }
            context.setExecutedActions(context.getExecutedActions() + 1);
        }
        session.transitionTo(Phase.EXECUTED, "system", actions.size() + " actions executed");
        validateFix(session);
    }

    private void validateFix(Session session) {
        SessionContext context = session.getContext();
        Set<RiskClass> readOnly = EnumSet.of(RiskClass.READ_ONLY);
        List<AgentTool> tools = registry.getToolsForRiskClasses(readOnly);
        List<AgentMessage> conversation = prompts.validation(context.getIssue(), context.getAnalysis(),
                context.getExecutionResults(), tools);

        int maxIterations = properties.getWorkflow().getMaxToolIterations();
        ToolLoopResult result = toolLoop.run(conversation, readOnly, session.toolContext(), maxIterations);
        context.getValidationInvocations().addAll(result.invocations());
        context.addUsage(result.usage());
        if (!result.converged()) {
            throw AgentException.validation("Validation did not reach a conclusion within "
                    + maxIterations + " iterations");
        }

        ValidationVerdict verdict = ModelJson.parse(objectMapper, result.finalContent(), ValidationVerdict.class);
        context.setValidationSummary(verdict.getSummary());
        if (!verdict.isResolved()) {
            throw AgentException.validation("Issue persists after remediation: " + verdict.getSummary());
        }
        session.transitionTo(Phase.VALIDATED, "system", verdict.getSummary());
    }

    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class ValidationVerdict {
        private boolean resolved;
        private String summary;
    }
}
