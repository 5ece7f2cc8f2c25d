package com.example.clusteragent.session;

import com.example.clusteragent.agent.TokenUsage;
import com.example.clusteragent.agent.ToolInvocation;
import com.example.clusteragent.capability.ScoredCapability;
import com.example.clusteragent.deploy.DeploymentResult;
import com.example.clusteragent.validation.ManifestValidationResult;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Everything a session has accumulated across its round-trips. Fields are filled in
 * as the workflow progresses and are never cleared by later phases.
 */
@Data
@NoArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class SessionContext {

    private ExecutionOptions options = ExecutionOptions.manual();

    // recommendation
    private String intent;
    private List<String> clarifications = new ArrayList<>();
    private List<String> clarificationQuestions = new ArrayList<>();
    private List<ScoredCapability> capabilityMatches = new ArrayList<>();
    private List<Solution> solutions = new ArrayList<>();
    private String selectedSolutionId;
    private Map<String, Object> answers = new LinkedHashMap<>();
    private String manifest;
    private String manifestPath;
    private int manifestAttempts;
    private ManifestValidationResult validation;
    private List<DeploymentResult> deployments = new ArrayList<>();

    // remediation
    private String issue;
    private List<ToolInvocation> investigation = new ArrayList<>();
    private RemediationAnalysis analysis;
    private AutomationDecision automation;
    private List<ToolInvocation> executionResults = new ArrayList<>();
    /** Number of analysis actions that have completed successfully */
    private int executedActions;
    private List<ToolInvocation> validationInvocations = new ArrayList<>();
    private String validationSummary;

    private TokenUsage usage = TokenUsage.NONE;

    public void addUsage(TokenUsage more) {
        usage = usage.plus(more);
    }
}
