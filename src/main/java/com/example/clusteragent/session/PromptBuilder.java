package com.example.clusteragent.session;

import com.example.clusteragent.agent.AgentMessage;
import com.example.clusteragent.agent.AgentTool;
import com.example.clusteragent.agent.ToolInvocation;
import com.example.clusteragent.capability.CapabilityRecord;
import com.example.clusteragent.capability.ScoredCapability;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Builds the model conversations of both workflows. Every prompt that expects a
 * structured answer spells out the JSON shape the workflow parses.
 */
@Component
public class PromptBuilder {

    // --- recommendation -------------------------------------------------------

    public List<AgentMessage> clarification(String intent, List<ScoredCapability> matches) {
        String system = identity("You help users deploy workloads on Kubernetes.")
                + capabilitiesSection(matches)
                + """
                # Task
                Decide what information is missing from the user's intent to choose between the
                capabilities above. Answer only with JSON:
                {"questions": ["<question>", ...]}
                Return an empty list when the intent is specific enough.

                """;
        return conversation(system, "Intent: " + intent);
    }

    public List<AgentMessage> solutions(String intent, List<String> clarifications, List<ScoredCapability> matches) {
        String system = identity("You design Kubernetes solutions from the resource types available in a cluster.")
                + capabilitiesSection(matches)
                + """
                # Task
                Propose solutions that satisfy the intent using only the resource names listed above.
                Prefer operator-managed custom resources over hand-assembled built-in primitives when
                both satisfy the intent. Score each solution from 0 to 100.
                For each solution list the configuration questions needed to generate its manifests.
                Answer only with JSON:
                {"solutions": [{"type": "single|combination", "resources": ["<resource name>"],
                  "score": 0-100, "description": "...", "reasons": ["..."],
                  "questions": [{"id": "...", "question": "...", "type": "text|select|multiselect|boolean|number",
                                 "options": ["..."], "required": true, "suggestedAnswer": "..."}]}]}

                """;
        StringBuilder user = new StringBuilder("Intent: ").append(intent).append('\n');
        for (String clarification : clarifications) {
            user.append("Additional detail: ").append(clarification).append('\n');
        }
        return conversation(system, user.toString());
    }

    public List<AgentMessage> manifest(String intent, Solution solution, List<CapabilityRecord> resources,
                                       Map<String, Object> answers, String previousManifest, String validationErrors) {
        StringBuilder system = new StringBuilder(identity(
                "You write Kubernetes manifests that pass server-side validation on the first try."));
        system.append("# Solution\n").append(solution.getDescription()).append("\n\n");
        system.append("# Resource Types\n");
        for (CapabilityRecord record : resources) {
            system.append(String.format("- %s (%s, kind %s): %s%n", record.getResourceName(),
                    record.getApiVersion(), record.getKind(), nullToEmpty(record.getDescription())));
        }
        system.append("""

                # Rules
                - Output a single multi-document YAML stream and nothing else
                - Every document needs apiVersion, kind and metadata.name
                - Set metadata.namespace and metadata.labels on namespaced resources
                - Use only fields that exist in the resource schemas

                """);

        StringBuilder user = new StringBuilder("Intent: ").append(intent).append("\n\nAnswers:\n");
        answers.forEach((id, value) -> user.append("- ").append(id).append(": ").append(value).append('\n'));
        if (previousManifest != null) {
            user.append("\nThe previous manifest failed validation:\n```yaml\n").append(previousManifest)
                    .append("\n```\nErrors:\n").append(validationErrors)
                    .append("\nReturn a corrected manifest.\n");
        }
        return conversation(system.toString(), user.toString());
    }

    // --- remediation ----------------------------------------------------------

    public List<AgentMessage> investigation(String issue, List<AgentTool> tools) {
        String system = identity("You are a Kubernetes site reliability engineer diagnosing a live cluster.")
                + toolsSection(tools)
                + """
                # Investigation
                - Gather evidence with the tools before drawing conclusions
                - You can only read cluster state in this phase; propose changes, do not attempt them
                - Stop calling tools once the root cause is clear

                # Final Answer
                When done, answer only with JSON:
                {"rootCause": "...", "confidence": 0.0-1.0, "factors": ["..."], "summary": "...",
                 "actions": [{"description": "...", "tool": "<tool name>", "arguments": {...},
                              "risk": "low|medium|high", "rationale": "..."}],
                 "risk": "low|medium|high", "validationIntent": "<what to check after the fix>"}
                Actions must use the mutating kubectl tools (kubectl_apply, kubectl_patch, kubectl_delete,
                kubectl_rollout_restart, kubectl_scale) with arguments matching their parameters.

                """;
        return conversation(system, "Issue: " + issue);
    }

    public List<AgentMessage> analysisReminder(List<AgentMessage> conversation, String parseError) {
        List<AgentMessage> retry = new ArrayList<>(conversation);
        retry.add(AgentMessage.user("Your last answer could not be used (" + parseError
                + "). Answer again with only the JSON object described above."));
        return retry;
    }

    public List<AgentMessage> validation(String issue, RemediationAnalysis analysis,
                                         List<ToolInvocation> executed, List<AgentTool> tools) {
        StringBuilder system = new StringBuilder(identity(
                "You verify that a remediation fixed a Kubernetes issue."));
        system.append(toolsSection(tools));
        system.append("# Original Issue\n").append(issue).append("\n\n");
        system.append("# Root Cause\n").append(analysis.getRootCause()).append("\n\n");
        system.append("# Executed Actions\n");
        for (ToolInvocation invocation : executed) {
            system.append(String.format("- %s %s: %s%n", invocation.getToolName(), invocation.getArguments(),
                    invocation.getOutcome()));
        }
        system.append("""

                # Task
                Check the cluster with the read-only tools. When done, answer only with JSON:
                {"resolved": true|false, "summary": "..."}

                """);
        String check = analysis.getValidationIntent() != null ? analysis.getValidationIntent() : issue;
        return conversation(system.toString(), "Verify: " + check);
    }

    // --- sections -------------------------------------------------------------

    private static String identity(String role) {
        return "# Identity\n" + role + "\nCurrent time: " + Instant.now() + "\n\n";
    }

    private static String capabilitiesSection(List<ScoredCapability> matches) {
        if (matches.isEmpty()) {
            return "# Available Capabilities\nNone matched.\n\n";
        }
        StringBuilder section = new StringBuilder("# Available Capabilities\n");
        for (ScoredCapability match : matches) {
            CapabilityRecord record = match.record();
            section.append(String.format("- %s (kind %s, complexity %s, score %.2f): %s; capabilities: %s; providers: %s%n",
                    record.getResourceName(), record.getKind(), record.getComplexity().toValue(), match.score(),
                    nullToEmpty(record.getDescription()), record.getCapabilities(), record.getProviders()));
        }
        return section.append('\n').toString();
    }

    private static String toolsSection(List<AgentTool> tools) {
        if (tools.isEmpty()) {
            return "# Available Tools\nNo tools currently available.\n\n";
        }
        StringBuilder section = new StringBuilder("# Available Tools\n");
        for (AgentTool tool : tools) {
            section.append(String.format("- **%s** (%s): %s%n", tool.getName(), tool.getCategory(),
                    tool.getDescription()));
        }
        return section.append('\n').toString();
    }

    private static List<AgentMessage> conversation(String system, String user) {
        List<AgentMessage> messages = new ArrayList<>();
        messages.add(AgentMessage.system(system));
        messages.add(AgentMessage.user(user));
        return messages;
    }

    private static String nullToEmpty(String value) {
        return value != null ? value : "";
    }
}
